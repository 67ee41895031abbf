package com.obelisk.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Availability and call statistics of one tool within one session. Immutable; the session
 * replaces the entry on every change.
 *
 * @param toolName               tool name
 * @param state                  availability state
 * @param lastChecked            epoch millis of the last availability check
 * @param cacheExpiry            epoch millis after which the entry must be re-checked, or null for never
 * @param errorMessage           reason the tool is unavailable or in error, if any
 * @param executionCount         calls recorded in this session
 * @param successCount           successful calls recorded in this session
 * @param averageExecutionTimeMs exponential moving average of call latency
 * @param lastExecutionTime      epoch millis of the last recorded call, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolAvailabilityInfo(
        @JsonProperty("toolName") String toolName,
        @JsonProperty("state") ToolAvailabilityState state,
        @JsonProperty("lastChecked") long lastChecked,
        @JsonProperty("cacheExpiry") Long cacheExpiry,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("executionCount") long executionCount,
        @JsonProperty("successCount") long successCount,
        @JsonProperty("averageExecutionTimeMs") double averageExecutionTimeMs,
        @JsonProperty("lastExecutionTime") Long lastExecutionTime) {

    /** Weight of the newest sample in the latency average. */
    public static final double EMA_ALPHA = 0.3;

    @JsonCreator
    public ToolAvailabilityInfo {
        Objects.requireNonNull(toolName, "toolName");
        Objects.requireNonNull(state, "state");
    }

    static ToolAvailabilityInfo loading(String toolName, long now) {
        return new ToolAvailabilityInfo(toolName, ToolAvailabilityState.LOADING, now, null, null, 0, 0, 0.0, null);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return state.isUsable();
    }

    public boolean isExpired(long now) {
        return cacheExpiry != null && now > cacheExpiry;
    }

    /** Success rate as a percentage; 0 when no calls were recorded. */
    @JsonIgnore
    public double getSuccessRate() {
        return executionCount == 0 ? 0.0 : (successCount * 100.0) / executionCount;
    }

    ToolAvailabilityInfo withState(ToolAvailabilityState newState, long now) {
        return new ToolAvailabilityInfo(toolName, newState, now, cacheExpiry, errorMessage,
                executionCount, successCount, averageExecutionTimeMs, lastExecutionTime);
    }

    ToolAvailabilityInfo withAvailability(ToolAvailabilityState newState, String error, long expiry, long now) {
        return new ToolAvailabilityInfo(toolName, newState, now, expiry, error,
                executionCount, successCount, averageExecutionTimeMs, lastExecutionTime);
    }

    ToolAvailabilityInfo withExecution(boolean success, double durationMs, long now) {
        long count = executionCount + 1;
        double average = count == 1
                ? durationMs
                : EMA_ALPHA * durationMs + (1 - EMA_ALPHA) * averageExecutionTimeMs;
        return new ToolAvailabilityInfo(toolName, state, lastChecked, cacheExpiry, errorMessage,
                count, success ? successCount + 1 : successCount, average, now);
    }
}
