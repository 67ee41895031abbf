package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one tool call: payload on success, structured {@link ToolError} otherwise.
 * <p>
 * Invariant enforced at construction: status is COMPLETED exactly when there is no error,
 * and a populated error implies FAILED, TIMEOUT or CANCELLED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolCallResult {

    private final String callId;
    private final String toolName;
    private final ToolCallStatus status;
    private final Map<String, Object> result;
    private final ToolError error;
    private final double executionTimeMs;
    private final long timestamp;
    private final Map<String, Object> metadata;

    @JsonCreator
    public ToolCallResult(
            @JsonProperty("callId") String callId,
            @JsonProperty("toolName") String toolName,
            @JsonProperty("status") ToolCallStatus status,
            @JsonProperty("result") Map<String, Object> result,
            @JsonProperty("error") ToolError error,
            @JsonProperty("executionTimeMs") double executionTimeMs,
            @JsonProperty("timestamp") Long timestamp,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.callId = Objects.requireNonNull(callId, "callId");
        this.toolName = Objects.requireNonNull(toolName, "toolName");
        this.status = Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Result status must be terminal: " + status);
        }
        if ((status == ToolCallStatus.COMPLETED) != (error == null)) {
            throw new IllegalArgumentException(
                    String.format("Inconsistent result for call %s: status=%s, error=%s", callId, status, error));
        }
        this.result = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : null;
        this.error = error;
        this.executionTimeMs = Math.max(0.0, executionTimeMs);
        this.timestamp = timestamp != null ? timestamp : System.currentTimeMillis();
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public static ToolCallResult completed(String callId, String toolName, Map<String, Object> result,
                                           double executionTimeMs, Map<String, Object> metadata) {
        return new ToolCallResult(callId, toolName, ToolCallStatus.COMPLETED,
                result != null ? result : Map.of(), null, executionTimeMs, null, metadata);
    }

    /** Failed result; status is TIMEOUT for timeout errors, CANCELLED for cancellations, FAILED otherwise. */
    public static ToolCallResult failed(String callId, String toolName, ToolError error,
                                        double executionTimeMs, Map<String, Object> metadata) {
        Objects.requireNonNull(error, "error");
        ToolCallStatus status = switch (error.getKind()) {
            case TIMEOUT -> ToolCallStatus.TIMEOUT;
            case CANCELLED -> ToolCallStatus.CANCELLED;
            default -> ToolCallStatus.FAILED;
        };
        return new ToolCallResult(callId, toolName, status, null, error, executionTimeMs, null, metadata);
    }

    public static ToolCallResult failed(ToolCall call, ToolError error) {
        return failed(call.getId(), call.getToolName(), error, 0.0, null);
    }

    /** Synthetic result for a call skipped by cooperative cancellation. */
    public static ToolCallResult cancelled(String callId, String toolName, String reason) {
        return failed(callId, toolName, ToolError.of(ToolErrorKind.CANCELLED, reason), 0.0, null);
    }

    /** Copy with extra metadata entries merged over the existing ones. */
    public ToolCallResult withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new ToolCallResult(callId, toolName, status, result, error, executionTimeMs, timestamp, merged);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ToolCallStatus.COMPLETED;
    }

    @JsonIgnore
    public boolean isCancelled() {
        return status == ToolCallStatus.CANCELLED;
    }

    public String getCallId() {
        return callId;
    }

    public String getToolName() {
        return toolName;
    }

    public ToolCallStatus getStatus() {
        return status;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public ToolError getError() {
        return error;
    }

    public double getExecutionTimeMs() {
        return executionTimeMs;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ToolCallResult{" + callId + ", " + toolName + ", " + status
                + (error != null ? ", error=" + error : "") + "}";
    }
}
