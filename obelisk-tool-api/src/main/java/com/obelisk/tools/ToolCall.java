package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Request to execute one tool with concrete parameters. Never mutated after creation;
 * status transitions are reported through the {@link ToolCallResult} returned for it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolCall {

    private final String id;
    private final String toolName;
    private final Map<String, Object> parameters;
    private final ToolCallStatus status;
    private final Double timeoutSeconds;
    private final long createdAt;

    @JsonCreator
    public ToolCall(
            @JsonProperty("id") String id,
            @JsonProperty("toolName") String toolName,
            @JsonProperty("parameters") Map<String, Object> parameters,
            @JsonProperty("status") ToolCallStatus status,
            @JsonProperty("timeoutSeconds") Double timeoutSeconds,
            @JsonProperty("createdAt") Long createdAt) {
        this.id = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        this.toolName = Objects.requireNonNull(toolName, "toolName");
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
        this.status = status != null ? status : ToolCallStatus.PENDING;
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive when set");
        }
        this.timeoutSeconds = timeoutSeconds;
        this.createdAt = createdAt != null ? createdAt : System.currentTimeMillis();
    }

    /** New pending call with a generated id and no timeout override. */
    public static ToolCall of(String toolName, Map<String, Object> parameters) {
        return new ToolCall(null, toolName, parameters, null, null, null);
    }

    public static ToolCall of(String id, String toolName, Map<String, Object> parameters) {
        return new ToolCall(id, toolName, parameters, null, null, null);
    }

    /** Copy with replaced parameters (same id). */
    public ToolCall withParameters(Map<String, Object> newParameters) {
        return new ToolCall(id, toolName, newParameters, status, timeoutSeconds, createdAt);
    }

    /** Copy with a timeout override (same id). */
    public ToolCall withTimeoutSeconds(Double newTimeoutSeconds) {
        return new ToolCall(id, toolName, parameters, status, newTimeoutSeconds, createdAt);
    }

    public String getId() {
        return id;
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public ToolCallStatus getStatus() {
        return status;
    }

    public Double getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "ToolCall{" + id + ", " + toolName + "}";
    }
}
