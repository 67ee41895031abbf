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
 * Structured error carried by a failed, timed-out or cancelled {@link ToolCallResult}.
 * {@code type} is a stable tag (e.g. "ToolValidationError", "MaxRetriesExhausted") and
 * {@code details} holds kind-specific data such as per-parameter validation errors.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ToolError {

    private final ToolErrorKind kind;
    private final String type;
    private final String message;
    private final boolean terminal;
    private final Map<String, Object> details;

    @JsonCreator
    public ToolError(
            @JsonProperty("kind") ToolErrorKind kind,
            @JsonProperty("type") String type,
            @JsonProperty("message") String message,
            @JsonProperty("terminal") boolean terminal,
            @JsonProperty("details") Map<String, Object> details) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.type = type != null && !type.isBlank() ? type : defaultType(kind);
        this.message = message != null ? message : "";
        this.terminal = terminal;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    public static ToolError of(ToolErrorKind kind, String message) {
        return new ToolError(kind, null, message, false, null);
    }

    public static ToolError of(ToolErrorKind kind, String type, String message, Map<String, Object> details) {
        return new ToolError(kind, type, message, false, details);
    }

    /** Converts a typed tool exception to its error value. */
    public static ToolError from(ToolException e) {
        return new ToolError(e.getKind(), e.getErrorType(), e.getMessage(), e.isTerminal(), e.getDetails());
    }

    /** Default type tag per kind. */
    public static String defaultType(ToolErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> "ToolNotFoundError";
            case VALIDATION -> "ToolValidationError";
            case CONFIGURATION -> "ToolConfigurationError";
            case PERMISSION -> "ToolPermissionError";
            case TIMEOUT -> "ToolTimeoutError";
            case EXECUTION -> "ToolExecutionError";
            case CANCELLED -> "Cancelled";
        };
    }

    public ToolErrorKind getKind() {
        return kind;
    }

    public String getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    /** True when a retryable kind was explicitly marked as not worth retrying. */
    public boolean isTerminal() {
        return terminal;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /** Whether a retry wrapper may attempt the call again after this error. */
    @JsonIgnore
    public boolean isRetryable() {
        return kind.isRetryable() && !terminal;
    }

    public ToolError withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new ToolError(kind, type, message, terminal, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolError that)) return false;
        return terminal == that.terminal && kind == that.kind && type.equals(that.type)
                && message.equals(that.message) && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, type, message, terminal, details);
    }

    @Override
    public String toString() {
        return type + "(" + kind + "): " + message;
    }
}
