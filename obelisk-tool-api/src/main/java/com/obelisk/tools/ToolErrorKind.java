package com.obelisk.tools;

/**
 * Error taxonomy for tool calls. Only {@link #TIMEOUT} and {@link #EXECUTION} are retried;
 * an EXECUTION error may still be marked terminal on the {@link ToolError} itself.
 */
public enum ToolErrorKind {

    /** Tool or session missing. */
    NOT_FOUND(false),

    /** Bad or missing parameters, or an invalid execution context. */
    VALIDATION(false),

    /** Malformed definition or tool name mismatch. */
    CONFIGURATION(false),

    /** Role, model or rate-limit denial. */
    PERMISSION(false),

    /** Execution exceeded its deadline. */
    TIMEOUT(true),

    /** Tool body reported or raised a failure. */
    EXECUTION(true),

    /** Cooperative cancellation; reported separately from failures. */
    CANCELLED(false);

    private final boolean retryable;

    ToolErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
