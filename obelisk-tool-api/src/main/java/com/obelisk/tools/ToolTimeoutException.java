package com.obelisk.tools;

import java.util.Map;

/** Execution did not finish within its timeout. */
public final class ToolTimeoutException extends ToolException {

    private final double timeoutSeconds;

    public ToolTimeoutException(String toolName, double timeoutSeconds) {
        super(String.format("Tool '%s' timed out after %s seconds", toolName, timeoutSeconds), toolName,
                Map.of("timeout_seconds", timeoutSeconds));
        this.timeoutSeconds = timeoutSeconds;
    }

    public double getTimeoutSeconds() {
        return timeoutSeconds;
    }

    @Override
    public ToolErrorKind getKind() {
        return ToolErrorKind.TIMEOUT;
    }
}
