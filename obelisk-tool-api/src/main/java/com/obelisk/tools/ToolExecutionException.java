package com.obelisk.tools;

import java.util.Map;

/**
 * Tool body failed. Retryable unless constructed as terminal (e.g. the failure is
 * deterministic for the given input).
 */
public final class ToolExecutionException extends ToolException {

    private final boolean terminal;

    public ToolExecutionException(String message, String toolName) {
        this(message, toolName, false, null, null);
    }

    public ToolExecutionException(String message, String toolName, Throwable cause) {
        this(message, toolName, false, null, cause);
    }

    public ToolExecutionException(String message, String toolName, boolean terminal,
                                  Map<String, Object> details, Throwable cause) {
        super(message, toolName, details, cause);
        this.terminal = terminal;
    }

    @Override
    public boolean isTerminal() {
        return terminal;
    }

    @Override
    public ToolErrorKind getKind() {
        return ToolErrorKind.EXECUTION;
    }
}
