package com.obelisk.tools;

import java.util.Map;

/** Malformed tool definition, name mismatch, or an invalid chain configuration. */
public final class ToolConfigurationException extends ToolException {

    private final String errorType;

    public ToolConfigurationException(String message, String toolName) {
        this(message, toolName, null, null);
    }

    public ToolConfigurationException(String message, String toolName, String errorType, Map<String, Object> details) {
        super(message, toolName, details);
        this.errorType = errorType;
    }

    @Override
    public String getErrorType() {
        return errorType != null ? errorType : super.getErrorType();
    }

    @Override
    public ToolErrorKind getKind() {
        return ToolErrorKind.CONFIGURATION;
    }
}
