package com.obelisk.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of the typed tool failures. Thrown inside tools and gates, and converted to a
 * {@link ToolError} at every call boundary.
 */
public abstract class ToolException extends RuntimeException {

    private final String toolName;
    private final Map<String, Object> details;

    protected ToolException(String message, String toolName, Map<String, Object> details) {
        this(message, toolName, details, null);
    }

    protected ToolException(String message, String toolName, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
        Map<String, Object> copy = new LinkedHashMap<>();
        if (details != null) copy.putAll(details);
        if (toolName != null) copy.putIfAbsent("tool_name", toolName);
        this.details = Collections.unmodifiableMap(copy);
    }

    public abstract ToolErrorKind getKind();

    /** Stable type tag written to {@link ToolError#getType()}. */
    public String getErrorType() {
        return ToolError.defaultType(getKind());
    }

    public boolean isTerminal() {
        return false;
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
