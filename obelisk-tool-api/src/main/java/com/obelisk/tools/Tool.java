package com.obelisk.tools;

import java.util.Map;

/**
 * Executable tool. The registry only ever holds references to this interface.
 * Implementations normally extend {@link AbstractTool}, which supplies {@link #call}.
 */
public interface Tool {

    /** Declarative definition; must return the same value for the tool's lifetime. */
    ToolDefinition definition();

    /**
     * Runs the tool body with already-validated parameters.
     *
     * @param parameters validated parameters with defaults applied
     * @param context    execution context
     * @return success with data, or failure with a message
     * @throws Exception any failure; converted to an EXECUTION error (or the typed kind of a {@link ToolException})
     */
    ToolResult execute(Map<String, Object> parameters, ToolExecutionContext context) throws Exception;

    /**
     * Full call lifecycle: name and context checks, parameter validation, hooks, timed
     * execution. Never throws; every failure is captured in the returned result.
     */
    ToolCallResult call(ToolCall call, ToolExecutionContext context);
}
