/**
 * Tool contract: declarative {@link com.obelisk.tools.ToolDefinition}s, the executable
 * {@link com.obelisk.tools.Tool} with its call lifecycle in {@link com.obelisk.tools.AbstractTool},
 * call/result value types, and the error taxonomy carried in {@link com.obelisk.tools.ToolError}.
 */
package com.obelisk.tools;
