package com.obelisk.session;

/**
 * Outcome of checking whether a session may call a tool.
 *
 * @param valid  whether the call may proceed
 * @param reason human-readable reason; "Tool available" when valid
 */
public record ToolCallValidation(boolean valid, String reason) {

    static final String OK = "Tool available";

    static ToolCallValidation ok() {
        return new ToolCallValidation(true, OK);
    }

    static ToolCallValidation rejected(String reason) {
        return new ToolCallValidation(false, reason);
    }
}
