package com.obelisk.tools;

/** Tool (or the requested version of it) is not registered or is disabled. */
public final class ToolNotFoundException extends ToolException {

    public ToolNotFoundException(String toolName) {
        super(String.format("Tool '%s' not found", toolName), toolName, null);
    }

    public ToolNotFoundException(String toolName, String reason) {
        super(String.format("Tool '%s' not found: %s", toolName, reason), toolName, null);
    }

    @Override
    public ToolErrorKind getKind() {
        return ToolErrorKind.NOT_FOUND;
    }
}
