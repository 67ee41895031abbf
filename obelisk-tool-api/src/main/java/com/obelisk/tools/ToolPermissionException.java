package com.obelisk.tools;

import java.util.Map;

/** Call denied by role, model or rate-limit policy. */
public final class ToolPermissionException extends ToolException {

    private final String reason;

    public ToolPermissionException(String toolName, String reason) {
        super(String.format("Permission denied for tool '%s': %s", toolName, reason), toolName,
                Map.of("reason", reason));
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public ToolErrorKind getKind() {
        return ToolErrorKind.PERMISSION;
    }
}
