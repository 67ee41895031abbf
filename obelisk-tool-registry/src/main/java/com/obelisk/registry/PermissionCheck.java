package com.obelisk.registry;

/**
 * Outcome of a permission check.
 *
 * @param allowed whether the call may proceed
 * @param reason  denial reason, or "allowed"
 */
public record PermissionCheck(boolean allowed, String reason) {

    private static final PermissionCheck ALLOWED = new PermissionCheck(true, "allowed");

    public static PermissionCheck allow() {
        return ALLOWED;
    }

    public static PermissionCheck deny(String reason) {
        return new PermissionCheck(false, reason);
    }
}
