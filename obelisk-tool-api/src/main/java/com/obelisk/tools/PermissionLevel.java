package com.obelisk.tools;

/**
 * Coarse access level of a tool. PUBLIC tools need no role; AUTHENTICATED tools need any
 * non-blank role; ADMIN tools need the {@value #ADMIN_ROLE} role.
 */
public enum PermissionLevel {

    PUBLIC,
    AUTHENTICATED,
    ADMIN;

    public static final String ADMIN_ROLE = "admin";

    public boolean permits(String role) {
        return switch (this) {
            case PUBLIC -> true;
            case AUTHENTICATED -> role != null && !role.isBlank();
            case ADMIN -> ADMIN_ROLE.equalsIgnoreCase(role);
        };
    }
}
