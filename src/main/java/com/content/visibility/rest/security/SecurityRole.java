package com.content.visibility.rest.security;

import java.util.Locale;

/**
 * Security roles for API access control.
 * Roles are hierarchical: ADMIN > USER.
 */
public enum SecurityRole {

    /** A library user: manages their own hidden entities. */
    USER,

    /** Full access: restriction rules, recomputes and statistics for every user. */
    ADMIN;

    /**
     * Returns true if this role has sufficient privilege for the required role.
     */
    public boolean hasPermission(SecurityRole required) {
        return this.ordinal() >= required.ordinal();
    }

    /**
     * Parses a role from string, case-insensitive.
     *
     * @throws IllegalArgumentException if the value doesn't match any role
     */
    public static SecurityRole fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Security role must not be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
