package com.qasandbox.domain.access;

import java.util.Locale;

public enum Role {
    ADMIN,
    TESTER,
    VIEWER;

    /** Lower-case wire value, as stored in the users table and the JWT "role" claim. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored or transmitted role.
     *
     * @throws IllegalArgumentException for anything that is not a known role
     */
    public static Role fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role is blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Role r : values()) {
            if (r.name().equals(normalized)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
