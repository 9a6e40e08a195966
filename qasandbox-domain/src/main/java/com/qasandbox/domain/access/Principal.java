package com.qasandbox.domain.access;

import java.util.Objects;

/**
 * Authenticated identity attempting an action. Built once per request and passed explicitly.
 */
public record Principal(long id, Role role) {

    public Principal {
        Objects.requireNonNull(role, "role");
    }

    public static Principal of(long id, Role role) {
        return new Principal(id, role);
    }

    public boolean owns(Long ownerId) {
        return ownerId != null && ownerId == id;
    }
}
