package com.securityops.coordination.dto;

/**
 * Role resolved once at connection time; immutable for the lifetime of a session.
 */
public enum Role {
    AGENT,
    SUPERVISOR,
    ADMIN,
    CLIENT;

    public boolean isStaff() {
        return this == SUPERVISOR || this == ADMIN;
    }
}
