package com.securityops.coordination.dto;

/**
 * Alert lifecycle. Escalation only happens while OPEN; ACKNOWLEDGED stops escalation
 * but still accepts a resolution; RESOLVED is final.
 */
public enum AlertStatus {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED;

    public boolean isEscalating() {
        return this == OPEN;
    }
}
