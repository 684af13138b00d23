package com.securityops.coordination.dto;

public enum AlertType {
    PANIC,
    MEDICAL,
    SECURITY,
    FIRE,
    GENERAL;

    /**
     * Life-safety alerts are always created with HIGH priority.
     */
    public boolean isLifeSafety() {
        return this == PANIC || this == MEDICAL || this == FIRE;
    }
}
