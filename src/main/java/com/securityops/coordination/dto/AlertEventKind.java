package com.securityops.coordination.dto;

public enum AlertEventKind {
    CREATED,
    ESCALATED,
    ACKNOWLEDGED,
    RESOLVED
}
