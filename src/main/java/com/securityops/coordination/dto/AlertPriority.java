package com.securityops.coordination.dto;

public enum AlertPriority {
    LOW,
    NORMAL,
    HIGH
}
