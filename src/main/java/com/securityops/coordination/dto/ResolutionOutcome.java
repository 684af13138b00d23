package com.securityops.coordination.dto;

public enum ResolutionOutcome {
    RESOLVED,
    FALSE_ALARM
}
