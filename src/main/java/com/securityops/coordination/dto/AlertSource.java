package com.securityops.coordination.dto;

public enum AlertSource {
    AGENT_TRIGGER,
    MANUAL_REPORT,
    GEOFENCE_VIOLATION
}
