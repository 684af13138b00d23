package com.securityops.coordination.dto;

/**
 * Drives the retention window of queued messages: location events lose their value fast,
 * alert events are kept longer for audit purposes.
 */
public enum EventCategory {
    LOCATION,
    ALERT
}
