package com.securityops.coordination.dto;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of an emergency alert. This is what gets broadcast, returned from the REST
 * API and archived to the audit store; the engine builds a new snapshot on every transition.
 */
public record EmergencyAlertView(
    String id,
    AlertType type,
    AlertPriority priority,
    AlertSource source,
    String agentId,
    String siteId,
    GeoPoint location,
    String description,
    AlertStatus status,
    int escalationLevel,
    List<Acknowledgment> acknowledgments,
    Resolution resolution,
    Instant createdAt,
    Instant updatedAt,
    long version
) {

    public EmergencyAlertView {
        acknowledgments = acknowledgments == null ? List.of() : List.copyOf(acknowledgments);
    }

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    public String toLogString() {
        return String.format(
            "Alert[id=%s, type=%s, priority=%s, agent=%s, site=%s, status=%s, level=%d]",
            id, type, priority, agentId, siteId, status, escalationLevel
        );
    }
}
