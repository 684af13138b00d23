package com.securityops.coordination.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * Event pushed to connected supervisors, agents and clients on {@code /user/queue/events}.
 */
public record OutboundEvent(
    String eventId,
    String type,
    EventCategory category,
    Object payload,
    Instant publishedAt
) {

    public static final String LOCATION_UPDATE = "LOCATION_UPDATE";
    public static final String GEOFENCE_VIOLATION = "GEOFENCE_VIOLATION";
    public static final String ALERT_CREATED = "ALERT_CREATED";
    public static final String ALERT_ESCALATED = "ALERT_ESCALATED";
    public static final String ALERT_ACKNOWLEDGED = "ALERT_ACKNOWLEDGED";
    public static final String ALERT_RESOLVED = "ALERT_RESOLVED";

    public static OutboundEvent location(String type, Object payload, Instant publishedAt) {
        return new OutboundEvent(UUID.randomUUID().toString(), type, EventCategory.LOCATION, payload, publishedAt);
    }

    public static OutboundEvent alert(String type, Object payload, Instant publishedAt) {
        return new OutboundEvent(UUID.randomUUID().toString(), type, EventCategory.ALERT, payload, publishedAt);
    }
}
