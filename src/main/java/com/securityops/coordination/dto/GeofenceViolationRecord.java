package com.securityops.coordination.dto;

import java.time.Instant;

/**
 * Immutable record of an agent found outside the geofence of its shift.
 *
 * Broadcast to the site's supervisors, persisted for audit, and turned into an emergency alert
 * when it crosses the configured severity/distance thresholds.
 *
 * @param violationId           Unique identifier, {agentId}_{epochMillis}
 * @param agentId               The agent outside the boundary
 * @param siteId                Site of the agent's active shift
 * @param geofenceId            Geofence that was tested
 * @param geofenceName          Human-readable geofence name
 * @param latitude              Sample latitude
 * @param longitude             Sample longitude
 * @param distanceOutsideMeters Distance between the sample and the boundary
 * @param severity              Severity graded against the geofence's reference radius
 * @param timestamp             Capture time of the sample that triggered the violation
 */
public record GeofenceViolationRecord(
    String violationId,
    String agentId,
    String siteId,
    Long geofenceId,
    String geofenceName,
    double latitude,
    double longitude,
    double distanceOutsideMeters,
    ViolationSeverity severity,
    Instant timestamp
) {

    public static GeofenceViolationRecord fromSample(
        LocationSample sample,
        CachedGeofenceRecord geofence,
        GeofenceEvaluation evaluation
    ) {
        return new GeofenceViolationRecord(
            generateViolationId(sample.agentId(), sample.capturedAt()),
            sample.agentId(),
            sample.siteId(),
            geofence.geofenceId(),
            geofence.name(),
            sample.latitude(),
            sample.longitude(),
            evaluation.distanceOutsideMeters(),
            evaluation.severity(),
            sample.capturedAt()
        );
    }

    private static String generateViolationId(String agentId, Instant timestamp) {
        return String.format("%s_%d", agentId, timestamp.toEpochMilli());
    }

    public String toLogString() {
        return String.format(
            "Violation[id=%s, agent=%s, site=%s, outside=%.1fm, severity=%s]",
            violationId, agentId, siteId, distanceOutsideMeters, severity
        );
    }

    public boolean isCritical() {
        return severity == ViolationSeverity.HIGH;
    }
}
