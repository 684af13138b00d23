package com.securityops.coordination.dto;

import java.time.Instant;

/**
 * An accepted location sample bound to the agent's in-progress shift. Immutable once created.
 */
public record LocationSample(
    String agentId,
    String siteId,
    String shiftId,
    double latitude,
    double longitude,
    Double accuracy,
    Integer batteryLevel,
    Double speed,
    Double heading,
    Instant capturedAt,
    Instant receivedAt,
    SampleStatus status
) {

    public static LocationSample accepted(
        String agentId,
        String siteId,
        String shiftId,
        LocationSampleRecord record,
        Instant receivedAt,
        SampleStatus status
    ) {
        return new LocationSample(
            agentId,
            siteId,
            shiftId,
            record.latitude(),
            record.longitude(),
            record.accuracy(),
            record.batteryLevel(),
            record.speed(),
            record.heading(),
            record.timestamp(),
            receivedAt,
            status
        );
    }

    public String toLogString() {
        return String.format(
            "Sample[agent=%s, site=%s, lat=%.6f, lon=%.6f, time=%s, status=%s]",
            agentId, siteId, latitude, longitude, capturedAt, status
        );
    }
}
