package com.securityops.coordination.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * Raw position report pushed by an agent device, before it is accepted by the ingest pipeline.
 *
 * The agent id is not part of the payload: over STOMP it comes from the authenticated session,
 * over REST from the request path.
 *
 * @param latitude     GPS latitude in decimal degrees (WGS84)
 * @param longitude    GPS longitude in decimal degrees (WGS84)
 * @param accuracy     Optional GPS accuracy in meters
 * @param batteryLevel Optional battery percentage of the device
 * @param speed        Optional speed in km/h
 * @param heading      Optional direction in degrees (0-360, where 0 is North)
 * @param timestamp    When the reading was captured on the device
 */
public record LocationSampleRecord(
    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @PositiveOrZero(message = "Accuracy must be >= 0")
    Double accuracy,

    @Min(value = 0, message = "Battery level must be >= 0")
    @Max(value = 100, message = "Battery level must be <= 100")
    Integer batteryLevel,

    @PositiveOrZero(message = "Speed must be >= 0")
    Double speed,

    @Min(value = 0, message = "Heading must be >= 0")
    @Max(value = 360, message = "Heading must be <= 360")
    Double heading,

    @NotNull(message = "Timestamp is required")
    @JsonFormat(shape = JsonFormat.Shape.NUMBER)
    Instant timestamp
) {

    public LocationSampleRecord {
        if (heading != null && heading > 360) {
            heading = heading % 360;
        }
    }

    public static LocationSampleRecord of(double lat, double lon, double accuracy, Instant timestamp) {
        return new LocationSampleRecord(lat, lon, accuracy, null, null, null, timestamp);
    }

    /**
     * A missing accuracy is treated as acceptable; devices that cannot report it are not penalised.
     */
    public boolean hasAcceptableAccuracy(double maxAccuracyMeters) {
        return accuracy == null || accuracy <= maxAccuracyMeters;
    }

    public String toLogString() {
        return String.format(
            "Sample[lat=%.6f, lon=%.6f, acc=%s, time=%s]",
            latitude, longitude, accuracy, timestamp
        );
    }
}
