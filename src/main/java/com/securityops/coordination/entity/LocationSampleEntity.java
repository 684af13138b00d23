package com.securityops.coordination.entity;

import com.securityops.coordination.dto.LocationSample;
import com.securityops.coordination.dto.SampleStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Archived location sample. Rows are append-only and purged after the history retention window.
 */
@Entity
@Table(
    name = "location_samples",
    indexes = {
        @Index(name = "idx_sample_agent_time", columnList = "agent_id, captured_at"),
        @Index(name = "idx_sample_captured_at", columnList = "captured_at")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationSampleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_id", nullable = false, length = 100)
    private String agentId;

    @Column(name = "site_id", length = 100)
    private String siteId;

    @Column(name = "shift_id", length = 100)
    private String shiftId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private Double accuracy;

    @Column(name = "battery_level")
    private Integer batteryLevel;

    private Double speed;

    private Double heading;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SampleStatus status;

    public static LocationSampleEntity from(LocationSample sample) {
        return LocationSampleEntity.builder()
            .agentId(sample.agentId())
            .siteId(sample.siteId())
            .shiftId(sample.shiftId())
            .latitude(sample.latitude())
            .longitude(sample.longitude())
            .accuracy(sample.accuracy())
            .batteryLevel(sample.batteryLevel())
            .speed(sample.speed())
            .heading(sample.heading())
            .capturedAt(sample.capturedAt())
            .receivedAt(sample.receivedAt())
            .status(sample.status())
            .build();
    }

    public LocationSample toSample() {
        return new LocationSample(agentId, siteId, shiftId, latitude, longitude, accuracy,
            batteryLevel, speed, heading, capturedAt, receivedAt, status);
    }
}
