package com.securityops.coordination.entity;

import com.securityops.coordination.dto.GeofenceViolationRecord;
import com.securityops.coordination.dto.ViolationSeverity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Persisted geofence violation.
 *
 * Design Decision:
 * - Record (GeofenceViolationRecord): in-memory processing and broadcast, immutable
 * - Entity: audit trail, JPA-managed
 *
 * Geofence name and site are denormalized so incident reports need no joins.
 */
@Entity
@Table(
    name = "geofence_violations",
    indexes = {
        @Index(name = "idx_violation_agent", columnList = "agent_id"),
        @Index(name = "idx_violation_site", columnList = "site_id"),
        @Index(name = "idx_violation_timestamp", columnList = "timestamp"),
        @Index(name = "idx_violation_agent_time", columnList = "agent_id, timestamp")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceViolationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Format: {agentId}_{epochMillis}; unique, so a retried write is rejected instead of duplicated
     */
    @Column(name = "violation_id", nullable = false, unique = true)
    private String violationId;

    @Column(name = "agent_id", nullable = false, length = 100)
    private String agentId;

    @Column(name = "site_id", nullable = false, length = 100)
    private String siteId;

    @Column(name = "geofence_id", nullable = false)
    private Long geofenceId;

    @Column(name = "geofence_name", nullable = false)
    private String geofenceName;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "distance_outside_meters", nullable = false)
    private Double distanceOutsideMeters;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ViolationSeverity severity;

    /**
     * Capture time of the sample that triggered the violation
     */
    @Column(nullable = false)
    private Instant timestamp;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static GeofenceViolationEntity from(GeofenceViolationRecord violation) {
        return GeofenceViolationEntity.builder()
            .violationId(violation.violationId())
            .agentId(violation.agentId())
            .siteId(violation.siteId())
            .geofenceId(violation.geofenceId())
            .geofenceName(violation.geofenceName())
            .latitude(violation.latitude())
            .longitude(violation.longitude())
            .distanceOutsideMeters(violation.distanceOutsideMeters())
            .severity(violation.severity())
            .timestamp(violation.timestamp())
            .build();
    }
}
