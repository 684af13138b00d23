package com.securityops.coordination.entity;

import com.securityops.coordination.dto.AlertEventKind;
import com.securityops.coordination.dto.AlertEventRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only transition log of an alert. (alert_id, sequence) is unique.
 */
@Entity
@Table(
    name = "alert_events",
    uniqueConstraints = @UniqueConstraint(name = "uk_alert_event_sequence", columnNames = {"alert_id", "sequence"}),
    indexes = @Index(name = "idx_alert_event_alert", columnList = "alert_id")
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false, length = 64)
    private String alertId;

    @Column(nullable = false)
    private Long sequence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertEventKind kind;

    @Column(name = "from_level")
    private Integer fromLevel;

    @Column(name = "to_level", nullable = false)
    private Integer toLevel;

    @Column(nullable = false, length = 100)
    private String actor;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    public static AlertEventEntity from(AlertEventRecord event) {
        return AlertEventEntity.builder()
            .alertId(event.alertId())
            .sequence(event.sequence())
            .kind(event.kind())
            .fromLevel(event.fromLevel())
            .toLevel(event.toLevel())
            .actor(event.actor())
            .occurredAt(event.occurredAt())
            .build();
    }

    public AlertEventRecord toRecord() {
        return new AlertEventRecord(alertId, sequence, kind, fromLevel, toLevel, actor, occurredAt);
    }
}
