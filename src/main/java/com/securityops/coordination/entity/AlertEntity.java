package com.securityops.coordination.entity;

import com.securityops.coordination.dto.Acknowledgment;
import com.securityops.coordination.dto.AlertPriority;
import com.securityops.coordination.dto.AlertSource;
import com.securityops.coordination.dto.AlertStatus;
import com.securityops.coordination.dto.AlertType;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.GeoPoint;
import com.securityops.coordination.dto.Resolution;
import com.securityops.coordination.dto.ResolutionOutcome;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Latest persisted snapshot of an emergency alert.
 *
 * The row is overwritten on every transition, but only by a snapshot with an equal or higher
 * {@code version}; audit writes run asynchronously and may arrive out of order.
 * The full transition history lives in {@link AlertEventEntity}.
 */
@Entity
@Table(
    name = "emergency_alerts",
    indexes = {
        @Index(name = "idx_alert_status", columnList = "status"),
        @Index(name = "idx_alert_site", columnList = "site_id"),
        @Index(name = "idx_alert_agent", columnList = "agent_id")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AlertSource source;

    @Column(name = "agent_id", nullable = false, length = 100)
    private String agentId;

    @Column(name = "site_id", length = 100)
    private String siteId;

    private Double latitude;

    private Double longitude;

    private Double accuracy;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertStatus status;

    @Column(name = "escalation_level", nullable = false)
    private Integer escalationLevel;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_acknowledgments", joinColumns = @JoinColumn(name = "alert_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<AlertAcknowledgment> acknowledgments = new ArrayList<>();

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_notes", length = 4000)
    private String resolutionNotes;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_outcome", length = 20)
    private ResolutionOutcome resolutionOutcome;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Alert version of the snapshot. Not a JPA @Version: ordering comes from the engine, not the database.
     */
    @Column(nullable = false)
    private Long version;

    public static AlertEntity from(EmergencyAlertView view) {
        AlertEntity entity = new AlertEntity();
        entity.setId(view.id());
        entity.apply(view);
        return entity;
    }

    /**
     * Copies a snapshot onto this row.
     */
    public void apply(EmergencyAlertView view) {
        type = view.type();
        priority = view.priority();
        source = view.source();
        agentId = view.agentId();
        siteId = view.siteId();
        latitude = view.location() == null ? null : view.location().latitude();
        longitude = view.location() == null ? null : view.location().longitude();
        accuracy = view.location() == null ? null : view.location().accuracy();
        description = view.description();
        status = view.status();
        escalationLevel = view.escalationLevel();
        if (acknowledgments == null) {
            acknowledgments = new ArrayList<>();
        }
        acknowledgments.clear();
        for (Acknowledgment ack : view.acknowledgments()) {
            acknowledgments.add(new AlertAcknowledgment(ack.userId(), ack.acknowledgedAt()));
        }
        Resolution resolution = view.resolution();
        resolvedBy = resolution == null ? null : resolution.userId();
        resolvedAt = resolution == null ? null : resolution.resolvedAt();
        resolutionNotes = resolution == null ? null : resolution.notes();
        resolutionOutcome = resolution == null ? null : resolution.outcome();
        createdAt = view.createdAt();
        updatedAt = view.updatedAt();
        version = view.version();
    }

    public EmergencyAlertView toView() {
        GeoPoint location = latitude == null || longitude == null ? null : new GeoPoint(latitude, longitude, accuracy);
        List<Acknowledgment> acks = acknowledgments == null ? List.of() : acknowledgments.stream()
            .map(ack -> new Acknowledgment(ack.getUserId(), ack.getAcknowledgedAt()))
            .toList();
        Resolution resolution = resolvedBy == null ? null
            : new Resolution(resolvedBy, resolvedAt, resolutionNotes, resolutionOutcome);
        return new EmergencyAlertView(id, type, priority, source, agentId, siteId, location, description,
            status, escalationLevel, acks, resolution, createdAt, updatedAt, version);
    }
}
