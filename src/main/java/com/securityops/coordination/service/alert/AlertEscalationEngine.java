package com.securityops.coordination.service.alert;

import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.config.CoordinationProperties.Escalation.Tier;
import com.securityops.coordination.directory.ActiveShift;
import com.securityops.coordination.directory.DirectoryService;
import com.securityops.coordination.dto.Acknowledgment;
import com.securityops.coordination.dto.AlertEventKind;
import com.securityops.coordination.dto.AlertEventRecord;
import com.securityops.coordination.dto.AlertPriority;
import com.securityops.coordination.dto.AlertSource;
import com.securityops.coordination.dto.AlertStatus;
import com.securityops.coordination.dto.CreateAlertRequest;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.GeoPoint;
import com.securityops.coordination.dto.GeofenceViolationRecord;
import com.securityops.coordination.dto.OutboundEvent;
import com.securityops.coordination.dto.Resolution;
import com.securityops.coordination.dto.ResolutionOutcome;
import com.securityops.coordination.exception.AlertNotFoundException;
import com.securityops.coordination.exception.CoordinationException;
import com.securityops.coordination.exception.StateConflictException;
import com.securityops.coordination.exception.ValidationException;
import com.securityops.coordination.service.alert.AlertHandle.Transition;
import com.securityops.coordination.service.audit.AuditSink;
import com.securityops.coordination.service.audit.AuditTrailService;
import com.securityops.coordination.service.broadcast.BroadcastRouter;
import com.securityops.coordination.service.location.GeofenceViolationDetectedEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Lifecycle of emergency alerts: creation, timed escalation, acknowledgment and resolution.
 *
 * State machine:
 * <pre>
 * OPEN(0) --timer--> OPEN(1) --timer--> ... OPEN(N)
 *    |                  |                      |
 *    +--acknowledge-----+----------------------+--> ACKNOWLEDGED --resolve--> RESOLVED
 *    +--resolve---------+----------------------+---------------------------> RESOLVED
 * </pre>
 *
 * Tier n is reached at {@code createdAt + tiers[n].offset}. Reaching level n notifies the rooms
 * of tiers 0..n, and HIGH priority alerts also notify the high-priority rooms.
 *
 * Concurrency:
 * Every transition is a compare-and-set on the alert's immutable snapshot (see {@link AlertHandle}).
 * The timer callback only escalates if the alert is still OPEN at the level the timer was armed
 * for, so a timer racing an acknowledgment either wins before it (and the acknowledgment applies
 * to the new level) or sees ACKNOWLEDGED and does nothing. Re-transitions into a state the alert
 * already left are no-ops that return the current snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertEscalationEngine {

    private static final String SITE_PLACEHOLDER = "{siteId}";
    private static final String AGENT_PLACEHOLDER = "{agentId}";

    private final BroadcastRouter broadcastRouter;
    private final AuditTrailService auditTrailService;
    private final AuditSink auditSink;
    private final DirectoryService directoryService;
    @Qualifier("taskScheduler")
    private final TaskScheduler taskScheduler;
    private final CoordinationProperties properties;
    private final Clock clock;

    private final Map<String, AlertHandle> alerts = new ConcurrentHashMap<>();
    private List<Tier> tiers = List.of();

    /**
     * Tiers must start at level 0, be contiguous, and reach later levels no earlier than earlier ones.
     */
    @PostConstruct
    public void validateTiers() {
        List<Tier> sorted = properties.getEscalation().getTiers().stream()
                .sorted(Comparator.comparingInt(Tier::getLevel))
                .toList();
        if (sorted.isEmpty()) {
            throw new IllegalStateException("coordination.escalation.tiers must define at least level 0");
        }
        for (int i = 0; i < sorted.size(); i++) {
            Tier tier = sorted.get(i);
            if (tier.getLevel() != i) {
                throw new IllegalStateException("Escalation tiers must be numbered 0.." + (sorted.size() - 1)
                        + " without gaps, found level " + tier.getLevel());
            }
            if (tier.getOffset() == null || tier.getOffset().isNegative()) {
                throw new IllegalStateException("Escalation tier " + i + " needs a non-negative offset");
            }
            if (i > 0 && tier.getOffset().compareTo(sorted.get(i - 1).getOffset()) < 0) {
                throw new IllegalStateException("Escalation tier " + i + " is reached before tier " + (i - 1));
            }
        }
        this.tiers = sorted;
        log.info("Escalation tiers: {}", sorted.stream()
                .map(tier -> tier.getLevel() + "@" + tier.getOffset() + tier.getRooms())
                .toList());
    }

    /**
     * Opens a new alert at level 0, notifies the level-0 rooms and arms the timer for level 1.
     */
    public EmergencyAlertView createAlert(CreateAlertRequest request) {
        if (!directoryService.isKnownAgent(request.agentId())) {
            throw new ValidationException("Unknown agent: " + request.agentId());
        }

        Instant now = clock.instant();
        String siteId = request.siteId() != null
                ? request.siteId()
                : directoryService.findActiveShift(request.agentId(), now).map(ActiveShift::siteId).orElse(null);

        EmergencyAlertView alert = new EmergencyAlertView(
                UUID.randomUUID().toString(),
                request.type(),
                priorityFor(request),
                request.sourceOrDefault(),
                request.agentId(),
                siteId,
                request.location(),
                request.description(),
                AlertStatus.OPEN,
                0,
                List.of(),
                null,
                now,
                now,
                1L
        );

        AlertHandle handle = new AlertHandle(alert);
        alerts.put(alert.id(), handle);

        log.warn("Emergency alert raised: {}", alert.toLogString());
        String actor = alert.source() == AlertSource.GEOFENCE_VIOLATION ? AlertEventRecord.SYSTEM_ACTOR : alert.agentId();
        record(alert, AlertEventKind.CREATED, null, actor, now);
        notifyRooms(alert, OutboundEvent.ALERT_CREATED, now);
        scheduleNextTier(handle, 0);
        return alert;
    }

    /**
     * Timer callback: moves OPEN(fromLevel) to OPEN(fromLevel + 1).
     *
     * @return true if the alert escalated; false if it was acknowledged, resolved or already
     *         moved past {@code fromLevel}
     */
    public boolean escalate(String alertId, int fromLevel) {
        AlertHandle handle = alerts.get(alertId);
        if (handle == null) {
            log.debug("Escalation timer fired for unknown alert {}", alertId);
            return false;
        }
        if (fromLevel + 1 >= tiers.size()) {
            log.debug("Alert {} already at the last tier", alertId);
            return false;
        }

        Instant now = clock.instant();
        Transition transition;
        try {
            transition = handle.transition(current -> {
                if (current.status() != AlertStatus.OPEN || current.escalationLevel() != fromLevel) {
                    throw new StateConflictException(String.format(
                            "alert %s is %s at level %d, timer armed for level %d",
                            alertId, current.status(), current.escalationLevel(), fromLevel));
                }
                return copy(current, AlertStatus.OPEN, fromLevel + 1, current.acknowledgments(), null, now);
            });
        } catch (StateConflictException e) {
            log.debug("Escalation skipped: {}", e.getMessage());
            return false;
        }

        EmergencyAlertView escalated = transition.after();
        log.warn("Alert escalated {} -> {}: {}", fromLevel, escalated.escalationLevel(), escalated.toLogString());
        record(escalated, AlertEventKind.ESCALATED, fromLevel, AlertEventRecord.SYSTEM_ACTOR, now);
        notifyRooms(escalated, OutboundEvent.ALERT_ESCALATED, now);
        scheduleNextTier(handle, escalated.escalationLevel());
        return true;
    }

    /**
     * Stops escalation. Acknowledging an alert that is no longer OPEN returns it unchanged.
     */
    public EmergencyAlertView acknowledge(String alertId, String userId) {
        AlertHandle handle = requireHandle(alertId);
        Instant now = clock.instant();

        Transition transition;
        try {
            transition = handle.transition(current -> {
                if (current.status() != AlertStatus.OPEN) {
                    throw new StateConflictException(String.format("alert %s is already %s", alertId, current.status()));
                }
                List<Acknowledgment> acks = new ArrayList<>(current.acknowledgments());
                acks.add(new Acknowledgment(userId, now));
                return copy(current, AlertStatus.ACKNOWLEDGED, current.escalationLevel(), acks, null, now);
            });
        } catch (StateConflictException e) {
            log.debug("Acknowledge by {} ignored: {}", userId, e.getMessage());
            return handle.current();
        }
        handle.cancelTimer();

        EmergencyAlertView acknowledged = transition.after();
        log.info("Alert acknowledged by {}: {}", userId, acknowledged.toLogString());
        record(acknowledged, AlertEventKind.ACKNOWLEDGED, transition.before().escalationLevel(), userId, now);
        notifyRooms(acknowledged, OutboundEvent.ALERT_ACKNOWLEDGED, now);
        return acknowledged;
    }

    /**
     * Closes an OPEN or ACKNOWLEDGED alert. Resolving a RESOLVED alert returns the same record.
     */
    public EmergencyAlertView resolve(String alertId, String userId, String notes, ResolutionOutcome outcome) {
        AlertHandle handle = requireHandle(alertId);
        Instant now = clock.instant();
        ResolutionOutcome effectiveOutcome = outcome == null ? ResolutionOutcome.RESOLVED : outcome;

        Transition transition;
        try {
            transition = handle.transition(current -> {
                if (current.status() == AlertStatus.RESOLVED) {
                    throw new StateConflictException(String.format("alert %s is already resolved", alertId));
                }
                Resolution resolution = new Resolution(userId, now, notes, effectiveOutcome);
                return copy(current, AlertStatus.RESOLVED, current.escalationLevel(), current.acknowledgments(), resolution, now);
            });
        } catch (StateConflictException e) {
            log.debug("Resolve by {} ignored: {}", userId, e.getMessage());
            return handle.current();
        }
        handle.cancelTimer();

        EmergencyAlertView resolved = transition.after();
        log.info("Alert resolved by {} as {}: {}", userId, effectiveOutcome, resolved.toLogString());
        record(resolved, AlertEventKind.RESOLVED, transition.before().escalationLevel(), userId, now);
        notifyRooms(resolved, OutboundEvent.ALERT_RESOLVED, now);
        return resolved;
    }

    /**
     * Looks the alert up in memory first, then in the durable store.
     */
    public Optional<EmergencyAlertView> findAlert(String alertId) {
        AlertHandle handle = alerts.get(alertId);
        if (handle != null) {
            return Optional.of(handle.current());
        }
        return auditSink.findAlert(alertId);
    }

    public EmergencyAlertView getAlert(String alertId) {
        return findAlert(alertId)
                .orElseThrow(() -> new AlertNotFoundException("Alert not found: " + alertId));
    }

    /**
     * OPEN and ACKNOWLEDGED alerts, HIGH priority first, newest first within a priority.
     */
    public List<EmergencyAlertView> activeAlerts() {
        return alerts.values().stream()
                .map(AlertHandle::current)
                .filter(alert -> !alert.isResolved())
                .sorted(Comparator.comparing(EmergencyAlertView::priority).reversed()
                        .thenComparing(EmergencyAlertView::createdAt, Comparator.reverseOrder()))
                .toList();
    }

    public List<AlertEventRecord> alertHistory(String alertId) {
        getAlert(alertId);
        return auditSink.alertHistory(alertId);
    }

    /**
     * Turns a geofence violation into a SECURITY alert when it crosses the configured thresholds.
     */
    @EventListener
    public void onGeofenceViolation(GeofenceViolationDetectedEvent event) {
        GeofenceViolationRecord violation = event.violation();
        CoordinationProperties.Geofence config = properties.getGeofence();
        if (!violation.severity().isAtLeast(config.getAlertMinSeverity())
                || violation.distanceOutsideMeters() < config.getAlertMinDistanceMeters()) {
            log.debug("Violation {} below alert thresholds", violation.violationId());
            return;
        }

        CreateAlertRequest request = new CreateAlertRequest(
                config.getAlertType(),
                violation.agentId(),
                violation.siteId(),
                new GeoPoint(violation.latitude(), violation.longitude(), event.sample().accuracy()),
                String.format("Agent %s is %.1fm outside geofence '%s' (severity %s)",
                        violation.agentId(), violation.distanceOutsideMeters(),
                        violation.geofenceName(), violation.severity()),
                null,
                AlertSource.GEOFENCE_VIOLATION
        );
        try {
            createAlert(request);
        } catch (CoordinationException e) {
            log.error("Could not raise alert for violation {}: {}", violation.violationId(), e.getMessage(), e);
        }
    }

    /**
     * Re-arms timers of alerts that were still open when the previous instance stopped.
     * Tiers that became due in the meantime fire immediately, one level at a time.
     */
    @EventListener(ApplicationReadyEvent.class)
    public int recoverOpenAlerts() {
        List<EmergencyAlertView> open;
        try {
            open = auditSink.loadOpenAlerts();
        } catch (Exception e) {
            log.error("Could not load open alerts for recovery", e);
            return 0;
        }

        int recovered = 0;
        for (EmergencyAlertView alert : open) {
            AlertHandle handle = new AlertHandle(alert);
            if (alerts.putIfAbsent(alert.id(), handle) != null) {
                continue;
            }
            recovered++;
            if (alert.status() == AlertStatus.OPEN) {
                scheduleNextTier(handle, alert.escalationLevel());
            }
        }
        log.info("Recovered {} unresolved alerts from the store", recovered);
        return recovered;
    }

    /**
     * Evicts resolved alerts from memory once the retention window has passed.
     */
    @Scheduled(fixedDelayString = "${coordination.escalation.sweep-interval:PT5M}")
    public int sweepClosedAlerts() {
        Instant cutoff = clock.instant().minus(properties.getEscalation().getClosedAlertRetention());
        int before = alerts.size();
        alerts.values().removeIf(handle -> {
            EmergencyAlertView alert = handle.current();
            return alert.isResolved() && alert.updatedAt().isBefore(cutoff);
        });
        int evicted = before - alerts.size();
        if (evicted > 0) {
            log.debug("Evicted {} resolved alerts from memory", evicted);
        }
        return evicted;
    }

    boolean hasPendingTimer(String alertId) {
        AlertHandle handle = alerts.get(alertId);
        return handle != null && handle.hasPendingTimer();
    }

    private void scheduleNextTier(AlertHandle handle, int currentLevel) {
        int nextLevel = currentLevel + 1;
        if (nextLevel >= tiers.size()) {
            return;
        }
        EmergencyAlertView alert = handle.current();
        Instant fireAt = alert.createdAt().plus(tiers.get(nextLevel).getOffset());
        ScheduledFuture<?> timer = taskScheduler.schedule(() -> escalate(alert.id(), currentLevel), fireAt);
        handle.replaceTimer(timer);

        // An acknowledge or resolve may have landed between the transition and the schedule call
        EmergencyAlertView now = handle.current();
        if (now.status() != AlertStatus.OPEN || now.escalationLevel() != currentLevel) {
            handle.cancelTimer();
            return;
        }
        log.debug("Alert {} will reach level {} at {}", alert.id(), nextLevel, fireAt);
    }

    private AlertHandle requireHandle(String alertId) {
        AlertHandle handle = alerts.get(alertId);
        if (handle != null) {
            return handle;
        }
        EmergencyAlertView stored = auditSink.findAlert(alertId)
                .orElseThrow(() -> new AlertNotFoundException("Alert not found: " + alertId));
        AlertHandle adopted = new AlertHandle(stored);
        AlertHandle existing = alerts.putIfAbsent(alertId, adopted);
        if (existing != null) {
            return existing;
        }
        if (stored.status() == AlertStatus.OPEN) {
            scheduleNextTier(adopted, stored.escalationLevel());
        }
        return adopted;
    }

    private AlertPriority priorityFor(CreateAlertRequest request) {
        if (request.type().isLifeSafety()) {
            return AlertPriority.HIGH;
        }
        return request.priority() != null ? request.priority() : properties.getEscalation().getDefaultPriority();
    }

    /**
     * Rooms of tiers 0..level, plus the high-priority rooms for HIGH alerts.
     */
    Set<String> roomsFor(EmergencyAlertView alert) {
        Set<String> rooms = new LinkedHashSet<>();
        int maxLevel = Math.min(alert.escalationLevel(), tiers.size() - 1);
        for (int level = 0; level <= maxLevel; level++) {
            for (String template : tiers.get(level).getRooms()) {
                resolveRoom(template, alert).ifPresent(rooms::add);
            }
        }
        if (alert.priority() == AlertPriority.HIGH) {
            for (String template : properties.getEscalation().getHighPriorityRooms()) {
                resolveRoom(template, alert).ifPresent(rooms::add);
            }
        }
        return rooms;
    }

    private Optional<String> resolveRoom(String template, EmergencyAlertView alert) {
        if (template.contains(SITE_PLACEHOLDER) && alert.siteId() == null) {
            log.debug("Alert {} has no site, skipping room {}", alert.id(), template);
            return Optional.empty();
        }
        String room = template.replace(SITE_PLACEHOLDER, String.valueOf(alert.siteId()))
                .replace(AGENT_PLACEHOLDER, alert.agentId());
        return Optional.of(room);
    }

    private void notifyRooms(EmergencyAlertView alert, String eventType, Instant now) {
        Set<String> rooms = roomsFor(alert);
        if (rooms.isEmpty()) {
            log.warn("Alert {} has no rooms to notify for {}", alert.id(), eventType);
            return;
        }
        broadcastRouter.publish(rooms, OutboundEvent.alert(eventType, alert, now));
    }

    private void record(EmergencyAlertView alert, AlertEventKind kind, Integer fromLevel, String actor, Instant at) {
        AlertEventRecord event = new AlertEventRecord(
                alert.id(), alert.version(), kind, fromLevel, alert.escalationLevel(), actor, at);
        auditTrailService.recordAlertTransition(alert, event);
    }

    private static EmergencyAlertView copy(
            EmergencyAlertView current,
            AlertStatus status,
            int level,
            List<Acknowledgment> acknowledgments,
            Resolution resolution,
            Instant now) {
        return new EmergencyAlertView(
                current.id(),
                current.type(),
                current.priority(),
                current.source(),
                current.agentId(),
                current.siteId(),
                current.location(),
                current.description(),
                status,
                level,
                acknowledgments,
                resolution,
                current.createdAt(),
                now,
                current.version() + 1
        );
    }
}
