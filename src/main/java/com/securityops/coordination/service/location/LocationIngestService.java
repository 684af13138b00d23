package com.securityops.coordination.service.location;

import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.directory.ActiveShift;
import com.securityops.coordination.directory.DirectoryService;
import com.securityops.coordination.dto.GeofenceViolationRecord;
import com.securityops.coordination.dto.IngestResult;
import com.securityops.coordination.dto.LatestLocationView;
import com.securityops.coordination.dto.LocationSample;
import com.securityops.coordination.dto.LocationSampleRecord;
import com.securityops.coordination.dto.OutboundEvent;
import com.securityops.coordination.dto.RejectionReason;
import com.securityops.coordination.dto.SampleStatus;
import com.securityops.coordination.exception.StaleDataException;
import com.securityops.coordination.exception.ValidationException;
import com.securityops.coordination.service.audit.AuditSink;
import com.securityops.coordination.service.audit.AuditTrailService;
import com.securityops.coordination.service.broadcast.BroadcastRouter;
import com.securityops.coordination.service.location.GeofenceEvaluator.GeofenceCheck;
import com.securityops.coordination.service.registry.RoomIds;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Entry point for agent location samples, over STOMP or REST.
 *
 * Pipeline (checks run in this order, the first failure decides):
 * 1. Validation: coordinates, timestamp not in the future beyond clock skew, known agent
 *    -> ValidationException to the caller
 * 2. Active shift lookup -> NO_ACTIVE_SHIFT
 * 3. Accuracy ceiling -> ACCURACY_TOO_LOW (logged, not stored, not broadcast)
 * 4. Per-agent watermark: capture time must be strictly after the last accepted one -> OUT_OF_ORDER
 *
 * An accepted sample then:
 * - becomes the agent's latest position
 * - is tested against the shift's geofence; outside + cooldown elapsed -> violation
 * - is broadcast as LOCATION_UPDATE and written to the audit trail
 *
 * Nothing on this path blocks on I/O: geofences come from the in-process cache,
 * audit writes are asynchronous and broadcasts go to the in-memory broker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationIngestService {

    private final DirectoryService directoryService;
    private final GeofenceEvaluator geofenceEvaluator;
    private final LatestLocationCache latestLocationCache;
    private final BroadcastRouter broadcastRouter;
    private final AuditTrailService auditTrailService;
    private final AuditSink auditSink;
    private final ApplicationEventPublisher eventPublisher;
    private final Validator validator;
    private final CoordinationProperties properties;
    private final Clock clock;

    // Capture time of the last accepted sample per agent
    private final Map<String, Instant> watermarks = new ConcurrentHashMap<>();
    // Capture time of the last violation raised per agent
    private final Map<String, Instant> lastViolationAt = new ConcurrentHashMap<>();

    public IngestResult ingest(String agentId, LocationSampleRecord record) {
        Instant now = clock.instant();
        validate(agentId, record, now);

        Optional<ActiveShift> shift = directoryService.findActiveShift(agentId, now);
        if (shift.isEmpty()) {
            log.debug("Sample from agent {} rejected: no active shift", agentId);
            return IngestResult.rejected(RejectionReason.NO_ACTIVE_SHIFT);
        }

        double ceiling = properties.getLocation().getAccuracyCeilingMeters();
        if (!record.hasAcceptableAccuracy(ceiling)) {
            log.warn("Poor GPS accuracy rejected for agent {}: {}m > {}m ({})",
                agentId, record.accuracy(), ceiling, record.toLogString());
            return IngestResult.rejected(RejectionReason.ACCURACY_TOO_LOW);
        }

        try {
            advanceWatermark(agentId, record.timestamp());
        } catch (StaleDataException e) {
            log.debug("Out-of-order sample dropped: {}", e.getMessage());
            return IngestResult.rejected(RejectionReason.OUT_OF_ORDER);
        }

        LocationSample sample = LocationSample.accepted(
            agentId, shift.get().siteId(), shift.get().shiftId(), record, now, statusAt(record.timestamp(), now));
        return accept(sample, shift.get(), now);
    }

    private IngestResult accept(LocationSample sample, ActiveShift shift, Instant now) {
        latestLocationCache.update(sample);

        GeofenceViolationRecord violation = geofenceEvaluator.evaluate(shift, sample)
            .filter(GeofenceCheck::isOutside)
            .filter(check -> claimViolationSlot(sample.agentId(), sample.capturedAt()))
            .map(check -> GeofenceViolationRecord.fromSample(sample, check.geofence(), check.evaluation()))
            .orElse(null);

        if (violation != null) {
            log.warn("Geofence violation detected! {}", violation.toLogString());
            auditTrailService.recordViolation(violation);
            broadcastRouter.publish(
                List.of(RoomIds.site(sample.siteId()), RoomIds.MONITORING),
                OutboundEvent.alert(OutboundEvent.GEOFENCE_VIOLATION, violation, now));
            eventPublisher.publishEvent(new GeofenceViolationDetectedEvent(violation, sample));
        }

        broadcastRouter.publish(locationRooms(sample, shift), OutboundEvent.location(OutboundEvent.LOCATION_UPDATE, sample, now));
        auditTrailService.recordSample(sample);

        log.debug("Sample accepted: {}", sample.toLogString());
        return IngestResult.accepted(sample, violation);
    }

    public Optional<LatestLocationView> latestFor(String agentId) {
        return latestLocationCache.latestFor(agentId);
    }

    public List<LatestLocationView> latestForSite(String siteId) {
        return latestLocationCache.latestForSite(siteId);
    }

    public List<LatestLocationView> latestAll() {
        return latestLocationCache.latestAll();
    }

    /**
     * Stored track of an agent between two instants, oldest first.
     */
    public List<LocationSample> history(String agentId, Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new ValidationException("History range start must not be after its end");
        }
        return auditSink.locationHistory(agentId, from, to);
    }

    /**
     * Deletes stored samples older than the history retention window.
     */
    @Scheduled(fixedDelayString = "${coordination.location.history-purge-interval:PT1H}")
    public void purgeExpiredHistory() {
        Instant cutoff = clock.instant().minus(properties.getLocation().getHistoryRetention());
        try {
            int purged = auditSink.purgeLocationSamplesBefore(cutoff);
            log.info("Purged {} location samples captured before {}", purged, cutoff);
        } catch (Exception e) {
            log.error("Location history purge failed", e);
        }
    }

    private void validate(String agentId, LocationSampleRecord record, Instant now) {
        if (agentId == null || agentId.isBlank()) {
            throw new ValidationException("Agent ID is required");
        }
        if (record == null) {
            throw new ValidationException("Location sample is required");
        }
        Set<ConstraintViolation<LocationSampleRecord>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations.stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .collect(Collectors.joining(", ")));
        }
        Duration maxSkew = properties.getLocation().getMaxClockSkew();
        if (record.timestamp().isAfter(now.plus(maxSkew))) {
            throw new ValidationException(String.format(
                "Sample timestamp %s is in the future (server time %s)", record.timestamp(), now));
        }
        if (!directoryService.isKnownAgent(agentId)) {
            throw new ValidationException("Unknown agent: " + agentId);
        }
    }

    /**
     * Atomically checks the sample is newer than the agent's watermark and advances it.
     */
    private void advanceWatermark(String agentId, Instant capturedAt) {
        watermarks.compute(agentId, (id, last) -> {
            if (last != null && !capturedAt.isAfter(last)) {
                throw new StaleDataException(String.format(
                    "agent=%s captured=%s, last accepted=%s", agentId, capturedAt, last));
            }
            return capturedAt;
        });
    }

    /**
     * Claims the agent's violation slot if the cooldown (measured on sample time) has elapsed.
     */
    private boolean claimViolationSlot(String agentId, Instant capturedAt) {
        Duration cooldown = properties.getGeofence().getViolationCooldown();
        Instant winner = lastViolationAt.compute(agentId, (id, last) ->
            last == null || !capturedAt.isBefore(last.plus(cooldown)) ? capturedAt : last);
        boolean claimed = capturedAt.equals(winner);
        if (!claimed) {
            log.debug("Violation for agent {} suppressed by cooldown (last at {})", agentId, winner);
        }
        return claimed;
    }

    private SampleStatus statusAt(Instant capturedAt, Instant now) {
        return Duration.between(capturedAt, now).compareTo(properties.getLocation().getFreshnessWindow()) > 0
            ? SampleStatus.STALE
            : SampleStatus.ACTIVE;
    }

    private List<String> locationRooms(LocationSample sample, ActiveShift shift) {
        List<String> rooms = new ArrayList<>();
        rooms.add(RoomIds.site(sample.siteId()));
        rooms.add(RoomIds.MONITORING);
        rooms.add(RoomIds.agent(sample.agentId()));
        if (shift.clientId() != null) {
            rooms.add(RoomIds.client(shift.clientId()));
        }
        return rooms;
    }
}
