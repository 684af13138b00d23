package com.securityops.coordination.service.audit;

import com.securityops.coordination.dto.AlertEventRecord;
import com.securityops.coordination.dto.AlertStatus;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.GeofenceViolationRecord;
import com.securityops.coordination.dto.LocationSample;
import com.securityops.coordination.entity.AlertEntity;
import com.securityops.coordination.entity.AlertEventEntity;
import com.securityops.coordination.entity.GeofenceViolationEntity;
import com.securityops.coordination.entity.LocationSampleEntity;
import com.securityops.coordination.repository.AlertEventRepository;
import com.securityops.coordination.repository.AlertRepository;
import com.securityops.coordination.repository.GeofenceViolationRepository;
import com.securityops.coordination.repository.LocationSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * {@link AuditSink} on top of the JPA repositories (PostgreSQL in production).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAuditSink implements AuditSink {

    private final LocationSampleRepository sampleRepository;
    private final GeofenceViolationRepository violationRepository;
    private final AlertRepository alertRepository;
    private final AlertEventRepository alertEventRepository;

    @Override
    @Transactional
    public void appendLocationSample(LocationSample sample) {
        sampleRepository.save(LocationSampleEntity.from(sample));
    }

    @Override
    @Transactional
    public void appendViolation(GeofenceViolationRecord violation) {
        if (violationRepository.existsByViolationId(violation.violationId())) {
            log.debug("Violation {} already stored", violation.violationId());
            return;
        }
        violationRepository.save(GeofenceViolationEntity.from(violation));
    }

    @Override
    @Transactional
    public void saveAlert(EmergencyAlertView alert) {
        AlertEntity entity = alertRepository.findById(alert.id()).orElse(null);
        if (entity == null) {
            alertRepository.save(AlertEntity.from(alert));
            return;
        }
        if (entity.getVersion() != null && entity.getVersion() > alert.version()) {
            log.debug("Skipping stale snapshot of alert {}: stored v{}, offered v{}",
                alert.id(), entity.getVersion(), alert.version());
            return;
        }
        entity.apply(alert);
        alertRepository.save(entity);
    }

    @Override
    @Transactional
    public void appendAlertEvent(AlertEventRecord event) {
        if (alertEventRepository.existsByAlertIdAndSequence(event.alertId(), event.sequence())) {
            log.debug("Alert event {}#{} already stored", event.alertId(), event.sequence());
            return;
        }
        alertEventRepository.save(AlertEventEntity.from(event));
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmergencyAlertView> loadOpenAlerts() {
        return alertRepository.findByStatusIn(EnumSet.of(AlertStatus.OPEN, AlertStatus.ACKNOWLEDGED)).stream()
            .map(AlertEntity::toView)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EmergencyAlertView> findAlert(String alertId) {
        return alertRepository.findById(alertId).map(AlertEntity::toView);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LocationSample> locationHistory(String agentId, Instant from, Instant to) {
        return sampleRepository.findByAgentIdAndCapturedAtBetweenOrderByCapturedAtAsc(agentId, from, to).stream()
            .map(LocationSampleEntity::toSample)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertEventRecord> alertHistory(String alertId) {
        return alertEventRepository.findByAlertIdOrderBySequenceAsc(alertId).stream()
            .map(AlertEventEntity::toRecord)
            .toList();
    }

    @Override
    @Transactional
    public int purgeLocationSamplesBefore(Instant cutoff) {
        return sampleRepository.deleteCapturedBefore(cutoff);
    }
}
