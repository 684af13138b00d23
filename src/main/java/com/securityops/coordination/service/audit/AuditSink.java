package com.securityops.coordination.service.audit;

import com.securityops.coordination.dto.AlertEventRecord;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.GeofenceViolationRecord;
import com.securityops.coordination.dto.LocationSample;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for samples, violations and alert history.
 *
 * Writes must be idempotent: the audit trail retries failed writes, so the same sample,
 * violation or alert event may be offered more than once.
 */
public interface AuditSink {

    void appendLocationSample(LocationSample sample);

    void appendViolation(GeofenceViolationRecord violation);

    /**
     * Upserts the alert snapshot. A snapshot older than the stored one is ignored.
     */
    void saveAlert(EmergencyAlertView alert);

    /**
     * Appends a transition; an event whose (alertId, sequence) is already stored is ignored.
     */
    void appendAlertEvent(AlertEventRecord event);

    /**
     * Alerts that were still OPEN or ACKNOWLEDGED at the last write.
     */
    List<EmergencyAlertView> loadOpenAlerts();

    Optional<EmergencyAlertView> findAlert(String alertId);

    List<LocationSample> locationHistory(String agentId, Instant from, Instant to);

    List<AlertEventRecord> alertHistory(String alertId);

    int purgeLocationSamplesBefore(Instant cutoff);
}
