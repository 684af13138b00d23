package com.securityops.coordination.service.location;

import com.securityops.coordination.directory.ActiveShift;
import com.securityops.coordination.dto.CachedGeofenceRecord;
import com.securityops.coordination.dto.GeofenceEvaluation;
import com.securityops.coordination.dto.LocationSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Tests accepted samples against the geofence bound to the agent's shift.
 *
 * Performance:
 * - Circle: one haversine computation, O(1)
 * - Polygon: JTS covers, O(vertices)
 * - Geofence lookup: in-process map in the steady state
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeofenceEvaluator {

    private final GeofenceCacheService geofenceCacheService;

    /**
     * @return empty when the shift has no usable geofence; the sample is still accepted
     */
    public Optional<GeofenceCheck> evaluate(ActiveShift shift, LocationSample sample) {
        if (shift.geofenceId() == null) {
            log.debug("Shift {} has no geofence, skipping boundary check", shift.shiftId());
            return Optional.empty();
        }

        Optional<CachedGeofenceRecord> geofence = geofenceCacheService.findGeofence(shift.geofenceId());
        if (geofence.isEmpty()) {
            log.warn("Geofence {} of shift {} not found or inactive", shift.geofenceId(), shift.shiftId());
            return Optional.empty();
        }

        GeofenceEvaluation evaluation = geofence.get().evaluate(sample.latitude(), sample.longitude());
        if (!evaluation.inside()) {
            log.debug("Agent {} is {}m outside {}",
                sample.agentId(), String.format("%.1f", evaluation.distanceOutsideMeters()),
                geofence.get().toLogString());
        }
        return Optional.of(new GeofenceCheck(geofence.get(), evaluation));
    }

    public record GeofenceCheck(CachedGeofenceRecord geofence, GeofenceEvaluation evaluation) {

        public boolean isOutside() {
            return !evaluation.inside();
        }
    }
}
