package com.securityops.coordination.service.location;

import com.securityops.coordination.dto.GeofenceViolationRecord;
import com.securityops.coordination.dto.LocationSample;

/**
 * Published when an agent is found outside the geofence of its shift (after cooldown).
 * The alert engine decides whether it becomes an emergency alert.
 */
public record GeofenceViolationDetectedEvent(GeofenceViolationRecord violation, LocationSample sample) {
}
