package com.securityops.coordination.dto;

/**
 * Result of testing a point against a geofence. The boundary is inclusive:
 * a point exactly on it is inside and has zero distance outside.
 */
public record GeofenceEvaluation(
    boolean inside,
    double distanceOutsideMeters,
    double referenceRadiusMeters
) {

    public static GeofenceEvaluation insideOf(double referenceRadiusMeters) {
        return new GeofenceEvaluation(true, 0.0, referenceRadiusMeters);
    }

    public ViolationSeverity severity() {
        return ViolationSeverity.of(distanceOutsideMeters, referenceRadiusMeters);
    }
}
