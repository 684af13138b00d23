package com.securityops.coordination.dto;

/**
 * Severity of a geofence violation, derived from how far outside the boundary the agent is
 * relative to the geofence's reference radius.
 */
public enum ViolationSeverity {
    LOW,
    MEDIUM,
    HIGH;

    public static ViolationSeverity of(double distanceOutsideMeters, double referenceRadiusMeters) {
        if (referenceRadiusMeters <= 0) {
            return HIGH;
        }
        double excessPercentage = distanceOutsideMeters / referenceRadiusMeters * 100.0;
        if (excessPercentage > 100.0) {
            return HIGH;
        }
        if (excessPercentage > 50.0) {
            return MEDIUM;
        }
        return LOW;
    }

    public boolean isAtLeast(ViolationSeverity other) {
        return compareTo(other) >= 0;
    }
}
