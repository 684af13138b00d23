package com.securityops.coordination.dto;

/**
 * Outcome of ingesting one sample: either accepted (with an optional violation), or rejected with a reason.
 */
public record IngestResult(
    boolean accepted,
    RejectionReason rejectionReason,
    LocationSample sample,
    GeofenceViolationRecord violation
) {

    public static IngestResult accepted(LocationSample sample, GeofenceViolationRecord violation) {
        return new IngestResult(true, null, sample, violation);
    }

    public static IngestResult rejected(RejectionReason reason) {
        return new IngestResult(false, reason, null, null);
    }

    public boolean hasViolation() {
        return violation != null;
    }
}
