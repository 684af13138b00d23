package com.securityops.coordination.dto;

/**
 * Why an ingested sample was not accepted.
 */
public enum RejectionReason {
    /** Agent is known but has no shift in progress. */
    NO_ACTIVE_SHIFT,
    /** Reported accuracy is worse than the configured ceiling; discarded, not broadcast. */
    ACCURACY_TOO_LOW,
    /** Capture time is not after the last accepted sample of the agent; dropped. */
    OUT_OF_ORDER
}
