package com.securityops.coordination.dto;

import java.time.Instant;

/**
 * One row of an alert's audit trail.
 *
 * @param sequence  Alert version after the transition; (alertId, sequence) is unique, which makes
 *                  retried writes of the same transition idempotent
 * @param fromLevel Escalation level before the transition, null for CREATED
 * @param toLevel   Escalation level after the transition
 * @param actor     User who caused the transition, or "system" for timer-driven escalations
 */
public record AlertEventRecord(
    String alertId,
    long sequence,
    AlertEventKind kind,
    Integer fromLevel,
    int toLevel,
    String actor,
    Instant occurredAt
) {

    public static final String SYSTEM_ACTOR = "system";
}
