package com.securityops.coordination.directory;

import java.time.Instant;

/**
 * An agent's in-progress shift as resolved by the directory. Every active shift maps to exactly
 * one geofence, used for violation testing during the shift's window.
 *
 * @param clientId Client that owns the site, null for internal sites
 * @param endsAt   Null for open-ended shifts
 */
public record ActiveShift(
    String shiftId,
    String agentId,
    String siteId,
    String clientId,
    Long geofenceId,
    Instant startsAt,
    Instant endsAt
) {

    public boolean isInProgressAt(Instant at) {
        return !at.isBefore(startsAt) && (endsAt == null || at.isBefore(endsAt));
    }
}
