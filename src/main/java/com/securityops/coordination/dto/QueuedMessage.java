package com.securityops.coordination.dto;

import java.time.Instant;

/**
 * Event held for a recipient who is expected in a room but has no live session.
 */
public record QueuedMessage(
    String recipientId,
    String roomId,
    OutboundEvent event,
    Instant enqueuedAt,
    int deliveryAttempts
) {

    public QueuedMessage attempted() {
        return new QueuedMessage(recipientId, roomId, event, enqueuedAt, deliveryAttempts + 1);
    }
}
