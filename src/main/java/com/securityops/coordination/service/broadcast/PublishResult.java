package com.securityops.coordination.service.broadcast;

import java.util.Set;

/**
 * Outcome of one publish: who received the event now and who will get it from their queue.
 */
public record PublishResult(Set<String> deliveredTo, Set<String> queuedFor) {

    public static PublishResult none() {
        return new PublishResult(Set.of(), Set.of());
    }

    public int recipientCount() {
        return deliveredTo.size() + queuedFor.size();
    }
}
