package com.securityops.coordination.service.registry;

/**
 * Published by the registry on every register, join, leave and disconnect.
 *
 * @param roomId Room joined or left; null when the whole session came or went
 */
public record PresenceChangedEvent(String userId, String sessionId, String roomId, Presence presence) {

    public enum Presence {
        ONLINE,
        OFFLINE
    }

    public boolean isOnline() {
        return presence == Presence.ONLINE;
    }
}
