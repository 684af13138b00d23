package com.securityops.coordination.service.registry;

import com.securityops.coordination.dto.AuthenticatedPrincipal;
import com.securityops.coordination.dto.Role;

import java.security.Principal;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A live, authenticated connection. Room membership and last-seen time are mutated only by
 * {@link ConnectionRegistry}; everyone else gets read access.
 *
 * Implements {@link Principal} with the user id as name so STOMP user destinations resolve to it.
 */
public class SessionHandle implements Principal {

    private final String sessionId;
    private final AuthenticatedPrincipal principal;
    private final Instant connectedAt;
    private final Set<String> rooms = ConcurrentHashMap.newKeySet();
    private volatile Instant lastSeen;

    SessionHandle(String sessionId, AuthenticatedPrincipal principal, Instant connectedAt) {
        this.sessionId = sessionId;
        this.principal = principal;
        this.connectedAt = connectedAt;
        this.lastSeen = connectedAt;
    }

    @Override
    public String getName() {
        return principal.userId();
    }

    public String sessionId() {
        return sessionId;
    }

    public String userId() {
        return principal.userId();
    }

    public Role role() {
        return principal.role();
    }

    public String agentId() {
        return principal.agentId();
    }

    public String clientId() {
        return principal.clientId();
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastSeen() {
        return lastSeen;
    }

    public Set<String> rooms() {
        return Collections.unmodifiableSet(rooms);
    }

    public boolean isInRoom(String roomId) {
        return rooms.contains(roomId);
    }

    boolean addRoom(String roomId) {
        return rooms.add(roomId);
    }

    boolean removeRoom(String roomId) {
        return rooms.remove(roomId);
    }

    void touch(Instant at) {
        this.lastSeen = at;
    }

    @Override
    public String toString() {
        return String.format("Session[id=%s, user=%s, role=%s]", sessionId, principal.userId(), principal.role());
    }
}
