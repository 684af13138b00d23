package com.securityops.coordination.service.registry;

import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.directory.AuthService;
import com.securityops.coordination.directory.DirectoryService;
import com.securityops.coordination.dto.AuthenticatedPrincipal;
import com.securityops.coordination.dto.Role;
import com.securityops.coordination.exception.RoomAccessDeniedException;
import com.securityops.coordination.exception.ValidationException;
import com.securityops.coordination.service.registry.PresenceChangedEvent.Presence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of live sessions and the rooms they belong to.
 *
 * Index layout:
 * - sessionId -> handle: authoritative set of live sessions
 * - roomId -> sessionIds: route lookups for the broadcast router
 * - userId -> sessionIds: a user can be connected from several devices at once
 *
 * A session only appears in the room and user indexes while it is present in the session index.
 * Disconnect removes it from the session index first, so a concurrent route() never returns
 * a handle that is already gone.
 *
 * Every membership change is published as a {@link PresenceChangedEvent}; the broadcast router
 * uses ONLINE events to flush queued messages.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionRegistry {

    private final AuthService authService;
    private final DirectoryService directoryService;
    private final ApplicationEventPublisher eventPublisher;
    private final CoordinationProperties properties;
    private final Clock clock;

    private final Map<String, SessionHandle> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByRoom = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();

    /**
     * Authenticates a token and registers a new session.
     *
     * The session is placed in its private rooms right away: user:{id}, role:{ROLE}, and
     * agent:{agentId} for agents / client:{clientId} for client users.
     *
     * @throws com.securityops.coordination.exception.AuthenticationException for a bad token
     */
    public SessionHandle register(String sessionToken, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("Session id is required");
        }
        AuthenticatedPrincipal principal = authService.authenticate(sessionToken);

        SessionHandle previous = sessions.get(sessionId);
        if (previous != null) {
            log.warn("Session {} registered twice, dropping the previous registration", sessionId);
            disconnect(sessionId, DisconnectReason.EXPLICIT);
        }

        SessionHandle handle = new SessionHandle(sessionId, principal, clock.instant());
        sessions.put(sessionId, handle);
        for (String roomId : defaultRooms(principal)) {
            addToRoom(handle, roomId);
        }
        // the user counts as online only once the private rooms route to this session
        sessionsByUser.compute(principal.userId(), (userId, ids) -> {
            Set<String> updated = ids == null ? ConcurrentHashMap.newKeySet() : ids;
            updated.add(sessionId);
            return updated;
        });

        log.info("Session registered: {} (rooms={})", handle, handle.rooms());
        eventPublisher.publishEvent(new PresenceChangedEvent(handle.userId(), sessionId, null, Presence.ONLINE));
        return handle;
    }

    public SessionHandle joinRoom(String sessionId, String roomId) {
        return joinRoom(requireSession(sessionId), roomId);
    }

    /**
     * Adds a session to a room after checking the session's role may see it.
     *
     * @throws RoomAccessDeniedException when the role may not join
     */
    public SessionHandle joinRoom(SessionHandle handle, String roomId) {
        if (!RoomIds.isValid(roomId)) {
            throw new ValidationException("Unknown room: " + roomId);
        }
        if (!canAccessRoom(handle, roomId)) {
            log.warn("Room access denied: user={}, role={}, room={}", handle.userId(), handle.role(), roomId);
            throw new RoomAccessDeniedException(
                    String.format("User %s may not join room %s", handle.userId(), roomId));
        }
        if (!sessions.containsKey(handle.sessionId())) {
            throw new ValidationException("Session is not connected: " + handle.sessionId());
        }

        if (addToRoom(handle, roomId)) {
            log.debug("Session {} joined {}", handle.sessionId(), roomId);
            eventPublisher.publishEvent(
                    new PresenceChangedEvent(handle.userId(), handle.sessionId(), roomId, Presence.ONLINE));
        }
        return handle;
    }

    public SessionHandle leaveRoom(String sessionId, String roomId) {
        return leaveRoom(requireSession(sessionId), roomId);
    }

    public SessionHandle leaveRoom(SessionHandle handle, String roomId) {
        if (removeFromRoom(handle, roomId)) {
            log.debug("Session {} left {}", handle.sessionId(), roomId);
            eventPublisher.publishEvent(
                    new PresenceChangedEvent(handle.userId(), handle.sessionId(), roomId, Presence.OFFLINE));
        }
        return handle;
    }

    /**
     * Live sessions currently in a room. Empty when nobody is there.
     */
    public Set<SessionHandle> route(String roomId) {
        Set<String> members = sessionsByRoom.get(roomId);
        if (members == null) {
            return Set.of();
        }
        return members.stream()
                .map(sessions::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<SessionHandle> sessionsOf(String userId) {
        Set<String> ids = sessionsByUser.get(userId);
        if (ids == null) {
            return Set.of();
        }
        return ids.stream()
                .map(sessions::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Optional<SessionHandle> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean isUserOnline(String userId) {
        return !sessionsOf(userId).isEmpty();
    }

    public Set<String> connectedUsers() {
        return sessions.values().stream()
                .map(SessionHandle::userId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Records activity on a session so the idle sweep leaves it alone.
     */
    public void touch(String sessionId) {
        SessionHandle handle = sessions.get(sessionId);
        if (handle != null) {
            handle.touch(clock.instant());
        }
    }

    /**
     * Removes a session from every room. Disconnecting an unknown or already removed session is a no-op.
     */
    public void disconnect(String sessionId, DisconnectReason reason) {
        SessionHandle handle = sessions.remove(sessionId);
        if (handle == null) {
            return;
        }
        for (String roomId : handle.rooms()) {
            removeFromRoom(handle, roomId);
        }
        sessionsByUser.computeIfPresent(handle.userId(), (userId, ids) -> {
            ids.remove(sessionId);
            return ids.isEmpty() ? null : ids;
        });

        log.info("Session disconnected: {} reason={}", handle, reason);
        eventPublisher.publishEvent(new PresenceChangedEvent(handle.userId(), sessionId, null, Presence.OFFLINE));
    }

    /**
     * Drops sessions that have not been seen for longer than the idle timeout.
     */
    @Scheduled(fixedDelayString = "${coordination.session.sweep-interval:PT30S}")
    public int sweepIdleSessions() {
        Instant cutoff = clock.instant().minus(properties.getSession().getIdleTimeout());
        List<String> idle = new ArrayList<>();
        for (SessionHandle handle : sessions.values()) {
            if (handle.lastSeen().isBefore(cutoff)) {
                idle.add(handle.sessionId());
            }
        }
        idle.forEach(sessionId -> disconnect(sessionId, DisconnectReason.IDLE_TIMEOUT));
        if (!idle.isEmpty()) {
            log.info("Idle sweep disconnected {} sessions", idle.size());
        }
        return idle.size();
    }

    /**
     * Room access rules:
     * - staff (SUPERVISOR, ADMIN) may join any room
     * - agents may join their own agent room
     * - client users may join their own client room and the sites of their client
     * - everyone may join their own user and role rooms
     */
    public boolean canAccessRoom(SessionHandle handle, String roomId) {
        if (roomId.equals(RoomIds.user(handle.userId())) || roomId.equals(RoomIds.role(handle.role()))) {
            return true;
        }
        if (handle.role().isStaff()) {
            return true;
        }
        String agentId = RoomIds.idOf(roomId, RoomIds.AGENT_PREFIX);
        if (agentId != null) {
            return handle.role() == Role.AGENT && agentId.equals(handle.agentId());
        }
        if (handle.role() != Role.CLIENT || handle.clientId() == null) {
            return false;
        }
        String clientId = RoomIds.idOf(roomId, RoomIds.CLIENT_PREFIX);
        if (clientId != null) {
            return clientId.equals(handle.clientId());
        }
        String siteId = RoomIds.idOf(roomId, RoomIds.SITE_PREFIX);
        if (siteId != null) {
            return directoryService.clientIdForSite(siteId)
                    .map(handle.clientId()::equals)
                    .orElse(false);
        }
        return false;
    }

    private List<String> defaultRooms(AuthenticatedPrincipal principal) {
        List<String> rooms = new ArrayList<>();
        rooms.add(RoomIds.user(principal.userId()));
        rooms.add(RoomIds.role(principal.role()));
        if (principal.role() == Role.AGENT && principal.agentId() != null) {
            rooms.add(RoomIds.agent(principal.agentId()));
        }
        if (principal.role() == Role.CLIENT && principal.clientId() != null) {
            rooms.add(RoomIds.client(principal.clientId()));
        }
        return rooms;
    }

    private boolean addToRoom(SessionHandle handle, String roomId) {
        boolean added = handle.addRoom(roomId);
        sessionsByRoom.compute(roomId, (id, members) -> {
            Set<String> updated = members == null ? ConcurrentHashMap.newKeySet() : members;
            updated.add(handle.sessionId());
            return updated;
        });
        return added;
    }

    private boolean removeFromRoom(SessionHandle handle, String roomId) {
        boolean removed = handle.removeRoom(roomId);
        sessionsByRoom.computeIfPresent(roomId, (id, members) -> {
            members.remove(handle.sessionId());
            return members.isEmpty() ? null : members;
        });
        return removed;
    }

    private SessionHandle requireSession(String sessionId) {
        SessionHandle handle = sessions.get(sessionId);
        if (handle == null) {
            throw new ValidationException("Session is not connected: " + sessionId);
        }
        return handle;
    }
}
