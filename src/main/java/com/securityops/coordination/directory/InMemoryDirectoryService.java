package com.securityops.coordination.directory;

import com.securityops.coordination.dto.Role;
import com.securityops.coordination.service.registry.RoomIds;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Directory kept in process memory. Deployments that own a workforce database replace it by
 * declaring their own {@link DirectoryService} bean; this one is populated by the scheduling
 * integration (or by tests) through the register/assign methods.
 */
@Slf4j
public class InMemoryDirectoryService implements DirectoryService {

    private final Map<String, Role> rolesByUser = new ConcurrentHashMap<>();
    private final Map<String, String> userByAgent = new ConcurrentHashMap<>();
    private final Map<String, ActiveShift> shiftByAgent = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> supervisorsBySite = new ConcurrentHashMap<>();
    private final Map<String, String> clientBySite = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> usersByClient = new ConcurrentHashMap<>();

    public void registerUser(String userId, Role role) {
        rolesByUser.put(userId, role);
    }

    public void registerAgent(String agentId, String userId) {
        userByAgent.put(agentId, userId);
        rolesByUser.putIfAbsent(userId, Role.AGENT);
    }

    public void assignShift(ActiveShift shift) {
        shiftByAgent.put(shift.agentId(), shift);
        if (shift.clientId() != null) {
            clientBySite.put(shift.siteId(), shift.clientId());
        }
        log.info("Shift {} assigned: agent={}, site={}, geofence={}",
                shift.shiftId(), shift.agentId(), shift.siteId(), shift.geofenceId());
    }

    public void endShift(String agentId) {
        ActiveShift removed = shiftByAgent.remove(agentId);
        if (removed != null) {
            log.info("Shift {} ended for agent {}", removed.shiftId(), agentId);
        }
    }

    public void assignSupervisor(String siteId, String userId) {
        supervisorsBySite.computeIfAbsent(siteId, k -> ConcurrentHashMap.newKeySet()).add(userId);
        rolesByUser.putIfAbsent(userId, Role.SUPERVISOR);
    }

    public void registerClientUser(String clientId, String userId) {
        usersByClient.computeIfAbsent(clientId, k -> ConcurrentHashMap.newKeySet()).add(userId);
        rolesByUser.putIfAbsent(userId, Role.CLIENT);
    }

    @Override
    public boolean isKnownAgent(String agentId) {
        return userByAgent.containsKey(agentId);
    }

    @Override
    public Optional<ActiveShift> findActiveShift(String agentId, Instant at) {
        return Optional.ofNullable(shiftByAgent.get(agentId))
                .filter(shift -> shift.isInProgressAt(at));
    }

    @Override
    public Set<String> recipientsForRoom(String roomId) {
        if (RoomIds.MONITORING.equals(roomId)) {
            return usersWithRole(Role.SUPERVISOR, Role.ADMIN);
        }
        String siteId = RoomIds.idOf(roomId, RoomIds.SITE_PREFIX);
        if (siteId != null) {
            return Set.copyOf(supervisorsBySite.getOrDefault(siteId, Set.of()));
        }
        String agentId = RoomIds.idOf(roomId, RoomIds.AGENT_PREFIX);
        if (agentId != null) {
            return agentChannelRecipients(agentId);
        }
        String clientId = RoomIds.idOf(roomId, RoomIds.CLIENT_PREFIX);
        if (clientId != null) {
            return Set.copyOf(usersByClient.getOrDefault(clientId, Set.of()));
        }
        String role = RoomIds.idOf(roomId, RoomIds.ROLE_PREFIX);
        if (role != null) {
            try {
                return usersWithRole(Role.valueOf(role));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown role in room id {}", roomId);
                return Set.of();
            }
        }
        String userId = RoomIds.idOf(roomId, RoomIds.USER_PREFIX);
        if (userId != null) {
            return Set.of(userId);
        }
        return Set.of();
    }

    @Override
    public Optional<String> clientIdForSite(String siteId) {
        return Optional.ofNullable(clientBySite.get(siteId));
    }

    private Set<String> agentChannelRecipients(String agentId) {
        Set<String> recipients = new HashSet<>();
        String agentUser = userByAgent.get(agentId);
        if (agentUser != null) {
            recipients.add(agentUser);
        }
        ActiveShift shift = shiftByAgent.get(agentId);
        if (shift != null) {
            recipients.addAll(supervisorsBySite.getOrDefault(shift.siteId(), Set.of()));
        }
        return Set.copyOf(recipients);
    }

    private Set<String> usersWithRole(Role... roles) {
        Set<Role> wanted = Set.of(roles);
        return rolesByUser.entrySet().stream()
                .filter(entry -> wanted.contains(entry.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }
}
