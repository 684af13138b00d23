package com.securityops.coordination.service.registry;

import com.securityops.coordination.dto.Role;
import com.securityops.coordination.exception.ValidationException;

/**
 * Room naming scheme shared by the registry, the router and the escalation tiers.
 *
 * <pre>
 * monitoring          all-site monitoring feed
 * site:{siteId}       site feed (supervisors, and the site's client)
 * agent:{agentId}     per-agent channel
 * client:{clientId}   client-scoped feed
 * user:{userId}       private room of a user, joined automatically
 * role:{ROLE}         everyone with a role, joined automatically
 * </pre>
 */
public final class RoomIds {

    public static final String MONITORING = "monitoring";
    public static final String SITE_PREFIX = "site:";
    public static final String AGENT_PREFIX = "agent:";
    public static final String CLIENT_PREFIX = "client:";
    public static final String USER_PREFIX = "user:";
    public static final String ROLE_PREFIX = "role:";

    private static final String JOIN = "join:";
    private static final String LEAVE = "leave:";

    private RoomIds() {
    }

    public static String site(String siteId) {
        return SITE_PREFIX + siteId;
    }

    public static String agent(String agentId) {
        return AGENT_PREFIX + agentId;
    }

    public static String client(String clientId) {
        return CLIENT_PREFIX + clientId;
    }

    public static String user(String userId) {
        return USER_PREFIX + userId;
    }

    public static String role(Role role) {
        return ROLE_PREFIX + role.name();
    }

    /**
     * Returns the id part of a prefixed room, e.g. {@code idOf("site:S1", SITE_PREFIX) -> "S1"},
     * or null if the room does not carry that prefix.
     */
    public static String idOf(String roomId, String prefix) {
        if (roomId == null || !roomId.startsWith(prefix) || roomId.length() == prefix.length()) {
            return null;
        }
        return roomId.substring(prefix.length());
    }

    public static boolean isValid(String roomId) {
        if (MONITORING.equals(roomId)) {
            return true;
        }
        for (String prefix : new String[]{SITE_PREFIX, AGENT_PREFIX, CLIENT_PREFIX, USER_PREFIX, ROLE_PREFIX}) {
            if (idOf(roomId, prefix) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses a room subscription message such as {@code join:site:S1} or {@code leave:monitoring}.
     */
    public static Subscription parseSubscription(String message) {
        if (message != null) {
            String trimmed = message.trim();
            if (trimmed.startsWith(JOIN)) {
                return new Subscription(true, validated(trimmed.substring(JOIN.length())));
            }
            if (trimmed.startsWith(LEAVE)) {
                return new Subscription(false, validated(trimmed.substring(LEAVE.length())));
            }
        }
        throw new ValidationException("Unrecognised room subscription message: " + message);
    }

    private static String validated(String roomId) {
        if (!isValid(roomId)) {
            throw new ValidationException("Unknown room: " + roomId);
        }
        return roomId;
    }

    public record Subscription(boolean join, String roomId) {
    }
}
