package com.securityops.coordination.directory;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Directory collaborator: agents, shifts, sites and who is expected to listen in each room.
 */
public interface DirectoryService {

    boolean isKnownAgent(String agentId);

    /**
     * Resolves agent → in-progress shift → site → geofence at the given instant.
     */
    Optional<ActiveShift> findActiveShift(String agentId, Instant at);

    /**
     * User ids that are valid members of a room whether or not they are connected.
     * The broadcast router queues events for the ones that are offline.
     */
    Set<String> recipientsForRoom(String roomId);

    Optional<String> clientIdForSite(String siteId);
}
