package com.securityops.coordination.dto;

/**
 * Identity returned by the auth service for a valid session token.
 *
 * @param agentId  Set for AGENT users only
 * @param clientId Set for CLIENT users only
 */
public record AuthenticatedPrincipal(String userId, Role role, String agentId, String clientId) {
}
