package com.securityops.coordination.service.registry;

/**
 * A session has subscribed to its event queue and can now receive pushed events.
 */
public record SessionReadyEvent(String userId, String sessionId) {
}
