package com.securityops.coordination.service.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Removes sessions from the registry when the WebSocket closes, whether the client sent
 * DISCONNECT or the transport dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleListener {

    private final ConnectionRegistry connectionRegistry;

    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        log.debug("WebSocket session {} closed with status {}", event.getSessionId(), event.getCloseStatus());
        connectionRegistry.disconnect(event.getSessionId(), DisconnectReason.EXPLICIT);
    }
}
