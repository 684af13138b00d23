package com.securityops.coordination.config;

import com.securityops.coordination.exception.AuthenticationException;
import com.securityops.coordination.service.registry.ConnectionRegistry;
import com.securityops.coordination.service.registry.SessionHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

/**
 * Authenticates STOMP sessions.
 *
 * CONNECT frames must carry an {@code Authorization} header; the token is handed to the
 * registry, and the resulting session handle becomes the STOMP user. A rejected token fails
 * the CONNECT, which Spring turns into an ERROR frame and closes the socket.
 *
 * Every other inbound frame counts as activity for the idle sweep.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompAuthChannelInterceptor implements ChannelInterceptor {

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private final ConnectionRegistry connectionRegistry;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || accessor.getSessionId() == null) {
            return message;
        }

        if (StompCommand.CONNECT.equals(accessor.getCommand())) {
            String token = accessor.getFirstNativeHeader(AUTHORIZATION_HEADER);
            try {
                SessionHandle handle = connectionRegistry.register(token, accessor.getSessionId());
                accessor.setUser(handle);
            } catch (AuthenticationException e) {
                log.warn("STOMP CONNECT rejected for session {}: {}", accessor.getSessionId(), e.getMessage());
                throw e;
            }
        } else {
            connectionRegistry.touch(accessor.getSessionId());
        }
        return message;
    }
}
