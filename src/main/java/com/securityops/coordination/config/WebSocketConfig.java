package com.securityops.coordination.config;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket configuration for agent devices and supervisor consoles.
 *
 * Architecture:
 * - STOMP over WebSocket, authenticated on CONNECT by {@link StompAuthChannelInterceptor}
 * - In-memory broker; every server push is a per-session user destination
 *
 * Endpoints:
 * - /ws/coordination: connection endpoint (SockJS and native)
 * - /app/*: client commands (/app/location, /app/alert, /app/rooms, ...)
 * - /user/queue/events: room events routed to this session
 * - /user/queue/reply, /user/queue/errors: command results
 */
@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final StompAuthChannelInterceptor stompAuthChannelInterceptor;
    private final StompSubscriptionTracker stompSubscriptionTracker;

    @Value("${coordination.websocket.endpoint:/ws/coordination}")
    private String websocketEndpoint;

    @Value("${coordination.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // Room membership lives in the ConnectionRegistry, so the broker only needs queues
        config.enableSimpleBroker("/queue", "/topic");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(stompAuthChannelInterceptor, stompSubscriptionTracker);
    }
}
