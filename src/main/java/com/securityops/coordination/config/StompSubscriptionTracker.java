package com.securityops.coordination.config;

import com.securityops.coordination.service.registry.SessionReadyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHandler;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.simp.user.UserDestinationMessageHandler;
import org.springframework.messaging.support.ExecutorChannelInterceptor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Knows which sessions are subscribed to their event queue.
 *
 * A session is only marked once the user-destination handler has passed its SUBSCRIBE on to
 * the broker, so an event sent after {@link SessionReadyEvent} is guaranteed a subscriber.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompSubscriptionTracker implements ExecutorChannelInterceptor {

    public static final String USER_EVENTS_DESTINATION = "/user/queue/events";

    private final ApplicationEventPublisher eventPublisher;

    // sessionId -> STOMP subscription id of the event queue
    private final Map<String, String> subscriptions = new ConcurrentHashMap<>();

    public boolean isSubscribed(String sessionId) {
        return subscriptions.containsKey(sessionId);
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        String sessionId = accessor.getSessionId();
        if (sessionId == null) {
            return message;
        }
        if (StompCommand.UNSUBSCRIBE.equals(accessor.getCommand())
                && accessor.getSubscriptionId() != null
                && subscriptions.remove(sessionId, accessor.getSubscriptionId())) {
            log.debug("Session {} unsubscribed from its event queue", sessionId);
        } else if (StompCommand.DISCONNECT.equals(accessor.getCommand())) {
            subscriptions.remove(sessionId);
        }
        return message;
    }

    @Override
    public void afterMessageHandled(Message<?> message, MessageChannel channel, MessageHandler handler, Exception ex) {
        if (ex != null || !(handler instanceof UserDestinationMessageHandler)) {
            return;
        }
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        if (!StompCommand.SUBSCRIBE.equals(accessor.getCommand())
                || !USER_EVENTS_DESTINATION.equals(accessor.getDestination())) {
            return;
        }
        String sessionId = accessor.getSessionId();
        Principal user = accessor.getUser();
        if (sessionId == null || user == null) {
            return;
        }
        subscriptions.put(sessionId, accessor.getSubscriptionId());
        log.debug("Session {} of {} subscribed to its event queue", sessionId, user.getName());
        eventPublisher.publishEvent(new SessionReadyEvent(user.getName(), sessionId));
    }

    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        subscriptions.remove(event.getSessionId());
    }
}
