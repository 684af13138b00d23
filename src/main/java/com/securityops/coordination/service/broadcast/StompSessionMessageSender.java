package com.securityops.coordination.service.broadcast;

import com.securityops.coordination.config.StompSubscriptionTracker;
import com.securityops.coordination.dto.OutboundEvent;
import com.securityops.coordination.service.registry.SessionHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes events to {@code /user/queue/events} of one specific STOMP session.
 *
 * The session id header pins the user destination to that session only, so a user logged in
 * on two devices gets the event on each device exactly once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompSessionMessageSender implements SessionMessageSender {

    public static final String EVENTS_DESTINATION = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final StompSubscriptionTracker subscriptionTracker;

    @Override
    public boolean send(SessionHandle session, OutboundEvent event) {
        if (!subscriptionTracker.isSubscribed(session.sessionId())) {
            log.debug("Session {} has no event subscription yet, holding {}", session.sessionId(), event.eventId());
            return false;
        }

        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(session.sessionId());
        headers.setLeaveMutable(true);
        try {
            messagingTemplate.convertAndSendToUser(session.userId(), EVENTS_DESTINATION, event, headers.getMessageHeaders());
            return true;
        } catch (MessagingException e) {
            log.warn("Failed to push {} to session {}: {}", event.eventId(), session.sessionId(), e.getMessage());
            return false;
        }
    }
}
