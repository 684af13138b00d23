package com.securityops.coordination.controller;

import com.securityops.coordination.dto.AlertActionMessage;
import com.securityops.coordination.dto.CreateAlertRequest;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.IngestResult;
import com.securityops.coordination.dto.LocationSampleRecord;
import com.securityops.coordination.dto.Role;
import com.securityops.coordination.exception.AuthenticationException;
import com.securityops.coordination.exception.CoordinationException;
import com.securityops.coordination.exception.ValidationException;
import com.securityops.coordination.service.alert.AlertEscalationEngine;
import com.securityops.coordination.service.location.LocationIngestService;
import com.securityops.coordination.service.registry.ConnectionRegistry;
import com.securityops.coordination.service.registry.RoomIds;
import com.securityops.coordination.service.registry.SessionHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * WebSocket controller for agent devices and supervisor consoles.
 *
 * Message Flow:
 * 1. Client connects to /ws/coordination with an Authorization header
 * 2. Client subscribes to /user/queue/events (room events), /user/queue/reply and /user/queue/errors
 * 3. Commands are sent to /app/*; the acting user and agent always come from the session
 * 4. The result of a command goes back to the originating session on /user/queue/reply,
 *    a rejected command on /user/queue/errors
 *
 * Destinations:
 * - /app/location: location sample from an agent device
 * - /app/alert: agent-triggered emergency alert
 * - /app/alert/acknowledge, /app/alert/resolve: alert actions
 * - /app/rooms: "join:site:S1", "leave:monitoring", ...
 * - /app/ping: liveness check
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class CoordinationStreamingController {

    private final LocationIngestService ingestService;
    private final AlertEscalationEngine alertEngine;
    private final ConnectionRegistry connectionRegistry;
    private final Clock clock;

    /**
     * Handle incoming location samples from agent devices.
     */
    @MessageMapping("/location")
    @SendToUser(destinations = "/queue/reply", broadcast = false)
    public Map<String, Object> handleLocation(
            @Payload LocationSampleRecord sample,
            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        SessionHandle session = requireSession(sessionId);
        if (session.role() != Role.AGENT || session.agentId() == null) {
            throw new ValidationException("Only agent sessions can report locations");
        }

        IngestResult result = ingestService.ingest(session.agentId(), sample);

        Map<String, Object> ack = reply("LOCATION_ACK");
        ack.put("accepted", result.accepted());
        if (result.accepted()) {
            ack.put("status", result.sample().status());
            ack.put("violation", result.hasViolation());
        } else {
            ack.put("rejectionReason", result.rejectionReason());
        }
        return ack;
    }

    /**
     * Agent-triggered alert (panic button and similar). The origin agent is the session's agent.
     */
    @MessageMapping("/alert")
    @SendToUser(destinations = "/queue/reply", broadcast = false)
    public Map<String, Object> handleAlert(
            @Payload CreateAlertRequest request,
            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        SessionHandle session = requireSession(sessionId);
        if (session.agentId() == null) {
            throw new ValidationException("Only agent sessions can trigger alerts");
        }
        if (request.type() == null) {
            throw new ValidationException("Alert type is required");
        }

        EmergencyAlertView alert = alertEngine.createAlert(new CreateAlertRequest(
                request.type(),
                session.agentId(),
                request.siteId(),
                request.location(),
                request.description(),
                request.priority(),
                request.sourceOrDefault()
        ));
        log.info("Agent {} triggered {} alert {}", session.agentId(), alert.type(), alert.id());

        Map<String, Object> ack = reply("ALERT_ACK");
        ack.put("alert", alert);
        return ack;
    }

    @MessageMapping("/alert/acknowledge")
    @SendToUser(destinations = "/queue/reply", broadcast = false)
    public Map<String, Object> handleAcknowledge(
            @Payload AlertActionMessage message,
            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        SessionHandle session = requireSession(sessionId);
        EmergencyAlertView alert = alertEngine.acknowledge(requireAlertId(message), session.userId());

        Map<String, Object> ack = reply("ALERT_ACTION_ACK");
        ack.put("alert", alert);
        return ack;
    }

    @MessageMapping("/alert/resolve")
    @SendToUser(destinations = "/queue/reply", broadcast = false)
    public Map<String, Object> handleResolve(
            @Payload AlertActionMessage message,
            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        SessionHandle session = requireSession(sessionId);
        EmergencyAlertView alert = alertEngine.resolve(
                requireAlertId(message), session.userId(), message.notes(), message.outcome());

        Map<String, Object> ack = reply("ALERT_ACTION_ACK");
        ack.put("alert", alert);
        return ack;
    }

    /**
     * Room subscription messages, e.g. {@code join:site:S1} or {@code leave:monitoring}.
     */
    @MessageMapping("/rooms")
    @SendToUser(destinations = "/queue/reply", broadcast = false)
    public Map<String, Object> handleRoomSubscription(
            @Payload String message,
            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        SessionHandle session = requireSession(sessionId);
        RoomIds.Subscription subscription = RoomIds.parseSubscription(message);

        SessionHandle updated = subscription.join()
                ? connectionRegistry.joinRoom(session, subscription.roomId())
                : connectionRegistry.leaveRoom(session, subscription.roomId());

        Map<String, Object> ack = reply(subscription.join() ? "JOINED" : "LEFT");
        ack.put("room", subscription.roomId());
        ack.put("rooms", new TreeSet<>(updated.rooms()));
        return ack;
    }

    /**
     * Health check for WebSocket connection.
     * Client sends ping, server responds with pong.
     */
    @MessageMapping("/ping")
    @SendToUser(destinations = "/queue/reply", broadcast = false)
    public Map<String, Object> handlePing(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        log.debug("Ping received from session {}", sessionId);
        Map<String, Object> pong = reply("PONG");
        pong.put("status", "OK");
        return pong;
    }

    @MessageExceptionHandler(CoordinationException.class)
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public Map<String, Object> handleCoordinationError(CoordinationException e) {
        log.warn("STOMP command rejected: {}", e.getMessage());
        Map<String, Object> error = reply("ERROR");
        error.put("error", e.getClass().getSimpleName());
        error.put("message", e.getMessage());
        return error;
    }

    @MessageExceptionHandler(Exception.class)
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public Map<String, Object> handleUnexpectedError(Exception e) {
        log.error("Error processing STOMP command: {}", e.getMessage(), e);
        Map<String, Object> error = reply("ERROR");
        error.put("message", "Failed to process command");
        return error;
    }

    private SessionHandle requireSession(String sessionId) {
        return connectionRegistry.find(sessionId)
                .orElseThrow(() -> new AuthenticationException("Session is not registered: " + sessionId));
    }

    private static String requireAlertId(AlertActionMessage message) {
        if (message == null || message.alertId() == null || message.alertId().isBlank()) {
            throw new ValidationException("Alert ID is required");
        }
        return message.alertId();
    }

    private Map<String, Object> reply(String type) {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("type", type);
        reply.put("timestamp", clock.instant().toString());
        return reply;
    }
}
