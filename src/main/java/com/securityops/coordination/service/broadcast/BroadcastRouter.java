package com.securityops.coordination.service.broadcast;

import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.directory.DirectoryService;
import com.securityops.coordination.dto.EventCategory;
import com.securityops.coordination.dto.OutboundEvent;
import com.securityops.coordination.dto.QueuedMessage;
import com.securityops.coordination.exception.RoutingException;
import com.securityops.coordination.service.registry.ConnectionRegistry;
import com.securityops.coordination.service.registry.PresenceChangedEvent;
import com.securityops.coordination.service.registry.SessionHandle;
import com.securityops.coordination.service.registry.SessionReadyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Fans events out to the users of one or more rooms.
 *
 * Recipients of a publish are the users with live sessions in a target room plus the users the
 * directory expects there. Each recipient is handled once per publish:
 * - live session in a target room: delivered now
 * - not connected at all: queued in the recipient's mailbox, flushed when they come back
 * - connected but not in any target room: skipped (they chose not to subscribe)
 *
 * Ordering: all work for one recipient happens under that recipient's mailbox lock, and new
 * events go behind any backlog, so a recipient sees events in publish order. A queued event
 * leaves the mailbox only once it has been handed to a session, so it is delivered once.
 *
 * Retention: LOCATION events expire after {@code location-retention}, ALERT events after
 * {@code alert-retention}; expired events are dropped on flush and by a scheduled purge.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BroadcastRouter {

    private final ConnectionRegistry connectionRegistry;
    private final DirectoryService directoryService;
    private final SessionMessageSender messageSender;
    private final CoordinationProperties properties;
    private final Clock clock;

    private final Map<String, RecipientMailbox> mailboxes = new ConcurrentHashMap<>();

    public PublishResult publish(String roomId, OutboundEvent event) {
        return publish(List.of(roomId), event);
    }

    public PublishResult publish(Collection<String> roomIds, OutboundEvent event) {
        Map<String, String> roomByRecipient;
        Map<String, Set<SessionHandle>> liveSessionsByRecipient = new LinkedHashMap<>();
        try {
            roomByRecipient = resolveRecipients(roomIds, liveSessionsByRecipient);
        } catch (RoutingException e) {
            log.warn("RoutingError: {} (event {} {})", e.getMessage(), event.type(), event.eventId());
            return PublishResult.none();
        }

        Instant now = clock.instant();
        Set<String> delivered = new LinkedHashSet<>();
        Set<String> queued = new LinkedHashSet<>();

        for (Map.Entry<String, String> entry : roomByRecipient.entrySet()) {
            String recipientId = entry.getKey();
            Set<SessionHandle> targetSessions = liveSessionsByRecipient.getOrDefault(recipientId, Set.of());

            if (targetSessions.isEmpty() && connectionRegistry.isUserOnline(recipientId)) {
                log.debug("Recipient {} is online but not in {}, skipping {}", recipientId, roomIds, event.type());
                continue;
            }

            QueuedMessage message = new QueuedMessage(recipientId, entry.getValue(), event, now, 0);
            boolean deliveredNow = withMailbox(recipientId, mailbox -> dispatch(mailbox, message, targetSessions));
            (deliveredNow ? delivered : queued).add(recipientId);
        }

        log.debug("Published {} to {}: delivered={}, queued={}", event.type(), roomIds, delivered.size(), queued.size());
        return new PublishResult(delivered, queued);
    }

    /**
     * Delivers a recipient's backlog, in order, to their live sessions.
     *
     * @return number of queued events delivered
     */
    public int flush(String recipientId) {
        if (!mailboxes.containsKey(recipientId)) {
            return 0;
        }
        return withMailbox(recipientId, mailbox -> drain(mailbox, connectionRegistry.sessionsOf(recipientId), clock.instant()));
    }

    @EventListener
    public void onPresenceChanged(PresenceChangedEvent event) {
        if (event.isOnline()) {
            int flushed = flush(event.userId());
            if (flushed > 0) {
                log.info("Delivered {} queued events to {} (session {})", flushed, event.userId(), event.sessionId());
            }
        }
    }

    @EventListener
    public void onSessionReady(SessionReadyEvent event) {
        int flushed = flush(event.userId());
        if (flushed > 0) {
            log.info("Delivered {} queued events to {} after subscribe (session {})",
                flushed, event.userId(), event.sessionId());
        }
    }

    public int queuedFor(String recipientId) {
        RecipientMailbox mailbox = mailboxes.get(recipientId);
        if (mailbox == null) {
            return 0;
        }
        mailbox.lock();
        try {
            return mailbox.size();
        } finally {
            mailbox.unlock();
        }
    }

    public int totalQueued() {
        return mailboxes.keySet().stream().mapToInt(this::queuedFor).sum();
    }

    /**
     * Drops queued events that outlived their retention window.
     */
    @Scheduled(fixedDelayString = "${coordination.broadcast.purge-interval:PT10M}")
    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        for (String recipientId : new HashSet<>(mailboxes.keySet())) {
            purged += withMailbox(recipientId, mailbox -> dropExpired(mailbox, now));
        }
        if (purged > 0) {
            log.info("Purged {} expired queued events", purged);
        }
        return purged;
    }

    private Map<String, String> resolveRecipients(
            Collection<String> roomIds,
            Map<String, Set<SessionHandle>> liveSessionsByRecipient) {
        Map<String, String> roomByRecipient = new LinkedHashMap<>();
        for (String roomId : roomIds) {
            for (SessionHandle session : connectionRegistry.route(roomId)) {
                liveSessionsByRecipient.computeIfAbsent(session.userId(), k -> new LinkedHashSet<>()).add(session);
                roomByRecipient.putIfAbsent(session.userId(), roomId);
            }
            for (String userId : directoryService.recipientsForRoom(roomId)) {
                roomByRecipient.putIfAbsent(userId, roomId);
            }
        }
        if (roomByRecipient.isEmpty()) {
            throw new RoutingException("No recipients for rooms " + roomIds);
        }
        return roomByRecipient;
    }

    private boolean dispatch(RecipientMailbox mailbox, QueuedMessage message, Set<SessionHandle> targetSessions) {
        if (targetSessions.isEmpty()) {
            enqueue(mailbox, message);
            return false;
        }
        if (mailbox.hasBacklog()) {
            enqueue(mailbox, message);
            drain(mailbox, connectionRegistry.sessionsOf(mailbox.recipientId()), clock.instant());
            return !mailbox.hasBacklog();
        }
        if (sendToAny(targetSessions, message.event())) {
            return true;
        }
        enqueue(mailbox, message.attempted());
        return false;
    }

    /**
     * Sends queued events in order until the mailbox is empty or a send fails.
     * Must be called with the mailbox lock held.
     */
    private int drain(RecipientMailbox mailbox, Set<SessionHandle> sessions, Instant now) {
        dropExpired(mailbox, now);
        if (sessions.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        while (mailbox.hasBacklog()) {
            QueuedMessage head = mailbox.peek();
            if (!sendToAny(sessions, head.event())) {
                mailbox.replaceHead(head.attempted());
                log.debug("Flush to {} paused after {} events: no session accepted {}",
                    mailbox.recipientId(), delivered, head.event().eventId());
                break;
            }
            mailbox.poll();
            delivered++;
        }
        return delivered;
    }

    private boolean sendToAny(Set<SessionHandle> sessions, OutboundEvent event) {
        boolean delivered = false;
        for (SessionHandle session : sessions) {
            try {
                delivered |= messageSender.send(session, event);
            } catch (RuntimeException e) {
                log.warn("Send of {} to session {} failed: {}", event.eventId(), session.sessionId(), e.getMessage());
            }
        }
        return delivered;
    }

    private void enqueue(RecipientMailbox mailbox, QueuedMessage message) {
        List<QueuedMessage> dropped = mailbox.enqueue(message, properties.getBroadcast().getMaxQueuedPerRecipient());
        for (QueuedMessage oldest : dropped) {
            log.warn("Queue for {} full, dropped oldest {} event {}",
                mailbox.recipientId(), oldest.event().type(), oldest.event().eventId());
        }
    }

    private int dropExpired(RecipientMailbox mailbox, Instant now) {
        List<QueuedMessage> expired = mailbox.removeIf(message -> isExpired(message, now));
        for (QueuedMessage message : expired) {
            log.warn("Dropped expired {} event {} for {} (queued at {})",
                message.event().type(), message.event().eventId(), message.recipientId(), message.enqueuedAt());
        }
        return expired.size();
    }

    private boolean isExpired(QueuedMessage message, Instant now) {
        Duration retention = message.event().category() == EventCategory.ALERT
            ? properties.getBroadcast().getAlertRetention()
            : properties.getBroadcast().getLocationRetention();
        return message.enqueuedAt().plus(retention).isBefore(now);
    }

    /**
     * Runs an action under the recipient's mailbox lock. Empty mailboxes are retired and removed
     * from the index while still locked; a caller that finds a retired mailbox starts over.
     */
    private <T> T withMailbox(String recipientId, Function<RecipientMailbox, T> action) {
        while (true) {
            RecipientMailbox mailbox = mailboxes.computeIfAbsent(recipientId, RecipientMailbox::new);
            mailbox.lock();
            try {
                if (mailbox.isRetired()) {
                    continue;
                }
                T result = action.apply(mailbox);
                if (!mailbox.hasBacklog()) {
                    mailbox.retire();
                    mailboxes.remove(recipientId, mailbox);
                }
                return result;
            } finally {
                mailbox.unlock();
            }
        }
    }
}
