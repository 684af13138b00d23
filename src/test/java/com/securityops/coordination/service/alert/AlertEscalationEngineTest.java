package com.securityops.coordination.service.alert;

import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.config.CoordinationProperties.Escalation.Tier;
import com.securityops.coordination.directory.ActiveShift;
import com.securityops.coordination.directory.InMemoryDirectoryService;
import com.securityops.coordination.dto.AlertEventKind;
import com.securityops.coordination.dto.AlertEventRecord;
import com.securityops.coordination.dto.AlertPriority;
import com.securityops.coordination.dto.AlertSource;
import com.securityops.coordination.dto.AlertStatus;
import com.securityops.coordination.dto.AlertType;
import com.securityops.coordination.dto.CreateAlertRequest;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.GeoPoint;
import com.securityops.coordination.dto.GeofenceViolationRecord;
import com.securityops.coordination.dto.LocationSample;
import com.securityops.coordination.dto.OutboundEvent;
import com.securityops.coordination.dto.ResolutionOutcome;
import com.securityops.coordination.dto.SampleStatus;
import com.securityops.coordination.dto.ViolationSeverity;
import com.securityops.coordination.exception.AlertNotFoundException;
import com.securityops.coordination.exception.ValidationException;
import com.securityops.coordination.service.audit.AuditSink;
import com.securityops.coordination.service.audit.AuditTrailService;
import com.securityops.coordination.service.broadcast.BroadcastRouter;
import com.securityops.coordination.service.location.GeofenceViolationDetectedEvent;
import com.securityops.coordination.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AlertEscalationEngineTest {

    private static final Instant T0 = Instant.parse("2024-06-03T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final CoordinationProperties properties = new CoordinationProperties();
    private final List<PendingTimer> timers = new CopyOnWriteArrayList<>();

    private BroadcastRouter router;
    private AuditTrailService auditTrail;
    private AuditSink auditSink;
    private InMemoryDirectoryService directory;
    private AlertEscalationEngine engine;

    @BeforeEach
    void setUp() {
        router = mock(BroadcastRouter.class);
        auditTrail = mock(AuditTrailService.class);
        auditSink = mock(AuditSink.class);

        directory = new InMemoryDirectoryService();
        directory.registerAgent("AG-1", "u-agent");
        directory.assignShift(new ActiveShift("SH-1", "AG-1", "S1", null, 7L, T0.minus(Duration.ofHours(2)), null));

        TaskScheduler scheduler = mock(TaskScheduler.class);
        when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            PendingTimer timer = new PendingTimer(invocation.getArgument(0), invocation.getArgument(1));
            timers.add(timer);
            return timer;
        });

        engine = new AlertEscalationEngine(router, auditTrail, auditSink, directory, scheduler, properties, clock);
        engine.validateTiers();
    }

    @Test
    void medicalAlertEscalatesOnScheduleUntilAcknowledged() {
        EmergencyAlertView created = engine.createAlert(request(AlertType.MEDICAL, null));

        assertThat(created.priority()).isEqualTo(AlertPriority.HIGH);
        assertThat(created.status()).isEqualTo(AlertStatus.OPEN);
        assertThat(created.escalationLevel()).isZero();
        assertThat(created.siteId()).isEqualTo("S1");
        assertThat(timers).singleElement().extracting(PendingTimer::at).isEqualTo(T0.plus(Duration.ofMinutes(5)));

        clock.set(T0.plus(Duration.ofMinutes(5)));
        fireLast();
        assertThat(engine.getAlert(created.id()).escalationLevel()).isEqualTo(1);
        assertThat(lastTimer().at()).isEqualTo(T0.plus(Duration.ofMinutes(15)));

        clock.set(T0.plus(Duration.ofMinutes(15)));
        fireLast();
        assertThat(engine.getAlert(created.id()).escalationLevel()).isEqualTo(2);
        assertThat(timers).hasSize(2);

        clock.set(T0.plus(Duration.ofMinutes(20)));
        EmergencyAlertView acknowledged = engine.acknowledge(created.id(), "u-sup");

        assertThat(acknowledged.status()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acknowledged.escalationLevel()).isEqualTo(2);
        assertThat(acknowledged.acknowledgments()).singleElement().satisfies(ack -> {
            assertThat(ack.userId()).isEqualTo("u-sup");
            assertThat(ack.acknowledgedAt()).isEqualTo(T0.plus(Duration.ofMinutes(20)));
        });

        List<AlertEventRecord> events = recordedEvents();
        assertThat(events).extracting(AlertEventRecord::kind).containsExactly(
                AlertEventKind.CREATED, AlertEventKind.ESCALATED, AlertEventKind.ESCALATED, AlertEventKind.ACKNOWLEDGED);
        assertThat(events).extracting(AlertEventRecord::sequence).containsExactly(1L, 2L, 3L, 4L);
        assertThat(events.get(1).fromLevel()).isZero();
        assertThat(events.get(2).toLevel()).isEqualTo(2);
        assertThat(events.get(2).actor()).isEqualTo(AlertEventRecord.SYSTEM_ACTOR);
        assertThat(events.get(3).actor()).isEqualTo("u-sup");
    }

    @Test
    void escalationNotifiesTheUnionOfTierRooms() {
        engine.createAlert(request(AlertType.MEDICAL, null));
        clock.set(T0.plus(Duration.ofMinutes(5)));
        fireLast();
        clock.set(T0.plus(Duration.ofMinutes(15)));
        fireLast();

        ArgumentCaptor<Collection<String>> rooms = roomsCaptor();
        ArgumentCaptor<OutboundEvent> published = ArgumentCaptor.forClass(OutboundEvent.class);
        verify(router, org.mockito.Mockito.times(3)).publish(rooms.capture(), published.capture());

        assertThat(published.getAllValues()).extracting(OutboundEvent::type).containsExactly(
                OutboundEvent.ALERT_CREATED, OutboundEvent.ALERT_ESCALATED, OutboundEvent.ALERT_ESCALATED);
        assertThat(rooms.getAllValues().get(0)).containsExactlyInAnyOrder("site:S1", "monitoring");
        assertThat(rooms.getAllValues().get(1)).containsExactlyInAnyOrder("site:S1", "role:SUPERVISOR", "monitoring");
        assertThat(rooms.getAllValues().get(2))
                .containsExactlyInAnyOrder("site:S1", "role:SUPERVISOR", "role:ADMIN", "monitoring");
    }

    @Test
    void acknowledgeCancelsPendingEscalation() {
        EmergencyAlertView created = engine.createAlert(request(AlertType.PANIC, null));
        PendingTimer timer = lastTimer();

        clock.set(T0.plus(Duration.ofMinutes(2)));
        engine.acknowledge(created.id(), "u-sup");

        assertThat(timer.isCancelled()).isTrue();
        assertThat(engine.hasPendingTimer(created.id())).isFalse();

        clock.set(T0.plus(Duration.ofMinutes(5)));
        timer.task().run();

        EmergencyAlertView current = engine.getAlert(created.id());
        assertThat(current.status()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(current.escalationLevel()).isZero();
        assertThat(recordedEvents()).extracting(AlertEventRecord::kind)
                .containsExactly(AlertEventKind.CREATED, AlertEventKind.ACKNOWLEDGED);
    }

    @Test
    void repeatedAcknowledgeIsANoOp() {
        EmergencyAlertView created = engine.createAlert(request(AlertType.FIRE, null));

        EmergencyAlertView first = engine.acknowledge(created.id(), "u-sup");
        EmergencyAlertView second = engine.acknowledge(created.id(), "u-admin");

        assertThat(second).isEqualTo(first);
        assertThat(second.acknowledgments()).hasSize(1);
    }

    @Test
    void resolveIsIdempotent() {
        EmergencyAlertView created = engine.createAlert(request(AlertType.SECURITY, null));
        clock.advance(Duration.ofMinutes(1));

        EmergencyAlertView first = engine.resolve(created.id(), "u-sup", "Door was left open", ResolutionOutcome.FALSE_ALARM);
        clock.advance(Duration.ofMinutes(1));
        EmergencyAlertView second = engine.resolve(created.id(), "u-admin", "again", ResolutionOutcome.RESOLVED);
        EmergencyAlertView afterAck = engine.acknowledge(created.id(), "u-admin");

        assertThat(first.status()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(first.resolution().outcome()).isEqualTo(ResolutionOutcome.FALSE_ALARM);
        assertThat(second).isEqualTo(first);
        assertThat(afterAck).isEqualTo(first);
        assertThat(recordedEvents()).extracting(AlertEventRecord::kind)
                .containsExactly(AlertEventKind.CREATED, AlertEventKind.RESOLVED);
        assertThat(engine.activeAlerts()).isEmpty();
    }

    @Test
    void acknowledgedAlertCanStillBeResolved() {
        EmergencyAlertView created = engine.createAlert(request(AlertType.MEDICAL, null));
        engine.acknowledge(created.id(), "u-sup");

        EmergencyAlertView resolved = engine.resolve(created.id(), "u-sup", null, null);

        assertThat(resolved.status()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(resolved.acknowledgments()).hasSize(1);
        assertThat(resolved.resolution().outcome()).isEqualTo(ResolutionOutcome.RESOLVED);
    }

    @Test
    void timerFiringConcurrentlyWithAcknowledgeNeverEscalatesAnAcknowledgedAlert() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 200; i++) {
                EmergencyAlertView alert = engine.createAlert(request(AlertType.PANIC, null));
                PendingTimer timer = lastTimer();
                CountDownLatch start = new CountDownLatch(1);

                Future<Boolean> fired = pool.submit(() -> {
                    start.await();
                    return engine.escalate(alert.id(), 0);
                });
                Future<EmergencyAlertView> acked = pool.submit(() -> {
                    start.await();
                    return engine.acknowledge(alert.id(), "u-sup");
                });
                start.countDown();

                boolean escalated = fired.get(5, TimeUnit.SECONDS);
                EmergencyAlertView acknowledged = acked.get(5, TimeUnit.SECONDS);
                EmergencyAlertView finalState = engine.getAlert(alert.id());

                int expectedLevel = escalated ? 1 : 0;
                assertThat(acknowledged.status()).isEqualTo(AlertStatus.ACKNOWLEDGED);
                assertThat(acknowledged.escalationLevel()).isEqualTo(expectedLevel);
                assertThat(finalState.status()).isEqualTo(AlertStatus.ACKNOWLEDGED);
                assertThat(finalState.escalationLevel()).isEqualTo(expectedLevel);
                assertThat(engine.hasPendingTimer(alert.id())).isFalse();
                if (!escalated) {
                    assertThat(timer.isCancelled()).isTrue();
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void nonLifeSafetyAlertUsesDefaultOrRequestedPriority() {
        EmergencyAlertView general = engine.createAlert(request(AlertType.GENERAL, null));
        EmergencyAlertView security = engine.createAlert(request(AlertType.SECURITY, AlertPriority.HIGH));
        EmergencyAlertView panic = engine.createAlert(request(AlertType.PANIC, AlertPriority.LOW));

        assertThat(general.priority()).isEqualTo(AlertPriority.NORMAL);
        assertThat(security.priority()).isEqualTo(AlertPriority.HIGH);
        assertThat(panic.priority()).isEqualTo(AlertPriority.HIGH);
        assertThat(engine.roomsFor(general)).containsExactly("site:S1");
    }

    @Test
    void activeAlertsListHighPriorityFirstThenNewest() {
        EmergencyAlertView general = engine.createAlert(request(AlertType.GENERAL, null));
        clock.advance(Duration.ofSeconds(1));
        EmergencyAlertView medical = engine.createAlert(request(AlertType.MEDICAL, null));
        clock.advance(Duration.ofSeconds(1));
        EmergencyAlertView panic = engine.createAlert(request(AlertType.PANIC, null));

        assertThat(engine.activeAlerts()).extracting(EmergencyAlertView::id)
                .containsExactly(panic.id(), medical.id(), general.id());
    }

    @Test
    void unknownAgentIsRejected() {
        CreateAlertRequest request = new CreateAlertRequest(AlertType.PANIC, "AG-404", null, null, null, null, null);

        assertThatThrownBy(() -> engine.createAlert(request)).isInstanceOf(ValidationException.class);
        verify(router, never()).publish(any(Collection.class), any(OutboundEvent.class));
    }

    @Test
    void unknownAlertIsNotFound() {
        assertThatThrownBy(() -> engine.acknowledge("missing", "u-sup")).isInstanceOf(AlertNotFoundException.class);
        assertThatThrownBy(() -> engine.getAlert("missing")).isInstanceOf(AlertNotFoundException.class);
    }

    @Test
    void storedAlertIsFoundAfterEviction() {
        EmergencyAlertView created = engine.createAlert(request(AlertType.GENERAL, null));
        EmergencyAlertView resolved = engine.resolve(created.id(), "u-sup", "done", ResolutionOutcome.RESOLVED);
        when(auditSink.findAlert(created.id())).thenReturn(Optional.of(resolved));

        clock.advance(Duration.ofMinutes(30));
        assertThat(engine.sweepClosedAlerts()).isZero();
        clock.advance(Duration.ofMinutes(31));
        assertThat(engine.sweepClosedAlerts()).isEqualTo(1);

        assertThat(engine.getAlert(created.id())).isEqualTo(resolved);
        assertThat(engine.resolve(created.id(), "u-sup", "done", ResolutionOutcome.RESOLVED)).isEqualTo(resolved);
    }

    @Test
    void violationAboveThresholdRaisesSystemAlert() {
        engine.onGeofenceViolation(violation(ViolationSeverity.MEDIUM, 80.0));

        assertThat(engine.activeAlerts()).singleElement().satisfies(alert -> {
            assertThat(alert.type()).isEqualTo(AlertType.SECURITY);
            assertThat(alert.source()).isEqualTo(AlertSource.GEOFENCE_VIOLATION);
            assertThat(alert.siteId()).isEqualTo("S1");
            assertThat(alert.location().accuracy()).isEqualTo(5.0);
        });
        assertThat(recordedEvents()).singleElement()
                .extracting(AlertEventRecord::actor)
                .isEqualTo(AlertEventRecord.SYSTEM_ACTOR);
    }

    @Test
    void violationBelowThresholdIsIgnored() {
        properties.getGeofence().setAlertMinSeverity(ViolationSeverity.HIGH);

        engine.onGeofenceViolation(violation(ViolationSeverity.MEDIUM, 80.0));

        assertThat(engine.activeAlerts()).isEmpty();
    }

    @Test
    void recoveryRearmsTimersOfOpenAlerts() {
        Instant createdAt = T0.minus(Duration.ofMinutes(20));
        EmergencyAlertView open = new EmergencyAlertView("A-1", AlertType.PANIC, AlertPriority.HIGH,
                AlertSource.AGENT_TRIGGER, "AG-1", "S1", null, null, AlertStatus.OPEN, 0,
                List.of(), null, createdAt, createdAt, 1L);
        EmergencyAlertView acknowledged = new EmergencyAlertView("A-2", AlertType.GENERAL, AlertPriority.NORMAL,
                AlertSource.MANUAL_REPORT, "AG-1", "S1", null, null, AlertStatus.ACKNOWLEDGED, 1,
                List.of(), null, createdAt, createdAt, 3L);
        when(auditSink.loadOpenAlerts()).thenReturn(List.of(open, acknowledged));

        int recovered = engine.recoverOpenAlerts();

        assertThat(recovered).isEqualTo(2);
        assertThat(timers).singleElement().extracting(PendingTimer::at).isEqualTo(createdAt.plus(Duration.ofMinutes(5)));

        fireLast();
        assertThat(engine.getAlert("A-1").escalationLevel()).isEqualTo(1);
        assertThat(lastTimer().at()).isEqualTo(createdAt.plus(Duration.ofMinutes(15)));
    }

    @Test
    void tiersWithGapsAreRejected() {
        properties.getEscalation().setTiers(new ArrayList<>(List.of(
                new Tier(0, Duration.ZERO, List.of("site:{siteId}")),
                new Tier(2, Duration.ofMinutes(5), List.of("role:ADMIN")))));

        assertThatThrownBy(() -> engine.validateTiers()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tiersReachedOutOfOrderAreRejected() {
        properties.getEscalation().setTiers(new ArrayList<>(List.of(
                new Tier(0, Duration.ZERO, List.of("site:{siteId}")),
                new Tier(1, Duration.ofMinutes(10), List.of("role:SUPERVISOR")),
                new Tier(2, Duration.ofMinutes(5), List.of("role:ADMIN")))));

        assertThatThrownBy(() -> engine.validateTiers()).isInstanceOf(IllegalStateException.class);
    }

    private CreateAlertRequest request(AlertType type, AlertPriority priority) {
        return new CreateAlertRequest(type, "AG-1", null, new GeoPoint(40.7128, -74.0060, 5.0),
                "test alert", priority, AlertSource.AGENT_TRIGGER);
    }

    private GeofenceViolationDetectedEvent violation(ViolationSeverity severity, double distance) {
        LocationSample sample = new LocationSample("AG-1", "S1", "SH-1", 40.714, -74.006, 5.0,
                null, null, null, T0, T0, SampleStatus.ACTIVE);
        GeofenceViolationRecord record = new GeofenceViolationRecord("AG-1_1", "AG-1", "S1", 7L, "HQ",
                40.714, -74.006, distance, severity, T0);
        return new GeofenceViolationDetectedEvent(record, sample);
    }

    private List<AlertEventRecord> recordedEvents() {
        ArgumentCaptor<AlertEventRecord> captor = ArgumentCaptor.forClass(AlertEventRecord.class);
        verify(auditTrail, org.mockito.Mockito.atLeast(0)).recordAlertTransition(any(), captor.capture());
        return captor.getAllValues();
    }

    private PendingTimer lastTimer() {
        return timers.get(timers.size() - 1);
    }

    private void fireLast() {
        lastTimer().task().run();
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<Collection<String>> roomsCaptor() {
        return ArgumentCaptor.forClass(Collection.class);
    }

    /**
     * Timer handed out by the mocked scheduler; the test decides when it runs.
     */
    private static final class PendingTimer implements ScheduledFuture<Object> {

        private final Runnable task;
        private final Instant at;
        private volatile boolean cancelled;

        PendingTimer(Runnable task, Instant at) {
            this.task = task;
            this.at = at;
        }

        Runnable task() {
            return task;
        }

        Instant at() {
            return at;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return 0;
        }

        @Override
        public int compareTo(Delayed other) {
            return 0;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
