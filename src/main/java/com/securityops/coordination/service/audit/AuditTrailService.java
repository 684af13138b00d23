package com.securityops.coordination.service.audit;

import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.dto.AlertEventRecord;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.GeofenceViolationRecord;
import com.securityops.coordination.dto.LocationSample;
import com.securityops.coordination.exception.PersistenceException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Writes the audit trail off the hot path.
 *
 * Every write runs on the audit executor and is retried with exponential back-off
 * (resilience4j). Ingest and alert transitions never wait for the store: they fire the write
 * and move on. When the retries run out the failure is logged as a PersistenceError and the
 * returned future completes with a {@link PersistenceException}; callers may ignore it.
 *
 * Retried writes are safe because every {@link AuditSink} write is idempotent.
 */
@Service
@Slf4j
public class AuditTrailService {

    private final AuditSink auditSink;
    private final ScheduledExecutorService auditExecutor;
    private final Retry retry;

    public AuditTrailService(
            AuditSink auditSink,
            @Qualifier("auditExecutor") ScheduledExecutorService auditExecutor,
            CoordinationProperties properties) {
        this.auditSink = auditSink;
        this.auditExecutor = auditExecutor;

        CoordinationProperties.Audit audit = properties.getAudit();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(audit.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        audit.getInitialBackoff(), audit.getBackoffMultiplier()))
                .build();
        this.retry = Retry.of("audit-sink", config);
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("Audit write failed (attempt {}), retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()));
    }

    public CompletableFuture<Void> recordSample(LocationSample sample) {
        return submit("location sample " + sample.toLogString(), () -> auditSink.appendLocationSample(sample));
    }

    public CompletableFuture<Void> recordViolation(GeofenceViolationRecord violation) {
        return submit("violation " + violation.violationId(), () -> auditSink.appendViolation(violation));
    }

    /**
     * Stores the alert snapshot together with the transition that produced it.
     */
    public CompletableFuture<Void> recordAlertTransition(EmergencyAlertView alert, AlertEventRecord event) {
        return submit(
                String.format("alert %s transition %s#%d", alert.id(), event.kind(), event.sequence()),
                () -> {
                    auditSink.saveAlert(alert);
                    auditSink.appendAlertEvent(event);
                });
    }

    private CompletableFuture<Void> submit(String description, Runnable write) {
        Supplier<CompletionStage<Void>> attempt = () -> CompletableFuture.runAsync(write, auditExecutor);

        return Retry.decorateCompletionStage(retry, auditExecutor, attempt)
                .get()
                .toCompletableFuture()
                .handle((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        log.error("PersistenceError: {} not stored after {} attempts",
                                description, retry.getRetryConfig().getMaxAttempts(), cause);
                        throw new PersistenceException("Failed to persist " + description, cause);
                    }
                    log.debug("Persisted {}", description);
                    return null;
                });
    }
}
