package com.stratus.config.rotation;

import com.stratus.config.audit.AuditAction;
import com.stratus.config.audit.AuditLogService;
import com.stratus.config.error.NotFoundException;
import com.stratus.config.error.ValidationException;
import com.stratus.config.error.Violation;
import com.stratus.config.observability.ConfigEngineMetrics;
import com.stratus.config.secret.Secret;
import com.stratus.config.secret.SecretRepository;
import com.stratus.config.secret.SecretRotationConfig;
import com.stratus.config.secret.SecretsService;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-secret rotation timers and the rotation procedure itself.
 * <p>
 * Each secret has at most one armed timer and at most one rotation in flight. A trigger that
 * arrives while a rotation is running is rejected with {@link RotationInProgressException}.
 * A failed scheduled rotation is audited and the timer is re-armed; only
 * {@link #cancelRotation(String)} removes a schedule.
 */
@Slf4j
public class RotationScheduler {

    private final SecretRepository repository;
    private final SecretsService secretsService;
    private final RotationHandlerRegistry handlers;
    private final AuditLogService auditLog;
    private final ConfigEngineMetrics metrics;
    private final ScheduledExecutorService executor;
    private final Duration intervalUnit;

    private final Map<String, ScheduledRotation> schedules = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public RotationScheduler(SecretRepository repository,
                             SecretsService secretsService,
                             RotationHandlerRegistry handlers,
                             AuditLogService auditLog,
                             ConfigEngineMetrics metrics,
                             int poolSize) {
        this(repository, secretsService, handlers, auditLog, metrics,
                Executors.newScheduledThreadPool(poolSize, rotationThreadFactory()), Duration.ofDays(1));
    }

    /**
     * @param intervalUnit length of one {@link SecretRotationConfig#getInterval()} unit
     */
    RotationScheduler(SecretRepository repository,
                      SecretsService secretsService,
                      RotationHandlerRegistry handlers,
                      AuditLogService auditLog,
                      ConfigEngineMetrics metrics,
                      ScheduledExecutorService executor,
                      Duration intervalUnit) {
        this.repository = repository;
        this.secretsService = secretsService;
        this.handlers = handlers;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.executor = executor;
        this.intervalUnit = intervalUnit;
    }

    // =========================================================================
    // Scheduling
    // =========================================================================

    /**
     * Replace any existing timer for the secret. Configs that are disabled or not auto-rotating
     * leave the secret unscheduled.
     *
     * @throws ValidationException if an auto-rotating config has a non-positive interval
     */
    public void scheduleRotation(String secretId, SecretRotationConfig config) {
        cancelRotation(secretId);
        if (config == null || !config.isEnabled() || !config.isAutoRotate()) {
            return;
        }
        if (config.getInterval() <= 0) {
            throw new ValidationException("Rotation config validation failed",
                    List.of(new Violation("interval", "minimum", "Rotation interval must be at least 1 day")));
        }
        arm(secretId, config, null);
        log.info("Scheduled rotation of secret {} every {} day(s)", secretId, config.getInterval());
    }

    /**
     * Disarm the secret's timer. A rotation that is already running is left to finish but does
     * not re-arm the timer.
     *
     * @return true if a timer was armed
     */
    public boolean cancelRotation(String secretId) {
        ScheduledRotation entry = schedules.remove(secretId);
        if (entry == null) {
            return false;
        }
        entry.cancel();
        updateScheduledGauge();
        log.debug("Cancelled rotation schedule for secret {}", secretId);
        return true;
    }

    public boolean isScheduled(String secretId) {
        return schedules.containsKey(secretId);
    }

    public RotationStatus getRotationStatus(String secretId) {
        Secret secret = repository.findById(secretId)
                .orElseThrow(() -> new NotFoundException("Secret with id " + secretId + " not found"));
        ScheduledRotation entry = schedules.get(secretId);

        Instant nextRotation = null;
        if (entry != null) {
            nextRotation = entry.dueAt;
        } else if (secret.getRotationConfig() != null && secret.getRotationConfig().isEnabled()
                && secret.getRotationConfig().getInterval() > 0) {
            Instant base = secret.getLastRotatedAt() != null ? secret.getLastRotatedAt() : secret.getCreatedAt();
            nextRotation = base.plus(intervalUnit.multipliedBy(secret.getRotationConfig().getInterval()));
        }
        return new RotationStatus(secretId, entry != null, nextRotation, secret.getLastRotatedAt(),
                inFlight.contains(secretId));
    }

    /**
     * Armed timers, soonest first.
     */
    public List<PendingRotation> listPendingRotations() {
        List<PendingRotation> pending = new ArrayList<>();
        schedules.forEach((secretId, entry) -> pending.add(new PendingRotation(secretId, entry.scheduledAt, entry.dueAt)));
        pending.sort(Comparator.comparing(PendingRotation::dueAt));
        return pending;
    }

    // =========================================================================
    // Rotation
    // =========================================================================

    /**
     * Rotate now. On success an auto-rotating secret's timer restarts from this rotation.
     *
     * @throws NotFoundException            if the secret does not exist
     * @throws RotationDisabledException    if the secret's rotation config is absent or disabled
     * @throws UnknownRotationTypeException if no handler is registered for the config's type
     * @throws RotationInProgressException  if a rotation for the secret is already running
     */
    public Secret rotateSecret(String secretId) {
        Secret rotated = performRotation(secretId);
        SecretRotationConfig config = rotated.getRotationConfig();
        if (config != null && config.isAutoRotate()) {
            scheduleRotation(secretId, config);
        }
        return rotated;
    }

    private Secret performRotation(String secretId) {
        Secret secret = repository.findById(secretId)
                .orElseThrow(() -> new NotFoundException("Secret with id " + secretId + " not found"));
        SecretRotationConfig config = secret.getRotationConfig();
        if (config == null || !config.isEnabled()) {
            throw new RotationDisabledException(secretId);
        }
        RotationHandler handler = handlers.find(config.getType())
                .orElseThrow(() -> new UnknownRotationTypeException(config.getType()));

        if (!inFlight.add(secretId)) {
            throw new RotationInProgressException(secretId);
        }
        Timer.Sample sample = metrics.startRotationTimer();
        try {
            String newValue = handler.generate(secret, config);
            secretsService.storeSecretValue(secretId, newValue, null, AuditLogService.SYSTEM_PRINCIPAL);
            Secret rotated = repository.modify(secretId, s -> {
                s.setLastRotatedAt(Instant.now());
                return s;
            }).orElseThrow(() -> new NotFoundException("Secret with id " + secretId + " not found"));

            auditLog.record(secretId, AuditLogService.SYSTEM_PRINCIPAL, AuditAction.ROTATE, true);
            metrics.recordRotationSucceeded(sample);
            log.info("Rotated secret {} ({}) to version {}", secret.getName(), secretId, rotated.getVersion());
            return rotated;
        } catch (RuntimeException e) {
            auditLog.record(secretId, AuditLogService.SYSTEM_PRINCIPAL, AuditAction.ROTATE, false, e.getMessage());
            metrics.recordRotationFailed(sample);
            log.error("Failed to rotate secret {}: {}", secretId, e.getMessage());
            throw e;
        } finally {
            inFlight.remove(secretId);
        }
    }

    private void fire(String secretId, ScheduledRotation entry) {
        if (schedules.get(secretId) != entry) {
            return;
        }
        try {
            Secret rotated = performRotation(secretId);
            arm(secretId, rotated.getRotationConfig(), entry);
        } catch (NotFoundException e) {
            log.info("Secret {} no longer exists, dropping its rotation schedule", secretId);
            schedules.remove(secretId, entry);
            updateScheduledGauge();
        } catch (RuntimeException e) {
            log.error("Scheduled rotation of secret {} failed, keeping schedule", secretId, e);
            repository.findById(secretId).ifPresentOrElse(
                    secret -> arm(secretId, secret.getRotationConfig(), entry),
                    () -> schedules.remove(secretId, entry));
        }
    }

    /**
     * Arm a timer. With {@code expected} set the new entry only replaces that exact entry, so a
     * cancel or reschedule that happened meanwhile wins.
     */
    private void arm(String secretId, SecretRotationConfig config, ScheduledRotation expected) {
        if (config == null || !config.isEnabled() || !config.isAutoRotate() || config.getInterval() <= 0) {
            if (expected != null) {
                schedules.remove(secretId, expected);
                updateScheduledGauge();
            }
            return;
        }
        Duration delay = intervalUnit.multipliedBy(config.getInterval());
        Instant now = Instant.now();
        ScheduledRotation entry = new ScheduledRotation(now, now.plus(delay));

        if (expected == null) {
            schedules.put(secretId, entry);
        } else if (!schedules.replace(secretId, expected, entry)) {
            return;
        }
        entry.future = executor.schedule(() -> fire(secretId, entry), delay.toMillis(), TimeUnit.MILLISECONDS);
        if (schedules.get(secretId) != entry) {
            entry.cancel();
        }
        updateScheduledGauge();
    }

    private void updateScheduledGauge() {
        metrics.setScheduledRotations(schedules.size());
    }

    /**
     * Cancel every timer and stop the worker pool.
     */
    public void shutdown() {
        schedules.values().forEach(ScheduledRotation::cancel);
        schedules.clear();
        updateScheduledGauge();
        executor.shutdownNow();
        log.info("Rotation scheduler stopped");
    }

    private static ThreadFactory rotationThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "secret-rotation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ScheduledRotation {

        private final Instant scheduledAt;
        private final Instant dueAt;
        private volatile ScheduledFuture<?> future;

        private ScheduledRotation(Instant scheduledAt, Instant dueAt) {
            this.scheduledAt = scheduledAt;
            this.dueAt = dueAt;
        }

        private void cancel() {
            ScheduledFuture<?> armed = future;
            if (armed != null) {
                armed.cancel(false);
            }
        }
    }
}
