package com.stratus.config.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the configuration and secrets engine.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Configuration lifecycle (created, updated, rolled back)</li>
 *     <li>Secret value traffic (reads, writes, failures)</li>
 *     <li>Rotation execution (success, failure, duration, scheduled)</li>
 *     <li>Access control (denials)</li>
 * </ul>
 */
public class ConfigEngineMetrics {

    private final MeterRegistry meterRegistry;

    // Configuration metrics
    @Getter
    private final Counter configurationsCreated;
    @Getter
    private final Counter configurationsUpdated;
    @Getter
    private final Counter configurationsRolledBack;

    // Secret metrics
    @Getter
    private final Counter secretReads;
    @Getter
    private final Counter secretWrites;
    @Getter
    private final Counter secretBackendFailures;

    // Rotation metrics
    @Getter
    private final Counter rotationsSucceeded;
    @Getter
    private final Counter rotationsFailed;
    private final Timer rotationDuration;
    private final AtomicInteger scheduledRotations;

    // Access metrics
    @Getter
    private final Counter permissionDenials;

    public ConfigEngineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.configurationsCreated = Counter.builder("stratus.config.configurations.created")
                .description("Configurations created")
                .register(meterRegistry);
        this.configurationsUpdated = Counter.builder("stratus.config.configurations.updated")
                .description("Configuration updates committed")
                .register(meterRegistry);
        this.configurationsRolledBack = Counter.builder("stratus.config.configurations.rolled_back")
                .description("Configuration rollbacks")
                .register(meterRegistry);

        this.secretReads = Counter.builder("stratus.config.secrets.reads")
                .description("Secret values read from the backend")
                .register(meterRegistry);
        this.secretWrites = Counter.builder("stratus.config.secrets.writes")
                .description("Secret values written to the backend")
                .register(meterRegistry);
        this.secretBackendFailures = Counter.builder("stratus.config.secrets.backend_failures")
                .description("Secret operations that failed at the backend")
                .register(meterRegistry);

        this.rotationsSucceeded = Counter.builder("stratus.config.rotations.succeeded")
                .description("Secret rotations completed")
                .register(meterRegistry);
        this.rotationsFailed = Counter.builder("stratus.config.rotations.failed")
                .description("Secret rotations failed")
                .register(meterRegistry);
        this.rotationDuration = Timer.builder("stratus.config.rotations.duration")
                .description("Secret rotation duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.scheduledRotations = meterRegistry.gauge("stratus.config.rotations.scheduled", new AtomicInteger(0));

        this.permissionDenials = Counter.builder("stratus.config.access.denied")
                .description("Secret operations denied by access control")
                .register(meterRegistry);
    }

    // ========== Configuration Methods ==========

    public void recordConfigurationCreated() {
        configurationsCreated.increment();
    }

    public void recordConfigurationUpdated() {
        configurationsUpdated.increment();
    }

    public void recordConfigurationRolledBack() {
        configurationsRolledBack.increment();
    }

    // ========== Secret Methods ==========

    public void recordSecretRead() {
        secretReads.increment();
    }

    public void recordSecretWrite() {
        secretWrites.increment();
    }

    public void recordSecretBackendFailure() {
        secretBackendFailures.increment();
    }

    // ========== Rotation Methods ==========

    public Timer.Sample startRotationTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRotationSucceeded(Timer.Sample sample) {
        sample.stop(rotationDuration);
        rotationsSucceeded.increment();
    }

    public void recordRotationFailed(Timer.Sample sample) {
        sample.stop(rotationDuration);
        rotationsFailed.increment();
    }

    public void setScheduledRotations(int count) {
        scheduledRotations.set(count);
    }

    public int getScheduledRotations() {
        return scheduledRotations.get();
    }

    // ========== Access Methods ==========

    public void recordPermissionDenied() {
        permissionDenials.increment();
    }
}
