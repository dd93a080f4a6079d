package com.stratus.config.rotation;

import com.stratus.config.access.AccessControlGate;
import com.stratus.config.audit.AuditAction;
import com.stratus.config.audit.AuditLogService;
import com.stratus.config.audit.InMemoryAuditLogRepository;
import com.stratus.config.audit.SecretAuditLog;
import com.stratus.config.error.NotFoundException;
import com.stratus.config.error.ValidationException;
import com.stratus.config.observability.ConfigEngineMetrics;
import com.stratus.config.secret.InMemorySecretRepository;
import com.stratus.config.secret.NewSecret;
import com.stratus.config.secret.Secret;
import com.stratus.config.secret.SecretRotationConfig;
import com.stratus.config.secret.SecretType;
import com.stratus.config.secret.SecretsService;
import com.stratus.vault.InMemoryVaultConnector;
import com.stratus.vault.VaultProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("RotationScheduler Tests")
class RotationSchedulerTest {

    private InMemorySecretRepository repository;
    private AuditLogService auditLog;
    private ConfigEngineMetrics metrics;
    private SecretsService secretsService;
    private RotationHandlerRegistry registry;
    private RotationScheduler scheduler;

    @BeforeEach
    void setUp() {
        repository = new InMemorySecretRepository();
        InMemoryVaultConnector connector = new InMemoryVaultConnector();
        connector.connect();
        auditLog = new AuditLogService(new InMemoryAuditLogRepository(), 100);
        metrics = new ConfigEngineMetrics(new SimpleMeterRegistry());
        secretsService = new SecretsService(repository, connector,
                new AccessControlGate(connector, new VaultProperties(), (principal, resource, action) -> true),
                auditLog, metrics);
        registry = new RotationHandlerRegistry(List.of(new PasswordRotationHandler(16, "abcdefgh")));

        // One interval unit is a millisecond so timers fire within the test
        scheduler = new RotationScheduler(repository, secretsService, registry, auditLog, metrics,
                Executors.newScheduledThreadPool(2), Duration.ofMillis(1));
        secretsService.setRotationScheduler(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private Secret createSecret(String name, SecretRotationConfig config) {
        return secretsService.createSecret(NewSecret.builder()
                .name(name)
                .environmentId("prod")
                .type(SecretType.PASSWORD)
                .rotationConfig(config)
                .build(), "admin");
    }

    private static SecretRotationConfig auto(String type, int interval) {
        return SecretRotationConfig.builder().enabled(true).autoRotate(true).type(type).interval(interval).build();
    }

    private static SecretRotationConfig manual(String type) {
        return SecretRotationConfig.builder().enabled(true).autoRotate(false).type(type).interval(10).build();
    }

    @Nested
    @DisplayName("Timers")
    class TimerTests {

        @Test
        @DisplayName("should rotate when the timer fires")
        void shouldRotateOnSchedule() {
            // Given
            Secret secret = createSecret("db-password", auto("password", 50));

            // Then
            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
                Secret current = repository.findById(secret.getId()).orElseThrow();
                assertThat(current.getLastRotatedAt()).isNotNull();
                assertThat(current.getVersion()).isGreaterThanOrEqualTo(2);
            });
            assertThat(auditLog.getAuditLogs(secret.getId(), 100))
                    .anySatisfy(entry -> {
                        assertThat(entry.getAction()).isEqualTo(AuditAction.ROTATE);
                        assertThat(entry.isSuccess()).isTrue();
                        assertThat(entry.getPrincipalId()).isEqualTo(AuditLogService.SYSTEM_PRINCIPAL);
                    });
            assertThat(scheduler.isScheduled(secret.getId())).isTrue();
        }

        @Test
        @DisplayName("should not fire after cancellation")
        void shouldNotFireAfterCancel() {
            // Given
            Secret secret = createSecret("db-password", auto("password", 200));

            // When
            boolean cancelled = scheduler.cancelRotation(secret.getId());

            // Then
            assertThat(cancelled).isTrue();
            assertThat(scheduler.cancelRotation(secret.getId())).isFalse();
            await().during(Duration.ofMillis(400)).atMost(Duration.ofSeconds(2))
                    .untilAsserted(() -> assertThat(repository.findById(secret.getId()).orElseThrow().getVersion()).isEqualTo(1));
            assertThat(metrics.getScheduledRotations()).isZero();
        }

        @Test
        @DisplayName("should keep the schedule after a failed rotation")
        void shouldKeepScheduleAfterFailure() {
            // Given
            registry.register(new FailingHandler());
            Secret secret = createSecret("db-password", auto("failing", 30));

            // When
            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(metrics.getRotationsFailed().count()).isGreaterThanOrEqualTo(1.0));

            // Then
            assertThat(scheduler.isScheduled(secret.getId())).isTrue();
            assertThat(auditLog.getAuditLogs(secret.getId(), 100))
                    .filteredOn(entry -> entry.getAction() == AuditAction.ROTATE)
                    .first()
                    .satisfies(entry -> {
                        assertThat(entry.isSuccess()).isFalse();
                        assertThat(entry.getErrorMessage()).isEqualTo("generator offline");
                    });
            assertThat(repository.findById(secret.getId()).orElseThrow().getVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("should drop the schedule of a secret that no longer exists")
        void shouldDropScheduleForMissingSecret() {
            // When
            scheduler.scheduleRotation("ghost", auto("password", 20));

            // Then
            await().atMost(Duration.ofSeconds(5)).until(() -> !scheduler.isScheduled("ghost"));
        }

        @Test
        @DisplayName("should list pending rotations soonest first")
        void shouldListPendingRotations() {
            // When
            scheduler.scheduleRotation("later", auto("password", 600_000));
            scheduler.scheduleRotation("sooner", auto("password", 300_000));
            scheduler.scheduleRotation("manual", manual("password"));

            // Then
            assertThat(scheduler.listPendingRotations())
                    .extracting(PendingRotation::secretId)
                    .containsExactly("sooner", "later");
            assertThat(metrics.getScheduledRotations()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject an auto-rotating config without a positive interval")
        void shouldRejectNonPositiveInterval() {
            assertThatThrownBy(() -> scheduler.scheduleRotation("s1", auto("password", 0)))
                    .isInstanceOf(ValidationException.class);
            assertThat(scheduler.isScheduled("s1")).isFalse();
        }
    }

    @Nested
    @DisplayName("Manual rotation")
    class ManualRotationTests {

        @Test
        @DisplayName("should reject a second rotation while one is running")
        void shouldRejectConcurrentRotation() throws Exception {
            // Given
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            registry.register(new BlockingHandler(entered, release));
            Secret secret = createSecret("db-password", manual("blocking"));
            ExecutorService caller = Executors.newSingleThreadExecutor();

            try {
                // When
                Future<Secret> first = caller.submit(() -> scheduler.rotateSecret(secret.getId()));
                assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

                // Then
                assertThatThrownBy(() -> scheduler.rotateSecret(secret.getId()))
                        .isInstanceOf(RotationInProgressException.class)
                        .hasMessage("Rotation already in progress for secret " + secret.getId());
                assertThat(scheduler.getRotationStatus(secret.getId()).inProgress()).isTrue();

                release.countDown();
                assertThat(first.get(5, TimeUnit.SECONDS).getVersion()).isEqualTo(2);
                assertThat(scheduler.getRotationStatus(secret.getId()).inProgress()).isFalse();
            } finally {
                release.countDown();
                caller.shutdownNow();
            }
        }

        @Test
        @DisplayName("should refuse disabled rotation")
        void shouldRefuseDisabled() {
            Secret secret = createSecret("db-password", null);

            assertThatThrownBy(() -> scheduler.rotateSecret(secret.getId()))
                    .isInstanceOf(RotationDisabledException.class);
        }

        @Test
        @DisplayName("should refuse an unregistered rotation type")
        void shouldRefuseUnknownType() {
            Secret secret = createSecret("db-password", manual("certificate"));

            assertThatThrownBy(() -> scheduler.rotateSecret(secret.getId()))
                    .isInstanceOf(UnknownRotationTypeException.class)
                    .hasMessageContaining("certificate");
            assertThat(auditLog.getAuditLogs(secret.getId(), 100))
                    .extracting(SecretAuditLog::getAction)
                    .doesNotContain(AuditAction.ROTATE);
        }

        @Test
        @DisplayName("should fail for an unknown secret")
        void shouldFailForUnknownSecret() {
            assertThatThrownBy(() -> scheduler.rotateSecret("missing"))
                    .isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> scheduler.getRotationStatus("missing"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("should derive the next rotation of an unscheduled secret from its creation")
        void shouldDeriveNextRotation() {
            // Given
            Secret secret = createSecret("db-password", manual("password"));

            // When
            RotationStatus status = scheduler.getRotationStatus(secret.getId());

            // Then
            assertThat(status.scheduled()).isFalse();
            assertThat(status.lastRotation()).isNull();
            assertThat(status.nextRotation()).isEqualTo(secret.getCreatedAt().plusMillis(10));
        }
    }

    private static final class FailingHandler implements RotationHandler {

        @Override
        public String getType() {
            return "failing";
        }

        @Override
        public String generate(Secret secret, SecretRotationConfig config) {
            throw new IllegalStateException("generator offline");
        }
    }

    private static final class BlockingHandler implements RotationHandler {

        private final CountDownLatch entered;
        private final CountDownLatch release;

        private BlockingHandler(CountDownLatch entered, CountDownLatch release) {
            this.entered = entered;
            this.release = release;
        }

        @Override
        public String getType() {
            return "blocking";
        }

        @Override
        public String generate(Secret secret, SecretRotationConfig config) {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "rotated-value";
        }
    }
}
