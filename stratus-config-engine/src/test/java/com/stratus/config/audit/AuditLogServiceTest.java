package com.stratus.config.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuditLogService Tests")
class AuditLogServiceTest {

    private InMemoryAuditLogRepository repository;
    private AuditLogService auditLog;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditLogRepository();
        auditLog = new AuditLogService(repository, 2);
    }

    @Nested
    @DisplayName("Recording")
    class RecordingTests {

        @Test
        @DisplayName("should chain each entry to its predecessor")
        void shouldChainEntries() {
            // When
            SecretAuditLog first = auditLog.record("s1", "user-1", AuditAction.CREATE, true);
            SecretAuditLog second = auditLog.record("s2", "user-1", AuditAction.READ, false, "Permission denied: read");

            // Then
            assertThat(first.getSequence()).isEqualTo(1);
            assertThat(first.getPreviousHash()).isEqualTo(AuditLogService.GENESIS_HASH);
            assertThat(second.getPreviousHash()).isEqualTo(first.getEntryHash());
            assertThat(second.getErrorMessage()).isEqualTo("Permission denied: read");
            assertThat(first.getEntryHash()).hasSize(64).isNotEqualTo(second.getEntryHash());
            assertThat(auditLog.verifyChain()).isTrue();
        }

        @Test
        @DisplayName("should classify the system principal")
        void shouldClassifySystemPrincipal() {
            SecretAuditLog entry = auditLog.record("s1", AuditLogService.SYSTEM_PRINCIPAL, AuditAction.ROTATE, true);

            assertThat(entry.getPrincipalType()).isEqualTo(PrincipalType.SYSTEM);
        }

        @Test
        @DisplayName("should return a secret's entries most recent first")
        void shouldReturnMostRecentFirst() {
            // Given
            auditLog.record("s1", "user-1", AuditAction.CREATE, true);
            auditLog.record("s2", "user-1", AuditAction.CREATE, true);
            auditLog.record("s1", "user-1", AuditAction.UPDATE, true);
            auditLog.record("s1", "user-2", AuditAction.READ, true);

            // When
            List<SecretAuditLog> all = auditLog.getAuditLogs("s1", 10);
            List<SecretAuditLog> defaulted = auditLog.getAuditLogs("s1", 0);

            // Then
            assertThat(all).extracting(SecretAuditLog::getAction)
                    .containsExactly(AuditAction.READ, AuditAction.UPDATE, AuditAction.CREATE);
            assertThat(defaulted).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Tamper detection")
    class TamperTests {

        @Test
        @DisplayName("should detect an altered entry")
        void shouldDetectAlteredEntry() {
            // Given
            List<SecretAuditLog> entries = new ArrayList<>();
            AuditLogRepository tampering = new AuditLogRepository() {
                @Override
                public void append(SecretAuditLog entry) {
                    entries.add(entry);
                }

                @Override
                public Optional<SecretAuditLog> findLatest() {
                    return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
                }

                @Override
                public List<SecretAuditLog> findBySecretId(String secretId, int limit) {
                    return List.of();
                }

                @Override
                public List<SecretAuditLog> findAll() {
                    return entries;
                }
            };
            AuditLogService service = new AuditLogService(tampering, 10);
            service.record("s1", "user-1", AuditAction.READ, false, "denied");
            service.record("s1", "user-1", AuditAction.READ, true);

            // When
            SecretAuditLog original = entries.get(0);
            entries.set(0, SecretAuditLog.builder()
                    .id(original.getId())
                    .sequence(original.getSequence())
                    .secretId(original.getSecretId())
                    .action(original.getAction())
                    .principalId(original.getPrincipalId())
                    .principalType(original.getPrincipalType())
                    .success(true)
                    .errorMessage(null)
                    .timestamp(original.getTimestamp())
                    .previousHash(original.getPreviousHash())
                    .entryHash(original.getEntryHash())
                    .build());

            // Then
            assertThat(service.verifyChain()).isFalse();
        }

        @Test
        @DisplayName("should detect a removed entry")
        void shouldDetectRemovedEntry() {
            // Given
            List<SecretAuditLog> entries = new ArrayList<>();
            auditLog.record("s1", "user-1", AuditAction.CREATE, true);
            auditLog.record("s1", "user-1", AuditAction.UPDATE, true);
            auditLog.record("s1", "user-1", AuditAction.DELETE, true);
            entries.addAll(repository.findAll());
            entries.remove(1);

            // When
            InMemoryAuditLogRepository copy = new InMemoryAuditLogRepository();
            entries.forEach(copy::append);

            // Then
            assertThat(new AuditLogService(copy, 10).verifyChain()).isFalse();
            assertThat(auditLog.verifyChain()).isTrue();
        }
    }
}
