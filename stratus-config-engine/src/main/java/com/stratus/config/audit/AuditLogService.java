package com.stratus.config.audit;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * Tamper-evident audit log for secret access and mutation.
 * <p>
 * Appends are serialized so that each entry's {@code previousHash} is the hash of the entry
 * appended immediately before it.
 */
@Slf4j
public class AuditLogService {

    public static final String SYSTEM_PRINCIPAL = "system";

    static final String GENESIS_HASH = "0".repeat(64);

    private final AuditLogRepository repository;
    private final int defaultLimit;

    public AuditLogService(AuditLogRepository repository, int defaultLimit) {
        this.repository = repository;
        this.defaultLimit = defaultLimit;
    }

    public SecretAuditLog record(String secretId, String principalId, AuditAction action, boolean success) {
        return record(secretId, principalId, action, success, null);
    }

    public SecretAuditLog record(String secretId, String principalId, AuditAction action, boolean success,
                                 String errorMessage) {
        PrincipalType type = SYSTEM_PRINCIPAL.equals(principalId) ? PrincipalType.SYSTEM : PrincipalType.USER;
        return record(secretId, principalId, type, action, success, errorMessage);
    }

    public synchronized SecretAuditLog record(String secretId, String principalId, PrincipalType principalType,
                                              AuditAction action, boolean success, String errorMessage) {
        SecretAuditLog previous = repository.findLatest().orElse(null);
        String previousHash = previous != null ? previous.getEntryHash() : GENESIS_HASH;
        long sequence = previous != null ? previous.getSequence() + 1 : 1;

        SecretAuditLog.SecretAuditLogBuilder builder = SecretAuditLog.builder()
                .id(UUID.randomUUID().toString())
                .sequence(sequence)
                .secretId(secretId)
                .action(action)
                .principalId(principalId)
                .principalType(principalType)
                .success(success)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .previousHash(previousHash);
        SecretAuditLog entry = builder.entryHash(hash(builder.build())).build();

        repository.append(entry);
        log.debug("Audit #{} {} on secret {} by {} success={}", sequence, action.getValue(), secretId, principalId, success);
        return entry;
    }

    /**
     * Most recent first. A non-positive limit falls back to the configured default.
     */
    public List<SecretAuditLog> getAuditLogs(String secretId, int limit) {
        return repository.findBySecretId(secretId, limit > 0 ? limit : defaultLimit);
    }

    /**
     * Recompute every hash and link. False if any entry was altered, removed or reordered.
     */
    public boolean verifyChain() {
        String expectedPrevious = GENESIS_HASH;
        long expectedSequence = 1;
        for (SecretAuditLog entry : repository.findAll()) {
            if (entry.getSequence() != expectedSequence
                    || !expectedPrevious.equals(entry.getPreviousHash())
                    || !hash(entry).equals(entry.getEntryHash())) {
                log.warn("Audit chain broken at entry #{} ({})", entry.getSequence(), entry.getId());
                return false;
            }
            expectedPrevious = entry.getEntryHash();
            expectedSequence++;
        }
        return true;
    }

    static String hash(SecretAuditLog entry) {
        String canonical = String.join("|",
                entry.getId(),
                String.valueOf(entry.getSequence()),
                String.valueOf(entry.getSecretId()),
                entry.getAction().getValue(),
                String.valueOf(entry.getPrincipalId()),
                entry.getPrincipalType().getValue(),
                String.valueOf(entry.isSuccess()),
                String.valueOf(entry.getErrorMessage()),
                entry.getTimestamp().toString(),
                entry.getPreviousHash());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
