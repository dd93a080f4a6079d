package com.stratus.config.audit;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for audit entries. There is no update or delete.
 */
public interface AuditLogRepository {

    void append(SecretAuditLog entry);

    Optional<SecretAuditLog> findLatest();

    /**
     * Entries for one secret, most recent first.
     */
    List<SecretAuditLog> findBySecretId(String secretId, int limit);

    /**
     * Every entry in append order.
     */
    List<SecretAuditLog> findAll();
}
