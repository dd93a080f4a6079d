package com.stratus.config.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Basic in-memory repository used until a durable store is wired up.
 */
public class InMemoryAuditLogRepository implements AuditLogRepository {

    private final List<SecretAuditLog> entries = new ArrayList<>();

    @Override
    public synchronized void append(SecretAuditLog entry) {
        entries.add(entry);
    }

    @Override
    public synchronized Optional<SecretAuditLog> findLatest() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    @Override
    public synchronized List<SecretAuditLog> findBySecretId(String secretId, int limit) {
        List<SecretAuditLog> result = new ArrayList<>();
        for (int i = entries.size() - 1; i >= 0 && result.size() < limit; i--) {
            SecretAuditLog entry = entries.get(i);
            if (entry.getSecretId().equals(secretId)) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public synchronized List<SecretAuditLog> findAll() {
        return List.copyOf(entries);
    }
}
