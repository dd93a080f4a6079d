package com.stratus.config.secret;

import com.stratus.config.access.AccessControlGate;
import com.stratus.config.access.SecretAccessGrant;
import com.stratus.config.access.SecretPermission;
import com.stratus.config.audit.AuditAction;
import com.stratus.config.audit.AuditLogService;
import com.stratus.config.audit.SecretAuditLog;
import com.stratus.config.error.ConfigEngineException;
import com.stratus.config.error.DataSourceUnavailableException;
import com.stratus.config.error.NotFoundException;
import com.stratus.config.error.PermissionDeniedException;
import com.stratus.config.error.ValidationException;
import com.stratus.config.error.Violation;
import com.stratus.config.observability.ConfigEngineMetrics;
import com.stratus.config.rotation.RotationScheduler;
import com.stratus.config.rotation.RotationStatus;
import com.stratus.vault.VaultConnector;
import com.stratus.vault.VaultException;
import com.stratus.vault.VaultSecret;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * First-class secrets layered over a {@link VaultConnector}.
 * <p>
 * Values only ever live in the backend. This service keeps the metadata, a SHA-256 checksum
 * of the current value and, per version, the backend version the value was written as.
 * Value reads and mutations are checked against the {@link AccessControlGate} and audited,
 * denials included.
 */
@Slf4j
public class SecretsService {

    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9-_]");

    private final SecretRepository repository;
    private final VaultConnector connector;
    private final AccessControlGate accessControl;
    private final AuditLogService auditLog;
    private final ConfigEngineMetrics metrics;

    // Serializes backend write + version commit per secret
    private final Map<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    private volatile RotationScheduler rotationScheduler;

    public SecretsService(SecretRepository repository,
                          VaultConnector connector,
                          AccessControlGate accessControl,
                          AuditLogService auditLog,
                          ConfigEngineMetrics metrics) {
        this.repository = repository;
        this.connector = connector;
        this.accessControl = accessControl;
        this.auditLog = auditLog;
        this.metrics = metrics;
    }

    public void setRotationScheduler(RotationScheduler rotationScheduler) {
        this.rotationScheduler = rotationScheduler;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Register a secret at {@code environments/<env>/secrets/<sanitized name>} with version 1.
     * An initial value, when present, is written immediately.
     *
     * @throws ValidationException listing every violated rule
     * @throws com.stratus.config.error.ConflictException if the path is already taken
     */
    public Secret createSecret(NewSecret request, String principalId) {
        List<Violation> violations = new ArrayList<>();
        if (request.getName() == null || request.getName().isBlank()) {
            violations.add(Violation.required("name", "Secret name is required"));
        }
        if (request.getEnvironmentId() == null || request.getEnvironmentId().isBlank()) {
            violations.add(Violation.required("environmentId", "Environment ID is required"));
        }
        if (request.getType() == null) {
            violations.add(Violation.required("type", "Secret type is required"));
        }
        violations.addAll(validateRotationConfig(request.getRotationConfig()));
        if (!violations.isEmpty()) {
            throw new ValidationException("Secret validation failed", violations);
        }

        Instant now = Instant.now();
        Secret record = Secret.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .path(buildPath(request.getEnvironmentId(), request.getName()))
                .environmentId(request.getEnvironmentId())
                .type(request.getType())
                .description(request.getDescription())
                .version(1)
                .rotationConfig(request.getRotationConfig() != null ? request.getRotationConfig().copy() : null)
                .tags(request.getTags() != null ? new HashMap<>(request.getTags()) : new HashMap<>())
                .createdBy(principalId)
                .updatedBy(principalId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Secret created = repository.create(record);
        auditLog.record(created.getId(), principalId, AuditAction.CREATE, true);
        log.info("Created secret {} ({}) at {}", created.getName(), created.getId(), created.getPath());

        if (request.getInitialValue() != null) {
            created = storeSecretValue(created.getId(), request.getInitialValue(), null, principalId);
        }
        RotationScheduler scheduler = rotationScheduler;
        if (scheduler != null && created.getRotationConfig() != null) {
            scheduler.scheduleRotation(created.getId(), created.getRotationConfig());
        }
        return created;
    }

    /**
     * Metadata-only changes. Replacing the rotation config re-arms or cancels the timer.
     */
    public Secret updateSecret(String id, SecretUpdate update, String principalId) {
        findSecret(id);
        requirePermission(id, principalId, SecretPermission.UPDATE, AuditAction.UPDATE);
        List<Violation> violations = new ArrayList<>();
        if (update.getName() != null && update.getName().isBlank()) {
            violations.add(Violation.required("name", "Secret name must not be blank"));
        }
        violations.addAll(validateRotationConfig(update.getRotationConfig()));
        if (!violations.isEmpty()) {
            throw new ValidationException("Secret validation failed", violations);
        }

        Secret updated = repository.modify(id, secret -> {
            if (update.getName() != null) {
                secret.setName(update.getName());
            }
            if (update.getDescription() != null) {
                secret.setDescription(update.getDescription());
            }
            if (update.getTags() != null) {
                secret.setTags(new HashMap<>(update.getTags()));
            }
            if (update.getRotationConfig() != null) {
                secret.setRotationConfig(update.getRotationConfig().copy());
            }
            secret.setUpdatedBy(principalId);
            secret.setUpdatedAt(Instant.now());
            return secret;
        }).orElseThrow(() -> notFound(id));

        RotationScheduler scheduler = rotationScheduler;
        if (scheduler != null && update.getRotationConfig() != null) {
            scheduler.scheduleRotation(id, updated.getRotationConfig());
        }
        auditLog.record(id, principalId, AuditAction.UPDATE, true);
        return updated;
    }

    /**
     * Remove the secret. The backend delete is best effort; the record, its history, its grants
     * and its rotation timer are always dropped.
     */
    public void deleteSecret(String id, String principalId) {
        Secret secret = findSecret(id);
        requirePermission(id, principalId, SecretPermission.DELETE, AuditAction.DELETE);

        try {
            connector.deleteSecret(secret.getPath());
        } catch (VaultException e) {
            log.warn("Failed to delete secret {} from backend at {}: {}", id, secret.getPath(), e.getMessage());
        }
        RotationScheduler scheduler = rotationScheduler;
        if (scheduler != null) {
            scheduler.cancelRotation(id);
        }
        accessControl.revokeAll(id);
        repository.delete(id);
        writeLocks.remove(id);
        auditLog.record(id, principalId, AuditAction.DELETE, true);
        log.info("Deleted secret {} ({})", secret.getName(), id);
    }

    // =========================================================================
    // Values
    // =========================================================================

    /**
     * Write a new value, creating the next version.
     *
     * @param metadata optional content type and custom fields; size and checksum are computed
     * @throws PermissionDeniedException     without {@code write} permission
     * @throws DataSourceUnavailableException if the backend write fails
     */
    public Secret setSecretValue(String id, String value, SecretMetadata metadata, String principalId) {
        findSecret(id);
        requirePermission(id, principalId, SecretPermission.WRITE, AuditAction.UPDATE);
        return storeSecretValue(id, value, metadata, principalId);
    }

    /**
     * Write path shared by {@link #setSecretValue}, rollback and rotation, entered after the
     * caller's access has been established.
     */
    public Secret storeSecretValue(String id, String value, SecretMetadata metadata, String principalId) {
        if (value == null) {
            throw new ValidationException("Secret validation failed",
                    List.of(Violation.required("value", "Secret value is required")));
        }

        ReentrantLock lock = writeLocks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        try {
            Secret current = findSecret(id);
            SecretMetadata computed = metadata != null ? metadata.copy() : SecretMetadata.builder().build();
            computed.setSize(value.getBytes(StandardCharsets.UTF_8).length);
            computed.setEncoding("utf8");
            computed.setChecksum(checksum(value));

            int backendVersion;
            try {
                backendVersion = connector.writeSecret(current.getPath(), Map.of("value", value),
                        backendMetadata(computed, principalId));
            } catch (VaultException e) {
                metrics.recordSecretBackendFailure();
                auditLog.record(id, principalId, AuditAction.UPDATE, false, e.getMessage());
                throw new DataSourceUnavailableException(
                        "Secret backend unavailable while writing secret " + id + ": " + e.getMessage(), e);
            }

            Instant now = Instant.now();
            int nextVersion = current.getVersion() + 1;
            Secret next = current.copy();
            next.setVersion(nextVersion);
            next.setBackendVersion(backendVersion);
            next.setMetadata(computed);
            next.setUpdatedBy(principalId);
            next.setUpdatedAt(now);

            SecretVersion row = SecretVersion.builder()
                    .id(UUID.randomUUID().toString())
                    .secretId(id)
                    .version(nextVersion)
                    .backendVersion(backendVersion)
                    .valueHash(computed.getChecksum())
                    .metadata(computed.copy())
                    .createdBy(principalId)
                    .createdAt(now)
                    .active(true)
                    .build();

            Secret saved = repository.commitVersion(next, current.getVersion(), row);
            metrics.recordSecretWrite();
            auditLog.record(id, principalId, AuditAction.UPDATE, true);
            log.info("Stored secret {} version {} (backend version {})", id, nextVersion, backendVersion);
            return saved;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read the current value from the backend.
     *
     * @throws PermissionDeniedException without {@code read} permission
     * @throws SecretRetrievalException  if the backend fails or holds no value
     */
    public String getSecretValue(String id, String principalId) {
        Secret secret = findSecret(id);
        requirePermission(id, principalId, SecretPermission.READ, AuditAction.READ);

        Optional<VaultSecret> stored;
        try {
            stored = connector.readSecret(secret.getPath());
        } catch (VaultException e) {
            metrics.recordSecretBackendFailure();
            auditLog.record(id, principalId, AuditAction.READ, false, e.getMessage());
            throw new SecretRetrievalException("Failed to retrieve secret value: " + e.getMessage(), e);
        }

        String value = stored.map(VaultSecret::value).orElse(null);
        if (value == null) {
            String message = "Secret value not found in backend for path " + secret.getPath();
            auditLog.record(id, principalId, AuditAction.READ, false, message);
            throw new SecretRetrievalException(message);
        }

        repository.modify(id, s -> {
            s.setLastAccessedAt(Instant.now());
            return s;
        });
        metrics.recordSecretRead();
        auditLog.record(id, principalId, AuditAction.READ, true);
        return value;
    }

    /**
     * Re-write the value of {@code targetVersion} as a new version. History is not modified.
     *
     * @throws NotFoundException if the version, or its value in the backend, does not exist
     */
    public Secret rollbackSecret(String id, int targetVersion, String reason, String principalId) {
        Secret secret = findSecret(id);
        requirePermission(id, principalId, SecretPermission.UPDATE, AuditAction.UPDATE);

        SecretVersion target = repository.findVersion(id, targetVersion)
                .orElseThrow(() -> rollbackFailure(id, principalId,
                        new NotFoundException("Version " + targetVersion + " not found for secret " + id)));
        if (target.getBackendVersion() == null) {
            throw rollbackFailure(id, principalId,
                    new NotFoundException("Secret value not found in backend for version " + targetVersion));
        }

        Optional<VaultSecret> stored;
        try {
            stored = connector.readSecret(secret.getPath(), target.getBackendVersion());
        } catch (VaultException e) {
            metrics.recordSecretBackendFailure();
            throw rollbackFailure(id, principalId,
                    new SecretRetrievalException("Failed to retrieve secret value: " + e.getMessage(), e));
        }
        String value = stored.map(VaultSecret::value)
                .orElseThrow(() -> rollbackFailure(id, principalId,
                        new NotFoundException("Secret value not found in backend for version " + targetVersion)));

        SecretMetadata metadata = target.getMetadata() != null ? target.getMetadata().copy() : SecretMetadata.builder().build();
        metadata.getCustomFields().put("rolledBackFrom", String.valueOf(targetVersion));
        if (reason != null) {
            metadata.getCustomFields().put("reason", reason);
        }
        log.info("Rolling back secret {} to version {}: {}", id, targetVersion, reason);
        return storeSecretValue(id, value, metadata, principalId);
    }

    private <E extends RuntimeException> E rollbackFailure(String id, String principalId, E failure) {
        auditLog.record(id, principalId, AuditAction.UPDATE, false, failure.getMessage());
        return failure;
    }

    // =========================================================================
    // Metadata reads
    // =========================================================================

    public Optional<Secret> getSecret(String id) {
        return repository.findById(id);
    }

    public Optional<Secret> getSecretByPath(String path) {
        return repository.findByPath(path);
    }

    public List<Secret> listSecrets(SecretFilter filter) {
        SecretFilter effective = filter != null ? filter : new SecretFilter();
        List<Secret> result = new ArrayList<>();
        for (Secret secret : repository.findAll()) {
            if (effective.matches(secret)) {
                result.add(secret);
            }
        }
        result.sort(Comparator.comparing(Secret::getEnvironmentId).thenComparing(Secret::getName));
        return result;
    }

    /**
     * Case-insensitive match of {@code query} against name, path and description.
     */
    public List<Secret> searchSecrets(String query, SecretFilter filter) {
        String needle = query != null ? query.toLowerCase(Locale.ROOT) : "";
        List<Secret> result = new ArrayList<>();
        for (Secret secret : listSecrets(filter)) {
            if (contains(secret.getName(), needle) || contains(secret.getPath(), needle)
                    || contains(secret.getDescription(), needle)) {
                result.add(secret);
            }
        }
        return result;
    }

    public List<SecretVersion> getSecretVersions(String id) {
        findSecret(id);
        return repository.findVersions(id);
    }

    public Optional<SecretVersion> getSecretVersion(String id, int version) {
        return repository.findVersion(id, version);
    }

    // =========================================================================
    // Rotation
    // =========================================================================

    public Secret rotateSecret(String id, String principalId) {
        findSecret(id);
        requirePermission(id, principalId, SecretPermission.ROTATE, AuditAction.ROTATE);
        return scheduler().rotateSecret(id);
    }

    /**
     * Store the rotation config on the secret and arm its timer.
     */
    public Secret scheduleRotation(String id, SecretRotationConfig config, String principalId) {
        findSecret(id);
        requirePermission(id, principalId, SecretPermission.ROTATE, AuditAction.ROTATE);
        List<Violation> violations = validateRotationConfig(config);
        if (config == null) {
            violations.add(Violation.required("rotationConfig", "Rotation config is required"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Rotation config validation failed", violations);
        }
        Secret updated = repository.modify(id, secret -> {
            secret.setRotationConfig(config.copy());
            secret.setUpdatedAt(Instant.now());
            return secret;
        }).orElseThrow(() -> notFound(id));
        scheduler().scheduleRotation(id, updated.getRotationConfig());
        return updated;
    }

    public boolean cancelRotation(String id, String principalId) {
        findSecret(id);
        requirePermission(id, principalId, SecretPermission.ROTATE, AuditAction.ROTATE);
        return scheduler().cancelRotation(id);
    }

    public RotationStatus getRotationStatus(String id) {
        return scheduler().getRotationStatus(id);
    }

    // =========================================================================
    // Access
    // =========================================================================

    public SecretAccessGrant grantAccess(String id, SecretAccessGrant grant, String principalId) {
        Secret secret = findSecret(id);
        SecretAccessGrant request = grant.copy();
        request.setCreatedBy(principalId);

        SecretAccessGrant recorded;
        try {
            recorded = accessControl.grantAccess(id, secret.getPath(), request);
        } catch (VaultException e) {
            auditLog.record(id, principalId, AuditAction.GRANT_ACCESS, false, e.getMessage());
            throw new DataSourceUnavailableException("Failed to create access policy for secret " + id + ": " + e.getMessage(), e);
        } catch (ConfigEngineException e) {
            auditLog.record(id, principalId, AuditAction.GRANT_ACCESS, false, e.getMessage());
            throw e;
        }

        repository.modify(id, s -> {
            if (!s.getAccessPolicies().contains(recorded.getPolicyName())) {
                s.getAccessPolicies().add(recorded.getPolicyName());
            }
            return s;
        });
        auditLog.record(id, principalId, AuditAction.GRANT_ACCESS, true);
        return recorded;
    }

    public void revokeAccess(String id, String targetPrincipalId, String principalId) {
        findSecret(id);
        SecretAccessGrant revoked;
        try {
            revoked = accessControl.revokeAccess(id, targetPrincipalId);
        } catch (VaultException e) {
            auditLog.record(id, principalId, AuditAction.REVOKE_ACCESS, false, e.getMessage());
            throw new DataSourceUnavailableException("Failed to delete access policy for secret " + id + ": " + e.getMessage(), e);
        }
        if (revoked == null) {
            throw new NotFoundException("No access grant for principal " + targetPrincipalId + " on secret " + id);
        }

        repository.modify(id, s -> {
            s.getAccessPolicies().remove(revoked.getPolicyName());
            return s;
        });
        auditLog.record(id, principalId, AuditAction.REVOKE_ACCESS, true);
    }

    public boolean checkAccess(String id, String principalId, SecretPermission permission) {
        return accessControl.checkPermission(id, principalId, permission);
    }

    public List<SecretAccessGrant> listAccessGrants(String id) {
        findSecret(id);
        return accessControl.listPrincipals(id);
    }

    public List<SecretAuditLog> getAuditLogs(String id, int limit) {
        return auditLog.getAuditLogs(id, limit);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void requirePermission(String id, String principalId, SecretPermission permission, AuditAction action) {
        if (!accessControl.checkPermission(id, principalId, permission)) {
            metrics.recordPermissionDenied();
            auditLog.record(id, principalId, action, false, "Permission denied: " + permission.getValue());
            log.debug("Denied {} on secret {} to {}", permission.getValue(), id, principalId);
            throw new PermissionDeniedException(principalId, "secret:" + id, permission.getValue());
        }
    }

    private Secret findSecret(String id) {
        return repository.findById(id).orElseThrow(() -> notFound(id));
    }

    private RotationScheduler scheduler() {
        RotationScheduler scheduler = rotationScheduler;
        if (scheduler == null) {
            throw new IllegalStateException("Rotation scheduler is not configured");
        }
        return scheduler;
    }

    private static List<Violation> validateRotationConfig(SecretRotationConfig config) {
        List<Violation> violations = new ArrayList<>();
        if (config == null || !config.isEnabled()) {
            return violations;
        }
        if (config.getType() == null || config.getType().isBlank()) {
            violations.add(Violation.required("rotationConfig.type", "Rotation type is required"));
        }
        if (config.isAutoRotate() && config.getInterval() <= 0) {
            violations.add(new Violation("rotationConfig.interval", "minimum", "Rotation interval must be at least 1 day"));
        }
        return violations;
    }

    private static Map<String, Object> backendMetadata(SecretMetadata metadata, String principalId) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("size", metadata.getSize());
        result.put("encoding", metadata.getEncoding());
        result.put("checksum", metadata.getChecksum());
        if (metadata.getContentType() != null) {
            result.put("contentType", metadata.getContentType());
        }
        if (metadata.getCustomFields() != null) {
            result.putAll(metadata.getCustomFields());
        }
        result.put("updatedBy", principalId);
        return result;
    }

    static String buildPath(String environmentId, String name) {
        return "environments/" + environmentId + "/secrets/" + UNSAFE_NAME_CHARS.matcher(name).replaceAll("_");
    }

    static String checksum(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static NotFoundException notFound(String id) {
        return new NotFoundException("Secret with id " + id + " not found");
    }
}
