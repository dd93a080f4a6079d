package com.stratus.config.configuration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.stratus.config.crypto.DecryptionException;
import com.stratus.config.crypto.EncryptionEngine;
import com.stratus.config.error.ConfigEngineException;
import com.stratus.config.error.NotFoundException;
import com.stratus.config.error.ValidationException;
import com.stratus.config.error.Violation;
import com.stratus.config.observability.ConfigEngineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed, versioned configuration store.
 * <p>
 * Secret values are encrypted before they reach the repository and decrypted on the way out.
 * Every value mutation appends a {@link ConfigurationVersion}; history is never rewritten.
 */
@Slf4j
public class ConfigurationService {

    static final String BULK_DESCRIPTION = "Bulk import configuration";

    private final ConfigurationRepository repository;
    private final ConfigurationValidator validator;
    private final EncryptionEngine encryption;
    private final ConfigurationCodec codec;
    private final ConfigEngineMetrics metrics;
    private final String redactionMarker;

    public ConfigurationService(ConfigurationRepository repository,
                                ConfigurationValidator validator,
                                EncryptionEngine encryption,
                                ConfigurationCodec codec,
                                ConfigEngineMetrics metrics,
                                String redactionMarker) {
        this.repository = repository;
        this.validator = validator;
        this.encryption = encryption;
        this.codec = codec;
        this.metrics = metrics;
        this.redactionMarker = redactionMarker;
    }

    // =========================================================================
    // CRUD
    // =========================================================================

    /**
     * Validate and store a new configuration at version 1.
     *
     * @throws ValidationException listing every violated rule
     * @throws com.stratus.config.error.ConflictException if the key exists in the environment
     */
    public Configuration create(Configuration draft, String principalId) {
        List<Violation> violations = validator.validate(draft);
        if (!violations.isEmpty()) {
            throw new ValidationException("Configuration validation failed", violations);
        }

        Instant now = Instant.now();
        String createdBy = principalId != null ? principalId : draft.getCreatedBy();
        Object storedValue = toStoredValue(draft.getValue(), draft.isSecret());

        Configuration record = draft.copy();
        record.setId(UUID.randomUUID().toString());
        record.setValue(storedValue);
        record.setVersion(1);
        record.setCreatedBy(createdBy);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);

        ConfigurationVersion initial = ConfigurationVersion.builder()
                .id(UUID.randomUUID().toString())
                .configurationId(record.getId())
                .version(1)
                .value(storedValue)
                .secret(record.isSecret())
                .changeDescription("Initial version")
                .createdBy(createdBy)
                .createdAt(now)
                .build();

        Configuration created = repository.create(record, initial);
        metrics.recordConfigurationCreated();
        log.info("Created configuration {} (key={}, environment={})",
                created.getId(), created.getKey(), created.getEnvironmentId());
        return created.withValue(draft.getValue());
    }

    public Optional<Configuration> get(String id) {
        return repository.findById(id).map(this::decryptForRead);
    }

    public Optional<Configuration> getByKey(String environmentId, String key) {
        return repository.findByKey(environmentId, key).map(this::decryptForRead);
    }

    /**
     * Apply a partial update and append a version row, incrementing {@code version} by one.
     *
     * @throws NotFoundException if the id is unknown
     * @throws com.stratus.config.error.ConflictException if another writer got there first
     */
    public Configuration update(String id, ConfigurationUpdate update, String principalId) {
        Configuration current = repository.findById(id)
                .orElseThrow(() -> notFound(id));
        int expectedVersion = update.getExpectedVersion() != null ? update.getExpectedVersion() : current.getVersion();

        Object plaintextValue = update.getValue() != null ? update.getValue() : strictPlaintext(current);
        Configuration merged = current.withValue(plaintextValue);
        if (update.getName() != null) {
            merged.setName(update.getName());
        }
        if (update.getDescription() != null) {
            merged.setDescription(update.getDescription());
        }
        if (update.getTags() != null) {
            merged.setTags(new HashMap<>(update.getTags()));
        }
        if (update.getSecret() != null) {
            merged.setSecret(update.getSecret());
        }

        List<Violation> violations = validator.validate(merged);
        if (!violations.isEmpty()) {
            throw new ValidationException("Configuration validation failed", violations);
        }

        Instant now = Instant.now();
        Object storedValue = toStoredValue(plaintextValue, merged.isSecret());
        Configuration next = merged.withValue(storedValue);
        next.setVersion(expectedVersion + 1);
        next.setUpdatedAt(now);

        ConfigurationVersion row = ConfigurationVersion.builder()
                .id(UUID.randomUUID().toString())
                .configurationId(id)
                .version(next.getVersion())
                .value(storedValue)
                .secret(next.isSecret())
                .changeDescription(update.getChangeDescription() != null
                        ? update.getChangeDescription() : "Updated configuration")
                .createdBy(principalId)
                .createdAt(now)
                .build();

        Configuration saved = repository.update(next, expectedVersion, row);
        metrics.recordConfigurationUpdated();
        log.info("Updated configuration {} to version {}", id, saved.getVersion());
        return saved.withValue(plaintextValue);
    }

    /**
     * Remove a configuration and its history.
     *
     * @throws NotFoundException if the id is unknown
     */
    public void delete(String id) {
        if (!repository.delete(id)) {
            throw notFound(id);
        }
        log.info("Deleted configuration {}", id);
    }

    public List<Configuration> list(ConfigurationFilter filter) {
        ConfigurationFilter effective = filter != null ? filter : new ConfigurationFilter();
        return repository.findAll().stream()
                .filter(effective::matches)
                .sorted(Comparator.comparing(Configuration::getEnvironmentId, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(Configuration::getKey, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(this::decryptForRead)
                .toList();
    }

    public List<Configuration> search(String query, ConfigurationFilter filter) {
        ConfigurationFilter base = filter != null ? filter : new ConfigurationFilter();
        return list(base.toBuilder().search(query).build());
    }

    /**
     * All configurations of an environment, with secret values either decrypted or redacted.
     */
    public List<Configuration> getEnvironmentConfigurations(String environmentId, boolean includeSecrets) {
        List<Configuration> configurations = list(ConfigurationFilter.forEnvironment(environmentId));
        if (includeSecrets) {
            return configurations;
        }
        return configurations.stream()
                .map(config -> config.isSecret() ? config.withValue(redactionMarker) : config)
                .toList();
    }

    public List<Violation> validate(Configuration config) {
        return validator.validate(config);
    }

    // =========================================================================
    // Versions
    // =========================================================================

    /**
     * Version history in ascending order. Values are returned as stored at rest.
     */
    public List<ConfigurationVersion> getVersions(String configurationId) {
        return repository.findVersions(configurationId);
    }

    public Optional<ConfigurationVersion> getVersion(String configurationId, int version) {
        return repository.findVersion(configurationId, version);
    }

    /**
     * Write a new version whose value equals the target version's value.
     *
     * @throws NotFoundException if the configuration or version does not exist
     */
    public Configuration rollback(RollbackRequest request, String principalId) {
        ConfigurationVersion target = repository.findVersion(request.configurationId(), request.targetVersion())
                .orElseThrow(() -> new NotFoundException("Version " + request.targetVersion()
                        + " not found for configuration " + request.configurationId()));
        Configuration current = repository.findById(request.configurationId())
                .orElseThrow(() -> notFound(request.configurationId()));

        Object value = target.getValue();
        if (target.isSecret() && value instanceof String stored && encryption.isEncrypted(stored)) {
            value = restore(encryption.decrypt(stored), current);
        }

        ConfigurationUpdate update = ConfigurationUpdate.builder()
                .value(value)
                .changeDescription("Rollback to version " + request.targetVersion() + ": " + request.reason())
                .build();
        Configuration rolledBack = update(request.configurationId(), update, principalId);
        metrics.recordConfigurationRolledBack();
        return rolledBack;
    }

    // =========================================================================
    // Bulk
    // =========================================================================

    /**
     * Create every item independently. Failures are collected, never abort the batch.
     */
    public BulkResult<Configuration> bulkCreate(BulkOperation operation, String principalId) {
        BulkResult<Configuration> result = new BulkResult<>();
        for (Configuration item : operation.getConfigurations()) {
            Configuration draft = item.copy();
            draft.setEnvironmentId(operation.getEnvironmentId());
            if (draft.getName() == null) {
                draft.setName(draft.getKey());
            }
            if (draft.getType() == null) {
                draft.setType(ConfigurationType.STRING);
            }
            if (draft.getDescription() == null) {
                draft.setDescription(BULK_DESCRIPTION);
            }
            try {
                result.addSuccess(create(draft, principalId));
            } catch (ConfigEngineException e) {
                log.warn("Failed to create configuration {}: {}", draft.getKey(), e.getMessage());
                result.addFailure(draft.getKey(), e);
            }
        }
        log.info("Bulk create in environment {}: {} created, {} failed", operation.getEnvironmentId(),
                result.getSucceeded().size(), result.getFailed().size());
        return result;
    }

    public BulkResult<Configuration> bulkUpdate(Map<String, ConfigurationUpdate> updates, String principalId) {
        BulkResult<Configuration> result = new BulkResult<>();
        updates.forEach((id, update) -> {
            try {
                result.addSuccess(update(id, update, principalId));
            } catch (ConfigEngineException e) {
                log.warn("Failed to update configuration {}: {}", id, e.getMessage());
                result.addFailure(id, e);
            }
        });
        return result;
    }

    public BulkResult<String> bulkDelete(List<String> ids) {
        BulkResult<String> result = new BulkResult<>();
        for (String id : ids) {
            try {
                delete(id);
                result.addSuccess(id);
            } catch (ConfigEngineException e) {
                log.warn("Failed to delete configuration {}: {}", id, e.getMessage());
                result.addFailure(id, e);
            }
        }
        return result;
    }

    // =========================================================================
    // Import / export
    // =========================================================================

    public String export(ExportRequest request) {
        List<Configuration> configurations = getEnvironmentConfigurations(
                request.getEnvironmentId(), request.isIncludeSecrets());
        return codec.export(configurations, request.getFormat());
    }

    /**
     * Parse, flatten and create the document's entries. With {@code overwriteExisting},
     * keys already present in the environment are updated instead.
     */
    public BulkResult<Configuration> importConfigurations(ImportRequest request, String principalId) {
        List<Configuration> drafts = codec.parseImport(request.getData(), request.getFormat());
        String changeDescription = request.getChangeDescription() != null ? request.getChangeDescription() : "Bulk import";

        if (!request.isOverwriteExisting()) {
            return bulkCreate(BulkOperation.builder()
                    .environmentId(request.getEnvironmentId())
                    .configurations(drafts)
                    .changeDescription(changeDescription)
                    .build(), principalId);
        }

        List<Configuration> toCreate = new ArrayList<>();
        BulkResult<Configuration> result = new BulkResult<>();
        for (Configuration draft : drafts) {
            Optional<Configuration> existing = draft.getKey() != null
                    ? repository.findByKey(request.getEnvironmentId(), draft.getKey())
                    : Optional.empty();
            if (existing.isEmpty()) {
                toCreate.add(draft);
                continue;
            }
            try {
                result.addSuccess(update(existing.get().getId(), ConfigurationUpdate.builder()
                        .value(draft.getValue())
                        .changeDescription(changeDescription)
                        .build(), principalId));
            } catch (ConfigEngineException e) {
                log.warn("Failed to overwrite configuration {}: {}", draft.getKey(), e.getMessage());
                result.addFailure(draft.getKey(), e);
            }
        }

        BulkResult<Configuration> created = bulkCreate(BulkOperation.builder()
                .environmentId(request.getEnvironmentId())
                .configurations(toCreate)
                .changeDescription(changeDescription)
                .build(), principalId);
        result.merge(created);
        return result;
    }

    // =========================================================================
    // Value handling
    // =========================================================================

    private Object toStoredValue(Object value, boolean secret) {
        return secret ? encryption.encrypt(codec.toPlaintext(value)) : value;
    }

    /**
     * Decrypt a secret value for a read path. A failure is logged and the stored
     * ciphertext is returned.
     */
    private Configuration decryptForRead(Configuration config) {
        if (!config.isSecret() || !(config.getValue() instanceof String stored) || !encryption.isEncrypted(stored)) {
            return config;
        }
        try {
            return config.withValue(restore(encryption.decrypt(stored), config));
        } catch (DecryptionException e) {
            log.warn("Failed to decrypt configuration {}: {}", config.getId(), e.getMessage());
            return config;
        }
    }

    /**
     * Plaintext of the current value for a write path. Decryption failures propagate.
     */
    private Object strictPlaintext(Configuration config) {
        if (config.isSecret() && config.getValue() instanceof String stored && encryption.isEncrypted(stored)) {
            return restore(encryption.decrypt(stored), config);
        }
        return config.getValue();
    }

    private Object restore(String plaintext, Configuration config) {
        try {
            return codec.fromPlaintext(plaintext, config.getType());
        } catch (JsonProcessingException e) {
            log.warn("Configuration {} holds a value that does not match type {}", config.getId(), config.getType());
            return plaintext;
        }
    }

    private static NotFoundException notFound(String id) {
        return new NotFoundException("Configuration with id " + id + " not found");
    }
}
