package com.stratus.config.configuration;

import com.stratus.config.error.ConflictException;
import com.stratus.config.error.NotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory repository used until a durable store is wired up.
 * <p>
 * Per-entity atomicity comes from {@link ConcurrentHashMap#compute}: the version check, the
 * replacement and the version-row append happen inside one compute call.
 */
public class InMemoryConfigurationRepository implements ConfigurationRepository {

    private final Map<String, Configuration> store = new ConcurrentHashMap<>();
    private final Map<String, List<ConfigurationVersion>> versions = new ConcurrentHashMap<>();
    private final Map<String, String> keyIndex = new ConcurrentHashMap<>();

    @Override
    public Configuration create(Configuration configuration, ConfigurationVersion initialVersion) {
        String indexKey = indexKey(configuration.getEnvironmentId(), configuration.getKey());
        if (keyIndex.putIfAbsent(indexKey, configuration.getId()) != null) {
            throw new ConflictException("Configuration with key " + configuration.getKey()
                    + " already exists in environment " + configuration.getEnvironmentId());
        }
        List<ConfigurationVersion> history = new CopyOnWriteArrayList<>();
        history.add(initialVersion.copy());
        versions.put(configuration.getId(), history);
        store.put(configuration.getId(), configuration.copy());
        return configuration.copy();
    }

    @Override
    public Configuration update(Configuration configuration, int expectedVersion, ConfigurationVersion versionRow) {
        Configuration saved = store.compute(configuration.getId(), (id, current) -> {
            if (current == null) {
                throw new NotFoundException("Configuration with id " + id + " not found");
            }
            if (current.getVersion() != expectedVersion) {
                throw ConflictException.concurrentModification("Configuration", id, expectedVersion);
            }
            versions.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(versionRow.copy());
            return configuration.copy();
        });
        return saved.copy();
    }

    @Override
    public Optional<Configuration> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(Configuration::copy);
    }

    @Override
    public Optional<Configuration> findByKey(String environmentId, String key) {
        String id = keyIndex.get(indexKey(environmentId, key));
        return id != null ? findById(id) : Optional.empty();
    }

    @Override
    public List<Configuration> findAll() {
        List<Configuration> result = new ArrayList<>();
        store.values().forEach(config -> result.add(config.copy()));
        return result;
    }

    @Override
    public boolean delete(String id) {
        AtomicBoolean removed = new AtomicBoolean();
        store.computeIfPresent(id, (key, current) -> {
            keyIndex.remove(indexKey(current.getEnvironmentId(), current.getKey()));
            versions.remove(id);
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    @Override
    public List<ConfigurationVersion> findVersions(String configurationId) {
        List<ConfigurationVersion> history = versions.getOrDefault(configurationId, List.of());
        List<ConfigurationVersion> sorted = new ArrayList<>();
        history.forEach(row -> sorted.add(row.copy()));
        sorted.sort(Comparator.comparingInt(ConfigurationVersion::getVersion));
        return sorted;
    }

    @Override
    public Optional<ConfigurationVersion> findVersion(String configurationId, int version) {
        return versions.getOrDefault(configurationId, List.of()).stream()
                .filter(row -> row.getVersion() == version)
                .findFirst()
                .map(ConfigurationVersion::copy);
    }

    private static String indexKey(String environmentId, String key) {
        return environmentId + "\u0000" + key;
    }
}
