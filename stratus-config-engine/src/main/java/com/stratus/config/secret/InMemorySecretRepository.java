package com.stratus.config.secret;

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
import java.util.function.UnaryOperator;

/**
 * In-memory secret store. Version checks, record replacement and history appends for one
 * secret happen inside a single {@link ConcurrentHashMap#compute} call.
 */
public class InMemorySecretRepository implements SecretRepository {

    private final Map<String, Secret> store = new ConcurrentHashMap<>();
    private final Map<String, List<SecretVersion>> versions = new ConcurrentHashMap<>();
    private final Map<String, String> pathIndex = new ConcurrentHashMap<>();

    @Override
    public Secret create(Secret secret) {
        if (pathIndex.putIfAbsent(secret.getPath(), secret.getId()) != null) {
            throw new ConflictException("Secret already exists at path " + secret.getPath());
        }
        versions.put(secret.getId(), new CopyOnWriteArrayList<>());
        store.put(secret.getId(), secret.copy());
        return secret.copy();
    }

    @Override
    public Secret commitVersion(Secret secret, int expectedVersion, SecretVersion versionRow) {
        Secret saved = store.compute(secret.getId(), (id, current) -> {
            if (current == null) {
                throw new NotFoundException("Secret with id " + id + " not found");
            }
            if (current.getVersion() != expectedVersion) {
                throw ConflictException.concurrentModification("Secret", id, expectedVersion);
            }
            List<SecretVersion> history = versions.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>());
            List<SecretVersion> deactivated = new ArrayList<>();
            history.forEach(row -> {
                SecretVersion copy = row.copy();
                copy.setActive(false);
                deactivated.add(copy);
            });
            SecretVersion newRow = versionRow.copy();
            newRow.setActive(true);
            deactivated.add(newRow);
            versions.put(id, new CopyOnWriteArrayList<>(deactivated));
            return secret.copy();
        });
        return saved.copy();
    }

    @Override
    public Optional<Secret> modify(String id, UnaryOperator<Secret> change) {
        Secret saved = store.computeIfPresent(id, (key, current) -> change.apply(current.copy()).copy());
        return Optional.ofNullable(saved).map(Secret::copy);
    }

    @Override
    public Optional<Secret> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(Secret::copy);
    }

    @Override
    public Optional<Secret> findByPath(String path) {
        String id = pathIndex.get(path);
        return id != null ? findById(id) : Optional.empty();
    }

    @Override
    public List<Secret> findAll() {
        List<Secret> result = new ArrayList<>();
        store.values().forEach(secret -> result.add(secret.copy()));
        return result;
    }

    @Override
    public boolean delete(String id) {
        AtomicBoolean removed = new AtomicBoolean();
        store.computeIfPresent(id, (key, current) -> {
            pathIndex.remove(current.getPath());
            versions.remove(id);
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    @Override
    public List<SecretVersion> findVersions(String secretId) {
        List<SecretVersion> sorted = new ArrayList<>();
        versions.getOrDefault(secretId, List.of()).forEach(row -> sorted.add(row.copy()));
        sorted.sort(Comparator.comparingInt(SecretVersion::getVersion));
        return sorted;
    }

    @Override
    public Optional<SecretVersion> findVersion(String secretId, int version) {
        return versions.getOrDefault(secretId, List.of()).stream()
                .filter(row -> row.getVersion() == version)
                .findFirst()
                .map(SecretVersion::copy);
    }
}
