package com.stratus.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link VaultConnector} for development and testing.
 * <p>
 * This connector emulates the parts of a KV v2 engine the engine relies on:
 * <ul>
 *   <li>Per-path version history with soft delete and destroy</li>
 *   <li>Custom metadata per path</li>
 *   <li>ACL policy documents and issued tokens</li>
 * </ul>
 * <p>
 * <b>Warning:</b> This connector is NOT suitable for production use.
 * Use {@link HttpVaultConnector} for production deployments.
 */
public class InMemoryVaultConnector implements VaultConnector {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVaultConnector.class);
    private static final String PROVIDER_TYPE = "inmemory";

    private final ConcurrentMap<String, PathEntry> secrets = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> policies = new ConcurrentHashMap<>();
    private final VaultTokenSessionStore tokenStore;
    private volatile boolean connected;

    public InMemoryVaultConnector() {
        this(new VaultTokenSessionStore(new VaultProperties.TokenStoreConfig()));
    }

    public InMemoryVaultConnector(VaultTokenSessionStore tokenStore) {
        this.tokenStore = tokenStore;
        log.info("Initialized in-memory vault connector (development mode)");
    }

    @Override
    public void connect() {
        connected = true;
        log.debug("In-memory vault connector connected");
    }

    @Override
    public void disconnect() {
        connected = false;
        tokenStore.clear();
        log.debug("In-memory vault connector disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public int writeSecret(String path, Map<String, Object> data, Map<String, Object> metadata) {
        ensureConnected();
        PathEntry entry = secrets.computeIfAbsent(normalize(path), key -> new PathEntry());
        int version;
        synchronized (entry) {
            version = entry.versions.size() + 1;
            entry.versions.add(new StoredVersion(version, new LinkedHashMap<>(data), Instant.now()));
            if (metadata != null) {
                metadata.forEach((key, value) -> {
                    if (value != null) {
                        entry.customMetadata.put(key, String.valueOf(value));
                    }
                });
            }
        }
        log.debug("Stored secret at path: {} (version {})", path, version);
        return version;
    }

    @Override
    public Optional<VaultSecret> readSecret(String path, Integer version) {
        ensureConnected();
        PathEntry entry = secrets.get(normalize(path));
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            if (entry.versions.isEmpty()) {
                return Optional.empty();
            }
            int target = version != null ? version : entry.versions.size();
            if (target < 1 || target > entry.versions.size()) {
                return Optional.empty();
            }
            StoredVersion stored = entry.versions.get(target - 1);
            if (stored.deletedAt != null || stored.destroyed) {
                return Optional.empty();
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("version", stored.version);
            meta.put("created_time", stored.createdAt.toString());
            meta.put("custom_metadata", new LinkedHashMap<>(entry.customMetadata));
            return Optional.of(new VaultSecret(stored.data, meta));
        }
    }

    @Override
    public void deleteSecret(String path) {
        ensureConnected();
        PathEntry entry = secrets.get(normalize(path));
        if (entry == null) {
            return;
        }
        synchronized (entry) {
            if (!entry.versions.isEmpty()) {
                entry.versions.get(entry.versions.size() - 1).deletedAt = Instant.now();
            }
        }
        log.debug("Deleted secret at path: {}", path);
    }

    @Override
    public List<String> listSecrets(String path) {
        ensureConnected();
        String prefix = normalize(path);
        if (!prefix.isEmpty()) {
            prefix = prefix + "/";
        }

        Set<String> keys = new TreeSet<>();
        for (String stored : secrets.keySet()) {
            if (!stored.startsWith(prefix) || stored.length() == prefix.length()) {
                continue;
            }
            String remainder = stored.substring(prefix.length());
            int slash = remainder.indexOf('/');
            keys.add(slash >= 0 ? remainder.substring(0, slash + 1) : remainder);
        }
        return new ArrayList<>(keys);
    }

    @Override
    public List<VaultSecretVersion> getSecretVersions(String path) {
        ensureConnected();
        PathEntry entry = secrets.get(normalize(path));
        if (entry == null) {
            return List.of();
        }
        synchronized (entry) {
            return entry.versions.stream()
                    .map(v -> new VaultSecretVersion(v.version, v.createdAt, v.deletedAt, v.destroyed))
                    .toList();
        }
    }

    @Override
    public void destroySecretVersion(String path, int version) {
        ensureConnected();
        PathEntry entry = secrets.get(normalize(path));
        if (entry == null) {
            return;
        }
        synchronized (entry) {
            if (version >= 1 && version <= entry.versions.size()) {
                StoredVersion stored = entry.versions.get(version - 1);
                stored.destroyed = true;
                stored.data = Map.of();
            }
        }
        log.debug("Destroyed version {} of secret at path: {}", version, path);
    }

    @Override
    public Optional<Map<String, Object>> getSecretMetadata(String path) {
        ensureConnected();
        PathEntry entry = secrets.get(normalize(path));
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("current_version", entry.versions.size());
            metadata.put("custom_metadata", new LinkedHashMap<>(entry.customMetadata));
            return Optional.of(metadata);
        }
    }

    @Override
    public void updateSecretMetadata(String path, Map<String, Object> metadata) {
        ensureConnected();
        PathEntry entry = secrets.computeIfAbsent(normalize(path), key -> new PathEntry());
        Object custom = metadata.getOrDefault("custom_metadata", metadata);
        synchronized (entry) {
            if (custom instanceof Map<?, ?> values) {
                values.forEach((key, value) -> {
                    if (value != null) {
                        entry.customMetadata.put(String.valueOf(key), String.valueOf(value));
                    }
                });
            }
        }
    }

    @Override
    public void createPolicy(String name, String policy) {
        ensureConnected();
        policies.put(name, policy);
        log.debug("Stored policy: {}", name);
    }

    @Override
    public void deletePolicy(String name) {
        ensureConnected();
        policies.remove(name);
    }

    @Override
    public Optional<String> getPolicy(String name) {
        ensureConnected();
        return Optional.ofNullable(policies.get(name));
    }

    @Override
    public IssuedToken createToken(List<String> tokenPolicies, Duration ttl) {
        ensureConnected();
        IssuedToken token = new IssuedToken(
                "hvs." + UUID.randomUUID().toString().replace("-", ""),
                UUID.randomUUID().toString(),
                tokenPolicies,
                ttl,
                Instant.now());
        tokenStore.register(token);
        return token;
    }

    @Override
    public void revokeToken(String token) {
        ensureConnected();
        tokenStore.revoke(token);
    }

    @Override
    public void renewToken(String token, Duration increment) {
        ensureConnected();
        tokenStore.renew(token, increment);
    }

    @Override
    public String getProviderType() {
        return PROVIDER_TYPE;
    }

    public VaultTokenSessionStore getTokenStore() {
        return tokenStore;
    }

    private void ensureConnected() {
        if (!connected) {
            throw new VaultNotConnectedException();
        }
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path.strip();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static final class PathEntry {
        private final List<StoredVersion> versions = new ArrayList<>();
        private final Map<String, String> customMetadata = new LinkedHashMap<>();
    }

    private static final class StoredVersion {
        private final int version;
        private final Instant createdAt;
        private Map<String, Object> data;
        private Instant deletedAt;
        private boolean destroyed;

        private StoredVersion(int version, Map<String, Object> data, Instant createdAt) {
            this.version = version;
            this.data = data;
            this.createdAt = createdAt;
        }
    }
}
