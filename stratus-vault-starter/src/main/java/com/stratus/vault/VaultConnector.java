package com.stratus.vault;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client abstraction over an external, versioned secret backend.
 * <p>
 * Implementations:
 * <ul>
 *   <li>{@link HttpVaultConnector} - HashiCorp Vault KV v2 over HTTP</li>
 *   <li>{@link InMemoryVaultConnector} - Development/testing (default)</li>
 * </ul>
 * <p>
 * Every operation except {@link #connect()}, {@link #disconnect()} and {@link #isConnected()}
 * fails with {@link VaultNotConnectedException} until {@link #connect()} has succeeded.
 * Paths are relative to the configured KV mount.
 */
public interface VaultConnector {

    // =========================================================================
    // Connection lifecycle
    // =========================================================================

    /**
     * Authenticate and probe backend health.
     *
     * @throws VaultConnectionException if authentication or the health probe fails
     */
    void connect();

    /**
     * Revoke the session token (best effort) and drop the connection.
     */
    void disconnect();

    boolean isConnected();

    // =========================================================================
    // Secret data
    // =========================================================================

    /**
     * Write a new version of the secret at {@code path}.
     *
     * @param path     secret path relative to the mount
     * @param data     key/value payload
     * @param metadata optional custom metadata to attach after the data write, may be {@code null};
     *                 a failure to attach it does not fail the write
     * @return the version number the backend assigned to this write
     */
    int writeSecret(String path, Map<String, Object> data, Map<String, Object> metadata);

    /**
     * Read the latest version of a secret.
     *
     * @return the secret, or empty if the backend has nothing at {@code path}
     */
    default Optional<VaultSecret> readSecret(String path) {
        return readSecret(path, null);
    }

    /**
     * Read a specific version of a secret.
     *
     * @param version backend version, or {@code null} for the latest
     * @return the secret, or empty if the path or version does not exist
     */
    Optional<VaultSecret> readSecret(String path, Integer version);

    /**
     * Soft-delete the latest version of a secret.
     */
    void deleteSecret(String path);

    /**
     * List the child keys under a path. Returns an empty list for unknown paths.
     */
    List<String> listSecrets(String path);

    // =========================================================================
    // Versions and metadata
    // =========================================================================

    List<VaultSecretVersion> getSecretVersions(String path);

    /**
     * Permanently destroy the data of one version.
     */
    void destroySecretVersion(String path, int version);

    Optional<Map<String, Object>> getSecretMetadata(String path);

    void updateSecretMetadata(String path, Map<String, Object> metadata);

    // =========================================================================
    // Policies
    // =========================================================================

    void createPolicy(String name, String policy);

    default void updatePolicy(String name, String policy) {
        createPolicy(name, policy);
    }

    void deletePolicy(String name);

    Optional<String> getPolicy(String name);

    // =========================================================================
    // Tokens
    // =========================================================================

    /**
     * Issue a child token bound to the given policies.
     *
     * @param ttl requested lifetime, or {@code null} for the backend default
     */
    IssuedToken createToken(List<String> policies, Duration ttl);

    void revokeToken(String token);

    /**
     * Extend the lease of a previously issued token.
     *
     * @param increment requested extension, or {@code null} for the backend default
     */
    void renewToken(String token, Duration increment);

    /**
     * Backend type identifier (e.g. "vault", "inmemory").
     */
    String getProviderType();
}
