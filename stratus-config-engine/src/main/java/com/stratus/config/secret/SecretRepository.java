package com.stratus.config.secret;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for secret records and their version history.
 * <p>
 * Implementations return copies, so callers never mutate stored state.
 */
public interface SecretRepository {

    /**
     * @throws com.stratus.config.error.ConflictException if a secret already uses the path
     */
    Secret create(Secret secret);

    /**
     * Atomically replace the record and append {@code versionRow}, deactivating every older
     * row, provided the stored version still equals {@code expectedVersion}.
     *
     * @throws com.stratus.config.error.ConflictException with {@code CONCURRENT_MODIFICATION}
     *                                                    when the stored version moved on
     * @throws com.stratus.config.error.NotFoundException if the secret is gone
     */
    Secret commitVersion(Secret secret, int expectedVersion, SecretVersion versionRow);

    /**
     * Atomically apply a metadata-only change. The version is not touched.
     */
    Optional<Secret> modify(String id, UnaryOperator<Secret> change);

    Optional<Secret> findById(String id);

    Optional<Secret> findByPath(String path);

    List<Secret> findAll();

    boolean delete(String id);

    /**
     * Version rows in ascending version order.
     */
    List<SecretVersion> findVersions(String secretId);

    Optional<SecretVersion> findVersion(String secretId, int version);
}
