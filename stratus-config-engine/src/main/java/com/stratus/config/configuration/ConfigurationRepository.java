package com.stratus.config.configuration;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for configurations and their version history.
 * <p>
 * Implementations must make {@link #create} and {@link #update} atomic with respect to the
 * version row they append, and must reject a second writer that observed a stale version.
 */
public interface ConfigurationRepository {

    /**
     * Insert a new configuration together with its first version row.
     *
     * @throws com.stratus.config.error.ConflictException if {@code (environmentId, key)} is taken
     */
    Configuration create(Configuration configuration, ConfigurationVersion initialVersion);

    /**
     * Replace the stored configuration if its version still equals {@code expectedVersion},
     * appending {@code versionRow} in the same step.
     *
     * @throws com.stratus.config.error.NotFoundException if the id is unknown
     * @throws com.stratus.config.error.ConflictException with code {@code CONCURRENT_MODIFICATION}
     *                                                    if the version moved on
     */
    Configuration update(Configuration configuration, int expectedVersion, ConfigurationVersion versionRow);

    Optional<Configuration> findById(String id);

    Optional<Configuration> findByKey(String environmentId, String key);

    List<Configuration> findAll();

    /**
     * Remove a configuration and its version history.
     *
     * @return false if nothing was stored under the id
     */
    boolean delete(String id);

    /**
     * Version rows in ascending order.
     */
    List<ConfigurationVersion> findVersions(String configurationId);

    Optional<ConfigurationVersion> findVersion(String configurationId, int version);
}
