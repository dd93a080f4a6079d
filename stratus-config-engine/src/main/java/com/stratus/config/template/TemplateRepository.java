package com.stratus.config.template;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for template persistence.
 */
public interface TemplateRepository {

    /**
     * Persist the given template. Existing templates with the same id are replaced.
     *
     * @throws com.stratus.config.error.ConflictException if another template already uses the name
     */
    ConfigurationTemplate save(ConfigurationTemplate template);

    Optional<ConfigurationTemplate> findById(String id);

    Optional<ConfigurationTemplate> findByName(String name);

    List<ConfigurationTemplate> findAll();

    void delete(String id);
}
