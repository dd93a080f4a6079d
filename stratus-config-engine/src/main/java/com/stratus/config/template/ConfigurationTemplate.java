package com.stratus.config.template;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema plus default values that expand into a set of configurations for an environment.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationTemplate {

    private String id;

    /** Unique, {@code [A-Za-z0-9._-]+} */
    private String name;

    private String description;

    private ConfigurationSchema schema;

    @Builder.Default
    private Map<String, Object> defaultValues = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> tags = new HashMap<>();

    private String createdBy;

    private Instant createdAt;

    private Instant updatedAt;
}
