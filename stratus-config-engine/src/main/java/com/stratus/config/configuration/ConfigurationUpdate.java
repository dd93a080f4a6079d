package com.stratus.config.configuration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial update of a configuration. {@code null} fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationUpdate {

    private Object value;

    private String name;

    private String description;

    private Map<String, String> tags;

    private Boolean secret;

    private String changeDescription;

    /**
     * Version the caller last observed. When set, the update is rejected if the stored
     * version has moved on.
     */
    private Integer expectedVersion;
}
