package com.stratus.config.template;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root object schema of a template.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationSchema {

    @Builder.Default
    private String type = "object";

    @Builder.Default
    private Map<String, SchemaProperty> properties = new LinkedHashMap<>();

    @Builder.Default
    private List<String> required = new ArrayList<>();

    /**
     * View the root as a property so nested and root validation share one path.
     */
    public SchemaProperty asProperty() {
        return SchemaProperty.builder()
                .type(type)
                .properties(properties)
                .required(required)
                .build();
    }
}
