package com.stratus.config.configuration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stratus.config.error.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Field, key-format and per-type value checks for configurations. Every violated rule is
 * reported.
 */
public class ConfigurationValidator {

    static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+$");

    private final ObjectMapper objectMapper;

    public ConfigurationValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Violation> validate(Configuration config) {
        List<Violation> violations = new ArrayList<>();

        if (isBlank(config.getEnvironmentId())) {
            violations.add(Violation.required("environmentId", "Environment ID is required"));
        }
        if (isBlank(config.getKey())) {
            violations.add(Violation.required("key", "Configuration key is required"));
        }
        if (isBlank(config.getName())) {
            violations.add(Violation.required("name", "Configuration name is required"));
        }
        if (config.getValue() == null) {
            violations.add(Violation.required("value", "Configuration value is required"));
        }
        if (config.getType() == null) {
            violations.add(Violation.required("type", "Configuration type is required"));
        }

        if (!isBlank(config.getKey()) && !KEY_PATTERN.matcher(config.getKey()).matches()) {
            violations.add(new Violation("key", "pattern",
                    "Configuration key must contain only alphanumeric characters, underscores, dots, and hyphens"));
        }

        if (config.getType() != null && config.getValue() != null && !isValidValue(config.getType(), config.getValue())) {
            violations.add(new Violation("value", "type",
                    "Configuration value is not valid for type " + config.getType().getValue()));
        }

        if (config.getTags() != null) {
            config.getTags().keySet().forEach(tagKey -> {
                if (tagKey == null || !KEY_PATTERN.matcher(tagKey).matches()) {
                    violations.add(new Violation("tags." + tagKey, "pattern", "Tag key '" + tagKey
                            + "' must contain only alphanumeric characters, underscores, dots, and hyphens"));
                }
            });
        }

        return violations;
    }

    public boolean isValidValue(ConfigurationType type, Object value) {
        return switch (type) {
            case STRING, YAML, ENV -> value instanceof String;
            case NUMBER -> value instanceof Number number && isFinite(number);
            case BOOLEAN -> value instanceof Boolean;
            case JSON -> value instanceof String text ? isParseableJson(text) : value instanceof Map || value instanceof List;
        };
    }

    private boolean isParseableJson(String text) {
        try {
            objectMapper.readTree(text);
            return !text.isBlank();
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double d) {
            return !d.isNaN() && !d.isInfinite();
        }
        if (number instanceof Float f) {
            return !f.isNaN() && !f.isInfinite();
        }
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
