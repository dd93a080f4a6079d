package com.stratus.config.configuration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a configuration value.
 */
public enum ConfigurationType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    JSON("json"),
    YAML("yaml"),
    ENV("env");

    private final String value;

    ConfigurationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConfigurationType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConfigurationType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown configuration type: " + value);
    }

    /**
     * Infer the type of a raw imported value.
     */
    public static ConfigurationType infer(Object value) {
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Map || value instanceof List) {
            return JSON;
        }
        return STRING;
    }
}
