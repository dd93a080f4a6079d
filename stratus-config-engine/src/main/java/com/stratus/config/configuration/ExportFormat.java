package com.stratus.config.configuration;

import java.util.Locale;

public enum ExportFormat {
    JSON,
    YAML,
    ENV;

    public static ExportFormat fromValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unsupported format: " + value, e);
        }
    }
}
