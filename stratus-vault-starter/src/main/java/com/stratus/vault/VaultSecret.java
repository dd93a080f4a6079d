package com.stratus.vault;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A secret payload read from the backend together with the backend's own metadata
 * (version, created_time, custom metadata).
 */
public record VaultSecret(Map<String, Object> data, Map<String, Object> metadata) {

    public VaultSecret {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Backend version of this payload, or {@code null} when the backend did not report one.
     */
    public Integer version() {
        Object version = metadata.get("version");
        if (version instanceof Number number) {
            return number.intValue();
        }
        if (version instanceof String text && !text.isBlank()) {
            return Integer.valueOf(text);
        }
        return null;
    }

    /**
     * Convenience accessor for the conventional {@code value} field.
     */
    public String value() {
        Object value = data.get("value");
        return value != null ? value.toString() : null;
    }
}
