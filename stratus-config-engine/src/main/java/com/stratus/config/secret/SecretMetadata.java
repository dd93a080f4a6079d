package com.stratus.config.secret;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Descriptive facts about a secret value. Never contains the value itself.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecretMetadata {

    /** UTF-8 byte length of the value */
    private int size;

    @Builder.Default
    private String encoding = "utf8";

    private String contentType;

    /** Hex SHA-256 of the value */
    private String checksum;

    @Builder.Default
    private Map<String, String> customFields = new HashMap<>();

    public SecretMetadata copy() {
        return toBuilder()
                .customFields(customFields != null ? new HashMap<>(customFields) : new HashMap<>())
                .build();
    }
}
