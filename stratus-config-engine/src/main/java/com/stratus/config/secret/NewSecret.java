package com.stratus.config.secret;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request to register a secret, optionally with its first value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewSecret {

    private String name;

    private String environmentId;

    private SecretType type;

    private String description;

    private SecretRotationConfig rotationConfig;

    @Builder.Default
    private Map<String, String> tags = new HashMap<>();

    /** Written to the backend as version 2 when present */
    private String initialValue;
}
