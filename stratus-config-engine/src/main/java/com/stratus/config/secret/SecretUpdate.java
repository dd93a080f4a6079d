package com.stratus.config.secret;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Metadata changes for a secret. Null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecretUpdate {

    private String name;

    private String description;

    private SecretRotationConfig rotationConfig;

    private Map<String, String> tags;
}
