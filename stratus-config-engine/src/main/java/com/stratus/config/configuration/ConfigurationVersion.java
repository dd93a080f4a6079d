package com.stratus.config.configuration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable history row written for every value mutation. For secret configurations
 * {@code value} holds the encryption token, never the plaintext.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationVersion {

    private String id;

    private String configurationId;

    private int version;

    /** Value as stored at rest */
    private Object value;

    /** Whether the configuration was secret when this row was written */
    private boolean secret;

    private String changeDescription;

    private String createdBy;

    private Instant createdAt;

    public ConfigurationVersion copy() {
        return toBuilder().build();
    }
}
