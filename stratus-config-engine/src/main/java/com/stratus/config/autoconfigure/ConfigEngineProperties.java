package com.stratus.config.autoconfigure;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the configuration and secrets engine.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Encryption key sourcing</li>
 *     <li>Rotation worker pool and credential generators</li>
 *     <li>Audit log reads</li>
 *     <li>Export redaction</li>
 * </ul>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "stratus.config-engine")
public class ConfigEngineProperties {

    private final Encryption encryption = new Encryption();
    private final Rotation rotation = new Rotation();
    private final Audit audit = new Audit();
    private final Export export = new Export();

    /**
     * Encryption-at-rest for secret configurations.
     */
    @Data
    public static class Encryption {
        /** Hex encoded 256-bit key. Falls back to CONFIG_ENCRYPTION_KEY. */
        private String key;

        /** Generate a throwaway key when none is configured (development only) */
        private boolean allowGeneratedKey = false;
    }

    /**
     * Scheduled rotation and the built-in credential generators.
     */
    @Data
    public static class Rotation {
        @Positive
        private int poolSize = 2;

        @Positive
        private int passwordLength = 32;

        @NotBlank
        private String passwordCharset = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789!@#$%^&*";

        private String apiKeyPrefix = "ak_";
    }

    @Data
    public static class Audit {
        @Positive
        private int defaultLimit = 100;
    }

    @Data
    public static class Export {
        @NotBlank
        private String redactionMarker = "[REDACTED]";
    }
}
