package com.stratus.config.rotation;

import com.stratus.config.secret.Secret;
import com.stratus.config.secret.SecretRotationConfig;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;

/**
 * Prefixed API key of 32 random bytes in hex. Honors the {@code prefix} setting.
 */
public class ApiKeyRotationHandler implements RotationHandler {

    public static final String TYPE = "api_key";

    private static final int KEY_BYTES = 32;

    private final SecureRandom random = new SecureRandom();
    private final String defaultPrefix;

    public ApiKeyRotationHandler(String defaultPrefix) {
        this.defaultPrefix = defaultPrefix != null ? defaultPrefix : "";
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String generate(Secret secret, SecretRotationConfig config) {
        Map<String, Object> settings = config.getSettings() != null ? config.getSettings() : Map.of();
        String prefix = settings.get("prefix") instanceof String text ? text : defaultPrefix;
        byte[] key = new byte[KEY_BYTES];
        random.nextBytes(key);
        return prefix + HexFormat.of().formatHex(key);
    }
}
