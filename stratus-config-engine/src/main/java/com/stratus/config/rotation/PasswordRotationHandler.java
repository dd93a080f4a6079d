package com.stratus.config.rotation;

import com.stratus.config.secret.Secret;
import com.stratus.config.secret.SecretRotationConfig;

import java.security.SecureRandom;
import java.util.Map;

/**
 * Random password from a character set. Honors the {@code length} and {@code charset} settings.
 */
public class PasswordRotationHandler implements RotationHandler {

    public static final String TYPE = "password";

    private final SecureRandom random = new SecureRandom();
    private final int defaultLength;
    private final String defaultCharset;

    public PasswordRotationHandler(int defaultLength, String defaultCharset) {
        if (defaultLength <= 0) {
            throw new IllegalArgumentException("Password length must be positive");
        }
        if (defaultCharset == null || defaultCharset.isEmpty()) {
            throw new IllegalArgumentException("Password charset must not be empty");
        }
        this.defaultLength = defaultLength;
        this.defaultCharset = defaultCharset;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String generate(Secret secret, SecretRotationConfig config) {
        Map<String, Object> settings = config.getSettings() != null ? config.getSettings() : Map.of();
        int length = settings.get("length") instanceof Number number ? number.intValue() : defaultLength;
        String charset = settings.get("charset") instanceof String text && !text.isEmpty() ? text : defaultCharset;
        if (length <= 0) {
            throw new IllegalArgumentException("Password length must be positive for secret " + secret.getId());
        }

        StringBuilder password = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            password.append(charset.charAt(random.nextInt(charset.length())));
        }
        return password.toString();
    }
}
