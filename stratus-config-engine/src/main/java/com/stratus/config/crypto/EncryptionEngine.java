package com.stratus.config.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM encryption for configuration values flagged secret.
 * <p>
 * Tokens have the form {@code "enc:" + base64(iv || ciphertext || tag)} with a fresh
 * 16-byte IV per call, so encrypting the same plaintext twice yields different tokens.
 */
@Slf4j
public class EncryptionEngine {

    public static final String PREFIX = "enc:";
    public static final String KEY_ENV_VARIABLE = "CONFIG_ENCRYPTION_KEY";

    private static final String ENCRYPTION_ALGO = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 16;
    private static final int GCM_TAG_LENGTH = 128;

    private final SecretKey secretKey;
    private final SecureRandom random = new SecureRandom();

    public EncryptionEngine(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Encryption key must be " + KEY_LENGTH + " bytes");
        }
        this.secretKey = new SecretKeySpec(key, "AES");
    }

    /**
     * Build an engine from a hex key, falling back to {@value #KEY_ENV_VARIABLE} and then,
     * only when {@code allowGeneratedKey} is set, to a freshly generated key.
     */
    public static EncryptionEngine create(String hexKey, boolean allowGeneratedKey) {
        return create(hexKey, System.getenv(KEY_ENV_VARIABLE), allowGeneratedKey);
    }

    static EncryptionEngine create(String hexKey, String environmentKey, boolean allowGeneratedKey) {
        if (hexKey != null && !hexKey.isBlank()) {
            log.info("Using configured encryption key");
            return new EncryptionEngine(decodeHexKey(hexKey));
        }
        if (environmentKey != null && !environmentKey.isBlank()) {
            log.info("Using encryption key from {}", KEY_ENV_VARIABLE);
            return new EncryptionEngine(decodeHexKey(environmentKey));
        }
        if (allowGeneratedKey) {
            log.warn("No encryption key configured; generated a random key. "
                    + "Encrypted values will not survive a restart. Set {} in production.", KEY_ENV_VARIABLE);
            return new EncryptionEngine(HexFormat.of().parseHex(generateKey()));
        }
        throw new IllegalStateException("No encryption key configured: set stratus.config-engine.encryption.key or "
                + KEY_ENV_VARIABLE);
    }

    /**
     * Generate a new random 256-bit key, hex encoded.
     */
    public static String generateKey() {
        byte[] key = new byte[KEY_LENGTH];
        new SecureRandom().nextBytes(key);
        return HexFormat.of().formatHex(key);
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext must not be null");
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] encryptedWithIv = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, encryptedWithIv, 0, iv.length);
            System.arraycopy(encrypted, 0, encryptedWithIv, iv.length, encrypted.length);
            return PREFIX + Base64.getEncoder().encodeToString(encryptedWithIv);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    public String decrypt(String token) {
        if (!isEncrypted(token)) {
            throw new ValueNotEncryptedException();
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(token.substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Encrypted value is not valid base64", e);
        }
        if (decoded.length <= IV_LENGTH) {
            throw new DecryptionException("Encrypted value is too short", null);
        }

        try {
            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, decoded, 0, IV_LENGTH));
            byte[] original = cipher.doFinal(decoded, IV_LENGTH, decoded.length - IV_LENGTH);
            return new String(original, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt value", e);
        }
    }

    public boolean isEncrypted(String value) {
        return value != null && value.startsWith(PREFIX);
    }

    /**
     * Encrypt unless the value already carries the encryption prefix.
     */
    public String safeEncrypt(String value) {
        return isEncrypted(value) ? value : encrypt(value);
    }

    /**
     * Decrypt when the value carries the encryption prefix, otherwise return it unchanged.
     */
    public String safeDecrypt(String value) {
        return isEncrypted(value) ? decrypt(value) : value;
    }

    private static byte[] decodeHexKey(String hexKey) {
        try {
            return HexFormat.of().parseHex(hexKey.strip());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Encryption key must be hex encoded", e);
        }
    }
}
