package com.stratus.config.crypto;

import com.stratus.config.error.ConfigEngineException;
import com.stratus.config.error.ErrorCode;

/**
 * A ciphertext token could not be decrypted: malformed encoding, truncated payload or
 * a failed integrity check.
 */
public class DecryptionException extends ConfigEngineException {

    public DecryptionException(String message, Throwable cause) {
        super(ErrorCode.DECRYPTION_FAILED, message, cause);
    }

    protected DecryptionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
