package com.stratus.config.secret;

import com.stratus.config.error.ConfigEngineException;
import com.stratus.config.error.ErrorCode;

/**
 * A secret value could not be read from the backend.
 */
public class SecretRetrievalException extends ConfigEngineException {

    public SecretRetrievalException(String message) {
        super(ErrorCode.SECRET_RETRIEVAL_FAILED, message);
    }

    public SecretRetrievalException(String message, Throwable cause) {
        super(ErrorCode.SECRET_RETRIEVAL_FAILED, message, cause);
    }
}
