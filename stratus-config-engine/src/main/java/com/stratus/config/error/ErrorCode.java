package com.stratus.config.error;

/**
 * Stable, machine-readable failure codes carried by every {@link ConfigEngineException}.
 */
public enum ErrorCode {
    VALIDATION_FAILED,
    CONFLICT,
    CONCURRENT_MODIFICATION,
    NOT_FOUND,
    DECRYPTION_FAILED,
    VALUE_NOT_ENCRYPTED,
    SECRET_RETRIEVAL_FAILED,
    ROTATION_DISABLED,
    UNKNOWN_ROTATION_TYPE,
    ROTATION_IN_PROGRESS,
    PERMISSION_DENIED,
    DATA_SOURCE_UNAVAILABLE
}
