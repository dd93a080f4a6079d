package com.stratus.config.error;

/**
 * Base class for every failure raised by the configuration and secrets engine.
 */
public class ConfigEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    public ConfigEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ConfigEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.name();
    }
}
