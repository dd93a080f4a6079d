package com.stratus.config.error;

/**
 * The backing store could not be reached. Callers decide whether to degrade; the engine
 * never substitutes data of its own.
 */
public class DataSourceUnavailableException extends ConfigEngineException {

    public DataSourceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DATA_SOURCE_UNAVAILABLE, message, cause);
    }
}
