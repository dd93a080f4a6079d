package com.stratus.config.error;

public class NotFoundException extends ConfigEngineException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
