package com.stratus.config.rotation;

import com.stratus.config.error.ConfigEngineException;
import com.stratus.config.error.ErrorCode;

public class UnknownRotationTypeException extends ConfigEngineException {

    public UnknownRotationTypeException(String type) {
        super(ErrorCode.UNKNOWN_ROTATION_TYPE, "No rotation handler found for type " + type);
    }
}
