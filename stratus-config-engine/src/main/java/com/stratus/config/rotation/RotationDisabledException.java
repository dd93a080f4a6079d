package com.stratus.config.rotation;

import com.stratus.config.error.ConfigEngineException;
import com.stratus.config.error.ErrorCode;

public class RotationDisabledException extends ConfigEngineException {

    public RotationDisabledException(String secretId) {
        super(ErrorCode.ROTATION_DISABLED, "Rotation is not enabled for secret " + secretId);
    }
}
