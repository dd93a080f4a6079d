package com.stratus.config.rotation;

import com.stratus.config.error.ConfigEngineException;
import com.stratus.config.error.ErrorCode;

/**
 * A rotation for the same secret is already running.
 */
public class RotationInProgressException extends ConfigEngineException {

    public RotationInProgressException(String secretId) {
        super(ErrorCode.ROTATION_IN_PROGRESS, "Rotation already in progress for secret " + secretId);
    }
}
