package com.stratus.config.rotation;

import com.stratus.config.secret.Secret;
import com.stratus.config.secret.SecretRotationConfig;

/**
 * Generates the replacement value for one rotation type.
 */
public interface RotationHandler {

    /**
     * Registry key matched against {@link SecretRotationConfig#getType()}.
     */
    String getType();

    /**
     * Produce a new secret value. Must not touch the backend; the scheduler stores the result.
     */
    String generate(Secret secret, SecretRotationConfig config);
}
