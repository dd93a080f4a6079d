package com.stratus.config.rotation;

import java.time.Instant;

/**
 * @param nextRotation when the armed timer fires, or {@code null} when not scheduled
 * @param lastRotation last successful rotation, or {@code null} if never rotated
 */
public record RotationStatus(String secretId, boolean scheduled, Instant nextRotation, Instant lastRotation,
                             boolean inProgress) {
}
