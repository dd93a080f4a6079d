package com.stratus.config.rotation;

import java.time.Instant;

public record PendingRotation(String secretId, Instant scheduledAt, Instant dueAt) {
}
