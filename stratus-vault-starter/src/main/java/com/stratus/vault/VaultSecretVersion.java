package com.stratus.vault;

import java.time.Instant;

/**
 * One entry of a secret's version history as reported by the backend.
 */
public record VaultSecretVersion(int version, Instant createdAt, Instant deletedAt, boolean destroyed) {
}
