package com.stratus.vault;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A token issued through {@link VaultConnector#createToken(List, Duration)}.
 */
public record IssuedToken(String token, String accessor, List<String> policies, Duration ttl, Instant issuedAt) {

    public IssuedToken {
        policies = policies != null ? List.copyOf(policies) : List.of();
    }

    public IssuedToken renewedAt(Instant renewedAt, Duration newTtl) {
        return new IssuedToken(token, accessor, policies, newTtl != null ? newTtl : ttl, renewedAt);
    }
}
