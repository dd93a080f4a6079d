package com.stratus.vault;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tracks tokens issued through a {@link VaultConnector} until their lease runs out.
 * <p>
 * Entries expire on their own lease: each token lives for its TTL from the time it
 * was issued or last renewed. The store is owned by the connector that created it,
 * so its lifetime is the connector's lifetime.
 */
public class VaultTokenSessionStore {

    private static final Logger log = LoggerFactory.getLogger(VaultTokenSessionStore.class);

    private final Cache<String, IssuedToken> tokens;
    private final Duration defaultTtl;

    public VaultTokenSessionStore(VaultProperties.TokenStoreConfig config) {
        this(config.getDefaultTtl(), config.getMaxSize());
    }

    public VaultTokenSessionStore(Duration defaultTtl, long maxSize) {
        this(defaultTtl, maxSize, Ticker.systemTicker());
    }

    VaultTokenSessionStore(Duration defaultTtl, long maxSize, Ticker ticker) {
        this.defaultTtl = defaultTtl;
        this.tokens = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new LeaseExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public void register(IssuedToken token) {
        tokens.put(token.token(), token);
        log.debug("Tracking issued token accessor={} ttl={}", token.accessor(), effectiveTtl(token));
    }

    public Optional<IssuedToken> find(String token) {
        return Optional.ofNullable(tokens.getIfPresent(token));
    }

    /**
     * Restart the lease of a tracked token. Unknown tokens are ignored.
     */
    public void renew(String token, Duration increment) {
        IssuedToken existing = tokens.getIfPresent(token);
        if (existing != null) {
            tokens.put(token, existing.renewedAt(Instant.now(), increment));
        }
    }

    public void revoke(String token) {
        tokens.invalidate(token);
    }

    public List<IssuedToken> activeTokens() {
        return List.copyOf(tokens.asMap().values());
    }

    public void clear() {
        tokens.invalidateAll();
    }

    private Duration effectiveTtl(IssuedToken token) {
        return token.ttl() != null ? token.ttl() : defaultTtl;
    }

    private class LeaseExpiry implements Expiry<String, IssuedToken> {

        @Override
        public long expireAfterCreate(String key, IssuedToken value, long currentTime) {
            return effectiveTtl(value).toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, IssuedToken value, long currentTime, long currentDuration) {
            return effectiveTtl(value).toNanos();
        }

        @Override
        public long expireAfterRead(String key, IssuedToken value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
