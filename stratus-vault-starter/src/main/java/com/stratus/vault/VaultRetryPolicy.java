package com.stratus.vault;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with linear backoff around backend calls.
 * <p>
 * Only transient failures are retried: I/O errors surfaced by {@code RestTemplate}
 * as {@link ResourceAccessException} (connection reset, timeout, unknown host) and
 * 5xx responses. Client errors propagate on the first attempt.
 */
public class VaultRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(VaultRetryPolicy.class);

    private final Retry retry;
    private final int maxAttempts;

    public VaultRetryPolicy(VaultProperties.RetryConfig config) {
        this(config.getMaxAttempts(), config.getBaseDelay());
    }

    public VaultRetryPolicy(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        long baseDelayMillis = Math.max(0L, baseDelay.toMillis());
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(linearBackoff(baseDelayMillis))
                .retryOnException(VaultRetryPolicy::isTransient)
                .failAfterMaxAttempts(false)
                .build();
        this.retry = Retry.of("vault-connector", retryConfig);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying Vault call (attempt {}/{}) after {}ms: {}",
                        event.getNumberOfRetryAttempts() + 1, maxAttempts,
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Run {@code call} under the retry policy. The last failure is rethrown unchanged
     * once attempts are exhausted.
     */
    public <T> T execute(Supplier<T> call) {
        return retry.executeSupplier(call);
    }

    public void run(Runnable call) {
        retry.executeRunnable(call);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    Retry getRetry() {
        return retry;
    }

    static boolean isTransient(Throwable error) {
        return error instanceof ResourceAccessException
                || error instanceof HttpServerErrorException;
    }

    private static IntervalFunction linearBackoff(long baseDelayMillis) {
        return attempt -> baseDelayMillis * attempt;
    }
}
