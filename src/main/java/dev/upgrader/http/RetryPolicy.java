package dev.upgrader.http;

import dev.upgrader.config.HttpConfig;
import lombok.Getter;

import java.time.Duration;
import java.util.Set;

/**
 * Which failures are retried and how long to wait before each retry.
 * <p>
 * Retry {@code n} (0-based, {@code n < maxRetries}) waits
 * {@code min(backoffFactor * 2^n, maxBackoff)}.
 */
@Getter
public final class RetryPolicy {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final int maxRetries;
    private final Duration backoffFactor;
    private final Duration maxBackoff;

    public RetryPolicy(int maxRetries, Duration backoffFactor, Duration maxBackoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.backoffFactor = backoffFactor;
        this.maxBackoff = maxBackoff;
    }

    public static RetryPolicy from(HttpConfig config) {
        return new RetryPolicy(config.getMaxRetries(), config.getBackoffFactor(), config.getMaxBackoff());
    }

    public boolean isRetryableStatus(int statusCode) {
        return RETRYABLE_STATUSES.contains(statusCode);
    }

    /**
     * @param attempt number of retries already made
     */
    public boolean canRetry(int attempt) {
        return attempt < maxRetries;
    }

    public Duration backoffDelay(int attempt) {
        long millis = backoffFactor.toMillis() * (1L << Math.min(attempt, 30));
        return millis >= maxBackoff.toMillis() ? maxBackoff : Duration.ofMillis(millis);
    }
}
