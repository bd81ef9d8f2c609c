package com.specforge.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff.
 *
 * <p>Attempt {@code n} (1-based) that fails transiently is followed by a delay of
 * {@code baseDelay * 2^(n-1)}; after {@code maxRetries} retries the failure stands.
 *
 * @param maxRetries retries after the first attempt
 * @param baseDelay delay before the first retry
 */
public record RetryPolicy(int maxRetries, Duration baseDelay) {

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(200);

    /**
     * Compact constructor with validation.
     */
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY);
    }

    /**
     * Returns the delay after the given failed attempt.
     *
     * @param attempt 1-based attempt number
     * @return backoff delay
     */
    public Duration delayAfter(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(Math.max(attempt - 1, 0), 30));
    }
}
