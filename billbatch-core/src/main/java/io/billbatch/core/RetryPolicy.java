package io.billbatch.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-item retry policy. Pure: it never sleeps and never looks at the kind of error.
 *
 * <p>Attempts are 0-indexed. After a failed attempt {@code n} the item is retried when
 * {@code n < maxRetries}, after {@link #delay(int) delay(n)}. A permanently failing item is
 * therefore invoked {@code maxRetries + 1} times.
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        boolean exponential
) {
    private static final int MAX_SHIFT = 30;

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
    }

    /**
     * 3 retries, 1s base delay doubling per attempt, capped at 30s.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), true);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, false);
    }

    public static RetryPolicy fixed(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, delay, delay, false);
    }

    public static RetryPolicy exponential(int maxRetries, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, true);
    }

    public void validate() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 but was " + maxRetries);
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative");
        }
    }

    public boolean shouldRetry(int attempt) {
        return attempt < maxRetries;
    }

    /**
     * {@code min(maxDelay, baseDelay * 2^attempt)} when exponential, otherwise {@code baseDelay}.
     */
    public Duration delay(int attempt) {
        if (!exponential) {
            return baseDelay;
        }
        int shift = Math.max(0, Math.min(attempt, MAX_SHIFT));
        Duration scaled;
        try {
            scaled = baseDelay.multipliedBy(1L << shift);
        } catch (ArithmeticException overflow) {
            return maxDelay;
        }
        return scaled.compareTo(maxDelay) > 0 ? maxDelay : scaled;
    }

    /**
     * @param attempt 0-indexed attempt that just failed
     * @param error   the failure; ignored, every failure is treated alike
     */
    public RetryDecision decide(int attempt, Throwable error) {
        if (!shouldRetry(attempt)) {
            return RetryDecision.giveUp();
        }
        return RetryDecision.retryAfter(delay(attempt));
    }
}
