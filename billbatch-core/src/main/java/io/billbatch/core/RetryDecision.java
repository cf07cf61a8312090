package io.billbatch.core;

import java.time.Duration;

/**
 * Outcome of consulting a {@link RetryPolicy} after a failed attempt.
 */
public record RetryDecision(
        boolean retry,
        Duration delay
) {

    public static RetryDecision giveUp() {
        return new RetryDecision(false, Duration.ZERO);
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
