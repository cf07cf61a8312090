package io.billbatch.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void exponentialDelayShouldDoubleUntilCapped() {
        RetryPolicy policy = RetryPolicy.exponential(10, Duration.ofSeconds(1), Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(1), policy.delay(0));
        assertEquals(Duration.ofSeconds(2), policy.delay(1));
        assertEquals(Duration.ofSeconds(16), policy.delay(4));
        assertEquals(Duration.ofSeconds(30), policy.delay(5));
        assertEquals(Duration.ofSeconds(30), policy.delay(500));
    }

    @Test
    void fixedDelayShouldNotGrow() {
        RetryPolicy policy = RetryPolicy.fixed(3, Duration.ofMillis(250));

        assertEquals(Duration.ofMillis(250), policy.delay(0));
        assertEquals(Duration.ofMillis(250), policy.delay(7));
    }

    @Test
    void decideShouldRetryOnlyWhileAttemptBelowMaxRetries() {
        RetryPolicy policy = RetryPolicy.exponential(2, Duration.ofMillis(100), Duration.ofSeconds(1));
        Exception boom = new IllegalStateException("boom");

        RetryDecision first = policy.decide(0, boom);
        RetryDecision second = policy.decide(1, boom);
        RetryDecision third = policy.decide(2, boom);

        assertTrue(first.retry());
        assertEquals(Duration.ofMillis(100), first.delay());
        assertTrue(second.retry());
        assertEquals(Duration.ofMillis(200), second.delay());
        assertFalse(third.retry());
    }

    @Test
    void noneShouldNeverRetry() {
        assertFalse(RetryPolicy.none().decide(0, new RuntimeException()).retry());
    }

    @Test
    void validateShouldRejectNegativeRetries() {
        RetryPolicy policy = new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, false);
        assertThrows(IllegalArgumentException.class, policy::validate);
    }
}
