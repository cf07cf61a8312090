package io.billbatch.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchConfigTest {

    @Test
    void defaultsShouldBeValid() {
        BatchConfig config = BatchConfig.defaults();

        assertDoesNotThrow(config::validate);
        assertEquals(4, config.maxWorkers());
        assertEquals(100, config.batchSize());
        assertEquals(Duration.ofSeconds(300), config.timeout());
        assertTrue(config.continueOnError());
    }

    @Test
    void validateShouldRejectInvalidFields() {
        BatchConfig base = BatchConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> base.withMaxWorkers(0).validate());
        assertThrows(IllegalArgumentException.class, () -> base.withBatchSize(0).validate());
        assertThrows(IllegalArgumentException.class, () -> base.withTimeout(Duration.ZERO).validate());
        assertThrows(IllegalArgumentException.class, () -> base.withTimeout(Duration.ofSeconds(-1)).validate());
        assertThrows(IllegalArgumentException.class,
                () -> base.withRetryPolicy(new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, false)).validate());
    }

    @Test
    void statusTransitionsShouldOnlyMoveForward() {
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.PROCESSING));
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.CANCELLED));
        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.COMPLETED_WITH_ERRORS));
        assertFalse(JobStatus.PROCESSING.canTransitionTo(JobStatus.QUEUED));
        assertFalse(JobStatus.COMPLETED.canTransitionTo(JobStatus.CANCELLED));
        assertFalse(JobStatus.CANCELLED.canTransitionTo(JobStatus.FAILED));
        assertEquals("completed_with_errors", JobStatus.COMPLETED_WITH_ERRORS.wireName());
    }
}
