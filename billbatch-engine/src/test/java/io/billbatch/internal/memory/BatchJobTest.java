package io.billbatch.internal.memory;

import io.billbatch.core.BatchConfig;
import io.billbatch.core.ItemOutcome;
import io.billbatch.core.JobSnapshot;
import io.billbatch.core.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchJobTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void recordShouldKeepOneOutcomePerItem() {
        BatchJob<String, String> job = newJob(BatchConfig.defaults(), "a", "b");

        assertTrue(job.record(ItemOutcome.success(0, "a", "A", 1, Duration.ZERO)));
        assertFalse(job.record(ItemOutcome.failure(0, "a", new IllegalStateException("late"), 1, Duration.ZERO)));

        assertEquals(1, job.getProcessedCount());
        assertEquals(0, job.getErrorCount());
        assertTrue(job.hasOutcome(0));
        assertFalse(job.hasOutcome(1));
    }

    @Test
    void endedAtShouldBeStampedOnlyOnFirstTerminalTransition() {
        BatchJob<String, String> job = newJob(BatchConfig.defaults(), "a");

        assertTrue(job.markProcessing(T0.plusSeconds(1)));
        assertTrue(job.transitionTo(JobStatus.CANCELLED, T0.plusSeconds(2)));
        assertFalse(job.transitionTo(JobStatus.COMPLETED, T0.plusSeconds(3)));

        assertEquals(JobStatus.CANCELLED, job.getStatus());
        assertEquals(T0.plusSeconds(2), job.getEndedAt());
        assertEquals(Duration.ofSeconds(1), job.duration(T0.plusSeconds(100)));
    }

    @Test
    void cancelledQueuedJobShouldNotStartProcessing() {
        BatchJob<String, String> job = newJob(BatchConfig.defaults(), "a");

        assertTrue(job.transitionTo(JobStatus.CANCELLED, T0));

        assertFalse(job.markProcessing(T0));
        assertTrue(job.isAdmissionClosed());
    }

    @Test
    void failureWithoutContinueOnErrorShouldAbort() {
        BatchJob<String, String> job = newJob(BatchConfig.defaults().withContinueOnError(false), "a", "b", "c");
        job.markProcessing(T0);

        assertFalse(job.isAdmissionClosed());
        job.record(ItemOutcome.success(0, "a", "A", 1, Duration.ZERO));
        job.record(ItemOutcome.failure(1, "b", new IllegalStateException("bad"), 1, Duration.ZERO));

        assertTrue(job.isAborted());
        assertTrue(job.isAdmissionClosed());
        assertEquals(JobStatus.FAILED, job.resolveTerminalStatus());
    }

    @Test
    void resolveTerminalStatusShouldFollowOutcomes() {
        BatchJob<String, String> clean = newJob(BatchConfig.defaults(), "a", "b");
        clean.record(ItemOutcome.success(0, "a", "A", 1, Duration.ZERO));
        clean.record(ItemOutcome.success(1, "b", "B", 1, Duration.ZERO));
        assertEquals(JobStatus.COMPLETED, clean.resolveTerminalStatus());

        BatchJob<String, String> partial = newJob(BatchConfig.defaults(), "a", "b");
        partial.record(ItemOutcome.success(0, "a", "A", 1, Duration.ZERO));
        partial.record(ItemOutcome.failure(1, "b", new RuntimeException("x"), 1, Duration.ZERO));
        assertEquals(JobStatus.COMPLETED_WITH_ERRORS, partial.resolveTerminalStatus());

        BatchJob<String, String> allFailed = newJob(BatchConfig.defaults(), "a");
        allFailed.record(ItemOutcome.failure(0, "a", new RuntimeException("x"), 1, Duration.ZERO));
        assertEquals(JobStatus.FAILED, allFailed.resolveTerminalStatus());
    }

    @Test
    void snapshotShouldBeDetachedCopy() {
        BatchJob<String, String> job = newJob(BatchConfig.defaults(), "a", "b");
        job.markProcessing(T0);
        job.record(ItemOutcome.success(0, "a", "A", 1, Duration.ZERO));

        JobSnapshot snapshot = job.snapshot(T0.plusSeconds(5));
        job.record(ItemOutcome.success(1, "b", "B", 1, Duration.ZERO));

        assertEquals(1, snapshot.processedCount());
        assertEquals(1, snapshot.results().size());
        assertEquals(50.0, snapshot.progressPercent());
        assertEquals(Duration.ofSeconds(5), snapshot.duration());
        assertNull(snapshot.endedAt());
    }

    @Test
    void emptyJobShouldReportZeroProgress() {
        BatchJob<String, String> job = newJob(BatchConfig.defaults());

        assertEquals(0.0, job.snapshot(T0).progressPercent());
        assertEquals(JobStatus.COMPLETED, job.resolveTerminalStatus());
    }

    private static BatchJob<String, String> newJob(BatchConfig config, String... items) {
        return new BatchJob<String, String>("job-1", List.of(items), String::toUpperCase, config, T0);
    }
}
