package io.billbatch.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a job's state at the time of the query.
 */
public record JobSnapshot(
        String jobId,
        JobStatus status,
        int totalItems,
        int processedCount,
        int errorsCount,
        Instant submittedAt,
        Instant startedAt,
        Instant endedAt,
        Duration duration,
        List<ItemOutcome<?, ?>> results,
        List<ItemOutcome<?, ?>> errors
) {

    public JobSnapshot {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
    }

    /**
     * {@code processedCount / totalItems * 100}; 0 for an empty job.
     */
    public double progressPercent() {
        if (totalItems == 0) {
            return 0.0;
        }
        return processedCount * 100.0 / totalItems;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
