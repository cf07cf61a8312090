package io.billbatch.core;

import java.time.Duration;

/**
 * Cumulative registry counters.
 *
 * completedJobs       : jobs finished as COMPLETED or COMPLETED_WITH_ERRORS
 * failedJobs          : jobs finished as FAILED
 * cancelledJobs       : jobs finished as CANCELLED
 * activeJobs          : jobs currently QUEUED or PROCESSING
 * totalItemsProcessed : items with a recorded outcome, summed at each job's terminal transition
 * averageDuration     : mean duration over all terminal jobs
 * successRate         : percentage of finished (non-cancelled) jobs that ended COMPLETED
 */
public record BatchStatistics(
        long totalJobs,
        long completedJobs,
        long failedJobs,
        long cancelledJobs,
        int activeJobs,
        long totalItemsProcessed,
        Duration averageDuration,
        double successRate
) {
}
