package io.billbatch;

import io.billbatch.core.BatchConfig;
import io.billbatch.core.RetryPolicy;

import java.time.Duration;

/**
 * Fluent builder for a batch submission.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns the validated {@link BatchConfig} only</li>
 *   <li>submit(processor): build() + hand the job to the registry</li>
 * </ul>
 */
public interface SubmissionBuilder<T> {

    /**
     * Use a caller-chosen job id instead of a generated one.
     */
    SubmissionBuilder<T> jobId(String jobId);

    SubmissionBuilder<T> maxWorkers(int maxWorkers);

    SubmissionBuilder<T> batchSize(int batchSize);

    /**
     * Wall-clock ceiling for the whole job, measured from processing start.
     */
    SubmissionBuilder<T> timeout(Duration timeout);

    /**
     * Timeout as a human interval, e.g. "90 seconds" or "5m".
     */
    SubmissionBuilder<T> timeout(String timeout);

    SubmissionBuilder<T> retryPolicy(RetryPolicy retryPolicy);

    /**
     * Shortcut for {@code retryPolicy(RetryPolicy.none())}.
     */
    SubmissionBuilder<T> noRetry();

    SubmissionBuilder<T> continueOnError(boolean continueOnError);

    BatchConfig build();

    <R> String submit(BatchProcessor<T, R> processor);
}
