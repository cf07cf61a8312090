package io.billbatch.core;

import java.time.Duration;

/**
 * Immutable per-job policy.
 *
 * maxWorkers      : upper bound of concurrently executing items
 * batchSize       : sub-batch size used for dispatch
 * timeout         : wall-clock ceiling for the whole job, from processing start
 * retryPolicy     : per-item retry behavior
 * continueOnError : if false, the first item that fails for good aborts the job
 */
public record BatchConfig(
        int maxWorkers,
        int batchSize,
        Duration timeout,
        RetryPolicy retryPolicy,
        boolean continueOnError
) {
    public static final int DEFAULT_MAX_WORKERS = 4;
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    public static BatchConfig defaults() {
        return new BatchConfig(DEFAULT_MAX_WORKERS, DEFAULT_BATCH_SIZE, DEFAULT_TIMEOUT, RetryPolicy.defaults(), true);
    }

    /**
     * Rejects configurations that must never reach the queue.
     *
     * @throws IllegalArgumentException describing the first invalid field
     */
    public void validate() {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1 but was " + maxWorkers);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1 but was " + batchSize);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy must not be null");
        }
        retryPolicy.validate();
    }

    public BatchConfig withMaxWorkers(int maxWorkers) {
        return new BatchConfig(maxWorkers, batchSize, timeout, retryPolicy, continueOnError);
    }

    public BatchConfig withBatchSize(int batchSize) {
        return new BatchConfig(maxWorkers, batchSize, timeout, retryPolicy, continueOnError);
    }

    public BatchConfig withTimeout(Duration timeout) {
        return new BatchConfig(maxWorkers, batchSize, timeout, retryPolicy, continueOnError);
    }

    public BatchConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new BatchConfig(maxWorkers, batchSize, timeout, retryPolicy, continueOnError);
    }

    public BatchConfig withContinueOnError(boolean continueOnError) {
        return new BatchConfig(maxWorkers, batchSize, timeout, retryPolicy, continueOnError);
    }
}
