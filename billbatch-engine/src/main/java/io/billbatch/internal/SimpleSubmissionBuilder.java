package io.billbatch.internal;

import io.billbatch.BatchProcessor;
import io.billbatch.JobRegistry;
import io.billbatch.SubmissionBuilder;
import io.billbatch.core.BatchConfig;
import io.billbatch.core.RetryPolicy;
import io.billbatch.utils.IntervalParser;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link SubmissionBuilder}, starting from the registry's default config.
 */
public class SimpleSubmissionBuilder<T> implements SubmissionBuilder<T> {

    private final JobRegistry registry;
    private final List<T> items;

    private String jobId;
    private int maxWorkers;
    private int batchSize;
    private Duration timeout;
    private RetryPolicy retryPolicy;
    private boolean continueOnError;

    public SimpleSubmissionBuilder(JobRegistry registry, List<T> items, BatchConfig defaults) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.items = Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(defaults, "defaults must not be null");
        this.maxWorkers = defaults.maxWorkers();
        this.batchSize = defaults.batchSize();
        this.timeout = defaults.timeout();
        this.retryPolicy = defaults.retryPolicy();
        this.continueOnError = defaults.continueOnError();
    }

    @Override
    public SubmissionBuilder<T> jobId(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        if (jobId.isBlank()) throw new IllegalArgumentException("jobId must not be blank");

        this.jobId = jobId;
        return this;
    }

    @Override
    public SubmissionBuilder<T> maxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
        return this;
    }

    @Override
    public SubmissionBuilder<T> batchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    @Override
    public SubmissionBuilder<T> timeout(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        return this;
    }

    @Override
    public SubmissionBuilder<T> timeout(String timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        this.timeout = IntervalParser.parseDuration(timeout);
        return this;
    }

    @Override
    public SubmissionBuilder<T> retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        return this;
    }

    @Override
    public SubmissionBuilder<T> noRetry() {
        this.retryPolicy = RetryPolicy.none();
        return this;
    }

    @Override
    public SubmissionBuilder<T> continueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
        return this;
    }

    @Override
    public BatchConfig build() {
        BatchConfig config = new BatchConfig(maxWorkers, batchSize, timeout, retryPolicy, continueOnError);
        config.validate();
        return config;
    }

    @Override
    public <R> String submit(BatchProcessor<T, R> processor) {
        return registry.submit(jobId, items, processor, build());
    }
}
