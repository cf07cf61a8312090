package io.billbatch;

import io.billbatch.core.BatchConfig;
import io.billbatch.core.BatchStatistics;
import io.billbatch.core.JobSnapshot;
import io.billbatch.core.SubmissionRequest;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Control surface of the batch engine.
 *
 * <p>Jobs are submitted without blocking, run on a bounded worker pool and can be polled,
 * cancelled and purged. All queries return detached snapshots.
 *
 * <pre>{@code
 * registry.start();
 *
 * String jobId = registry.create(files)
 *         .maxWorkers(4)
 *         .batchSize(10)
 *         .continueOnError(true)
 *         .submit(file -> renderBill(file));
 *
 * registry.getStatus(jobId).ifPresent(s -> log.info("progress={}", s.progressPercent()));
 * registry.stop();
 * }</pre>
 */
public interface JobRegistry {
    void start();

    /**
     * Cancel active jobs and release the dispatch threads.
     */
    void stop();

    boolean isRunning();

    <T> SubmissionBuilder<T> create(List<T> items);

    /**
     * Submit a job with a generated id.
     *
     * @throws IllegalArgumentException if the config is invalid
     */
    <T, R> String submit(List<T> items, BatchProcessor<T, R> processor, BatchConfig config);

    /**
     * Submit a job under a caller-chosen id. A null id means "generate one".
     *
     * @throws IllegalArgumentException if the config is invalid or the id is already in use
     */
    <T, R> String submit(String jobId, List<T> items, BatchProcessor<T, R> processor, BatchConfig config);

    /**
     * Submit a job against a processor registered by name. Raw items are converted to the
     * processor's item class.
     */
    String submit(SubmissionRequest request);

    Optional<JobSnapshot> getStatus(String jobId);

    /**
     * Cooperatively cancel a queued or running job. Items already started run to completion.
     *
     * @return false if the job is unknown or already terminal
     */
    boolean cancel(String jobId);

    List<JobSnapshot> listActive();

    List<JobSnapshot> listAll();

    /**
     * Purge jobs that reached a terminal state more than {@code maxAge} ago.
     *
     * @return number of purged jobs
     */
    int cleanup(Duration maxAge);

    BatchStatistics statistics();
}
