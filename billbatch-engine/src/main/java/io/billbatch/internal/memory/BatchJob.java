package io.billbatch.internal.memory;

import io.billbatch.BatchProcessor;
import io.billbatch.core.BatchConfig;
import io.billbatch.core.ItemOutcome;
import io.billbatch.core.JobSnapshot;
import io.billbatch.core.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory state of one submitted job.
 *
 * <p>All mutation goes through the synchronized methods below. Each item gets at most one
 * recorded outcome; the status only moves forward and {@code endedAt} is stamped once, on the
 * first terminal transition.
 */
public class BatchJob<T, R> {

    private final String jobId;
    private final List<T> items;
    private final BatchProcessor<T, R> processor;
    private final BatchConfig config;
    private final Instant submittedAt;

    private JobStatus status = JobStatus.QUEUED;
    private Instant startedAt;
    private Instant endedAt;

    private final List<ItemOutcome<T, R>> results = new ArrayList<>();
    private final List<ItemOutcome<T, R>> errors = new ArrayList<>();
    private final boolean[] recorded;
    private int processedCount;
    private boolean aborted;

    public BatchJob(String jobId, List<T> items, BatchProcessor<T, R> processor, BatchConfig config, Instant submittedAt) {
        this.jobId = jobId;
        this.items = items;
        this.processor = processor;
        this.config = config;
        this.submittedAt = submittedAt;
        this.recorded = new boolean[items.size()];
    }

    public String getJobId() {
        return jobId;
    }

    public List<T> getItems() {
        return items;
    }

    public BatchProcessor<T, R> getProcessor() {
        return processor;
    }

    public BatchConfig getConfig() {
        return config;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public int getTotalItems() {
        return items.size();
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized Instant getEndedAt() {
        return endedAt;
    }

    public synchronized int getProcessedCount() {
        return processedCount;
    }

    public synchronized int getErrorCount() {
        return errors.size();
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    public synchronized boolean isCancelled() {
        return status == JobStatus.CANCELLED;
    }

    /**
     * True once no further items may be started: the job was cancelled, finished, or aborted
     * after a failure with continueOnError=false.
     */
    public synchronized boolean isAdmissionClosed() {
        return status != JobStatus.PROCESSING || aborted;
    }

    public synchronized boolean hasOutcome(int index) {
        return recorded[index];
    }

    /**
     * QUEUED -> PROCESSING.
     *
     * @return false if the job left QUEUED in the meantime (e.g. it was cancelled)
     */
    public synchronized boolean markProcessing(Instant now) {
        if (status != JobStatus.QUEUED) {
            return false;
        }
        status = JobStatus.PROCESSING;
        startedAt = now;
        return true;
    }

    /**
     * @return true only for the call that actually performed the transition
     */
    public synchronized boolean transitionTo(JobStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        if (next.isTerminal() && endedAt == null) {
            endedAt = now;
        }
        return true;
    }

    /**
     * Append an outcome unless the item already has one.
     *
     * @return false if the outcome was dropped as a duplicate
     */
    public synchronized boolean record(ItemOutcome<T, R> outcome) {
        int index = outcome.index();
        if (recorded[index]) {
            return false;
        }
        recorded[index] = true;
        processedCount++;
        if (outcome.isSuccess()) {
            results.add(outcome);
        } else {
            errors.add(outcome);
            if (!config.continueOnError()) {
                aborted = true;
            }
        }
        return true;
    }

    /**
     * Status implied by the recorded outcomes once execution has stopped.
     */
    public synchronized JobStatus resolveTerminalStatus() {
        if (errors.isEmpty()) {
            return JobStatus.COMPLETED;
        }
        if (errors.size() == items.size() || !config.continueOnError()) {
            return JobStatus.FAILED;
        }
        return JobStatus.COMPLETED_WITH_ERRORS;
    }

    public synchronized Duration duration(Instant now) {
        Instant from = startedAt != null ? startedAt : submittedAt;
        Instant to = endedAt != null ? endedAt : now;
        return to.isBefore(from) ? Duration.ZERO : Duration.between(from, to);
    }

    public synchronized JobSnapshot snapshot(Instant now) {
        return new JobSnapshot(
                jobId,
                status,
                items.size(),
                processedCount,
                errors.size(),
                submittedAt,
                startedAt,
                endedAt,
                duration(now),
                new ArrayList<>(results),
                new ArrayList<>(errors)
        );
    }
}
