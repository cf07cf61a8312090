package io.billbatch.internal.memory;

import io.billbatch.BatchProcessor;
import io.billbatch.core.BatchConfig;
import io.billbatch.core.ItemOutcome;
import io.billbatch.core.JobStatus;
import io.billbatch.core.JobTimeoutException;
import io.billbatch.core.RetryDecision;
import io.billbatch.core.RetryPolicy;
import io.billbatch.resource.ResourceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one {@link BatchJob} from PROCESSING to the point where its terminal status is known.
 *
 * <p>Items are dispatched sub-batch by sub-batch, in order, onto a pool of {@code maxWorkers}
 * threads. A semaphore with the same number of permits keeps admission just-in-time, so the
 * resource monitor and the cancel/abort flags are consulted right before each item starts.
 * Running items are never interrupted.
 */
class BatchExecutor {
    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    private static final long SLOT_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ResourceMonitor resourceMonitor;
    private final Sleeper sleeper;
    private final Duration admissionPollInterval;

    BatchExecutor(ResourceMonitor resourceMonitor, Sleeper sleeper, Duration admissionPollInterval) {
        this.resourceMonitor = Objects.requireNonNull(resourceMonitor, "resourceMonitor must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.admissionPollInterval = Objects.requireNonNull(admissionPollInterval, "admissionPollInterval must not be null");
    }

    /**
     * Run the job until every dispatched item has an outcome or the job timeout expires.
     *
     * @return the terminal status to apply, or null if the job was cancelled
     */
    <T, R> JobStatus execute(BatchJob<T, R> job) {
        BatchConfig config = job.getConfig();
        int total = job.getTotalItems();
        // wraps for very long timeouts; only deadline differences are compared
        long deadline = System.nanoTime() + saturatedNanos(config.timeout());

        boolean[] dispatched = new boolean[total];
        List<Future<?>> inFlight = new ArrayList<>();
        Semaphore slots = new Semaphore(config.maxWorkers());
        ExecutorService workers = newWorkerPool(job.getJobId(), config.maxWorkers());

        RuntimeException stopCause = null;
        try {
            dispatch:
            for (int start = 0; start < total; start += config.batchSize()) {
                int end = Math.min(start + config.batchSize(), total);
                int next = start;
                try {
                    for (; next < end; next++) {
                        if (!awaitSlot(job, slots, deadline)) {
                            break dispatch;
                        }
                        final int index = next;
                        try {
                            inFlight.add(workers.submit(() -> runItem(job, index, slots)));
                        } catch (RuntimeException e) {
                            slots.release();
                            throw e;
                        }
                        dispatched[index] = true;
                    }
                } catch (RuntimeException e) {
                    log.error("sub-batch dispatch failed jobId={} range=[{},{}) msg={}", job.getJobId(), start, end, e.getMessage(), e);
                    for (int i = next; i < end; i++) {
                        job.record(ItemOutcome.failure(i, job.getItems().get(i), e, 0, Duration.ZERO));
                    }
                }
            }

            for (Future<?> future : inFlight) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                try {
                    future.get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    break;
                } catch (ExecutionException e) {
                    log.error("item task failed unexpectedly jobId={} msg={}", job.getJobId(), e.getMessage(), e);
                }
            }

            if (System.nanoTime() - deadline >= 0 && hasPending(job, dispatched)) {
                stopCause = new JobTimeoutException(job.getJobId(), config.timeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopCause = new IllegalStateException("Job " + job.getJobId() + " was interrupted");
        } finally {
            workers.shutdown();
        }

        if (stopCause != null) {
            abandonPending(job, dispatched, stopCause);
        }

        if (job.isCancelled()) {
            return null;
        }
        return job.resolveTerminalStatus();
    }

    /**
     * Record a failure for every item that has no outcome yet. For cancelled or aborted jobs only
     * items that were actually started are covered; the rest were never admitted.
     */
    private <T, R> void abandonPending(BatchJob<T, R> job, boolean[] dispatched, RuntimeException cause) {
        boolean onlyStarted = onlyStartedItemsPending(job);
        int abandoned = 0;
        for (int i = 0; i < dispatched.length; i++) {
            if (onlyStarted && !dispatched[i]) {
                continue;
            }
            if (job.record(ItemOutcome.failure(i, job.getItems().get(i), cause, 0, Duration.ZERO))) {
                abandoned++;
            }
        }
        log.warn("batch job stopped waiting jobId={} abandonedItems={} reason={}", job.getJobId(), abandoned, cause.getMessage());
    }

    private boolean hasPending(BatchJob<?, ?> job, boolean[] dispatched) {
        boolean onlyStarted = onlyStartedItemsPending(job);
        for (int i = 0; i < dispatched.length; i++) {
            if ((dispatched[i] || !onlyStarted) && !job.hasOutcome(i)) {
                return true;
            }
        }
        return false;
    }

    private static boolean onlyStartedItemsPending(BatchJob<?, ?> job) {
        return job.isCancelled() || job.isAborted();
    }

    /**
     * Wait for a free worker slot and resource admission.
     *
     * @return false if the job stopped admitting items or ran out of time; no permit is held then
     */
    private boolean awaitSlot(BatchJob<?, ?> job, Semaphore slots, long deadline) throws InterruptedException {
        boolean throttled = false;
        while (true) {
            if (job.isAdmissionClosed()) {
                return false;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            if (!slots.tryAcquire(Math.min(remaining, SLOT_POLL_NANOS), TimeUnit.NANOSECONDS)) {
                continue;
            }
            // the item that freed this slot may have aborted the job
            if (job.isAdmissionClosed()) {
                slots.release();
                return false;
            }
            if (resourceMonitor.checkAdmission()) {
                if (throttled) {
                    log.info("admission resumed jobId={}", job.getJobId());
                }
                return true;
            }
            slots.release();
            if (!throttled) {
                log.warn("admission paused by resource pressure jobId={}", job.getJobId());
                throttled = true;
            }
            long pause = Math.min(admissionPollInterval.toNanos(), deadline - System.nanoTime());
            if (pause > 0) {
                TimeUnit.NANOSECONDS.sleep(pause);
            }
        }
    }

    private <T, R> void runItem(BatchJob<T, R> job, int index, Semaphore slots) {
        try {
            ItemOutcome<T, R> outcome = attempt(job, index);
            if (!job.record(outcome)) {
                log.debug("late outcome dropped jobId={} index={} status={}", job.getJobId(), index, outcome.status());
            }
        } finally {
            slots.release();
        }
    }

    /**
     * Call the processor until it succeeds or the retry policy gives up. Never throws.
     */
    private <T, R> ItemOutcome<T, R> attempt(BatchJob<T, R> job, int index) {
        T item = job.getItems().get(index);
        BatchProcessor<T, R> processor = job.getProcessor();
        RetryPolicy policy = job.getConfig().retryPolicy();
        long startedAt = System.nanoTime();

        for (int attempt = 0; ; attempt++) {
            try {
                R value = processor.process(item);
                return ItemOutcome.success(index, item, value, attempt + 1, elapsedSince(startedAt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ItemOutcome.failure(index, item, e, attempt + 1, elapsedSince(startedAt));
            } catch (Exception e) {
                RetryDecision decision = policy.decide(attempt, e);
                if (!decision.retry()) {
                    log.warn("item failed jobId={} index={} attempts={} msg={}", job.getJobId(), index, attempt + 1, e.getMessage());
                    return ItemOutcome.failure(index, item, e, attempt + 1, elapsedSince(startedAt));
                }
                if (job.hasOutcome(index)) {
                    return ItemOutcome.failure(index, item, e, attempt + 1, elapsedSince(startedAt));
                }
                log.debug("item attempt failed, retrying jobId={} index={} attempt={} delay={} msg={}",
                        job.getJobId(), index, attempt + 1, decision.delay(), e.getMessage());
                try {
                    sleeper.sleep(decision.delay());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return ItemOutcome.failure(index, item, e, attempt + 1, elapsedSince(startedAt));
                }
            } catch (Error e) {
                log.error("item raised an error, not retried jobId={} index={} msg={}", job.getJobId(), index, e.getMessage(), e);
                return ItemOutcome.failure(index, item, e, attempt + 1, elapsedSince(startedAt));
            }
        }
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static Duration elapsedSince(long startedAtNanos) {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos);
    }

    private static ExecutorService newWorkerPool(String jobId, int size) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r);
            t.setName("billbatch.worker-" + jobId + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
