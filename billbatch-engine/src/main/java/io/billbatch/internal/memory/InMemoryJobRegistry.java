package io.billbatch.internal.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.billbatch.BatchProcessor;
import io.billbatch.JobRegistry;
import io.billbatch.NamedBatchProcessor;
import io.billbatch.SubmissionBuilder;
import io.billbatch.config.BatchProperties;
import io.billbatch.core.BatchConfig;
import io.billbatch.core.BatchStatistics;
import io.billbatch.core.JobSnapshot;
import io.billbatch.core.JobStatus;
import io.billbatch.core.ProcessorRegistry;
import io.billbatch.core.SubmissionRequest;
import io.billbatch.internal.SimpleSubmissionBuilder;
import io.billbatch.resource.ResourceMonitor;
import io.billbatch.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local job registry and runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Non-blocking submission; jobs wait in a queue until a dispatch slot frees up</li>
 *   <li>One dispatcher thread hands queued jobs to a pool of {@code maxConcurrentJobs} runners</li>
 *   <li>Per-job bounded item concurrency, retries and resource throttling ({@link BatchExecutor})</li>
 *   <li>Cooperative cancellation, periodic cleanup of finished jobs, cumulative statistics</li>
 * </ul>
 *
 * <p>Jobs submitted before {@link #start()} stay queued until the registry is started. Nothing
 * survives the process.
 */
public class InMemoryJobRegistry implements JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobRegistry.class);

    private final BatchProperties props;
    private final ProcessorRegistry processors;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BatchExecutor executor;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService jobRunners;
    private Thread dispatcherThread;
    private Thread janitorThread;

    private final LinkedBlockingQueue<BatchJob<?, ?>> queue = new LinkedBlockingQueue<>();
    private final Semaphore jobSlots;
    private final AtomicLong idSequence = new AtomicLong();

    // guards jobs and every counter below
    private final Object lock = new Object();
    private final Map<String, BatchJob<?, ?>> jobs = new LinkedHashMap<>();
    private long totalJobs;
    private long completedJobs;
    private long cleanJobs;
    private long failedJobs;
    private long cancelledJobs;
    private long totalItemsProcessed;
    private long terminalJobs;
    private Duration totalDuration = Duration.ZERO;

    public InMemoryJobRegistry(BatchProperties props, ProcessorRegistry processors, ResourceMonitor resourceMonitor, ObjectMapper objectMapper) {
        this(props, processors, resourceMonitor, objectMapper, Clock.systemUTC(), Sleeper.threadSleep());
    }

    public InMemoryJobRegistry(BatchProperties props,
                               ProcessorRegistry processors,
                               ResourceMonitor resourceMonitor,
                               ObjectMapper objectMapper,
                               Clock clock,
                               Sleeper sleeper) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.processors = Objects.requireNonNull(processors, "processors must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxConcurrentJobs() < 1) {
            throw new IllegalArgumentException("billbatch.maxConcurrentJobs must be >= 1");
        }
        ResourceMonitor monitor = props.isResourceCheckEnabled()
                ? Objects.requireNonNull(resourceMonitor, "resourceMonitor must not be null")
                : ResourceMonitor.alwaysAllow();
        this.executor = new BatchExecutor(monitor, sleeper, props.getAdmissionPollInterval());
        this.jobSlots = new Semaphore(props.getMaxConcurrentJobs());
    }

    /**
     * Start dispatching queued jobs. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Batch registry starting with maxConcurrentJobs={}, resourceCheckEnabled={}, cleanupEvery={}, cleanupMaxAge={}",
                props.getMaxConcurrentJobs(),
                props.isResourceCheckEnabled(),
                props.getCleanupEvery(),
                props.getCleanupMaxAge());

        if (jobRunners == null) {
            AtomicInteger seq = new AtomicInteger();
            jobRunners = Executors.newFixedThreadPool(props.getMaxConcurrentJobs(), r -> {
                Thread t = new Thread(r);
                t.setName("billbatch.jobRunner-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("billbatch.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }

        String cleanupEvery = props.getCleanupEvery();
        if (janitorThread == null && cleanupEvery != null && !cleanupEvery.isBlank()) {
            janitorThread = new Thread(this::janitorLoop);
            janitorThread.setName("billbatch.janitor");
            janitorThread.setDaemon(true);
            janitorThread.start();
        }
        log.info("Batch registry started successfully.");
    }

    /**
     * Cancel active jobs and stop all threads. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Batch registry stopping...");

        for (JobSnapshot active : listActive()) {
            cancel(active.jobId());
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }
        if (janitorThread != null) {
            janitorThread.interrupt();
            janitorThread = null;
        }

        if (jobRunners != null) {
            jobRunners.shutdown();
            try {
                if (!jobRunners.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    jobRunners.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                jobRunners.shutdownNow();
            } finally {
                jobRunners = null;
            }
        }

        // jobs submitted while the sweep above ran are still queued
        List<BatchJob<?, ?>> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        for (BatchJob<?, ?> job : leftover) {
            cancel(job.getJobId());
        }
        log.info("Batch registry stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public <T> SubmissionBuilder<T> create(List<T> items) {
        return new SimpleSubmissionBuilder<>(this, items, props.defaultBatchConfig());
    }

    @Override
    public <T, R> String submit(List<T> items, BatchProcessor<T, R> processor, BatchConfig config) {
        return submit(null, items, processor, config);
    }

    @Override
    public <T, R> String submit(String jobId, List<T> items, BatchProcessor<T, R> processor, BatchConfig config) {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(processor, "processor must not be null");
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        if (jobId != null && jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }

        String id = jobId != null ? jobId : nextJobId();
        List<T> frozen = Collections.unmodifiableList(new ArrayList<>(items));
        BatchJob<T, R> job = new BatchJob<>(id, frozen, processor, config, clock.instant());

        synchronized (lock) {
            if (jobs.containsKey(id)) {
                throw new IllegalArgumentException("Job id already in use: " + id);
            }
            jobs.put(id, job);
            totalJobs++;
        }
        queue.offer(job);

        log.info("Batch job submitted jobId={} items={} maxWorkers={} batchSize={} timeout={} maxRetries={} continueOnError={}",
                id, frozen.size(), config.maxWorkers(), config.batchSize(), config.timeout(),
                config.retryPolicy().maxRetries(), config.continueOnError());
        return id;
    }

    @Override
    public String submit(SubmissionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        request.config().validate();
        NamedBatchProcessor<?, ?> processor = processors.getRequired(request.processor());
        return submitNamed(request.jobId(), processor, request.items(), request.config());
    }

    private <T, R> String submitNamed(String jobId, NamedBatchProcessor<T, R> processor, List<Object> rawItems, BatchConfig config) {
        List<T> items = new ArrayList<>(rawItems.size());
        for (Object raw : rawItems) {
            items.add(raw == null ? null : objectMapper.convertValue(raw, processor.itemClass()));
        }
        return submit(jobId, items, processor, config);
    }

    @Override
    public Optional<JobSnapshot> getStatus(String jobId) {
        synchronized (lock) {
            BatchJob<?, ?> job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.snapshot(clock.instant()));
        }
    }

    @Override
    public boolean cancel(String jobId) {
        BatchJob<?, ?> job;
        synchronized (lock) {
            job = jobs.get(jobId);
        }
        if (job == null || !finish(job, JobStatus.CANCELLED)) {
            return false;
        }
        log.info("Batch job cancelled jobId={} processed={}/{}", jobId, job.getProcessedCount(), job.getTotalItems());
        return true;
    }

    @Override
    public List<JobSnapshot> listActive() {
        synchronized (lock) {
            Instant now = clock.instant();
            List<JobSnapshot> out = new ArrayList<>();
            for (BatchJob<?, ?> job : jobs.values()) {
                if (job.getStatus().isActive()) {
                    out.add(job.snapshot(now));
                }
            }
            return out;
        }
    }

    @Override
    public List<JobSnapshot> listAll() {
        synchronized (lock) {
            Instant now = clock.instant();
            List<JobSnapshot> out = new ArrayList<>(jobs.size());
            for (BatchJob<?, ?> job : jobs.values()) {
                out.add(job.snapshot(now));
            }
            return out;
        }
    }

    @Override
    public int cleanup(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        synchronized (lock) {
            Iterator<BatchJob<?, ?>> it = jobs.values().iterator();
            while (it.hasNext()) {
                BatchJob<?, ?> job = it.next();
                Instant endedAt = job.getEndedAt();
                if (job.getStatus().isTerminal() && endedAt != null && endedAt.isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} finished batch jobs older than {}", removed, maxAge);
        }
        return removed;
    }

    @Override
    public BatchStatistics statistics() {
        synchronized (lock) {
            int active = 0;
            for (BatchJob<?, ?> job : jobs.values()) {
                if (job.getStatus().isActive()) {
                    active++;
                }
            }
            long finished = completedJobs + failedJobs;
            double successRate = finished == 0 ? 0.0 : cleanJobs * 100.0 / finished;
            Duration average = terminalJobs == 0 ? Duration.ZERO : totalDuration.dividedBy(terminalJobs);
            return new BatchStatistics(
                    totalJobs,
                    completedJobs,
                    failedJobs,
                    cancelledJobs,
                    active,
                    totalItemsProcessed,
                    average,
                    successRate
            );
        }
    }

    private String nextJobId() {
        return "batch_" + clock.millis() + "_" + idSequence.incrementAndGet();
    }

    /**
     * Move the job to a terminal status and account for it in the statistics, atomically with
     * respect to every reader. Only the caller that wins the transition updates the counters.
     */
    private boolean finish(BatchJob<?, ?> job, JobStatus terminal) {
        synchronized (lock) {
            Instant now = clock.instant();
            if (!job.transitionTo(terminal, now)) {
                return false;
            }
            switch (terminal) {
                case COMPLETED -> {
                    completedJobs++;
                    cleanJobs++;
                }
                case COMPLETED_WITH_ERRORS -> completedJobs++;
                case FAILED -> failedJobs++;
                case CANCELLED -> cancelledJobs++;
                default -> throw new IllegalStateException("Not a terminal status: " + terminal);
            }
            totalItemsProcessed += job.getProcessedCount();
            terminalJobs++;
            totalDuration = totalDuration.plus(job.duration(now));
            return true;
        }
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                BatchJob<?, ?> job = queue.take();
                if (job.getStatus() != JobStatus.QUEUED) {
                    log.debug("Skipping job no longer queued jobId={} status={}", job.getJobId(), job.getStatus());
                    continue;
                }
                jobSlots.acquire();
                try {
                    jobRunners.submit(() -> runJob(job));
                } catch (RuntimeException e) {
                    jobSlots.release();
                    throw e;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("batch dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private <T, R> void runJob(BatchJob<T, R> job) {
        try {
            if (!job.markProcessing(clock.instant())) {
                return;
            }
            log.info("Batch job started jobId={} items={}", job.getJobId(), job.getTotalItems());

            JobStatus terminal = executor.execute(job);
            if (terminal != null && finish(job, terminal)) {
                log.info("Batch job finished jobId={} status={} processed={}/{} errors={} duration={}",
                        job.getJobId(), terminal, job.getProcessedCount(), job.getTotalItems(),
                        job.getErrorCount(), job.duration(clock.instant()));
            }
        } catch (Exception e) {
            log.error("batch job runner failed jobId={} msg={}", job.getJobId(), e.getMessage(), e);
            finish(job, JobStatus.FAILED);
        } finally {
            jobSlots.release();
        }
    }

    private void janitorLoop() {
        ZoneId zone = resolveZone(props.getCleanupTimezone());
        int failures = 0;
        Instant previous = clock.instant();

        while (started.get()) {
            try {
                Instant next = IntervalParser.nextRun(props.getCleanupEvery(), zone, previous);
                long waitMs = Duration.between(clock.instant(), next).toMillis();
                if (waitMs > 0) {
                    Thread.sleep(waitMs);
                }
                previous = next;
                cleanup(props.getCleanupMaxAge());
                failures = 0;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                failures++;
                log.error("batch cleanup failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(failures).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                previous = clock.instant();
            }
        }
    }

    // Exponential backoff for repeated cleanup failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            log.warn("Invalid cleanup timezone '{}', using system default", timezone);
            return ZoneId.systemDefault();
        }
    }
}
