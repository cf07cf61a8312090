package io.billbatch.config;

import io.billbatch.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the job registry once the context is refreshed and stops it first on shutdown, so
 * active jobs are cancelled before the beans their processors depend on are destroyed.
 */
public class BillBatchLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(BillBatchLifecycle.class);

    private final JobRegistry jobRegistry;

    public BillBatchLifecycle(JobRegistry jobRegistry) {
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
    }

    @Override
    public void start() {
        jobRegistry.start();
    }

    @Override
    public void stop() {
        int active = jobRegistry.listActive().size();
        if (active > 0) {
            log.info("Context shutting down, cancelling {} active batch jobs", active);
        }
        jobRegistry.stop();
    }

    @Override
    public boolean isRunning() {
        return jobRegistry.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
