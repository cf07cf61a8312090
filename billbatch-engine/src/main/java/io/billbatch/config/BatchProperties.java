package io.billbatch.config;

import io.billbatch.core.BatchConfig;
import io.billbatch.core.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration for the batch engine.
 */
@ConfigurationProperties(prefix = "billbatch")
public class BatchProperties {
    private boolean enabled = true;
    private int maxConcurrentJobs = 4; // jobs running at the same time
    private int defaultMaxWorkers = BatchConfig.DEFAULT_MAX_WORKERS; // per job
    private int defaultBatchSize = BatchConfig.DEFAULT_BATCH_SIZE;
    private Duration defaultTimeout = BatchConfig.DEFAULT_TIMEOUT;
    private int defaultMaxRetries = 3;
    private Duration defaultRetryBaseDelay = Duration.ofSeconds(1);
    private Duration defaultRetryMaxDelay = Duration.ofSeconds(30);
    private boolean exponentialBackoff = true;
    private boolean continueOnError = true;
    private boolean resourceCheckEnabled = true;
    private double maxMemoryPercent = 80.0;
    private double maxCpuPercent = 90.0; // 100 disables the CPU check
    private Duration admissionPollInterval = Duration.ofSeconds(1);
    private String cleanupEvery = "1 hour"; // interval, cron or "AT HH:mm"; blank disables
    private Duration cleanupMaxAge = Duration.ofHours(24);
    private String cleanupTimezone;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private Render render = new Render();

    /**
     * Config applied to submissions that do not override it.
     */
    public BatchConfig defaultBatchConfig() {
        return new BatchConfig(
                defaultMaxWorkers,
                defaultBatchSize,
                defaultTimeout,
                new RetryPolicy(defaultMaxRetries, defaultRetryBaseDelay, defaultRetryMaxDelay, exponentialBackoff),
                continueOnError
        );
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    public int getDefaultMaxWorkers() {
        return defaultMaxWorkers;
    }

    public void setDefaultMaxWorkers(int defaultMaxWorkers) {
        this.defaultMaxWorkers = defaultMaxWorkers;
    }

    public int getDefaultBatchSize() {
        return defaultBatchSize;
    }

    public void setDefaultBatchSize(int defaultBatchSize) {
        this.defaultBatchSize = defaultBatchSize;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Duration getDefaultRetryBaseDelay() {
        return defaultRetryBaseDelay;
    }

    public void setDefaultRetryBaseDelay(Duration defaultRetryBaseDelay) {
        this.defaultRetryBaseDelay = defaultRetryBaseDelay;
    }

    public Duration getDefaultRetryMaxDelay() {
        return defaultRetryMaxDelay;
    }

    public void setDefaultRetryMaxDelay(Duration defaultRetryMaxDelay) {
        this.defaultRetryMaxDelay = defaultRetryMaxDelay;
    }

    public boolean isExponentialBackoff() {
        return exponentialBackoff;
    }

    public void setExponentialBackoff(boolean exponentialBackoff) {
        this.exponentialBackoff = exponentialBackoff;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public void setContinueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
    }

    public boolean isResourceCheckEnabled() {
        return resourceCheckEnabled;
    }

    public void setResourceCheckEnabled(boolean resourceCheckEnabled) {
        this.resourceCheckEnabled = resourceCheckEnabled;
    }

    public double getMaxMemoryPercent() {
        return maxMemoryPercent;
    }

    public void setMaxMemoryPercent(double maxMemoryPercent) {
        this.maxMemoryPercent = maxMemoryPercent;
    }

    public double getMaxCpuPercent() {
        return maxCpuPercent;
    }

    public void setMaxCpuPercent(double maxCpuPercent) {
        this.maxCpuPercent = maxCpuPercent;
    }

    public Duration getAdmissionPollInterval() {
        return admissionPollInterval;
    }

    public void setAdmissionPollInterval(Duration admissionPollInterval) {
        this.admissionPollInterval = admissionPollInterval;
    }

    public String getCleanupEvery() {
        return cleanupEvery;
    }

    public void setCleanupEvery(String cleanupEvery) {
        this.cleanupEvery = cleanupEvery;
    }

    public Duration getCleanupMaxAge() {
        return cleanupMaxAge;
    }

    public void setCleanupMaxAge(Duration cleanupMaxAge) {
        this.cleanupMaxAge = cleanupMaxAge;
    }

    public String getCleanupTimezone() {
        return cleanupTimezone;
    }

    public void setCleanupTimezone(String cleanupTimezone) {
        this.cleanupTimezone = cleanupTimezone;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    /**
     * Rendering fallback chain settings.
     */
    public static class Render {
        private List<String> engines = new ArrayList<>(List.of("chrome-headless", "wkhtmltopdf", "playwright", "openhtmltopdf"));
        private Duration probeTtl = Duration.ofMinutes(5);
        private List<String> chromeExecutables = new ArrayList<>(List.of("google-chrome", "chrome", "chromium", "chromium-browser"));
        private String wkhtmltopdfExecutable = "wkhtmltopdf";
        private Duration processTimeout = Duration.ofSeconds(60);

        public List<String> getEngines() {
            return engines;
        }

        public void setEngines(List<String> engines) {
            this.engines = engines;
        }

        public Duration getProbeTtl() {
            return probeTtl;
        }

        public void setProbeTtl(Duration probeTtl) {
            this.probeTtl = probeTtl;
        }

        public List<String> getChromeExecutables() {
            return chromeExecutables;
        }

        public void setChromeExecutables(List<String> chromeExecutables) {
            this.chromeExecutables = chromeExecutables;
        }

        public String getWkhtmltopdfExecutable() {
            return wkhtmltopdfExecutable;
        }

        public void setWkhtmltopdfExecutable(String wkhtmltopdfExecutable) {
            this.wkhtmltopdfExecutable = wkhtmltopdfExecutable;
        }

        public Duration getProcessTimeout() {
            return processTimeout;
        }

        public void setProcessTimeout(Duration processTimeout) {
            this.processTimeout = processTimeout;
        }
    }
}
