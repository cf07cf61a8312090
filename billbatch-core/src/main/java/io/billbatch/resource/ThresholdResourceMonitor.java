package io.billbatch.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Refuses admission while memory (or, if enabled, CPU) usage is above its ceiling.
 *
 * <p>A CPU ceiling of 100 or more disables the CPU check. Any sampling failure allows
 * admission.
 */
public class ThresholdResourceMonitor implements ResourceMonitor {
    private static final Logger log = LoggerFactory.getLogger(ThresholdResourceMonitor.class);

    public static final double DEFAULT_MAX_MEMORY_PERCENT = 80.0;
    public static final double DEFAULT_MAX_CPU_PERCENT = 90.0;

    private final ResourceSampler sampler;
    private final double maxMemoryPercent;
    private final double maxCpuPercent;

    public ThresholdResourceMonitor(ResourceSampler sampler) {
        this(sampler, DEFAULT_MAX_MEMORY_PERCENT, DEFAULT_MAX_CPU_PERCENT);
    }

    public ThresholdResourceMonitor(ResourceSampler sampler, double maxMemoryPercent, double maxCpuPercent) {
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        if (maxMemoryPercent <= 0 || maxMemoryPercent > 100) {
            throw new IllegalArgumentException("maxMemoryPercent must be in (0, 100] but was " + maxMemoryPercent);
        }
        if (maxCpuPercent <= 0) {
            throw new IllegalArgumentException("maxCpuPercent must be positive but was " + maxCpuPercent);
        }
        this.maxMemoryPercent = maxMemoryPercent;
        this.maxCpuPercent = maxCpuPercent;
    }

    @Override
    public boolean checkAdmission() {
        ResourceUsage usage;
        try {
            usage = sampler.sample();
        } catch (Exception e) {
            log.debug("resource sampling failed, allowing admission msg={}", e.getMessage());
            return true;
        }
        if (usage == null) {
            return true;
        }

        if (usage.memoryPercent() > maxMemoryPercent) {
            log.debug("admission refused memory={}% limit={}%", usage.memoryPercent(), maxMemoryPercent);
            return false;
        }

        if (isCpuCheckEnabled() && !Double.isNaN(usage.cpuPercent()) && usage.cpuPercent() > maxCpuPercent) {
            log.debug("admission refused cpu={}% limit={}%", usage.cpuPercent(), maxCpuPercent);
            return false;
        }
        return true;
    }

    public boolean isCpuCheckEnabled() {
        return maxCpuPercent < 100.0;
    }

    public double getMaxMemoryPercent() {
        return maxMemoryPercent;
    }

    public double getMaxCpuPercent() {
        return maxCpuPercent;
    }
}
