package io.billbatch.resource;

/**
 * One sample of host pressure, both values in percent (0-100).
 * A NaN cpuPercent means CPU load could not be determined.
 */
public record ResourceUsage(
        double memoryPercent,
        double cpuPercent
) {
}
