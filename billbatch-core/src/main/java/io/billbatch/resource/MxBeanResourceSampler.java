package io.billbatch.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Samples host memory and system CPU load.
 *
 * <p>Memory pressure is {@code (MemTotal - MemAvailable) / MemTotal} from {@code /proc/meminfo},
 * so reclaimable page cache does not count as used. Where that file is missing or has no
 * {@code MemAvailable} line the platform MXBean's free memory is used instead. CPU load always
 * comes from the MXBean.
 *
 * <p>Requires the {@code com.sun.management} extension (HotSpot / OpenJDK); on other VMs
 * {@link #sample()} throws and the monitor fails open.
 */
public class MxBeanResourceSampler implements ResourceSampler {
    private static final Logger log = LoggerFactory.getLogger(MxBeanResourceSampler.class);

    static final Path PROC_MEMINFO = Path.of("/proc/meminfo");

    private final OperatingSystemMXBean osBean;
    private final Path meminfo;

    public MxBeanResourceSampler() {
        this(ManagementFactory.getOperatingSystemMXBean(), PROC_MEMINFO);
    }

    MxBeanResourceSampler(OperatingSystemMXBean osBean, Path meminfo) {
        this.osBean = Objects.requireNonNull(osBean, "osBean must not be null");
        this.meminfo = Objects.requireNonNull(meminfo, "meminfo must not be null");
    }

    @Override
    public ResourceUsage sample() {
        if (!(osBean instanceof com.sun.management.OperatingSystemMXBean os)) {
            throw new IllegalStateException("Platform MXBean does not expose physical memory: " + osBean.getClass().getName());
        }

        double memoryPercent = availableMemoryPercent();
        if (Double.isNaN(memoryPercent)) {
            long total = os.getTotalMemorySize();
            long free = os.getFreeMemorySize();
            if (total <= 0) {
                throw new IllegalStateException("Total memory size unavailable");
            }
            memoryPercent = (double) (total - free) * 100.0 / total;
        }

        double cpuLoad = os.getCpuLoad();
        double cpuPercent = cpuLoad < 0 ? Double.NaN : cpuLoad * 100.0;

        return new ResourceUsage(memoryPercent, cpuPercent);
    }

    /**
     * Used memory percent based on MemAvailable, or NaN when the kernel does not report it.
     */
    double availableMemoryPercent() {
        if (!Files.isReadable(meminfo)) {
            return Double.NaN;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(meminfo, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            log.debug("Could not read meminfo path={} msg={}", meminfo, e.getMessage());
            return Double.NaN;
        }

        long totalKb = -1;
        long availableKb = -1;
        for (String line : lines) {
            if (line.startsWith("MemTotal:")) {
                totalKb = kilobytes(line);
            } else if (line.startsWith("MemAvailable:")) {
                availableKb = kilobytes(line);
            }
        }
        if (totalKb <= 0 || availableKb < 0) {
            log.debug("meminfo has no usable MemTotal/MemAvailable path={}", meminfo);
            return Double.NaN;
        }
        return (double) (totalKb - Math.min(availableKb, totalKb)) * 100.0 / totalKb;
    }

    private static long kilobytes(String line) {
        String[] parts = line.substring(line.indexOf(':') + 1).trim().split("\\s+");
        try {
            return Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
