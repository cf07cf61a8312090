package io.billbatch.resource;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThresholdResourceMonitorTest {

    @Test
    void samplingFailureShouldAllowAdmission() throws Exception {
        ResourceSampler sampler = mock(ResourceSampler.class);
        when(sampler.sample()).thenThrow(new IllegalStateException("no probe"));

        assertTrue(new ThresholdResourceMonitor(sampler).checkAdmission());
    }

    @Test
    void nullSampleShouldAllowAdmission() {
        assertTrue(new ThresholdResourceMonitor(() -> null).checkAdmission());
    }

    @Test
    void memoryAboveCeilingShouldRefuse() {
        assertFalse(new ThresholdResourceMonitor(() -> new ResourceUsage(85.0, 10.0)).checkAdmission());
        assertTrue(new ThresholdResourceMonitor(() -> new ResourceUsage(80.0, 10.0)).checkAdmission());
    }

    @Test
    void cpuAboveCeilingShouldRefuseUnlessDisabled() {
        ResourceSampler busyCpu = () -> new ResourceUsage(10.0, 95.0);

        assertFalse(new ThresholdResourceMonitor(busyCpu).checkAdmission());

        ThresholdResourceMonitor cpuDisabled = new ThresholdResourceMonitor(busyCpu, 80.0, 100.0);
        assertFalse(cpuDisabled.isCpuCheckEnabled());
        assertTrue(cpuDisabled.checkAdmission());
    }

    @Test
    void unknownCpuShouldBeIgnored() {
        assertTrue(new ThresholdResourceMonitor(() -> new ResourceUsage(10.0, Double.NaN)).checkAdmission());
    }

    @Test
    void constructorShouldRejectInvalidCeilings() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdResourceMonitor(() -> null, 0, 90));
        assertThrows(IllegalArgumentException.class, () -> new ThresholdResourceMonitor(() -> null, 80, -1));
    }
}
