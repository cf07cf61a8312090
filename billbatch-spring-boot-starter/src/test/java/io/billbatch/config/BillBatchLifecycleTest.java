package io.billbatch.config;

import io.billbatch.JobRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BillBatchLifecycleTest {

    @Test
    void shouldDelegateToRegistry() {
        JobRegistry registry = mock(JobRegistry.class);
        when(registry.listActive()).thenReturn(List.of());
        when(registry.isRunning()).thenReturn(true);
        BillBatchLifecycle lifecycle = new BillBatchLifecycle(registry);

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(lifecycle.isAutoStartup()).isTrue();

        lifecycle.stop();

        verify(registry).start();
        verify(registry).stop();
    }
}
