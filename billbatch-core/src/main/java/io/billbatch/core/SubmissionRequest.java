package io.billbatch.core;

import java.util.List;
import java.util.Objects;

/**
 * Submission against a named processor. Items are raw values (maps, strings, numbers) that
 * the registry converts to the processor's item class.
 */
public record SubmissionRequest(
        String jobId,
        String processor,
        List<Object> items,
        BatchConfig config
) {

    public SubmissionRequest {
        Objects.requireNonNull(processor, "processor must not be null");
        if (processor.isBlank()) {
            throw new IllegalArgumentException("processor must not be blank");
        }
        items = items == null ? List.of() : items;
        config = config == null ? BatchConfig.defaults() : config;
    }
}
