package io.billbatch.core;

import io.billbatch.NamedBatchProcessor;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class ProcessorRegistry {

    private final Map<String, NamedBatchProcessor<?, ?>> processorsByName;

    public ProcessorRegistry(List<NamedBatchProcessor<?, ?>> processors) {
        this.processorsByName = processors.stream()
                .collect(Collectors.toUnmodifiableMap(
                        NamedBatchProcessor::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate processor name: " + a.name());
                        }
                ));
    }

    public static ProcessorRegistry empty() {
        return new ProcessorRegistry(List.of());
    }

    public NamedBatchProcessor<?, ?> getRequired(String name) {
        NamedBatchProcessor<?, ?> processor = processorsByName.get(name);
        if (processor == null) {
            throw new IllegalArgumentException("No processor registered for name: " + name);
        }
        return processor;
    }

    public Set<String> names() {
        return processorsByName.keySet();
    }
}
