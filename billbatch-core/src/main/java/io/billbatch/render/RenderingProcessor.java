package io.billbatch.render;

import io.billbatch.NamedBatchProcessor;

import java.util.Objects;

/**
 * Batch processor that renders each {@link RenderRequest} through an {@link EngineSelector}.
 *
 * <p>An exhausted fallback chain is raised as {@link RenderException}, so the job's retry
 * policy treats it like any other item failure.
 */
public class RenderingProcessor implements NamedBatchProcessor<RenderRequest, RenderResult> {

    public static final String DEFAULT_NAME = "render";

    private final String name;
    private final EngineSelector selector;

    public RenderingProcessor(EngineSelector selector) {
        this(DEFAULT_NAME, selector);
    }

    public RenderingProcessor(String name, EngineSelector selector) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<RenderRequest> itemClass() {
        return RenderRequest.class;
    }

    @Override
    public RenderResult process(RenderRequest item) throws RenderException {
        RenderResult result = selector.render(item);
        if (!result.success()) {
            throw new RenderException("All rendering engines failed for " + item.sourceName()
                    + ": " + String.join("; ", result.errors()), result.errors());
        }
        return result;
    }
}
