package io.billbatch.render;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable engine for selector tests.
 */
class StubEngine implements RenderingEngine {
    private final String name;
    private final Set<OutputFormat> formats;
    volatile boolean available = true;
    volatile RenderException failure;
    volatile RuntimeException crash;
    final AtomicInteger probeCalls = new AtomicInteger();
    final AtomicInteger renderCalls = new AtomicInteger();

    StubEngine(String name) {
        this(name, Set.of(OutputFormat.PDF, OutputFormat.PNG));
    }

    StubEngine(String name, Set<OutputFormat> formats) {
        this.name = name;
        this.formats = formats;
    }

    static StubEngine failing(String name, String message) {
        StubEngine engine = new StubEngine(name);
        engine.failure = new RenderException(message);
        return engine;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean probe() {
        probeCalls.incrementAndGet();
        return available;
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return formats;
    }

    @Override
    public byte[] render(RenderRequest request) throws RenderException {
        renderCalls.incrementAndGet();
        if (crash != null) {
            throw crash;
        }
        if (failure != null) {
            throw failure;
        }
        return (name + ":" + request.sourceName()).getBytes(StandardCharsets.UTF_8);
    }
}
