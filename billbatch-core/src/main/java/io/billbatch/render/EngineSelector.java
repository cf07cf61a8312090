package io.billbatch.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Renders a document with the first engine of a fixed fallback chain that succeeds.
 *
 * <p>Per call, engines are tried strictly in construction order. An engine is skipped (and one
 * error recorded for it) when it does not support the requested format, its cached probe says it
 * is unavailable, or its render attempt fails. No engine is tried twice in the same call and the
 * order never changes. When every engine fails the result carries one error per engine.
 *
 * <p>Probe results are cached for {@code probeTtl}; a zero TTL probes on every call. An engine
 * that reports {@link EngineUnavailableException} while rendering is marked unavailable until the
 * next probe.
 */
public class EngineSelector {
    private static final Logger log = LoggerFactory.getLogger(EngineSelector.class);

    public static final Duration DEFAULT_PROBE_TTL = Duration.ofMinutes(5);

    private final List<RenderingEngine> engines;
    private final Duration probeTtl;
    private final Clock clock;
    private final ConcurrentHashMap<String, ProbeState> probes = new ConcurrentHashMap<>();

    private record ProbeState(boolean available, Instant probedAt) {
    }

    public EngineSelector(List<? extends RenderingEngine> engines) {
        this(engines, DEFAULT_PROBE_TTL, Clock.systemUTC());
    }

    public EngineSelector(List<? extends RenderingEngine> engines, Duration probeTtl, Clock clock) {
        Objects.requireNonNull(engines, "engines must not be null");
        if (engines.isEmpty()) {
            throw new IllegalArgumentException("at least one rendering engine is required");
        }
        Set<String> names = new HashSet<>();
        for (RenderingEngine engine : engines) {
            Objects.requireNonNull(engine, "engines must not contain null");
            if (!names.add(engine.name())) {
                throw new IllegalArgumentException("Duplicate rendering engine name: " + engine.name());
            }
        }
        this.engines = List.copyOf(engines);
        this.probeTtl = Objects.requireNonNull(probeTtl, "probeTtl must not be null");
        if (probeTtl.isNegative()) {
            throw new IllegalArgumentException("probeTtl must not be negative");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RenderResult render(RenderRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<String> errors = new ArrayList<>();

        for (RenderingEngine engine : engines) {
            String name = engine.name();

            if (!engine.supportedFormats().contains(request.format())) {
                errors.add(name + ": does not support " + request.format());
                continue;
            }
            if (!isAvailable(engine)) {
                errors.add(name + ": engine unavailable");
                continue;
            }

            try {
                byte[] output = engine.render(request);
                if (output == null || output.length == 0) {
                    errors.add(name + ": produced no output");
                    continue;
                }
                log.debug("render succeeded source={} engine={} bytes={} skipped={}",
                        request.sourceName(), name, output.length, errors.size());
                return RenderResult.success(output, name, errors);
            } catch (EngineUnavailableException e) {
                probes.put(name, new ProbeState(false, clock.instant()));
                errors.add(name + ": " + e.getMessage());
                log.warn("render engine unavailable source={} engine={} msg={}", request.sourceName(), name, e.getMessage());
            } catch (RenderException | RuntimeException e) {
                errors.add(name + ": " + e.getMessage());
                log.warn("render engine failed source={} engine={} msg={}", request.sourceName(), name, e.getMessage());
            }
        }

        log.error("all render engines failed source={} errors={}", request.sourceName(), errors);
        return RenderResult.failure(errors);
    }

    /**
     * Re-probe every engine regardless of cache age.
     */
    public List<EngineDescriptor> refreshAvailability() {
        for (RenderingEngine engine : engines) {
            probe(engine);
        }
        return describeEngines();
    }

    /**
     * Engines in priority order with their last known availability.
     */
    public List<EngineDescriptor> describeEngines() {
        List<EngineDescriptor> out = new ArrayList<>(engines.size());
        for (int i = 0; i < engines.size(); i++) {
            String name = engines.get(i).name();
            ProbeState state = probes.get(name);
            out.add(new EngineDescriptor(
                    name,
                    i,
                    state == null ? null : state.available(),
                    state == null ? null : state.probedAt()
            ));
        }
        return out;
    }

    public List<String> engineNames() {
        return engines.stream().map(RenderingEngine::name).toList();
    }

    private boolean isAvailable(RenderingEngine engine) {
        ProbeState state = probes.get(engine.name());
        if (state != null && !probeTtl.isZero()
                && clock.instant().isBefore(state.probedAt().plus(probeTtl))) {
            return state.available();
        }
        return probe(engine);
    }

    private boolean probe(RenderingEngine engine) {
        boolean available;
        try {
            available = engine.probe();
        } catch (RuntimeException e) {
            log.warn("render engine probe failed engine={} msg={}", engine.name(), e.getMessage());
            available = false;
        }
        probes.put(engine.name(), new ProbeState(available, clock.instant()));
        log.debug("render engine probed engine={} available={}", engine.name(), available);
        return available;
    }
}
