package io.billbatch.render;

import java.util.Set;

/**
 * One rendering backend.
 */
public interface RenderingEngine {
    String name();

    /**
     * Cheap check that the backend can be invoked at all (executable present, library loads).
     * Must not throw.
     */
    boolean probe();

    Set<OutputFormat> supportedFormats();

    /**
     * @throws EngineUnavailableException if the backend cannot be invoked
     * @throws RenderException            if the backend ran but produced no output
     */
    byte[] render(RenderRequest request) throws RenderException;
}
