package io.billbatch.render;

/**
 * The backend could not be invoked at all (missing executable, process failed to start).
 */
public class EngineUnavailableException extends RenderException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
