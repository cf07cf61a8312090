package io.billbatch.render;

import java.util.List;

public class RenderException extends Exception {

    private final List<String> errors;

    public RenderException(String message) {
        this(message, List.of(), null);
    }

    public RenderException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public RenderException(String message, List<String> errors) {
        this(message, errors, null);
    }

    private RenderException(String message, List<String> errors, Throwable cause) {
        super(message, cause);
        this.errors = List.copyOf(errors);
    }

    /**
     * Per-engine errors when raised for an exhausted fallback chain; empty otherwise.
     */
    public List<String> getErrors() {
        return errors;
    }
}
