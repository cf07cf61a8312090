package io.billbatch.render;

import java.util.List;

/**
 * Outcome of one selector call.
 *
 * <p>{@code engineUsed} always names the engine whose bytes are returned; it is null on
 * failure. {@code errors} holds one entry per engine that was tried and did not succeed,
 * in priority order.
 */
public record RenderResult(
        boolean success,
        byte[] output,
        String engineUsed,
        List<String> errors
) {

    public RenderResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RenderResult success(byte[] output, String engineUsed, List<String> errors) {
        return new RenderResult(true, output, engineUsed, errors);
    }

    public static RenderResult failure(List<String> errors) {
        return new RenderResult(false, null, null, errors);
    }
}
