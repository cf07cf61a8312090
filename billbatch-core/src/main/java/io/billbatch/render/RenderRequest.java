package io.billbatch.render;

import java.util.Objects;

/**
 * A document to render. {@code sourceName} only labels logs and errors.
 */
public record RenderRequest(
        String sourceName,
        String html,
        OutputFormat format,
        RenderOptions options
) {

    public RenderRequest {
        Objects.requireNonNull(html, "html must not be null");
        format = format == null ? OutputFormat.PDF : format;
        options = options == null ? RenderOptions.defaults() : options;
        sourceName = (sourceName == null || sourceName.isBlank()) ? "document" : sourceName;
    }

    public static RenderRequest pdf(String sourceName, String html) {
        return new RenderRequest(sourceName, html, OutputFormat.PDF, RenderOptions.defaults());
    }
}
