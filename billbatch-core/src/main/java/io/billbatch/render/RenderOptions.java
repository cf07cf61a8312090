package io.billbatch.render;

import java.util.Objects;

/**
 * Page setup shared by every engine.
 *
 * <p>Margins are CSS lengths ("10mm", "0"). {@code zoom} scales content (1.0 = 100%) and is
 * applied both as CSS zoom and, where the engine supports it, as a native option.
 */
public record RenderOptions(
        PageSize pageSize,
        Orientation orientation,
        String marginTop,
        String marginRight,
        String marginBottom,
        String marginLeft,
        double zoom,
        int dpi
) {
    public static final String DEFAULT_MARGIN = "10mm";
    public static final int DEFAULT_DPI = 96;

    public RenderOptions {
        Objects.requireNonNull(pageSize, "pageSize must not be null");
        Objects.requireNonNull(orientation, "orientation must not be null");
        marginTop = marginOrDefault(marginTop);
        marginRight = marginOrDefault(marginRight);
        marginBottom = marginOrDefault(marginBottom);
        marginLeft = marginOrDefault(marginLeft);
        if (zoom <= 0 || Double.isNaN(zoom)) {
            throw new IllegalArgumentException("zoom must be positive but was " + zoom);
        }
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive but was " + dpi);
        }
    }

    public static RenderOptions defaults() {
        return new RenderOptions(PageSize.A4, Orientation.PORTRAIT,
                DEFAULT_MARGIN, DEFAULT_MARGIN, DEFAULT_MARGIN, DEFAULT_MARGIN, 1.0, DEFAULT_DPI);
    }

    public RenderOptions withZoom(double zoom) {
        return new RenderOptions(pageSize, orientation, marginTop, marginRight, marginBottom, marginLeft, zoom, dpi);
    }

    public RenderOptions withMargins(String margin) {
        return new RenderOptions(pageSize, orientation, margin, margin, margin, margin, zoom, dpi);
    }

    public RenderOptions withPage(PageSize pageSize, Orientation orientation) {
        return new RenderOptions(pageSize, orientation, marginTop, marginRight, marginBottom, marginLeft, zoom, dpi);
    }

    /**
     * CSS shorthand: top right bottom left.
     */
    public String marginCss() {
        return marginTop + " " + marginRight + " " + marginBottom + " " + marginLeft;
    }

    private static String marginOrDefault(String margin) {
        return (margin == null || margin.isBlank()) ? DEFAULT_MARGIN : margin.trim();
    }
}
