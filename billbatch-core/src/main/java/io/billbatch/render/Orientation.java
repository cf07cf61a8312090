package io.billbatch.render;

import java.util.Locale;

public enum Orientation {
    PORTRAIT,
    LANDSCAPE;

    public String cssName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
