package io.billbatch.render;

/**
 * Paper sizes, with portrait dimensions in millimetres.
 */
public enum PageSize {
    A4("A4", 210, 297),
    A3("A3", 297, 420),
    LETTER("Letter", 216, 279),
    LEGAL("Legal", 216, 356);

    private final String cssName;
    private final int widthMm;
    private final int heightMm;

    PageSize(String cssName, int widthMm, int heightMm) {
        this.cssName = cssName;
        this.widthMm = widthMm;
        this.heightMm = heightMm;
    }

    public String cssName() {
        return cssName;
    }

    public int widthMm(Orientation orientation) {
        return orientation == Orientation.LANDSCAPE ? heightMm : widthMm;
    }

    public int heightMm(Orientation orientation) {
        return orientation == Orientation.LANDSCAPE ? widthMm : heightMm;
    }
}
