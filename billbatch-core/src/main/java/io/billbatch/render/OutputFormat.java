package io.billbatch.render;

public enum OutputFormat {
    PDF("application/pdf", ".pdf"),
    PNG("image/png", ".png");

    private final String mediaType;
    private final String extension;

    OutputFormat(String mediaType, String extension) {
        this.mediaType = mediaType;
        this.extension = extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public String extension() {
        return extension;
    }
}
