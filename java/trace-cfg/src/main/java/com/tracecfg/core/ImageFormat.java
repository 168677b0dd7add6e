package com.tracecfg.core;

import java.util.Locale;

public enum ImageFormat {
    PNG("png"),
    PDF("pdf"),
    SVG("svg");

    private final String extension;

    ImageFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /** Value passed to Graphviz as {@code -T<type>}. */
    public String getGraphvizType() {
        return extension;
    }

    public static ImageFormat fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ImageFormat format : values()) {
                if (format.extension.equals(normalized)) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported image format: " + name);
    }
}
