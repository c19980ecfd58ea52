package com.jqflow.output;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Output kinds, chosen by the extension of the target path.
 */
public enum OutputFormat {
    DOT(".dot"),
    SVG(".svg");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public boolean isImage() {
        return this == SVG;
    }

    public static OutputFormat forPath(Path output) {
        String name = output.getFileName() == null ? "" : output.getFileName().toString().toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return format;
            }
        }
        throw new UnsupportedFormatException("unsupported output format for " + output
            + ": use " + DOT.extension + " or " + SVG.extension);
    }

    /**
     * {@code output} with its extension replaced by this format's, e.g. {@code report.svg -> report.dot}.
     */
    public Path sibling(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return output.resolveSibling(base + extension);
    }
}
