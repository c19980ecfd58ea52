package com.jqflow.output;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turning the DOT text into an image failed. {@link #savedSource()} points at the
 * DOT text that was written next to the requested output before the error surfaced.
 */
public class DiagramRenderException extends IOException {
    private final Path savedSource;

    public DiagramRenderException(String message) {
        this(message, null, null);
    }

    public DiagramRenderException(String message, Throwable cause) {
        this(message, cause, null);
    }

    protected DiagramRenderException(String message, Throwable cause, Path savedSource) {
        super(message, cause);
        this.savedSource = savedSource;
    }

    /** Null until the source has been saved. */
    public Path savedSource() {
        return savedSource;
    }

    /**
     * Same failure, with the saved source path added to the message.
     */
    public DiagramRenderException withSavedSource(Path source) {
        DiagramRenderException copy = copy(getMessage() + " (DOT source saved to: " + source + ")", source);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    protected DiagramRenderException copy(String message, Path source) {
        return new DiagramRenderException(message, getCause(), source);
    }
}
