package com.jqflow.output;

import java.nio.file.Path;

/**
 * The DOT text could not be parsed or the layout engine rejected it.
 */
public class LayoutCompilationException extends DiagramRenderException {
    public LayoutCompilationException(String message) {
        super(message);
    }

    public LayoutCompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    private LayoutCompilationException(String message, Throwable cause, Path savedSource) {
        super(message, cause, savedSource);
    }

    @Override
    protected DiagramRenderException copy(String message, Path source) {
        return new LayoutCompilationException(message, getCause(), source);
    }
}
