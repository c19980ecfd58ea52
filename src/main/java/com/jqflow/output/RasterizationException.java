package com.jqflow.output;

import java.nio.file.Path;

/**
 * Layout succeeded but no usable image came out of it.
 */
public class RasterizationException extends DiagramRenderException {
    public RasterizationException(String message) {
        super(message);
    }

    public RasterizationException(String message, Throwable cause) {
        super(message, cause);
    }

    private RasterizationException(String message, Throwable cause, Path savedSource) {
        super(message, cause, savedSource);
    }

    @Override
    protected DiagramRenderException copy(String message, Path source) {
        return new RasterizationException(message, getCause(), source);
    }
}
