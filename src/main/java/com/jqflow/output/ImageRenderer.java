package com.jqflow.output;

/**
 * Lays out DOT text and draws it as an SVG document.
 */
public interface ImageRenderer {
    /**
     * @param source DOT text carrying the {@code rankdir} and {@code layout} directives
     * @return the SVG document
     */
    String render(String source) throws DiagramRenderException;
}
