package com.jqflow.output;

import guru.nidi.graphviz.engine.Engine;

/**
 * Graphviz engines that honour clusters.
 */
public enum LayoutEngine {
    /** Layered, hierarchical layout. */
    DOT("dot", Engine.DOT),
    /** Force-directed layout. */
    FDP("fdp", Engine.FDP);

    private final String directiveName;
    private final Engine engine;

    LayoutEngine(String directiveName, Engine engine) {
        this.directiveName = directiveName;
        this.engine = engine;
    }

    public String directiveName() {
        return directiveName;
    }

    Engine engine() {
        return engine;
    }

    public static LayoutEngine fromDirective(String name) throws LayoutCompilationException {
        for (LayoutEngine layout : values()) {
            if (layout.directiveName.equals(name)) {
                return layout;
            }
        }
        throw new LayoutCompilationException("Unknown layout engine '" + name + "'");
    }
}
