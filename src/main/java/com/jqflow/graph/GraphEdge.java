package com.jqflow.graph;

import java.util.Objects;

/**
 * @param type  value type flowing along the edge, empty when unknown
 * @param label display label; empty unless explicitly set
 */
public record GraphEdge(String from, String to, String type, String label) {
    public GraphEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        type = type == null ? "" : type;
        label = label == null ? "" : label;
    }

    public String key() {
        return from + " -> " + to;
    }

    GraphEdge withType(String type) {
        return new GraphEdge(from, to, type, label);
    }

    GraphEdge withLabel(String label) {
        return new GraphEdge(from, to, type, label);
    }
}
