package com.jqflow.graph;

import java.util.Objects;

/**
 * @param id    absolute, dotted id
 * @param scope scope the node was declared in
 * @param name  id relative to {@code scope}
 */
public record GraphNode(String id, ScopePath scope, String name, NodeShape shape, String label) {
    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(shape, "shape");
        label = label == null ? "" : label;
    }

    GraphNode withShape(NodeShape shape) {
        return new GraphNode(id, scope, name, shape, label);
    }

    GraphNode withLabel(String label) {
        return new GraphNode(id, scope, name, shape, label);
    }
}
