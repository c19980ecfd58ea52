package com.jqflow.graph;

import java.util.Objects;

/**
 * A child namespace of a container node, such as one function argument or one object key.
 */
public record GraphScope(ScopePath path, String label) {
    public GraphScope {
        Objects.requireNonNull(path, "path");
        label = label == null ? "" : label;
    }

    public String id() {
        return path.id();
    }

    GraphScope withLabel(String label) {
        return new GraphScope(path, label);
    }
}
