package com.jqflow.output;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Settings for image output. {@code padding} is in inches around the drawing.
 */
public record DiagramOptions(LayoutEngine layoutEngine, Direction direction, double padding) {
    public DiagramOptions {
        Objects.requireNonNull(layoutEngine, "layoutEngine");
        Objects.requireNonNull(direction, "direction");
        if (padding < 0) {
            throw new IllegalArgumentException("padding must not be negative: " + padding);
        }
    }

    public static DiagramOptions defaults() {
        return new DiagramOptions(LayoutEngine.DOT, Direction.RIGHT, 0.5);
    }

    /**
     * Graph attributes placed ahead of everything else in the DOT text of an image target.
     */
    public ImmutableList<String> directives() {
        return Lists.immutable.of(
            "rankdir=" + direction.rankdir(),
            "layout=" + layoutEngine.directiveName());
    }
}
