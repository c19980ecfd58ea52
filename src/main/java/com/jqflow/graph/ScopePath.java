package com.jqflow.graph;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Address of a namespace in the diagram. The root scope is empty. A child scope
 * appends {@code <containerId>, child_<k>} to the path of the scope that owns the container,
 * so ids inside it read {@code node_1.child_0.node_0}.
 */
public record ScopePath(ImmutableList<String> segments) {
    private static final ScopePath ROOT = new ScopePath(Lists.immutable.empty());

    public ScopePath {
        Objects.requireNonNull(segments, "segments");
    }

    public static ScopePath root() {
        return ROOT;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public ScopePath child(String containerId, int index) {
        return new ScopePath(segments.newWith(containerId).newWith("child_" + index));
    }

    /**
     * Absolute id of {@code relativeId} when it is declared in this scope.
     */
    public String qualify(String relativeId) {
        return isRoot() ? relativeId : id() + "." + relativeId;
    }

    /** Absolute id of the scope itself; empty for the root. */
    public String id() {
        return segments.makeString(".");
    }

    /** Absolute id of the container node owning this scope. */
    public String owner() {
        if (isRoot()) {
            throw new IllegalStateException("The root scope has no owner");
        }
        return segments.take(segments.size() - 1).makeString(".");
    }

    /** The scope in which the owning container node is declared. */
    public ScopePath parent() {
        if (isRoot()) {
            throw new IllegalStateException("The root scope has no parent");
        }
        return new ScopePath(segments.take(segments.size() - 2));
    }

    public int depth() {
        return segments.size() / 2;
    }

    @Override
    public String toString() {
        return isRoot() ? "<root>" : id();
    }
}
