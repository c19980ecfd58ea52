package com.jqflow.graph;

/**
 * Append-only operations on a {@link FlowGraph}. Each call returns the updated handle;
 * ids are relative to {@code scope}. Failures raise {@link GraphMutationException}.
 */
public interface GraphEmitter {
    /** Declares node {@code id}; fails if the id is taken or the scope does not exist. */
    FlowGraph createNode(FlowGraph graph, ScopePath scope, String id);

    /** Registers a child scope; fails if its owning node is missing or it already exists. */
    FlowGraph createScope(FlowGraph graph, ScopePath scope);

    /**
     * Sets {@code target.attribute} where target is a node, a child scope or an edge
     * written {@code from -> to}. Nodes take {@code shape} and {@code label}, scopes
     * take {@code label}, edges take {@code label} and {@code type}.
     */
    FlowGraph setAttribute(FlowGraph graph, ScopePath scope, String key, String value);

    /** Connects two existing nodes of {@code scope}. */
    FlowGraph createEdge(FlowGraph graph, ScopePath scope, String from, String to);
}
