package com.jqflow.graph;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Persistent diagram graph. Every change yields a new instance and leaves the
 * receiver untouched; callers must keep working with the latest handle.
 * Nodes, scopes and edges keep their insertion order.
 */
public final class FlowGraph {
    private static final FlowGraph EMPTY = new FlowGraph(
        Lists.immutable.empty(), Maps.immutable.empty(),
        Lists.immutable.empty(), Maps.immutable.empty(),
        Lists.immutable.empty());

    private final ImmutableList<String> nodeOrder;
    private final ImmutableMap<String, GraphNode> nodesById;
    private final ImmutableList<String> scopeOrder;
    private final ImmutableMap<String, GraphScope> scopesById;
    private final ImmutableList<GraphEdge> edges;

    private FlowGraph(ImmutableList<String> nodeOrder,
                      ImmutableMap<String, GraphNode> nodesById,
                      ImmutableList<String> scopeOrder,
                      ImmutableMap<String, GraphScope> scopesById,
                      ImmutableList<GraphEdge> edges) {
        this.nodeOrder = nodeOrder;
        this.nodesById = nodesById;
        this.scopeOrder = scopeOrder;
        this.scopesById = scopesById;
        this.edges = edges;
    }

    public static FlowGraph empty() {
        return EMPTY;
    }

    public ImmutableList<GraphNode> nodes() {
        return nodeOrder.collect(nodesById::get);
    }

    public ImmutableList<GraphScope> scopes() {
        return scopeOrder.collect(scopesById::get);
    }

    public ImmutableList<GraphEdge> edges() {
        return edges;
    }

    /** Returns the node with the given absolute id, or null. */
    public GraphNode node(String id) {
        return nodesById.get(id);
    }

    /** Returns the scope with the given absolute id, or null. */
    public GraphScope scope(String id) {
        return scopesById.get(id);
    }

    public boolean containsNode(ScopePath scope, String relativeId) {
        return nodesById.containsKey(scope.qualify(relativeId));
    }

    /** Nodes declared directly in {@code scope}. */
    public ImmutableList<GraphNode> nodesIn(ScopePath scope) {
        return nodes().select(node -> node.scope().equals(scope));
    }

    /** Child scopes owned by the container node {@code nodeId}. */
    public ImmutableList<GraphScope> scopesOwnedBy(String nodeId) {
        return scopes().select(scope -> scope.path().owner().equals(nodeId));
    }

    /** Edges from {@code from} to {@code to}, both absolute ids. */
    public ImmutableList<GraphEdge> edgesBetween(String from, String to) {
        return edges.select(edge -> edge.from().equals(from) && edge.to().equals(to));
    }

    FlowGraph withNode(GraphNode node) {
        return new FlowGraph(nodeOrder.newWith(node.id()), nodesById.newWithKeyValue(node.id(), node),
            scopeOrder, scopesById, edges);
    }

    FlowGraph replaceNode(GraphNode node) {
        return new FlowGraph(nodeOrder, nodesById.newWithKeyValue(node.id(), node), scopeOrder, scopesById, edges);
    }

    FlowGraph withScope(GraphScope scope) {
        return new FlowGraph(nodeOrder, nodesById,
            scopeOrder.newWith(scope.id()), scopesById.newWithKeyValue(scope.id(), scope), edges);
    }

    FlowGraph replaceScope(GraphScope scope) {
        return new FlowGraph(nodeOrder, nodesById, scopeOrder, scopesById.newWithKeyValue(scope.id(), scope), edges);
    }

    FlowGraph withEdge(GraphEdge edge) {
        return new FlowGraph(nodeOrder, nodesById, scopeOrder, scopesById, edges.newWith(edge));
    }

    FlowGraph replaceEdge(int index, GraphEdge edge) {
        MutableList<GraphEdge> updated = edges.toList();
        updated.set(index, edge);
        return new FlowGraph(nodeOrder, nodesById, scopeOrder, scopesById, updated.toImmutable());
    }

    @Override
    public String toString() {
        return "FlowGraph{nodes=" + nodeOrder.size() + ", scopes=" + scopeOrder.size() + ", edges=" + edges.size() + "}";
    }
}
