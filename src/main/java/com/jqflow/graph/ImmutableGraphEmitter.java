package com.jqflow.graph;

public class ImmutableGraphEmitter implements GraphEmitter {
    private static final String ARROW = " -> ";

    @Override
    public FlowGraph createNode(FlowGraph graph, ScopePath scope, String id) {
        requireScope(graph, scope);
        if (id == null || id.isBlank() || id.contains(ARROW)) {
            throw new GraphMutationException("Invalid node id '" + id + "' in scope " + scope);
        }
        String absoluteId = scope.qualify(id);
        if (graph.node(absoluteId) != null || graph.scope(absoluteId) != null) {
            throw new GraphMutationException("Duplicate id " + absoluteId);
        }
        return graph.withNode(new GraphNode(absoluteId, scope, id, NodeShape.RECTANGLE, id));
    }

    @Override
    public FlowGraph createScope(FlowGraph graph, ScopePath scope) {
        if (scope.isRoot()) {
            throw new GraphMutationException("The root scope always exists");
        }
        requireScope(graph, scope.parent());
        if (graph.node(scope.owner()) == null) {
            throw new GraphMutationException("Scope " + scope + " has no container node " + scope.owner());
        }
        if (graph.scope(scope.id()) != null || graph.node(scope.id()) != null) {
            throw new GraphMutationException("Duplicate id " + scope.id());
        }
        return graph.withScope(new GraphScope(scope, ""));
    }

    @Override
    public FlowGraph setAttribute(FlowGraph graph, ScopePath scope, String key, String value) {
        requireScope(graph, scope);
        int dot = key.lastIndexOf('.');
        if (dot <= 0 || dot == key.length() - 1) {
            throw new GraphMutationException("Malformed attribute key '" + key + "' in scope " + scope);
        }
        String target = key.substring(0, dot);
        String attribute = key.substring(dot + 1);

        if (target.contains(ARROW)) {
            return setEdgeAttribute(graph, scope, target, attribute, value);
        }

        String absoluteId = scope.qualify(target);
        GraphNode node = graph.node(absoluteId);
        if (node != null) {
            return switch (attribute) {
                case "shape" -> graph.replaceNode(node.withShape(NodeShape.fromName(value)));
                case "label" -> graph.replaceNode(node.withLabel(value));
                default -> throw new GraphMutationException("Unknown node attribute '" + attribute + "' on " + absoluteId);
            };
        }
        GraphScope child = graph.scope(absoluteId);
        if (child != null) {
            if (!attribute.equals("label")) {
                throw new GraphMutationException("Unknown scope attribute '" + attribute + "' on " + absoluteId);
            }
            return graph.replaceScope(child.withLabel(value));
        }
        throw new GraphMutationException("No node or scope " + absoluteId + " for attribute " + attribute);
    }

    @Override
    public FlowGraph createEdge(FlowGraph graph, ScopePath scope, String from, String to) {
        requireScope(graph, scope);
        String source = scope.qualify(from);
        String target = scope.qualify(to);
        if (graph.node(source) == null) {
            throw new GraphMutationException("Missing edge source " + source + " for edge to " + target);
        }
        if (graph.node(target) == null) {
            throw new GraphMutationException("Missing edge target " + target + " for edge from " + source);
        }
        return graph.withEdge(new GraphEdge(source, target, "", ""));
    }

    // Attributes apply to the most recent edge between the two endpoints
    private FlowGraph setEdgeAttribute(FlowGraph graph, ScopePath scope, String target, String attribute, String value) {
        int arrow = target.indexOf(ARROW);
        String source = scope.qualify(target.substring(0, arrow).trim());
        String destination = scope.qualify(target.substring(arrow + ARROW.length()).trim());

        int index = graph.edges().detectLastIndex(
            edge -> edge.from().equals(source) && edge.to().equals(destination));
        if (index < 0) {
            throw new GraphMutationException("No edge " + source + ARROW + destination + " for attribute " + attribute);
        }
        GraphEdge edge = graph.edges().get(index);
        return switch (attribute) {
            case "label" -> graph.replaceEdge(index, edge.withLabel(value));
            case "type" -> graph.replaceEdge(index, edge.withType(value));
            default -> throw new GraphMutationException(
                "Unknown edge attribute '" + attribute + "' on " + source + ARROW + destination);
        };
    }

    private static void requireScope(FlowGraph graph, ScopePath scope) {
        if (!scope.isRoot() && graph.scope(scope.id()) == null) {
            throw new GraphMutationException("Invalid scope " + scope);
        }
    }
}
