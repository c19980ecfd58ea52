package com.jqflow.diagram;

import com.jqflow.graph.FlowGraph;
import com.jqflow.graph.GraphEmitter;
import com.jqflow.graph.GraphMutationException;
import com.jqflow.graph.NodeShape;
import com.jqflow.graph.ScopePath;
import com.jqflow.query.ObjectEntry;
import com.jqflow.query.Query;
import com.jqflow.query.Term;

/**
 * Builds container stages: a node whose arguments (or object values) are each drawn
 * as an independent sub-flow inside a child scope {@code child_<k>} of the container.
 * Sub-flows start from a fresh cursor, have no entry edge and are not linked to the container.
 */
class ContainerBuilder {
    private static final String ARRAY_LABEL = "Array";

    private final GraphEmitter emitter;
    private final QueryTraversal traversal;

    ContainerBuilder(GraphEmitter emitter, QueryTraversal traversal) {
        this.emitter = emitter;
        this.traversal = traversal;
    }

    TraversalResult buildFunction(Term.FunctionCall call, FlowGraph graph, ScopePath scope, Cursor cursor,
                                  ValueType incomingType) {
        String label = Labels.containerLabel(call);
        FlowGraph updated = traversal.appendStage(graph, scope, cursor, label, NodeShape.RECTANGLE, incomingType);
        String containerId = cursor.lastNodeId();
        for (int k = 0; k < call.args().size(); k++) {
            updated = buildChild(updated, scope, containerId, label, "argument", k, "", call.args().get(k), incomingType);
        }
        return new TraversalResult(TypeInference.ofTerm(call), updated);
    }

    TraversalResult buildObject(Term.ObjectLiteral object, FlowGraph graph, ScopePath scope, Cursor cursor,
                                ValueType incomingType) {
        String label = object.suffixes().isEmpty() ? Labels.objectLabel(object) : Labels.termLabel(object);
        FlowGraph updated = traversal.appendStage(graph, scope, cursor, label, NodeShape.RECTANGLE, incomingType);
        String containerId = cursor.lastNodeId();
        for (int k = 0; k < object.entries().size(); k++) {
            ObjectEntry entry = object.entries().get(k);
            updated = buildChild(updated, scope, containerId, label, "entry", k,
                scopeLabel(entry.key()), entry.value(), incomingType);
        }
        return new TraversalResult(TypeInference.ofTerm(object), updated);
    }

    /**
     * An array whose body calls a function: the body is drawn as the only sub-flow.
     */
    TraversalResult buildArray(Term.ArrayLiteral array, FlowGraph graph, ScopePath scope, Cursor cursor,
                               ValueType incomingType) {
        FlowGraph updated = traversal.appendStage(graph, scope, cursor, ARRAY_LABEL, NodeShape.RECTANGLE, incomingType);
        String containerId = cursor.lastNodeId();
        updated = buildChild(updated, scope, containerId, ARRAY_LABEL, "element", 0, "", array.body(), incomingType);
        return new TraversalResult(TypeInference.ofTerm(array), updated);
    }

    private FlowGraph buildChild(FlowGraph graph, ScopePath scope, String containerId, String containerLabel,
                                 String role, int index, String scopeLabel, Query body, ValueType incomingType) {
        ScopePath childScope = scope.child(containerId, index);
        try {
            FlowGraph updated = emitter.createScope(graph, childScope);
            if (!scopeLabel.isEmpty()) {
                updated = emitter.setAttribute(updated, scope, containerId + ".child_" + index + ".label", scopeLabel);
            }
            return traversal.traverse(body, updated, childScope, Cursor.fresh(), incomingType).graph();
        } catch (GraphMutationException e) {
            throw new GraphMutationException("Failed to build " + role + " " + index + " of "
                + scope.qualify(containerId) + " (" + containerLabel + "): " + e.getMessage(), e);
        }
    }

    private static String scopeLabel(ObjectEntry.Key key) {
        if (key instanceof ObjectEntry.Key.Named named) {
            return named.name();
        }
        return Labels.keyLabel(key);
    }
}
