package com.jqflow.diagram;

import com.jqflow.graph.FlowGraph;
import com.jqflow.graph.GraphEmitter;
import com.jqflow.graph.NodeShape;
import com.jqflow.graph.ScopePath;
import com.jqflow.query.Query;
import com.jqflow.query.Term;

/**
 * Walks a parsed filter and adds one stage per visible step to the graph.
 *
 * <p>Pipes are transparent: their halves are chained. Function calls, object
 * literals and arrays holding calls become containers (see {@link ContainerBuilder}).
 * Other operators become a single node that both operand branches feed into.
 * Everything else is a plain stage labelled by {@link Labels#nodeLabel(Query)}.
 */
public class QueryTraversal {
    private final GraphEmitter emitter;
    private final ContainerBuilder containers;

    public QueryTraversal(GraphEmitter emitter) {
        this.emitter = emitter;
        this.containers = new ContainerBuilder(emitter, this);
    }

    public TraversalResult traverse(Query query, FlowGraph graph, ScopePath scope, Cursor cursor, ValueType incomingType) {
        if (query == null) {
            return new TraversalResult(ValueType.UNKNOWN, graph);
        }
        switch (query.op()) {
            case PIPE:
                return traverseSequence(query, graph, scope, cursor, incomingType);
            case NONE:
                if (query.term() != null) {
                    return query.term().accept(new TermDispatch(query, graph, scope, cursor, incomingType));
                }
                if (Labels.nodeLabel(query).startsWith(Labels.SLICE_PREFIX)) {
                    return stage(query, graph, scope, cursor, incomingType);
                }
                return traverseSequence(query, graph, scope, cursor, incomingType);
            case COMMA:
                // Alternatives are not modelled; one node shows the whole expression
                return stage(query, graph, scope, cursor, incomingType);
            default:
                return traverseOperator(query, graph, scope, cursor, incomingType);
        }
    }

    /**
     * Declares {@code nodeId} in {@code scope} with its shape and label.
     */
    public FlowGraph emitNode(FlowGraph graph, ScopePath scope, String nodeId, String label, NodeShape shape) {
        FlowGraph updated = emitter.createNode(graph, scope, nodeId);
        updated = emitter.setAttribute(updated, scope, nodeId + ".shape", shape.shapeName());
        return emitter.setAttribute(updated, scope, nodeId + ".label", label);
    }

    /**
     * Connects {@code from} to {@code to} and records the flowing type on the edge.
     * A detached cursor ({@code from == null}) connects nothing, and {@code start}
     * is only connected in the scope that declares it.
     */
    public FlowGraph connect(FlowGraph graph, ScopePath scope, String from, String to, ValueType type) {
        if (from == null) {
            return graph;
        }
        if (Cursor.START.equals(from)) {
            return graph.containsNode(scope, Cursor.START) ? emitter.createEdge(graph, scope, from, to) : graph;
        }
        FlowGraph updated = emitter.createEdge(graph, scope, from, to);
        if (!type.isKnown()) {
            return updated;
        }
        String edge = from + " -> " + to;
        updated = emitter.setAttribute(updated, scope, edge + ".type", type.label());
        String label = EdgeLabels.sanitize(type.label());
        if (!label.isEmpty()) {
            updated = emitter.setAttribute(updated, scope, edge + ".label", label);
        }
        return updated;
    }

    /**
     * Allocates the next id, declares the node, links it from the cursor and moves the cursor onto it.
     */
    FlowGraph appendStage(FlowGraph graph, ScopePath scope, Cursor cursor, String label, NodeShape shape,
                          ValueType incomingType) {
        String nodeId = cursor.nextNodeId();
        FlowGraph updated = emitNode(graph, scope, nodeId, label, shape);
        updated = connect(updated, scope, cursor.lastNodeId(), nodeId, incomingType);
        cursor.moveTo(nodeId);
        return updated;
    }

    private TraversalResult stage(Query query, FlowGraph graph, ScopePath scope, Cursor cursor, ValueType incomingType) {
        FlowGraph updated = appendStage(graph, scope, cursor, Labels.nodeLabel(query), NodeShape.RECTANGLE, incomingType);
        return new TraversalResult(TypeInference.infer(query), updated);
    }

    private TraversalResult traverseSequence(Query query, FlowGraph graph, ScopePath scope, Cursor cursor,
                                             ValueType incomingType) {
        TraversalResult left = traverse(query.left(), graph, scope, cursor, incomingType);
        if (query.right() == null) {
            return left;
        }
        ValueType between = query.left() == null ? incomingType : left.outputType();
        return traverse(query.right(), left.graph(), scope, cursor, between);
    }

    private TraversalResult traverseOperator(Query query, FlowGraph graph, ScopePath scope, Cursor cursor,
                                             ValueType incomingType) {
        String label = Labels.nodeLabel(query);
        FlowGraph updated = appendStage(graph, scope, cursor, label, NodeShape.RECTANGLE, incomingType);
        String operatorId = cursor.lastNodeId();

        for (Query operand : new Query[]{query.left(), query.right()}) {
            if (operand == null) {
                continue;
            }
            cursor.detach();
            TraversalResult branch = traverse(operand, updated, scope, cursor, incomingType);
            updated = connect(branch.graph(), scope, cursor.lastNodeId(), operatorId, branch.outputType());
        }
        cursor.moveTo(operatorId);
        return new TraversalResult(TypeInference.infer(query), updated);
    }

    private final class TermDispatch implements Term.Visitor<TraversalResult> {
        private final Query query;
        private final FlowGraph graph;
        private final ScopePath scope;
        private final Cursor cursor;
        private final ValueType incomingType;

        TermDispatch(Query query, FlowGraph graph, ScopePath scope, Cursor cursor, ValueType incomingType) {
            this.query = query;
            this.graph = graph;
            this.scope = scope;
            this.cursor = cursor;
            this.incomingType = incomingType;
        }

        private TraversalResult plain() {
            return stage(query, graph, scope, cursor, incomingType);
        }

        @Override
        public TraversalResult visitIdentity(Term.Identity identity) {
            return plain();
        }

        @Override
        public TraversalResult visitRecurse(Term.Recurse recurse) {
            return plain();
        }

        @Override
        public TraversalResult visitNull(Term.NullLiteral literal) {
            return plain();
        }

        @Override
        public TraversalResult visitBoolean(Term.BooleanLiteral literal) {
            return plain();
        }

        @Override
        public TraversalResult visitNumber(Term.NumberLiteral literal) {
            return plain();
        }

        @Override
        public TraversalResult visitString(Term.StringLiteral literal) {
            return plain();
        }

        @Override
        public TraversalResult visitIndex(Term.Index index) {
            return plain();
        }

        @Override
        public TraversalResult visitFunctionCall(Term.FunctionCall call) {
            if (Labels.sliceLabel(call) != null) {
                return plain();
            }
            return containers.buildFunction(call, graph, scope, cursor, incomingType);
        }

        @Override
        public TraversalResult visitArray(Term.ArrayLiteral array) {
            if (array.suffixes().isEmpty() && Labels.containsCall(array.body())) {
                return containers.buildArray(array, graph, scope, cursor, incomingType);
            }
            return plain();
        }

        @Override
        public TraversalResult visitObject(Term.ObjectLiteral object) {
            if (Labels.sliceLabel(object) != null) {
                return plain();
            }
            return containers.buildObject(object, graph, scope, cursor, incomingType);
        }

        @Override
        public TraversalResult visitVariable(Term.Variable variable) {
            return plain();
        }

        @Override
        public TraversalResult visitSubquery(Term.Subquery subquery) {
            if (subquery.suffixes().isEmpty()) {
                return traverse(subquery.query(), graph, scope, cursor, incomingType);
            }
            return plain();
        }

        @Override
        public TraversalResult visitUnmodeled(Term.Unmodeled unmodeled) {
            return plain();
        }
    }
}
