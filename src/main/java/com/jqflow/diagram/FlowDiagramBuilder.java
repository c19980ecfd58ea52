package com.jqflow.diagram;

import com.jqflow.graph.FlowGraph;
import com.jqflow.graph.GraphEmitter;
import com.jqflow.graph.ImmutableGraphEmitter;
import com.jqflow.graph.NodeShape;
import com.jqflow.graph.ScopePath;
import com.jqflow.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a parsed filter into a diagram graph framed by a {@code Start} and an {@code End} node.
 */
public class FlowDiagramBuilder {
    private static final Logger log = LoggerFactory.getLogger(FlowDiagramBuilder.class);

    private final QueryTraversal traversal;

    public FlowDiagramBuilder() {
        this(new ImmutableGraphEmitter());
    }

    public FlowDiagramBuilder(GraphEmitter emitter) {
        this.traversal = new QueryTraversal(emitter);
    }

    public FlowGraph build(Query query) {
        ScopePath root = ScopePath.root();
        FlowGraph graph = traversal.emitNode(FlowGraph.empty(), root, Cursor.START, "Start", NodeShape.CIRCLE);

        Cursor cursor = Cursor.fresh();
        TraversalResult result = traversal.traverse(query, graph, root, cursor, ValueType.UNKNOWN);

        String endId = "end_" + cursor.counter();
        graph = traversal.emitNode(result.graph(), root, endId, "End", NodeShape.CIRCLE);
        graph = traversal.connect(graph, root, cursor.lastNodeId(), endId, result.outputType());

        log.debug("Built {} for output type '{}'", graph, result.outputType().label());
        return graph;
    }
}
