package com.jqflow.diagram;

import com.jqflow.graph.FlowGraph;

/**
 * Output of traversing one filter: the type it is believed to emit and the updated graph.
 */
public record TraversalResult(ValueType outputType, FlowGraph graph) {
}
