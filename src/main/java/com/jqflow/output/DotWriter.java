package com.jqflow.output;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.jqflow.graph.FlowGraph;
import com.jqflow.graph.GraphEdge;
import com.jqflow.graph.GraphNode;
import com.jqflow.graph.GraphScope;
import com.jqflow.graph.ScopePath;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Serializes a {@link FlowGraph} as Graphviz DOT. A container node and its child
 * scopes share one cluster; each child scope is a nested cluster of its own.
 * Edges are written last, by absolute id.
 */
public class DotWriter {
    private static final String INDENT = "  ";
    private static final JsonStringEncoder ENCODER = JsonStringEncoder.getInstance();

    /** Plain DOT, without layout directives. */
    public String write(FlowGraph graph) {
        return write(graph, Lists.immutable.empty());
    }

    /** DOT with the direction and layout engine directives of {@code options}. */
    public String write(FlowGraph graph, DiagramOptions options) {
        return write(graph, options.directives());
    }

    String write(FlowGraph graph, ImmutableList<String> directives) {
        StringBuilder out = new StringBuilder("digraph \"jqflow\" {\n");
        directives.forEach(directive -> out.append(INDENT).append(directive).append(";\n"));
        writeScope(out, graph, ScopePath.root(), 1);
        graph.edges().forEach(edge -> writeEdge(out, edge));
        return out.append("}\n").toString();
    }

    private void writeScope(StringBuilder out, FlowGraph graph, ScopePath scope, int depth) {
        for (GraphNode node : graph.nodesIn(scope)) {
            ImmutableList<GraphScope> children = graph.scopesOwnedBy(node.id());
            if (children.isEmpty()) {
                writeNode(out, node, depth);
                continue;
            }
            openCluster(out, node.id(), "", depth);
            writeNode(out, node, depth + 1);
            for (GraphScope child : children) {
                // Unlabelled clusters would inherit the enclosing label
                openCluster(out, child.id(), child.label(), depth + 1);
                writeScope(out, graph, child.path(), depth + 2);
                indent(out, depth + 1).append("}\n");
            }
            indent(out, depth).append("}\n");
        }
    }

    private void openCluster(StringBuilder out, String id, String label, int depth) {
        indent(out, depth).append("subgraph ").append(quote("cluster_" + id)).append(" {\n");
        indent(out, depth + 1).append("label=").append(quote(label)).append(";\n");
    }

    private void writeNode(StringBuilder out, GraphNode node, int depth) {
        indent(out, depth).append(quote(node.id()))
            .append(" [shape=").append(node.shape().shapeName())
            .append(", label=").append(quote(node.label()))
            .append("];\n");
    }

    private void writeEdge(StringBuilder out, GraphEdge edge) {
        out.append(INDENT).append(quote(edge.from())).append(" -> ").append(quote(edge.to()));
        MutableList<String> attributes = Lists.mutable.empty();
        if (!edge.label().isEmpty()) {
            attributes.add("label=" + quote(edge.label()));
        }
        if (!edge.type().isEmpty()) {
            attributes.add("type=" + quote(edge.type()));
        }
        if (attributes.notEmpty()) {
            out.append(attributes.makeString(" [", ", ", "]"));
        }
        out.append(";\n");
    }

    private static StringBuilder indent(StringBuilder out, int depth) {
        return out.append(INDENT.repeat(depth));
    }

    static String quote(String value) {
        return "\"" + new String(ENCODER.quoteAsString(value)) + "\"";
    }
}
