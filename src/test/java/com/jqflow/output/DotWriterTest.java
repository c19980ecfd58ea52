package com.jqflow.output;

import com.jqflow.diagram.FlowDiagramBuilder;
import com.jqflow.graph.FlowGraph;
import com.jqflow.query.QueryParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DotWriterTest {

    private final DotWriter writer = new DotWriter();

    @Test
    public void testNodesAndEdges() {
        String dot = writer.write(build("\"hello\" | base64_encode"));

        assertTrue(dot.startsWith("digraph \"jqflow\" {\n"));
        assertTrue(dot.endsWith("}\n"));
        assertTrue(dot.contains("  \"start\" [shape=circle, label=\"Start\"];\n"));
        assertTrue(dot.contains("  \"node_0\" [shape=rectangle, label=\"\\\"hello\\\"\"];\n"));
        assertTrue(dot.contains("  \"start\" -> \"node_0\";\n"));
        assertTrue(dot.contains("  \"node_0\" -> \"node_1\" [type=\"string\"];\n"));
        assertTrue(dot.contains("  \"node_1\" -> \"end_2\" [type=\"string\"];\n"));
    }

    @Test
    public void testTextHasNoDirectives() {
        String dot = writer.write(build(".a | length"));

        assertFalse(dot.contains("rankdir"));
        assertFalse(dot.contains("layout"));
    }

    @Test
    public void testDirectivesComeFirst() {
        DiagramOptions options = new DiagramOptions(LayoutEngine.FDP, Direction.DOWN, 0.25);
        String dot = writer.write(build(".a"), options);

        int rankdir = dot.indexOf("rankdir=TB;");
        int layout = dot.indexOf("layout=fdp;");
        assertTrue(rankdir > 0);
        assertTrue(layout > rankdir);
        assertTrue(layout < dot.indexOf("\"start\""));
    }

    @Test
    public void testContainersAreNestedClusters() {
        String dot = writer.write(build("{file: \"test\", md5: (md5 | ._val)}"));

        assertTrue(dot.contains("  subgraph \"cluster_node_0\" {\n"));
        assertTrue(dot.contains("    subgraph \"cluster_node_0.child_0\" {\n      label=\"file\";\n"));
        assertTrue(dot.contains("    subgraph \"cluster_node_0.child_1\" {\n      label=\"md5\";\n"));
        assertTrue(dot.contains("      \"node_0.child_1.node_0\" [shape=rectangle, label=\"md5()\"];\n"));
        assertTrue(dot.contains("  \"node_0.child_1.node_0\" -> \"node_0.child_1.node_1\" [type=\"string\"];\n"));
        assertTrue(dot.indexOf("cluster_node_0.child_0") < dot.indexOf("cluster_node_0.child_1"));
    }

    @Test
    public void testArgumentClustersGetEmptyLabel() {
        String dot = writer.write(build("map(select(.a))"));

        assertTrue(dot.contains("subgraph \"cluster_node_0.child_0\" {\n      label=\"\";\n"));
        assertTrue(dot.contains("subgraph \"cluster_node_0.child_0.node_0.child_0\""));
    }

    @Test
    public void testOutputIsStable() {
        FlowGraph graph = build("[.[] | {n: .name | ascii_upcase}] | length");
        assertEquals(writer.write(graph), writer.write(build("[.[] | {n: .name | ascii_upcase}] | length")));
    }

    private static FlowGraph build(String filter) {
        return new FlowDiagramBuilder().build(new QueryParser().parse(filter));
    }
}
