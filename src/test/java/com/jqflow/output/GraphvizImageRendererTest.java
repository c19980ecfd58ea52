package com.jqflow.output;

import com.jqflow.graph.FlowGraph;
import guru.nidi.graphviz.model.MutableGraph;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GraphvizImageRendererTest {

    private final GraphvizImageRenderer renderer = new GraphvizImageRenderer(0.5);

    @Test
    public void testMalformedSourceIsALayoutError() {
        LayoutCompilationException e = assertThrows(LayoutCompilationException.class,
            () -> renderer.render("digraph \"jqflow\" {\n  \"a\" -> \n"));
        assertTrue(e.getMessage().startsWith("Invalid diagram source"));
    }

    @Test
    public void testUnknownLayoutEngine() {
        LayoutCompilationException e = assertThrows(LayoutCompilationException.class,
            () -> renderer.render("digraph \"jqflow\" {\n  layout=circo;\n  \"a\";\n}\n"));
        assertTrue(e.getMessage().contains("circo"));
    }

    @Test
    public void testDirectivesAreReadBack() throws LayoutCompilationException {
        MutableGraph graph = GraphvizImageRenderer.compile(new DotWriter().write(
            FlowGraph.empty(), new DiagramOptions(LayoutEngine.FDP, Direction.RIGHT, 0.5)));

        assertEquals("fdp", String.valueOf(graph.graphAttrs().get("layout")));
        assertEquals("LR", String.valueOf(graph.graphAttrs().get("rankdir")));
    }

    @Test
    public void testThemeAndPaddingAreApplied() throws LayoutCompilationException {
        MutableGraph graph = GraphvizImageRenderer.compile(new DotWriter().write(
            FlowGraph.empty(), DiagramOptions.defaults()));
        new GraphvizImageRenderer(1.25).applyTheme(graph);

        assertEquals("1.25", String.valueOf(graph.graphAttrs().get("pad")));
        assertEquals("Helvetica", String.valueOf(graph.graphAttrs().get("fontname")));
        assertEquals("filled", String.valueOf(graph.nodeAttrs().get("style")));
        assertEquals("#F7FAFF", String.valueOf(graph.nodeAttrs().get("fillcolor")));
        assertEquals("10", String.valueOf(graph.linkAttrs().get("fontsize")));
    }
}
