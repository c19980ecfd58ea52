package com.jqflow.output;

import com.jqflow.diagram.FlowDiagramBuilder;
import com.jqflow.graph.FlowGraph;
import com.jqflow.query.QueryParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class DiagramRendererTest {

    @TempDir
    Path dir;

    private final FlowGraph graph = new FlowDiagramBuilder().build(new QueryParser().parse(".a | length"));

    @Test
    public void testTextTargetIsPlainDot() throws IOException {
        Path output = dir.resolve("report.dot");
        new DiagramRenderer(DiagramOptions.defaults(), source -> fail("text output must not be drawn"))
            .render(graph, output);

        String dot = Files.readString(output);
        assertEquals(new DotWriter().write(graph), dot);
        assertFalse(dot.contains("rankdir"));
        assertFalse(dot.contains("layout"));
    }

    @Test
    public void testLayoutFailureSavesSource() {
        Path output = dir.resolve("report.svg");
        DiagramRenderer renderer = new DiagramRenderer(DiagramOptions.defaults(), source -> {
            throw new LayoutCompilationException("layout rejected");
        });

        DiagramRenderException e = assertThrows(DiagramRenderException.class, () -> renderer.render(graph, output));

        Path saved = dir.resolve("report.dot");
        assertInstanceOf(LayoutCompilationException.class, e);
        assertFalse(Files.exists(output));
        assertTrue(Files.exists(saved));
        assertEquals(saved, e.savedSource());
        assertTrue(e.getMessage().contains("layout rejected"));
        assertTrue(e.getMessage().contains("report.dot"));
    }

    @Test
    public void testSavedSourceKeepsDirectives() throws IOException {
        Path output = dir.resolve("flow.svg");
        DiagramOptions options = new DiagramOptions(LayoutEngine.FDP, Direction.DOWN, 0.5);
        DiagramRenderer renderer = new DiagramRenderer(options, source -> {
            throw new RasterizationException("no image");
        });

        RasterizationException e = assertThrows(RasterizationException.class, () -> renderer.render(graph, output));

        String saved = Files.readString(dir.resolve("flow.dot"));
        assertEquals(new DotWriter().write(graph, options), saved);
        assertTrue(saved.contains("rankdir=TB;"));
        assertTrue(saved.contains("layout=fdp;"));
        assertTrue(e.getMessage().contains("flow.dot"));
    }

    @Test
    public void testUnsupportedFormatWritesNothing() throws IOException {
        DiagramRenderer renderer = new DiagramRenderer(DiagramOptions.defaults(), source -> "<svg/>");

        assertThrows(UnsupportedFormatException.class, () -> renderer.render(graph, dir.resolve("report.txt")));
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    public void testRenderedImageIsWritten() throws IOException {
        Path output = dir.resolve("flow.svg");
        StringBuilder seen = new StringBuilder();
        new DiagramRenderer(DiagramOptions.defaults(), source -> {
            seen.append(source);
            return "<svg xmlns=\"http://www.w3.org/2000/svg\"></svg>";
        }).render(graph, output);

        assertEquals("<svg xmlns=\"http://www.w3.org/2000/svg\"></svg>", Files.readString(output));
        assertTrue(seen.toString().contains("rankdir=LR;"));
        assertFalse(Files.exists(dir.resolve("flow.dot")));
    }

    @Test
    public void testGraphvizRendersSvg() throws IOException {
        String source = new DotWriter().write(graph, DiagramOptions.defaults());
        String svg;
        try {
            svg = new GraphvizImageRenderer().render(source);
        } catch (DiagramRenderException | RuntimeException | LinkageError e) {
            assumeTrue(false, "No Graphviz engine available: " + e.getMessage());
            return;
        }

        assertTrue(svg.contains("<svg"));
        assertTrue(svg.contains("length()"));
    }
}
