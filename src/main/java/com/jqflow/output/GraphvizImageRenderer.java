package com.jqflow.output;

import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;
import guru.nidi.graphviz.engine.GraphvizCmdLineEngine;
import guru.nidi.graphviz.engine.GraphvizException;
import guru.nidi.graphviz.engine.GraphvizJdkEngine;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.parse.Parser;
import guru.nidi.graphviz.parse.ParserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Renders through graphviz-java. A local {@code dot} binary is used when present,
 * otherwise the JavaScript build of Graphviz running on GraalJS.
 */
public class GraphvizImageRenderer implements ImageRenderer {
    private static final Logger log = LoggerFactory.getLogger(GraphvizImageRenderer.class);

    private static final String BORDER_COLOR = "#0D32B2";
    private static final String FILL_COLOR = "#F7FAFF";
    private static final String FONT = "Helvetica";

    private static volatile boolean enginesConfigured;

    private final double padding;

    public GraphvizImageRenderer() {
        this(DiagramOptions.defaults().padding());
    }

    public GraphvizImageRenderer(double padding) {
        this.padding = padding;
    }

    @Override
    public String render(String source) throws DiagramRenderException {
        MutableGraph graph = compile(source);
        LayoutEngine layout = LayoutEngine.fromDirective(layoutDirective(graph));
        applyTheme(graph);

        log.debug("Laying out diagram with the {} engine", layout.directiveName());
        String svg;
        try {
            configureEngines();
            svg = Graphviz.fromGraph(graph).engine(layout.engine()).render(Format.SVG).toString();
        } catch (GraphvizException e) {
            throw new LayoutCompilationException("Layout with " + layout.directiveName() + " failed: " + e.getMessage(), e);
        }
        if (svg == null || !svg.contains("<svg")) {
            throw new RasterizationException("Graphviz produced no SVG document");
        }
        return svg;
    }

    static MutableGraph compile(String source) throws LayoutCompilationException {
        try {
            return new Parser().read(source);
        } catch (IOException | ParserException e) {
            throw new LayoutCompilationException("Invalid diagram source: " + e.getMessage(), e);
        }
    }

    private static String layoutDirective(MutableGraph graph) {
        Object value = graph.graphAttrs().get("layout");
        return value == null ? LayoutEngine.DOT.directiveName() : value.toString();
    }

    void applyTheme(MutableGraph graph) {
        graph.graphAttrs().add("pad", padding);
        graph.graphAttrs().add("fontname", FONT);
        graph.nodeAttrs().add("fontname", FONT);
        graph.nodeAttrs().add("style", "filled");
        graph.nodeAttrs().add("fillcolor", FILL_COLOR);
        graph.nodeAttrs().add("color", BORDER_COLOR);
        graph.linkAttrs().add("fontname", FONT);
        graph.linkAttrs().add("fontsize", 10);
        graph.linkAttrs().add("color", BORDER_COLOR);
    }

    private static synchronized void configureEngines() {
        if (!enginesConfigured) {
            Graphviz.useEngine(new GraphvizCmdLineEngine(), new GraphvizJdkEngine());
            enginesConfigured = true;
        }
    }
}
