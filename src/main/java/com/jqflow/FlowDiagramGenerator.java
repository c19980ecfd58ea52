package com.jqflow;

import com.jqflow.diagram.FlowDiagramBuilder;
import com.jqflow.graph.FlowGraph;
import com.jqflow.output.DiagramOptions;
import com.jqflow.output.DiagramRenderer;
import com.jqflow.output.OutputFormat;
import com.jqflow.query.Query;
import com.jqflow.query.QueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Draws a jq filter to a file. The extension of the target picks the output:
 * {@code .dot} for the DOT text, {@code .svg} for a laid-out drawing.
 */
public class FlowDiagramGenerator {
    private static final Logger log = LoggerFactory.getLogger(FlowDiagramGenerator.class);

    private final FlowDiagramBuilder builder;
    private final DiagramRenderer renderer;

    public FlowDiagramGenerator() {
        this(DiagramOptions.defaults());
    }

    public FlowDiagramGenerator(DiagramOptions options) {
        this(new FlowDiagramBuilder(), new DiagramRenderer(options));
    }

    public FlowDiagramGenerator(FlowDiagramBuilder builder, DiagramRenderer renderer) {
        this.builder = builder;
        this.renderer = renderer;
    }

    public FlowGraph generate(String filter, Path output) throws IOException {
        OutputFormat.forPath(output);
        return generate(new QueryParser().parse(filter), output);
    }

    public FlowGraph generate(Query query, Path output) throws IOException {
        // Reject the target before building anything
        OutputFormat format = OutputFormat.forPath(output);
        FlowGraph graph = builder.build(query);
        log.debug("Rendering {} as {}", graph, format);
        renderer.render(graph, output);
        return graph;
    }
}
