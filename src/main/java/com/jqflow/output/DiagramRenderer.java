package com.jqflow.output;

import com.jqflow.graph.FlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a finished graph to disk. {@code .dot} targets get the plain DOT text;
 * {@code .svg} targets are laid out and drawn. When drawing fails the DOT text,
 * directives included, is saved next to the target as {@code <name>.dot}.
 */
public class DiagramRenderer {
    private static final Logger log = LoggerFactory.getLogger(DiagramRenderer.class);

    private final DotWriter writer = new DotWriter();
    private final DiagramOptions options;
    private final ImageRenderer imageRenderer;

    public DiagramRenderer() {
        this(DiagramOptions.defaults());
    }

    public DiagramRenderer(DiagramOptions options) {
        this(options, new GraphvizImageRenderer(options.padding()));
    }

    public DiagramRenderer(DiagramOptions options, ImageRenderer imageRenderer) {
        this.options = options;
        this.imageRenderer = imageRenderer;
    }

    public void render(FlowGraph graph, Path output) throws IOException {
        OutputFormat format = OutputFormat.forPath(output);
        if (!format.isImage()) {
            Files.writeString(output, writer.write(graph));
            log.info("Wrote {}", output);
            return;
        }

        String source = writer.write(graph, options);
        String svg;
        try {
            svg = imageRenderer.render(source);
        } catch (DiagramRenderException e) {
            Path saved = OutputFormat.DOT.sibling(output);
            Files.writeString(saved, source);
            log.warn("Could not draw {}; DOT source saved to {}", output, saved);
            throw e.withSavedSource(saved);
        }
        Files.writeString(output, svg);
        log.info("Wrote {} using the {} layout", output, options.layoutEngine().directiveName());
    }
}
