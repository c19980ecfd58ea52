package com.jqflow;

import com.jqflow.graph.FlowGraph;
import com.jqflow.output.DiagramOptions;
import com.jqflow.output.Direction;
import com.jqflow.output.DotWriter;
import com.jqflow.output.LayoutEngine;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "jqflow", mixinStandardHelpOptions = true, version = "1.0",
         description = "Draw a jq filter as a flow diagram (.dot or .svg)")
public class JqFlow implements Callable<Integer> {
    @Parameters(index = "0", description = "The jq filter to draw")
    private String filter;

    @Parameters(index = "1", description = "Output file: .dot for Graphviz text, .svg for an image")
    private Path output;

    @Option(names = {"-e", "--layout-engine"}, description = "Layout engine: ${COMPLETION-CANDIDATES} (default: dot)")
    private LayoutEngine layoutEngine = LayoutEngine.DOT;

    @Option(names = {"-d", "--direction"}, description = "Flow direction: ${COMPLETION-CANDIDATES} (default: RIGHT)")
    private Direction direction = Direction.RIGHT;

    @Option(names = "--pad", description = "Padding around the image, in inches (default: 0.5)")
    private double padding = DiagramOptions.defaults().padding();

    @Option(names = {"-p", "--print"}, description = "Also print the DOT text to stdout")
    private boolean print = false;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new JqFlow()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() throws Exception {
        try {
            DiagramOptions options = new DiagramOptions(layoutEngine, direction, padding);
            FlowGraph graph = new FlowDiagramGenerator(options).generate(filter, output);
            if (print) {
                System.out.print(new DotWriter().write(graph));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
