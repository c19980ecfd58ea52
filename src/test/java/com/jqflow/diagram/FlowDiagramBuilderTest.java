package com.jqflow.diagram;

import com.jqflow.graph.FlowGraph;
import com.jqflow.graph.GraphEdge;
import com.jqflow.graph.GraphMutationException;
import com.jqflow.graph.GraphNode;
import com.jqflow.graph.GraphScope;
import com.jqflow.graph.ImmutableGraphEmitter;
import com.jqflow.graph.NodeShape;
import com.jqflow.graph.ScopePath;
import com.jqflow.query.IndexSpec;
import com.jqflow.query.Operator;
import com.jqflow.query.Query;
import com.jqflow.query.QueryParser;
import com.jqflow.query.Term;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class FlowDiagramBuilderTest {

    private final QueryParser parser = new QueryParser();
    private final FlowDiagramBuilder builder = new FlowDiagramBuilder();

    @Test
    public void testEncodeDecodeChain() {
        FlowGraph graph = build("\"hello\" | base64_encode | base64_decode");

        assertEquals(5, graph.nodes().size());
        assertEquals("\"hello\"", graph.node("node_0").label());
        assertEquals("base64_encode()", graph.node("node_1").label());
        assertEquals("base64_decode()", graph.node("node_2").label());
        assertEquals(NodeShape.CIRCLE, graph.node("start").shape());
        assertEquals("Start", graph.node("start").label());
        assertEquals("End", graph.node("end_3").label());

        assertEquals(Lists.immutable.of("start -> node_0", "node_0 -> node_1", "node_1 -> node_2", "node_2 -> end_3"),
            graph.edges().collect(GraphEdge::key));
        assertEquals("", edge(graph, "start", "node_0").type());
        assertEquals("string", edge(graph, "node_0", "node_1").type());
        assertEquals("string", edge(graph, "node_1", "node_2").type());
        assertEquals("string", edge(graph, "node_2", "end_3").type());
    }

    @Test
    public void testSliceIsOneNode() {
        FlowGraph graph = build(".[0:3]");

        ImmutableList<GraphNode> stages = stages(graph);
        assertEquals(1, stages.size());
        assertEquals("Slice [0:3]", stages.getOnly().label());
    }

    @Test
    public void testSliceChildrenAreNotTraversed() {
        Query slice = Query.of(new Term.Index(new IndexSpec.Slice(
            Query.of(new Term.NumberLiteral("2")), parser.parse("length"))));
        Query wrapped = new Query(Operator.NONE, null, slice, Query.of(new Term.Identity()));

        FlowGraph graph = builder.build(wrapped);

        assertEquals(1, stages(graph).size());
        assertEquals("Slice [2:length]", graph.node("node_0").label());
        assertTrue(graph.scopes().isEmpty());
    }

    @ParameterizedTest
    @CsvSource(delimiterString = " => ", value = {
        "split(\",\")[0:2] => Slice [0:2] of split(\",\")",
        "{a: length}[1:] => Slice [1:] of {a: length}",
    })
    public void testSlicedContainerIsOneStage(String filter, String label) {
        FlowGraph graph = build(filter);

        assertEquals(1, stages(graph).size());
        assertEquals(label, graph.node("node_0").label());
        assertTrue(graph.scopes().isEmpty());
        assertEquals(3, graph.nodes().size());
    }

    @ParameterizedTest
    @CsvSource(delimiterString = " => ", value = {
        ". => 1",
        ".a | .b => 2",
        ".a | .b | .c => 3",
        ".a | .b | .c | .d | .e => 5",
        "(.a | .b) | (.c | .d) => 4"
    })
    public void testPipesCreateNoNodes(String filter, int expectedStages) {
        FlowGraph graph = build(filter);

        assertEquals(expectedStages, stages(graph).size());
        assertEquals(expectedStages + 1, graph.edges().size());
    }

    @Test
    public void testFunctionArgumentsAreIndependent() {
        FlowGraph both = build("test(.a | ascii_downcase; .b)");
        FlowGraph secondOnly = build("test(.b)");

        ScopePath call = ScopePath.root();
        assertEquals(1 + 2 + 1, stages(both).size());
        assertEquals(2, both.nodesIn(call.child("node_0", 0)).size());
        assertEquals(1, both.nodesIn(call.child("node_0", 1)).size());

        GraphNode b = both.nodesIn(call.child("node_0", 1)).getOnly();
        GraphNode alone = secondOnly.nodesIn(call.child("node_0", 0)).getOnly();
        assertEquals(alone.name(), b.name());
        assertEquals(alone.label(), b.label());

        // No edge links the container to its arguments or the arguments to each other
        assertTrue(both.edges().noneSatisfy(edge -> edge.from().equals("node_0") && edge.to().startsWith("node_0.")));
        assertTrue(both.edges().noneSatisfy(edge -> edge.from().startsWith("node_0.child_0")
            && edge.to().startsWith("node_0.child_1")));
        assertEquals(1, both.edges().count(edge -> edge.from().startsWith("node_0.child_")));
    }

    @Test
    public void testArgumentScopesHaveNoEntryNode() {
        FlowGraph graph = build("select(.a)");

        assertNull(graph.node("node_0.child_0.start"));
        assertTrue(graph.edges().noneSatisfy(edge -> edge.to().equals("node_0.child_0.node_0")));
        assertEquals("", graph.scope("node_0.child_0").label());
    }

    @Test
    public void testNestedContainers() {
        FlowGraph graph = build("map(select(.a | endswith(\".go\")))");

        assertEquals("map()", graph.node("node_0").label());
        assertEquals("select()", graph.node("node_0.child_0.node_0").label());
        assertEquals(".a", graph.node("node_0.child_0.node_0.child_0.node_0").label());
        assertEquals("endswith()", graph.node("node_0.child_0.node_0.child_0.node_1").label());
        assertEquals("\".go\"", graph.node("node_0.child_0.node_0.child_0.node_1.child_0.node_0").label());

        assertEquals(1, graph.scopesOwnedBy("node_0.child_0.node_0").size());
        assertEquals(1, graph.edgesBetween("node_0.child_0.node_0.child_0.node_0",
            "node_0.child_0.node_0.child_0.node_1").size());
        assertEquals(3, graph.scopes().size());
    }

    @Test
    public void testObjectEntriesAreLabelledScopes() {
        FlowGraph graph = build("{file: \"test\", md5: (md5 | ._val)}");

        GraphNode object = graph.node("node_0");
        assertEquals("{file: \"test\", md5: (md5 | ._val)}", object.label());

        ImmutableList<GraphScope> scopes = graph.scopesOwnedBy("node_0");
        assertEquals(2, scopes.size());
        assertEquals("file", scopes.get(0).label());
        assertEquals("md5", scopes.get(1).label());

        assertEquals("\"test\"", graph.node("node_0.child_0.node_0").label());
        assertEquals("md5()", graph.node("node_0.child_1.node_0").label());
        assertEquals("._val", graph.node("node_0.child_1.node_1").label());
        assertEquals("string", edge(graph, "node_0.child_1.node_0", "node_0.child_1.node_1").type());

        assertTrue(graph.edges().noneSatisfy(edge -> edge.from().startsWith("node_0.child_0")
            && edge.to().startsWith("node_0.child_1")));
        assertEquals("object", edge(graph, "node_0", "end_1").type());
    }

    @Test
    public void testPlainObjectIsStillAContainer() {
        FlowGraph graph = build("{a: 1, (.k): .v}");

        assertEquals("Object", graph.node("node_0").label());
        assertEquals("a", graph.scope("node_0.child_0").label());
        assertEquals("(.k)", graph.scope("node_0.child_1").label());
    }

    @Test
    public void testArrayWithCallIsAContainer() {
        FlowGraph graph = build("[.[] | tostring]");

        assertEquals("Array", graph.node("node_0").label());
        assertEquals(1, graph.scopesOwnedBy("node_0").size());
        assertEquals(".[]", graph.node("node_0.child_0.node_0").label());
        assertEquals("tostring()", graph.node("node_0.child_0.node_1").label());
    }

    @Test
    public void testArrayWithoutCallIsPlain() {
        FlowGraph graph = build("[.a, .b]");

        assertEquals(1, stages(graph).size());
        assertEquals("[.a, .b]", graph.node("node_0").label());
        assertEquals("array", edge(graph, "node_0", "end_1").type());
    }

    @Test
    public void testBinaryOperatorBranches() {
        FlowGraph graph = build(".x | length + \"a\"");

        assertEquals(".x", graph.node("node_0").label());
        assertEquals("Add (+)", graph.node("node_1").label());
        assertEquals("length()", graph.node("node_2").label());
        assertEquals("\"a\"", graph.node("node_3").label());

        assertEquals(1, graph.edgesBetween("node_0", "node_1").size());
        assertEquals("number", edge(graph, "node_2", "node_1").type());
        assertEquals("string", edge(graph, "node_3", "node_1").type());
        // operands are not fed by the preceding stage
        assertTrue(graph.edges().noneSatisfy(edge -> edge.to().equals("node_2") || edge.to().equals("node_3")));
        assertEquals("number", edge(graph, "node_1", "end_4").type());
    }

    @Test
    public void testComparisonFeedsIntoNextStage() {
        FlowGraph graph = build(".a == 1 | not");

        assertEquals("Equal (==)", graph.node("node_0").label());
        assertEquals("not()", graph.node("node_3").label());
        assertEquals("boolean", edge(graph, "node_0", "node_3").type());
    }

    @Test
    public void testCommaIsSingleFallbackNode() {
        FlowGraph graph = build(".a, .b | length");

        assertEquals(".a, .b", graph.node("node_0").label());
        assertEquals("length()", graph.node("node_1").label());
        assertEquals(2, stages(graph).size());
    }

    @Test
    public void testSubqueryIsTransparent() {
        FlowGraph graph = build("(.a | .b)");

        assertEquals(2, stages(graph).size());
        assertEquals(".a", graph.node("node_0").label());

        FlowGraph suffixed = build("(.a | .b)[0]");
        assertEquals(1, stages(suffixed).size());
        assertEquals("(.a | .b)[0]", suffixed.node("node_0").label());
    }

    @Test
    public void testNoEdgeLabelIsAReservedWord() {
        FlowGraph graph = build("{a: (\"x\" | length), b: [1] | tojson} | keys | .[0] == true");

        assertTrue(graph.edges().anySatisfy(edge -> !edge.type().isEmpty()));
        assertTrue(graph.edges().allSatisfy(edge -> !EdgeLabels.isReserved(edge.label())));
    }

    @Test
    public void testBuildIsDeterministic() {
        Query query = parser.parse("{k: map(select(.v > 1) | .n)} | to_entries | .[1:] | length + 1");

        FlowGraph first = builder.build(query);
        FlowGraph second = new FlowDiagramBuilder().build(query);

        assertEquals(first.nodes(), second.nodes());
        assertEquals(first.edges(), second.edges());
        assertEquals(first.scopes(), second.scopes());
    }

    @Test
    public void testEmitterFailureNamesTheArgument() {
        ImmutableGraphEmitter failing = new ImmutableGraphEmitter() {
            @Override
            public FlowGraph createNode(FlowGraph graph, ScopePath scope, String id) {
                if (scope.depth() > 0) {
                    throw new GraphMutationException("Invalid scope " + scope);
                }
                return super.createNode(graph, scope, id);
            }
        };

        GraphMutationException e = assertThrows(GraphMutationException.class,
            () -> new FlowDiagramBuilder(failing).build(parser.parse(".x | ltrimstr(\"a\")")));
        assertTrue(e.getMessage().contains("argument 0"));
        assertTrue(e.getMessage().contains("node_1"));
        assertTrue(e.getMessage().contains("ltrimstr()"));
    }

    private FlowGraph build(String filter) {
        return builder.build(parser.parse(filter));
    }

    private static ImmutableList<GraphNode> stages(FlowGraph graph) {
        return graph.nodes().reject(node -> node.shape() == NodeShape.CIRCLE);
    }

    private static GraphEdge edge(FlowGraph graph, String from, String to) {
        return graph.edgesBetween(from, to).getOnly();
    }
}
