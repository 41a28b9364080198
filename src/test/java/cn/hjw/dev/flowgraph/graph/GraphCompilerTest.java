package cn.hjw.dev.flowgraph.graph;

import cn.hjw.dev.flowgraph.exception.UnknownNodeException;
import cn.hjw.dev.flowgraph.function.NodeFunction;
import cn.hjw.dev.flowgraph.function.RouterOutput;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class GraphCompilerTest {

    private static final NodeFunction IDENTITY = input -> List.of(input);

    @Test
    public void testMissingStartNodeRejected() {
        ComputeGraph graph = new ComputeGraph("g", "start")
                .addNode("other", IDENTITY, String.class);

        UnknownNodeException e = Assertions.assertThrows(UnknownNodeException.class,
                () -> GraphCompiler.compile(graph));
        Assertions.assertEquals("start", e.getNodeName());
    }

    @Test
    public void testUnknownStaticEdgeRejectedAtRegistration() {
        ComputeGraph graph = new ComputeGraph("g", "A")
                .addNode("A", IDENTITY, String.class)
                .addEdge("A", "ghost");

        UnknownNodeException e = Assertions.assertThrows(UnknownNodeException.class,
                () -> GraphCompiler.compile(graph));
        Assertions.assertEquals("ghost", e.getNodeName());
    }

    @Test
    public void testUnknownEdgeSourceRejected() {
        ComputeGraph graph = new ComputeGraph("g", "A")
                .addNode("A", IDENTITY, String.class)
                .addEdge("ghost", "A");

        Assertions.assertThrows(UnknownNodeException.class, () -> GraphCompiler.compile(graph));
    }

    @Test
    public void testRouterNameMustNotShadowNode() {
        ComputeGraph graph = new ComputeGraph("g", "A")
                .addNode("A", IDENTITY, String.class)
                .addRouter("A", input -> RouterOutput.none());

        Assertions.assertThrows(IllegalStateException.class, () -> GraphCompiler.compile(graph));
    }

    @Test
    public void testStaticCycleIsAccepted() {
        ComputeGraph graph = new ComputeGraph("g", "A")
                .addNode("A", IDENTITY, String.class)
                .addNode("B", IDENTITY, String.class)
                .addEdge("A", "B")
                .addEdge("B", "A");

        Assertions.assertDoesNotThrow(() -> GraphCompiler.compile(graph));
    }

    @Test
    public void testCompiledGraphIsReadOnlyAndDetached() {
        ComputeGraph graph = new ComputeGraph("g", "A")
                .addNode("A", IDENTITY, String.class)
                .addNode("B", IDENTITY, Integer.class)
                .addRouter("R", input -> RouterOutput.of("B"))
                .addEdge("A", "R", "B");

        CompiledGraph compiled = GraphCompiler.compile(graph);
        graph.addEdge("A", "A");

        Assertions.assertEquals(List.of("R", "B"), compiled.edges("A"));
        Assertions.assertEquals(Set.of("A", "B"), compiled.nodes());
        Assertions.assertEquals(Set.of("R"), compiled.routers());
        Assertions.assertEquals(Integer.class, compiled.outputType("B"));
        Assertions.assertTrue(compiled.isRouter("R"));
        Assertions.assertFalse(compiled.hasNode("R"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> compiled.edges("A").add("B"));
        Assertions.assertEquals(List.of(), compiled.edges("B"));
    }
}
