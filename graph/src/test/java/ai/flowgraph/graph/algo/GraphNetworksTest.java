package ai.flowgraph.graph.algo;

import ai.flowgraph.graph.algo.GraphNetworks.FlowEdge;
import ai.flowgraph.graph.algo.GraphNetworks.OperatorNode;
import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Operator;
import com.google.common.graph.ImmutableNetwork;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class GraphNetworksTest {
    private GraphStore store;

    @Before
    public void setUp() {
        store = new GraphStore();
    }

    private Operator add(String name, String expression) throws Exception {
        final Operator op = store.createOperator(name, expression);
        store.appendOperator(op);
        return op;
    }

    private static OperatorNode node(ImmutableNetwork<OperatorNode, FlowEdge> network, String name) {
        return network.nodes().stream()
            .filter(node -> node.name().equals(name))
            .findFirst()
            .orElseThrow();
    }

    @Test
    public void nodesCarryOperatorAttributes() throws Exception {
        add("read", "42");
        add("sum", "x + y");

        final ImmutableNetwork<OperatorNode, FlowEdge> network = GraphNetworks.toNetwork(store);

        Assert.assertTrue(network.isDirected());
        Assert.assertEquals(2, network.nodes().size());
        final OperatorNode sum = node(network, "sum");
        Assert.assertEquals("x + y", sum.expression());
        Assert.assertEquals(List.of("x", "y"), sum.inlets());
        Assert.assertEquals(List.of(), node(network, "read").inlets());
        Assert.assertTrue(network.edges().isEmpty());
    }

    @Test
    public void parallelEdgesAndSelfLoops() throws Exception {
        final Operator read = add("read", "2");
        final Operator sum = add("sum", "x + y");
        final Operator loop = add("loop", "v");
        store.appendLink(read.outlet(), sum.inlets().get(0));
        store.appendLink(read.outlet(), sum.inlets().get(1));
        store.appendLink(loop.outlet(), loop.inlets().get(0));
        store.appendLink(null, sum.inlets().get(1));

        final ImmutableNetwork<OperatorNode, FlowEdge> network = GraphNetworks.toNetwork(store);

        Assert.assertTrue(network.allowsParallelEdges());
        Assert.assertEquals(3, network.edges().size());
        final Set<FlowEdge> between = network.edgesConnecting(node(network, "read"), node(network, "sum"));
        Assert.assertEquals(Set.of("x", "y"), between.stream().map(FlowEdge::inlet).collect(Collectors.toSet()));
        Assert.assertTrue(network.edgesConnecting(node(network, "sum"), node(network, "read")).isEmpty());

        final OperatorNode loopNode = node(network, "loop");
        final Set<FlowEdge> selfLoops = network.edgesConnecting(loopNode, loopNode);
        Assert.assertEquals(1, selfLoops.size());
        Assert.assertEquals("v", selfLoops.iterator().next().inlet());
    }
}
