package ai.flowgraph.graph.algo;

import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Inlet;
import ai.flowgraph.graph.model.Link;
import ai.flowgraph.graph.model.Operator;
import com.google.common.collect.ImmutableList;
import com.google.common.graph.ImmutableNetwork;
import com.google.common.graph.MutableNetwork;
import com.google.common.graph.NetworkBuilder;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports a graph as a Guava multigraph: one node per operator, one edge per non-pending link
 * pointing along the data flow. Parallel edges and self loops are kept.
 */
public final class GraphNetworks {

    private GraphNetworks() {}

    public record OperatorNode(String id, String name, String expression, List<String> inlets) { }

    public record FlowEdge(String linkId, String inlet, int inletOrdinal, long serial) { }

    public static ImmutableNetwork<OperatorNode, FlowEdge> toNetwork(GraphStore store) {
        final MutableNetwork<OperatorNode, FlowEdge> network = NetworkBuilder.directed()
            .allowsParallelEdges(true)
            .allowsSelfLoops(true)
            .expectedNodeCount(store.operatorCount())
            .build();

        final Map<Operator, OperatorNode> nodes = new HashMap<>();
        for (Operator op : store.operators()) {
            final OperatorNode node = new OperatorNode(op.id(), op.name(), op.expression(),
                op.inlets().stream().map(Inlet::name).collect(ImmutableList.toImmutableList()));
            nodes.put(op, node);
            network.addNode(node);
        }
        for (Operator op : store.operators()) {
            final List<Inlet> inlets = op.inlets();
            for (int i = 0; i < inlets.size(); i++) {
                for (Link link : inlets.get(i).links()) {
                    if (link.isPending()) {
                        continue;
                    }
                    network.addEdge(nodes.get(link.source().operator()), nodes.get(op),
                        new FlowEdge(link.id(), inlets.get(i).name(), i, link.serial()));
                }
            }
        }
        return ImmutableNetwork.copyOf(network);
    }
}
