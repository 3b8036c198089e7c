package ai.flowgraph.graph.json;

import ai.flowgraph.graph.exceptions.GraphException;
import ai.flowgraph.graph.exceptions.InvalidSourceException;
import ai.flowgraph.graph.exceptions.InvalidTargetException;
import ai.flowgraph.graph.json.GraphSnapshot.LinkSnapshot;
import ai.flowgraph.graph.json.GraphSnapshot.OperatorSnapshot;
import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Inlet;
import ai.flowgraph.graph.model.Link;
import ai.flowgraph.graph.model.Operator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

public final class GraphSnapshots {
    private static final Logger LOG = LogManager.getLogger(GraphSnapshots.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphSnapshots() {}

    public static GraphSnapshot capture(GraphStore store) {
        final List<OperatorSnapshot> operators = new ArrayList<>();
        final List<LinkSnapshot> links = new ArrayList<>();
        for (Operator op : store.operators()) {
            final List<Inlet> inlets = op.inlets();
            operators.add(new OperatorSnapshot(op.id(), op.name(), op.expression(),
                inlets.stream().map(Inlet::name).toList(), op.outlet().name()));
            for (int i = 0; i < inlets.size(); i++) {
                for (Link link : inlets.get(i).links()) {
                    links.add(new LinkSnapshot(op.id(), i,
                        link.isPending() ? null : link.source().operator().id(), link.serial()));
                }
            }
        }
        return new GraphSnapshot(operators, links);
    }

    public static GraphStore restore(GraphSnapshot snapshot) throws GraphException {
        final GraphStore store = new GraphStore();
        restore(snapshot, store);
        return store;
    }

    /**
     * Appends the snapshot's operators and links to {@code store}. Operators get fresh ids.
     * References are checked before anything is added. Links are re-created oldest first, each at
     * its recorded position, so both positional order and recency survive.
     */
    public static void restore(GraphSnapshot snapshot, GraphStore store) throws GraphException {
        final Map<String, OperatorSnapshot> byId = new HashMap<>();
        for (OperatorSnapshot op : snapshot.operators()) {
            byId.put(op.id(), op);
        }
        for (LinkSnapshot link : snapshot.links()) {
            final OperatorSnapshot target = byId.get(link.targetOperator());
            if (target == null || link.targetInlet() < 0 || link.targetInlet() >= target.inlets().size()) {
                throw new InvalidTargetException("Snapshot link targets unknown inlet "
                    + link.targetOperator() + "#" + link.targetInlet());
            }
            if (link.sourceOperator() != null && !byId.containsKey(link.sourceOperator())) {
                throw new InvalidSourceException("Snapshot link has unknown source " + link.sourceOperator());
            }
        }

        final Map<String, Operator> restored = new HashMap<>();
        for (OperatorSnapshot snap : snapshot.operators()) {
            final Operator op = new Operator(snap.name(), snap.expression(), snap.inlets(), snap.outlet());
            store.appendOperator(op);
            restored.put(snap.id(), op);
        }

        final Map<LinkSnapshot, Integer> positions = new IdentityHashMap<>();
        final Map<String, Integer> nextPosition = new HashMap<>();
        for (LinkSnapshot snap : snapshot.links()) {
            positions.put(snap, nextPosition.merge(inletKey(snap), 1, Integer::sum) - 1);
        }
        final List<LinkSnapshot> byRecency = new ArrayList<>(snapshot.links());
        byRecency.sort(Comparator.comparingLong(LinkSnapshot::serial));

        final Map<String, List<Integer>> placed = new HashMap<>();
        for (LinkSnapshot snap : byRecency) {
            final int position = positions.get(snap);
            final List<Integer> taken = placed.computeIfAbsent(inletKey(snap), key -> new ArrayList<>());
            int index = 0;
            while (index < taken.size() && taken.get(index) < position) {
                index++;
            }
            taken.add(index, position);

            final Operator target = restored.get(snap.targetOperator());
            final Operator source = snap.sourceOperator() == null ? null : restored.get(snap.sourceOperator());
            store.insertLink(index, source == null ? null : source.outlet(), target.inlets().get(snap.targetInlet()));
        }
        LOG.info("Restored {} operators and {} links", snapshot.operators().size(), snapshot.links().size());
    }

    private static String inletKey(LinkSnapshot snap) {
        return snap.targetOperator() + "#" + snap.targetInlet();
    }

    public static String toJson(GraphSnapshot snapshot) throws JsonProcessingException {
        return MAPPER.writeValueAsString(snapshot);
    }

    public static GraphSnapshot fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, GraphSnapshot.class);
    }
}
