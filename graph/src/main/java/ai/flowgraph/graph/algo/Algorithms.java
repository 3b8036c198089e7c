package ai.flowgraph.graph.algo;

import ai.flowgraph.graph.exceptions.NotFoundException;
import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Inlet;
import ai.flowgraph.graph.model.Link;
import ai.flowgraph.graph.model.Operator;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

public class Algorithms {
    private static final String EDGE = " -> ";

    /**
     * Operators whose results flow into {@code op}, directly or transitively, in breadth-first
     * order. Pending links are skipped. {@code op} itself is never part of the result, even when
     * it lies on a cycle.
     */
    public static Set<Operator> ancestors(GraphStore store, Operator op) throws NotFoundException {
        requirePresent(store, op);
        return reach(op, Algorithms::upstream);
    }

    /**
     * Operators fed by {@code op}, directly or transitively, in breadth-first order.
     */
    public static Set<Operator> descendants(GraphStore store, Operator op) throws NotFoundException {
        requirePresent(store, op);
        return reach(op, Algorithms::downstream);
    }

    /**
     * Upstream operators of {@code op} ordered so that every source precedes its consumers, with
     * {@code op} last. Back edges of cycles are ignored.
     */
    public static List<Operator> dependencyOrder(GraphStore store, Operator op) throws NotFoundException {
        requirePresent(store, op);
        final List<Operator> order = new ArrayList<>();
        postOrder(op, new HashSet<>(), order);
        return order;
    }

    public static boolean hasCycle(GraphStore store) {
        return findCycle(store).isPresent();
    }

    /**
     * Some cycle of the graph as a closed walk along the data flow, first and last elements being
     * the same operator.
     */
    public static Optional<List<Operator>> findCycle(GraphStore store) {
        final List<Operator> operators = store.operators();
        final Map<Operator, Integer> index = new HashMap<>();
        for (int i = 0; i < operators.size(); i++) {
            index.put(operators.get(i), i);
        }

        final List<List<Integer>> graph = new ArrayList<>(operators.size());
        for (Operator op : operators) {
            final List<Integer> to = new ArrayList<>();
            for (Operator next : downstream(op)) {
                to.add(index.get(next));
            }
            graph.add(to);
        }

        final int n = operators.size();
        final int[] colors = new int[n];
        final int[] prev = new int[n];

        int[] cycleEnds = null;
        for (int i = 0; i < n && cycleEnds == null; i++) {
            if (colors[i] == 0) {
                cycleEnds = dfs(graph, i, colors, prev);
            }
        }
        if (cycleEnds == null) {
            return Optional.empty();
        }

        final LinkedList<Operator> cycle = new LinkedList<>();
        cycle.add(operators.get(cycleEnds[0]));
        for (int v = cycleEnds[1]; v != cycleEnds[0]; v = prev[v]) {
            cycle.addFirst(operators.get(v));
        }
        cycle.addFirst(operators.get(cycleEnds[0]));
        return Optional.of(cycle);
    }

    public static String printCycle(List<Operator> cycle) {
        return cycle.stream().map(Operator::name).collect(Collectors.joining(EDGE));
    }

    private static int[] dfs(List<List<Integer>> graph, int v, int[] colors, int[] prev) {
        colors[v] = 1;

        for (int u : graph.get(v)) {
            if (colors[u] == 0) {
                // not visited yet
                prev[u] = v;
                final int[] cycleEnds = dfs(graph, u, colors, prev);
                if (cycleEnds != null) {
                    return cycleEnds;
                }
            } else if (colors[u] == 1) {
                // back edge
                return new int[] {u, v};
            }
        }

        colors[v] = 2;
        return null;
    }

    private static void postOrder(Operator op, Set<Operator> visited, List<Operator> order) {
        if (!visited.add(op)) {
            return;
        }
        for (Operator source : upstream(op)) {
            postOrder(source, visited, order);
        }
        order.add(op);
    }

    private static Set<Operator> reach(Operator start, Function<Operator, List<Operator>> neighbours) {
        final Set<Operator> visited = new LinkedHashSet<>();
        final Deque<Operator> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            for (Operator next : neighbours.apply(queue.poll())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        visited.remove(start);
        return visited;
    }

    private static List<Operator> upstream(Operator op) {
        final List<Operator> result = new ArrayList<>();
        for (Inlet inlet : op.inlets()) {
            for (Link link : inlet.links()) {
                if (!link.isPending()) {
                    result.add(link.source().operator());
                }
            }
        }
        return result;
    }

    private static List<Operator> downstream(Operator op) {
        final List<Operator> result = new ArrayList<>();
        for (Link link : op.outlet().links()) {
            result.add(link.target().operator());
        }
        return result;
    }

    private static void requirePresent(GraphStore store, Operator op) throws NotFoundException {
        if (!store.contains(op)) {
            throw new NotFoundException("Operator " + op + " is not in the graph");
        }
    }
}
