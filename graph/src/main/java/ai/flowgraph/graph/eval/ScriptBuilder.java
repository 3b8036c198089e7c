package ai.flowgraph.graph.eval;

import ai.flowgraph.expression.PortResolver;
import ai.flowgraph.graph.algo.Algorithms;
import ai.flowgraph.graph.exceptions.NotFoundException;
import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Inlet;
import ai.flowgraph.graph.model.Operator;
import ai.flowgraph.graph.model.Outlet;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders an operator and everything it depends on as assignment lines, sources first. Each
 * bound inlet is replaced by the name of the operator feeding it, so the script reads as plain
 * code over operator names.
 */
public class ScriptBuilder {
    private final GraphStore store;

    public ScriptBuilder(GraphStore store) {
        this.store = store;
    }

    public String build(Operator op) throws NotFoundException {
        final StringBuilder script = new StringBuilder();
        for (Operator each : Algorithms.dependencyOrder(store, op)) {
            script.append(line(each)).append('\n');
        }
        return script.toString();
    }

    static String line(Operator op) {
        final Map<String, String> renames = new HashMap<>();
        for (Inlet inlet : op.inlets()) {
            final Outlet source = Sources.latest(inlet);
            if (source != null && !source.operator().name().equals(inlet.name())) {
                renames.put(inlet.name(), source.operator().name());
            }
        }
        return op.name() + " = " + PortResolver.rename(op.expression(), renames);
    }
}
