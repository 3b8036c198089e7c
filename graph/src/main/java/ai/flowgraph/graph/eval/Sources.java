package ai.flowgraph.graph.eval;

import ai.flowgraph.graph.model.Inlet;
import ai.flowgraph.graph.model.Link;
import ai.flowgraph.graph.model.Outlet;

import java.util.Comparator;
import java.util.List;
import javax.annotation.Nullable;

final class Sources {
    private Sources() {}

    /**
     * Links of the inlet that have a source, in positional order.
     */
    static List<Link> sourced(Inlet inlet) {
        return inlet.links().stream()
            .filter(link -> !link.isPending())
            .toList();
    }

    @Nullable
    static Outlet latest(Inlet inlet) {
        return sourced(inlet).stream()
            .max(Comparator.comparingLong(Link::serial))
            .map(Link::source)
            .orElse(null);
    }
}
