package ai.flowgraph.graph.model;

import java.util.ArrayList;
import java.util.List;

public final class Inlet implements GraphEntity {
    private final String id;
    private String name;
    private final Operator operator;
    private final List<Link> links = new ArrayList<>();

    Inlet(String name, Operator operator) {
        this.id = Operator.IDS.generate("in");
        this.name = name;
        this.operator = operator;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.INLET;
    }

    public String name() {
        return name;
    }

    public Operator operator() {
        return operator;
    }

    /**
     * Incoming links in positional order.
     */
    public List<Link> links() {
        return List.copyOf(links);
    }

    void setName(String name) {
        this.name = name;
    }

    List<Link> linkList() {
        return links;
    }

    @Override
    public String toString() {
        return operator.name() + "." + name;
    }
}
