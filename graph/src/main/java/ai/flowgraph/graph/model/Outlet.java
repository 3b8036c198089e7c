package ai.flowgraph.graph.model;

import java.util.ArrayList;
import java.util.List;

public final class Outlet implements GraphEntity {
    private final String id;
    private String name;
    private final Operator operator;
    private final List<Link> links = new ArrayList<>();

    Outlet(String name, Operator operator) {
        this.id = Operator.IDS.generate("out");
        this.name = name;
        this.operator = operator;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.OUTLET;
    }

    public String name() {
        return name;
    }

    public Operator operator() {
        return operator;
    }

    /**
     * Outgoing links in the order they were attached to this outlet.
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
