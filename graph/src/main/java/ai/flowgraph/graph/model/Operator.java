package ai.flowgraph.graph.model;

import ai.flowgraph.common.IdGenerator;
import ai.flowgraph.common.RandomIdGenerator;
import ai.flowgraph.expression.PortResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Graph node: a named expression with one inlet per free variable and a single outlet.
 * Name and expression are changed through {@link GraphStore} once the operator is inserted.
 */
public final class Operator implements GraphEntity {
    public static final String DEFAULT_OUTLET_NAME = "result";

    static final IdGenerator IDS = new RandomIdGenerator();

    private final String id;
    private String name;
    private String expression;
    private final List<Inlet> inlets = new ArrayList<>();
    private final Outlet outlet;

    @Nullable
    GraphStore owner;

    public Operator(String name, String expression) {
        this(name, expression, DEFAULT_OUTLET_NAME);
    }

    public Operator(String name, String expression, String outletName) {
        this(name, expression, PortResolver.resolve(expression), outletName);
    }

    /**
     * Operator with explicitly given inlets. They are not checked against the expression; the
     * next expression edit reconciles them.
     */
    public Operator(String name, String expression, List<String> inletNames, String outletName) {
        this.id = IDS.generate("op");
        this.name = Objects.requireNonNull(name, "name");
        this.expression = Objects.requireNonNull(expression, "expression");
        for (String inletName : inletNames) {
            inlets.add(new Inlet(inletName, this));
        }
        this.outlet = new Outlet(Objects.requireNonNull(outletName, "outletName"), this);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.OPERATOR;
    }

    public String name() {
        return name;
    }

    public String expression() {
        return expression;
    }

    public List<Inlet> inlets() {
        return List.copyOf(inlets);
    }

    public Outlet outlet() {
        return outlet;
    }

    void setName(String name) {
        this.name = name;
    }

    void setExpression(String expression) {
        this.expression = expression;
    }

    List<Inlet> inletList() {
        return inlets;
    }

    @Override
    public String toString() {
        return name + "[" + expression + "]";
    }
}
