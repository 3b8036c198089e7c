package ai.flowgraph.graph.model;

import ai.flowgraph.common.IndexRange;
import ai.flowgraph.expression.PortResolver;
import ai.flowgraph.graph.exceptions.InvalidNameException;
import ai.flowgraph.graph.exceptions.InvalidSourceException;
import ai.flowgraph.graph.exceptions.InvalidTargetException;
import ai.flowgraph.graph.exceptions.NotFoundException;
import ai.flowgraph.graph.exceptions.OutOfRangeException;
import ai.flowgraph.graph.exceptions.ReentrancyViolationException;
import ai.flowgraph.graph.exceptions.StructuralViolationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Owns operators and links and keeps the structural invariants: ports belong to present
 * operators, link targets are live inlets and link sources are live outlets or absent.
 *
 * <p>Every mutator validates its arguments completely before touching any state, so a call that
 * throws leaves the store as it was. Mutators are rejected while the {@link MutationGuard} is
 * dispatching change notifications.
 */
public class GraphStore {
    private static final Logger LOG = LogManager.getLogger(GraphStore.class);

    private final List<Operator> operators = new ArrayList<>();
    private final LinkedHashSet<Link> links = new LinkedHashSet<>();
    private final MutationGuard guard = new MutationGuard();
    private final String outletName;
    private long linkSerial = 0;

    public GraphStore() {
        this(Operator.DEFAULT_OUTLET_NAME);
    }

    public GraphStore(String outletName) {
        this.outletName = Objects.requireNonNull(outletName, "outletName");
    }

    public MutationGuard guard() {
        return guard;
    }

    /**
     * Builds a detached operator whose outlet carries the store's outlet name. The operator is
     * not part of the graph until it is inserted.
     */
    public Operator createOperator(String name, String expression) {
        return new Operator(name, expression, outletName);
    }

    // ---- reads ----

    public List<Operator> operators() {
        return List.copyOf(operators);
    }

    public int operatorCount() {
        return operators.size();
    }

    public Operator operator(int index) throws OutOfRangeException {
        if (index < 0 || index >= operators.size()) {
            throw new OutOfRangeException("Operator index " + index + " is outside [0, " + operators.size() + ")");
        }
        return operators.get(index);
    }

    /**
     * All links in creation order.
     */
    public List<Link> links() {
        return List.copyOf(links);
    }

    public List<Inlet> inlets(Operator op) throws NotFoundException {
        requirePresent(op);
        return op.inlets();
    }

    public Outlet outlet(Operator op) throws NotFoundException {
        requirePresent(op);
        return op.outlet();
    }

    public List<Link> inLinks(Inlet inlet) throws NotFoundException {
        if (!contains(inlet)) {
            throw new NotFoundException("Inlet " + inlet + " is not in the graph");
        }
        return inlet.links();
    }

    public List<Link> outLinks(Outlet outlet) throws NotFoundException {
        if (!contains(outlet)) {
            throw new NotFoundException("Outlet " + outlet + " is not in the graph");
        }
        return outlet.links();
    }

    public String name(Operator op) throws NotFoundException {
        requirePresent(op);
        return op.name();
    }

    public String expression(Operator op) throws NotFoundException {
        requirePresent(op);
        return op.expression();
    }

    public boolean contains(@Nullable GraphEntity entity) {
        if (entity == null) {
            return false;
        }
        switch (entity.kind()) {
            case OPERATOR:
                return ((Operator) entity).owner == this;
            case INLET: {
                final Inlet inlet = (Inlet) entity;
                return inlet.operator().owner == this && inlet.operator().inletList().contains(inlet);
            }
            case OUTLET:
                return ((Outlet) entity).operator().owner == this;
            case LINK:
                return links.contains(entity);
            default:
                throw new IllegalStateException("Unexpected entity kind " + entity.kind());
        }
    }

    public int indexOf(Operator op) throws NotFoundException {
        requirePresent(op);
        return operators.indexOf(op);
    }

    public int indexOf(Inlet inlet) throws NotFoundException {
        if (!contains(inlet)) {
            throw new NotFoundException("Inlet " + inlet + " is not in the graph");
        }
        return inlet.operator().inletList().indexOf(inlet);
    }

    public int indexOf(Link link) throws NotFoundException {
        requirePresent(link);
        return link.target().linkList().indexOf(link);
    }

    // ---- operators ----

    public void appendOperator(Operator op) throws ReentrancyViolationException, StructuralViolationException {
        try {
            insertOperator(operators.size(), op);
        } catch (OutOfRangeException e) {
            throw new IllegalStateException("Append position is always valid", e);
        }
    }

    public void insertOperator(int position, Operator op)
        throws ReentrancyViolationException, OutOfRangeException, StructuralViolationException
    {
        guard.checkMutable("insert operator");
        checkInsertOperator(position, op);

        operators.add(position, op);
        op.owner = this;
        LOG.info("Operator {} inserted at {}, id={}", op.name(), position, op.id());
    }

    /**
     * Performs the checks of {@link #insertOperator} without inserting.
     */
    public void checkInsertOperator(int position, Operator op) throws OutOfRangeException, StructuralViolationException {
        Objects.requireNonNull(op, "op");
        if (position < 0 || position > operators.size()) {
            throw new OutOfRangeException("Operator position " + position + " is outside [0, " + operators.size() + "]");
        }
        if (op.owner != null) {
            throw new StructuralViolationException("Operator " + op + " already belongs to a graph");
        }
        for (Inlet inlet : op.inletList()) {
            if (!inlet.linkList().isEmpty()) {
                throw new StructuralViolationException("Operator " + op + " carries links from another graph");
            }
        }
        if (!op.outlet().linkList().isEmpty()) {
            throw new StructuralViolationException("Operator " + op + " carries links from another graph");
        }
    }

    public void removeOperator(Operator op) throws ReentrancyViolationException, NotFoundException {
        guard.checkMutable("remove operator");
        requirePresent(op);

        final List<Link> referencing = new ArrayList<>();
        for (Inlet inlet : op.inletList()) {
            referencing.addAll(inlet.linkList());
        }
        for (Link link : op.outlet().linkList()) {
            if (!referencing.contains(link)) {
                referencing.add(link);
            }
        }
        referencing.forEach(this::detach);

        operators.remove(op);
        op.owner = null;
        LOG.info("Operator {} removed with {} links, id={}", op.name(), referencing.size(), op.id());
    }

    // ---- attributes ----

    public void setName(Operator op, String name) throws ReentrancyViolationException, NotFoundException {
        guard.checkMutable("rename operator");
        requirePresent(op);
        Objects.requireNonNull(name, "name");
        op.setName(name);
    }

    public InletReconciliation setExpression(Operator op, String expression)
        throws ReentrancyViolationException, NotFoundException
    {
        return setExpression(op, expression, ReconciliationListener.NONE);
    }

    /**
     * Replaces the expression and reconciles the inlets with its free variables. The listener sees
     * each removed run before and after it is taken out, highest first, then each inserted run
     * before and after it is put in, lowest first.
     */
    public InletReconciliation setExpression(Operator op, String expression, ReconciliationListener listener)
        throws ReentrancyViolationException, NotFoundException
    {
        guard.checkMutable("set expression");
        requirePresent(op);
        Objects.requireNonNull(expression, "expression");

        final InletReconciliation plan = InletReconciliation.plan(op, expression);
        LOG.debug("Reconciling inlets of {}: {}", op.name(), plan);

        final List<Inlet> inlets = op.inletList();
        for (IndexRange run : plan.removedRuns()) {
            listener.beforeRemove(op, run);
            for (int i = run.last(); i >= run.first(); i--) {
                final Inlet inlet = inlets.remove(i);
                if (plan.dropped().contains(inlet)) {
                    List.copyOf(inlet.linkList()).forEach(this::detach);
                }
            }
            listener.afterRemove(op, run);
        }
        for (IndexRange run : plan.insertedRuns()) {
            listener.beforeInsert(op, run);
            inlets.addAll(run.first(), plan.after().subList(run.first(), run.last() + 1));
            listener.afterInsert(op, run);
        }
        op.setExpression(expression);
        return plan;
    }

    /**
     * Computes the reconciliation {@link #setExpression} would perform without applying it.
     */
    public InletReconciliation planExpression(Operator op, String expression) throws NotFoundException {
        requirePresent(op);
        return InletReconciliation.plan(op, expression);
    }

    /**
     * Renames an inlet in place and rewrites every free occurrence of the old name in the owning
     * operator's expression.
     */
    public void renameInlet(Inlet inlet, String name)
        throws ReentrancyViolationException, NotFoundException, InvalidNameException
    {
        guard.checkMutable("rename inlet");
        if (!contains(inlet)) {
            throw new NotFoundException("Inlet " + inlet + " is not in the graph");
        }
        Objects.requireNonNull(name, "name");
        if (name.equals(inlet.name())) {
            return;
        }
        if (!List.of(name).equals(PortResolver.resolve(name))) {
            throw new InvalidNameException("'" + name + "' is not a valid inlet name");
        }
        final Operator op = inlet.operator();
        for (Inlet other : op.inletList()) {
            if (other.name().equals(name)) {
                throw new InvalidNameException("Operator " + op.name() + " already has inlet '" + name + "'");
            }
        }
        if (PortResolver.resolve(op.expression()).contains(name)) {
            throw new InvalidNameException("Expression of " + op.name() + " already uses '" + name + "'");
        }

        final String expression = PortResolver.rename(op.expression(), Map.of(inlet.name(), name));
        LOG.debug("Inlet {} renamed to {}", inlet, name);
        inlet.setName(name);
        op.setExpression(expression);
    }

    public void setOutletName(Outlet outlet, String name) throws ReentrancyViolationException, NotFoundException {
        guard.checkMutable("rename outlet");
        if (!contains(outlet)) {
            throw new NotFoundException("Outlet " + outlet + " is not in the graph");
        }
        outlet.setName(Objects.requireNonNull(name, "name"));
    }

    // ---- links ----

    public Link appendLink(@Nullable Outlet source, Inlet target)
        throws ReentrancyViolationException, InvalidTargetException, InvalidSourceException
    {
        try {
            return insertLink(target == null ? 0 : target.linkList().size(), source, target);
        } catch (OutOfRangeException e) {
            throw new IllegalStateException("Append position is always valid", e);
        }
    }

    public Link insertLink(int position, @Nullable Outlet source, Inlet target)
        throws ReentrancyViolationException, InvalidTargetException, InvalidSourceException, OutOfRangeException
    {
        guard.checkMutable("insert link");
        checkInsertLink(position, source, target);

        final Link link = new Link(source, target, ++linkSerial);
        target.linkList().add(position, link);
        if (source != null) {
            source.linkList().add(link);
        }
        links.add(link);
        LOG.debug("{} inserted at {}", link, position);
        return link;
    }

    /**
     * Performs the checks of {@link #insertLink} without inserting.
     */
    public void checkInsertLink(int position, @Nullable Outlet source, Inlet target)
        throws InvalidTargetException, InvalidSourceException, OutOfRangeException
    {
        if (target == null || !contains(target)) {
            throw new InvalidTargetException("Link target " + target + " is not a live inlet");
        }
        checkSource(source);
        final int size = target.linkList().size();
        if (position < 0 || position > size) {
            throw new OutOfRangeException("Link position " + position + " is outside [0, " + size + "]");
        }
    }

    public void checkSource(@Nullable Outlet source) throws InvalidSourceException {
        if (source != null && !contains(source)) {
            throw new InvalidSourceException("Link source " + source + " is not a live outlet");
        }
    }

    public void setLinkSource(Link link, @Nullable Outlet source)
        throws ReentrancyViolationException, NotFoundException, InvalidSourceException
    {
        guard.checkMutable("set link source");
        requirePresent(link);
        checkSource(source);
        if (link.source() == source) {
            return;
        }

        if (link.source() != null) {
            link.source().linkList().remove(link);
        }
        if (source != null) {
            source.linkList().add(link);
        }
        link.setSource(source);
        LOG.debug("{} source reassigned", link);
    }

    public void removeLink(Link link) throws ReentrancyViolationException, NotFoundException {
        guard.checkMutable("remove link");
        requirePresent(link);
        detach(link);
    }

    private void detach(Link link) {
        link.target().linkList().remove(link);
        if (link.source() != null) {
            link.source().linkList().remove(link);
        }
        links.remove(link);
        LOG.debug("{} removed", link);
    }

    private void requirePresent(Operator op) throws NotFoundException {
        if (op == null || op.owner != this) {
            throw new NotFoundException("Operator " + op + " is not in the graph");
        }
    }

    private void requirePresent(Link link) throws NotFoundException {
        if (link == null || !links.contains(link)) {
            throw new NotFoundException("Link " + link + " is not in the graph");
        }
    }
}
