package ai.flowgraph.projection;

import ai.flowgraph.common.IndexRange;
import ai.flowgraph.common.Ranges;
import ai.flowgraph.common.UniqueNames;
import ai.flowgraph.graph.config.GraphConfig;
import ai.flowgraph.graph.exceptions.GraphException;
import ai.flowgraph.graph.exceptions.InvalidPathException;
import ai.flowgraph.graph.exceptions.InvalidSourceException;
import ai.flowgraph.graph.exceptions.InvalidTargetException;
import ai.flowgraph.graph.exceptions.NotFoundException;
import ai.flowgraph.graph.exceptions.OutOfRangeException;
import ai.flowgraph.graph.exceptions.StructuralViolationException;
import ai.flowgraph.graph.model.EntityKind;
import ai.flowgraph.graph.model.GraphEntity;
import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Inlet;
import ai.flowgraph.graph.model.InletReconciliation;
import ai.flowgraph.graph.model.Link;
import ai.flowgraph.graph.model.Operator;
import ai.flowgraph.graph.model.Outlet;
import ai.flowgraph.graph.model.ReconciliationListener;
import ai.flowgraph.projection.ChangeEvent.Type;
import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import javax.annotation.Nullable;

/**
 * Positional view of a {@link GraphStore}: operators at depth 1, their inlets followed by the
 * outlet at depth 2, and the links of each inlet at depth 3. Paths are computed from the store on
 * every call and are never cached.
 *
 * <p>Structural changes made through this class are announced to {@link ChangeListener}s: a begin
 * event after validation and before the store changes, an end event right after. Attribute
 * changes are announced once they are applied.
 */
public class GraphTreeModel {
    private static final Logger LOG = LogManager.getLogger(GraphTreeModel.class);

    private final GraphStore store;
    private final String defaultExpression;
    private final String namePrefix;
    private final List<ChangeListener> listeners = new ArrayList<>();

    public GraphTreeModel(GraphStore store) {
        this(store, "x+y", "n");
    }

    public GraphTreeModel(GraphStore store, GraphConfig config) {
        this(store, config.getOperators().getDefaultExpression(), config.getOperators().getNamePrefix());
    }

    public GraphTreeModel(GraphStore store, String defaultExpression, String namePrefix) {
        this.store = store;
        this.defaultExpression = defaultExpression;
        this.namePrefix = namePrefix;
    }

    public GraphStore store() {
        return store;
    }

    public void addListener(ChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ChangeListener listener) {
        listeners.remove(listener);
    }

    // ---- addressing ----

    public GraphEntity resolve(TreePath path) throws InvalidPathException {
        final GraphEntity entity = find(path);
        Preconditions.checkState(entity.kind() == kindAt(path),
            "Entity %s at %s does not match positional kind %s", entity, path, kindAt(path));
        return entity;
    }

    private GraphEntity find(TreePath path) throws InvalidPathException {
        if (path.isRoot() || path.depth() > 3) {
            throw new InvalidPathException("Path " + path + " does not address an entity");
        }
        final List<Operator> operators = store.operators();
        if (path.get(0) >= operators.size()) {
            throw new InvalidPathException("No operator at " + path);
        }
        final Operator op = operators.get(path.get(0));
        if (path.depth() == 1) {
            return op;
        }

        final List<Inlet> inlets = op.inlets();
        final int port = path.get(1);
        if (port == inlets.size() && path.depth() == 2) {
            return op.outlet();
        }
        if (port >= inlets.size()) {
            throw new InvalidPathException("No inlet at " + path);
        }
        final Inlet inlet = inlets.get(port);
        if (path.depth() == 2) {
            return inlet;
        }

        final List<Link> links = inlet.links();
        if (path.get(2) >= links.size()) {
            throw new InvalidPathException("No link at " + path);
        }
        return links.get(path.get(2));
    }

    public TreePath locate(GraphEntity entity) throws NotFoundException {
        if (!store.contains(entity)) {
            throw new NotFoundException("Entity " + entity + " is not in the graph");
        }
        switch (entity.kind()) {
            case OPERATOR:
                return TreePath.of(store.indexOf((Operator) entity));
            case INLET: {
                final Inlet inlet = (Inlet) entity;
                return TreePath.of(store.indexOf(inlet.operator()), store.indexOf(inlet));
            }
            case OUTLET: {
                final Operator op = ((Outlet) entity).operator();
                return TreePath.of(store.indexOf(op), op.inlets().size());
            }
            case LINK: {
                final Link link = (Link) entity;
                final Inlet target = link.target();
                return TreePath.of(store.indexOf(target.operator()), store.indexOf(target), store.indexOf(link));
            }
            default:
                throw new IllegalStateException("Unexpected entity kind " + entity.kind());
        }
    }

    /**
     * Kind of the entity at {@code path} as implied by its depth and, under an operator, by whether
     * it is the last sibling.
     */
    public EntityKind kindAt(TreePath path) throws InvalidPathException {
        switch (path.depth()) {
            case 1:
                return EntityKind.OPERATOR;
            case 2:
                return path.last() == childCount(path.parent()) - 1 ? EntityKind.OUTLET : EntityKind.INLET;
            case 3:
                return EntityKind.LINK;
            default:
                throw new InvalidPathException("Path " + path + " does not address an entity");
        }
    }

    public int childCount(TreePath path) throws InvalidPathException {
        if (path.isRoot()) {
            return store.operatorCount();
        }
        final GraphEntity entity = find(path);
        switch (entity.kind()) {
            case OPERATOR:
                return ((Operator) entity).inlets().size() + 1;
            case INLET:
                return ((Inlet) entity).links().size();
            default:
                return 0;
        }
    }

    // ---- positional edits ----

    /**
     * Inserts {@code count} new children under {@code parent}: operators with the default expression
     * under the root, pending links under an inlet.
     */
    public List<GraphEntity> insertAt(TreePath parent, int ordinal, int count) throws GraphException {
        store.guard().checkMutable("insert at " + parent);
        checkCount(count);
        if (parent.isRoot()) {
            checkInsertRange(ordinal, count, store.operatorCount());
            final List<String> taken = new ArrayList<>();
            store.operators().forEach(op -> taken.add(op.name()));
            final List<Operator> created = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                final String name = UniqueNames.next(namePrefix, taken);
                taken.add(name);
                created.add(store.createOperator(name, defaultExpression));
            }

            final IndexRange range = IndexRange.of(ordinal, ordinal + count - 1);
            publish(ChangeEvent.structural(Type.BEGIN_INSERT, parent, range));
            for (int i = 0; i < count; i++) {
                store.insertOperator(ordinal + i, created.get(i));
            }
            publish(ChangeEvent.structural(Type.END_INSERT, parent, range));
            return List.copyOf(created);
        }

        final GraphEntity entity = resolve(parent);
        if (entity.kind() != EntityKind.INLET) {
            throw rejected("Cannot insert children under " + entity.kind() + " at " + parent);
        }
        final Inlet inlet = (Inlet) entity;
        checkInsertRange(ordinal, count, inlet.links().size());

        final IndexRange range = IndexRange.of(ordinal, ordinal + count - 1);
        final List<GraphEntity> created = new ArrayList<>();
        publish(ChangeEvent.structural(Type.BEGIN_INSERT, parent, range));
        for (int i = 0; i < count; i++) {
            created.add(store.insertLink(ordinal + i, null, inlet));
        }
        publish(ChangeEvent.structural(Type.END_INSERT, parent, range));
        return created;
    }

    public void removeAt(TreePath parent, int ordinal, int count) throws GraphException {
        store.guard().checkMutable("remove at " + parent);
        checkCount(count);
        if (parent.isRoot()) {
            checkRemoveRange(ordinal, count, store.operatorCount());
            removeOperators(ordinal, count);
            return;
        }

        final GraphEntity entity = resolve(parent);
        if (entity.kind() != EntityKind.INLET) {
            throw rejected("Cannot remove children of " + entity.kind() + " at " + parent);
        }
        final List<Link> links = ((Inlet) entity).links();
        checkRemoveRange(ordinal, count, links.size());
        removeLinks(parent, links, IndexRange.of(ordinal, ordinal + count - 1));
    }

    private void removeOperators(int ordinal, int count) throws GraphException {
        final List<Operator> operators = store.operators();
        final List<Operator> removed = operators.subList(ordinal, ordinal + count);
        final Set<Operator> removedSet = Collections.newSetFromMap(new IdentityHashMap<>());
        removedSet.addAll(removed);

        // links leaving the removed operators live under surviving inlets
        for (int i = 0; i < operators.size(); i++) {
            final Operator survivor = operators.get(i);
            if (removedSet.contains(survivor)) {
                continue;
            }
            final List<Inlet> inlets = survivor.inlets();
            for (int j = 0; j < inlets.size(); j++) {
                final List<Link> links = inlets.get(j).links();
                final List<Integer> ordinals = new ArrayList<>();
                for (int k = 0; k < links.size(); k++) {
                    final Outlet source = links.get(k).source();
                    if (source != null && removedSet.contains(source.operator())) {
                        ordinals.add(k);
                    }
                }
                for (IndexRange run : Ranges.groupDescending(ordinals)) {
                    removeLinks(TreePath.of(i, j), links, run);
                }
            }
        }

        final IndexRange range = IndexRange.of(ordinal, ordinal + count - 1);
        publish(ChangeEvent.structural(Type.BEGIN_REMOVE, TreePath.ROOT, range));
        for (int i = removed.size() - 1; i >= 0; i--) {
            store.removeOperator(removed.get(i));
        }
        publish(ChangeEvent.structural(Type.END_REMOVE, TreePath.ROOT, range));
    }

    private void removeLinks(TreePath inletPath, List<Link> links, IndexRange run) throws GraphException {
        publish(ChangeEvent.structural(Type.BEGIN_REMOVE, inletPath, run));
        for (int k = run.last(); k >= run.first(); k--) {
            store.removeLink(links.get(k));
        }
        publish(ChangeEvent.structural(Type.END_REMOVE, inletPath, run));
    }

    // ---- attributes ----

    @Nullable
    public Object getAttribute(TreePath path, Attribute attribute) throws GraphException {
        final GraphEntity entity = resolve(path);
        switch (attribute) {
            case KIND:
                return entity.kind();
            case NAME:
                switch (entity.kind()) {
                    case OPERATOR:
                        return ((Operator) entity).name();
                    case INLET:
                        return ((Inlet) entity).name();
                    case OUTLET:
                        return ((Outlet) entity).name();
                    default:
                        throw unsupported(entity, attribute);
                }
            case EXPRESSION:
                if (entity.kind() != EntityKind.OPERATOR) {
                    throw unsupported(entity, attribute);
                }
                return ((Operator) entity).expression();
            case LINK_SOURCE:
                if (entity.kind() != EntityKind.LINK) {
                    throw unsupported(entity, attribute);
                }
                return ((Link) entity).source();
            default:
                throw unsupported(entity, attribute);
        }
    }

    /**
     * Writes an attribute. {@code NAME} and {@code EXPRESSION} take strings; {@code LINK_SOURCE} takes
     * an outlet, an operator (standing for its outlet) or null.
     */
    public void setAttribute(TreePath path, Attribute attribute, @Nullable Object value) throws GraphException {
        final GraphEntity entity = resolve(path);
        switch (attribute) {
            case NAME: {
                final String name = requireText(value, attribute);
                switch (entity.kind()) {
                    case OPERATOR:
                        setName((Operator) entity, name);
                        return;
                    case INLET:
                        renameInlet((Inlet) entity, name);
                        return;
                    case OUTLET:
                        store.setOutletName((Outlet) entity, name);
                        publish(ChangeEvent.changed(path, Attribute.NAME));
                        return;
                    default:
                        throw unsupported(entity, attribute);
                }
            }
            case EXPRESSION:
                if (entity.kind() != EntityKind.OPERATOR) {
                    throw unsupported(entity, attribute);
                }
                setExpression((Operator) entity, requireText(value, attribute));
                return;
            case LINK_SOURCE:
                if (entity.kind() != EntityKind.LINK) {
                    throw unsupported(entity, attribute);
                }
                setLinkSource((Link) entity, toOutlet(value));
                return;
            default:
                throw unsupported(entity, attribute);
        }
    }

    @Nullable
    private static Outlet toOutlet(@Nullable Object value) throws InvalidSourceException {
        if (value == null || value instanceof Outlet) {
            return (Outlet) value;
        }
        if (value instanceof Operator op) {
            return op.outlet();
        }
        throw new InvalidSourceException("Link source must be an outlet or an operator, got " + value);
    }

    private static String requireText(@Nullable Object value, Attribute attribute) {
        Preconditions.checkArgument(value instanceof String, "%s expects a string, got %s", attribute, value);
        return (String) value;
    }

    // ---- graph operations with notifications ----

    public void appendOperator(Operator op) throws GraphException {
        insertOperator(store.operatorCount(), op);
    }

    public void insertOperator(int position, Operator op) throws GraphException {
        store.guard().checkMutable("insert operator");
        store.checkInsertOperator(position, op);

        final IndexRange range = IndexRange.single(position);
        publish(ChangeEvent.structural(Type.BEGIN_INSERT, TreePath.ROOT, range));
        store.insertOperator(position, op);
        publish(ChangeEvent.structural(Type.END_INSERT, TreePath.ROOT, range));
    }

    public void removeOperator(Operator op) throws GraphException {
        store.guard().checkMutable("remove operator");
        removeOperators(store.indexOf(op), 1);
    }

    public void setName(Operator op, String name) throws GraphException {
        store.setName(op, name);
        publish(ChangeEvent.changed(locate(op), Attribute.NAME));
    }

    public InletReconciliation setExpression(Operator op, String expression) throws GraphException {
        final TreePath path = locate(op);
        final InletReconciliation plan = store.setExpression(op, expression, new ReconciliationListener() {
            @Override
            public void beforeRemove(Operator operator, IndexRange run) {
                publish(ChangeEvent.structural(Type.BEGIN_REMOVE, path, run));
            }

            @Override
            public void afterRemove(Operator operator, IndexRange run) {
                publish(ChangeEvent.structural(Type.END_REMOVE, path, run));
            }

            @Override
            public void beforeInsert(Operator operator, IndexRange run) {
                publish(ChangeEvent.structural(Type.BEGIN_INSERT, path, run));
            }

            @Override
            public void afterInsert(Operator operator, IndexRange run) {
                publish(ChangeEvent.structural(Type.END_INSERT, path, run));
            }
        });

        // Inlets are matched by name, so surviving inlets never need a NAME change of their own.
        publish(ChangeEvent.changed(path, Attribute.EXPRESSION));
        return plan;
    }

    public void renameInlet(Inlet inlet, String name) throws GraphException {
        store.renameInlet(inlet, name);
        final TreePath path = locate(inlet);
        publish(ChangeEvent.changed(path, Attribute.NAME));
        publish(ChangeEvent.changed(path.parent(), Attribute.EXPRESSION));
    }

    public Link appendLink(@Nullable Outlet source, Inlet target) throws GraphException {
        if (target == null || !store.contains(target)) {
            throw new InvalidTargetException("Link target " + target + " is not a live inlet");
        }
        return insertLink(target.links().size(), source, target);
    }

    public Link insertLink(int position, @Nullable Outlet source, Inlet target) throws GraphException {
        store.guard().checkMutable("insert link");
        store.checkInsertLink(position, source, target);

        final TreePath parent = locate(target);
        final IndexRange range = IndexRange.single(position);
        publish(ChangeEvent.structural(Type.BEGIN_INSERT, parent, range));
        final Link link = store.insertLink(position, source, target);
        publish(ChangeEvent.structural(Type.END_INSERT, parent, range));
        return link;
    }

    public void setLinkSource(Link link, @Nullable Outlet source) throws GraphException {
        store.setLinkSource(link, source);
        publish(ChangeEvent.changed(locate(link), Attribute.LINK_SOURCE));
    }

    public void removeLink(Link link) throws GraphException {
        store.guard().checkMutable("remove link");
        final TreePath path = locate(link);
        removeLinks(path.parent(), link.target().links(), IndexRange.single(path.last()));
    }

    // ---- helpers ----

    private void publish(ChangeEvent event) {
        LOG.debug("Notify {}", event);
        store.guard().dispatch(() -> {
            for (ChangeListener listener : List.copyOf(listeners)) {
                try {
                    listener.onChange(event);
                } catch (RuntimeException e) {
                    LOG.error("Change listener {} failed on {}", listener, event, e);
                }
            }
        });
    }

    private static void checkCount(int count) throws OutOfRangeException {
        if (count < 1) {
            throw new OutOfRangeException("Count must be positive, got " + count);
        }
    }

    private static void checkOrdinal(int ordinal, int size) throws OutOfRangeException {
        if (ordinal < 0 || ordinal > size) {
            throw new OutOfRangeException("Ordinal " + ordinal + " is outside [0, " + size + "]");
        }
    }

    private static void checkInsertRange(int ordinal, int count, int size) throws OutOfRangeException {
        checkOrdinal(ordinal, size);
        if (count > Integer.MAX_VALUE - size) {
            throw new OutOfRangeException("Cannot insert " + count + " children next to " + size + " existing");
        }
    }

    private static void checkRemoveRange(int ordinal, int count, int size) throws OutOfRangeException {
        if (ordinal < 0 || ordinal > size || count > size - ordinal) {
            throw new OutOfRangeException(
                "Range [" + ordinal + ", " + ((long) ordinal + count) + ") is outside [0, " + size + ")");
        }
    }

    private static StructuralViolationException rejected(String message) {
        LOG.warn(message);
        return new StructuralViolationException(message);
    }

    private static StructuralViolationException unsupported(GraphEntity entity, Attribute attribute) {
        return rejected("Attribute " + attribute + " is not supported on " + entity.kind());
    }
}
