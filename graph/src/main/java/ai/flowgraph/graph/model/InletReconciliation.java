package ai.flowgraph.graph.model;

import ai.flowgraph.common.IndexRange;
import ai.flowgraph.common.Ranges;
import ai.flowgraph.expression.PortResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Three-way diff between an operator's current inlets and the free variables of a new expression.
 *
 * <p>Inlets are matched by name and keep their identity and links. The final order follows the
 * expression. Kept inlets that would have to change their relative order are moved: they appear
 * both among the removed ordinals (old position) and the inserted ordinals (new position), while
 * still being the same object. The largest set of kept inlets whose relative order is unchanged
 * stays in place.
 */
public final class InletReconciliation {
    private final Operator operator;
    private final String expression;
    private final List<Inlet> before;
    private final List<Inlet> after;
    private final Set<Inlet> dropped;
    private final Set<Inlet> created;
    private final Set<Inlet> moved;
    private final TreeSet<Integer> removedOrdinals;
    private final TreeSet<Integer> insertedOrdinals;

    private InletReconciliation(Operator operator, String expression, List<Inlet> before, List<Inlet> after,
                                Set<Inlet> dropped, Set<Inlet> created, Set<Inlet> moved,
                                TreeSet<Integer> removedOrdinals, TreeSet<Integer> insertedOrdinals)
    {
        this.operator = operator;
        this.expression = expression;
        this.before = before;
        this.after = after;
        this.dropped = dropped;
        this.created = created;
        this.moved = moved;
        this.removedOrdinals = removedOrdinals;
        this.insertedOrdinals = insertedOrdinals;
    }

    static InletReconciliation plan(Operator operator, String expression) {
        final List<Inlet> before = List.copyOf(operator.inletList());
        final List<String> desired = PortResolver.resolve(expression);

        final Map<String, Integer> oldIndexByName = new HashMap<>();
        for (int i = 0; i < before.size(); i++) {
            oldIndexByName.putIfAbsent(before.get(i).name(), i);
        }

        final List<Inlet> after = new ArrayList<>(desired.size());
        final Set<Inlet> created = identitySet();
        final List<Integer> keptNewOrdinals = new ArrayList<>();
        final List<Integer> keptOldOrdinals = new ArrayList<>();
        for (int i = 0; i < desired.size(); i++) {
            final Integer oldIndex = oldIndexByName.get(desired.get(i));
            if (oldIndex == null) {
                final Inlet inlet = new Inlet(desired.get(i), operator);
                created.add(inlet);
                after.add(inlet);
            } else {
                after.add(before.get(oldIndex));
                keptNewOrdinals.add(i);
                keptOldOrdinals.add(oldIndex);
            }
        }

        final boolean[] stays = longestIncreasingSubsequence(keptOldOrdinals);

        final Set<Inlet> keptInPlace = identitySet();
        final Set<Inlet> moved = identitySet();
        final TreeSet<Integer> insertedOrdinals = new TreeSet<>();
        for (int i = 0; i < after.size(); i++) {
            if (created.contains(after.get(i))) {
                insertedOrdinals.add(i);
            }
        }
        for (int k = 0; k < keptNewOrdinals.size(); k++) {
            final Inlet inlet = after.get(keptNewOrdinals.get(k));
            if (stays[k]) {
                keptInPlace.add(inlet);
            } else {
                moved.add(inlet);
                insertedOrdinals.add(keptNewOrdinals.get(k));
            }
        }

        final Set<Inlet> dropped = identitySet();
        final TreeSet<Integer> removedOrdinals = new TreeSet<>();
        for (int i = 0; i < before.size(); i++) {
            final Inlet inlet = before.get(i);
            if (!keptInPlace.contains(inlet)) {
                removedOrdinals.add(i);
                if (!moved.contains(inlet)) {
                    dropped.add(inlet);
                }
            }
        }

        return new InletReconciliation(operator, expression, before, List.copyOf(after), dropped, created, moved,
            removedOrdinals, insertedOrdinals);
    }

    /**
     * Marks the members of one longest strictly increasing subsequence.
     */
    private static boolean[] longestIncreasingSubsequence(List<Integer> values) {
        final int n = values.size();
        final int[] length = new int[n];
        final int[] previous = new int[n];
        int best = -1;
        for (int i = 0; i < n; i++) {
            length[i] = 1;
            previous[i] = -1;
            for (int j = 0; j < i; j++) {
                if (values.get(j) < values.get(i) && length[j] + 1 > length[i]) {
                    length[i] = length[j] + 1;
                    previous[i] = j;
                }
            }
            if (best < 0 || length[i] > length[best]) {
                best = i;
            }
        }
        final boolean[] members = new boolean[n];
        for (int i = best; i >= 0; i = previous[i]) {
            members[i] = true;
        }
        return members;
    }

    private static Set<Inlet> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    public Operator operator() {
        return operator;
    }

    public String expression() {
        return expression;
    }

    public List<Inlet> before() {
        return before;
    }

    public List<Inlet> after() {
        return after;
    }

    public Set<Inlet> dropped() {
        return Collections.unmodifiableSet(dropped);
    }

    public Set<Inlet> created() {
        return Collections.unmodifiableSet(created);
    }

    public Set<Inlet> moved() {
        return Collections.unmodifiableSet(moved);
    }

    public Set<Integer> removedOrdinals() {
        return Collections.unmodifiableSet(removedOrdinals);
    }

    public Set<Integer> insertedOrdinals() {
        return Collections.unmodifiableSet(insertedOrdinals);
    }

    public List<IndexRange> removedRuns() {
        return Ranges.groupDescending(removedOrdinals);
    }

    public List<IndexRange> insertedRuns() {
        return Ranges.group(insertedOrdinals);
    }

    public boolean isStructural() {
        return !removedOrdinals.isEmpty() || !insertedOrdinals.isEmpty();
    }

    @Override
    public String toString() {
        return "InletReconciliation{operator=" + operator.id()
            + ", removed=" + removedRuns()
            + ", inserted=" + insertedRuns()
            + ", moved=" + moved.size()
            + '}';
    }
}
