package ai.flowgraph.projection;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Sequence of sibling ordinals from the implicit root. The empty path is the root itself.
 */
public final class TreePath {
    public static final TreePath ROOT = new TreePath(ImmutableList.of());

    private final ImmutableList<Integer> ordinals;

    private TreePath(ImmutableList<Integer> ordinals) {
        this.ordinals = ordinals;
    }

    public static TreePath of(int... ordinals) {
        final ImmutableList.Builder<Integer> builder = ImmutableList.builder();
        for (int ordinal : ordinals) {
            Preconditions.checkArgument(ordinal >= 0, "negative ordinal %s", ordinal);
            builder.add(ordinal);
        }
        return new TreePath(builder.build());
    }

    public TreePath child(int ordinal) {
        Preconditions.checkArgument(ordinal >= 0, "negative ordinal %s", ordinal);
        return new TreePath(ImmutableList.<Integer>builder().addAll(ordinals).add(ordinal).build());
    }

    public TreePath parent() {
        Preconditions.checkState(!isRoot(), "root has no parent");
        return new TreePath(ordinals.subList(0, ordinals.size() - 1));
    }

    public boolean isRoot() {
        return ordinals.isEmpty();
    }

    public int depth() {
        return ordinals.size();
    }

    public int get(int level) {
        return ordinals.get(level);
    }

    public int last() {
        Preconditions.checkState(!isRoot(), "root has no ordinal");
        return ordinals.get(ordinals.size() - 1);
    }

    public List<Integer> ordinals() {
        return ordinals;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return ordinals.equals(((TreePath) o).ordinals);
    }

    @Override
    public int hashCode() {
        return ordinals.hashCode();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (int ordinal : ordinals) {
            sb.append('/').append(ordinal);
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }
}
