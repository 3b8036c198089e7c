package ai.flowgraph.projection;

import ai.flowgraph.common.IndexRange;

import javax.annotation.Nullable;

/**
 * Structural events carry the parent path and the affected ordinal range; {@code CHANGED} carries
 * the path of the changed entity and the attribute.
 */
public record ChangeEvent(
    Type type,
    TreePath path,
    int first,
    int last,
    @Nullable Attribute attribute
) {
    public enum Type {
        BEGIN_INSERT,
        END_INSERT,
        BEGIN_REMOVE,
        END_REMOVE,
        CHANGED
    }

    public static ChangeEvent structural(Type type, TreePath parent, IndexRange range) {
        return new ChangeEvent(type, parent, range.first(), range.last(), null);
    }

    public static ChangeEvent changed(TreePath path, Attribute attribute) {
        return new ChangeEvent(Type.CHANGED, path, -1, -1, attribute);
    }

    public IndexRange range() {
        return IndexRange.of(first, last);
    }

    @Override
    public String toString() {
        if (type == Type.CHANGED) {
            return type + "(" + path + ", " + attribute + ")";
        }
        return type + "(" + path + ", " + first + ".." + last + ")";
    }
}
