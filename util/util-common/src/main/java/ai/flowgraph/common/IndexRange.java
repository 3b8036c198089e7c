package ai.flowgraph.common;

/**
 * Closed range of consecutive ordinals {@code [first, last]}.
 */
public record IndexRange(int first, int last) {

    public IndexRange {
        if (first < 0 || last < first) {
            throw new IllegalArgumentException("Invalid range [" + first + ", " + last + "]");
        }
    }

    public static IndexRange of(int first, int last) {
        return new IndexRange(first, last);
    }

    public static IndexRange single(int index) {
        return new IndexRange(index, index);
    }

    public int count() {
        return last - first + 1;
    }

    public boolean contains(int index) {
        return first <= index && index <= last;
    }

    @Override
    public String toString() {
        return "[" + first + ".." + last + "]";
    }
}
