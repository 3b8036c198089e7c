package ai.flowgraph.common;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

public final class Ranges {
    private Ranges() {}

    /**
     * Groups ordinals into maximal runs of consecutive integers.
     * Input order and duplicates do not matter, runs are returned in ascending order.
     */
    public static List<IndexRange> group(Collection<Integer> ordinals) {
        final TreeSet<Integer> sorted = new TreeSet<>(ordinals);
        if (sorted.isEmpty()) {
            return List.of();
        }

        final ImmutableList.Builder<IndexRange> runs = ImmutableList.builder();
        int first = sorted.first();
        int last = first;
        for (int n : sorted.tailSet(first, false)) {
            if (n == last + 1) {
                last = n;
            } else {
                runs.add(IndexRange.of(first, last));
                first = last = n;
            }
        }
        runs.add(IndexRange.of(first, last));
        return runs.build();
    }

    /**
     * Same runs as {@link #group(Collection)}, highest first. Removing runs in this order keeps the
     * ordinals of the remaining runs valid.
     */
    public static List<IndexRange> groupDescending(Collection<Integer> ordinals) {
        return Lists.reverse(group(ordinals));
    }
}
