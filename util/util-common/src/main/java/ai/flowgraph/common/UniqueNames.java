package ai.flowgraph.common;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

public final class UniqueNames {
    private UniqueNames() {}

    /**
     * Returns {@code prefix + N} for the smallest N >= 1 that is not taken.
     */
    public static String next(String prefix, Collection<String> taken) {
        final Set<String> names = new HashSet<>(taken);
        int n = 1;
        while (names.contains(prefix + n)) {
            n++;
        }
        return prefix + n;
    }
}
