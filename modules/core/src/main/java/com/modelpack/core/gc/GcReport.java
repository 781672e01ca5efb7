package com.modelpack.core.gc;

import com.modelpack.util.Digest;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one garbage collection pass.
 *
 * @param pruned   blobs deleted, per repository (repositories with nothing to prune are omitted)
 * @param failures error message per repository that could not be collected
 */
public record GcReport(Map<String, List<Digest>> pruned, Map<String, String> failures) {

    public GcReport {
        pruned = Collections.unmodifiableMap(new TreeMap<>(pruned));
        failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    public int prunedCount() {
        return pruned.values().stream().mapToInt(List::size).sum();
    }

    public boolean successful() {
        return failures.isEmpty();
    }
}
