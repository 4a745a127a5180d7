package com.pipeline.dag.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A rewritten dependency map plus the ordered change-log that produced it.
 * The map is a fresh copy; the caller's input is never touched.
 *
 * @param dependencies job name to reduced declared dependency names, in input
 *                     order
 * @param changes      removals, in the order they were made
 */
public record OptimizeResult(Map<String, List<String>> dependencies, List<DependencyChange> changes) {

    public OptimizeResult {
        changes = List.copyOf(changes);
    }

    public boolean changed() {
        return !changes.isEmpty();
    }

    public int removedCount() {
        return changes.stream().mapToInt(c -> c.removed().size()).sum();
    }

    /** Chains a later pass onto this one: the later map wins, change-logs are concatenated. */
    public OptimizeResult andThen(OptimizeResult next) {
        List<DependencyChange> all = new ArrayList<>(changes);
        all.addAll(next.changes());
        return new OptimizeResult(next.dependencies(), all);
    }
}
