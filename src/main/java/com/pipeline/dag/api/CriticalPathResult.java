package com.pipeline.dag.api;

import java.util.List;

/**
 * The longest duration-weighted chain of dependent jobs, root first.
 *
 * @param path          job names from root to sink
 * @param totalDuration sum of the weights of the jobs on {@code path}
 */
public record CriticalPathResult(List<String> path, long totalDuration) {

    public static final CriticalPathResult EMPTY = new CriticalPathResult(List.of(), 0);

    public CriticalPathResult {
        path = List.copyOf(path);
    }

    public boolean isEmpty() {
        return path.isEmpty();
    }
}
