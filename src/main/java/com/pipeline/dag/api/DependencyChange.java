package com.pipeline.dag.api;

import java.util.List;

/** One entry of an optimization change-log. */
public record DependencyChange(String job, List<String> removed, Reason reason) {

    public enum Reason {
        REDUNDANT_DEPENDENCY,
        ENABLE_PARALLELIZATION
    }

    public DependencyChange {
        removed = List.copyOf(removed);
    }

    public String message() {
        return switch (reason) {
            case REDUNDANT_DEPENDENCY -> "Removed redundant dependencies " + removed + " from job '" + job + "'";
            case ENABLE_PARALLELIZATION -> "Enabled parallel execution for job '" + job + "' by removing " + removed;
        };
    }
}
