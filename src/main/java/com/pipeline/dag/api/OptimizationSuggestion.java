package com.pipeline.dag.api;

/**
 * Advice on restructuring a pipeline for more parallelism. Suggestions are
 * advisory only and never block analysis.
 */
public interface OptimizationSuggestion {

    enum Kind {
        PARALLELIZE_INDEPENDENT_JOBS,
        SPLIT_BOTTLENECK_JOB,
        LONG_DEPENDENCY_CHAIN,
        LARGE_JOB
    }

    Kind kind();

    Severity severity();

    String message();

    String remedy();
}
