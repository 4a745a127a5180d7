package com.pipeline.dag.api;

/** Two jobs of the same stage that share no descendant. {@code jobA} sorts before {@code jobB}. */
public record ParallelizeIndependentJobs(String jobA, String jobB) implements OptimizationSuggestion {

    @Override
    public Kind kind() {
        return Kind.PARALLELIZE_INDEPENDENT_JOBS;
    }

    @Override
    public Severity severity() {
        return Severity.MEDIUM;
    }

    @Override
    public String message() {
        return "Jobs '" + jobA + "' and '" + jobB + "' could potentially run in parallel";
    }

    @Override
    public String remedy() {
        return "Review if these jobs truly need to run sequentially";
    }
}
