package com.pipeline.dag.api;

public record SplitBottleneckJob(String job, int stepCount) implements OptimizationSuggestion {

    @Override
    public Kind kind() {
        return Kind.SPLIT_BOTTLENECK_JOB;
    }

    @Override
    public Severity severity() {
        return Severity.MEDIUM;
    }

    @Override
    public String message() {
        return "Job '" + job + "' is a bottleneck with " + stepCount + " steps";
    }

    @Override
    public String remedy() {
        return "Consider splitting this job into smaller, parallel jobs";
    }
}
