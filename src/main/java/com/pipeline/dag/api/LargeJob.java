package com.pipeline.dag.api;

public record LargeJob(String job, int stepCount) implements OptimizationSuggestion {

    @Override
    public Kind kind() {
        return Kind.LARGE_JOB;
    }

    @Override
    public Severity severity() {
        return Severity.LOW;
    }

    @Override
    public String message() {
        return "Job '" + job + "' has " + stepCount + " steps";
    }

    @Override
    public String remedy() {
        return "Consider splitting into smaller, parallel jobs for faster execution";
    }
}
