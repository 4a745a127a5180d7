package com.pipeline.dag.api;

public record MissingDependency(String job, String missingName) implements DependencyIssue {

    @Override
    public Kind kind() {
        return Kind.MISSING_DEPENDENCY;
    }

    @Override
    public Severity severity() {
        return Severity.HIGH;
    }

    @Override
    public String message() {
        return "Job '" + job + "' depends on non-existent job '" + missingName + "'";
    }

    @Override
    public String remedy() {
        return "Either create job '" + missingName + "' or remove it from the needs list";
    }
}
