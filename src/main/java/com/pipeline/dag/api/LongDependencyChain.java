package com.pipeline.dag.api;

import java.util.List;

public record LongDependencyChain(List<String> path) implements OptimizationSuggestion {

    public LongDependencyChain {
        path = List.copyOf(path);
    }

    @Override
    public Kind kind() {
        return Kind.LONG_DEPENDENCY_CHAIN;
    }

    @Override
    public Severity severity() {
        return Severity.LOW;
    }

    @Override
    public String message() {
        return "Long dependency chain: " + String.join(" -> ", path);
    }

    @Override
    public String remedy() {
        return "Consider restructuring to reduce sequential dependencies";
    }
}
