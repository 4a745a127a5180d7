package com.pipeline.dag.api;

import java.util.List;

/**
 * A simple cycle. {@code cycle} lists each member once, in edge order; the
 * closing edge runs from the last member back to the first.
 */
public record CircularDependency(List<String> cycle) implements DependencyIssue {

    public CircularDependency {
        cycle = List.copyOf(cycle);
    }

    @Override
    public Kind kind() {
        return Kind.CIRCULAR_DEPENDENCY;
    }

    @Override
    public Severity severity() {
        return Severity.HIGH;
    }

    @Override
    public String message() {
        return "Circular dependency detected: " + String.join(" -> ", cycle) + " -> " + cycle.get(0);
    }

    @Override
    public String remedy() {
        return "Remove or restructure dependencies to eliminate the cycle";
    }
}
