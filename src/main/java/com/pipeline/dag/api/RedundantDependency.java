package com.pipeline.dag.api;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@code job} declares {@code dependency} directly although every job in
 * {@code impliedBy} is also a direct dependency of {@code job} and already
 * (transitively) depends on {@code dependency}.
 */
public record RedundantDependency(String job, String dependency, Set<String> impliedBy) implements DependencyIssue {

    public RedundantDependency {
        impliedBy = Collections.unmodifiableSet(new TreeSet<>(impliedBy));
    }

    @Override
    public Kind kind() {
        return Kind.REDUNDANT_DEPENDENCY;
    }

    @Override
    public Severity severity() {
        return Severity.LOW;
    }

    @Override
    public String message() {
        return "Job '" + job + "' has redundant dependency on '" + dependency + "'";
    }

    @Override
    public String remedy() {
        return "Remove '" + dependency + "' from needs as it's implied by " + impliedBy;
    }
}
