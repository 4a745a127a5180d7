package com.pipeline.dag.api;

/**
 * A problem found in a job dependency declaration.
 *
 * <p>
 * Structural issues (cycles, dangling names) always reach the caller and a
 * cycle stops weighted scheduling analysis. Advisory issues never block any
 * other pass.
 */
public interface DependencyIssue {

    enum Kind {
        CIRCULAR_DEPENDENCY,
        MISSING_DEPENDENCY,
        REDUNDANT_DEPENDENCY
    }

    Kind kind();

    Severity severity();

    /** One-line description of the problem. */
    String message();

    /** One-line description of how to fix it. */
    String remedy();

    default boolean isStructural() {
        return kind() != Kind.REDUNDANT_DEPENDENCY;
    }
}
