package com.pipeline.dag.engine;

import com.pipeline.dag.api.AnalyzedJob;
import com.pipeline.dag.api.MissingDependency;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The result of {@link com.pipeline.dag.GraphBuilder#build()}: normalized jobs,
 * the feasible dependency graph, and the dangling names that did not become
 * edges.
 *
 * @param name    pipeline name, for logging
 * @param jobs    normalized jobs in input order
 * @param graph   graph over the job names; dangling names are absent
 * @param missing one issue per (job, dangling name) pair
 */
public record JobGraph(String name, Map<String, AnalyzedJob> jobs, DependencyGraph graph,
        List<MissingDependency> missing) {

    /** Declared dependency names of {@code job}, dangling ones included. */
    public Set<String> declared(String job) {
        AnalyzedJob j = jobs.get(job);
        if (j == null)
            throw new IllegalArgumentException("Unknown job: " + job);
        return j.dependencies();
    }

    public AnalyzedJob job(String name) {
        return jobs.get(name);
    }
}
