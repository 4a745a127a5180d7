package com.pipeline.dag.api;

import java.util.List;
import java.util.Map;

/**
 * Everything one analysis produces. Pure value; built fresh for every call.
 *
 * @param jobs          jobs with derived duration and parallelizability, in
 *                      input order
 * @param edges         resolved dependency edges
 * @param stages        execution stages, empty when the graph has a cycle
 * @param criticalPath  duration-weighted longest chain, empty on a cycle
 * @param serialTime    sum of all job weights
 * @param parallelTime  sum over stages of the heaviest job per stage
 * @param bottlenecks   jobs constraining downstream parallelism
 * @param issues        structural and advisory issues
 * @param suggestions   optimization advice
 */
public record AnalysisResult(
        Map<String, AnalyzedJob> jobs,
        List<DependencyEdge> edges,
        List<List<String>> stages,
        CriticalPathResult criticalPath,
        long serialTime,
        long parallelTime,
        List<String> bottlenecks,
        List<DependencyIssue> issues,
        List<OptimizationSuggestion> suggestions) {

    public boolean hasCycles() {
        return issues.stream().anyMatch(i -> i.kind() == DependencyIssue.Kind.CIRCULAR_DEPENDENCY);
    }

    public List<DependencyIssue> issues(DependencyIssue.Kind kind) {
        return issues.stream().filter(i -> i.kind() == kind).toList();
    }

    public List<OptimizationSuggestion> suggestions(OptimizationSuggestion.Kind kind) {
        return suggestions.stream().filter(s -> s.kind() == kind).toList();
    }

    /** Serial time divided by parallel time, 1.0 when nothing can be scheduled. */
    public double speedup() {
        return parallelTime == 0 ? 1.0 : (double) serialTime / parallelTime;
    }
}
