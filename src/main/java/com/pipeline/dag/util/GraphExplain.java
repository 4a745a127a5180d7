package com.pipeline.dag.util;

import com.pipeline.dag.api.AnalysisResult;
import com.pipeline.dag.api.AnalyzedJob;
import com.pipeline.dag.api.DependencyEdge;

import java.util.*;

/**
 * Diagnostic utility for inspecting an analyzed pipeline graph.
 *
 * <p>
 * Generates human-readable text and Mermaid diagrams from an
 * {@link AnalysisResult}. Intended for debugging sessions and log output; the
 * reporting front end is expected to do its own rendering.
 */
public final class GraphExplain {
    private final AnalysisResult result;
    private final Map<String, List<String>> successors = new LinkedHashMap<>();
    private final Map<String, Integer> stageOf = new HashMap<>();
    private final Set<String> critical;

    public GraphExplain(AnalysisResult result) {
        this.result = result;
        for (String job : result.jobs().keySet())
            successors.put(job, new ArrayList<>());
        for (DependencyEdge e : result.edges())
            successors.get(e.from()).add(e.to());
        for (int s = 0; s < result.stages().size(); s++)
            for (String job : result.stages().get(s))
                stageOf.put(job, s);
        this.critical = new HashSet<>(result.criticalPath().path());
    }

    /**
     * Dumps the state of a single job.
     */
    public String explainJob(String jobName) {
        AnalyzedJob job = result.jobs().get(jobName);
        if (job == null)
            throw new IllegalArgumentException("Unknown job: " + jobName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Job: ").append(jobName).append('\n')
                .append("  Stage: ").append(stageOf.containsKey(jobName) ? stageOf.get(jobName) : "-").append('\n')
                .append("  Steps: ").append(job.stepCount()).append('\n')
                .append("  Estimated duration: ").append(job.estimatedDuration()).append("s\n")
                .append("  Can parallelize: ").append(job.canParallelize()).append('\n')
                .append("  On critical path: ").append(critical.contains(jobName)).append('\n')
                .append("  Needs: ").append(String.join(", ", job.dependencies())).append('\n');
        List<String> succ = successors.get(jobName);
        sb.append("  Dependents (").append(succ.size()).append("): ").append(String.join(", ", succ));
        return sb.append('\n').toString();
    }

    /**
     * Returns a one-line summary of the timing figures.
     */
    public String explainTiming() {
        return String.format(Locale.ROOT, "Serial: %ds, Parallel: %ds, Critical path: %ds, Speedup: %.2fx",
                result.serialTime(), result.parallelTime(), result.criticalPath().totalDuration(), result.speedup());
    }

    /**
     * Dumps the whole graph in dot-like text format, one line per job.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(result.jobs().size()).append(" jobs, ")
                .append(result.stages().size()).append(" stages):\n");
        for (String job : result.jobs().keySet()) {
            Integer stage = stageOf.get(job);
            sb.append("  [").append(stage == null ? "?" : stage).append("] ").append(job);
            if (critical.contains(job))
                sb.append(" (CRIT)");
            List<String> succ = successors.get(job);
            if (!succ.isEmpty())
                sb.append(" -> ").append(String.join(", ", succ));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram. Critical path jobs get the
     * {@code critical} class.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in input order
        for (AnalyzedJob job : result.jobs().values()) {
            sb.append("  ").append(sanitize(job.name()))
                    .append("[\"").append(job.name()).append("<br/>")
                    .append(job.estimatedDuration()).append("s\"];\n");
        }

        // 2. Declare all edges afterwards
        for (DependencyEdge e : result.edges())
            sb.append("  ").append(sanitize(e.from())).append(" --> ").append(sanitize(e.to())).append(";\n");

        if (!critical.isEmpty()) {
            sb.append("  classDef critical stroke:#d33,stroke-width:3px;\n");
            for (String job : result.criticalPath().path())
                sb.append("  class ").append(sanitize(job)).append(" critical;\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
