package com.pipeline.dag.engine;

import com.pipeline.dag.api.CircularDependency;
import com.pipeline.dag.api.DependencyIssue;
import com.pipeline.dag.api.RedundantDependency;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Structural and redundancy checks over a built {@link JobGraph}.
 *
 * <p>
 * Issues come out in a fixed order: cycles, then dangling names (already
 * collected by the builder), then redundant edges. Nothing here mutates the
 * graph; see {@link com.pipeline.dag.optimize.RedundancyOptimizer} for the
 * rewriting counterpart of {@link #findRedundant(DependencyGraph)}.
 */
public final class ValidationPass {
    private static final Logger log = LogManager.getLogger(ValidationPass.class);

    private ValidationPass() {
        // Utility class
    }

    public static List<DependencyIssue> validate(JobGraph jobGraph) {
        List<DependencyIssue> issues = new ArrayList<>();
        issues.addAll(findCycles(jobGraph.graph()));
        issues.addAll(jobGraph.missing());
        issues.addAll(findRedundant(jobGraph.graph()));
        return issues;
    }

    /** One issue per simple cycle; empty for an acyclic graph. */
    public static List<CircularDependency> findCycles(DependencyGraph graph) {
        if (graph.isAcyclic())
            return List.of();
        List<CircularDependency> out = new ArrayList<>();
        for (List<String> cycle : graph.simpleCycles())
            out.add(new CircularDependency(cycle));
        log.debug("Found {} simple cycle(s)", out.size());
        return out;
    }

    /** Redundant direct edges of every job, in node order. */
    public static List<RedundantDependency> findRedundant(DependencyGraph graph) {
        List<RedundantDependency> out = new ArrayList<>();
        for (String job : graph.names()) {
            Map<String, Set<String>> redundant = redundantWitnesses(graph, job, graph.predecessors(job));
            for (Map.Entry<String, Set<String>> e : redundant.entrySet())
                out.add(new RedundantDependency(job, e.getKey(), e.getValue()));
        }
        return out;
    }

    /**
     * For each {@code d2} in {@code direct}, the set of other members
     * {@code d1} of {@code direct} that {@code d2} is an ancestor of. Only
     * entries with at least one witness are returned. Names in {@code direct}
     * that are not graph nodes are ignored.
     *
     * <p>
     * Ancestor walks never pass through {@code job}, so an edge of {@code job}
     * is only ever implied by a path that does not depend on {@code job} itself.
     */
    public static Map<String, Set<String>> redundantWitnesses(DependencyGraph graph, String job,
            Collection<String> direct) {
        List<String> known = new ArrayList<>(direct.size());
        for (String d : direct)
            if (graph.contains(d))
                known.add(d);

        Map<String, Set<String>> out = new LinkedHashMap<>();
        if (known.size() < 2)
            return out;

        Map<String, Set<String>> ancestorsOf = new HashMap<>();
        for (String d1 : known)
            ancestorsOf.put(d1, graph.ancestorsAvoiding(d1, job));

        for (String d2 : known) {
            Set<String> witnesses = new TreeSet<>();
            for (String d1 : known)
                if (!d1.equals(d2) && ancestorsOf.get(d1).contains(d2))
                    witnesses.add(d1);
            if (!witnesses.isEmpty())
                out.put(d2, witnesses);
        }
        return out;
    }
}
