package com.pipeline.dag.optimize;

import com.pipeline.dag.api.AnalyzedJob;
import com.pipeline.dag.api.DependencyChange;
import com.pipeline.dag.api.OptimizeResult;
import com.pipeline.dag.engine.DependencyGraph;
import com.pipeline.dag.engine.JobGraph;
import com.pipeline.dag.engine.ValidationPass;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Removes declared dependencies that another declared dependency already
 * implies.
 *
 * <p>
 * For each job the candidate set is computed once, against the job's original
 * direct dependencies. A candidate {@code d2} is then only dropped if it is
 * still an ancestor of a dependency that remains after the removals made so
 * far, so the last witness of an implied edge is never removed. Reachability
 * between jobs is unchanged by the rewrite, which makes the pass idempotent.
 *
 * <p>
 * Only the returned copy is rewritten. Dangling names are kept as declared.
 */
public final class RedundancyOptimizer {
    private static final Logger log = LogManager.getLogger(RedundancyOptimizer.class);

    public OptimizeResult optimize(JobGraph jobGraph) {
        Map<String, List<String>> declared = new LinkedHashMap<>();
        for (AnalyzedJob job : jobGraph.jobs().values())
            declared.put(job.name(), new ArrayList<>(job.dependencies()));
        return optimize(declared);
    }

    public OptimizeResult optimize(Map<String, ? extends Collection<String>> declared) {
        DependencyGraph graph = DependencyGraph.of(declared);
        Map<String, List<String>> rewritten = new LinkedHashMap<>(declared.size() * 2);
        List<DependencyChange> changes = new ArrayList<>();

        for (Map.Entry<String, ? extends Collection<String>> e : declared.entrySet()) {
            String job = e.getKey();
            List<String> deps = new ArrayList<>(new LinkedHashSet<>(e.getValue()));
            Set<String> candidates = ValidationPass.redundantWitnesses(graph, job, deps).keySet();
            Set<String> removed = removeImplied(graph, job, deps, candidates);

            List<String> kept = new ArrayList<>(deps);
            kept.removeAll(removed);
            rewritten.put(job, Collections.unmodifiableList(kept));
            if (!removed.isEmpty()) {
                log.debug("Job '{}': removing redundant dependencies {}", job, removed);
                changes.add(new DependencyChange(job, new ArrayList<>(removed),
                        DependencyChange.Reason.REDUNDANT_DEPENDENCY));
            }
        }
        return new OptimizeResult(Collections.unmodifiableMap(rewritten), changes);
    }

    /**
     * Drops each candidate that is still implied by a dependency of {@code job}
     * left after the removals made so far. Returns the dropped names in
     * declaration order.
     */
    static Set<String> removeImplied(DependencyGraph graph, String job, List<String> deps,
            Collection<String> candidates) {
        Set<String> remaining = new LinkedHashSet<>();
        for (String d : deps)
            if (graph.contains(d))
                remaining.add(d);

        Set<String> removed = new LinkedHashSet<>();
        for (String d2 : deps) {
            if (!candidates.contains(d2))
                continue;
            boolean implied = false;
            for (String other : remaining) {
                if (!other.equals(d2) && graph.ancestorsAvoiding(other, job).contains(d2)) {
                    implied = true;
                    break;
                }
            }
            if (implied) {
                remaining.remove(d2);
                removed.add(d2);
            }
        }
        return removed;
    }
}
