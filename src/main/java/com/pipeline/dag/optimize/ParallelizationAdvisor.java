package com.pipeline.dag.optimize;

import com.pipeline.dag.api.*;
import com.pipeline.dag.config.AnalyzerSettings;
import com.pipeline.dag.engine.DependencyGraph;
import com.pipeline.dag.engine.JobGraph;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds jobs that could run side by side and proposes how to get there.
 *
 * <p>
 * Two passes flag groups of jobs, and their results are merged with duplicate
 * job sets dropped:
 * <ol>
 * <li>same-stage independence: the jobs of a stage that no other job of that
 * stage feeds directly, when there are at least two of them</li>
 * <li>identical dependencies: jobs whose declared dependency sets are equal,
 * whatever their stage</li>
 * </ol>
 * A flagged group that still has edges between its own members gets an
 * edge-removal proposal limited to those edges, under the same
 * last-witness rule as {@link RedundancyOptimizer}.
 */
public final class ParallelizationAdvisor {
    private static final Logger log = LogManager.getLogger(ParallelizationAdvisor.class);

    private final AnalyzerSettings settings;

    public ParallelizationAdvisor(AnalyzerSettings settings) {
        this.settings = settings;
    }

    // ── Suggestions ──────────────────────────────────────────────

    /**
     * All suggestions for an analyzed graph: independent pairs, bottleneck
     * splits, the first long chain, then large jobs.
     */
    public List<OptimizationSuggestion> suggest(JobGraph jobGraph, List<List<String>> stages,
            List<String> bottlenecks) {
        List<OptimizationSuggestion> out = new ArrayList<>(independentPairs(jobGraph.graph(), stages));

        for (String job : bottlenecks) {
            AnalyzedJob j = jobGraph.job(job);
            if (j != null && j.stepCount() > settings.getSplitBottleneckMinSteps())
                out.add(new SplitBottleneckJob(job, j.stepCount()));
        }

        List<String> chain = longestChain(jobGraph.graph());
        if (chain.size() > settings.getLongChainThreshold())
            out.add(new LongDependencyChain(chain));

        for (AnalyzedJob j : jobGraph.jobs().values())
            if (j.stepCount() > settings.getLargeJobMinSteps())
                out.add(new LargeJob(j.name(), j.stepCount()));
        return out;
    }

    /**
     * One suggestion per unordered pair of independent jobs in the same stage
     * that share no descendant.
     */
    public List<ParallelizeIndependentJobs> independentPairs(DependencyGraph graph, List<List<String>> stages) {
        List<ParallelizeIndependentJobs> out = new ArrayList<>();
        for (List<String> stage : stages) {
            List<String> independent = independentJobs(graph, stage);
            if (independent.size() < 2)
                continue;
            List<String> sorted = new ArrayList<>(independent);
            Collections.sort(sorted);
            Map<String, Set<String>> descendants = new HashMap<>();
            for (String job : sorted)
                descendants.put(job, graph.descendants(job));
            for (int i = 0; i < sorted.size(); i++) {
                for (int j = i + 1; j < sorted.size(); j++) {
                    String a = sorted.get(i), b = sorted.get(j);
                    if (Collections.disjoint(descendants.get(a), descendants.get(b)))
                        out.add(new ParallelizeIndependentJobs(a, b));
                }
            }
        }
        return out;
    }

    /** Jobs of {@code stage} with no direct edge from another job of the same stage. */
    static List<String> independentJobs(DependencyGraph graph, List<String> stage) {
        List<String> out = new ArrayList<>();
        for (String job : stage) {
            boolean fed = false;
            for (String other : stage) {
                if (!other.equals(job) && graph.hasEdge(other, job)) {
                    fed = true;
                    break;
                }
            }
            if (!fed)
                out.add(job);
        }
        return out;
    }

    /**
     * Longest path by hop count, root first; on ties the path ending earliest in
     * topological order wins. Empty for an empty or cyclic graph.
     */
    public List<String> longestChain(DependencyGraph graph) {
        if (graph.nodeCount() == 0 || !graph.isAcyclic())
            return List.of();
        int n = graph.nodeCount();
        int[] order = graph.topologicalIndices();
        int[] hops = new int[n];
        int[] pred = new int[n];
        Arrays.fill(hops, 1);
        Arrays.fill(pred, -1);
        for (int node : order) {
            for (int k = 0; k < graph.childCount(node); k++) {
                int succ = graph.child(node, k);
                if (hops[node] + 1 > hops[succ]) {
                    hops[succ] = hops[node] + 1;
                    pred[succ] = node;
                }
            }
        }
        int end = order[0];
        for (int node : order)
            if (hops[node] > hops[end])
                end = node;
        LinkedList<String> path = new LinkedList<>();
        for (int curr = end; curr != -1; curr = pred[curr])
            path.addFirst(graph.name(curr));
        return path;
    }

    // ── Groups and edge removal ──────────────────────────────────

    /**
     * Groups of jobs that could run in parallel: independent jobs per stage,
     * then jobs with set-equal declared dependencies. Each job set appears once.
     */
    public List<List<String>> parallelGroups(DependencyGraph graph, Map<String, ? extends Collection<String>> declared) {
        Set<Set<String>> seen = new HashSet<>();
        List<List<String>> groups = new ArrayList<>();

        for (List<String> stage : graph.generations()) {
            List<String> independent = independentJobs(graph, stage);
            if (independent.size() > 1 && seen.add(new HashSet<>(independent))) {
                groups.add(independent);
                log.debug("Found parallelizable jobs: {}", independent);
            }
        }

        Map<Set<String>, List<String>> byDeps = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<String>> e : declared.entrySet())
            byDeps.computeIfAbsent(new HashSet<>(e.getValue()), k -> new ArrayList<>()).add(e.getKey());
        for (List<String> group : byDeps.values()) {
            if (group.size() > 1 && seen.add(new HashSet<>(group))) {
                groups.add(group);
                log.debug("Jobs with identical dependencies: {}", group);
            }
        }
        return groups;
    }

    /**
     * Proposes removing edges between members of each flagged group that is
     * still serialized. Returns a rewritten copy of {@code declared}.
     */
    public OptimizeResult proposeEdgeRemovals(Map<String, ? extends Collection<String>> declared) {
        DependencyGraph graph = DependencyGraph.of(declared);
        Map<String, List<String>> current = new LinkedHashMap<>(declared.size() * 2);
        for (Map.Entry<String, ? extends Collection<String>> e : declared.entrySet())
            current.put(e.getKey(), new ArrayList<>(new LinkedHashSet<>(e.getValue())));

        List<DependencyChange> changes = new ArrayList<>();
        for (List<String> group : parallelGroups(graph, declared)) {
            if (!hasInternalEdge(graph, group))
                continue;
            Set<String> members = new HashSet<>(group);
            for (String job : group) {
                List<String> deps = current.get(job);
                List<String> intra = new ArrayList<>();
                for (String d : deps)
                    if (members.contains(d) && !d.equals(job))
                        intra.add(d);
                if (intra.isEmpty())
                    continue;
                Set<String> removed = RedundancyOptimizer.removeImplied(graph, job, deps, intra);
                if (removed.isEmpty())
                    continue;
                deps.removeAll(removed);
                changes.add(new DependencyChange(job, new ArrayList<>(removed),
                        DependencyChange.Reason.ENABLE_PARALLELIZATION));
                log.debug("Job '{}': removing serializing dependencies {}", job, removed);
            }
        }

        Map<String, List<String>> rewritten = new LinkedHashMap<>(current.size() * 2);
        for (Map.Entry<String, List<String>> e : current.entrySet())
            rewritten.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
        return new OptimizeResult(Collections.unmodifiableMap(rewritten), changes);
    }

    static boolean hasInternalEdge(DependencyGraph graph, List<String> group) {
        for (String a : group)
            for (String b : group)
                if (!a.equals(b) && graph.hasEdge(a, b))
                    return true;
        return false;
    }
}
