package com.pipeline.dag.engine;

import com.pipeline.dag.api.AnalyzedJob;
import com.pipeline.dag.api.CriticalPathResult;
import com.pipeline.dag.config.AnalyzerSettings;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Duration-weighted scheduling metrics of an acyclic job graph.
 *
 * <p>
 * Every job is weighted by its estimated duration, or by
 * {@link AnalyzerSettings#getDefaultJobDuration()} when the estimate is zero.
 * On a cyclic graph stages and the critical path are empty: no approximate
 * schedule is ever returned.
 *
 * <p>
 * Critical path: nodes are relaxed in topological order with
 * {@code dist[s] = max(dist[s], dist[n] + weight(n))}, so {@code dist[n]} is the
 * longest weighted path that ends just before {@code n}. The path ends at the
 * node with the largest {@code dist} (first in topological order on ties) and
 * is recovered by walking predecessor pointers; its duration is the sum of the
 * weights on it.
 */
public final class SchedulingAnalyzer {
    private static final Logger log = LogManager.getLogger(SchedulingAnalyzer.class);

    private final AnalyzerSettings settings;

    public SchedulingAnalyzer(AnalyzerSettings settings) {
        this.settings = settings;
    }

    public int weight(JobGraph jobGraph, String job) {
        AnalyzedJob j = jobGraph.job(job);
        if (j == null)
            throw new IllegalArgumentException("Unknown job: " + job);
        return j.estimatedDuration() > 0 ? j.estimatedDuration() : settings.getDefaultJobDuration();
    }

    private int[] weights(JobGraph jobGraph) {
        DependencyGraph graph = jobGraph.graph();
        int[] w = new int[graph.nodeCount()];
        for (int i = 0; i < w.length; i++)
            w[i] = weight(jobGraph, graph.name(i));
        return w;
    }

    /** Kahn generations of the graph, empty when it has a cycle. */
    public List<List<String>> stages(JobGraph jobGraph) {
        List<List<String>> stages = jobGraph.graph().generations();
        log.debug("Calculated {} execution stages", stages.size());
        return stages;
    }

    public CriticalPathResult criticalPath(JobGraph jobGraph) {
        DependencyGraph graph = jobGraph.graph();
        if (graph.nodeCount() == 0 || !graph.isAcyclic())
            return CriticalPathResult.EMPTY;

        int n = graph.nodeCount();
        int[] w = weights(jobGraph);
        int[] order = graph.topologicalIndices();
        long[] dist = new long[n];
        int[] pred = new int[n];
        Arrays.fill(pred, -1);

        for (int node : order) {
            for (int k = 0; k < graph.childCount(node); k++) {
                int succ = graph.child(node, k);
                long candidate = dist[node] + w[node];
                if (candidate > dist[succ]) {
                    dist[succ] = candidate;
                    pred[succ] = node;
                }
            }
        }

        int end = order[0];
        for (int node : order)
            if (dist[node] > dist[end])
                end = node;

        LinkedList<String> path = new LinkedList<>();
        long total = 0;
        for (int curr = end; curr != -1; curr = pred[curr]) {
            path.addFirst(graph.name(curr));
            total += w[curr];
        }
        log.debug("Critical path: {} ({}s)", String.join(" -> ", path), total);
        return new CriticalPathResult(path, total);
    }

    /** Total time if every job ran one after another. */
    public long serialTime(JobGraph jobGraph) {
        long total = 0;
        for (String job : jobGraph.jobs().keySet())
            total += weight(jobGraph, job);
        return total;
    }

    /**
     * Lower bound with unlimited runners and no overlap between stages: the sum
     * of the heaviest job of each stage.
     */
    public long parallelTime(JobGraph jobGraph, List<List<String>> stages) {
        long total = 0;
        for (List<String> stage : stages) {
            int max = 0;
            for (String job : stage)
                max = Math.max(max, weight(jobGraph, job));
            total += max;
        }
        return total;
    }

    /**
     * Jobs blocking at least {@link AnalyzerSettings#getBottleneckOutDegree()}
     * dependents, then jobs that are alone in their stage and gate a later one.
     * Each job appears once.
     */
    public List<String> bottlenecks(JobGraph jobGraph, List<List<String>> stages) {
        DependencyGraph graph = jobGraph.graph();
        Set<String> out = new LinkedHashSet<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            if (graph.childCount(i) >= settings.getBottleneckOutDegree()) {
                out.add(graph.name(i));
                log.debug("Bottleneck: {} blocks {} jobs", graph.name(i), graph.childCount(i));
            }
        }
        for (List<String> stage : stages) {
            if (stage.size() == 1) {
                String job = stage.get(0);
                if (graph.outDegree(job) > 0 && out.add(job))
                    log.debug("Bottleneck: {} is alone in its stage", job);
            }
        }
        return new ArrayList<>(out);
    }
}
