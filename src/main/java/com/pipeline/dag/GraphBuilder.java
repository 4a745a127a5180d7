package com.pipeline.dag;

import com.pipeline.dag.api.AnalyzedJob;
import com.pipeline.dag.api.Job;
import com.pipeline.dag.api.MissingDependency;
import com.pipeline.dag.api.Step;
import com.pipeline.dag.engine.DependencyGraph;
import com.pipeline.dag.engine.DurationEstimator;
import com.pipeline.dag.engine.JobGraph;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Graph Builder -- turns a normalized job map into a {@link JobGraph}.
 *
 * <p>
 * Each job's raw {@code needs} declaration is normalized into a set of names by
 * {@link #normalizeNeeds(Object)}, the only place that looks at the shape of a
 * declaration. A name that matches a job becomes an edge
 * {@code dependency -> job}; a name that does not becomes a
 * {@link MissingDependency} and no edge, so every later pass works on the
 * largest graph that can actually be built.
 *
 * <h3>Usage Pattern</h3>
 *
 * <pre>{@code
 * JobGraph g = GraphBuilder.create("ci.yml")
 *         .job(Job.of("build", null))
 *         .job(Job.of("test", "build"))
 *         .build();
 * }</pre>
 *
 * <p>
 * The builder is stateful and not thread-safe. Once {@link #build()} is called
 * it cannot be used to add more jobs.
 */
public final class GraphBuilder {
    private static final Logger log = LogManager.getLogger(GraphBuilder.class);

    private final String pipelineName;
    private final Map<String, Job> jobs = new LinkedHashMap<>();

    private boolean built;

    private GraphBuilder(String pipelineName) {
        this.pipelineName = pipelineName;
    }

    public static GraphBuilder create(String pipelineName) {
        return new GraphBuilder(pipelineName);
    }

    /**
     * Adds one job.
     *
     * @throws IllegalArgumentException if the name is missing or already used
     */
    public GraphBuilder job(Job job) {
        checkNotBuilt();
        if (job == null)
            throw new IllegalArgumentException("Job record must not be null");
        if (job.name() == null || job.name().isBlank())
            throw new IllegalArgumentException("Job record is missing a name");
        if (jobs.containsKey(job.name()))
            throw new IllegalArgumentException("Duplicate job name: " + job.name());
        for (Step step : job.steps())
            if (step == null)
                throw new IllegalArgumentException("Job '" + job.name() + "' has a null step");
        jobs.put(job.name(), job);
        return this;
    }

    /**
     * Adds every job of a name-keyed map, in map iteration order.
     *
     * @throws IllegalArgumentException if a key differs from its job's name
     */
    public GraphBuilder jobs(Map<String, Job> jobMap) {
        for (Map.Entry<String, Job> e : jobMap.entrySet()) {
            Job job = e.getValue();
            if (job != null && !e.getKey().equals(job.name()))
                throw new IllegalArgumentException(
                        "Job map key '" + e.getKey() + "' does not match job name '" + job.name() + "'");
            job(job);
        }
        return this;
    }

    public JobGraph build() {
        checkNotBuilt();
        built = true;

        Map<String, AnalyzedJob> analyzed = new LinkedHashMap<>(jobs.size() * 2);
        DependencyGraph.Builder graph = DependencyGraph.builder();
        for (Job job : jobs.values()) {
            Set<String> deps = normalizeNeeds(job.needs());
            analyzed.put(job.name(), new AnalyzedJob(job.name(),
                    Collections.unmodifiableSet(deps), job.steps(),
                    DurationEstimator.estimate(job.steps()),
                    DurationEstimator.canParallelize(job.steps())));
            graph.addNode(job.name());
        }

        List<MissingDependency> missing = new ArrayList<>();
        for (AnalyzedJob job : analyzed.values()) {
            for (String dep : job.dependencies()) {
                if (analyzed.containsKey(dep)) {
                    graph.addEdge(dep, job.name());
                } else {
                    log.warn("Job '{}' in {} depends on non-existent job '{}'", job.name(), pipelineName, dep);
                    missing.add(new MissingDependency(job.name(), dep));
                }
            }
        }

        DependencyGraph g = graph.build();
        log.debug("Built dependency graph for {} with {} nodes and {} edges", pipelineName, g.nodeCount(),
                g.edgeCount());
        return new JobGraph(pipelineName, Collections.unmodifiableMap(analyzed), g,
                Collections.unmodifiableList(missing));
    }

    /**
     * Normalizes a raw {@code needs} declaration into an ordered set of names.
     * <ul>
     * <li>{@code null}: no dependencies</li>
     * <li>{@code String}: one dependency</li>
     * <li>collection: each element is a name or a mapping with a string
     * {@code job} field</li>
     * <li>mapping: its keys are the names</li>
     * </ul>
     *
     * @throws IllegalArgumentException for any other shape
     */
    public static Set<String> normalizeNeeds(Object needs) {
        Set<String> names = new LinkedHashSet<>();
        if (needs == null)
            return names;
        if (needs instanceof String s) {
            names.add(s);
        } else if (needs instanceof Collection<?> items) {
            for (Object item : items) {
                if (item instanceof String name) {
                    names.add(name);
                } else if (item instanceof Map<?, ?> entry) {
                    if (!(entry.get("job") instanceof String jobName))
                        throw new IllegalArgumentException("Dependency entry without a string 'job' field: " + entry);
                    names.add(jobName);
                } else {
                    throw new IllegalArgumentException("Unsupported dependency entry: " + item);
                }
            }
        } else if (needs instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                if (!(key instanceof String name))
                    throw new IllegalArgumentException("Dependency name is not a string: " + key);
                names.add(name);
            }
        } else {
            throw new IllegalArgumentException(
                    "Unsupported dependency declaration of type " + needs.getClass().getSimpleName() + ": " + needs);
        }
        return names;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("GraphBuilder already built");
    }
}
