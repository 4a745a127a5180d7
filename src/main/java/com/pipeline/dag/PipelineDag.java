package com.pipeline.dag;

import com.pipeline.dag.api.*;
import com.pipeline.dag.config.AnalyzerSettings;
import com.pipeline.dag.engine.JobGraph;
import com.pipeline.dag.engine.SchedulingAnalyzer;
import com.pipeline.dag.engine.ValidationPass;
import com.pipeline.dag.optimize.ParallelizationAdvisor;
import com.pipeline.dag.optimize.RedundancyOptimizer;
import com.pipeline.dag.util.GraphExplain;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * PipelineDag -- dependency graph analysis for CI/CD pipeline jobs.
 *
 * <h2>Philosophy</h2>
 * <p>
 * A pipeline's jobs and their {@code needs} declarations form a directed graph
 * where an edge {@code a -> b} means {@code b} waits for {@code a}. This class
 * checks that graph for correctness problems (cycles, dangling names,
 * redundant edges), measures how well it can be scheduled (stages, critical
 * path, bottlenecks) and rewrites declarations for more parallelism.
 *
 * <h3>Key Properties</h3>
 * <ul>
 * <li><b>Pure:</b> every call builds its graph from the supplied job map and
 * returns a fresh value. No state is shared between calls, so one instance may
 * be used from any number of threads.</li>
 * <li><b>Precise over available:</b> a cycle empties the stages and the
 * critical path instead of returning an approximation.</li>
 * <li><b>Non-mutating:</b> {@link #optimize(Map)} returns a rewritten copy of the
 * dependency map plus a change-log.</li>
 * </ul>
 *
 * <pre>{@code
 * AnalysisResult result = PipelineDag.create().analyze(jobs);
 * result.criticalPath().path();
 * }</pre>
 */
public final class PipelineDag {
    private static final Logger log = LogManager.getLogger(PipelineDag.class);

    private final SchedulingAnalyzer scheduling;
    private final RedundancyOptimizer redundancy;
    private final ParallelizationAdvisor advisor;

    private PipelineDag(AnalyzerSettings settings) {
        settings.validate();
        this.scheduling = new SchedulingAnalyzer(settings);
        this.redundancy = new RedundancyOptimizer();
        this.advisor = new ParallelizationAdvisor(settings);
    }

    public static PipelineDag create() {
        return new PipelineDag(AnalyzerSettings.defaults());
    }

    public static PipelineDag create(AnalyzerSettings settings) {
        return new PipelineDag(settings);
    }

    /** Entry point for building a {@link JobGraph} job by job. */
    public static GraphBuilder builder(String pipelineName) {
        return GraphBuilder.create(pipelineName);
    }

    public AnalysisResult analyze(Map<String, Job> jobs) {
        return analyze("pipeline", jobs);
    }

    public AnalysisResult analyze(String pipelineName, Map<String, Job> jobs) {
        return analyze(GraphBuilder.create(pipelineName).jobs(jobs).build());
    }

    /**
     * Runs every pass over an already built graph. Stages, critical path and
     * parallel time are empty or zero when the graph has a cycle.
     */
    public AnalysisResult analyze(JobGraph jobGraph) {
        List<DependencyIssue> issues = ValidationPass.validate(jobGraph);

        List<List<String>> stages = scheduling.stages(jobGraph);
        CriticalPathResult criticalPath = scheduling.criticalPath(jobGraph);
        long serial = scheduling.serialTime(jobGraph);
        long parallel = scheduling.parallelTime(jobGraph, stages);
        List<String> bottlenecks = scheduling.bottlenecks(jobGraph, stages);
        List<OptimizationSuggestion> suggestions = advisor.suggest(jobGraph, stages, bottlenecks);

        if (!jobGraph.graph().isAcyclic())
            log.warn("{} has circular dependencies, scheduling analysis skipped", jobGraph.name());
        log.info("Analyzed {}: {} jobs, {} stages, {} issues, {} suggestions", jobGraph.name(),
                jobGraph.jobs().size(), stages.size(), issues.size(), suggestions.size());

        AnalysisResult result = new AnalysisResult(jobGraph.jobs(), jobGraph.graph().edges(), stages,
                criticalPath, serial, parallel, Collections.unmodifiableList(bottlenecks),
                Collections.unmodifiableList(issues), Collections.unmodifiableList(suggestions));
        if (log.isDebugEnabled())
            log.debug("{}\n{}", jobGraph.name(), new GraphExplain(result).dumpTopology());
        return result;
    }

    /**
     * Removes redundant declared dependencies, then intra-group edges of jobs
     * that could run in parallel. The change-log lists the redundancy removals
     * first.
     */
    public OptimizeResult optimize(Map<String, Job> jobs) {
        return optimize(GraphBuilder.create("pipeline").jobs(jobs).build());
    }

    public OptimizeResult optimize(JobGraph jobGraph) {
        OptimizeResult reduced = redundancy.optimize(jobGraph);
        OptimizeResult result = reduced.andThen(advisor.proposeEdgeRemovals(reduced.dependencies()));
        if (result.changed())
            log.info("Made {} dependency optimization(s) to {}", result.changes().size(), jobGraph.name());
        else
            log.info("No dependency optimizations needed for {}", jobGraph.name());
        return result;
    }
}
