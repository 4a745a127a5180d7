package com.pipeline.dag.util;

import com.pipeline.dag.PipelineDag;
import com.pipeline.dag.api.AnalysisResult;
import com.pipeline.dag.api.Job;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Analyzes many independent pipelines concurrently.
 *
 * <p>
 * Each pipeline is one {@link PipelineDag#analyze(String, Map)} call on a
 * worker thread. Calls share no state, so the only coordination is collecting
 * outcomes. An optional time budget starts when a pipeline's analysis starts;
 * a pipeline over budget is reported {@link Status#INCOMPLETE} and its late
 * result, if any, is discarded. Anything thrown by an analysis, {@link Error}s
 * included, becomes a {@link Status#FAILED} outcome.
 */
public final class BatchAnalyzer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BatchAnalyzer.class);

    public enum Status {
        COMPLETED,
        INCOMPLETE,
        FAILED
    }

    /**
     * Outcome for one pipeline. {@code result} is set only when
     * {@code COMPLETED}, {@code error} only when {@code FAILED}.
     */
    public record Outcome(String pipeline, Status status, AnalysisResult result, Throwable error) {
    }

    private final PipelineDag dag;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;

    public BatchAnalyzer(PipelineDag dag, int threads) {
        if (threads <= 0)
            throw new IllegalArgumentException("threads must be positive, got " + threads);
        this.dag = dag;
        this.workers = Executors.newFixedThreadPool(threads, daemonFactory("dag-batch-"));
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonFactory("dag-batch-timer-"));
    }

    /** Analyzes every pipeline without a time budget. */
    public Map<String, Outcome> analyzeAll(Map<String, Map<String, Job>> pipelines) {
        return analyzeAll(pipelines, null);
    }

    /**
     * Analyzes every pipeline and waits for all outcomes.
     *
     * @param pipelines pipeline name to job map
     * @param budget    per-pipeline time budget, or null for none
     * @return outcomes keyed by pipeline name, in input order
     */
    public Map<String, Outcome> analyzeAll(Map<String, Map<String, Job>> pipelines, Duration budget) {
        Map<String, CompletableFuture<AnalysisResult>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Job>> e : pipelines.entrySet())
            futures.put(e.getKey(), submit(e.getKey(), e.getValue(), budget));

        Map<String, Outcome> outcomes = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<AnalysisResult>> e : futures.entrySet())
            outcomes.put(e.getKey(), await(e.getKey(), e.getValue()));
        return outcomes;
    }

    private CompletableFuture<AnalysisResult> submit(String name, Map<String, Job> jobs, Duration budget) {
        CompletableFuture<AnalysisResult> future = new CompletableFuture<>();
        workers.execute(() -> {
            ScheduledFuture<?> deadline = budget == null ? null
                    : timer.schedule(() -> future.completeExceptionally(new TimeoutException(name)),
                            budget.toNanos(), TimeUnit.NANOSECONDS);
            try {
                future.complete(dag.analyze(name, jobs));
            } catch (Throwable t) {
                // Errors included: the future must always complete
                future.completeExceptionally(t);
            } finally {
                if (deadline != null)
                    deadline.cancel(false);
            }
        });
        return future;
    }

    private static Outcome await(String name, CompletableFuture<AnalysisResult> future) {
        try {
            return new Outcome(name, Status.COMPLETED, future.join(), null);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.warn("Analysis of {} exceeded its time budget", name);
                return new Outcome(name, Status.INCOMPLETE, null, null);
            }
            log.error("Analysis of {} failed", name, cause);
            return new Outcome(name, Status.FAILED, null, cause);
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        ThreadFactory base = Executors.defaultThreadFactory();
        return r -> {
            Thread t = base.newThread(r);
            t.setName(prefix + t.getName());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        workers.shutdownNow();
        timer.shutdownNow();
    }
}
