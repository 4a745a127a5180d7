package com.pipeline.dag.api;

import java.util.List;
import java.util.Set;

/**
 * A job after normalization and estimation.
 *
 * @param name              job name
 * @param dependencies      normalized declared dependency names, in declaration
 *                          order, including names that do not resolve to a job
 * @param steps             the job's steps
 * @param estimatedDuration heuristic duration in seconds
 * @param canParallelize    false when a step looks like a deploy or release
 */
public record AnalyzedJob(String name, Set<String> dependencies, List<Step> steps,
        int estimatedDuration, boolean canParallelize) {

    public int stepCount() {
        return steps.size();
    }
}
