package com.pipeline.dag.io;

import com.pipeline.dag.api.Job;
import com.pipeline.dag.api.Step;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a normalized job map from JSON into {@link Job} records.
 *
 * <p>
 * Expected layout:
 *
 * <pre>{@code
 * {
 *   "name": "ci",
 *   "jobs": {
 *     "build": { "runs-on": "ubuntu-latest", "steps": [ { "uses": "actions/checkout@v4" } ] },
 *     "test":  { "needs": "build", "steps": [ { "run": "npm test" } ] }
 *   }
 * }
 * }</pre>
 *
 * {@code needs} is passed through untouched; shape checks happen in
 * {@link com.pipeline.dag.GraphBuilder#normalizeNeeds(Object)}.
 */
public final class JobMapReader {
    private final ObjectMapper mapper;

    public JobMapReader() {
        this(new ObjectMapper());
    }

    public JobMapReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public WorkflowDefinition readDefinition(String json) {
        try {
            WorkflowDefinition def = mapper.readValue(json, WorkflowDefinition.class);
            if (def == null || def.getJobs() == null)
                throw new IllegalArgumentException("Missing 'jobs' key");
            return def;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed job map: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Job> read(String json) {
        return toJobs(readDefinition(json));
    }

    public Map<String, Job> read(Path path) {
        try {
            return read(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read job map from " + path, e);
        }
    }

    /** Converts a definition to job records, keeping the definition's job order. */
    public Map<String, Job> toJobs(WorkflowDefinition def) {
        Map<String, Job> jobs = new LinkedHashMap<>(def.getJobs().size() * 2);
        for (Map.Entry<String, WorkflowDefinition.JobDef> e : def.getJobs().entrySet()) {
            WorkflowDefinition.JobDef jd = e.getValue();
            if (jd == null)
                throw new IllegalArgumentException("Job '" + e.getKey() + "' has no definition");
            List<Step> steps = new ArrayList<>();
            if (jd.getSteps() != null) {
                for (WorkflowDefinition.StepDef sd : jd.getSteps()) {
                    if (sd == null)
                        throw new IllegalArgumentException("Job '" + e.getKey() + "' has a null step");
                    steps.add(new Step(sd.getName(), sd.getUses(), sd.getRun(), sd.getWith(), sd.getAttributes()));
                }
            }
            String runsOn = jd.getRunsOn() == null ? null : String.valueOf(jd.getRunsOn());
            jobs.put(e.getKey(), new Job(e.getKey(), jd.getNeeds(), steps, runsOn, jd.getMetadata()));
        }
        return jobs;
    }
}
