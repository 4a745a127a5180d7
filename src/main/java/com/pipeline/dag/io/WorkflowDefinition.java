package com.pipeline.dag.io;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a normalized pipeline: a name and a job map.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkflowDefinition {
    private String name;
    private LinkedHashMap<String, JobDef> jobs;

    /** Definition of a single job. Unknown attributes land in {@code metadata}. */
    @Data
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class JobDef {
        private Object needs;
        @JsonProperty("runs-on")
        private Object runsOn;
        private List<StepDef> steps;
        private Map<String, Object> metadata = new LinkedHashMap<>();

        @JsonAnySetter
        public void putMetadata(String key, Object value) {
            metadata.put(key, value);
        }
    }

    /** Definition of a single step. Keys other than the four known ones land in {@code attributes}. */
    @Data
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class StepDef {
        private String name, uses, run;
        private Map<String, Object> with;
        private Map<String, Object> attributes = new LinkedHashMap<>();

        @JsonAnySetter
        public void putAttribute(String key, Object value) {
            attributes.put(key, value);
        }
    }
}
