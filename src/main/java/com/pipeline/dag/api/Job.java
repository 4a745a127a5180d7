package com.pipeline.dag.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A job record handed over by the configuration normalizer.
 *
 * <p>
 * {@code needs} is the raw dependency declaration and may be a single name
 * ({@code String}), a list of names or {@code {job: name}} mappings, or a
 * mapping whose keys are names. It is normalized exactly once, by
 * {@link com.pipeline.dag.GraphBuilder#normalizeNeeds(Object)}.
 *
 * @param name     unique job name
 * @param needs    raw dependency declaration, may be null
 * @param steps    ordered steps
 * @param runsOn   runner identifier, ignored by the engine
 * @param metadata pass-through attributes, ignored by the engine
 */
public record Job(String name, Object needs, List<Step> steps, String runsOn, Map<String, Object> metadata) {

    public Job {
        // copies keep null entries so GraphBuilder can reject them by job name
        steps = steps == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(steps));
        metadata = metadata == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Job of(String name, Object needs) {
        return new Job(name, needs, null, null, null);
    }

    public static Job of(String name, Object needs, List<Step> steps) {
        return new Job(name, needs, steps, null, null);
    }
}
