package com.pipeline.dag.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single step of a job, as supplied by the configuration normalizer.
 *
 * <p>
 * The engine only looks at {@code uses} (an action reference such as
 * {@code actions/setup-node@v4}) and {@code run} (shell command text) for
 * duration estimation, plus the serialized text of the whole step for the
 * deploy/release check. Every other step key ({@code if}, {@code env},
 * {@code id}, ...) travels in {@code attributes} and only takes part in that
 * check.
 */
public record Step(String name, String uses, String run, Map<String, Object> with, Map<String, Object> attributes) {

    public Step {
        with = copyOf(with);
        attributes = copyOf(attributes);
    }

    public Step(String name, String uses, String run, Map<String, Object> with) {
        this(name, uses, run, with, null);
    }

    public static Step uses(String action) {
        return new Step(null, action, null, null, null);
    }

    public static Step run(String command) {
        return new Step(null, null, command, null, null);
    }

    private static Map<String, Object> copyOf(Map<String, Object> map) {
        return map == null || map.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public boolean hasAction() {
        return uses != null;
    }

    public boolean hasCommand() {
        return run != null;
    }

    /** Flattened text of every field, used for keyword checks across the whole step. */
    public String serializedText() {
        StringBuilder sb = new StringBuilder(64);
        if (name != null)
            sb.append("name=").append(name).append(' ');
        if (uses != null)
            sb.append("uses=").append(uses).append(' ');
        if (run != null)
            sb.append("run=").append(run).append(' ');
        if (!with.isEmpty())
            sb.append("with=").append(with).append(' ');
        for (Map.Entry<String, Object> e : attributes.entrySet())
            sb.append(e.getKey()).append('=').append(e.getValue()).append(' ');
        return sb.toString();
    }
}
