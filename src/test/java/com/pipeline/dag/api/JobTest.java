package com.pipeline.dag.api;

import java.util.*;

import org.junit.Test;

import static org.junit.Assert.*;

public class JobTest {

    @Test
    public void testStepsCopiedOnConstruction() {
        List<Step> steps = new ArrayList<>(List.of(Step.run("echo a")));
        Job job = Job.of("build", null, steps);

        steps.add(Step.run("./deploy.sh"));
        steps.set(0, Step.run("make release"));

        assertEquals(List.of(Step.run("echo a")), job.steps());
    }

    @Test
    public void testMetadataCopiedOnConstruction() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timeout-minutes", 15);
        Job job = new Job("build", null, null, "ubuntu-latest", metadata);

        metadata.put("timeout-minutes", 90);
        metadata.put("environment", "production");

        assertEquals(Map.of("timeout-minutes", 15), job.metadata());
    }

    @Test
    public void testNullStepEntryKept() {
        Job job = Job.of("build", null, Arrays.asList(Step.run("make"), null));
        assertEquals(2, job.steps().size());
        assertNull(job.steps().get(1));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testStepsReadOnly() {
        Job.of("build", null, new ArrayList<>()).steps().add(Step.run("make"));
    }

    @Test
    public void testStepMapsCopiedOnConstruction() {
        Map<String, Object> with = new HashMap<>(Map.of("node-version", "20"));
        Map<String, Object> attributes = new HashMap<>(Map.of("id", "setup"));
        Step step = new Step(null, "actions/setup-node@v4", null, with, attributes);

        with.put("registry-url", "https://example.invalid");
        attributes.put("if", "startsWith(github.ref, 'refs/tags/release')");

        assertEquals(Map.of("node-version", "20"), step.with());
        assertEquals(Map.of("id", "setup"), step.attributes());
        assertTrue(step.serializedText().contains("id=setup"));
    }
}
