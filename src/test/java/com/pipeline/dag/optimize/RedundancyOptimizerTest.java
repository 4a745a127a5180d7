package com.pipeline.dag.optimize;

import com.pipeline.dag.GraphBuilder;
import com.pipeline.dag.JobFixtures;
import com.pipeline.dag.api.DependencyChange;
import com.pipeline.dag.api.Job;
import com.pipeline.dag.api.OptimizeResult;
import com.pipeline.dag.engine.DependencyGraph;
import com.pipeline.dag.engine.JobGraph;
import com.pipeline.dag.engine.SchedulingAnalyzer;
import com.pipeline.dag.config.AnalyzerSettings;

import java.util.*;

import org.junit.Test;

import static org.junit.Assert.*;

public class RedundancyOptimizerTest {
    private final RedundancyOptimizer optimizer = new RedundancyOptimizer();

    private static JobGraph build(Map<String, Job> jobs) {
        return GraphBuilder.create("test").jobs(jobs).build();
    }

    @Test
    public void testRemovesImpliedDependency() {
        OptimizeResult result = optimizer.optimize(build(JobFixtures.jobs("a", "b:a", "c:a,b")));

        assertEquals(List.of("b"), result.dependencies().get("c"));
        assertEquals(List.of("a"), result.dependencies().get("b"));
        assertEquals(List.of(), result.dependencies().get("a"));
        assertEquals(List.of(new DependencyChange("c", List.of("a"), DependencyChange.Reason.REDUNDANT_DEPENDENCY)),
                result.changes());
    }

    @Test
    public void testReachabilityAndScheduleUnchanged() {
        JobGraph original = build(JobFixtures.jobs("a", "b:a", "c:a,b"));
        OptimizeResult result = optimizer.optimize(original);
        DependencyGraph reduced = DependencyGraph.of(result.dependencies());

        assertTrue(reduced.descendants("a").contains("c"));
        assertEquals(original.graph().generations(), reduced.generations());

        SchedulingAnalyzer scheduling = new SchedulingAnalyzer(AnalyzerSettings.defaults());
        assertEquals(List.of("a", "b", "c"), scheduling.criticalPath(original).path());
    }

    @Test
    public void testRemovesSeveralInOneBatch() {
        // d declares a, b and c; c already depends on b which depends on a
        OptimizeResult result = optimizer.optimize(build(JobFixtures.jobs("a", "b:a", "c:b", "d:a,b,c")));
        assertEquals(List.of("c"), result.dependencies().get("d"));
        assertEquals(List.of("a", "b"), result.changes().get(0).removed());
        assertEquals(2, result.removedCount());
    }

    @Test
    public void testKeepsDanglingNames() {
        OptimizeResult result = optimizer.optimize(build(JobFixtures.jobs("a", "b:a", "c:ghost,a,b")));
        assertEquals(List.of("ghost", "b"), result.dependencies().get("c"));
    }

    @Test
    public void testNothingToRemove() {
        OptimizeResult result = optimizer.optimize(build(JobFixtures.jobs("build", "lint", "test:build",
                "package:build,lint")));
        assertFalse(result.changed());
        assertEquals(List.of("build", "lint"), result.dependencies().get("package"));
    }

    @Test
    public void testMutualCycleKeepsLastWitness() {
        // x and y depend on each other; n declares both. Only one of them may go.
        OptimizeResult result = optimizer.optimize(build(JobFixtures.jobs("x:y", "y:x", "n:x,y")));
        assertEquals(List.of("y"), result.dependencies().get("n"));
        assertEquals(List.of("x"), result.changes().get(0).removed());
    }

    @Test
    public void testInputMapNotMutated() {
        Map<String, List<String>> declared = new LinkedHashMap<>();
        declared.put("a", new ArrayList<>());
        declared.put("b", new ArrayList<>(List.of("a")));
        declared.put("c", new ArrayList<>(List.of("a", "b")));

        OptimizeResult result = optimizer.optimize(declared);
        assertEquals(List.of("a", "b"), declared.get("c"));
        assertNotSame(declared.get("c"), result.dependencies().get("c"));
        assertEquals(List.of("b"), result.dependencies().get("c"));
    }

    @Test
    public void testIdempotentOnRandomDags() {
        Random rnd = new Random(1234);
        for (int round = 0; round < 200; round++) {
            Map<String, Job> jobs = JobFixtures.randomDag(rnd, 2 + rnd.nextInt(12), 0.2 + rnd.nextDouble() * 0.6);
            JobGraph original = build(jobs);
            OptimizeResult once = optimizer.optimize(original);
            OptimizeResult twice = optimizer.optimize(once.dependencies());

            assertFalse("second pass removed " + twice.changes(), twice.changed());
            assertEquals(once.dependencies(), twice.dependencies());

            DependencyGraph reduced = DependencyGraph.of(once.dependencies());
            for (String job : jobs.keySet())
                assertEquals(original.graph().descendants(job), reduced.descendants(job));
        }
    }
}
