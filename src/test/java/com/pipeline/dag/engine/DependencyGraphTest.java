package com.pipeline.dag.engine;

import com.pipeline.dag.api.DependencyEdge;

import java.util.*;

import org.junit.Test;

import static org.junit.Assert.*;

public class DependencyGraphTest {

    @Test
    public void testEmptyGraph() {
        DependencyGraph g = DependencyGraph.builder().build();
        assertEquals(0, g.nodeCount());
        assertTrue(g.isAcyclic());
        assertEquals(List.of(), g.generations());
        assertEquals(List.of(), g.simpleCycles());
    }

    @Test
    public void testSingleNode() {
        DependencyGraph g = DependencyGraph.builder().addNode("A").build();

        assertEquals(1, g.nodeCount());
        assertEquals("A", g.name(0));
        assertEquals(0, g.index("A"));
        assertEquals(0, g.childCount(0));
        assertEquals(0, g.parentCount(0));
        assertEquals(List.of(List.of("A")), g.generations());
    }

    @Test
    public void testLinearGraph() {
        // A -> B -> C
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("B").addNode("C")
                .addEdge("A", "B")
                .addEdge("B", "C")
                .build();

        assertEquals(3, g.nodeCount());
        assertEquals(2, g.edgeCount());
        assertEquals(List.of("A", "B", "C"), g.topologicalOrder());
        assertEquals(List.of(List.of("A"), List.of("B"), List.of("C")), g.generations());

        assertEquals(1, g.outDegree("A"));
        assertEquals(0, g.outDegree("C"));
        assertEquals(1, g.inDegree("C"));
        assertTrue(g.hasEdge("A", "B"));
        assertFalse(g.hasEdge("A", "C"));
        assertEquals(Set.of("A", "B"), g.ancestors("C"));
        assertEquals(Set.of("B", "C"), g.descendants("A"));
        assertEquals(List.of(new DependencyEdge("A", "B"), new DependencyEdge("B", "C")), g.edges());
    }

    @Test
    public void testDiamondGraph() {
        // A
        // / \
        // B C
        // \ /
        // D
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .addEdge("C", "D")
                .build();

        assertEquals(List.of(List.of("A"), List.of("B", "C"), List.of("D")), g.generations());
        assertEquals(Set.of("B", "C"), g.predecessors("D"));
        assertEquals(List.of("B", "C"), g.successors("A"));
        assertEquals(Set.of("A", "B", "C"), g.ancestors("D"));
    }

    @Test
    public void testDisjointGraphs() {
        // A -> B
        // C -> D
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "B")
                .addEdge("C", "D")
                .build();

        assertEquals(List.of(List.of("A", "C"), List.of("B", "D")), g.generations());
        assertTrue(Collections.disjoint(g.descendants("A"), g.descendants("C")));
    }

    @Test
    public void testGenerationKeepsInsertionOrder() {
        // D is released before C but was added after it
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "D")
                .addEdge("B", "C")
                .build();

        assertEquals(List.of(List.of("A", "B"), List.of("C", "D")), g.generations());
        assertEquals(List.of("A", "B", "C", "D"), g.topologicalOrder());
    }

    @Test
    public void testDuplicateEdgeCollapsed() {
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("B")
                .addEdge("A", "B")
                .addEdge("A", "B")
                .build();
        assertEquals(1, g.edgeCount());
        assertEquals(1, g.inDegree("B"));
    }

    @Test
    public void testCycleHasNoGenerations() {
        // A -> B -> C -> A
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("B").addNode("C")
                .addEdge("A", "B")
                .addEdge("B", "C")
                .addEdge("C", "A")
                .build();

        assertFalse(g.isAcyclic());
        assertEquals(List.of(), g.generations());
        assertEquals(List.of(List.of("A", "B", "C")), g.simpleCycles());
    }

    @Test(expected = IllegalStateException.class)
    public void testCycleHasNoTopologicalOrder() {
        DependencyGraph.builder()
                .addNode("A").addNode("B")
                .addEdge("A", "B")
                .addEdge("B", "A")
                .build()
                .topologicalOrder();
    }

    @Test
    public void testSelfLoopIsSingleMemberCycle() {
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A")
                .addEdge("A", "A")
                .build();

        assertFalse(g.isAcyclic());
        assertEquals(List.of(List.of("A")), g.simpleCycles());
    }

    @Test
    public void testEveryCycleEnumeratedOnce() {
        // A <-> B, B <-> C, A -> C -> A
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("B").addNode("C")
                .addEdge("A", "B").addEdge("B", "A")
                .addEdge("B", "C").addEdge("C", "B")
                .addEdge("A", "C").addEdge("C", "A")
                .build();

        List<List<String>> cycles = g.simpleCycles();
        // two 2-cycles through A, one 2-cycle B-C, and the two directed triangles
        assertEquals(5, cycles.size());
        assertEquals(5, new HashSet<>(cycles).size());
        assertTrue(cycles.contains(List.of("A", "B")));
        assertTrue(cycles.contains(List.of("A", "C")));
        assertTrue(cycles.contains(List.of("B", "C")));
        assertTrue(cycles.contains(List.of("A", "B", "C")));
        assertTrue(cycles.contains(List.of("A", "C", "B")));
    }

    @Test
    public void testCycleWithDeadEndBranches() {
        // A -> B -> C -> A, with B -> D -> E and E -> D hanging off the cycle
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("B").addNode("C").addNode("D").addNode("E")
                .addEdge("A", "B").addEdge("B", "C").addEdge("C", "A")
                .addEdge("B", "D").addEdge("D", "E").addEdge("E", "D")
                .build();

        assertEquals(List.of(List.of("A", "B", "C"), List.of("D", "E")), g.simpleCycles());
    }

    @Test
    public void testLongSingleCycle() {
        int n = 200_000;
        DependencyGraph.Builder b = DependencyGraph.builder();
        for (int i = 0; i < n; i++)
            b.addNode("j" + i);
        for (int i = 0; i < n; i++)
            b.addEdge("j" + i, "j" + ((i + 1) % n));
        DependencyGraph g = b.build();

        List<List<String>> cycles = g.simpleCycles();
        assertEquals(1, cycles.size());
        assertEquals(n, cycles.get(0).size());
        assertEquals("j0", cycles.get(0).get(0));
        assertEquals("j" + (n - 1), cycles.get(0).get(n - 1));
    }

    @Test
    public void testAncestorsAvoidingSkipsExcludedNode() {
        // A -> X -> B
        DependencyGraph g = DependencyGraph.builder()
                .addNode("A").addNode("X").addNode("B")
                .addEdge("A", "X")
                .addEdge("X", "B")
                .build();

        assertEquals(Set.of("A", "X"), g.ancestors("B"));
        assertEquals(Set.of(), g.ancestorsAvoiding("B", "X"));
        assertEquals(Set.of("A", "X"), g.ancestorsAvoiding("B", "not-a-node"));
    }

    @Test
    public void testOfSkipsUnknownNames() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("build", List.of());
        deps.put("test", List.of("build", "ghost"));

        DependencyGraph g = DependencyGraph.of(deps);
        assertEquals(2, g.nodeCount());
        assertEquals(1, g.edgeCount());
        assertFalse(g.contains("ghost"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeException() {
        DependencyGraph.builder()
                .addNode("A")
                .addNode("A");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeSourceException() {
        DependencyGraph.builder()
                .addNode("B")
                .addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeTargetException() {
        DependencyGraph.builder()
                .addNode("A")
                .addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidIndexLookup() {
        DependencyGraph g = DependencyGraph.builder().addNode("A").build();
        g.index("UNKNOWN");
    }
}
