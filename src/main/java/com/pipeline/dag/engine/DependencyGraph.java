package com.pipeline.dag.engine;

import com.pipeline.dag.api.DependencyEdge;

import java.util.*;

/**
 * DependencyGraph -- CSR-encoded directed graph over job names.
 *
 * <p>
 * An edge {@code a -> b} means job {@code b} needs job {@code a}. The graph is
 * immutable once built and may contain cycles; {@link #isAcyclic()} tells the
 * caller whether the generation and topological queries are meaningful.
 *
 * <p>
 * Data layout: nodes are numbered in insertion order. Successors of node
 * {@code i} are {@code childrenList[childrenOffset[i] .. childrenOffset[i+1])},
 * predecessors are stored the same way in {@code parentList}. Both directions
 * are kept because ancestor closure walks edges backwards while generation
 * peeling and longest-path relaxation walk them forwards.
 *
 * <p>
 * Generations (Kahn peeling) are computed once in {@link Builder#build()}.
 */
public final class DependencyGraph {
    private final String[] names;
    private final Map<String, Integer> nameToIndex;

    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentOffset;
    private final int[] parentList;

    // Null when the graph has a cycle.
    private final int[][] generations;

    private DependencyGraph(String[] names, Map<String, Integer> nameToIndex, int[] childrenOffset,
            int[] childrenList, int[] parentOffset, int[] parentList, int[][] generations) {
        this.names = names;
        this.nameToIndex = nameToIndex;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentOffset = parentOffset;
        this.parentList = parentList;
        this.generations = generations;
    }

    public int nodeCount() {
        return names.length;
    }

    public int edgeCount() {
        return childrenList.length;
    }

    public String name(int i) {
        return names[i];
    }

    /** Node names in insertion order. */
    public List<String> names() {
        return List.of(names);
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    /** Resolves a job name to its node index. */
    public int index(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown job: " + name);
        return idx;
    }

    public int childCount(int i) {
        return childrenOffset[i + 1] - childrenOffset[i];
    }

    public int child(int i, int k) {
        return childrenList[childrenOffset[i] + k];
    }

    public int parentCount(int i) {
        return parentOffset[i + 1] - parentOffset[i];
    }

    public int parent(int i, int k) {
        return parentList[parentOffset[i] + k];
    }

    public int outDegree(String name) {
        return childCount(index(name));
    }

    public int inDegree(String name) {
        return parentCount(index(name));
    }

    public boolean hasEdge(String from, String to) {
        if (!contains(from) || !contains(to))
            return false;
        int f = index(from), t = index(to);
        for (int k = childrenOffset[f]; k < childrenOffset[f + 1]; k++)
            if (childrenList[k] == t)
                return true;
        return false;
    }

    public List<String> successors(String name) {
        int i = index(name);
        List<String> out = new ArrayList<>(childCount(i));
        for (int k = 0; k < childCount(i); k++)
            out.add(names[child(i, k)]);
        return out;
    }

    public Set<String> predecessors(String name) {
        int i = index(name);
        Set<String> out = new LinkedHashSet<>();
        for (int k = 0; k < parentCount(i); k++)
            out.add(names[parent(i, k)]);
        return out;
    }

    /** All edges, grouped by source node in insertion order. */
    public List<DependencyEdge> edges() {
        List<DependencyEdge> out = new ArrayList<>(edgeCount());
        for (int i = 0; i < names.length; i++)
            for (int k = 0; k < childCount(i); k++)
                out.add(new DependencyEdge(names[i], names[child(i, k)]));
        return out;
    }

    /** Every node that can reach {@code name}, excluding {@code name} itself unless it sits on a cycle. */
    public Set<String> ancestors(String name) {
        return closure(index(name), -1, false);
    }

    /**
     * Ancestors of {@code name} found without passing through {@code excluded}.
     * {@code excluded} is never part of the result.
     */
    public Set<String> ancestorsAvoiding(String name, String excluded) {
        return closure(index(name), contains(excluded) ? index(excluded) : -1, false);
    }

    /** Every node reachable from {@code name}. */
    public Set<String> descendants(String name) {
        return closure(index(name), -1, true);
    }

    private Set<String> closure(int start, int excluded, boolean forward) {
        boolean[] seen = new boolean[names.length];
        int[] stack = new int[names.length];
        int top = 0;
        Set<String> out = new LinkedHashSet<>();
        stack[top++] = start;
        while (top > 0) {
            int curr = stack[--top];
            int n = forward ? childCount(curr) : parentCount(curr);
            for (int k = 0; k < n; k++) {
                int next = forward ? child(curr, k) : parent(curr, k);
                if (next == excluded || seen[next])
                    continue;
                seen[next] = true;
                out.add(names[next]);
                stack[top++] = next;
            }
        }
        return out;
    }

    public boolean isAcyclic() {
        return generations != null;
    }

    /**
     * Kahn generations: each stage holds the nodes whose predecessors all sit in
     * earlier stages. Empty when the graph has a cycle.
     */
    public List<List<String>> generations() {
        if (generations == null)
            return List.of();
        List<List<String>> out = new ArrayList<>(generations.length);
        for (int[] gen : generations) {
            List<String> stage = new ArrayList<>(gen.length);
            for (int i : gen)
                stage.add(names[i]);
            out.add(Collections.unmodifiableList(stage));
        }
        return Collections.unmodifiableList(out);
    }

    /** Node indices in topological order (concatenated generations). */
    public int[] topologicalIndices() {
        if (generations == null)
            throw new IllegalStateException("Graph has a cycle, no topological order exists");
        int[] order = new int[names.length];
        int pos = 0;
        for (int[] gen : generations)
            for (int i : gen)
                order[pos++] = i;
        return order;
    }

    public List<String> topologicalOrder() {
        int[] order = topologicalIndices();
        List<String> out = new ArrayList<>(order.length);
        for (int i : order)
            out.add(names[i]);
        return out;
    }

    /**
     * Enumerates every simple cycle exactly once. Each cycle starts at its
     * lowest-indexed member and follows edge direction. Self-loops are reported
     * as single-member cycles.
     *
     * <p>
     * For each start node {@code s} the walk is limited to nodes with index
     * {@code >= s} that can get back to {@code s} through such nodes, so starts
     * that lie on no remaining cycle cost one reverse step. The walk keeps its
     * own path and child cursors instead of recursing, so path length is bounded
     * by the node count, not the thread stack.
     */
    public List<List<String>> simpleCycles() {
        List<List<String>> cycles = new ArrayList<>();
        if (isAcyclic())
            return cycles;
        int n = names.length;
        boolean[] reachesStart = new boolean[n];
        boolean[] onPath = new boolean[n];
        int[] touched = new int[n];
        int[] path = new int[n];
        int[] cursor = new int[n];
        for (int s = 0; s < n; s++) {
            int marked = markReachingStart(s, reachesStart, touched);
            if (reachesStart[s])
                walkCycles(s, reachesStart, onPath, path, cursor, cycles);
            for (int i = 0; i < marked; i++)
                reachesStart[touched[i]] = false;
        }
        return cycles;
    }

    // Marks every node >= start that reaches start through nodes >= start. Returns how many were marked.
    private int markReachingStart(int start, boolean[] reachesStart, int[] touched) {
        int size = 0;
        int head = 0;
        int curr = start;
        while (true) {
            for (int k = 0; k < parentCount(curr); k++) {
                int p = parent(curr, k);
                if (p >= start && !reachesStart[p]) {
                    reachesStart[p] = true;
                    touched[size++] = p;
                }
            }
            if (head == size)
                return size;
            curr = touched[head++];
        }
    }

    private void walkCycles(int start, boolean[] reachesStart, boolean[] onPath, int[] path, int[] cursor,
            List<List<String>> cycles) {
        int depth = 0;
        path[0] = start;
        cursor[0] = 0;
        onPath[start] = true;
        while (depth >= 0) {
            int curr = path[depth];
            if (cursor[depth] == childCount(curr)) {
                onPath[curr] = false;
                depth--;
                continue;
            }
            int next = child(curr, cursor[depth]++);
            if (next == start) {
                List<String> cycle = new ArrayList<>(depth + 1);
                for (int i = 0; i <= depth; i++)
                    cycle.add(names[path[i]]);
                cycles.add(cycle);
            } else if (reachesStart[next] && !onPath[next]) {
                onPath[next] = true;
                path[++depth] = next;
                cursor[depth] = 0;
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Graph of a job-to-dependency-names map. Names that are not keys of the
     * map are skipped.
     */
    public static DependencyGraph of(Map<String, ? extends Collection<String>> dependencies) {
        Builder b = builder();
        for (String job : dependencies.keySet())
            b.addNode(job);
        for (Map.Entry<String, ? extends Collection<String>> e : dependencies.entrySet())
            for (String dep : e.getValue())
                if (dependencies.containsKey(dep))
                    b.addEdge(dep, e.getKey());
        return b.build();
    }

    /**
     * Builder for DependencyGraph. Duplicate edges are collapsed; self-edges are
     * kept so that cycle detection can report them.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<Set<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(String name) {
            if (name == null)
                throw new IllegalArgumentException("Node name must not be null");
            if (nameToIdx.containsKey(name))
                throw new IllegalArgumentException("Duplicate node name: " + name);
            nameToIdx.put(name, nodes.size());
            nodes.add(name);
            forwardEdges.add(new LinkedHashSet<>());
            return this;
        }

        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return idx;
        }

        public DependencyGraph build() {
            int n = nodes.size();

            // 1. Forward CSR
            int[] childOffsets = new int[n + 1];
            int[] inDegree = new int[n];
            for (int i = 0; i < n; i++) {
                childOffsets[i + 1] = childOffsets[i] + forwardEdges.get(i).size();
                for (int c : forwardEdges.get(i))
                    inDegree[c]++;
            }
            int[] children = new int[childOffsets[n]];
            for (int i = 0; i < n; i++) {
                int pos = childOffsets[i];
                for (int c : forwardEdges.get(i))
                    children[pos++] = c;
            }

            // 2. Reverse CSR, parents ordered by source index
            int[] parentOffsets = new int[n + 1];
            for (int i = 0; i < n; i++)
                parentOffsets[i + 1] = parentOffsets[i] + inDegree[i];
            int[] parents = new int[children.length];
            int[] fill = Arrays.copyOf(parentOffsets, n);
            for (int i = 0; i < n; i++)
                for (int c : forwardEdges.get(i))
                    parents[fill[c]++] = i;

            // 3. Kahn peeling into generations, each in insertion order
            int[] remaining = inDegree.clone();
            List<int[]> gens = new ArrayList<>();
            int[] current = new int[n];
            int size = 0;
            for (int i = 0; i < n; i++)
                if (remaining[i] == 0)
                    current[size++] = i;
            int placed = 0;
            while (size > 0) {
                int[] gen = Arrays.copyOf(current, size);
                Arrays.sort(gen);
                gens.add(gen);
                placed += size;
                size = 0;
                for (int node : gen)
                    for (int k = childOffsets[node]; k < childOffsets[node + 1]; k++)
                        if (--remaining[children[k]] == 0)
                            current[size++] = children[k];
            }
            int[][] generations = placed == n ? gens.toArray(new int[0][]) : null;

            return new DependencyGraph(nodes.toArray(new String[0]), new HashMap<>(nameToIdx),
                    childOffsets, children, parentOffsets, parents, generations);
        }
    }
}
