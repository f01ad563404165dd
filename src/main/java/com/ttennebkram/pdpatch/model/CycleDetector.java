package com.ttennebkram.pdpatch.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies edges of a node graph with an iterative depth-first search.
 *
 * Nodes are visited in index order and neighbors in ascending order. An edge
 * to a node that is still on the search stack is a back edge; self-loops are
 * back edges too. Dropping every back edge leaves an acyclic graph. The search
 * keeps its own stack, so graph depth is not limited by the call stack.
 */
public final class CycleDetector {

    private static final int UNVISITED = 0;
    private static final int ON_STACK = 1;
    private static final int DONE = 2;

    private CycleDetector() {
    }

    /**
     * Result of one classification run.
     */
    public static final class Result {
        private final Set<Long> backEdges;
        private final List<CycleWarning> cycles;

        Result(Set<Long> backEdges, List<CycleWarning> cycles) {
            this.backEdges = backEdges;
            this.cycles = cycles;
        }

        public boolean isBackEdge(int from, int to) {
            return backEdges.contains(key(from, to));
        }

        public int getBackEdgeCount() {
            return backEdges.size();
        }

        public boolean hasCycles() {
            return !backEdges.isEmpty();
        }

        /** One warning per back edge, empty unless cycles were collected. */
        public List<CycleWarning> getCycles() {
            return cycles;
        }
    }

    private static long key(int from, int to) {
        return ((long) from << 32) | (to & 0xffffffffL);
    }

    /**
     * Distinct neighbors per node in ascending order. Edges touching a
     * skipped node are left out.
     */
    public static int[][] adjacency(int nodeCount, Collection<Connection> connections, boolean[] skip) {
        List<Set<Integer>> sets = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            sets.add(new TreeSet<>());
        }
        for (Connection c : connections) {
            if (skip != null && (skip[c.getSource()] || skip[c.getSink()])) {
                continue;
            }
            sets.get(c.getSource()).add(c.getSink());
        }
        int[][] adjacency = new int[nodeCount][];
        for (int i = 0; i < nodeCount; i++) {
            adjacency[i] = sets.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return adjacency;
    }

    /**
     * Find back edges.
     *
     * @param adjacency     sorted neighbor lists
     * @param skip          nodes to leave out, or null
     * @param collectCycles also report the node path of every cycle closed by a back edge
     */
    public static Result detect(int[][] adjacency, boolean[] skip, boolean collectCycles) {
        int n = adjacency.length;
        int[] state = new int[n];
        int[] cursor = new int[n];
        int[] stack = new int[n];
        int[] stackPos = new int[n];
        Set<Long> backEdges = new HashSet<>();
        List<CycleWarning> cycles = new ArrayList<>();

        for (int start = 0; start < n; start++) {
            if (state[start] != UNVISITED || (skip != null && skip[start])) {
                continue;
            }
            int sp = 0;
            stackPos[start] = sp;
            stack[sp++] = start;
            state[start] = ON_STACK;

            while (sp > 0) {
                int v = stack[sp - 1];
                if (cursor[v] < adjacency[v].length) {
                    int w = adjacency[v][cursor[v]++];
                    if (state[w] == ON_STACK) {
                        backEdges.add(key(v, w));
                        if (collectCycles) {
                            List<Integer> path = new ArrayList<>();
                            for (int i = stackPos[w]; i < sp; i++) {
                                path.add(stack[i]);
                            }
                            cycles.add(new CycleWarning(path));
                        }
                    } else if (state[w] == UNVISITED && (skip == null || !skip[w])) {
                        state[w] = ON_STACK;
                        stackPos[w] = sp;
                        stack[sp++] = w;
                    }
                } else {
                    state[v] = DONE;
                    sp--;
                }
            }
        }
        return new Result(backEdges, collectCycles ? cycles : List.of());
    }

    /** Convenience: classify the edges of a connection list over all nodes. */
    public static Result detect(int nodeCount, Collection<Connection> connections, boolean collectCycles) {
        boolean[] skip = new boolean[nodeCount];
        Arrays.fill(skip, false);
        return detect(adjacency(nodeCount, connections, skip), skip, collectCycles);
    }
}
