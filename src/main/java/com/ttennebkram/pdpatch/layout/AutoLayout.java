package com.ttennebkram.pdpatch.layout;

import com.ttennebkram.pdpatch.model.Connection;
import com.ttennebkram.pdpatch.model.CycleDetector;
import com.ttennebkram.pdpatch.nodes.PatchNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Layered layout following signal flow, sources on top.
 *
 * <ol>
 * <li>Back edges are found by {@link CycleDetector} and dropped, leaving an
 * acyclic graph.</li>
 * <li>Each node's layer is its longest-path distance from a source, computed
 * in topological order.</li>
 * <li>Rows after the first are ordered by the mean column of each node's
 * parents in the row above; nodes without such parents go last. Ties keep
 * node order.</li>
 * </ol>
 * Hidden nodes are left where they are. Every other node gets exactly one
 * position, whatever cycles the graph contains.
 */
public final class AutoLayout {

    private static final Logger LOGGER = Logger.getLogger(AutoLayout.class.getName());

    private AutoLayout() {
    }

    /**
     * Outcome of one layout run.
     */
    public static final class Result {
        private final int placedNodes;
        private final int rows;
        private final int brokenCycleEdges;

        Result(int placedNodes, int rows, int brokenCycleEdges) {
            this.placedNodes = placedNodes;
            this.rows = rows;
            this.brokenCycleEdges = brokenCycleEdges;
        }

        public int getPlacedNodes() {
            return placedNodes;
        }

        public int getRows() {
            return rows;
        }

        /** Back edges ignored to break cycles. */
        public int getBrokenCycleEdges() {
            return brokenCycleEdges;
        }
    }

    public static Result apply(List<PatchNode> nodes, List<Connection> connections, AutoLayoutOptions options) {
        int n = nodes.size();
        if (n == 0) {
            return new Result(0, 0, 0);
        }
        boolean[] hidden = new boolean[n];
        for (int i = 0; i < n; i++) {
            hidden[i] = nodes.get(i).isHidden();
        }

        int[][] adjacency = CycleDetector.adjacency(n, connections, hidden);
        CycleDetector.Result cycles = CycleDetector.detect(adjacency, hidden, false);
        if (cycles.hasCycles()) {
            LOGGER.warning("Auto-layout ignored " + cycles.getBackEdgeCount() + " cycle edge(s)");
        }

        // Acyclic graph without back edges
        List<List<Integer>> dagOut = new ArrayList<>(n);
        List<List<Integer>> parents = new ArrayList<>(n);
        int[] indegree = new int[n];
        for (int i = 0; i < n; i++) {
            dagOut.add(new ArrayList<>());
            parents.add(new ArrayList<>());
        }
        for (int v = 0; v < n; v++) {
            for (int w : adjacency[v]) {
                parents.get(w).add(v);
                if (!cycles.isBackEdge(v, w)) {
                    dagOut.get(v).add(w);
                    indegree[w]++;
                }
            }
        }

        int[] layer = longestPathLayers(n, hidden, dagOut, indegree);

        TreeMap<Integer, List<Integer>> rows = new TreeMap<>();
        int placed = 0;
        for (int i = 0; i < n; i++) {
            if (!hidden[i]) {
                rows.computeIfAbsent(layer[i], k -> new ArrayList<>()).add(i);
                placed++;
            }
        }

        if (options.isAlignColumns()) {
            alignRows(rows, parents);
        }

        for (Map.Entry<Integer, List<Integer>> entry : rows.entrySet()) {
            int y = options.getMargin() + entry.getKey() * options.getRowSpacing();
            List<Integer> row = entry.getValue();
            for (int col = 0; col < row.size(); col++) {
                nodes.get(row.get(col)).setPosition(options.getMargin() + col * options.getColumnSpacing(), y);
            }
        }

        Result result = new Result(placed, rows.size(), cycles.getBackEdgeCount());
        LOGGER.fine(() -> "Auto-layout placed " + result.getPlacedNodes() + " nodes in " + result.getRows() + " rows");
        return result;
    }

    /** Kahn's algorithm over the acyclic graph; every visible node is reached. */
    private static int[] longestPathLayers(int n, boolean[] hidden, List<List<Integer>> dagOut, int[] indegree) {
        int[] layer = new int[n];
        int[] remaining = indegree.clone();
        Deque<Integer> queue = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (!hidden[i] && remaining[i] == 0) {
                queue.add(i);
            }
        }
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int w : dagOut.get(v)) {
                layer[w] = Math.max(layer[w], layer[v] + 1);
                if (--remaining[w] == 0) {
                    queue.add(w);
                }
            }
        }
        return layer;
    }

    private static void alignRows(TreeMap<Integer, List<Integer>> rows, List<List<Integer>> parents) {
        List<Integer> previous = null;
        for (List<Integer> row : rows.values()) {
            if (previous != null) {
                Map<Integer, Integer> columnOf = new HashMap<>();
                for (int c = 0; c < previous.size(); c++) {
                    columnOf.put(previous.get(c), c);
                }
                Map<Integer, Double> key = new HashMap<>();
                for (int node : row) {
                    double sum = 0;
                    int count = 0;
                    for (int p : parents.get(node)) {
                        Integer c = columnOf.get(p);
                        if (c != null) {
                            sum += c;
                            count++;
                        }
                    }
                    key.put(node, count == 0 ? Double.POSITIVE_INFINITY : sum / count);
                }
                // stable: equal keys keep node order
                row.sort(Comparator.comparing(key::get));
            }
            previous = row;
        }
    }
}
