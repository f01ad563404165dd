package com.ttennebkram.pdpatch.optimize;

import com.google.gson.annotations.SerializedName;

/**
 * Counts reported by one {@link PatchOptimizer} run. Nested subpatch runs
 * are added in when optimizing recursively.
 */
public class OptimizeStats {

    @SerializedName("nodes_removed")
    int nodesRemoved;

    @SerializedName("connections_removed")
    int connectionsRemoved;

    @SerializedName("duplicates_removed")
    int duplicatesRemoved;

    @SerializedName("pass_throughs_collapsed")
    int passThroughsCollapsed;

    @SerializedName("subpatches_optimized")
    int subpatchesOptimized;

    public int getNodesRemoved() {
        return nodesRemoved;
    }

    /** Connection count before minus after, bypass connections included. */
    public int getConnectionsRemoved() {
        return connectionsRemoved;
    }

    public int getDuplicatesRemoved() {
        return duplicatesRemoved;
    }

    public int getPassThroughsCollapsed() {
        return passThroughsCollapsed;
    }

    public int getSubpatchesOptimized() {
        return subpatchesOptimized;
    }

    /** Check if the run changed anything. */
    public boolean isEmpty() {
        return nodesRemoved == 0 && connectionsRemoved == 0 && duplicatesRemoved == 0
                && passThroughsCollapsed == 0;
    }

    void add(OptimizeStats other) {
        nodesRemoved += other.nodesRemoved;
        connectionsRemoved += other.connectionsRemoved;
        duplicatesRemoved += other.duplicatesRemoved;
        passThroughsCollapsed += other.passThroughsCollapsed;
        subpatchesOptimized += other.subpatchesOptimized;
    }

    @Override
    public String toString() {
        return "OptimizeStats{nodesRemoved=" + nodesRemoved
                + ", connectionsRemoved=" + connectionsRemoved
                + ", duplicatesRemoved=" + duplicatesRemoved
                + ", passThroughsCollapsed=" + passThroughsCollapsed
                + ", subpatchesOptimized=" + subpatchesOptimized + "}";
    }
}
