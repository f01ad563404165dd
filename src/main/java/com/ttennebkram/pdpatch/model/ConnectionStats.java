package com.ttennebkram.pdpatch.model;

/**
 * Summary of a patcher's wiring.
 */
public class ConnectionStats {

    public final int totalConnections;
    public final int nodesWithConnections;
    public final int maxInletUsed;
    public final int maxOutletUsed;
    // Percentage of nodes with a known inlet or outlet count, one decimal
    public final double validationCoverage;

    public ConnectionStats(int totalConnections, int nodesWithConnections,
                           int maxInletUsed, int maxOutletUsed, double validationCoverage) {
        this.totalConnections = totalConnections;
        this.nodesWithConnections = nodesWithConnections;
        this.maxInletUsed = maxInletUsed;
        this.maxOutletUsed = maxOutletUsed;
        this.validationCoverage = validationCoverage;
    }

    @Override
    public String toString() {
        return "ConnectionStats{total=" + totalConnections + ", nodes=" + nodesWithConnections
                + ", maxInlet=" + maxInletUsed + ", maxOutlet=" + maxOutletUsed
                + ", coverage=" + validationCoverage + "}";
    }
}
