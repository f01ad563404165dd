package com.ttennebkram.pdpatch.model;

import java.util.List;

/**
 * A directed cycle among patch nodes. Cycles are legal feedback paths, so
 * this is reported, never thrown.
 */
public final class CycleWarning {

    private final List<Integer> nodes;

    /** {@code nodes} lists the cycle in path order; the last links back to the first. */
    public CycleWarning(List<Integer> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public List<Integer> getNodes() {
        return nodes;
    }

    public boolean isSelfLoop() {
        return nodes.size() == 1;
    }

    public String getMessage() {
        StringBuilder sb = new StringBuilder("Cycle: ");
        for (int index : nodes) {
            sb.append(index).append(" -> ");
        }
        return sb.append(nodes.get(0)).toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CycleWarning && nodes.equals(((CycleWarning) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
