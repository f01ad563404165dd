package com.ttennebkram.pdpatch.model;

import com.ttennebkram.pdpatch.nodes.PatchNode;

/**
 * A node paired with one of its outlet numbers. Only a lookup pair; the
 * node is still resolved against the patcher when linking.
 */
public final class Outlet {

    private final PatchNode node;
    private final int index;

    public Outlet(PatchNode node, int index) {
        this.node = node;
        this.index = index;
    }

    public PatchNode getNode() {
        return node;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return node.getNodeName() + " outlet " + index;
    }
}
