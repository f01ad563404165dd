package com.ttennebkram.pdpatch.model;

/**
 * A node index or node reference is not part of the patcher.
 */
public class NodeNotFoundException extends PatchConnectionException {

    private final int index;

    public NodeNotFoundException(int index, int nodeCount) {
        super("No node at index " + index + " (patch has " + nodeCount + " nodes)");
        this.index = index;
    }

    public NodeNotFoundException(String nodeName) {
        super("Node " + nodeName + " is not in this patch");
        this.index = -1;
    }

    /** The missing index, or -1 when a node reference was not found. */
    public int getIndex() {
        return index;
    }
}
