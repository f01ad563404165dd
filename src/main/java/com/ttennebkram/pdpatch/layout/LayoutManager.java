package com.ttennebkram.pdpatch.layout;

import com.ttennebkram.pdpatch.nodes.PatchNode;
import com.ttennebkram.pdpatch.tree.Position;

/**
 * Flow layout: places nodes top to bottom in the order they are added.
 *
 * The manager remembers the first node of the current row (the row head) and
 * the last node placed (the row tail). A new row goes below the row head; a
 * node on the same row goes right of the row tail. Subclasses override
 * {@link #computePosition} and {@link #registerNode} for other strategies.
 */
public class LayoutManager {

    public static final int DEFAULT_MARGIN = 25;
    public static final int ROW_HEIGHT = 25;
    public static final int COLUMN_WIDTH = 50;

    protected final int margin;
    protected final int rowHeight;
    protected final int columnWidth;

    protected PatchNode rowHead;
    protected PatchNode rowTail;

    public LayoutManager() {
        this(DEFAULT_MARGIN, ROW_HEIGHT, COLUMN_WIDTH);
    }

    public LayoutManager(int margin, int rowHeight, int columnWidth) {
        this.margin = margin;
        this.rowHeight = rowHeight;
        this.columnWidth = columnWidth;
    }

    /** Forget the row anchors; the next node goes to the margin. */
    public void reset() {
        rowHead = null;
        rowTail = null;
    }

    /**
     * Compute the position for the next node without changing any state.
     */
    public Position computePosition(Placement placement) {
        if (placement.isAbsolute()) {
            return new Position(placement.getX(), placement.getY());
        }
        PatchNode anchor = placement.getNewRow() < 1 ? rowTail : rowHead;
        if (anchor == null) {
            return new Position(margin, margin);
        }
        return computeRelativePosition(anchor, placement);
    }

    protected Position computeRelativePosition(PatchNode anchor, Placement placement) {
        int x = anchor.x;
        int y = anchor.y;
        double newColumn = placement.getNewColumn();
        if (placement.getNewRow() < 1) {
            x += anchor.getWidth();
            newColumn -= 1;
        } else {
            y += anchor.getHeight() + (int) (rowHeight * (placement.getNewRow() - 1));
        }
        x += Math.max(0, (int) (columnWidth * newColumn));
        return new Position(x, y);
    }

    /**
     * Record a node that was just placed.
     */
    public void registerNode(PatchNode node, Placement placement) {
        rowTail = node;
        if (placement.isAbsolute() || rowHead == null
                || placement.getNewColumn() > 0 || placement.getNewRow() >= 1) {
            rowHead = node;
        }
    }

    /**
     * Compute a position for the node, register it and move the node there.
     */
    public Position place(PatchNode node, Placement placement) {
        Position position = computePosition(placement);
        registerNode(node, placement);
        node.setPosition(position.getX(), position.getY());
        return position;
    }

    /** Drop references to a node that left the patch. */
    public void nodeRemoved(PatchNode node) {
        if (rowTail == node) {
            rowTail = rowHead == node ? null : rowHead;
        }
        if (rowHead == node) {
            rowHead = rowTail;
        }
    }

    public int getMargin() {
        return margin;
    }
}
