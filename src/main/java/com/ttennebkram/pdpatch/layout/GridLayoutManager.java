package com.ttennebkram.pdpatch.layout;

import com.ttennebkram.pdpatch.nodes.PatchNode;
import com.ttennebkram.pdpatch.tree.Position;

/**
 * Places nodes left to right in fixed-size cells, wrapping after a set number
 * of columns. Row and column hints are ignored; absolute positions still work
 * and do not take a cell.
 */
public class GridLayoutManager extends LayoutManager {

    private final int columns;
    private final int cellWidth;
    private final int cellHeight;
    private int nodeCount;

    public GridLayoutManager() {
        this(4, 100, 40, DEFAULT_MARGIN);
    }

    public GridLayoutManager(int columns, int cellWidth, int cellHeight, int margin) {
        super(margin, ROW_HEIGHT, COLUMN_WIDTH);
        if (columns < 1) {
            throw new IllegalArgumentException("Grid needs at least one column: " + columns);
        }
        this.columns = columns;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
    }

    @Override
    public void reset() {
        super.reset();
        nodeCount = 0;
    }

    @Override
    public Position computePosition(Placement placement) {
        if (placement.isAbsolute()) {
            return new Position(placement.getX(), placement.getY());
        }
        int col = nodeCount % columns;
        int row = nodeCount / columns;
        return new Position(margin + col * cellWidth, margin + row * cellHeight);
    }

    @Override
    public void registerNode(PatchNode node, Placement placement) {
        super.registerNode(node, placement);
        if (!placement.isAbsolute()) {
            nodeCount++;
        }
    }

    public int getColumns() {
        return columns;
    }
}
