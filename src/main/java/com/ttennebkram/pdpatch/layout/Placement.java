package com.ttennebkram.pdpatch.layout;

/**
 * Where a new node should go relative to the previous ones.
 *
 * {@code newRow} below 1 continues the current row; 1 starts a new row and
 * larger values add extra space above. {@code newColumn} above 0 shifts right
 * by that many column widths. Non-negative {@code x} and {@code y} place the
 * node absolutely.
 */
public final class Placement {

    public static final Placement NEW_ROW = new Placement(1, 0, -1, -1);
    public static final Placement SAME_ROW = new Placement(0, 0, -1, -1);

    private final double newRow;
    private final double newColumn;
    private final int x;
    private final int y;

    private Placement(double newRow, double newColumn, int x, int y) {
        this.newRow = newRow;
        this.newColumn = newColumn;
        this.x = x;
        this.y = y;
    }

    public static Placement relative(double newRow, double newColumn) {
        return new Placement(newRow, newColumn, -1, -1);
    }

    public static Placement at(int x, int y) {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Absolute position must not be negative: " + x + "," + y);
        }
        return new Placement(0, 0, x, y);
    }

    public double getNewRow() {
        return newRow;
    }

    public double getNewColumn() {
        return newColumn;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public boolean isAbsolute() {
        return x >= 0 && y >= 0;
    }

    @Override
    public String toString() {
        return isAbsolute() ? "at(" + x + "," + y + ")" : "relative(" + newRow + "," + newColumn + ")";
    }
}
