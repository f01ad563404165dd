package com.ttennebkram.pdpatch.layout;

/**
 * Settings for {@link AutoLayout}.
 */
public class AutoLayoutOptions {

    private int margin = 50;
    private int rowSpacing = 40;
    private int columnSpacing = 120;
    private boolean alignColumns = true;

    public static AutoLayoutOptions defaults() {
        return new AutoLayoutOptions();
    }

    public int getMargin() {
        return margin;
    }

    public AutoLayoutOptions margin(int value) {
        this.margin = value;
        return this;
    }

    public int getRowSpacing() {
        return rowSpacing;
    }

    public AutoLayoutOptions rowSpacing(int value) {
        this.rowSpacing = value;
        return this;
    }

    public int getColumnSpacing() {
        return columnSpacing;
    }

    public AutoLayoutOptions columnSpacing(int value) {
        this.columnSpacing = value;
        return this;
    }

    /** Order each row by where its parents sit in the row above. */
    public boolean isAlignColumns() {
        return alignColumns;
    }

    public AutoLayoutOptions alignColumns(boolean value) {
        this.alignColumns = value;
        return this;
    }
}
