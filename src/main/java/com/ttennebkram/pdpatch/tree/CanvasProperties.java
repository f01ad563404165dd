package com.ttennebkram.pdpatch.tree;

import java.util.Objects;

/**
 * Fields of a {@code #N canvas} statement.
 *
 * A root canvas has five fields (x, y, width, height, font size). A subpatch
 * canvas has six (x, y, width, height, name, open flag). The form is decided
 * by field count only, so a numeric subpatch name stays a name.
 */
public final class CanvasProperties {

    public static final String DEFAULT_SUBPATCH_NAME = "(subpatch)";

    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final Integer fontSize;
    private final String name;
    private final Integer openOnLoad;

    private CanvasProperties(int x, int y, int width, int height,
                             Integer fontSize, String name, Integer openOnLoad) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.fontSize = fontSize;
        this.name = name;
        this.openOnLoad = openOnLoad;
    }

    public static CanvasProperties root(int x, int y, int width, int height, int fontSize) {
        return new CanvasProperties(x, y, width, height, fontSize, null, null);
    }

    /** {@code name} is a wire token, escapes kept. */
    public static CanvasProperties subpatch(int x, int y, int width, int height, String name, int openOnLoad) {
        return new CanvasProperties(x, y, width, height, null,
                Objects.requireNonNull(name, "name"), openOnLoad);
    }

    /** The canvas a new top-level patch starts with. */
    public static CanvasProperties defaultRoot() {
        return root(0, 50, 1000, 600, 10);
    }

    public static CanvasProperties defaultSubpatch(int width, int height) {
        return subpatch(0, 0, width, height, DEFAULT_SUBPATCH_NAME, 0);
    }

    public boolean isSubpatchForm() {
        return name != null;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /** Font size of a root canvas, null for the subpatch form. */
    public Integer getFontSize() {
        return fontSize;
    }

    /** Name token of a subpatch canvas, null for the root form. */
    public String getName() {
        return name;
    }

    public Integer getOpenOnLoad() {
        return openOnLoad;
    }

    public CanvasProperties withSize(int newWidth, int newHeight) {
        return new CanvasProperties(x, y, newWidth, newHeight, fontSize, name, openOnLoad);
    }

    public String toStatement() {
        StringBuilder sb = new StringBuilder("#N canvas ");
        sb.append(x).append(' ').append(y).append(' ').append(width).append(' ').append(height).append(' ');
        if (isSubpatchForm()) {
            sb.append(name).append(' ').append(openOnLoad);
        } else {
            sb.append(fontSize);
        }
        return sb.append(';').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CanvasProperties)) {
            return false;
        }
        return toStatement().equals(((CanvasProperties) o).toStatement());
    }

    @Override
    public int hashCode() {
        return toStatement().hashCode();
    }

    @Override
    public String toString() {
        return toStatement();
    }
}
