package com.ttennebkram.pdpatch.tree;

import com.ttennebkram.pdpatch.serialization.PdNumbers;

import java.util.List;

/**
 * Graph-on-parent settings of a canvas ({@code #X coords}).
 */
public final class CoordsElement extends Element {

    private final double xFrom;
    private final double yFrom;
    private final double xTo;
    private final double yTo;
    private final int width;
    private final int height;
    private final int graphOnParent;
    private final List<String> extra;

    public CoordsElement(double xFrom, double yFrom, double xTo, double yTo,
                         int width, int height, int graphOnParent, List<String> extra) {
        this.xFrom = xFrom;
        this.yFrom = yFrom;
        this.xTo = xTo;
        this.yTo = yTo;
        this.width = width;
        this.height = height;
        this.graphOnParent = graphOnParent;
        this.extra = extra == null ? List.of() : List.copyOf(extra);
    }

    /** Graph-on-parent box of the given size with margins 0 0. */
    public static CoordsElement graphOnParent(int width, int height) {
        return new CoordsElement(0, -1, 1, 1, width, height, 1, List.of("0", "0"));
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.COORDS;
    }

    public double getXFrom() {
        return xFrom;
    }

    public double getYFrom() {
        return yFrom;
    }

    public double getXTo() {
        return xTo;
    }

    public double getYTo() {
        return yTo;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getGraphOnParentFlag() {
        return graphOnParent;
    }

    public boolean isGraphOnParent() {
        return graphOnParent != 0;
    }

    /** Hide-name flag and margins, when present. */
    public List<String> getExtra() {
        return extra;
    }

    @Override
    public void write(List<String> lines) {
        StringBuilder sb = new StringBuilder("#X coords ");
        sb.append(PdNumbers.format(xFrom)).append(' ')
                .append(PdNumbers.format(yFrom)).append(' ')
                .append(PdNumbers.format(xTo)).append(' ')
                .append(PdNumbers.format(yTo)).append(' ')
                .append(width).append(' ').append(height).append(' ').append(graphOnParent);
        for (String token : extra) {
            sb.append(' ').append(token);
        }
        lines.add(sb.append(';').toString());
    }
}
