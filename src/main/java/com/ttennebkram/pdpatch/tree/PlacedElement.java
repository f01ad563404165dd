package com.ttennebkram.pdpatch.tree;

/**
 * An element drawn at a position on its canvas.
 */
public abstract class PlacedElement extends Element {

    protected final Position position;

    protected PlacedElement(Position position) {
        this.position = position == null ? Position.ORIGIN : position;
    }

    public Position getPosition() {
        return position;
    }

    /** Copy of this element moved to another position. */
    public abstract PlacedElement withPosition(Position position);
}
