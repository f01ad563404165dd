package com.ttennebkram.pdpatch.tree;

/**
 * Closed set of element variants. Indexed kinds take part in the positional
 * numbering used by connection statements.
 */
public enum ElementKind {
    OBJECT(true, false),
    MESSAGE(true, false),
    TEXT(true, false),
    FLOAT_ATOM(true, true),
    SYMBOL_ATOM(true, true),
    ARRAY(true, false),
    SUBPATCH(true, false),
    BANG(true, true),
    TOGGLE(true, true),
    NUMBER_BOX(true, true),
    VSLIDER(true, true),
    HSLIDER(true, true),
    VRADIO(true, true),
    HRADIO(true, true),
    CNV(true, true),
    VU(true, true),
    SCALAR(true, false),
    DECLARE(false, false),
    CONNECT(false, false),
    COORDS(false, false),
    OPAQUE(false, false);

    private final boolean indexed;
    private final boolean widget;

    ElementKind(boolean indexed, boolean widget) {
        this.indexed = indexed;
        this.widget = widget;
    }

    public boolean isIndexed() {
        return indexed;
    }

    /** Widgets are the eleven fixed-layout GUI variants, atoms included. */
    public boolean isWidget() {
        return widget;
    }
}
