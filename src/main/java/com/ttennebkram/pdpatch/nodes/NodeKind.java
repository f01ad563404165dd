package com.ttennebkram.pdpatch.nodes;

/**
 * Closed set of graph node variants. Everything except a plain object box is
 * protected from unused-node removal.
 */
public enum NodeKind {
    OBJECT(false),
    ABSTRACTION(true),
    MESSAGE(true),
    COMMENT(true),
    FLOAT_ATOM(true),
    SYMBOL_ATOM(true),
    ARRAY(true),
    SUBPATCH(true),
    GUI(true),
    SCALAR(true);

    private final boolean protectedKind;

    NodeKind(boolean protectedKind) {
        this.protectedKind = protectedKind;
    }

    public boolean isProtected() {
        return protectedKind;
    }
}
