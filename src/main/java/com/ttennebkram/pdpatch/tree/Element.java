package com.ttennebkram.pdpatch.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the immutable patch tree. Every element knows how to write its own
 * statements; two elements are equal when they are of the same class and
 * write identical text.
 */
public abstract class Element {

    public abstract ElementKind getKind();

    /**
     * Append this element's statements, each terminated by a semicolon.
     */
    public abstract void write(List<String> lines);

    /** The element's statements joined by newlines. */
    public String toPd() {
        List<String> lines = new ArrayList<>();
        write(lines);
        return String.join("\n", lines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        return toPd().equals(((Element) o).toPd());
    }

    @Override
    public int hashCode() {
        return toPd().hashCode();
    }

    @Override
    public String toString() {
        return toPd();
    }

    /** Join tokens with single spaces. */
    protected static String join(List<String> tokens) {
        return String.join(" ", tokens);
    }
}
