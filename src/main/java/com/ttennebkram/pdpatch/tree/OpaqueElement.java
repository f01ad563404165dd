package com.ttennebkram.pdpatch.tree;

import java.util.List;

/**
 * A statement kept verbatim because no typed element covers it, for example
 * {@code #A set} array data or a {@code #X f} width hint.
 */
public final class OpaqueElement extends Element {

    private final String text;

    /** {@code text} is the whole statement without its terminator. */
    public OpaqueElement(String text) {
        this.text = text;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.OPAQUE;
    }

    public String getText() {
        return text;
    }

    @Override
    public void write(List<String> lines) {
        lines.add(text + ";");
    }
}
