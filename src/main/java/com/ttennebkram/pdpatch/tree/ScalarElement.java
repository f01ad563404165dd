package com.ttennebkram.pdpatch.tree;

import java.util.List;

/**
 * A {@code #X scalar} statement: an instance of a data structure template.
 * Its fields depend on the template, so the statement is kept verbatim, but
 * unlike other verbatim statements it takes a place in connection numbering.
 */
public final class ScalarElement extends Element {

    private final String text;

    /** {@code text} is the whole statement without its terminator. */
    public ScalarElement(String text) {
        this.text = text;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.SCALAR;
    }

    public String getText() {
        return text;
    }

    /** Template name, the field after {@code #X scalar}. */
    public String getTemplate() {
        String[] fields = text.split("\\s+", 4);
        return fields.length > 2 ? fields[2] : "";
    }

    @Override
    public void write(List<String> lines) {
        lines.add(text + ";");
    }
}
