package com.ttennebkram.pdpatch.tree;

import java.util.List;

/**
 * A comment ({@code #X text}). The content is kept as written, escapes
 * and spacing included.
 */
public final class TextElement extends PlacedElement {

    private final String content;

    public TextElement(Position position, String content) {
        super(position);
        this.content = content == null ? "" : content;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.TEXT;
    }

    public String getContent() {
        return content;
    }

    @Override
    public TextElement withPosition(Position newPosition) {
        return new TextElement(newPosition, content);
    }

    @Override
    public void write(List<String> lines) {
        lines.add("#X text " + position + (content.isEmpty() ? "" : " " + content) + ";");
    }
}
