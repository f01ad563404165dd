package com.ttennebkram.pdpatch.tree;

import java.util.List;

/**
 * A message box ({@code #X msg}). The content is kept as written, escapes
 * and spacing included.
 */
public final class MessageElement extends PlacedElement {

    private final String content;

    public MessageElement(Position position, String content) {
        super(position);
        this.content = content == null ? "" : content;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.MESSAGE;
    }

    public String getContent() {
        return content;
    }

    @Override
    public MessageElement withPosition(Position newPosition) {
        return new MessageElement(newPosition, content);
    }

    @Override
    public void write(List<String> lines) {
        lines.add("#X msg " + position + (content.isEmpty() ? "" : " " + content) + ";");
    }
}
