package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;
import com.ttennebkram.pdpatch.serialization.PdEscaper;

/**
 * A message box. Content is kept in file form.
 */
public class MessageNode extends PatchNode {

    private String content;

    public MessageNode(String content) {
        super(1, 1);
        this.content = content == null ? "" : content;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MESSAGE;
    }

    @Override
    public String getNodeName() {
        return "[" + getDisplayText() + "(";
    }

    public String getContent() {
        return content;
    }

    public String getDisplayText() {
        return PdEscaper.unescape(content);
    }

    @Override
    public int getWidth() {
        return textWidth(getDisplayText());
    }

    @Override
    public int getHeight() {
        return textHeight(getDisplayText());
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("content", content);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        if (json.has("content")) content = json.get("content").getAsString();
    }
}
