package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;
import com.ttennebkram.pdpatch.serialization.PdEscaper;

/**
 * A comment. No inlets, no outlets.
 */
public class CommentNode extends PatchNode {

    private String content;

    public CommentNode(String content) {
        super(0, 0);
        this.content = content == null ? "" : content;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMMENT;
    }

    @Override
    public String getNodeName() {
        return "comment '" + getDisplayText() + "'";
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
