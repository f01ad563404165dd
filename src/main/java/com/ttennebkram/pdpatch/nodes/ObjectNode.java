package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.ttennebkram.pdpatch.registry.ObjectRegistry;
import com.ttennebkram.pdpatch.serialization.PdEscaper;
import com.ttennebkram.pdpatch.serialization.Statement;
import com.ttennebkram.pdpatch.tree.gui.IemGuiParsers;

import java.util.Collections;
import java.util.List;

/**
 * A generic object box. The text is kept in file form: escapes applied,
 * tokens separated by single spaces.
 */
public class ObjectNode extends PatchNode {

    protected String text;

    public ObjectNode(String text, Integer numInlets, Integer numOutlets) {
        super(numInlets, numOutlets);
        this.text = text;
    }

    /**
     * Create an object node, filling unknown counts from {@link ObjectRegistry}.
     *
     * @param text box text in file form
     */
    public static ObjectNode create(String text, Integer numInlets, Integer numOutlets) {
        ObjectNode node = new ObjectNode(text, numInlets, numOutlets);
        if (numInlets == null || numOutlets == null) {
            ObjectRegistry.ObjectRegistration reg = ObjectRegistry.lookup(node.getClassName());
            if (reg != null) {
                if (numInlets == null) node.numInlets = reg.inlets;
                if (numOutlets == null) node.numOutlets = reg.outlets;
            }
        }
        return node;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OBJECT;
    }

    /**
     * Widget boxes whose fields did not fit a known layout stay generic
     * objects but are still protected.
     */
    @Override
    public boolean isProtected() {
        return super.isProtected() || IemGuiParsers.isWidgetClass(getClassName());
    }

    @Override
    public String getNodeName() {
        return "[" + getDisplayText() + "]";
    }

    public String getText() {
        return text;
    }

    /** Text as shown in the box, escapes removed. */
    public String getDisplayText() {
        return PdEscaper.unescape(text);
    }

    /** Tokens of the text; escaped spaces do not split. */
    public List<String> getTokens() {
        return new Statement(text, 0).getTokens();
    }

    public String getClassName() {
        List<String> tokens = getTokens();
        return tokens.isEmpty() ? "" : tokens.get(0);
    }

    public List<String> getArguments() {
        List<String> tokens = getTokens();
        return tokens.size() <= 1 ? Collections.emptyList() : tokens.subList(1, tokens.size());
    }

    public void setNumInlets(Integer count) {
        this.numInlets = count;
    }

    public void setNumOutlets(Integer count) {
        this.numOutlets = count;
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
        json.addProperty("text", text);
        writeArity(json, numInlets, numOutlets);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        text = json.has("text") ? json.get("text").getAsString() : "";
        if (getTokens().isEmpty()) {
            throw new JsonParseException("Object node without text");
        }
        numInlets = readInt(json, "inlets");
        numOutlets = readInt(json, "outlets");
    }
}
