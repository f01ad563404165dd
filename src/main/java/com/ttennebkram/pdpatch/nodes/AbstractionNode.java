package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;

/**
 * An object box that instantiates another patch file. Arity comes from the
 * caller or from the boundary objects of the referenced patch.
 */
public class AbstractionNode extends ObjectNode {

    private String sourcePath;

    public AbstractionNode(String text, Integer numInlets, Integer numOutlets, String sourcePath) {
        super(text, numInlets, numOutlets);
        this.sourcePath = sourcePath;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ABSTRACTION;
    }

    /** Path of the abstraction's patch file, or null when unknown. */
    public String getSourcePath() {
        return sourcePath;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        super.serializeProperties(json);
        if (sourcePath != null) json.addProperty("sourcePath", sourcePath);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        super.deserializeProperties(json);
        if (json.has("sourcePath")) sourcePath = json.get("sourcePath").getAsString();
    }
}
