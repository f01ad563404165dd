package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;
import com.ttennebkram.pdpatch.tree.ArrayElement;

/**
 * An array definition. Hidden: drawn by its enclosing graph, never placed.
 */
public class ArrayNode extends PatchNode {

    private String name;
    private int size;
    private String type;
    private int saveFlag;

    public ArrayNode(String name, int size, String type, int saveFlag) {
        super(0, 0);
        this.name = name;
        this.size = size;
        this.type = type;
        this.saveFlag = saveFlag;
    }

    public ArrayNode(ArrayElement element) {
        this(element.getName(), element.getSize(), element.getType(), element.getSaveFlag());
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY;
    }

    @Override
    public String getNodeName() {
        return "array " + name;
    }

    @Override
    public boolean isHidden() {
        return true;
    }

    public ArrayElement toElement() {
        return new ArrayElement(name, size, type, saveFlag);
    }

    public String getName() {
        return name;
    }

    public int getSize() {
        return size;
    }

    @Override
    public int getWidth() {
        return 0;
    }

    @Override
    public int getHeight() {
        return 0;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("name", name);
        json.addProperty("size", size);
        json.addProperty("dataType", type);
        json.addProperty("saveFlag", saveFlag);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        if (json.has("name")) name = json.get("name").getAsString();
        if (json.has("size")) size = json.get("size").getAsInt();
        if (json.has("dataType")) type = json.get("dataType").getAsString();
        if (json.has("saveFlag")) saveFlag = json.get("saveFlag").getAsInt();
    }
}
