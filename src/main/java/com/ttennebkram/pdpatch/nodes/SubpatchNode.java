package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;
import com.ttennebkram.pdpatch.model.Patcher;
import com.ttennebkram.pdpatch.serialization.GraphJsonSerializer;
import com.ttennebkram.pdpatch.serialization.PdEscaper;
import com.ttennebkram.pdpatch.tree.CoordsElement;
import com.ttennebkram.pdpatch.tree.SubpatchElement;

/**
 * A subpatch box owning a nested graph.
 *
 * Inlet and outlet counts follow the boundary objects of the nested graph:
 * when it holds any {@code inlet}/{@code inlet~} objects their count is the
 * inlet count, whatever was passed in, and likewise for outlets. Without
 * boundary objects the explicit count applies, or zero.
 */
public class SubpatchNode extends PatchNode {

    private static final int BOX_HEIGHT = 25;

    private String name;
    private String restoreKind;
    private Patcher inner;

    public SubpatchNode(String name, Patcher inner, Integer numInlets, Integer numOutlets) {
        this(name, SubpatchElement.KIND_PD, inner, numInlets, numOutlets);
    }

    public SubpatchNode(String name, String restoreKind, Patcher inner, Integer numInlets, Integer numOutlets) {
        super(numInlets, numOutlets);
        this.name = name == null ? "" : name;
        this.restoreKind = restoreKind;
        this.inner = inner;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SUBPATCH;
    }

    @Override
    public String getNodeName() {
        return restoreKind + (name.isEmpty() ? "" : " " + PdEscaper.unescape(name));
    }

    /** Name tokens in file form. */
    public String getName() {
        return name;
    }

    public String getRestoreKind() {
        return restoreKind;
    }

    public Patcher getInner() {
        return inner;
    }

    @Override
    public Integer getNumInlets() {
        int boundary = inner.countBoundaryInlets();
        if (boundary > 0) {
            return boundary;
        }
        return numInlets != null ? numInlets : 0;
    }

    @Override
    public Integer getNumOutlets() {
        int boundary = inner.countBoundaryOutlets();
        if (boundary > 0) {
            return boundary;
        }
        return numOutlets != null ? numOutlets : 0;
    }

    /** Explicit counts as given by the caller, before boundary inference. */
    public Integer getDeclaredInlets() {
        return numInlets;
    }

    public Integer getDeclaredOutlets() {
        return numOutlets;
    }

    @Override
    public int getWidth() {
        CoordsElement coords = inner.getCoords();
        if (coords != null && coords.isGraphOnParent()) {
            return coords.getWidth();
        }
        return textWidth(getNodeName());
    }

    @Override
    public int getHeight() {
        CoordsElement coords = inner.getCoords();
        if (coords != null && coords.isGraphOnParent()) {
            return coords.getHeight();
        }
        return BOX_HEIGHT;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("name", name);
        json.addProperty("restoreKind", restoreKind);
        writeArity(json, numInlets, numOutlets);
        json.add("patcher", GraphJsonSerializer.toJson(inner));
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        if (json.has("name")) name = json.get("name").getAsString();
        if (json.has("restoreKind")) restoreKind = json.get("restoreKind").getAsString();
        numInlets = readInt(json, "inlets");
        numOutlets = readInt(json, "outlets");
        if (json.has("patcher")) inner = GraphJsonSerializer.fromJson(json.getAsJsonObject("patcher"));
    }
}
