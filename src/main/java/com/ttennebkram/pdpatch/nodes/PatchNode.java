package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ttennebkram.pdpatch.model.InvalidConnectionException;
import com.ttennebkram.pdpatch.model.Outlet;
import com.ttennebkram.pdpatch.serialization.NodeSerializable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all graph nodes.
 * Implements NodeSerializable to handle common property serialization.
 *
 * A node is addressed by its index in the owning patcher's node list; it
 * carries no identity of its own beyond object identity.
 */
public abstract class PatchNode implements NodeSerializable {

    // Text box metrics
    public static final int CHAR_WIDTH = 6;
    public static final int LINE_HEIGHT = 15;
    public static final int MIN_BOX_WIDTH = 50;
    public static final int WRAP_COLUMN = 60;

    public int x, y;

    // null = variable, depends on creation arguments
    protected Integer numInlets;
    protected Integer numOutlets;

    // Verbatim statements written right after this node (width hints, array data)
    private final List<String> trailingStatements = new ArrayList<>();

    protected PatchNode(Integer numInlets, Integer numOutlets) {
        this.numInlets = numInlets;
        this.numOutlets = numOutlets;
    }

    public abstract NodeKind getKind();

    /** Short description used in logs and error messages. */
    public abstract String getNodeName();

    public abstract int getWidth();

    public abstract int getHeight();

    /** Inlet count, or null when it cannot be known statically. */
    public Integer getNumInlets() {
        return numInlets;
    }

    /** Outlet count, or null when it cannot be known statically. */
    public Integer getNumOutlets() {
        return numOutlets;
    }

    public void setPosition(int newX, int newY) {
        this.x = newX;
        this.y = newY;
    }

    /** Check if unused-node removal must keep this node. */
    public boolean isProtected() {
        return getKind().isProtected();
    }

    /** Check if the node sends to or listens on a named destination. */
    public boolean hasActiveSendReceive() {
        return false;
    }

    /** Hidden nodes are not drawn on their canvas and are skipped by layouts. */
    public boolean isHidden() {
        return false;
    }

    public List<String> getTrailingStatements() {
        return Collections.unmodifiableList(trailingStatements);
    }

    /** Attach a statement (without terminator) to be written after this node. */
    public void addTrailingStatement(String statement) {
        trailingStatements.add(statement);
    }

    /**
     * Handle for one of this node's outlets, for chaining {@code link} calls.
     *
     * @throws InvalidConnectionException if the outlet is negative or beyond a known count
     */
    public Outlet outlet(int index) {
        Integer count = getNumOutlets();
        if (index < 0 || (count != null && index >= count)) {
            throw new InvalidConnectionException(getNodeName(), "outlet", index, count);
        }
        return new Outlet(this, index);
    }

    // ========== Serialization ==========

    /**
     * Serialize common properties shared by all nodes.
     * Called by GraphJsonSerializer before serializeProperties().
     *
     * @param json the JSON object to write to
     */
    public void serializeCommon(JsonObject json) {
        json.addProperty("type", getSerializationType());
        json.addProperty("x", x);
        json.addProperty("y", y);
        if (!trailingStatements.isEmpty()) {
            JsonArray trailing = new JsonArray();
            trailingStatements.forEach(trailing::add);
            json.add("trailing", trailing);
        }
    }

    /**
     * Deserialize common properties shared by all nodes.
     * Called by GraphJsonSerializer before deserializeProperties().
     *
     * @param json the JSON object to read from
     */
    public void deserializeCommon(JsonObject json) {
        if (json.has("x")) x = json.get("x").getAsInt();
        if (json.has("y")) y = json.get("y").getAsInt();
        if (json.has("trailing")) {
            trailingStatements.clear();
            for (JsonElement e : json.getAsJsonArray("trailing")) {
                trailingStatements.add(e.getAsString());
            }
        }
    }

    protected static void writeArity(JsonObject json, Integer inlets, Integer outlets) {
        if (inlets != null) json.addProperty("inlets", inlets);
        if (outlets != null) json.addProperty("outlets", outlets);
    }

    protected static Integer readInt(JsonObject json, String key) {
        return json.has(key) && !json.get(key).isJsonNull() ? json.get(key).getAsInt() : null;
    }

    // ========== Text box metrics ==========

    /**
     * Width of a box showing {@code text}: six pixels per character of the
     * longest wrapped line plus padding, at least fifty.
     */
    protected static int textWidth(String text) {
        int chars = Math.min(text.length(), WRAP_COLUMN);
        return Math.max(MIN_BOX_WIDTH, 20 + chars * CHAR_WIDTH);
    }

    /** Height of a box showing {@code text}, one line per sixty characters. */
    protected static int textHeight(String text) {
        int lines = Math.max(1, (text.length() + WRAP_COLUMN - 1) / WRAP_COLUMN);
        return 10 + LINE_HEIGHT * lines;
    }

    @Override
    public String toString() {
        return getNodeName() + " @ " + x + "," + y;
    }
}
