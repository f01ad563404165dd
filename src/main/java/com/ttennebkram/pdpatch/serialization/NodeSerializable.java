package com.ttennebkram.pdpatch.serialization;

import com.google.gson.JsonObject;

/**
 * A graph node that writes itself into, and reads itself back from, one
 * entry of the {@code nodes} array of a {@link GraphJsonSerializer} document.
 *
 * The serializer calls the common pair first (type tag, position, statements
 * kept verbatim), then the node's own pair.
 */
public interface NodeSerializable {

    /** Write the type tag and the fields every node has. */
    void serializeCommon(JsonObject json);

    /** Read back what {@link #serializeCommon} wrote, except the type tag. */
    void deserializeCommon(JsonObject json);

    /** Write the fields of this node kind: box text, widget statement, nested patch. */
    void serializeProperties(JsonObject json);

    /**
     * Read back what {@link #serializeProperties} wrote.
     *
     * @throws com.google.gson.JsonParseException if a stored statement does not parse
     */
    void deserializeProperties(JsonObject json);

    /**
     * Type tag stored under {@code type}; {@link GraphJsonSerializer} picks
     * the node class from it. Defaults to the simple class name without its
     * {@code Node} suffix, e.g. {@code Subpatch}.
     */
    default String getSerializationType() {
        String simpleName = getClass().getSimpleName();
        return simpleName.endsWith("Node") ? simpleName.substring(0, simpleName.length() - 4) : simpleName;
    }
}
