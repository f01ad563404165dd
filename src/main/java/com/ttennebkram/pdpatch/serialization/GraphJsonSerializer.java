package com.ttennebkram.pdpatch.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.pdpatch.model.Connection;
import com.ttennebkram.pdpatch.model.Patcher;
import com.ttennebkram.pdpatch.nodes.AbstractionNode;
import com.ttennebkram.pdpatch.nodes.ArrayNode;
import com.ttennebkram.pdpatch.nodes.AtomNode;
import com.ttennebkram.pdpatch.nodes.CommentNode;
import com.ttennebkram.pdpatch.nodes.GuiNode;
import com.ttennebkram.pdpatch.nodes.MessageNode;
import com.ttennebkram.pdpatch.nodes.ObjectNode;
import com.ttennebkram.pdpatch.nodes.PatchNode;
import com.ttennebkram.pdpatch.nodes.ScalarNode;
import com.ttennebkram.pdpatch.nodes.SubpatchNode;
import com.ttennebkram.pdpatch.tree.AtomElement;
import com.ttennebkram.pdpatch.tree.CoordsElement;
import com.ttennebkram.pdpatch.tree.gui.BangElement;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Handles JSON export and import of patch graphs.
 * Each node handles its own property serialization via the NodeSerializable interface.
 *
 * Document layout: {@code canvas} and optional {@code coords} statements, an
 * optional {@code leading} array of verbatim statements, a {@code nodes}
 * array (each with its {@code id}, the node index) and a {@code connections}
 * array of sourceId/outlet/sinkId/inlet objects. Subpatch nodes nest a whole
 * document under {@code patcher}.
 */
public class GraphJsonSerializer {

    private static final Logger LOGGER = Logger.getLogger(GraphJsonSerializer.class.getName());

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private GraphJsonSerializer() {
    }

    /**
     * Build the JSON document of a graph.
     */
    public static JsonObject toJson(Patcher patcher) {
        JsonObject root = new JsonObject();
        root.addProperty("canvas", patcher.getCanvas().toStatement());
        if (patcher.getCoords() != null) {
            root.addProperty("coords", patcher.getCoords().toPd());
        }
        if (!patcher.getLeadingStatements().isEmpty()) {
            JsonArray leading = new JsonArray();
            patcher.getLeadingStatements().forEach(leading::add);
            root.add("leading", leading);
        }

        // Serialize nodes
        JsonArray nodesArray = new JsonArray();
        for (int i = 0; i < patcher.size(); i++) {
            PatchNode node = patcher.getNode(i);
            JsonObject nodeJson = new JsonObject();

            // Add id for reference
            nodeJson.addProperty("id", i);

            // Common properties (includes type)
            node.serializeCommon(nodeJson);

            // Node-specific properties (handled by each node)
            node.serializeProperties(nodeJson);

            nodesArray.add(nodeJson);
        }
        root.add("nodes", nodesArray);

        JsonArray connectionsArray = new JsonArray();
        for (Connection conn : patcher.getConnections()) {
            JsonObject connJson = new JsonObject();
            connJson.addProperty("sourceId", conn.getSource());
            connJson.addProperty("outlet", conn.getOutlet());
            connJson.addProperty("sinkId", conn.getSink());
            connJson.addProperty("inlet", conn.getInlet());
            connectionsArray.add(connJson);
        }
        root.add("connections", connectionsArray);
        return root;
    }

    /**
     * Rebuild a graph from its JSON document.
     *
     * @throws JsonParseException on an unknown node type or a malformed statement
     */
    public static Patcher fromJson(JsonObject root) {
        Patcher patcher = new Patcher();
        if (root.has("canvas")) {
            String statement = root.get("canvas").getAsString();
            try {
                patcher.setCanvas(PatchParser.parseCanvas(new Statement(stripTerminator(statement), 1)));
            } catch (PatchParseException e) {
                throw new JsonParseException("Invalid canvas statement: " + statement, e);
            }
        }
        if (root.has("coords")) {
            String statement = root.get("coords").getAsString();
            try {
                patcher.setCoords((CoordsElement) PatchParser.parseElement(stripTerminator(statement)));
            } catch (PatchParseException | ClassCastException e) {
                throw new JsonParseException("Invalid coords statement: " + statement, e);
            }
        }
        if (root.has("leading")) {
            for (JsonElement e : root.getAsJsonArray("leading")) {
                patcher.addLeadingStatement(e.getAsString());
            }
        }

        // Nodes are stored in index order; ids are informational
        if (root.has("nodes")) {
            for (JsonElement elem : root.getAsJsonArray("nodes")) {
                JsonObject nodeJson = elem.getAsJsonObject();
                String type = nodeJson.has("type") ? nodeJson.get("type").getAsString() : "";
                PatchNode node = createNode(type);
                node.deserializeCommon(nodeJson);
                node.deserializeProperties(nodeJson);
                patcher.addPlaced(node);
            }
        }

        if (root.has("connections")) {
            for (JsonElement elem : root.getAsJsonArray("connections")) {
                JsonObject connJson = elem.getAsJsonObject();
                patcher.addConnection(new Connection(
                        connJson.get("sourceId").getAsInt(),
                        connJson.get("outlet").getAsInt(),
                        connJson.get("sinkId").getAsInt(),
                        connJson.get("inlet").getAsInt()));
            }
        }
        LOGGER.fine(() -> "Loaded " + patcher);
        return patcher;
    }

    /**
     * Create an empty node of a serialized type, to be filled by
     * deserializeProperties.
     */
    private static PatchNode createNode(String type) {
        switch (type) {
            case "Object":
                return new ObjectNode("", null, null);
            case "Abstraction":
                return new AbstractionNode("", null, null, null);
            case "Message":
                return new MessageNode("");
            case "Comment":
                return new CommentNode("");
            case "FloatAtom":
                return new AtomNode(AtomElement.floatAtom(null));
            case "SymbolAtom":
                return new AtomNode(AtomElement.symbolAtom(null));
            case "Array":
                return new ArrayNode("", 0, "float", 0);
            case "Scalar":
                return new ScalarNode("");
            case "Subpatch":
                return new SubpatchNode("", new Patcher(), null, null);
            case "Gui":
                return new GuiNode(BangElement.builder().build());
            default:
                throw new JsonParseException("Unknown node type: " + type);
        }
    }

    private static String stripTerminator(String statement) {
        return statement.endsWith(";") ? statement.substring(0, statement.length() - 1) : statement;
    }

    public static String toJsonString(Patcher patcher) {
        return GSON.toJson(toJson(patcher));
    }

    public static Patcher fromJsonString(String json) {
        return fromJson(JsonParser.parseString(json).getAsJsonObject());
    }

    /**
     * Save a graph to a JSON file.
     */
    public static void save(Path path, Patcher patcher) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(patcher), writer);
        }
    }

    /**
     * Load a graph from a JSON file.
     */
    public static Patcher load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
            return fromJson(root);
        }
    }
}
