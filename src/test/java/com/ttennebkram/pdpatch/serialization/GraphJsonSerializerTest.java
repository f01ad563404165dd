package com.ttennebkram.pdpatch.serialization;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.ttennebkram.pdpatch.layout.Placement;
import com.ttennebkram.pdpatch.model.Patcher;
import com.ttennebkram.pdpatch.nodes.AbstractionNode;
import com.ttennebkram.pdpatch.nodes.SubpatchNode;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

public class GraphJsonSerializerTest {

    private static final String PATCH = String.join("\n",
            "#N canvas 0 50 450 300 12;",
            "#X f 30;",
            "#X obj 30 30 osc~ 440;",
            "#X obj 30 70 *~ 0.3;",
            "#X obj 30 110 dac~;",
            "#X msg 120 30 440\\, 880;",
            "#X text 200 30 keep it low\\; really;",
            "#X floatatom 120 70 5 0 127 0 - freq -;",
            "#X symbolatom 120 110 10 0 0 0 - - -;",
            "#X obj 250 70 bng 15 250 50 0 empty b-in empty 17 7 0 10 -262144 -1 -1;",
            "#X array table 16 float 0;",
            "#N canvas 0 0 300 180 inner 0;",
            "#X obj 10 10 inlet;",
            "#X obj 10 60 outlet;",
            "#X connect 0 0 1 0;",
            "#X coords 0 -1 1 1 85 60 1;",
            "#X restore 30 150 pd inner;",
            "#X f 20;",
            "#X connect 0 0 1 0;",
            "#X connect 1 0 2 0;",
            "#X connect 1 0 2 1;",
            "");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void fileRoundTripKeepsPatchText() throws Exception {
        Patcher patcher = Patcher.fromPatch(PatchParser.parse(PATCH));
        Path file = folder.getRoot().toPath().resolve("synth.json");

        GraphJsonSerializer.save(file, patcher);
        Patcher loaded = GraphJsonSerializer.load(file);

        assertEquals(PATCH, loaded.toPd());
        assertEquals(patcher.getConnections(), loaded.getConnections());
    }

    @Test
    public void documentLayout() throws Exception {
        Patcher patcher = Patcher.fromPatch(PatchParser.parse(PATCH));
        JsonObject json = GraphJsonSerializer.toJson(patcher);

        assertEquals("#N canvas 0 50 450 300 12;", json.get("canvas").getAsString());
        assertEquals("#X f 30", json.getAsJsonArray("leading").get(0).getAsString());

        JsonArray nodes = json.getAsJsonArray("nodes");
        assertEquals(patcher.size(), nodes.size());
        JsonObject first = nodes.get(0).getAsJsonObject();
        assertEquals(0, first.get("id").getAsInt());
        assertEquals("Object", first.get("type").getAsString());
        assertEquals(30, first.get("x").getAsInt());
        assertEquals("FloatAtom", nodes.get(5).getAsJsonObject().get("type").getAsString());
        assertEquals("Subpatch", nodes.get(9).getAsJsonObject().get("type").getAsString());

        JsonObject connection = json.getAsJsonArray("connections").get(2).getAsJsonObject();
        assertEquals(1, connection.get("sourceId").getAsInt());
        assertEquals(2, connection.get("sinkId").getAsInt());
        assertEquals(1, connection.get("inlet").getAsInt());
        assertFalse(json.has("coords"));
    }

    @Test
    public void builtGraphRoundTrips() {
        Patcher inner = new Patcher();
        inner.addObject("inlet~");
        inner.addObject("outlet~");
        inner.link(0, 0, 1, 0);
        inner.setGraphOnParent(120, 40);

        Patcher patcher = new Patcher();
        patcher.addObject("noise~", Placement.at(10, 10));
        patcher.addSubpatch("filter", inner, null, null, Placement.at(10, 50));
        patcher.addAbstraction("voice 1", 2, null, "lib/voice.pd", Placement.at(10, 90));
        patcher.link(0, 0, 1, 0);

        Patcher loaded = GraphJsonSerializer.fromJsonString(GraphJsonSerializer.toJsonString(patcher));

        assertEquals(patcher.toPd(), loaded.toPd());
        SubpatchNode sub = (SubpatchNode) loaded.getNode(1);
        assertEquals("filter", sub.getName());
        assertEquals(patcher.getNode(1).getNumInlets(), sub.getNumInlets());
        AbstractionNode abstraction = (AbstractionNode) loaded.getNode(2);
        assertEquals("lib/voice.pd", abstraction.getSourcePath());
        assertEquals(Integer.valueOf(2), abstraction.getNumInlets());
        assertNull(abstraction.getNumOutlets());
    }

    @Test(expected = JsonParseException.class)
    public void unknownNodeTypeIsRejected() {
        GraphJsonSerializer.fromJsonString("{\"nodes\": [{\"id\": 0, \"type\": \"Sprocket\"}], \"connections\": []}");
    }

    @Test(expected = JsonParseException.class)
    public void badWidgetStatementIsRejected() {
        GraphJsonSerializer.fromJsonString(
                "{\"nodes\": [{\"id\": 0, \"type\": \"Gui\", \"statement\": \"#X obj 0 0 bng 15\"}]}");
    }

    @Test
    public void scalarStatementSurvivesJson() throws Exception {
        String text = String.join("\n",
                "#N canvas 0 50 450 300 12;",
                "#X obj 10 10 loadbang;",
                "#X scalar point 10 10 \\;;",
                "#X obj 10 60 print;",
                "#X connect 0 0 2 0;",
                "");
        Patcher graph = Patcher.fromPatch(PatchParser.parse(text));

        JsonObject json = GraphJsonSerializer.toJson(graph);
        assertEquals("Scalar", json.getAsJsonArray("nodes").get(1).getAsJsonObject().get("type").getAsString());

        Patcher loaded = GraphJsonSerializer.fromJson(json);
        assertEquals(text, loaded.toPd());
    }

    @Test(expected = JsonParseException.class)
    public void objectWithoutTextIsRejected() {
        GraphJsonSerializer.fromJsonString("{\"nodes\": [{\"id\": 0, \"type\": \"Object\", \"x\": 10, \"y\": 10}]}");
    }

    @Test(expected = JsonParseException.class)
    public void objectWithBlankTextIsRejected() {
        GraphJsonSerializer.fromJsonString("{\"nodes\": [{\"id\": 0, \"type\": \"Object\", \"text\": \"  \"}]}");
    }
}
