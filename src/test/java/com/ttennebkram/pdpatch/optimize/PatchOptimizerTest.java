package com.ttennebkram.pdpatch.optimize;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.ttennebkram.pdpatch.layout.Placement;
import com.ttennebkram.pdpatch.model.Connection;
import com.ttennebkram.pdpatch.model.Patcher;
import com.ttennebkram.pdpatch.nodes.NodeKind;
import com.ttennebkram.pdpatch.nodes.ObjectNode;
import com.ttennebkram.pdpatch.nodes.SubpatchNode;
import com.ttennebkram.pdpatch.serialization.PatchParser;
import com.ttennebkram.pdpatch.tree.AtomElement;
import com.ttennebkram.pdpatch.tree.Patch;
import com.ttennebkram.pdpatch.tree.gui.BangElement;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class PatchOptimizerTest {

    private static final Set<String> CHANGE = Collections.singleton("change");

    @Test
    public void duplicateAndUnusedAreRemoved() {
        Patcher patcher = new Patcher();
        ObjectNode osc = patcher.addObject("osc~ 440");
        ObjectNode gain = patcher.addObject("*~ 0.3");
        ObjectNode dac = patcher.addObject("dac~");
        patcher.addObject("+ 1");
        patcher.link(osc, gain);
        patcher.link(gain, dac);
        patcher.link(gain, dac);

        OptimizeStats stats = patcher.optimize(false);

        assertEquals(1, stats.getNodesRemoved());
        // counted as connections before minus connections after
        assertEquals(1, stats.getConnectionsRemoved());
        assertEquals(1, stats.getDuplicatesRemoved());
        assertEquals(0, stats.getPassThroughsCollapsed());
        assertEquals(Arrays.asList(osc, gain, dac), patcher.getNodes());
        assertEquals(Arrays.asList(new Connection(0, 0, 1, 0), new Connection(1, 0, 2, 0)),
                patcher.getConnections());
    }

    @Test
    public void secondRunChangesNothing() {
        Patcher patcher = new Patcher();
        patcher.addObject("metro 100");
        patcher.addObject("change");
        patcher.addObject("print");
        patcher.addObject("f");
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 2, 0);
        patcher.link(1, 0, 2, 0);

        assertFalse(patcher.optimize(false, CHANGE).isEmpty());
        String once = patcher.toPd();
        OptimizeStats again = patcher.optimize(false, CHANGE);

        assertTrue(again.isEmpty());
        assertEquals(once, patcher.toPd());
    }

    @Test
    public void protectedNodesSurvive() {
        Patcher patcher = new Patcher();
        patcher.addMessage("bang");
        patcher.addComment("notes");
        patcher.addFloatAtom(Placement.NEW_ROW);
        patcher.addAtom(AtomElement.symbolAtom(null).withSendReceive("-", "name"), Placement.NEW_ROW);
        patcher.addGui(BangElement.builder().build(), Placement.NEW_ROW);
        patcher.addSubpatch("sub", new Patcher());
        patcher.addArray("table", 8);
        patcher.addAbstraction("voice", 1, 1, "voice.pd", Placement.NEW_ROW);
        patcher.addObject("r unused");

        OptimizeStats stats = patcher.optimize(false);

        assertEquals(1, stats.getNodesRemoved());
        assertEquals(8, patcher.size());
    }

    @Test
    public void passThroughChainCollapses() {
        Patcher patcher = new Patcher();
        patcher.addObject("metro 100");
        patcher.addObject("change");
        patcher.addObject("change");
        ObjectNode print = patcher.addObject("print");
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 2, 0);
        patcher.link(2, 0, 3, 0);

        OptimizeStats stats = patcher.optimize(false, CHANGE);

        assertEquals(2, stats.getPassThroughsCollapsed());
        assertEquals(2, stats.getNodesRemoved());
        assertEquals(2, stats.getConnectionsRemoved());
        assertEquals(2, patcher.size());
        assertSame(print, patcher.getNode(1));
        assertEquals(Collections.singletonList(new Connection(0, 0, 1, 0)), patcher.getConnections());
    }

    @Test
    public void bypassKeepsPortNumbers() {
        Patcher patcher = new Patcher();
        patcher.addObject("moses 10");
        patcher.addObject("change");
        patcher.addObject("pack f f");
        patcher.link(0, 1, 1, 0);
        patcher.link(1, 0, 2, 1);

        patcher.optimize(false, CHANGE);

        assertEquals(Collections.singletonList(new Connection(0, 1, 1, 1)), patcher.getConnections());
    }

    @Test
    public void collapseNeedsExactlyOneInAndOut() {
        Patcher patcher = new Patcher();
        patcher.addObject("metro 100");
        patcher.addObject("change");
        patcher.addObject("print");
        patcher.addObject("print");
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 2, 0);
        patcher.link(1, 0, 3, 0);

        OptimizeStats stats = patcher.optimize(false, CHANGE);

        assertEquals(0, stats.getPassThroughsCollapsed());
        assertEquals(4, patcher.size());
    }

    @Test
    public void objectsWithArgumentsOrOtherClassesStay() {
        Patcher patcher = new Patcher();
        patcher.addObject("metro 100");
        patcher.addObject("change 5");
        patcher.addObject("f");
        patcher.addObject("print");
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 2, 0);
        patcher.link(2, 0, 3, 0);

        assertEquals(0, patcher.optimize(false, CHANGE).getPassThroughsCollapsed());
        assertEquals(4, patcher.size());
    }

    @Test
    public void collapseNeedsSingleInletAndOutlet() {
        Patcher patcher = new Patcher();
        patcher.addObject("metro 100");
        patcher.addObject("moses");
        patcher.addObject("print");
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 2, 0);

        OptimizeStats stats = patcher.optimize(false, Collections.singleton("moses"));

        assertEquals(0, stats.getPassThroughsCollapsed());
    }

    @Test
    public void unknownArityCanCollapse() {
        Patcher patcher = new Patcher();
        patcher.addObject("metro 100");
        patcher.addObject("my-thru");
        patcher.addObject("print");
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 2, 0);

        OptimizeStats stats = patcher.optimize(false, Collections.singleton("my-thru"));

        assertEquals(1, stats.getPassThroughsCollapsed());
        assertEquals(2, patcher.size());
    }

    @Test
    public void selfLoopIsNotCollapsed() {
        Patcher patcher = new Patcher();
        patcher.addObject("change");
        patcher.link(0, 0, 0, 0);

        OptimizeStats stats = patcher.optimize(false, CHANGE);

        assertTrue(stats.isEmpty());
        assertEquals(1, patcher.size());
    }

    @Test
    public void recursiveRunAggregatesSubpatches() {
        Patcher inner = new Patcher();
        inner.addObject("inlet");
        inner.addObject("print");
        inner.addObject("+ 1");
        inner.link(0, 0, 1, 0);
        inner.link(0, 0, 1, 0);

        Patcher outer = new Patcher();
        SubpatchNode sub = outer.addSubpatch("sub", inner);
        outer.addObject("loadbang");
        outer.link(1, 0, 0, 0);

        OptimizeStats stats = outer.optimize(true);

        assertEquals(1, stats.getSubpatchesOptimized());
        assertEquals(1, stats.getNodesRemoved());
        assertEquals(1, stats.getDuplicatesRemoved());
        assertEquals(2, sub.getInner().size());
        assertEquals(2, outer.size());
    }

    @Test
    public void flatRunLeavesSubpatchesAlone() {
        Patcher inner = new Patcher();
        inner.addObject("+ 1");
        Patcher outer = new Patcher();
        outer.addSubpatch("sub", inner);

        OptimizeStats stats = outer.optimize(false);

        assertTrue(stats.isEmpty());
        assertEquals(1, inner.size());
    }

    @Test
    public void statsUseSnakeCaseJson() {
        Patcher patcher = new Patcher();
        patcher.addObject("+ 1");
        OptimizeStats stats = patcher.optimize(false);

        JsonObject json = new Gson().toJsonTree(stats).getAsJsonObject();
        assertEquals(1, json.get("nodes_removed").getAsInt());
        assertEquals(0, json.get("pass_throughs_collapsed").getAsInt());
        assertTrue(json.has("subpatches_optimized"));
    }

    @Test
    public void hexColorWidgetsSurviveUnconnected() throws Exception {
        Patch patch = PatchParser.parse(String.join("\n",
                "#N canvas 0 50 450 300 12;",
                "#X obj 10 10 bng 25 250 50 0 empty empty empty 0 -8 0 12 #fcfcfc #000000 #000000;",
                "#X obj 10 50 tgl 15 0 empty empty empty 17 7 0 10 #fcfcfc #000000 #000000 0 1;",
                "#X obj 10 90 bng;",
                "#X obj 10 130 metro 100;",
                ""));
        Patcher patcher = Patcher.fromPatch(patch);

        OptimizeStats stats = patcher.optimize(false);

        assertEquals(1, stats.getNodesRemoved());
        assertEquals(3, patcher.size());
        assertEquals(NodeKind.GUI, patcher.getNode(0).getKind());
        assertEquals(NodeKind.GUI, patcher.getNode(1).getKind());
        assertEquals("bng", ((ObjectNode) patcher.getNode(2)).getClassName());
    }
}
