package com.ttennebkram.pdpatch.model;

import com.ttennebkram.pdpatch.layout.LayoutManager;
import com.ttennebkram.pdpatch.layout.Placement;
import com.ttennebkram.pdpatch.nodes.ArrayNode;
import com.ttennebkram.pdpatch.nodes.MessageNode;
import com.ttennebkram.pdpatch.nodes.ObjectNode;
import com.ttennebkram.pdpatch.nodes.PatchNode;
import com.ttennebkram.pdpatch.nodes.SubpatchNode;
import com.ttennebkram.pdpatch.serialization.PatchParser;
import com.ttennebkram.pdpatch.tree.ObjectElement;
import com.ttennebkram.pdpatch.tree.Patch;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PatcherTest {

    @Test
    public void objectCountsComeFromRegistry() {
        Patcher patcher = new Patcher();
        ObjectNode osc = patcher.addObject("osc~ 440");
        ObjectNode ext = patcher.addObject("my-external 1 2");

        assertEquals(Integer.valueOf(2), osc.getNumInlets());
        assertEquals(Integer.valueOf(1), osc.getNumOutlets());
        assertEquals("osc~", osc.getClassName());
        assertEquals(Arrays.asList("440"), osc.getArguments());
        assertNull(ext.getNumInlets());
        assertNull(ext.getNumOutlets());
    }

    @Test
    public void explicitCountsWin() {
        Patcher patcher = new Patcher();
        ObjectNode node = patcher.addObject("osc~", 5, 3, Placement.NEW_ROW);
        assertEquals(Integer.valueOf(5), node.getNumInlets());
        assertEquals(Integer.valueOf(3), node.getNumOutlets());
    }

    @Test
    public void objectTextIsNormalizedAndEscaped() {
        Patcher patcher = new Patcher();
        ObjectNode node = patcher.addObject("  list  append a;b  ");
        MessageNode msg = patcher.addMessage("1, 2; foo $1");

        assertEquals("list append a\\;b", node.getText());
        assertEquals("list append a;b", node.getDisplayText());
        assertEquals("1\\, 2\\; foo \\$1", msg.getContent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyObjectTextIsRejected() {
        new Patcher().addObject("   ");
    }

    @Test
    public void outletBeyondKnownCountIsRejected() {
        Patcher patcher = new Patcher();
        ObjectNode osc = patcher.addObject("osc~");
        ObjectNode dac = patcher.addObject("dac~");
        try {
            patcher.link(osc, 5, dac, 0);
            fail("Expected InvalidConnectionException");
        } catch (InvalidConnectionException e) {
            assertEquals("outlet", e.getPort());
            assertEquals(5, e.getPortIndex());
            assertEquals(Integer.valueOf(1), e.getAvailable());
            assertTrue(e.getMessage().contains("[osc~]"));
        }
        assertTrue(patcher.getConnections().isEmpty());
    }

    @Test
    public void unknownCountsAcceptAnyPort() {
        Patcher patcher = new Patcher();
        ObjectNode ext = patcher.addObject("my-external");
        ObjectNode dac = patcher.addObject("dac~");

        Connection c = patcher.link(ext, 5, dac, 1);
        assertEquals(new Connection(0, 5, 1, 1), c);
        assertTrue(patcher.validate(false).isValid());
    }

    @Test(expected = InvalidConnectionException.class)
    public void negativeInletIsRejected() {
        Patcher patcher = new Patcher();
        patcher.addObject("my-external");
        patcher.addObject("my-external");
        patcher.link(0, 0, 1, -1);
    }

    @Test
    public void missingNodeIsReported() {
        Patcher patcher = new Patcher();
        patcher.addObject("osc~");
        try {
            patcher.getNode(7);
            fail("Expected NodeNotFoundException");
        } catch (NodeNotFoundException e) {
            assertEquals(7, e.getIndex());
        }
        try {
            patcher.link(0, 0, 3, 0);
            fail("Expected NodeNotFoundException");
        } catch (NodeNotFoundException e) {
            assertEquals(3, e.getIndex());
        }
    }

    @Test(expected = NodeNotFoundException.class)
    public void foreignNodeCannotBeLinked() {
        Patcher patcher = new Patcher();
        ObjectNode osc = patcher.addObject("osc~");
        patcher.link(osc, ObjectNode.create("dac~", null, null));
    }

    @Test
    public void outletHandleChains() {
        Patcher patcher = new Patcher();
        ObjectNode osc = patcher.addObject("osc~ 220");
        ObjectNode dac = patcher.addObject("dac~");
        patcher.link(osc.outlet(0), dac, 0);
        patcher.link(osc.outlet(0), 1, 1);

        assertEquals(Arrays.asList(new Connection(0, 0, 1, 0), new Connection(0, 0, 1, 1)),
                patcher.getConnections());
    }

    @Test(expected = InvalidConnectionException.class)
    public void outletHandleChecksRange() {
        new Patcher().addObject("dac~").outlet(0);
    }

    @Test
    public void validateReportsCyclesAsWarnings() {
        Patcher patcher = new Patcher();
        patcher.addObject("+ 1");
        patcher.addObject("f");
        patcher.addObject("print");
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 0, 0);
        patcher.link(1, 0, 2, 0);

        ValidationReport report = patcher.validate(true);
        assertTrue(report.isValid());
        assertTrue(report.hasCycles());
        assertEquals(1, report.getCycleWarnings().size());
        assertEquals(Arrays.asList(0, 1), report.getCycleWarnings().get(0).getNodes());

        assertFalse(patcher.validate(false).hasCycles());
    }

    @Test
    public void validateReportsBadPortsFromLoadedFiles() throws Exception {
        Patcher patcher = Patcher.fromPatch(PatchParser.parse(
                "#N canvas 0 50 450 300 12;\n"
                        + "#X obj 10 10 osc~;\n"
                        + "#X obj 10 40 dac~;\n"
                        + "#X connect 0 3 1 0;\n"));

        ValidationReport report = patcher.validate(true);
        assertFalse(report.isValid());
        assertEquals(1, report.getErrors().size());
        assertTrue(report.getErrors().get(0) instanceof InvalidConnectionException);
        try {
            report.throwIfInvalid();
            fail("Expected PatchConnectionException");
        } catch (PatchConnectionException expected) {
            // expected
        }
    }

    @Test
    public void removeNodesRenumbersConnections() {
        Patcher patcher = new Patcher();
        for (int i = 0; i < 4; i++) {
            patcher.addObject("f");
        }
        PatchNode last = patcher.getNode(3);
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 2, 0);
        patcher.link(2, 0, 3, 0);
        patcher.link(0, 0, 3, 1);

        int dropped = patcher.removeNodes(Arrays.asList(1));

        assertEquals(2, dropped);
        assertEquals(3, patcher.size());
        assertSame(last, patcher.getNode(2));
        assertEquals(Arrays.asList(new Connection(1, 0, 2, 0), new Connection(0, 0, 2, 1)),
                patcher.getConnections());
    }

    @Test
    public void removeNodeByReference() {
        Patcher patcher = new Patcher();
        ObjectNode a = patcher.addObject("f");
        ObjectNode b = patcher.addObject("print");
        patcher.link(a, b);

        assertSame(a, patcher.removeNode(a));
        assertEquals(1, patcher.size());
        assertTrue(patcher.getConnections().isEmpty());
        assertEquals(-1, patcher.indexOf(a));
    }

    @Test
    public void insertNodeShiftsLaterIndices() {
        Patcher patcher = new Patcher();
        patcher.addObject("f");
        patcher.addObject("print");
        patcher.link(0, 0, 1, 0);

        ObjectNode inserted = ObjectNode.create("t b", null, null);
        patcher.insertNode(1, inserted);

        assertSame(inserted, patcher.getNode(1));
        assertEquals(Arrays.asList(new Connection(0, 0, 2, 0)), patcher.getConnections());
    }

    @Test(expected = IllegalArgumentException.class)
    public void nodeCannotBeAddedTwice() {
        Patcher patcher = new Patcher();
        ObjectNode node = patcher.addObject("f");
        patcher.add(node);
    }

    @Test
    public void subpatchCountsFollowBoundaryObjects() {
        Patcher inner = new Patcher();
        inner.addObject("inlet");
        inner.addObject("inlet~");
        inner.addObject("outlet");

        Patcher outer = new Patcher();
        SubpatchNode sub = outer.addSubpatch("voice", inner, 5, 5, Placement.NEW_ROW);

        assertEquals(Integer.valueOf(2), sub.getNumInlets());
        assertEquals(Integer.valueOf(1), sub.getNumOutlets());
        assertEquals(Integer.valueOf(5), sub.getDeclaredInlets());
        assertTrue(inner.getCanvas().isSubpatchForm());
    }

    @Test
    public void subpatchWithoutBoundaryUsesGivenCounts() {
        Patcher outer = new Patcher();
        SubpatchNode sub = outer.addSubpatch("empty", new Patcher(), 1, null, Placement.NEW_ROW);
        assertEquals(Integer.valueOf(1), sub.getNumInlets());
        assertEquals(Integer.valueOf(0), sub.getNumOutlets());
    }

    @Test(expected = IllegalArgumentException.class)
    public void innerPatchHasOneOwner() {
        Patcher inner = new Patcher();
        Patcher outer = new Patcher();
        outer.addSubpatch("a", inner);
        outer.addSubpatch("b", inner);
    }

    @Test
    public void abstractionCountsFromDefinition() throws Exception {
        Patch definition = PatchParser.parse(
                "#N canvas 0 50 450 300 12;\n"
                        + "#X obj 10 10 inlet~;\n"
                        + "#X obj 10 40 inlet;\n"
                        + "#X obj 10 70 outlet~;\n");

        Patcher patcher = new Patcher();
        PatchNode node = patcher.addAbstraction("voice 440", definition, "voice.pd", Placement.NEW_ROW);

        assertEquals(Integer.valueOf(2), node.getNumInlets());
        assertEquals(Integer.valueOf(1), node.getNumOutlets());
        assertTrue(node.isProtected());
    }

    @Test
    public void connectionStats() {
        Patcher patcher = new Patcher();
        patcher.addObject("osc~");
        patcher.addObject("dac~");
        patcher.addObject("my-external");
        patcher.link(0, 0, 1, 0);
        patcher.link(0, 0, 1, 1);

        ConnectionStats stats = patcher.getConnectionStats();
        assertEquals(2, stats.totalConnections);
        assertEquals(2, stats.nodesWithConnections);
        assertEquals(1, stats.maxInletUsed);
        assertEquals(0, stats.maxOutletUsed);
        assertEquals(66.7, stats.validationCoverage, 1e-9);

        assertEquals(0, new Patcher().getConnectionStats().totalConnections);
    }

    @Test
    public void nodesArePlacedThroughLayoutManager() {
        LayoutManager layout = Mockito.mock(LayoutManager.class);
        Patcher patcher = new Patcher(layout);

        ObjectNode node = patcher.addObject("osc~", Placement.SAME_ROW);
        ArrayNode array = patcher.addArray("table", 64);

        Mockito.verify(layout).place(node, Placement.SAME_ROW);
        Mockito.verify(layout, Mockito.never()).place(Mockito.eq(array), Mockito.any());

        patcher.removeNode(node);
        Mockito.verify(layout).nodeRemoved(node);
    }

    @Test
    public void sameRowGoesRightOfPreviousNode() {
        Patcher patcher = new Patcher();
        ObjectNode first = patcher.addObject("osc~");
        ObjectNode second = patcher.addObject("dac~", Placement.SAME_ROW);
        ObjectNode third = patcher.addObject("print");

        assertEquals(first.y, second.y);
        assertTrue(second.x > first.x);
        assertEquals(first.x, third.x);
        assertTrue(third.y > first.y);
    }

    @Test
    public void toPatchKeepsIndicesAndConnections() throws Exception {
        Patcher patcher = new Patcher();
        patcher.addObject("osc~ 440", Placement.at(10, 10));
        patcher.addObject("*~ 0.1", Placement.at(10, 40));
        patcher.addObject("dac~", Placement.at(10, 70));
        patcher.link(0, 0, 1, 0);
        patcher.link(1, 0, 2, 0);
        patcher.link(1, 0, 2, 1);

        Patch patch = PatchParser.parse(patcher.toPd());
        ObjectElement osc = (ObjectElement) patch.getIndexedElements().get(0);
        ObjectElement gain = (ObjectElement) patch.getIndexedElements().get(1);
        assertEquals("osc~ 440", osc.getText());
        assertEquals(40, gain.getPosition().getY());
        assertEquals(3, patch.getConnections().size());
        assertEquals(2, patch.getConnections().get(2).getSink());
        assertEquals(1, patch.getConnections().get(2).getInlet());
    }
}
