package com.ttennebkram.pdpatch.serialization;

import com.ttennebkram.pdpatch.tree.AtomElement;
import com.ttennebkram.pdpatch.tree.ConnectElement;
import com.ttennebkram.pdpatch.tree.DeclareElement;
import com.ttennebkram.pdpatch.tree.Element;
import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.MessageElement;
import com.ttennebkram.pdpatch.tree.ObjectElement;
import com.ttennebkram.pdpatch.tree.OpaqueElement;
import com.ttennebkram.pdpatch.tree.Patch;
import com.ttennebkram.pdpatch.tree.ScalarElement;
import com.ttennebkram.pdpatch.tree.SubpatchElement;
import com.ttennebkram.pdpatch.tree.TextElement;
import com.ttennebkram.pdpatch.tree.gui.BangElement;
import com.ttennebkram.pdpatch.tree.gui.ToggleElement;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PatchParserTest {

    private static final String SYNTH = String.join("\n",
            "#N canvas 0 50 450 300 12;",
            "#X declare -path lib;",
            "#X obj 30 30 osc~ 440;",
            "#X obj 30 70 *~ 0.3;",
            "#X obj 30 110 dac~;",
            "#X msg 120 30 440\\, 880 100;",
            "#X text 200 30 gain stage\\; keep low;",
            "#X floatatom 120 70 5 0 127 0 - freq -;",
            "#X symbolatom 120 110 10 0 0 0 - - -;",
            "#X obj 250 70 bng 15 250 50 0 empty b-in empty 17 7 0 10 -262144 -1 -1;",
            "#X obj 250 110 tgl 15 0 empty empty empty 17 7 0 10 -262144 -1 -1 0 1;",
            "#N canvas 0 0 300 180 inner 0;",
            "#X obj 10 10 inlet;",
            "#X obj 10 60 outlet;",
            "#X connect 0 0 1 0;",
            "#X restore 30 150 pd inner;",
            "#X f 20;",
            "#X connect 0 0 1 0;",
            "#X connect 1 0 2 0;",
            "#X connect 1 0 2 1;",
            "");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void serializerOutputRoundTripsExactly() throws Exception {
        Patch patch = PatchParser.parse(SYNTH);
        assertEquals(SYNTH, PatchSerializer.serialize(patch));
    }

    @Test
    public void parsesTypedElements() throws Exception {
        Patch patch = PatchParser.parse(SYNTH);
        assertEquals(12, patch.getCanvas().getFontSize().intValue());

        Element declare = patch.getElements().get(0);
        assertTrue(declare instanceof DeclareElement);
        assertEquals(Arrays.asList("lib"), ((DeclareElement) declare).getPaths());

        ObjectElement osc = (ObjectElement) patch.getElements().get(1);
        assertEquals("osc~", osc.getClassName());
        assertEquals(Arrays.asList("440"), osc.getArguments());
        assertEquals(30, osc.getPosition().getX());

        assertEquals("440\\, 880 100", ((MessageElement) patch.getElements().get(4)).getContent());
        assertEquals("gain stage\\; keep low", ((TextElement) patch.getElements().get(5)).getContent());

        AtomElement atom = (AtomElement) patch.getElements().get(6);
        assertEquals(127.0, atom.getUpper(), 0.0);
        assertEquals("freq", atom.getReceive());

        BangElement bang = (BangElement) patch.getElements().get(8);
        assertEquals("b-in", bang.getReceive());
        assertEquals(250, bang.getHold());
        assertTrue(patch.getElements().get(9) instanceof ToggleElement);

        SubpatchElement inner = (SubpatchElement) patch.getElements().get(10);
        assertEquals("inner", inner.getName());
        assertEquals(3, inner.getElements().size());

        assertTrue(patch.getElements().get(11) instanceof OpaqueElement);
        assertEquals(3, patch.getConnections().size());
    }

    @Test
    public void declareDoesNotTakeAnIndex() throws Exception {
        Patch patch = PatchParser.parse(SYNTH);
        // osc~ is index 0 although the declare comes first
        ConnectElement first = patch.getConnections().get(0);
        assertEquals(0, first.getSource());
        assertEquals(ElementKind.OBJECT, patch.getIndexedElements().get(first.getSource()).getKind());
        assertEquals(10, patch.getIndexedElements().size());
    }

    @Test
    public void numericSubpatchNameIsStillASubpatch() throws Exception {
        String text = "#N canvas 0 50 450 300 12;\n"
                + "#N canvas 0 0 450 300 42 0;\n"
                + "#X obj 10 10 inlet;\n"
                + "#X restore 20 20 pd 42;\n";
        Patch patch = PatchParser.parse(text);
        assertEquals(1, patch.getElements().size());
        SubpatchElement sub = (SubpatchElement) patch.getElements().get(0);
        assertTrue(sub.getCanvas().isSubpatchForm());
        assertEquals("42", sub.getCanvas().getName());
        assertEquals("42", sub.getName());
        assertEquals(text, PatchSerializer.serialize(patch));
    }

    @Test
    public void escapedSemicolonInLabelRoundTrips() throws Exception {
        String label = "a; b, $1";
        String text = "#N canvas 0 50 450 300 12;\n#X text 10 10 " + PdEscaper.escape(label) + ";\n";
        Patch patch = PatchParser.parse(text);
        TextElement comment = (TextElement) patch.getElements().get(0);
        assertEquals(label, PdEscaper.unescape(comment.getContent()));
        assertEquals(text, PatchSerializer.serialize(patch));
    }

    @Test
    public void widgetWithTooFewFieldsStaysAnObject() throws Exception {
        Patch patch = PatchParser.parse("#N canvas 0 50 450 300 12;\n#X obj 10 10 bng;\n#X obj 10 40 tgl 15 x;\n");
        assertEquals(ElementKind.OBJECT, patch.getElements().get(0).getKind());
        assertEquals(ElementKind.OBJECT, patch.getElements().get(1).getKind());
    }

    @Test
    public void foreignSpacingSurvivesInMessages() throws Exception {
        Patch patch = PatchParser.parse("#N canvas 0 50 450 300 12;\n#X msg 10 10 set   1  2;\n");
        assertEquals("set   1  2", ((MessageElement) patch.getElements().get(0)).getContent());
        Patch again = PatchParser.parse(PatchSerializer.serialize(patch));
        assertEquals(patch, again);
    }

    @Test
    public void unknownDirectivesArePreserved() throws Exception {
        String text = "#N canvas 0 50 450 300 12;\n#X array tab 4 float 3;\n#A 0 1 2 3 4;\n";
        Patch patch = PatchParser.parse(text);
        assertEquals(ElementKind.ARRAY, patch.getElements().get(0).getKind());
        assertEquals(ElementKind.OPAQUE, patch.getElements().get(1).getKind());
        assertEquals(text, PatchSerializer.serialize(patch));
    }

    @Test
    public void readsFiles() throws Exception {
        Path file = folder.newFile("synth.pd").toPath();
        PatchSerializer.write(PatchParser.parse(SYNTH), file);
        assertEquals(PatchParser.parse(SYNTH), PatchParser.read(file));
    }

    @Test
    public void rejectsMalformedInput() {
        assertParseError("", "Empty patch");
        assertParseError("#X obj 10 10 osc~;\n", "Statement before the first canvas");
        assertParseError("#N canvas 0 50 450 300 12;\nfoo bar;\n", "Unrecognized statement");
        assertParseError("#N canvas 0 50 450 300 12;\n#X obj ten 10 osc~;\n", "Invalid number");
        assertParseError("#N canvas 0 50 450 300 12;\n#X obj 10 10;\n", "Object box without a class");
        assertParseError("#N canvas 0 50 450 300 12;\n#X restore 0 0 pd x;\n", "Restore without matching canvas");
        assertParseError("#N canvas 0 50 450 300 12;\n#N canvas 0 0 100 100 sub 0;\n", "Unterminated subpatch");
        assertParseError("#N canvas 0 50 450 300 12;\n#X obj 10 10 f;\n#X connect 0 0 1 0;\n",
                "Connection refers to a missing element");
        assertParseError("#N canvas 0 50 450 300 12;\n#X connect 0 0 -1 0;\n", "Negative index");
    }

    @Test
    public void errorCarriesLineNumber() {
        try {
            PatchParser.parse("#N canvas 0 50 450 300 12;\n#X obj 1 1 f;\n#X floatatom 1 x 5;\n");
            fail("expected a parse error");
        } catch (PatchParseException e) {
            assertEquals(3, e.getLineNumber());
            assertTrue(e.getMessage().startsWith("line 3: "));
        }
    }

    @Test
    public void parsesSingleStatements() throws Exception {
        Element element = PatchParser.parseElement("#X obj 5 6 metro 100");
        assertEquals("#X obj 5 6 metro 100;", element.toPd());
        assertFalse(element instanceof OpaqueElement);
    }

    private static void assertParseError(String text, String reason) {
        try {
            PatchParser.parse(text);
            fail("expected a parse error for: " + text);
        } catch (PatchParseException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(reason));
        }
    }

    @Test
    public void scalarTakesAnIndex() throws Exception {
        String text = String.join("\n",
                "#N canvas 0 50 450 300 12;",
                "#X obj 10 10 loadbang;",
                "#X scalar point 10 10 \\;;",
                "#X obj 10 60 print;",
                "#X connect 0 0 2 0;",
                "");
        Patch patch = PatchParser.parse(text);

        Element scalar = patch.getElements().get(1);
        assertEquals(ElementKind.SCALAR, scalar.getKind());
        assertEquals("point", ((ScalarElement) scalar).getTemplate());
        assertEquals(Arrays.asList(patch.getElements().get(0), scalar, patch.getElements().get(2)),
                patch.getIndexedElements());
        assertEquals(text, PatchSerializer.serialize(patch));
    }
}
