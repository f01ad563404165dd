package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.serialization.PatchParser;
import com.ttennebkram.pdpatch.tree.Element;
import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.ObjectElement;
import com.ttennebkram.pdpatch.tree.Position;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class IemGuiParsersTest {

    private static IemGuiElement widget(String statement) throws Exception {
        Element element = PatchParser.parseElement(statement);
        assertTrue(statement, element instanceof IemGuiElement);
        assertEquals(statement + ";", element.toPd());
        return (IemGuiElement) element;
    }

    @Test
    public void radioGroups() throws Exception {
        RadioElement h = (RadioElement) widget(
                "#X obj 10 10 hradio 15 1 0 8 empty empty empty 0 -8 0 10 -262144 -1 -1 0");
        RadioElement v = (RadioElement) widget(
                "#X obj 10 10 vdl 15 1 0 4 empty radio-in empty 0 -8 0 10 -262144 -1 -1 2");

        assertEquals(ElementKind.HRADIO, h.getKind());
        assertEquals(120, h.getWidth());
        assertEquals(15, h.getHeight());
        assertEquals(ElementKind.VRADIO, v.getKind());
        assertEquals(60, v.getHeight());
        assertEquals("vdl", v.getClassName());
        assertTrue(v.hasActiveSendReceive());
    }

    @Test
    public void sliders() throws Exception {
        SliderElement slider = (SliderElement) widget(
                "#X obj 10 10 vsl 15 128 0 127 0 0 empty empty empty 0 -9 0 10 -262144 -1 -1 0 1");
        assertEquals(ElementKind.VSLIDER, slider.getKind());
        assertEquals(127.0, slider.getMax(), 0.0);
        assertEquals(128, slider.getHeight());
        assertEquals(1, slider.getNumInlets());
        assertEquals(1, slider.getNumOutlets());
    }

    @Test
    public void numberBoxWithExponentRange() throws Exception {
        NumberBoxElement box = (NumberBoxElement) widget(
                "#X obj 10 10 nbx 5 14 -1e+37 1e+37 0 0 empty empty empty 0 -8 0 10 -262144 -1 -1 0 256");
        assertEquals(ElementKind.NUMBER_BOX, box.getKind());
        assertEquals(5, box.getDigits());
        assertEquals(1e37, box.getMax(), 0.0);
    }

    @Test
    public void canvasAndMeterKeepTrailingFields() throws Exception {
        CnvElement cnv = (CnvElement) widget(
                "#X obj 10 10 cnv 15 100 60 empty empty empty 20 12 0 14 -233017 -66577 0");
        VuElement vu = (VuElement) widget(
                "#X obj 10 10 vu 15 120 empty empty -1 -8 0 10 -66577 -1 1 0");

        assertEquals(Arrays.asList("0"), cnv.getExtra());
        assertEquals(0, cnv.getNumInlets());
        assertEquals(0, cnv.getNumOutlets());
        assertEquals(100, cnv.getWidth());
        assertEquals(Arrays.asList("0"), vu.getExtra());
        assertEquals(2, vu.getNumInlets());
        assertEquals(1, vu.getScale());
    }

    @Test
    public void shortOrNonNumericFieldsStayObjects() throws Exception {
        assertTrue(PatchParser.parseElement("#X obj 10 10 vsl 15 128") instanceof ObjectElement);
        assertTrue(PatchParser.parseElement("#X obj 10 10 hradio big 1 0 8 empty empty empty 0 -8 0 10 "
                + "-262144 -1 -1 0") instanceof ObjectElement);
        assertNull(IemGuiParsers.parse(Position.ORIGIN, "metro", Arrays.asList("100")));
        assertFalse(IemGuiParsers.isWidgetClass("metro"));
    }

    @Test
    public void builderDefaultsAndCopies() {
        RadioElement radio = RadioElement.horizontal().position(20, 30).number(4).build();
        assertEquals("#X obj 20 30 hradio 15 0 0 4 empty empty empty 0 -8 0 10 -262144 -1 -1 0;", radio.toPd());

        IemGuiElement renamed = radio.withSendReceive("out", "in");
        assertEquals("out", renamed.getSend());
        assertEquals("in", renamed.getReceive());
        assertEquals(4, ((RadioElement) renamed).getNumber());
        assertEquals("empty", radio.getSend());

        SliderElement slider = SliderElement.horizontal().size(128, 15).range(0, 1).build();
        SliderElement copy = (SliderElement) slider.toBuilder().range(-1, 1).build();
        assertEquals(-1.0, copy.getMin(), 0.0);
        assertEquals(128, copy.getWidth());
    }

    @Test
    public void hexColorsKeepTheWidgetVariant() throws Exception {
        BangElement bang = (BangElement) widget(
                "#X obj 10 10 bng 25 250 50 0 empty empty empty 0 -8 0 12 #fcfcfc #000000 #000000");
        ToggleElement toggle = (ToggleElement) widget(
                "#X obj 10 40 tgl 15 0 empty empty empty 17 7 0 10 #fcfcfc #000000 #000000 0 1");
        CnvElement cnv = (CnvElement) widget(
                "#X obj 10 80 cnv 15 100 60 empty empty empty 20 12 0 14 #e0e0e0 #404040 0");

        assertEquals(ElementKind.BANG, bang.getKind());
        assertEquals("#fcfcfc", bang.getBgColor());
        assertEquals("#000000", bang.getLabelColor());
        assertEquals(25, bang.getSize());
        assertEquals(ElementKind.TOGGLE, toggle.getKind());
        assertEquals("#404040", cnv.getLabelColor());
    }

    @Test
    public void packedAndHexColorsMixInOneWidget() throws Exception {
        SliderElement slider = (SliderElement) widget(
                "#X obj 10 10 hsl 128 15 0 127 0 0 empty empty empty -2 -8 0 10 -262144 #000000 -1 0 1");
        assertEquals("-262144", slider.getBgColor());
        assertEquals("#000000", slider.getFgColor());
    }

    @Test
    public void tokenThatIsNoColorKeepsAnObject() throws Exception {
        assertTrue(PatchParser.parseElement("#X obj 10 10 bng 15 250 50 0 empty empty empty 17 7 0 10 "
                + "red -1 -1") instanceof ObjectElement);
        assertFalse(IemGuiElement.isColor("#fcfc"));
        assertTrue(IemGuiElement.isColor("#A0b0C0"));
        assertTrue(IemGuiElement.isColor("-1"));
    }

    @Test
    public void builderWritesHexColors() {
        BangElement bang = BangElement.builder().position(5, 5).colors("#ff0000", "#00ff00", "#0000ff").build();
        assertEquals("#X obj 5 5 bng 15 250 50 0 empty empty empty 17 7 0 10 #ff0000 #00ff00 #0000ff;",
                bang.toPd());
    }

    @Test(expected = IllegalArgumentException.class)
    public void builderRejectsNonColors() {
        ToggleElement.builder().colors("white", "-1", "-1");
    }
}
