package com.ttennebkram.pdpatch.serialization;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PdNumbersTest {

    @Test
    public void integralValuesPrintWithoutFraction() {
        assertEquals("0", PdNumbers.format(0.0));
        assertEquals("127", PdNumbers.format(127.0));
        assertEquals("-5", PdNumbers.format(-5.0));
    }

    @Test
    public void fractionsUseShortestForm() {
        assertEquals("0.3", PdNumbers.format(0.3));
        assertEquals("-0.25", PdNumbers.format(-0.25));
    }

    @Test
    public void exponentsUseCStyle() {
        assertEquals("1e+37", PdNumbers.format(1e37));
        assertEquals("2.5e-05", PdNumbers.format(2.5e-5));
    }

    @Test
    public void plainFormInsideGeneralRange() {
        assertEquals("0.0005", PdNumbers.format(0.0005));
        assertEquals("-0.00012", PdNumbers.format(-0.00012));
        assertEquals("12345678.5", PdNumbers.format(12345678.5));
        assertEquals("1234567890123.25", PdNumbers.format(1234567890123.25));
        assertEquals("1e+16", PdNumbers.format(1e16));
        assertEquals("5e-05", PdNumbers.format(0.00005));
    }

    @Test(expected = IllegalArgumentException.class)
    public void nanCannotBeWritten() {
        PdNumbers.format(Double.NaN);
    }

    @Test
    public void parsesOnlyPatchNumbers() {
        assertEquals(1e37, PdNumbers.parseDouble("1e+37"), 0.0);
        assertTrue(PdNumbers.isNumber("-0.5"));
        assertFalse(PdNumbers.isNumber("NaN"));
        assertFalse(PdNumbers.isNumber("Infinity"));
        assertFalse(PdNumbers.isNumber("1f"));
        assertFalse(PdNumbers.isNumber("empty"));
    }
}
