package com.ttennebkram.pdpatch.serialization;

import java.math.BigDecimal;

/**
 * Number formatting and parsing for patch file fields.
 */
public final class PdNumbers {

    // Integral values below this magnitude are written without a fraction or exponent
    private static final double PLAIN_INTEGER_LIMIT = 1e15;

    // Decimal exponents written without exponent form, as %g does
    private static final int MIN_PLAIN_EXPONENT = -4;
    private static final int MAX_PLAIN_EXPONENT = 15;

    private PdNumbers() {
    }

    /**
     * Format a number the way patch files write it: integral values as
     * integers, others in the shortest decimal form. Exponent form is used
     * only below 1e-4 or from 1e16 up, C style ({@code 1e+37}, {@code 2.5e-05}).
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot write non-finite number: " + value);
        }
        if (value == Math.rint(value) && Math.abs(value) < PLAIN_INTEGER_LIMIT) {
            return Long.toString((long) value);
        }
        String s = Double.toString(value);
        int e = s.indexOf('E');
        if (e < 0) {
            return s;
        }
        int exponent = Integer.parseInt(s.substring(e + 1));
        if (exponent >= MIN_PLAIN_EXPONENT && exponent <= MAX_PLAIN_EXPONENT) {
            return new BigDecimal(s).stripTrailingZeros().toPlainString();
        }
        String mantissa = stripZeroFraction(s.substring(0, e));
        String digits = Integer.toString(Math.abs(exponent));
        if (digits.length() < 2) {
            digits = "0" + digits;
        }
        return mantissa + "e" + (exponent < 0 ? "-" : "+") + digits;
    }

    private static String stripZeroFraction(String mantissa) {
        return mantissa.endsWith(".0") ? mantissa.substring(0, mantissa.length() - 2) : mantissa;
    }

    /** Parse an integer field. */
    public static int parseInt(String token) {
        return Integer.parseInt(token);
    }

    /** Parse a numeric field, rejecting NaN and infinities. */
    public static double parseDouble(String token) {
        double value = Double.parseDouble(token);
        if (Double.isNaN(value) || Double.isInfinite(value)
                || token.endsWith("d") || token.endsWith("D")
                || token.endsWith("f") || token.endsWith("F")) {
            throw new NumberFormatException("Not a patch number: " + token);
        }
        return value;
    }

    /** Check if a token reads as a number. */
    public static boolean isNumber(String token) {
        try {
            parseDouble(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
