package com.ttennebkram.pdpatch.serialization;

/**
 * Escaping rules for free text stored in patch files.
 *
 * The statement terminator, the message separator and the dollar sign are
 * written with a backslash prefix, and so is the backslash itself, which makes
 * {@link #unescape(String)} the exact inverse of {@link #escape(String)}.
 */
public final class PdEscaper {

    public static final char ESCAPE = '\\';

    private PdEscaper() {
    }

    /** Check if a character must be escaped when written to a patch file. */
    public static boolean isReserved(char c) {
        return c == ';' || c == ',' || c == '$' || c == ESCAPE;
    }

    /**
     * Escape reserved characters in plain text.
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isReserved(c)) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Remove escape prefixes. A backslash always takes the next character
     * literally; a lone trailing backslash is kept.
     */
    public static String unescape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE && i + 1 < text.length()) {
                sb.append(text.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
