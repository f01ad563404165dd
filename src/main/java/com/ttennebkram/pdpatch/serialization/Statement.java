package com.ttennebkram.pdpatch.serialization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One logical statement of a patch file, without its terminating semicolon.
 * Tokens keep their escape prefixes.
 */
public class Statement {

    private final String text;
    private final int lineNumber;
    private final List<String> tokens;
    private final int[] tokenStarts;

    public Statement(String text, int lineNumber) {
        this.text = text;
        this.lineNumber = lineNumber;
        List<String> found = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        tokenize(text, found, starts);
        this.tokens = Collections.unmodifiableList(found);
        this.tokenStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static void tokenize(String text, List<String> tokens, List<Integer> starts) {
        StringBuilder current = new StringBuilder();
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == PdEscaper.ESCAPE && i + 1 < text.length()) {
                if (start < 0) {
                    start = i;
                }
                current.append(c).append(text.charAt(++i));
            } else if (Character.isWhitespace(c)) {
                if (start >= 0) {
                    tokens.add(current.toString());
                    starts.add(start);
                    current.setLength(0);
                    start = -1;
                }
            } else {
                if (start < 0) {
                    start = i;
                }
                current.append(c);
            }
        }
        if (start >= 0) {
            tokens.add(current.toString());
            starts.add(start);
        }
    }

    public String getText() {
        return text;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public List<String> getTokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public String token(int index) {
        return tokens.get(index);
    }

    /** Tokens from {@code from} to the end. */
    public List<String> tokensFrom(int from) {
        return from >= tokens.size() ? Collections.emptyList() : tokens.subList(from, tokens.size());
    }

    /**
     * Raw statement text starting at token {@code from}, with original
     * spacing; empty when there is no such token. Statement text carries no
     * unescaped trailing whitespace.
     */
    public String rawFrom(int from) {
        if (from >= tokenStarts.length) {
            return "";
        }
        return text.substring(tokenStarts[from]);
    }

    @Override
    public String toString() {
        return lineNumber + ": " + text;
    }
}
