package com.ttennebkram.pdpatch.serialization;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits patch text into statements.
 *
 * Line endings are normalized first. A backslash directly before a newline
 * continues the statement on the next line and is removed together with the
 * newline; any other backslash escapes the following character, so an
 * escaped semicolon never ends a statement.
 */
public final class StatementReader {

    private StatementReader() {
    }

    public static List<Statement> split(String content) throws PatchParseException {
        String text = content.replace("\r\n", "\n").replace('\r', '\n');
        List<Statement> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int line = 1;
        int startLine = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == PdEscaper.ESCAPE && i + 1 < text.length()) {
                char next = text.charAt(++i);
                if (next == '\n') {
                    line++;
                    continue;
                }
                if (startLine == 0) {
                    startLine = line;
                }
                current.append(c).append(next);
            } else if (c == ';') {
                String stmt = stripTrailing(current);
                if (!stmt.isEmpty()) {
                    statements.add(new Statement(stmt, startLine));
                }
                current.setLength(0);
                startLine = 0;
            } else {
                if (c == '\n') {
                    line++;
                } else if (startLine == 0 && !Character.isWhitespace(c)) {
                    startLine = line;
                }
                if (startLine != 0) {
                    current.append(c);
                }
            }
        }

        String rest = stripTrailing(current);
        if (!rest.isEmpty()) {
            throw new PatchParseException("Unterminated statement", startLine, rest, null);
        }
        return statements;
    }

    /** Drop trailing whitespace that is not escaped. */
    static String stripTrailing(CharSequence text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            int slashes = 0;
            for (int i = end - 2; i >= 0 && text.charAt(i) == PdEscaper.ESCAPE; i--) {
                slashes++;
            }
            if (slashes % 2 == 1) {
                break;
            }
            end--;
        }
        return text.subSequence(0, end).toString();
    }
}
