package com.ttennebkram.pdpatch.serialization;

/**
 * Thrown when patch text cannot be parsed. Carries the 1-based line on which
 * the offending statement starts (0 when the problem is not tied to a line).
 */
public class PatchParseException extends Exception {

    private final int lineNumber;
    private final String statement;

    public PatchParseException(String message) {
        this(message, 0, null, null);
    }

    public PatchParseException(String message, Statement statement) {
        this(message, statement.getLineNumber(), statement.getText(), null);
    }

    public PatchParseException(String message, Statement statement, Throwable cause) {
        this(message, statement.getLineNumber(), statement.getText(), cause);
    }

    public PatchParseException(String message, int lineNumber, String statement, Throwable cause) {
        super(buildMessage(message, lineNumber, statement), cause);
        this.lineNumber = lineNumber;
        this.statement = statement;
    }

    private static String buildMessage(String message, int lineNumber, String statement) {
        StringBuilder sb = new StringBuilder();
        if (lineNumber > 0) {
            sb.append("line ").append(lineNumber).append(": ");
        }
        sb.append(message);
        if (statement != null) {
            sb.append(": ").append(statement);
        }
        return sb.toString();
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /** The offending statement without its terminator, or null. */
    public String getStatement() {
        return statement;
    }
}
