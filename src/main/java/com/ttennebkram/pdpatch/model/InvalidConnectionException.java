package com.ttennebkram.pdpatch.model;

/**
 * An outlet or inlet number is negative or beyond the node's known count.
 */
public class InvalidConnectionException extends PatchConnectionException {

    private final String port;
    private final int portIndex;
    private final Integer available;

    public InvalidConnectionException(String nodeName, String port, int portIndex, Integer available) {
        super(buildMessage(nodeName, port, portIndex, available));
        this.port = port;
        this.portIndex = portIndex;
        this.available = available;
    }

    private static String buildMessage(String nodeName, String port, int portIndex, Integer available) {
        if (portIndex < 0) {
            return "Negative " + port + " " + portIndex + " on " + nodeName;
        }
        return "Invalid " + port + " " + portIndex + " on " + nodeName + ": it has " + available + " " + port + "s";
    }

    /** {@code inlet} or {@code outlet}. */
    public String getPort() {
        return port;
    }

    public int getPortIndex() {
        return portIndex;
    }

    /** Known port count, null when the failure was a negative index on a variable node. */
    public Integer getAvailable() {
        return available;
    }
}
