package com.ttennebkram.pdpatch.model;

/**
 * Directed patch cord from an outlet of one node to an inlet of another,
 * both nodes addressed by their index in the owning patcher.
 *
 * Connections are values: two connections with the same four fields are
 * equal, which is what duplicate removal relies on.
 */
public final class Connection {

    private final int source;
    private final int outlet;
    private final int sink;
    private final int inlet;

    public Connection(int source, int outlet, int sink, int inlet) {
        this.source = source;
        this.outlet = outlet;
        this.sink = sink;
        this.inlet = inlet;
    }

    public int getSource() {
        return source;
    }

    public int getOutlet() {
        return outlet;
    }

    public int getSink() {
        return sink;
    }

    public int getInlet() {
        return inlet;
    }

    /** Check if this connection starts or ends at the given node. */
    public boolean touches(int index) {
        return source == index || sink == index;
    }

    /**
     * Renumber both endpoints through an old-to-new index table.
     *
     * @param table new index per old index, -1 for removed nodes
     * @return the renumbered connection, or null if an endpoint was removed
     */
    public Connection remap(int[] table) {
        int newSource = table[source];
        int newSink = table[sink];
        if (newSource < 0 || newSink < 0) {
            return null;
        }
        if (newSource == source && newSink == sink) {
            return this;
        }
        return new Connection(newSource, outlet, newSink, inlet);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Connection)) {
            return false;
        }
        Connection other = (Connection) o;
        return source == other.source && outlet == other.outlet
                && sink == other.sink && inlet == other.inlet;
    }

    @Override
    public int hashCode() {
        int result = source;
        result = 31 * result + outlet;
        result = 31 * result + sink;
        result = 31 * result + inlet;
        return result;
    }

    @Override
    public String toString() {
        return source + ":" + outlet + " -> " + sink + ":" + inlet;
    }
}
