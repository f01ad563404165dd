package com.ttennebkram.pdpatch.tree;

import java.util.List;

/**
 * A patch cord between two indexed elements of the same canvas.
 */
public final class ConnectElement extends Element {

    private final int source;
    private final int outlet;
    private final int sink;
    private final int inlet;

    public ConnectElement(int source, int outlet, int sink, int inlet) {
        if (source < 0 || outlet < 0 || sink < 0 || inlet < 0) {
            throw new IllegalArgumentException("Negative connection field: "
                    + source + " " + outlet + " " + sink + " " + inlet);
        }
        this.source = source;
        this.outlet = outlet;
        this.sink = sink;
        this.inlet = inlet;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.CONNECT;
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

    @Override
    public void write(List<String> lines) {
        lines.add("#X connect " + source + " " + outlet + " " + sink + " " + inlet + ";");
    }
}
