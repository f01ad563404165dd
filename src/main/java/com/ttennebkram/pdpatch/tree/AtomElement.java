package com.ttennebkram.pdpatch.tree;

import com.ttennebkram.pdpatch.serialization.PdNumbers;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Number or symbol atom box ({@code #X floatatom} / {@code #X symbolatom}).
 * Label, receive and send are wire tokens where {@code -} means unset.
 * Trailing fields written by newer editors are kept in {@link #getExtra()}.
 */
public final class AtomElement extends PlacedElement {

    public static final String UNSET = "-";
    public static final int DEFAULT_FLOAT_WIDTH = 5;
    public static final int DEFAULT_SYMBOL_WIDTH = 10;

    private static final Set<String> INACTIVE_NAMES = Set.of("", UNSET, "empty");

    private final boolean symbol;
    private final int width;
    private final double lower;
    private final double upper;
    private final int labelPosition;
    private final String label;
    private final String receive;
    private final String send;
    private final List<String> extra;

    public AtomElement(boolean symbol, Position position, int width, double lower, double upper,
                       int labelPosition, String label, String receive, String send, List<String> extra) {
        super(position);
        this.symbol = symbol;
        this.width = width;
        this.lower = lower;
        this.upper = upper;
        this.labelPosition = labelPosition;
        this.label = orUnset(label);
        this.receive = orUnset(receive);
        this.send = orUnset(send);
        this.extra = extra == null ? List.of() : List.copyOf(extra);
    }

    public static AtomElement floatAtom(Position position) {
        return new AtomElement(false, position, DEFAULT_FLOAT_WIDTH, 0, 0, 0, UNSET, UNSET, UNSET, null);
    }

    public static AtomElement symbolAtom(Position position) {
        return new AtomElement(true, position, DEFAULT_SYMBOL_WIDTH, 0, 0, 0, UNSET, UNSET, UNSET, null);
    }

    private static String orUnset(String s) {
        return s == null || s.isEmpty() ? UNSET : s;
    }

    /** Check if a send or receive token names a real destination. */
    public static boolean isActiveName(String name) {
        return name != null && !INACTIVE_NAMES.contains(name);
    }

    @Override
    public ElementKind getKind() {
        return symbol ? ElementKind.SYMBOL_ATOM : ElementKind.FLOAT_ATOM;
    }

    public boolean isSymbol() {
        return symbol;
    }

    public int getWidth() {
        return width;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public int getLabelPosition() {
        return labelPosition;
    }

    public String getLabel() {
        return label;
    }

    public String getReceive() {
        return receive;
    }

    public String getSend() {
        return send;
    }

    public List<String> getExtra() {
        return extra;
    }

    @Override
    public AtomElement withPosition(Position newPosition) {
        return new AtomElement(symbol, newPosition, width, lower, upper, labelPosition, label, receive, send, extra);
    }

    public AtomElement withWidth(int newWidth) {
        return new AtomElement(symbol, position, newWidth, lower, upper, labelPosition, label, receive, send, extra);
    }

    public AtomElement withRange(double newLower, double newUpper) {
        return new AtomElement(symbol, position, width, newLower, newUpper, labelPosition, label, receive, send, extra);
    }

    public AtomElement withLabel(String newLabel, int newLabelPosition) {
        return new AtomElement(symbol, position, width, lower, upper, newLabelPosition, newLabel, receive, send, extra);
    }

    public AtomElement withSendReceive(String newSend, String newReceive) {
        return new AtomElement(symbol, position, width, lower, upper, labelPosition, label, newReceive, newSend, extra);
    }

    @Override
    public void write(List<String> lines) {
        List<String> fields = new ArrayList<>();
        fields.add(symbol ? "#X symbolatom" : "#X floatatom");
        fields.add(position.toString());
        fields.add(Integer.toString(width));
        fields.add(PdNumbers.format(lower));
        fields.add(PdNumbers.format(upper));
        fields.add(Integer.toString(labelPosition));
        fields.add(label);
        fields.add(receive);
        fields.add(send);
        fields.addAll(extra);
        lines.add(join(fields) + ";");
    }
}
