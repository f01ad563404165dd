package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.ttennebkram.pdpatch.serialization.PatchParseException;
import com.ttennebkram.pdpatch.serialization.PatchParser;
import com.ttennebkram.pdpatch.tree.AtomElement;
import com.ttennebkram.pdpatch.tree.Position;

/**
 * Number or symbol atom box. The typed fields live in an immutable
 * {@link AtomElement}; the node adds the mutable position.
 */
public class AtomNode extends PatchNode {

    private static final int ATOM_HEIGHT = 25;
    private static final int FLOAT_ATOM_WIDTH = 50;

    private AtomElement element;

    public AtomNode(AtomElement element) {
        super(1, 1);
        this.element = element;
        this.x = element.getPosition().getX();
        this.y = element.getPosition().getY();
    }

    @Override
    public NodeKind getKind() {
        return element.isSymbol() ? NodeKind.SYMBOL_ATOM : NodeKind.FLOAT_ATOM;
    }

    @Override
    public String getNodeName() {
        return element.isSymbol() ? "symbolatom" : "floatatom";
    }

    /** The atom's fields at the node's current position. */
    public AtomElement getElement() {
        return element.withPosition(new Position(x, y));
    }

    public void setElement(AtomElement newElement) {
        this.element = newElement;
    }

    @Override
    public boolean hasActiveSendReceive() {
        return AtomElement.isActiveName(element.getSend()) || AtomElement.isActiveName(element.getReceive());
    }

    @Override
    public int getWidth() {
        return element.isSymbol() ? element.getWidth() * CHAR_WIDTH : FLOAT_ATOM_WIDTH;
    }

    @Override
    public int getHeight() {
        return ATOM_HEIGHT;
    }

    @Override
    public String getSerializationType() {
        return element.isSymbol() ? "SymbolAtom" : "FloatAtom";
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("statement", element.toPd());
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        if (!json.has("statement")) return;
        String statement = json.get("statement").getAsString();
        try {
            element = (AtomElement) PatchParser.parseElement(stripTerminator(statement));
        } catch (PatchParseException | ClassCastException e) {
            throw new JsonParseException("Invalid atom statement: " + statement, e);
        }
    }

    static String stripTerminator(String statement) {
        return statement.endsWith(";") ? statement.substring(0, statement.length() - 1) : statement;
    }
}
