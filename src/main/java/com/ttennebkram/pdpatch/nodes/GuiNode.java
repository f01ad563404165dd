package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.ttennebkram.pdpatch.serialization.PatchParseException;
import com.ttennebkram.pdpatch.serialization.PatchParser;
import com.ttennebkram.pdpatch.tree.Position;
import com.ttennebkram.pdpatch.tree.gui.IemGuiElement;

/**
 * A GUI widget (bang, toggle, slider, ...) with its full typed parameter set.
 */
public class GuiNode extends PatchNode {

    private IemGuiElement element;

    public GuiNode(IemGuiElement element) {
        super(element.getNumInlets(), element.getNumOutlets());
        this.element = element;
        this.x = element.getPosition().getX();
        this.y = element.getPosition().getY();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GUI;
    }

    @Override
    public String getNodeName() {
        return element.getClassName();
    }

    /** The widget at the node's current position. */
    public IemGuiElement getElement() {
        return element.withPosition(new Position(x, y));
    }

    public void setElement(IemGuiElement newElement) {
        this.element = newElement;
        this.numInlets = newElement.getNumInlets();
        this.numOutlets = newElement.getNumOutlets();
    }

    @Override
    public boolean hasActiveSendReceive() {
        return element.hasActiveSendReceive();
    }

    @Override
    public int getWidth() {
        return element.getWidth();
    }

    @Override
    public int getHeight() {
        return element.getHeight();
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
            setElement((IemGuiElement) PatchParser.parseElement(AtomNode.stripTerminator(statement)));
        } catch (PatchParseException | ClassCastException e) {
            throw new JsonParseException("Invalid widget statement: " + statement, e);
        }
    }
}
