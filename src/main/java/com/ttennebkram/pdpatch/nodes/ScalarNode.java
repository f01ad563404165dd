package com.ttennebkram.pdpatch.nodes;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.ttennebkram.pdpatch.tree.ScalarElement;

/**
 * A data structure instance, kept as its statement. Hidden: the template
 * decides where it is drawn, so layouts leave it alone.
 */
public class ScalarNode extends PatchNode {

    private String statement;

    public ScalarNode(String statement) {
        super(0, 0);
        this.statement = statement;
    }

    public ScalarNode(ScalarElement element) {
        this(element.getText());
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SCALAR;
    }

    @Override
    public String getNodeName() {
        return "scalar " + toElement().getTemplate();
    }

    @Override
    public boolean isHidden() {
        return true;
    }

    public String getStatement() {
        return statement;
    }

    public ScalarElement toElement() {
        return new ScalarElement(statement);
    }

    @Override
    public int getWidth() {
        return 0;
    }

    @Override
    public int getHeight() {
        return 0;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("statement", statement);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        if (!json.has("statement") || !json.get("statement").getAsString().startsWith("#X scalar")) {
            throw new JsonParseException("Scalar node without a scalar statement");
        }
        statement = json.get("statement").getAsString();
    }
}
