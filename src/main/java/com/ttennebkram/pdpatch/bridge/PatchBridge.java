package com.ttennebkram.pdpatch.bridge;

import com.ttennebkram.pdpatch.model.Connection;
import com.ttennebkram.pdpatch.model.Patcher;
import com.ttennebkram.pdpatch.nodes.ArrayNode;
import com.ttennebkram.pdpatch.nodes.AtomNode;
import com.ttennebkram.pdpatch.nodes.CommentNode;
import com.ttennebkram.pdpatch.nodes.GuiNode;
import com.ttennebkram.pdpatch.nodes.MessageNode;
import com.ttennebkram.pdpatch.nodes.ObjectNode;
import com.ttennebkram.pdpatch.nodes.PatchNode;
import com.ttennebkram.pdpatch.nodes.ScalarNode;
import com.ttennebkram.pdpatch.nodes.SubpatchNode;
import com.ttennebkram.pdpatch.tree.ArrayElement;
import com.ttennebkram.pdpatch.tree.AtomElement;
import com.ttennebkram.pdpatch.tree.CanvasProperties;
import com.ttennebkram.pdpatch.tree.ConnectElement;
import com.ttennebkram.pdpatch.tree.CoordsElement;
import com.ttennebkram.pdpatch.tree.DeclareElement;
import com.ttennebkram.pdpatch.tree.Element;
import com.ttennebkram.pdpatch.tree.MessageElement;
import com.ttennebkram.pdpatch.tree.ObjectElement;
import com.ttennebkram.pdpatch.tree.OpaqueElement;
import com.ttennebkram.pdpatch.tree.Patch;
import com.ttennebkram.pdpatch.tree.PlacedElement;
import com.ttennebkram.pdpatch.tree.Position;
import com.ttennebkram.pdpatch.tree.ScalarElement;
import com.ttennebkram.pdpatch.tree.SubpatchElement;
import com.ttennebkram.pdpatch.tree.TextElement;
import com.ttennebkram.pdpatch.tree.gui.IemGuiElement;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Converts between the immutable {@link Patch} tree and the editable
 * {@link Patcher} graph.
 *
 * Each indexed element becomes exactly one node and back, so connection
 * indices carry over unchanged. Statements kept verbatim in the tree travel
 * with the node they follow. Declare elements are not represented in the
 * graph and are dropped by {@link #toGraph}.
 */
public final class PatchBridge {

    private static final Logger LOGGER = Logger.getLogger(PatchBridge.class.getName());

    private PatchBridge() {
    }

    // ========== Graph to tree ==========

    public static Patch toTree(Patcher patcher) {
        return new Patch(patcher.getCanvas(), toElements(patcher));
    }

    private static List<Element> toElements(Patcher patcher) {
        List<Element> elements = new ArrayList<>();
        for (String statement : patcher.getLeadingStatements()) {
            elements.add(new OpaqueElement(statement));
        }
        for (PatchNode node : patcher.getNodes()) {
            elements.add(toElement(node));
            for (String statement : node.getTrailingStatements()) {
                elements.add(new OpaqueElement(statement));
            }
        }
        for (Connection c : patcher.getConnections()) {
            elements.add(new ConnectElement(c.getSource(), c.getOutlet(), c.getSink(), c.getInlet()));
        }
        if (patcher.getCoords() != null) {
            elements.add(patcher.getCoords());
        }
        return elements;
    }

    /**
     * The tree element for one node at its current position.
     *
     * @throws IllegalArgumentException for a node type without a tree form
     */
    public static Element toElement(PatchNode node) {
        Position position = new Position(node.x, node.y);
        if (node instanceof ObjectNode) {
            List<String> tokens = ((ObjectNode) node).getTokens();
            return new ObjectElement(position, tokens.get(0), tokens.subList(1, tokens.size()));
        } else if (node instanceof MessageNode) {
            return new MessageElement(position, ((MessageNode) node).getContent());
        } else if (node instanceof CommentNode) {
            return new TextElement(position, ((CommentNode) node).getContent());
        } else if (node instanceof AtomNode) {
            return ((AtomNode) node).getElement();
        } else if (node instanceof GuiNode) {
            return ((GuiNode) node).getElement();
        } else if (node instanceof ArrayNode) {
            return ((ArrayNode) node).toElement();
        } else if (node instanceof ScalarNode) {
            return ((ScalarNode) node).toElement();
        } else if (node instanceof SubpatchNode) {
            SubpatchNode subpatch = (SubpatchNode) node;
            Patcher inner = subpatch.getInner();
            CanvasProperties canvas = inner.getCanvas();
            if (!canvas.isSubpatchForm()) {
                canvas = CanvasProperties.defaultSubpatch(canvas.getWidth(), canvas.getHeight());
            }
            return new SubpatchElement(canvas, toElements(inner), position,
                    subpatch.getRestoreKind(), subpatch.getName());
        }
        throw new IllegalArgumentException("No tree form for node " + node.getNodeName());
    }

    // ========== Tree to graph ==========

    /**
     * Build a graph from a tree. Subpatches become nodes owning their own
     * graph; connections are added with existence checks only, so a file
     * with out-of-range ports still loads and shows up in
     * {@link Patcher#validate(boolean)}.
     */
    public static Patcher toGraph(Patch patch) {
        return toGraph(patch.getCanvas(), patch.getElements());
    }

    private static Patcher toGraph(CanvasProperties canvas, List<Element> elements) {
        Patcher patcher = new Patcher();
        patcher.setCanvas(canvas);
        List<ConnectElement> connects = new ArrayList<>();
        PatchNode last = null;
        int declares = 0;

        for (Element element : elements) {
            if (element instanceof ConnectElement) {
                connects.add((ConnectElement) element);
            } else if (element instanceof CoordsElement) {
                patcher.setCoords((CoordsElement) element);
            } else if (element instanceof DeclareElement) {
                declares++;
            } else if (element instanceof OpaqueElement) {
                String text = ((OpaqueElement) element).getText();
                if (last == null) {
                    patcher.addLeadingStatement(text);
                } else {
                    last.addTrailingStatement(text);
                }
            } else {
                last = toNode(element);
                patcher.addPlaced(last);
            }
        }

        for (ConnectElement c : connects) {
            patcher.addConnection(new Connection(c.getSource(), c.getOutlet(), c.getSink(), c.getInlet()));
        }
        if (declares > 0) {
            final int dropped = declares;
            LOGGER.fine(() -> "Dropped " + dropped + " declare statements");
        }
        return patcher;
    }

    /**
     * The graph node for one indexed element, positioned like the element.
     *
     * @throws IllegalArgumentException for an element without a node form
     */
    public static PatchNode toNode(Element element) {
        PatchNode node;
        if (element instanceof ObjectElement) {
            node = ObjectNode.create(((ObjectElement) element).getText(), null, null);
        } else if (element instanceof MessageElement) {
            node = new MessageNode(((MessageElement) element).getContent());
        } else if (element instanceof TextElement) {
            node = new CommentNode(((TextElement) element).getContent());
        } else if (element instanceof AtomElement) {
            node = new AtomNode((AtomElement) element);
        } else if (element instanceof IemGuiElement) {
            node = new GuiNode((IemGuiElement) element);
        } else if (element instanceof ArrayElement) {
            node = new ArrayNode((ArrayElement) element);
        } else if (element instanceof ScalarElement) {
            node = new ScalarNode((ScalarElement) element);
        } else if (element instanceof SubpatchElement) {
            SubpatchElement subpatch = (SubpatchElement) element;
            Patcher inner = toGraph(subpatch.getCanvas(), subpatch.getElements());
            node = new SubpatchNode(subpatch.getName(), subpatch.getRestoreKind(), inner, null, null);
        } else {
            throw new IllegalArgumentException("No node form for " + element.getKind() + " element");
        }
        if (element instanceof PlacedElement) {
            Position position = ((PlacedElement) element).getPosition();
            node.setPosition(position.getX(), position.getY());
        }
        return node;
    }
}
