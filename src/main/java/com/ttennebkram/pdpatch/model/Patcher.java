package com.ttennebkram.pdpatch.model;

import com.ttennebkram.pdpatch.bridge.PatchBridge;
import com.ttennebkram.pdpatch.layout.AutoLayout;
import com.ttennebkram.pdpatch.layout.AutoLayoutOptions;
import com.ttennebkram.pdpatch.layout.LayoutManager;
import com.ttennebkram.pdpatch.layout.Placement;
import com.ttennebkram.pdpatch.nodes.AbstractionNode;
import com.ttennebkram.pdpatch.nodes.ArrayNode;
import com.ttennebkram.pdpatch.nodes.AtomNode;
import com.ttennebkram.pdpatch.nodes.CommentNode;
import com.ttennebkram.pdpatch.nodes.GuiNode;
import com.ttennebkram.pdpatch.nodes.MessageNode;
import com.ttennebkram.pdpatch.nodes.NodeKind;
import com.ttennebkram.pdpatch.nodes.ObjectNode;
import com.ttennebkram.pdpatch.nodes.PatchNode;
import com.ttennebkram.pdpatch.nodes.SubpatchNode;
import com.ttennebkram.pdpatch.optimize.OptimizeStats;
import com.ttennebkram.pdpatch.optimize.PatchOptimizer;
import com.ttennebkram.pdpatch.registry.ObjectRegistry;
import com.ttennebkram.pdpatch.serialization.PatchSerializer;
import com.ttennebkram.pdpatch.serialization.PdEscaper;
import com.ttennebkram.pdpatch.tree.AtomElement;
import com.ttennebkram.pdpatch.tree.CanvasProperties;
import com.ttennebkram.pdpatch.tree.CoordsElement;
import com.ttennebkram.pdpatch.tree.Patch;
import com.ttennebkram.pdpatch.tree.PatchTrees;
import com.ttennebkram.pdpatch.tree.gui.IemGuiElement;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Editable patch graph: an ordered node list and a list of connections that
 * address nodes by index.
 *
 * Every structural edit keeps connections pointing at the same nodes: removals
 * renumber through an old-to-new index table, insertions shift the indices at
 * and after the insertion point. New nodes are positioned by the patcher's
 * {@link LayoutManager}.
 *
 * Not thread-safe; one owner at a time.
 */
public class Patcher {

    private static final Logger LOGGER = Logger.getLogger(Patcher.class.getName());

    public static final int DEFAULT_SUBPATCH_WIDTH = 300;
    public static final int DEFAULT_SUBPATCH_HEIGHT = 180;
    public static final int DEFAULT_GOP_WIDTH = 85;
    public static final int DEFAULT_GOP_HEIGHT = 60;

    private final List<PatchNode> nodes = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();
    private final List<String> leadingStatements = new ArrayList<>();
    private LayoutManager layout;
    private CanvasProperties canvas;
    private CoordsElement coords;

    public Patcher() {
        this(new LayoutManager());
    }

    public Patcher(LayoutManager layout) {
        this.layout = layout;
        this.canvas = CanvasProperties.defaultRoot();
    }

    /** Build a patcher from a parsed tree. */
    public static Patcher fromPatch(Patch patch) {
        return PatchBridge.toGraph(patch);
    }

    // ========== Nodes ==========

    public List<PatchNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Get a node by index.
     * @throws NodeNotFoundException if there is no such index
     */
    public PatchNode getNode(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new NodeNotFoundException(index, nodes.size());
        }
        return nodes.get(index);
    }

    /** Index of a node by identity, or -1. */
    public int indexOf(PatchNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    private int requireIndex(PatchNode node) {
        int index = indexOf(node);
        if (index < 0) {
            throw new NodeNotFoundException(node == null ? "null" : node.getNodeName());
        }
        return index;
    }

    /**
     * Append a node on a new row.
     * @return the node's index
     */
    public int add(PatchNode node) {
        return add(node, Placement.NEW_ROW);
    }

    /**
     * Append a node and position it through the layout manager. Hidden nodes
     * are not positioned.
     *
     * @return the node's index
     */
    public int add(PatchNode node, Placement placement) {
        append(node);
        if (!node.isHidden()) {
            layout.place(node, placement);
        }
        return nodes.size() - 1;
    }

    /**
     * Append a node keeping the position it already has. The layout manager
     * still takes it as the latest row head.
     *
     * @return the node's index
     */
    public int addPlaced(PatchNode node) {
        append(node);
        if (!node.isHidden()) {
            layout.registerNode(node, Placement.NEW_ROW);
        }
        return nodes.size() - 1;
    }

    private void append(PatchNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Node must not be null");
        }
        if (indexOf(node) >= 0) {
            throw new IllegalArgumentException(node.getNodeName() + " is already in this patch");
        }
        if (node instanceof SubpatchNode && ((SubpatchNode) node).getInner() == this) {
            throw new IllegalArgumentException("A patch cannot contain itself");
        }
        nodes.add(node);
    }

    /** Add an object box; unknown counts come from the object registry. */
    public ObjectNode addObject(String text) {
        return addObject(text, null, null, Placement.NEW_ROW);
    }

    public ObjectNode addObject(String text, Placement placement) {
        return addObject(text, null, null, placement);
    }

    /**
     * Add an object box.
     *
     * @param text       box text as displayed; whitespace is collapsed and reserved characters escaped
     * @param numInlets  inlet count, or null to look it up
     * @param numOutlets outlet count, or null to look it up
     */
    public ObjectNode addObject(String text, Integer numInlets, Integer numOutlets, Placement placement) {
        String normalized = toFileText(text);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Object text must not be empty");
        }
        ObjectNode node = ObjectNode.create(normalized, numInlets, numOutlets);
        add(node, placement);
        return node;
    }

    public MessageNode addMessage(String text) {
        return addMessage(text, Placement.NEW_ROW);
    }

    public MessageNode addMessage(String text, Placement placement) {
        MessageNode node = new MessageNode(toFileText(text));
        add(node, placement);
        return node;
    }

    public CommentNode addComment(String text) {
        return addComment(text, Placement.NEW_ROW);
    }

    public CommentNode addComment(String text, Placement placement) {
        CommentNode node = new CommentNode(toFileText(text));
        add(node, placement);
        return node;
    }

    public AtomNode addFloatAtom(Placement placement) {
        return addAtom(AtomElement.floatAtom(null), placement);
    }

    public AtomNode addSymbolAtom(Placement placement) {
        return addAtom(AtomElement.symbolAtom(null), placement);
    }

    /** Add a number or symbol atom with all of its fields. */
    public AtomNode addAtom(AtomElement atom, Placement placement) {
        AtomNode node = new AtomNode(atom);
        add(node, placement);
        return node;
    }

    /** Add any GUI widget with its full parameter set. */
    public GuiNode addGui(IemGuiElement widget, Placement placement) {
        GuiNode node = new GuiNode(widget);
        add(node, placement);
        return node;
    }

    public ArrayNode addArray(String name, int size) {
        ArrayNode node = new ArrayNode(PdEscaper.escape(name), size, "float", 0);
        add(node);
        return node;
    }

    public SubpatchNode addSubpatch(String name, Patcher inner) {
        return addSubpatch(name, inner, null, null, Placement.NEW_ROW);
    }

    /**
     * Add a subpatch owning {@code inner}. Counts given here apply only when
     * the inner patch has no boundary objects of that kind.
     */
    public SubpatchNode addSubpatch(String name, Patcher inner, Integer numInlets, Integer numOutlets,
                                    Placement placement) {
        for (PatchNode n : nodes) {
            if (n instanceof SubpatchNode && ((SubpatchNode) n).getInner() == inner) {
                throw new IllegalArgumentException("Inner patch is already owned by subpatch " + n.getNodeName());
            }
        }
        if (!inner.getCanvas().isSubpatchForm()) {
            inner.setCanvas(CanvasProperties.defaultSubpatch(DEFAULT_SUBPATCH_WIDTH, DEFAULT_SUBPATCH_HEIGHT));
        }
        SubpatchNode node = new SubpatchNode(toFileText(name), inner, numInlets, numOutlets);
        add(node, placement);
        return node;
    }

    /**
     * Add an abstraction with known counts (either may be null for variable).
     */
    public AbstractionNode addAbstraction(String text, Integer numInlets, Integer numOutlets,
                                          String sourcePath, Placement placement) {
        AbstractionNode node = new AbstractionNode(toFileText(text), numInlets, numOutlets, sourcePath);
        add(node, placement);
        return node;
    }

    /**
     * Add an abstraction whose counts come from the boundary objects of its
     * parsed definition.
     */
    public AbstractionNode addAbstraction(String text, Patch definition, String sourcePath, Placement placement) {
        PatchTrees.Arity arity = PatchTrees.inferArity(definition);
        return addAbstraction(text, arity.getInlets(), arity.getOutlets(), sourcePath, placement);
    }

    private static String toFileText(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = String.join(" ", text.trim().split("\\s+"));
        return PdEscaper.escape(collapsed);
    }

    // ========== Connections ==========

    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    /**
     * Connect two nodes by index.
     *
     * @throws NodeNotFoundException      if either index is not in the node list
     * @throws InvalidConnectionException if a port is negative or beyond a known count
     */
    public Connection link(int source, int outlet, int sink, int inlet) {
        PatchNode from = getNode(source);
        PatchNode to = getNode(sink);
        checkPort(from, "outlet", outlet, from.getNumOutlets());
        checkPort(to, "inlet", inlet, to.getNumInlets());
        Connection connection = new Connection(source, outlet, sink, inlet);
        connections.add(connection);
        return connection;
    }

    public Connection link(PatchNode source, int outlet, PatchNode sink, int inlet) {
        return link(requireIndex(source), outlet, requireIndex(sink), inlet);
    }

    /** Connect outlet 0 to inlet 0. */
    public Connection link(PatchNode source, PatchNode sink) {
        return link(source, 0, sink, 0);
    }

    public Connection link(Outlet source, PatchNode sink, int inlet) {
        return link(source.getNode(), source.getIndex(), sink, inlet);
    }

    public Connection link(Outlet source, int sink, int inlet) {
        return link(requireIndex(source.getNode()), source.getIndex(), sink, inlet);
    }

    private static void checkPort(PatchNode node, String port, int index, Integer count) {
        if (index < 0 || (count != null && index >= count)) {
            throw new InvalidConnectionException(node.getNodeName(), port, index, count);
        }
    }

    /**
     * Append a connection checking only that both nodes exist. Port ranges
     * are left to {@link #validate(boolean)}.
     */
    public Connection addConnection(Connection connection) {
        getNode(connection.getSource());
        getNode(connection.getSink());
        connections.add(connection);
        return connection;
    }

    public boolean removeConnection(Connection connection) {
        return connections.remove(connection);
    }

    /**
     * Replace all connections, checking that every endpoint exists.
     */
    public void setConnections(Collection<Connection> newConnections) {
        for (Connection c : newConnections) {
            getNode(c.getSource());
            getNode(c.getSink());
        }
        connections.clear();
        connections.addAll(newConnections);
    }

    // ========== Structural edits ==========

    /**
     * Remove one node with its connections.
     * @return the removed node
     */
    public PatchNode removeNode(int index) {
        PatchNode node = getNode(index);
        removeNodes(Collections.singleton(index));
        return node;
    }

    public PatchNode removeNode(PatchNode node) {
        return removeNode(requireIndex(node));
    }

    /**
     * Remove a set of nodes. Connections touching them are dropped and all
     * others renumbered through an old-to-new index table.
     *
     * @return number of connections dropped
     */
    public int removeNodes(Collection<Integer> indices) {
        Set<Integer> removal = new TreeSet<>(indices);
        if (removal.isEmpty()) {
            return 0;
        }
        for (int index : removal) {
            getNode(index);
        }

        int[] table = new int[nodes.size()];
        List<PatchNode> kept = new ArrayList<>(nodes.size() - removal.size());
        for (int i = 0; i < nodes.size(); i++) {
            if (removal.contains(i)) {
                table[i] = -1;
                layout.nodeRemoved(nodes.get(i));
            } else {
                table[i] = kept.size();
                kept.add(nodes.get(i));
            }
        }

        List<Connection> remapped = new ArrayList<>(connections.size());
        for (Connection c : connections) {
            Connection r = c.remap(table);
            if (r != null) {
                remapped.add(r);
            }
        }
        int dropped = connections.size() - remapped.size();

        nodes.clear();
        nodes.addAll(kept);
        connections.clear();
        connections.addAll(remapped);
        LOGGER.fine(() -> "Removed " + removal.size() + " nodes, dropped " + dropped + " connections");
        return dropped;
    }

    /**
     * Insert a node at {@code index}, shifting later nodes up by one. The node
     * keeps its position.
     */
    public void insertNode(int index, PatchNode node) {
        if (index < 0 || index > nodes.size()) {
            throw new NodeNotFoundException(index, nodes.size());
        }
        if (index == nodes.size()) {
            addPlaced(node);
            return;
        }
        append(node);
        nodes.remove(nodes.size() - 1);
        nodes.add(index, node);

        int[] table = new int[nodes.size() - 1];
        for (int i = 0; i < table.length; i++) {
            table[i] = i < index ? i : i + 1;
        }
        connections.replaceAll(c -> c.remap(table));
    }

    // ========== Validation ==========

    /**
     * Check every connection's endpoints and, where counts are known, its
     * port numbers. With {@code checkCycles} also report directed cycles as
     * warnings; cycles never make a patch invalid.
     */
    public ValidationReport validate(boolean checkCycles) {
        ValidationReport report = new ValidationReport();
        List<Connection> resolvable = new ArrayList<>();
        for (Connection c : connections) {
            if (c.getSource() < 0 || c.getSource() >= nodes.size()) {
                report.addError(new NodeNotFoundException(c.getSource(), nodes.size()));
                continue;
            }
            if (c.getSink() < 0 || c.getSink() >= nodes.size()) {
                report.addError(new NodeNotFoundException(c.getSink(), nodes.size()));
                continue;
            }
            resolvable.add(c);
            PatchNode from = nodes.get(c.getSource());
            PatchNode to = nodes.get(c.getSink());
            try {
                checkPort(from, "outlet", c.getOutlet(), from.getNumOutlets());
                checkPort(to, "inlet", c.getInlet(), to.getNumInlets());
            } catch (InvalidConnectionException e) {
                report.addError(e);
            }
        }
        if (checkCycles) {
            CycleDetector.Result result = CycleDetector.detect(nodes.size(), resolvable, true);
            report.addCycleWarnings(result.getCycles());
            for (CycleWarning warning : result.getCycles()) {
                LOGGER.warning(warning.getMessage());
            }
        }
        return report;
    }

    public ConnectionStats getConnectionStats() {
        if (connections.isEmpty()) {
            return new ConnectionStats(0, 0, 0, 0, 0.0);
        }
        Set<Integer> connected = new HashSet<>();
        int maxInlet = 0;
        int maxOutlet = 0;
        for (Connection c : connections) {
            connected.add(c.getSource());
            connected.add(c.getSink());
            maxInlet = Math.max(maxInlet, c.getInlet());
            maxOutlet = Math.max(maxOutlet, c.getOutlet());
        }
        int withCounts = 0;
        for (PatchNode n : nodes) {
            if (n.getNumInlets() != null || n.getNumOutlets() != null) {
                withCounts++;
            }
        }
        double coverage = nodes.isEmpty() ? 0.0 : Math.round(withCounts * 1000.0 / nodes.size()) / 10.0;
        return new ConnectionStats(connections.size(), connected.size(), maxInlet, maxOutlet, coverage);
    }

    // ========== Boundary objects ==========

    public int countBoundaryInlets() {
        int count = 0;
        for (PatchNode n : nodes) {
            if (n.getKind() == NodeKind.OBJECT && ObjectRegistry.isBoundaryInlet(((ObjectNode) n).getClassName())) {
                count++;
            }
        }
        return count;
    }

    public int countBoundaryOutlets() {
        int count = 0;
        for (PatchNode n : nodes) {
            if (n.getKind() == NodeKind.OBJECT && ObjectRegistry.isBoundaryOutlet(((ObjectNode) n).getClassName())) {
                count++;
            }
        }
        return count;
    }

    // ========== Canvas ==========

    public CanvasProperties getCanvas() {
        return canvas;
    }

    public void setCanvas(CanvasProperties canvas) {
        this.canvas = canvas;
    }

    /** Graph-on-parent settings, or null. */
    public CoordsElement getCoords() {
        return coords;
    }

    public void setCoords(CoordsElement coords) {
        this.coords = coords;
    }

    /** Show this patch's contents on its parent in a box of the given size. */
    public void setGraphOnParent(int width, int height) {
        this.coords = CoordsElement.graphOnParent(width, height);
    }

    /** Verbatim statements written before the first node. */
    public List<String> getLeadingStatements() {
        return Collections.unmodifiableList(leadingStatements);
    }

    public void addLeadingStatement(String statement) {
        leadingStatements.add(statement);
    }

    // ========== Layout and optimization ==========

    public LayoutManager getLayout() {
        return layout;
    }

    public void setLayout(LayoutManager layout) {
        this.layout = layout;
    }

    public AutoLayout.Result autoLayout() {
        return autoLayout(AutoLayoutOptions.defaults());
    }

    /** Reposition every visible node by signal flow. */
    public AutoLayout.Result autoLayout(AutoLayoutOptions options) {
        return AutoLayout.apply(nodes, connections, options);
    }

    /** Run the optimizer without pass-through collapse. */
    public OptimizeStats optimize(boolean recursive) {
        return optimize(recursive, Collections.emptySet());
    }

    /**
     * Remove duplicate connections, collapse pass-through objects whose class
     * is in {@code collapsible}, and remove unused objects.
     */
    public OptimizeStats optimize(boolean recursive, Set<String> collapsible) {
        return PatchOptimizer.optimize(this, recursive, collapsible);
    }

    // ========== Output ==========

    public Patch toPatch() {
        return PatchBridge.toTree(this);
    }

    /** Patch file text. */
    public String toPd() {
        return PatchSerializer.serialize(toPatch());
    }

    public void save(Path path) throws IOException {
        PatchSerializer.write(toPatch(), path);
    }

    @Override
    public String toString() {
        return "Patcher{nodes=" + nodes.size() + ", connections=" + connections.size() + "}";
    }
}
