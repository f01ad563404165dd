package com.ttennebkram.pdpatch.optimize;

import com.ttennebkram.pdpatch.model.Connection;
import com.ttennebkram.pdpatch.model.Patcher;
import com.ttennebkram.pdpatch.nodes.NodeKind;
import com.ttennebkram.pdpatch.nodes.ObjectNode;
import com.ttennebkram.pdpatch.nodes.PatchNode;
import com.ttennebkram.pdpatch.nodes.SubpatchNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Structural rewrites of a {@link Patcher}, run in this order:
 * <ol>
 *   <li>duplicate connections are dropped, first occurrence wins;</li>
 *   <li>pass-through objects whose class is in the collapsible set are
 *       removed and their single source wired straight to their single sink;</li>
 *   <li>objects without any connection are removed unless protected or
 *       talking to a named send/receive.</li>
 * </ol>
 * Every removal renumbers the surviving connections through
 * {@link Patcher#removeNodes}. Running the optimizer twice changes nothing
 * the second time.
 */
public final class PatchOptimizer {

    private static final Logger LOGGER = Logger.getLogger(PatchOptimizer.class.getName());

    private PatchOptimizer() {
    }

    public static OptimizeStats optimize(Patcher patcher, boolean recursive, Set<String> collapsible) {
        OptimizeStats stats = new OptimizeStats();
        Set<String> classes = collapsible == null ? Collections.emptySet() : collapsible;

        if (recursive) {
            for (PatchNode node : patcher.getNodes()) {
                if (node instanceof SubpatchNode) {
                    OptimizeStats inner = optimize(((SubpatchNode) node).getInner(), true, classes);
                    stats.add(inner);
                    stats.subpatchesOptimized++;
                }
            }
        }

        OptimizeStats own = new OptimizeStats();
        int initialConnections = patcher.getConnections().size();

        own.duplicatesRemoved = removeDuplicates(patcher);

        Set<Integer> removal = new TreeSet<>();
        if (!classes.isEmpty()) {
            own.passThroughsCollapsed = collapsePassThroughs(patcher, classes, removal);
        }
        removal.addAll(findUnused(patcher, removal));

        own.nodesRemoved = removal.size();
        patcher.removeNodes(removal);
        own.connectionsRemoved = initialConnections - patcher.getConnections().size();

        LOGGER.fine(() -> "Optimized " + patcher + ": " + own);
        stats.add(own);
        return stats;
    }

    private static int removeDuplicates(Patcher patcher) {
        List<Connection> before = patcher.getConnections();
        Set<Connection> distinct = new LinkedHashSet<>(before);
        int duplicates = before.size() - distinct.size();
        if (duplicates > 0) {
            patcher.setConnections(new ArrayList<>(distinct));
        }
        return duplicates;
    }

    /**
     * Bypass qualifying nodes one at a time until none is left, so chains of
     * pass-throughs collapse completely. Bypassed nodes are added to
     * {@code removal}; they keep their index until the final removal.
     */
    private static int collapsePassThroughs(Patcher patcher, Set<String> classes, Set<Integer> removal) {
        int collapsed = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            List<Connection> connections = new ArrayList<>(patcher.getConnections());
            for (int i = 0; i < patcher.size(); i++) {
                if (removal.contains(i) || !isCollapsible(patcher.getNode(i), classes)) {
                    continue;
                }
                Connection in = null;
                Connection out = null;
                int inCount = 0;
                int outCount = 0;
                for (Connection c : connections) {
                    if (c.getSink() == i) {
                        in = c;
                        inCount++;
                    }
                    if (c.getSource() == i) {
                        out = c;
                        outCount++;
                    }
                }
                if (inCount != 1 || outCount != 1 || in.getSource() == i) {
                    continue;
                }
                Connection bypass = new Connection(in.getSource(), in.getOutlet(), out.getSink(), out.getInlet());
                connections.remove(in);
                connections.remove(out);
                if (!connections.contains(bypass)) {
                    connections.add(bypass);
                }
                patcher.setConnections(connections);
                removal.add(i);
                collapsed++;
                changed = true;
                break;
            }
        }
        return collapsed;
    }

    private static boolean isCollapsible(PatchNode node, Set<String> classes) {
        if (node.getKind() != NodeKind.OBJECT) {
            return false;
        }
        ObjectNode object = (ObjectNode) node;
        if (!classes.contains(object.getClassName()) || !object.getArguments().isEmpty()) {
            return false;
        }
        Integer inlets = object.getNumInlets();
        Integer outlets = object.getNumOutlets();
        return (inlets == null || inlets == 1) && (outlets == null || outlets == 1);
    }

    private static Set<Integer> findUnused(Patcher patcher, Set<Integer> alreadyRemoved) {
        Set<Integer> connected = new TreeSet<>();
        for (Connection c : patcher.getConnections()) {
            connected.add(c.getSource());
            connected.add(c.getSink());
        }
        Set<Integer> unused = new TreeSet<>();
        for (int i = 0; i < patcher.size(); i++) {
            if (connected.contains(i) || alreadyRemoved.contains(i)) {
                continue;
            }
            PatchNode node = patcher.getNode(i);
            if (node.isProtected() || node.hasActiveSendReceive()) {
                continue;
            }
            unused.add(i);
        }
        return unused;
    }
}
