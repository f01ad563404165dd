package com.ttennebkram.pdpatch.tree;

import com.ttennebkram.pdpatch.registry.ObjectRegistry;
import com.ttennebkram.pdpatch.serialization.PdEscaper;
import com.ttennebkram.pdpatch.tree.gui.IemGuiElement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Queries and rewrites over {@link Patch} trees. Rewrites return new trees;
 * the input is never modified.
 */
public final class PatchTrees {

    private static final Set<String> NAMED_OBJECTS = Set.of(
            "s", "send", "r", "receive", "s~", "send~", "r~", "receive~", "throw~", "catch~");

    private PatchTrees() {
    }

    // ========== transform ==========

    /**
     * Rewrite every element bottom-up: a subpatch's children are rewritten
     * before the subpatch itself is passed to {@code rewrite}. Returning null
     * removes the element. Connections are renumbered to follow removed
     * indexed elements; connections touching a removed element are dropped.
     * Connections that survive are passed to {@code rewrite} last.
     */
    public static Patch transform(Patch patch, UnaryOperator<Element> rewrite) {
        return patch.withElements(transformElements(patch.getElements(), rewrite));
    }

    private static List<Element> transformElements(List<Element> elements, UnaryOperator<Element> rewrite) {
        List<Element> rewritten = new ArrayList<>(elements.size());
        List<Integer> table = new ArrayList<>();
        int nextIndex = 0;

        for (Element element : elements) {
            if (element instanceof ConnectElement) {
                rewritten.add(element);
                continue;
            }
            Element input = element;
            if (element instanceof SubpatchElement) {
                SubpatchElement subpatch = (SubpatchElement) element;
                List<Element> children = transformElements(subpatch.getElements(), rewrite);
                input = children.equals(subpatch.getElements()) ? subpatch : subpatch.withElements(children);
            }
            Element result = rewrite.apply(input);
            if (element.getKind().isIndexed()) {
                if (result != null && result.getKind().isIndexed()) {
                    table.add(nextIndex++);
                } else {
                    table.add(-1);
                }
            } else if (result != null && result.getKind().isIndexed()) {
                nextIndex++;
            }
            rewritten.add(result);
        }

        List<Element> out = new ArrayList<>(elements.size());
        for (Element element : rewritten) {
            if (element instanceof ConnectElement) {
                ConnectElement c = remap((ConnectElement) element, table);
                Element result = c == null ? null : rewrite.apply(c);
                if (result != null) {
                    out.add(result);
                }
            } else if (element != null) {
                out.add(element);
            }
        }
        return out;
    }

    private static ConnectElement remap(ConnectElement c, List<Integer> table) {
        if (c.getSource() >= table.size() || c.getSink() >= table.size()) {
            return null;
        }
        int source = table.get(c.getSource());
        int sink = table.get(c.getSink());
        if (source < 0 || sink < 0) {
            return null;
        }
        if (source == c.getSource() && sink == c.getSink()) {
            return c;
        }
        return new ConnectElement(source, c.getOutlet(), sink, c.getInlet());
    }

    // ========== find ==========

    /**
     * Elements matching {@code predicate} in pre-order, subpatch contents
     * right after their subpatch. The result is lazy and can be iterated any
     * number of times.
     */
    public static Iterable<Element> find(Patch patch, Predicate<? super Element> predicate) {
        return () -> new PreOrderIterator(patch.getElements(), predicate);
    }

    /** All matches of {@link #find} collected into a list. */
    public static List<Element> findAll(Patch patch, Predicate<? super Element> predicate) {
        List<Element> result = new ArrayList<>();
        find(patch, predicate).forEach(result::add);
        return result;
    }

    private static final class PreOrderIterator implements Iterator<Element> {

        private final Deque<Iterator<Element>> stack = new ArrayDeque<>();
        private final Predicate<? super Element> predicate;
        private Element next;

        PreOrderIterator(List<Element> roots, Predicate<? super Element> predicate) {
            this.predicate = predicate;
            stack.push(roots.iterator());
            advance();
        }

        private void advance() {
            next = null;
            while (!stack.isEmpty()) {
                Iterator<Element> top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    continue;
                }
                Element candidate = top.next();
                if (candidate instanceof SubpatchElement) {
                    stack.push(((SubpatchElement) candidate).getElements().iterator());
                }
                if (predicate.test(candidate)) {
                    next = candidate;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Element next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            Element result = next;
            advance();
            return result;
        }
    }

    // ========== send / receive renaming ==========

    public static Patch renameSendsReceives(Patch patch, String oldName, String newName) {
        return renameSendsReceives(patch, Collections.singletonMap(oldName, newName));
    }

    /**
     * Rename send and receive names of atoms, widgets and the named
     * send/receive/throw/catch objects. Names are given as displayed and
     * escaped for comparison.
     */
    public static Patch renameSendsReceives(Patch patch, Map<String, String> renames) {
        Map<String, String> wire = new HashMap<>();
        for (Map.Entry<String, String> e : renames.entrySet()) {
            wire.put(PdEscaper.escape(e.getKey()), PdEscaper.escape(e.getValue()));
        }
        return transform(patch, element -> rename(element, wire));
    }

    private static Element rename(Element element, Map<String, String> names) {
        if (element instanceof AtomElement) {
            AtomElement atom = (AtomElement) element;
            String send = names.getOrDefault(atom.getSend(), atom.getSend());
            String receive = names.getOrDefault(atom.getReceive(), atom.getReceive());
            if (send.equals(atom.getSend()) && receive.equals(atom.getReceive())) {
                return atom;
            }
            return atom.withSendReceive(send, receive);
        }
        if (element instanceof IemGuiElement) {
            IemGuiElement widget = (IemGuiElement) element;
            String send = names.getOrDefault(widget.getSend(), widget.getSend());
            String receive = names.getOrDefault(widget.getReceive(), widget.getReceive());
            if (send.equals(widget.getSend()) && receive.equals(widget.getReceive())) {
                return widget;
            }
            return widget.withSendReceive(send, receive);
        }
        if (element instanceof ObjectElement) {
            ObjectElement object = (ObjectElement) element;
            List<String> args = object.getArguments();
            if (NAMED_OBJECTS.contains(object.getClassName()) && !args.isEmpty()
                    && names.containsKey(args.get(0))) {
                List<String> renamed = new ArrayList<>(args);
                renamed.set(0, names.get(args.get(0)));
                return object.withArguments(renamed);
            }
        }
        return element;
    }

    // ========== declare paths ==========

    /** Every {@code -path} entry of every declare element, in pre-order. */
    public static List<String> declarePaths(Patch patch) {
        List<String> paths = new ArrayList<>();
        for (Element e : find(patch, el -> el instanceof DeclareElement)) {
            paths.addAll(((DeclareElement) e).getPaths());
        }
        return paths;
    }

    // ========== arity ==========

    /** Inlet and outlet counts of a patch used as an abstraction. */
    public static final class Arity {
        private final int inlets;
        private final int outlets;

        public Arity(int inlets, int outlets) {
            this.inlets = inlets;
            this.outlets = outlets;
        }

        public int getInlets() {
            return inlets;
        }

        public int getOutlets() {
            return outlets;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Arity)) {
                return false;
            }
            Arity other = (Arity) o;
            return inlets == other.inlets && outlets == other.outlets;
        }

        @Override
        public int hashCode() {
            return 31 * inlets + outlets;
        }

        @Override
        public String toString() {
            return "(" + inlets + ", " + outlets + ")";
        }
    }

    /**
     * Count the top-level {@code inlet}/{@code inlet~} and
     * {@code outlet}/{@code outlet~} objects. Nested subpatches do not count.
     */
    public static Arity inferArity(Patch patch) {
        int inlets = 0;
        int outlets = 0;
        for (Element e : patch.getElements()) {
            if (e instanceof ObjectElement) {
                String className = ((ObjectElement) e).getClassName();
                if (ObjectRegistry.isBoundaryInlet(className)) {
                    inlets++;
                } else if (ObjectRegistry.isBoundaryOutlet(className)) {
                    outlets++;
                }
            }
        }
        return new Arity(inlets, outlets);
    }
}
