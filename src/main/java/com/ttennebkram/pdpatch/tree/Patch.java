package com.ttennebkram.pdpatch.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed patch: the top-level canvas and its elements in file order.
 */
public final class Patch {

    private final CanvasProperties canvas;
    private final List<Element> elements;

    public Patch(CanvasProperties canvas, List<Element> elements) {
        this.canvas = canvas == null ? CanvasProperties.defaultRoot() : canvas;
        this.elements = List.copyOf(elements);
    }

    public CanvasProperties getCanvas() {
        return canvas;
    }

    public List<Element> getElements() {
        return elements;
    }

    /** Elements that take a connection index, in index order. */
    public List<Element> getIndexedElements() {
        return indexed(elements);
    }

    public List<ConnectElement> getConnections() {
        List<ConnectElement> result = new ArrayList<>();
        for (Element e : elements) {
            if (e instanceof ConnectElement) {
                result.add((ConnectElement) e);
            }
        }
        return result;
    }

    public Patch withElements(List<Element> newElements) {
        return new Patch(canvas, newElements);
    }

    public Patch withCanvas(CanvasProperties newCanvas) {
        return new Patch(newCanvas, elements);
    }

    /** Filter a canvas's elements down to the indexed ones. */
    public static List<Element> indexed(List<Element> elements) {
        List<Element> result = new ArrayList<>();
        for (Element e : elements) {
            if (e.getKind().isIndexed()) {
                result.add(e);
            }
        }
        return result;
    }

    public List<String> toLines() {
        List<String> lines = new ArrayList<>();
        lines.add(canvas.toStatement());
        for (Element e : elements) {
            e.write(lines);
        }
        return lines;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Patch)) {
            return false;
        }
        return toLines().equals(((Patch) o).toLines());
    }

    @Override
    public int hashCode() {
        return toLines().hashCode();
    }

    @Override
    public String toString() {
        return String.join("\n", toLines());
    }
}
