package com.ttennebkram.pdpatch.tree;

import java.util.List;

/**
 * A nested canvas closed by {@code #X restore}. Owns its child elements.
 */
public final class SubpatchElement extends PlacedElement {

    public static final String KIND_PD = "pd";
    public static final String KIND_GRAPH = "graph";

    private final CanvasProperties canvas;
    private final List<Element> elements;
    private final String restoreKind;
    private final String name;

    /**
     * @param position    position of the box on the parent canvas
     * @param restoreKind {@code pd} or {@code graph}
     * @param name        name tokens after the restore kind, may be empty
     */
    public SubpatchElement(CanvasProperties canvas, List<Element> elements,
                           Position position, String restoreKind, String name) {
        super(position);
        if (!canvas.isSubpatchForm()) {
            throw new IllegalArgumentException("Subpatch needs a subpatch canvas: " + canvas);
        }
        this.canvas = canvas;
        this.elements = List.copyOf(elements);
        this.restoreKind = restoreKind == null || restoreKind.isEmpty() ? KIND_PD : restoreKind;
        this.name = name == null ? "" : name;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.SUBPATCH;
    }

    public CanvasProperties getCanvas() {
        return canvas;
    }

    public List<Element> getElements() {
        return elements;
    }

    public String getRestoreKind() {
        return restoreKind;
    }

    public String getName() {
        return name;
    }

    /** The first coords element of the inner canvas, or null. */
    public CoordsElement getCoords() {
        for (Element e : elements) {
            if (e instanceof CoordsElement) {
                return (CoordsElement) e;
            }
        }
        return null;
    }

    public boolean isGraphOnParent() {
        CoordsElement coords = getCoords();
        return coords != null && coords.isGraphOnParent();
    }

    @Override
    public SubpatchElement withPosition(Position newPosition) {
        return new SubpatchElement(canvas, elements, newPosition, restoreKind, name);
    }

    public SubpatchElement withElements(List<Element> newElements) {
        return new SubpatchElement(canvas, newElements, position, restoreKind, name);
    }

    public SubpatchElement withName(String newName) {
        return new SubpatchElement(canvas, elements, position, restoreKind, newName);
    }

    @Override
    public void write(List<String> lines) {
        lines.add(canvas.toStatement());
        for (Element e : elements) {
            e.write(lines);
        }
        lines.add("#X restore " + position + " " + restoreKind + (name.isEmpty() ? "" : " " + name) + ";");
    }
}
