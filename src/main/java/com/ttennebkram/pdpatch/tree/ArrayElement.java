package com.ttennebkram.pdpatch.tree;

import java.util.List;

/**
 * An array definition ({@code #X array name size type flags}). Arrays take a
 * connection index but have no position of their own; they are drawn by the
 * graph that contains them.
 */
public final class ArrayElement extends Element {

    private final String name;
    private final int size;
    private final String type;
    private final int saveFlag;

    public ArrayElement(String name, int size, String type, int saveFlag) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Array name must not be empty");
        }
        if (size < 0) {
            throw new IllegalArgumentException("Array size must not be negative: " + size);
        }
        this.name = name;
        this.size = size;
        this.type = type == null || type.isEmpty() ? "float" : type;
        this.saveFlag = saveFlag;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.ARRAY;
    }

    public String getName() {
        return name;
    }

    public int getSize() {
        return size;
    }

    public String getType() {
        return type;
    }

    public int getSaveFlag() {
        return saveFlag;
    }

    public ArrayElement withName(String newName) {
        return new ArrayElement(newName, size, type, saveFlag);
    }

    @Override
    public void write(List<String> lines) {
        lines.add("#X array " + name + " " + size + " " + type + " " + saveFlag + ";");
    }
}
