package com.ttennebkram.pdpatch.tree;

import java.util.Arrays;
import java.util.List;

/**
 * A generic object box ({@code #X obj}). Class name and arguments are wire
 * tokens with escapes kept.
 */
public final class ObjectElement extends PlacedElement {

    private final String className;
    private final List<String> arguments;

    public ObjectElement(Position position, String className, List<String> arguments) {
        super(position);
        if (className == null || className.isEmpty()) {
            throw new IllegalArgumentException("Object class name must not be empty");
        }
        this.className = className;
        this.arguments = List.copyOf(arguments);
    }

    public ObjectElement(Position position, String className, String... arguments) {
        this(position, className, Arrays.asList(arguments));
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.OBJECT;
    }

    public String getClassName() {
        return className;
    }

    public List<String> getArguments() {
        return arguments;
    }

    /** Box text: class name followed by the arguments. */
    public String getText() {
        return arguments.isEmpty() ? className : className + " " + join(arguments);
    }

    @Override
    public ObjectElement withPosition(Position newPosition) {
        return new ObjectElement(newPosition, className, arguments);
    }

    public ObjectElement withArguments(List<String> newArguments) {
        return new ObjectElement(position, className, newArguments);
    }

    @Override
    public void write(List<String> lines) {
        lines.add("#X obj " + position + " " + getText() + ";");
    }
}
