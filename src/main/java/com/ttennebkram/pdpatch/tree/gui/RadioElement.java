package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Radio button group, vertical ({@code vradio}, {@code vdl}) or horizontal
 * ({@code hradio}, {@code hdl}). The class name is kept as written.
 */
public final class RadioElement extends IemGuiElement {

    public static final String VERTICAL = "vradio";
    public static final String HORIZONTAL = "hradio";
    static final int FIELD_COUNT = 15;

    private final String className;
    private final int size;
    private final int newOld;
    private final int init;
    private final int number;
    private final double initValue;

    private RadioElement(Builder b) {
        super(b);
        this.className = b.className;
        this.size = b.size;
        this.newOld = b.newOld;
        this.init = b.init;
        this.number = b.number;
        this.initValue = b.initValue;
    }

    public static Builder vertical() {
        return new Builder(VERTICAL);
    }

    public static Builder horizontal() {
        return new Builder(HORIZONTAL);
    }

    /** Check if a class name denotes a vertical radio group. */
    public static boolean isVerticalClass(String className) {
        return VERTICAL.equals(className) || "vdl".equals(className);
    }

    public static RadioElement fromArguments(String className, Position position, List<String> args) {
        FieldReader r = new FieldReader(args, FIELD_COUNT, className);
        Builder b = new Builder(className).position(position);
        b.size(r.nextInt()).newOld(r.nextInt()).init(r.nextInt()).number(r.nextInt());
        r.labelBlock(b, true);
        b.colors(r.nextColor(), r.nextColor(), r.nextColor());
        b.initValue(r.nextDouble());
        return b.extra(r.rest()).build();
    }

    @Override
    public ElementKind getKind() {
        return isVertical() ? ElementKind.VRADIO : ElementKind.HRADIO;
    }

    @Override
    public String getClassName() {
        return className;
    }

    public boolean isVertical() {
        return isVerticalClass(className);
    }

    public int getSize() {
        return size;
    }

    public int getNewOld() {
        return newOld;
    }

    public int getInit() {
        return init;
    }

    /** Number of buttons. */
    public int getNumber() {
        return number;
    }

    public double getInitValue() {
        return initValue;
    }

    @Override
    public List<String> getArguments() {
        List<String> out = new ArrayList<>();
        addInts(out, size, newOld, init, number);
        addLabelBlock(out, true);
        addColors(out, bgColor, fgColor, labelColor);
        addNumbers(out, initValue);
        return out;
    }

    @Override
    public int getNumInlets() {
        return 1;
    }

    @Override
    public int getNumOutlets() {
        return 1;
    }

    @Override
    public int getWidth() {
        return isVertical() ? size : size * number;
    }

    @Override
    public int getHeight() {
        return isVertical() ? size * number : size;
    }

    @Override
    public Builder toBuilder() {
        return new Builder(className).from(this).size(size).newOld(newOld).init(init)
                .number(number).initValue(initValue);
    }

    public static final class Builder extends IemGuiElement.Builder<RadioElement, Builder> {
        private final String className;
        private int size = 15;
        private int newOld;
        private int init;
        private int number = 8;
        private double initValue;

        Builder(String className) {
            this.className = className;
            labelOffset(0, -8);
        }

        public Builder size(int value) {
            this.size = value;
            return this;
        }

        public Builder newOld(int value) {
            this.newOld = value;
            return this;
        }

        public Builder init(int value) {
            this.init = value;
            return this;
        }

        public Builder number(int value) {
            this.number = value;
            return this;
        }

        public Builder initValue(double value) {
            this.initValue = value;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public RadioElement build() {
            return new RadioElement(this);
        }
    }
}
