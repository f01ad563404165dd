package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Toggle ({@code tgl}).
 */
public final class ToggleElement extends IemGuiElement {

    public static final String CLASS_NAME = "tgl";
    static final int FIELD_COUNT = 14;

    private final int size;
    private final int init;
    private final double initValue;
    private final double nonZero;

    private ToggleElement(Builder b) {
        super(b);
        this.size = b.size;
        this.init = b.init;
        this.initValue = b.initValue;
        this.nonZero = b.nonZero;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ToggleElement fromArguments(Position position, List<String> args) {
        FieldReader r = new FieldReader(args, FIELD_COUNT, CLASS_NAME);
        Builder b = builder().position(position);
        b.size(r.nextInt()).init(r.nextInt());
        r.labelBlock(b, true);
        b.colors(r.nextColor(), r.nextColor(), r.nextColor());
        b.initValue(r.nextDouble()).nonZero(r.nextDouble());
        return b.extra(r.rest()).build();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.TOGGLE;
    }

    @Override
    public String getClassName() {
        return CLASS_NAME;
    }

    public int getSize() {
        return size;
    }

    public int getInit() {
        return init;
    }

    public double getInitValue() {
        return initValue;
    }

    /** Value output when switched on. */
    public double getNonZero() {
        return nonZero;
    }

    @Override
    public List<String> getArguments() {
        List<String> out = new ArrayList<>();
        addInts(out, size, init);
        addLabelBlock(out, true);
        addColors(out, bgColor, fgColor, labelColor);
        addNumbers(out, initValue, nonZero);
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
        return size;
    }

    @Override
    public int getHeight() {
        return size;
    }

    @Override
    public Builder toBuilder() {
        return new Builder().from(this).size(size).init(init).initValue(initValue).nonZero(nonZero);
    }

    public static final class Builder extends IemGuiElement.Builder<ToggleElement, Builder> {
        private int size = 15;
        private int init;
        private double initValue;
        private double nonZero = 1;

        Builder() {
            labelOffset(17, 7);
        }

        public Builder size(int value) {
            this.size = value;
            return this;
        }

        public Builder init(int value) {
            this.init = value;
            return this;
        }

        public Builder initValue(double value) {
            this.initValue = value;
            return this;
        }

        public Builder nonZero(double value) {
            this.nonZero = value;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public ToggleElement build() {
            return new ToggleElement(this);
        }
    }
}
