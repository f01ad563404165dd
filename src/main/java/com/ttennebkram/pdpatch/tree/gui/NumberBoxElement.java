package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * IEM number box ({@code nbx}). Width is in characters.
 */
public final class NumberBoxElement extends IemGuiElement {

    public static final String CLASS_NAME = "nbx";
    static final int FIELD_COUNT = 18;
    private static final int CHAR_WIDTH = 6;

    private final int digits;
    private final int height;
    private final double min;
    private final double max;
    private final int logFlag;
    private final int init;
    private final double initValue;
    private final int logHeight;

    private NumberBoxElement(Builder b) {
        super(b);
        this.digits = b.digits;
        this.height = b.height;
        this.min = b.min;
        this.max = b.max;
        this.logFlag = b.logFlag;
        this.init = b.init;
        this.initValue = b.initValue;
        this.logHeight = b.logHeight;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static NumberBoxElement fromArguments(Position position, List<String> args) {
        FieldReader r = new FieldReader(args, FIELD_COUNT, CLASS_NAME);
        Builder b = builder().position(position);
        b.digits(r.nextInt()).height(r.nextInt()).range(r.nextDouble(), r.nextDouble())
                .logFlag(r.nextInt()).init(r.nextInt());
        r.labelBlock(b, true);
        b.colors(r.nextColor(), r.nextColor(), r.nextColor());
        b.initValue(r.nextDouble()).logHeight(r.nextInt());
        return b.extra(r.rest()).build();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.NUMBER_BOX;
    }

    @Override
    public String getClassName() {
        return CLASS_NAME;
    }

    public int getDigits() {
        return digits;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public int getLogFlag() {
        return logFlag;
    }

    public int getInit() {
        return init;
    }

    public double getInitValue() {
        return initValue;
    }

    public int getLogHeight() {
        return logHeight;
    }

    @Override
    public List<String> getArguments() {
        List<String> out = new ArrayList<>();
        addInts(out, digits, height);
        addNumbers(out, min, max);
        addInts(out, logFlag, init);
        addLabelBlock(out, true);
        addColors(out, bgColor, fgColor, labelColor);
        addNumbers(out, initValue);
        addInts(out, logHeight);
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
        return digits * CHAR_WIDTH;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public Builder toBuilder() {
        return new Builder().from(this).digits(digits).height(height).range(min, max)
                .logFlag(logFlag).init(init).initValue(initValue).logHeight(logHeight);
    }

    public static final class Builder extends IemGuiElement.Builder<NumberBoxElement, Builder> {
        private int digits = 5;
        private int height = 14;
        private double min = -1e37;
        private double max = 1e37;
        private int logFlag;
        private int init;
        private double initValue;
        private int logHeight = 256;

        Builder() {
            labelOffset(0, -8);
        }

        public Builder digits(int value) {
            this.digits = value;
            return this;
        }

        public Builder height(int value) {
            this.height = value;
            return this;
        }

        public Builder range(double low, double high) {
            this.min = low;
            this.max = high;
            return this;
        }

        public Builder logFlag(int value) {
            this.logFlag = value;
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

        public Builder logHeight(int value) {
            this.logHeight = value;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public NumberBoxElement build() {
            return new NumberBoxElement(this);
        }
    }
}
