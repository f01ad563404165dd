package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Vertical ({@code vsl}) or horizontal ({@code hsl}) slider. Both share one
 * field layout and differ only in defaults.
 */
public final class SliderElement extends IemGuiElement {

    public static final String VERTICAL = "vsl";
    public static final String HORIZONTAL = "hsl";
    static final int FIELD_COUNT = 18;

    private final boolean vertical;
    private final int width;
    private final int height;
    private final double min;
    private final double max;
    private final int logFlag;
    private final int init;
    private final double initValue;
    private final int steady;

    private SliderElement(Builder b) {
        super(b);
        this.vertical = b.vertical;
        this.width = b.width;
        this.height = b.height;
        this.min = b.min;
        this.max = b.max;
        this.logFlag = b.logFlag;
        this.init = b.init;
        this.initValue = b.initValue;
        this.steady = b.steady;
    }

    public static Builder vertical() {
        return new Builder(true);
    }

    public static Builder horizontal() {
        return new Builder(false);
    }

    public static SliderElement fromArguments(boolean vertical, Position position, List<String> args) {
        FieldReader r = new FieldReader(args, FIELD_COUNT, vertical ? VERTICAL : HORIZONTAL);
        Builder b = new Builder(vertical).position(position);
        b.size(r.nextInt(), r.nextInt()).range(r.nextDouble(), r.nextDouble())
                .logFlag(r.nextInt()).init(r.nextInt());
        r.labelBlock(b, true);
        b.colors(r.nextColor(), r.nextColor(), r.nextColor());
        b.initValue(r.nextDouble()).steady(r.nextInt());
        return b.extra(r.rest()).build();
    }

    @Override
    public ElementKind getKind() {
        return vertical ? ElementKind.VSLIDER : ElementKind.HSLIDER;
    }

    @Override
    public String getClassName() {
        return vertical ? VERTICAL : HORIZONTAL;
    }

    public boolean isVertical() {
        return vertical;
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

    /** Stored knob position in hundredths of a pixel. */
    public double getInitValue() {
        return initValue;
    }

    public int getSteady() {
        return steady;
    }

    @Override
    public List<String> getArguments() {
        List<String> out = new ArrayList<>();
        addInts(out, width, height);
        addNumbers(out, min, max);
        addInts(out, logFlag, init);
        addLabelBlock(out, true);
        addColors(out, bgColor, fgColor, labelColor);
        addNumbers(out, initValue);
        addInts(out, steady);
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
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public Builder toBuilder() {
        return new Builder(vertical).from(this).size(width, height).range(min, max)
                .logFlag(logFlag).init(init).initValue(initValue).steady(steady);
    }

    public static final class Builder extends IemGuiElement.Builder<SliderElement, Builder> {
        private final boolean vertical;
        private int width;
        private int height;
        private double min = 0;
        private double max = 127;
        private int logFlag;
        private int init;
        private double initValue;
        private int steady = 1;

        Builder(boolean vertical) {
            this.vertical = vertical;
            if (vertical) {
                size(15, 128);
                labelOffset(0, -9);
            } else {
                size(128, 15);
                labelOffset(-2, -8);
            }
        }

        public Builder size(int w, int h) {
            this.width = w;
            this.height = h;
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

        public Builder steady(int value) {
            this.steady = value;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public SliderElement build() {
            return new SliderElement(this);
        }
    }
}
