package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * VU meter ({@code vu}). Two inlets (rms and peak), no outlets, no send name.
 */
public final class VuElement extends IemGuiElement {

    public static final String CLASS_NAME = "vu";
    static final int FIELD_COUNT = 11;

    private final int width;
    private final int height;
    private final int scale;

    private VuElement(Builder b) {
        super(b);
        this.width = b.width;
        this.height = b.height;
        this.scale = b.scale;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static VuElement fromArguments(Position position, List<String> args) {
        FieldReader r = new FieldReader(args, FIELD_COUNT, CLASS_NAME);
        Builder b = builder().position(position);
        b.size(r.nextInt(), r.nextInt());
        r.labelBlock(b, false);
        b.colors(r.nextColor(), "-1", r.nextColor());
        b.scale(r.nextInt());
        return b.extra(r.rest()).build();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.VU;
    }

    @Override
    public String getClassName() {
        return CLASS_NAME;
    }

    public int getScale() {
        return scale;
    }

    @Override
    public List<String> getArguments() {
        List<String> out = new ArrayList<>();
        addInts(out, width, height);
        addLabelBlock(out, false);
        addColors(out, bgColor, labelColor);
        addInts(out, scale);
        return out;
    }

    @Override
    public int getNumInlets() {
        return 2;
    }

    @Override
    public int getNumOutlets() {
        return 0;
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
        return new Builder().from(this).size(width, height).scale(scale);
    }

    public static final class Builder extends IemGuiElement.Builder<VuElement, Builder> {
        private int width = 15;
        private int height = 120;
        private int scale = 1;

        Builder() {
            labelOffset(-1, -8);
            colors(-66577, -1, -1);
            extra(List.of("0"));
        }

        public Builder size(int w, int h) {
            this.width = w;
            this.height = h;
            return this;
        }

        public Builder scale(int value) {
            this.scale = value;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public VuElement build() {
            return new VuElement(this);
        }
    }
}
