package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Decorative canvas ({@code cnv}). Has no inlets or outlets; it is reached
 * through its receive name only.
 */
public final class CnvElement extends IemGuiElement {

    public static final String CLASS_NAME = "cnv";
    static final int FIELD_COUNT = 12;

    private final int selectSize;
    private final int width;
    private final int height;

    private CnvElement(Builder b) {
        super(b);
        this.selectSize = b.selectSize;
        this.width = b.width;
        this.height = b.height;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CnvElement fromArguments(Position position, List<String> args) {
        FieldReader r = new FieldReader(args, FIELD_COUNT, CLASS_NAME);
        Builder b = builder().position(position);
        b.selectSize(r.nextInt()).size(r.nextInt(), r.nextInt());
        r.labelBlock(b, true);
        b.colors(r.nextColor(), "-1", r.nextColor());
        return b.extra(r.rest()).build();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.CNV;
    }

    @Override
    public String getClassName() {
        return CLASS_NAME;
    }

    public int getSelectSize() {
        return selectSize;
    }

    @Override
    public List<String> getArguments() {
        List<String> out = new ArrayList<>();
        addInts(out, selectSize, width, height);
        addLabelBlock(out, true);
        addColors(out, bgColor, labelColor);
        return out;
    }

    @Override
    public int getNumInlets() {
        return 0;
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
        return new Builder().from(this).selectSize(selectSize).size(width, height);
    }

    public static final class Builder extends IemGuiElement.Builder<CnvElement, Builder> {
        private int selectSize = 15;
        private int width = 100;
        private int height = 60;

        Builder() {
            labelOffset(20, 12);
            font(0, 14);
            colors(-233017, -1, -66577);
            extra(List.of("0"));
        }

        public Builder selectSize(int value) {
            this.selectSize = value;
            return this;
        }

        public Builder size(int w, int h) {
            this.width = w;
            this.height = h;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public CnvElement build() {
            return new CnvElement(this);
        }
    }
}
