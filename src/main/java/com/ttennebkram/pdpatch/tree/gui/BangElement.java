package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.tree.ElementKind;
import com.ttennebkram.pdpatch.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Bang button ({@code bng}).
 */
public final class BangElement extends IemGuiElement {

    public static final String CLASS_NAME = "bng";
    static final int FIELD_COUNT = 14;

    private final int size;
    private final int hold;
    private final int interrupt;
    private final int init;

    private BangElement(Builder b) {
        super(b);
        this.size = b.size;
        this.hold = b.hold;
        this.interrupt = b.interrupt;
        this.init = b.init;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Parse the fields following {@code bng}. */
    public static BangElement fromArguments(Position position, List<String> args) {
        FieldReader r = new FieldReader(args, FIELD_COUNT, CLASS_NAME);
        Builder b = builder().position(position);
        b.size(r.nextInt()).hold(r.nextInt()).interrupt(r.nextInt()).init(r.nextInt());
        r.labelBlock(b, true);
        b.colors(r.nextColor(), r.nextColor(), r.nextColor());
        return b.extra(r.rest()).build();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.BANG;
    }

    @Override
    public String getClassName() {
        return CLASS_NAME;
    }

    public int getSize() {
        return size;
    }

    public int getHold() {
        return hold;
    }

    public int getInterrupt() {
        return interrupt;
    }

    public int getInit() {
        return init;
    }

    @Override
    public List<String> getArguments() {
        List<String> out = new ArrayList<>();
        addInts(out, size, hold, interrupt, init);
        addLabelBlock(out, true);
        addColors(out, bgColor, fgColor, labelColor);
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
        return new Builder().from(this).size(size).hold(hold).interrupt(interrupt).init(init);
    }

    public static final class Builder extends IemGuiElement.Builder<BangElement, Builder> {
        private int size = 15;
        private int hold = 250;
        private int interrupt = 50;
        private int init;

        Builder() {
            labelOffset(17, 7);
        }

        public Builder size(int value) {
            this.size = value;
            return this;
        }

        public Builder hold(int value) {
            this.hold = value;
            return this;
        }

        public Builder interrupt(int value) {
            this.interrupt = value;
            return this;
        }

        public Builder init(int value) {
            this.init = value;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public BangElement build() {
            return new BangElement(this);
        }
    }
}
