package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.serialization.PdNumbers;
import com.ttennebkram.pdpatch.tree.PlacedElement;
import com.ttennebkram.pdpatch.tree.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Base of the fixed-layout GUI widgets written as {@code #X obj x y <class> <fields>}.
 *
 * Every widget shares the label block (send, receive, label text, label
 * offset, font and colors); subclasses add their own leading and trailing
 * fields and decide the order they are written in. Fields written by newer
 * editors beyond the known layout are kept in {@link #getExtra()}.
 */
public abstract class IemGuiElement extends PlacedElement {

    public static final String EMPTY = "empty";

    private static final Set<String> INACTIVE_NAMES = Set.of("", "-", EMPTY);

    protected final String send;
    protected final String receive;
    protected final String label;
    protected final int labelX;
    protected final int labelY;
    protected final int font;
    protected final int fontSize;
    protected final String bgColor;
    protected final String fgColor;
    protected final String labelColor;
    protected final List<String> extra;

    protected IemGuiElement(Builder<?, ?> b) {
        super(b.position);
        this.send = nameOrEmpty(b.send);
        this.receive = nameOrEmpty(b.receive);
        this.label = nameOrEmpty(b.label);
        this.labelX = b.labelX;
        this.labelY = b.labelY;
        this.font = b.font;
        this.fontSize = b.fontSize;
        this.bgColor = b.bgColor;
        this.fgColor = b.fgColor;
        this.labelColor = b.labelColor;
        this.extra = List.copyOf(b.extra);
    }

    private static String nameOrEmpty(String s) {
        return s == null || s.isEmpty() ? EMPTY : s;
    }

    /** Class name as written, e.g. {@code bng} or {@code vdl}. */
    public abstract String getClassName();

    /** Fields after the class name, in wire order, without {@link #getExtra()}. */
    public abstract List<String> getArguments();

    public abstract int getNumInlets();

    public abstract int getNumOutlets();

    public abstract int getWidth();

    public abstract int getHeight();

    /** A builder primed with every field of this widget. */
    public abstract Builder<?, ?> toBuilder();

    public String getSend() {
        return send;
    }

    public String getReceive() {
        return receive;
    }

    public String getLabel() {
        return label;
    }

    public int getLabelX() {
        return labelX;
    }

    public int getLabelY() {
        return labelY;
    }

    public int getFont() {
        return font;
    }

    public int getFontSize() {
        return fontSize;
    }

    /** Color as written: a packed integer or {@code #rrggbb}. */
    public String getBgColor() {
        return bgColor;
    }

    public String getFgColor() {
        return fgColor;
    }

    public String getLabelColor() {
        return labelColor;
    }

    public List<String> getExtra() {
        return extra;
    }

    /** Check if the widget sends to or listens on a named destination. */
    public boolean hasActiveSendReceive() {
        return !INACTIVE_NAMES.contains(send) || !INACTIVE_NAMES.contains(receive);
    }

    @Override
    public IemGuiElement withPosition(Position newPosition) {
        return toBuilder().position(newPosition).build();
    }

    public IemGuiElement withSendReceive(String newSend, String newReceive) {
        return toBuilder().send(newSend).receive(newReceive).build();
    }

    /** Box text: class name, arguments and extra fields. */
    public String getText() {
        List<String> tokens = new ArrayList<>();
        tokens.add(getClassName());
        tokens.addAll(getArguments());
        tokens.addAll(extra);
        return join(tokens);
    }

    @Override
    public void write(List<String> lines) {
        lines.add("#X obj " + position + " " + getText() + ";");
    }

    // ========== Field helpers ==========

    /** Append send, receive, label, offsets, font and size. */
    protected void addLabelBlock(List<String> out, boolean withSend) {
        if (withSend) {
            out.add(send);
        }
        out.add(receive);
        out.add(label);
        addInts(out, labelX, labelY, font, fontSize);
    }

    protected static void addInts(List<String> out, int... values) {
        for (int v : values) {
            out.add(Integer.toString(v));
        }
    }

    protected static void addColors(List<String> out, String... values) {
        for (String v : values) {
            out.add(v);
        }
    }

    protected static void addNumbers(List<String> out, double... values) {
        for (double v : values) {
            out.add(PdNumbers.format(v));
        }
    }

    /**
     * Sequential reader over creation arguments. Number fields that do not
     * parse raise {@link NumberFormatException}.
     */
    protected static final class FieldReader {
        private final List<String> args;
        private int index;

        FieldReader(List<String> args, int required, String className) {
            if (args.size() < required) {
                throw new IllegalArgumentException(className + " needs " + required
                        + " fields, found " + args.size());
            }
            this.args = args;
        }

        int nextInt() {
            return PdNumbers.parseInt(args.get(index++));
        }

        double nextDouble() {
            return PdNumbers.parseDouble(args.get(index++));
        }

        /**
         * A color field: a packed integer (older files) or {@code #rrggbb}
         * (Pd 0.51 and later). The token is kept as written.
         */
        String nextColor() {
            String token = args.get(index++);
            if (!isColor(token)) {
                throw new IllegalArgumentException("Not a color: " + token);
            }
            return token;
        }

        String nextSymbol() {
            return args.get(index++);
        }

        /** Read send (optional), receive, label, offsets, font and size into the builder. */
        void labelBlock(Builder<?, ?> b, boolean withSend) {
            if (withSend) {
                b.send(nextSymbol());
            }
            b.receive(nextSymbol());
            b.label(nextSymbol());
            b.labelOffset(nextInt(), nextInt());
            b.font(nextInt(), nextInt());
        }

        List<String> rest() {
            return args.subList(index, args.size());
        }
    }

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9a-fA-F]{6}");

    /** Check if a token is a packed integer color or a {@code #rrggbb} color. */
    public static boolean isColor(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        if (HEX_COLOR.matcher(token).matches()) {
            return true;
        }
        try {
            PdNumbers.parseInt(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String requireColor(String token) {
        if (!isColor(token)) {
            throw new IllegalArgumentException("Not a color: " + token);
        }
        return token;
    }

    // ========== Builder ==========

    public abstract static class Builder<T extends IemGuiElement, B extends Builder<T, B>> {
        Position position = Position.ORIGIN;
        String send = EMPTY;
        String receive = EMPTY;
        String label = EMPTY;
        int labelX;
        int labelY;
        int font;
        int fontSize = 10;
        String bgColor = "-262144";
        String fgColor = "-1";
        String labelColor = "-1";
        List<String> extra = List.of();

        protected abstract B self();

        public abstract T build();

        public B position(Position value) {
            this.position = value;
            return self();
        }

        public B position(int x, int y) {
            return position(new Position(x, y));
        }

        public B send(String value) {
            this.send = value;
            return self();
        }

        public B receive(String value) {
            this.receive = value;
            return self();
        }

        public B label(String value) {
            this.label = value;
            return self();
        }

        public B labelOffset(int x, int y) {
            this.labelX = x;
            this.labelY = y;
            return self();
        }

        public B font(int face, int size) {
            this.font = face;
            this.fontSize = size;
            return self();
        }

        public B colors(String background, String foreground, String labelText) {
            this.bgColor = requireColor(background);
            this.fgColor = requireColor(foreground);
            this.labelColor = requireColor(labelText);
            return self();
        }

        public B colors(int background, int foreground, int labelText) {
            return colors(Integer.toString(background), Integer.toString(foreground),
                    Integer.toString(labelText));
        }

        public B extra(List<String> value) {
            this.extra = value == null ? List.of() : value;
            return self();
        }

        /** Copy the shared fields of an existing widget. */
        protected B from(IemGuiElement e) {
            this.position = e.position;
            this.send = e.send;
            this.receive = e.receive;
            this.label = e.label;
            this.labelX = e.labelX;
            this.labelY = e.labelY;
            this.font = e.font;
            this.fontSize = e.fontSize;
            this.bgColor = e.bgColor;
            this.fgColor = e.fgColor;
            this.labelColor = e.labelColor;
            this.extra = e.extra;
            return self();
        }
    }
}
