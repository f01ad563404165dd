package com.ttennebkram.pdpatch.serialization;

import com.ttennebkram.pdpatch.tree.ArrayElement;
import com.ttennebkram.pdpatch.tree.AtomElement;
import com.ttennebkram.pdpatch.tree.CanvasProperties;
import com.ttennebkram.pdpatch.tree.ConnectElement;
import com.ttennebkram.pdpatch.tree.CoordsElement;
import com.ttennebkram.pdpatch.tree.DeclareElement;
import com.ttennebkram.pdpatch.tree.Element;
import com.ttennebkram.pdpatch.tree.MessageElement;
import com.ttennebkram.pdpatch.tree.ObjectElement;
import com.ttennebkram.pdpatch.tree.OpaqueElement;
import com.ttennebkram.pdpatch.tree.ScalarElement;
import com.ttennebkram.pdpatch.tree.Patch;
import com.ttennebkram.pdpatch.tree.Position;
import com.ttennebkram.pdpatch.tree.SubpatchElement;
import com.ttennebkram.pdpatch.tree.TextElement;
import com.ttennebkram.pdpatch.tree.gui.IemGuiElement;
import com.ttennebkram.pdpatch.tree.gui.IemGuiParsers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Parses patch text into an immutable {@link Patch}.
 *
 * Statements are dispatched on their leading tag. {@code #N canvas} opens a
 * canvas and {@code #X restore} closes it into a subpatch element. Connection
 * indices are checked when their canvas closes, once every element of that
 * canvas is known. Unknown {@code #X}, {@code #N} and {@code #A} statements are
 * kept verbatim; anything else is an error.
 */
public final class PatchParser {

    private static final Logger LOGGER = Logger.getLogger(PatchParser.class.getName());

    private PatchParser() {
    }

    /** One open canvas while parsing. */
    private static class Frame {
        final CanvasProperties canvas;
        final Statement opener;
        final List<Element> elements = new ArrayList<>();
        final List<Statement> connectStatements = new ArrayList<>();
        int indexedCount;

        Frame(CanvasProperties canvas, Statement opener) {
            this.canvas = canvas;
            this.opener = opener;
        }

        void add(Element e) {
            elements.add(e);
            if (e.getKind().isIndexed()) {
                indexedCount++;
            }
        }
    }

    /**
     * Read and parse a patch file (UTF-8).
     */
    public static Patch read(Path path) throws IOException, PatchParseException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static Patch parse(String text) throws PatchParseException {
        List<Statement> statements = StatementReader.split(text);
        if (statements.isEmpty()) {
            throw new PatchParseException("Empty patch");
        }

        Deque<Frame> stack = new ArrayDeque<>();
        Frame root = null;

        for (Statement stmt : statements) {
            String tag = stmt.token(0);
            if ("#N".equals(tag) && stmt.size() > 1 && "canvas".equals(stmt.token(1))) {
                Frame frame = new Frame(parseCanvas(stmt), stmt);
                if (root == null) {
                    root = frame;
                }
                stack.push(frame);
                continue;
            }
            if (stack.isEmpty()) {
                throw new PatchParseException("Statement before the first canvas", stmt);
            }
            Frame current = stack.peek();

            if ("#X".equals(tag)) {
                if (stmt.size() < 2) {
                    throw new PatchParseException("Missing command", stmt);
                }
                if ("restore".equals(stmt.token(1))) {
                    if (stack.size() < 2) {
                        throw new PatchParseException("Restore without matching canvas", stmt);
                    }
                    stack.pop();
                    stack.peek().add(closeSubpatch(current, stmt));
                } else {
                    Element e = parseElement(stmt);
                    if (e instanceof ConnectElement) {
                        current.connectStatements.add(stmt);
                    }
                    current.add(e);
                }
            } else if (tag.startsWith("#")) {
                current.add(new OpaqueElement(stmt.getText()));
            } else {
                throw new PatchParseException("Unrecognized statement", stmt);
            }
        }

        if (stack.size() > 1) {
            throw new PatchParseException("Unterminated subpatch", stack.peek().opener);
        }
        checkConnections(root);
        LOGGER.fine(() -> "Parsed " + statements.size() + " statements");
        return new Patch(root.canvas, root.elements);
    }

    private static SubpatchElement closeSubpatch(Frame frame, Statement restore) throws PatchParseException {
        checkConnections(frame);
        if (!frame.canvas.isSubpatchForm()) {
            throw new PatchParseException("Subpatch canvas needs a name and open flag", frame.opener);
        }
        if (restore.size() < 4) {
            throw new PatchParseException("Malformed restore", restore);
        }
        Position position = position(restore);
        String kind = restore.size() > 4 ? restore.token(4) : SubpatchElement.KIND_PD;
        String name = String.join(" ", restore.tokensFrom(5));
        return new SubpatchElement(frame.canvas, frame.elements, position, kind, name);
    }

    private static void checkConnections(Frame frame) throws PatchParseException {
        int c = 0;
        for (Element e : frame.elements) {
            if (e instanceof ConnectElement) {
                ConnectElement conn = (ConnectElement) e;
                if (conn.getSource() >= frame.indexedCount || conn.getSink() >= frame.indexedCount) {
                    throw new PatchParseException("Connection refers to a missing element (canvas has "
                            + frame.indexedCount + ")", frame.connectStatements.get(c));
                }
                c++;
            }
        }
    }

    // ========== Statement parsers ==========

    static CanvasProperties parseCanvas(Statement stmt) throws PatchParseException {
        int n = stmt.size();
        if (n < 6) {
            throw new PatchParseException("Malformed canvas", stmt);
        }
        int x = intField(stmt, 2);
        int y = intField(stmt, 3);
        int w = intField(stmt, 4);
        int h = intField(stmt, 5);
        if (n <= 7) {
            int font = n == 7 ? intField(stmt, 6) : 10;
            return CanvasProperties.root(x, y, w, h, font);
        }
        String name = String.join(" ", stmt.getTokens().subList(6, n - 1));
        return CanvasProperties.subpatch(x, y, w, h, name, intField(stmt, n - 1));
    }

    /**
     * Parse a single {@code #X} statement other than restore.
     */
    public static Element parseElement(Statement stmt) throws PatchParseException {
        String cmd = stmt.token(1);
        switch (cmd) {
            case "obj":
                return parseObject(stmt);
            case "msg":
                requireFields(stmt, 4);
                return new MessageElement(position(stmt), stmt.rawFrom(4));
            case "text":
                requireFields(stmt, 4);
                return new TextElement(position(stmt), stmt.rawFrom(4));
            case "floatatom":
                return parseAtom(stmt, false);
            case "symbolatom":
                return parseAtom(stmt, true);
            case "array":
                return parseArray(stmt);
            case "declare":
                return new DeclareElement(stmt.tokensFrom(2));
            case "connect":
                if (stmt.size() != 6) {
                    throw new PatchParseException("Connection needs four fields", stmt);
                }
                return new ConnectElement(nonNegative(stmt, 2), nonNegative(stmt, 3),
                        nonNegative(stmt, 4), nonNegative(stmt, 5));
            case "coords":
                return parseCoords(stmt);
            case "scalar":
                requireFields(stmt, 3);
                return new ScalarElement(stmt.getText());
            default:
                return new OpaqueElement(stmt.getText());
        }
    }

    /** Parse one statement of text, without its terminator. */
    public static Element parseElement(String statementText) throws PatchParseException {
        Statement stmt = new Statement(statementText, 1);
        if (stmt.size() < 2 || !"#X".equals(stmt.token(0))) {
            throw new PatchParseException("Not an element statement", stmt);
        }
        return parseElement(stmt);
    }

    private static Element parseObject(Statement stmt) throws PatchParseException {
        if (stmt.size() < 5) {
            throw new PatchParseException("Object box without a class", stmt);
        }
        Position position = position(stmt);
        String className = stmt.token(4);
        List<String> args = stmt.tokensFrom(5);
        if (IemGuiParsers.isWidgetClass(className)) {
            IemGuiElement widget = IemGuiParsers.parse(position, className, args);
            if (widget != null) {
                return widget;
            }
            LOGGER.fine(() -> "Keeping " + className + " as a plain object: " + stmt);
        }
        return new ObjectElement(position, className, args);
    }

    private static AtomElement parseAtom(Statement stmt, boolean symbol) throws PatchParseException {
        requireFields(stmt, 4);
        int n = stmt.size();
        try {
            int width = n > 4 ? PdNumbers.parseInt(stmt.token(4))
                    : symbol ? AtomElement.DEFAULT_SYMBOL_WIDTH : AtomElement.DEFAULT_FLOAT_WIDTH;
            double lower = n > 5 ? PdNumbers.parseDouble(stmt.token(5)) : 0;
            double upper = n > 6 ? PdNumbers.parseDouble(stmt.token(6)) : 0;
            int labelPos = n > 7 ? PdNumbers.parseInt(stmt.token(7)) : 0;
            String label = n > 8 ? stmt.token(8) : AtomElement.UNSET;
            String receive = n > 9 ? stmt.token(9) : AtomElement.UNSET;
            String send = n > 10 ? stmt.token(10) : AtomElement.UNSET;
            return new AtomElement(symbol, position(stmt), width, lower, upper, labelPos,
                    label, receive, send, stmt.tokensFrom(11));
        } catch (NumberFormatException e) {
            throw new PatchParseException("Invalid atom field", stmt, e);
        }
    }

    private static ArrayElement parseArray(Statement stmt) throws PatchParseException {
        int n = stmt.size();
        if (n < 4 || n > 6) {
            throw new PatchParseException("Malformed array", stmt);
        }
        String type = n > 4 ? stmt.token(4) : "float";
        int flag = n > 5 ? intField(stmt, 5) : 0;
        return new ArrayElement(stmt.token(2), nonNegative(stmt, 3), type, flag);
    }

    private static CoordsElement parseCoords(Statement stmt) throws PatchParseException {
        requireFields(stmt, 9);
        try {
            return new CoordsElement(
                    PdNumbers.parseDouble(stmt.token(2)), PdNumbers.parseDouble(stmt.token(3)),
                    PdNumbers.parseDouble(stmt.token(4)), PdNumbers.parseDouble(stmt.token(5)),
                    PdNumbers.parseInt(stmt.token(6)), PdNumbers.parseInt(stmt.token(7)),
                    PdNumbers.parseInt(stmt.token(8)), stmt.tokensFrom(9));
        } catch (NumberFormatException e) {
            throw new PatchParseException("Invalid coords field", stmt, e);
        }
    }

    // ========== Field helpers ==========

    private static void requireFields(Statement stmt, int count) throws PatchParseException {
        if (stmt.size() < count) {
            throw new PatchParseException("Expected at least " + count + " fields", stmt);
        }
    }

    private static Position position(Statement stmt) throws PatchParseException {
        return new Position(intField(stmt, 2), intField(stmt, 3));
    }

    private static int intField(Statement stmt, int index) throws PatchParseException {
        try {
            return PdNumbers.parseInt(stmt.token(index));
        } catch (NumberFormatException e) {
            throw new PatchParseException("Invalid number '" + stmt.token(index) + "'", stmt, e);
        }
    }

    private static int nonNegative(Statement stmt, int index) throws PatchParseException {
        int value = intField(stmt, index);
        if (value < 0) {
            throw new PatchParseException("Negative index " + value, stmt);
        }
        return value;
    }
}
