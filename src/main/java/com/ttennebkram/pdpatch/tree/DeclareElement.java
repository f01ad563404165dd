package com.ttennebkram.pdpatch.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code #X declare} statement. Not indexed: adding or removing one never
 * shifts connection numbering.
 */
public final class DeclareElement extends Element {

    public static final String PATH_FLAG = "-path";

    private final List<String> tokens;

    public DeclareElement(List<String> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /** Declare only search paths. */
    public static DeclareElement ofPaths(List<String> paths) {
        List<String> tokens = new ArrayList<>();
        for (String path : paths) {
            tokens.add(PATH_FLAG);
            tokens.add(path);
        }
        return new DeclareElement(tokens);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.DECLARE;
    }

    public List<String> getTokens() {
        return tokens;
    }

    /** Values following each {@code -path} flag, in order. */
    public List<String> getPaths() {
        List<String> paths = new ArrayList<>();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (PATH_FLAG.equals(tokens.get(i))) {
                paths.add(tokens.get(++i));
            }
        }
        return paths;
    }

    @Override
    public void write(List<String> lines) {
        lines.add(tokens.isEmpty() ? "#X declare;" : "#X declare " + join(tokens) + ";");
    }
}
