package com.ttennebkram.pdpatch.serialization;

import com.ttennebkram.pdpatch.tree.Patch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link Patch} as patch text, one statement per line.
 */
public final class PatchSerializer {

    private PatchSerializer() {
    }

    public static String serialize(Patch patch) {
        StringBuilder sb = new StringBuilder();
        for (String line : patch.toLines()) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * Save a patch to a file (UTF-8).
     */
    public static void write(Patch patch, Path path) throws IOException {
        Files.writeString(path, serialize(patch), StandardCharsets.UTF_8);
    }
}
