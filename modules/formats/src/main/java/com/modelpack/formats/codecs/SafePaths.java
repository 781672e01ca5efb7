package com.modelpack.formats.codecs;

import java.io.IOException;
import java.nio.file.Path;

final class SafePaths {

    private SafePaths() {}

    /**
     * Resolves {@code relative} under {@code root}, refusing absolute paths and {@code ..}
     * segments that would land outside it.
     */
    static Path resolveInside(Path root, String relative) throws IOException {
        if (relative == null || relative.isBlank()) {
            throw new IOException("Missing relative path for layer");
        }
        Path base = root.toAbsolutePath().normalize();
        Path target = base.resolve(relative).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new IOException("Illegal path outside of output directory: " + relative);
        }
        return target;
    }
}
