package com.modelpack.core.process;

import com.modelpack.core.build.BuildInputException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Expands build patterns against the work directory.
 *
 * <p>Patterns are {@code /}-separated and relative to the work directory. A pattern with glob
 * wildcards matches regular files only and may match nothing; a literal path must exist.
 * Results are absolute, deduplicated and sorted.
 */
public final class FileMatcher {

    private FileMatcher() {}

    public static List<Path> match(Path workDir, List<String> patterns) {
        Path root = workDir.toAbsolutePath().normalize();
        TreeSet<Path> matched = new TreeSet<>();
        for (String pattern : patterns) {
            if (isGlob(pattern)) {
                matched.addAll(glob(root, pattern));
            } else {
                Path literal = root.resolve(pattern).normalize();
                if (!Files.exists(literal, LinkOption.NOFOLLOW_LINKS)) {
                    throw new BuildInputException("No file matches " + pattern + " in " + workDir);
                }
                matched.add(literal);
            }
        }
        return new ArrayList<>(matched);
    }

    static boolean isGlob(String pattern) {
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == '{') return true;
        }
        return false;
    }

    private static List<Path> glob(Path root, String pattern) {
        FileSystem fs = root.getFileSystem();
        PathMatcher matcher = fs.getPathMatcher("glob:" + pattern);
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .filter(p -> matcher.matches(root.relativize(p)))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }
    }
}
