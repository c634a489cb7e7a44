package com.vidnyan.tracescan.domain.source;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * A source file handed to rules: its path and its lines, read once.
 * Immutable value object.
 */
public record SourceFile(
    String path,
    List<String> lines
) {

    public static final String JAVA = ".java";
    public static final String KOTLIN = ".kt";

    public SourceFile {
        lines = List.copyOf(lines);
    }

    public static SourceFile of(Path path, List<String> lines) {
        return new SourceFile(path.toString(), lines);
    }

    /**
     * Convenience factory, mostly for tests.
     */
    public static SourceFile of(String path, String... lines) {
        return new SourceFile(path, List.of(lines));
    }

    /**
     * Same path with other lines, such as a masked view of this file.
     */
    public SourceFile withLines(List<String> replacement) {
        return new SourceFile(path, replacement);
    }

    public int lineCount() {
        return lines.size();
    }

    public String line(int index) {
        return lines.get(index);
    }

    /**
     * Lower-case extension including the dot, or empty string.
     */
    public String extension() {
        String normalized = path.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    public boolean isKotlin() {
        return KOTLIN.equals(extension());
    }

    public boolean isJava() {
        return JAVA.equals(extension());
    }

    /**
     * Case-insensitive check for a path segment such as a package directory.
     */
    public boolean pathContains(String segment) {
        return path.replace('\\', '/').toLowerCase(Locale.ROOT)
                .contains(segment.toLowerCase(Locale.ROOT));
    }

    public boolean anyLineContains(String token) {
        return lines.stream().anyMatch(l -> l.contains(token));
    }
}
