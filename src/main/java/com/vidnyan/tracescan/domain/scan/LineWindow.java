package com.vidnyan.tracescan.domain.scan;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Sliding-window matcher over raw lines.
 * Windows are clipped to the file; comment lines never match.
 */
public final class LineWindow {

    private LineWindow() {
    }

    /**
     * Check whether any line in [index - before, index + after] matches the pattern.
     */
    public static boolean contains(List<String> lines, int index, int before, int after, Pattern pattern) {
        return contains(lines, index - before, index + after, pattern);
    }

    /**
     * Lookback window: the target line and up to {@code radius} lines before it.
     */
    public static boolean lookback(List<String> lines, int index, int radius, Pattern pattern) {
        return contains(lines, index, radius, 0, pattern);
    }

    /**
     * Lookahead window: the target line and up to {@code radius} lines after it.
     */
    public static boolean lookahead(List<String> lines, int index, int radius, Pattern pattern) {
        return contains(lines, index, 0, radius, pattern);
    }

    /**
     * Check whether any line in the inclusive range matches the pattern.
     */
    public static boolean contains(List<String> lines, int from, int to, Pattern pattern) {
        return firstMatch(lines, from, to, pattern).isPresent();
    }

    /**
     * Block variant: any line of the block matches.
     */
    public static boolean contains(List<String> lines, CodeBlock block, Pattern pattern) {
        return contains(lines, block.start(), block.end(), pattern);
    }

    /**
     * First line index in the inclusive, clipped range matching the pattern.
     */
    public static OptionalInt firstMatch(List<String> lines, int from, int to, Pattern pattern) {
        int start = Math.max(0, from);
        int end = Math.min(lines.size() - 1, to);
        for (int i = start; i <= end; i++) {
            String line = lines.get(i);
            if (!SourceText.isComment(line) && pattern.matcher(line).find()) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
