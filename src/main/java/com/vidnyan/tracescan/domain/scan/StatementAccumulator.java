package com.vidnyan.tracescan.domain.scan;

import java.util.List;
import java.util.Optional;

/**
 * Reconstructs a call expression whose arguments span several lines.
 */
public final class StatementAccumulator {

    public static final int DEFAULT_MAX_LINES = 25;

    private StatementAccumulator() {
    }

    /**
     * Joined call text from the first bracket at or after (index, column) up to the
     * point where parentheses and square brackets balance again.
     *
     * @return empty when the expression does not close within {@code maxLines}
     */
    public static Optional<Statement> accumulate(List<String> lines, int index, int column, int maxLines) {
        if (index < 0 || index >= lines.size()) {
            return Optional.empty();
        }
        StringBuilder text = new StringBuilder();
        int depth = 0;
        boolean started = false;
        int last = Math.min(lines.size(), index + maxLines);
        for (int i = index; i < last; i++) {
            String raw = lines.get(i);
            String code = SourceText.code(raw);
            int from = i == index ? Math.min(column, code.length()) : 0;
            int segmentStart = from;
            for (int c = from; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '(' || ch == '[') {
                    depth++;
                    started = true;
                } else if ((ch == ')' || ch == ']') && started) {
                    depth--;
                    if (depth == 0) {
                        text.append(raw, segmentStart, c + 1);
                        return Optional.of(new Statement(text.toString().trim(), index, i, c));
                    }
                }
            }
            text.append(raw, segmentStart, code.length()).append(' ');
        }
        return Optional.empty();
    }

    public static Optional<Statement> accumulate(List<String> lines, int index, int column) {
        return accumulate(lines, index, column, DEFAULT_MAX_LINES);
    }

    /**
     * A logical statement reconstructed from one or more physical lines.
     * {@code endColumn} is the column of the closing bracket on the last line.
     */
    public record Statement(String text, int startIndex, int endIndex, int endColumn) {

        public boolean isMultiLine() {
            return endIndex > startIndex;
        }
    }
}
