package com.vidnyan.tracescan.domain.scan;

/**
 * A brace-delimited block located by {@link BlockLocator}.
 *
 * @param start  0-based index of the line holding the opening brace
 * @param column column of the opening brace on that line
 * @param end    0-based index of the line holding the matching closing brace
 * @param header code preceding the opening brace, possibly joined from earlier lines
 * @param name   declared method or type name, or null for anonymous blocks
 */
public record CodeBlock(
    int start,
    int column,
    int end,
    String header,
    String name
) {

    public boolean contains(int index) {
        return index >= start && index <= end;
    }

    public boolean hasName() {
        return name != null;
    }

    public int length() {
        return end - start + 1;
    }

    CodeBlock named(String declaredName) {
        return new CodeBlock(start, column, end, header, declaredName);
    }
}
