package com.vidnyan.tracescan.domain.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-level text helpers shared by all rules.
 * Works on single lines; there is no tokenizer behind it.
 */
public final class SourceText {

    private SourceText() {
    }

    /**
     * The line with string and char literal contents replaced by spaces and the
     * trailing line comment removed. Column positions are preserved.
     */
    public static String code(String line) {
        StringBuilder out = new StringBuilder(line.length());
        char quote = 0;
        boolean escaped = false;
        boolean blockComment = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (blockComment) {
                if (c == '*' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                    out.append("  ");
                    i++;
                    blockComment = false;
                } else {
                    out.append(' ');
                }
                continue;
            }
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                    out.append(' ');
                } else if (c == '\\') {
                    escaped = true;
                    out.append(' ');
                } else if (c == quote) {
                    quote = 0;
                    out.append(c);
                } else {
                    out.append(' ');
                }
                continue;
            }
            if (c == '/' && i + 1 < line.length()) {
                char next = line.charAt(i + 1);
                if (next == '/') {
                    break;
                }
                if (next == '*') {
                    out.append("  ");
                    i++;
                    blockComment = true;
                    continue;
                }
            }
            if (c == '"' || c == '\'') {
                quote = c;
            }
            out.append(c);
        }
        return out.toString();
    }

    /**
     * Copy of the lines with block comment text replaced by spaces, following comments
     * across line breaks. Literals and line comments are kept; columns are preserved.
     */
    public static List<String> maskBlockComments(List<String> lines) {
        List<String> masked = new ArrayList<>(lines.size());
        boolean inComment = false;
        for (String line : lines) {
            StringBuilder out = new StringBuilder(line.length());
            char quote = 0;
            boolean escaped = false;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (inComment) {
                    if (c == '*' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                        out.append("  ");
                        i++;
                        inComment = false;
                    } else {
                        out.append(' ');
                    }
                    continue;
                }
                if (quote != 0) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == quote) {
                        quote = 0;
                    }
                    out.append(c);
                    continue;
                }
                if (c == '/' && i + 1 < line.length()) {
                    char next = line.charAt(i + 1);
                    if (next == '/') {
                        out.append(line, i, line.length());
                        break;
                    }
                    if (next == '*') {
                        out.append("  ");
                        i++;
                        inComment = true;
                        continue;
                    }
                }
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                out.append(c);
            }
            masked.add(out.toString());
        }
        return masked;
    }

    /**
     * True for blank lines and lines that are entirely comment.
     */
    public static boolean isComment(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("*");
    }

    public static boolean isBlankOrComment(String line) {
        return line.isBlank() || isComment(line);
    }

    /**
     * Opening minus closing braces outside literals and comments.
     */
    public static int braceDelta(String line) {
        if (isComment(line)) {
            return 0;
        }
        String code = code(line);
        return count(code, '{') - count(code, '}');
    }

    /**
     * Opening minus closing parentheses outside literals and comments.
     */
    public static int parenDelta(String text) {
        String code = code(text);
        return count(code, '(') - count(code, ')');
    }

    public static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
