package com.vidnyan.tracescan.domain.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Brace-depth boundary finder.
 * Locates enclosing blocks, methods and try blocks by counting braces on raw lines.
 */
public final class BlockLocator {

    private static final int MAX_HEADER_LINES = 6;

    private static final Pattern KOTLIN_FUN = Pattern.compile(
            "\\bfun\\s+(?:<[^>]*>\\s*)?(?:[\\w.]+\\.)?(\\w+)\\s*\\(");
    private static final Pattern KOTLIN_INIT = Pattern.compile("^\\s*(?:\\}\\s*)?init\\s*$");
    private static final Pattern KOTLIN_CONSTRUCTOR = Pattern.compile("\\bconstructor\\s*\\(");
    private static final Pattern JAVA_DECLARATION = Pattern.compile(
            "^(?:@[\\w.]+(?:\\([^)]*\\))?\\s+)*"
            + "((?:(?:public|protected|private|static|final|synchronized|abstract|native|default)\\s+)+)?"
            + "(?:<[^>]*>\\s+)?"
            + "([\\w.$]+(?:<.*>)?(?:\\[\\])*\\s+)?"
            + "([\\w$]+)\\s*\\(");
    private static final Pattern CONTROL_START = Pattern.compile(
            "^\\s*(?:\\}\\s*)?(?:if|else|for|while|do|switch|when|try|catch|finally|synchronized|return|throw|new|case)\\b");
    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "\\b(?:class|interface|enum|object|record)\\s+\\w+");
    private static final Pattern TRY_HEADER = Pattern.compile(
            "(?:^|[\\s}=(])try\\s*(?:\\(.*\\))?\\s*$|\\brunCatching\\s*$");
    private static final Set<String> KEYWORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "when", "try", "catch", "finally",
            "synchronized", "return", "throw", "new", "case", "super", "this");

    private BlockLocator() {
    }

    /**
     * Find the line holding the brace that closes the first block opened at or after
     * the given position.
     *
     * @return 0-based line index, or -1 if the block is never opened or never closed
     */
    public static int findBlockEnd(List<String> lines, int openIndex, int column) {
        int depth = 0;
        boolean opened = false;
        for (int i = openIndex; i < lines.size(); i++) {
            String code = SourceText.isComment(lines.get(i)) ? "" : SourceText.code(lines.get(i));
            int from = i == openIndex ? Math.min(column, code.length()) : 0;
            for (int c = from; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '{') {
                    depth++;
                    opened = true;
                } else if (ch == '}' && opened) {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
        }
        return -1;
    }

    public static int findBlockEnd(List<String> lines, int openIndex) {
        return findBlockEnd(lines, openIndex, 0);
    }

    /**
     * All blocks enclosing the given position, innermost first.
     * Text on the target line before {@code column} counts as enclosing context.
     */
    public static List<CodeBlock> enclosingBlocks(List<String> lines, int index, int column) {
        List<CodeBlock> blocks = new ArrayList<>();
        if (index < 0 || index >= lines.size()) {
            return blocks;
        }
        int balance = 0;
        for (int i = index; i >= 0; i--) {
            String raw = lines.get(i);
            if (SourceText.isComment(raw)) {
                continue;
            }
            String code = SourceText.code(raw);
            int from = i == index ? Math.min(column, code.length()) - 1 : code.length() - 1;
            for (int c = from; c >= 0; c--) {
                char ch = code.charAt(c);
                if (ch == '}') {
                    balance++;
                } else if (ch == '{') {
                    if (balance == 0) {
                        blocks.add(toBlock(lines, i, c));
                    } else {
                        balance--;
                    }
                }
            }
        }
        return blocks;
    }

    public static List<CodeBlock> enclosingBlocks(List<String> lines, int index) {
        return enclosingBlocks(lines, index, 0);
    }

    /**
     * Innermost block enclosing the given line.
     */
    public static Optional<CodeBlock> findEnclosingBlock(List<String> lines, int index) {
        List<CodeBlock> blocks = enclosingBlocks(lines, index);
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks.get(0));
    }

    /**
     * Innermost method, function, constructor or initializer enclosing the given line.
     */
    public static Optional<CodeBlock> findEnclosingMethod(List<String> lines, int index) {
        for (CodeBlock block : enclosingBlocks(lines, index)) {
            Optional<String> name = declaredMethodName(block.header());
            if (name.isPresent()) {
                return Optional.of(block.named(name.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Check if any block enclosing the position is a try block.
     */
    public static boolean isInsideTry(List<String> lines, int index, int column) {
        for (CodeBlock block : enclosingBlocks(lines, index, column)) {
            if (isTryHeader(block.header())) {
                return true;
            }
            if (declaredMethodName(block.header()).isPresent()) {
                return false;
            }
        }
        return false;
    }

    public static boolean isInsideTry(List<String> lines, int index) {
        return isInsideTry(lines, index, 0);
    }

    public static boolean isTryHeader(String header) {
        return TRY_HEADER.matcher(header).find();
    }

    /**
     * Name declared by a block header, if the header is a method-like declaration.
     */
    public static Optional<String> declaredMethodName(String header) {
        String text = header.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Matcher kotlin = KOTLIN_FUN.matcher(text);
        if (kotlin.find()) {
            return Optional.of(kotlin.group(1));
        }
        if (KOTLIN_INIT.matcher(text).find()) {
            return Optional.of("init");
        }
        if (KOTLIN_CONSTRUCTOR.matcher(text).find() && !text.contains("=")) {
            return Optional.of("constructor");
        }
        if (CONTROL_START.matcher(text).find() || text.contains("->")) {
            return Optional.empty();
        }
        int paren = text.indexOf('(');
        int assign = text.indexOf('=');
        if (paren < 0 || (assign >= 0 && assign < paren)
                || TYPE_DECLARATION.matcher(text.substring(0, paren)).find()) {
            return Optional.empty();
        }
        Matcher java = JAVA_DECLARATION.matcher(text);
        if (!java.find() || (java.group(1) == null && java.group(2) == null)) {
            return Optional.empty();
        }
        String type = java.group(2) == null ? "" : java.group(2).trim();
        String name = java.group(3);
        if (KEYWORDS.contains(name) || KEYWORDS.contains(type)) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    /**
     * Check if any line of the block contains a try block.
     */
    public static boolean containsTry(List<String> lines, CodeBlock block) {
        for (int i = block.start(); i <= block.end() && i < lines.size(); i++) {
            String code = SourceText.code(lines.get(i));
            if (code.matches(".*\\btry\\b\\s*(\\{|\\().*") || code.matches(".*\\btry\\s*$")
                    || code.contains("runCatching")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Code preceding the brace at (index, column), extended over earlier lines when
     * the brace sits on its own line or closes a multi-line parameter list.
     */
    public static String headerBefore(List<String> lines, int index, int column) {
        String code = SourceText.code(lines.get(index));
        StringBuilder header = new StringBuilder(code.substring(0, Math.min(column, code.length())));
        int i = index;
        int taken = 0;
        while (i > 0 && taken < MAX_HEADER_LINES
                && (header.toString().isBlank() || SourceText.parenDelta(header.toString()) < 0)) {
            i--;
            String previous = lines.get(i);
            if (SourceText.isBlankOrComment(previous)) {
                continue;
            }
            String previousCode = SourceText.code(previous);
            if (header.toString().isBlank() && (previousCode.trim().endsWith(";")
                    || previousCode.trim().endsWith("}"))) {
                break;
            }
            header.insert(0, previousCode.trim() + " ");
            taken++;
        }
        return header.toString().trim();
    }

    private static CodeBlock toBlock(List<String> lines, int index, int column) {
        int end = findBlockEnd(lines, index, column);
        if (end < 0) {
            end = lines.size() - 1;
        }
        return new CodeBlock(index, column, end, headerBefore(lines, index, column), null);
    }
}
