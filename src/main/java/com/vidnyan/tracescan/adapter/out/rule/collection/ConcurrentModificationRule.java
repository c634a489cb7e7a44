package com.vidnyan.tracescan.adapter.out.rule.collection;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator.Statement;
import com.vidnyan.tracescan.domain.source.SourceFile;
import com.vidnyan.tracescan.exception.RuleEvaluationException;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects structural modification of a collection inside a for-each loop over it.
 */
@Component
public class ConcurrentModificationRule extends AbstractRule {

    public static final String NAME = "concurrent-modification";

    private static final Pattern JAVA_FOR_EACH = Pattern.compile(
            "\\bfor\\s*\\(\\s*(?:final\\s+)?[\\w.<>?, \\[\\]]+\\s+\\w+\\s*:\\s*(?:this\\.)?(\\w+)\\s*\\)");
    private static final Pattern KOTLIN_FOR_IN = Pattern.compile(
            "\\bfor\\s*\\(\\s*(?:\\(.*\\)|\\w+)\\s+in\\s+(?:this\\.)?(\\w+)\\s*\\)");
    private static final Pattern FOR_EACH_CALL = Pattern.compile("\\b(\\w+)\\s*\\.\\s*forEach\\s*(?:\\{|\\()");
    private static final Pattern EXIT = Pattern.compile("\\b(?:break|return)\\b");
    private static final int MAX_STATEMENT_LINES = 10;

    public ConcurrentModificationRule() {
        super(NAME,
                "Concurrent modification",
                "Iterate over a copy, collect the changes and apply them after the loop, "
                        + "or use Iterator.remove() / removeIf().",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, JAVA_FOR_EACH, (index, match) ->
                checkBody(file, matches, index, loopBody(file, index, match.end()), match.group(1)));
        forEachMatch(file, matches, KOTLIN_FOR_IN, (index, match) -> {
            String collection = match.group(1);
            if (collection.equals("indices") || file.line(index).matches(".*\\b(?:until|downTo)\\b.*|.*\\.\\..*")) {
                return;
            }
            checkBody(file, matches, index, loopBody(file, index, match.end()), collection);
        });
        forEachMatch(file, matches, FOR_EACH_CALL, (index, match) ->
                checkBody(file, matches, index, forEachBody(file, index, match.end() - 1), match.group(1)));
    }

    /**
     * Body of a for loop: a block opened right after the header, or the single
     * statement that follows it.
     */
    private Body loopBody(SourceFile file, int index, int column) {
        int line = index;
        String code = SourceText.code(file.line(index));
        int start = firstNonBlank(code, column);
        if (start < 0) {
            line = nextCodeLine(file, index);
            code = SourceText.code(file.line(line));
            start = firstNonBlank(code, 0);
        }
        if (code.charAt(start) == '{') {
            return block(file, line, start);
        }
        if (file.isKotlin()) {
            return new Body(line, start, line, code.length());
        }
        int last = Math.min(file.lineCount() - 1, line + MAX_STATEMENT_LINES);
        for (int i = line; i <= last; i++) {
            int semicolon = SourceText.code(file.line(i)).indexOf(';', i == line ? start : 0);
            if (semicolon >= 0) {
                return new Body(line, start, i, semicolon + 1);
            }
        }
        throw new RuleEvaluationException("loop statement not terminated", index + 1);
    }

    /**
     * Body of a forEach call: its trailing lambda block or its argument list.
     */
    private Body forEachBody(SourceFile file, int index, int open) {
        if (SourceText.code(file.line(index)).charAt(open) == '{') {
            return block(file, index, open);
        }
        Statement call = StatementAccumulator.accumulate(file.lines(), index, open)
                .orElseThrow(() -> new RuleEvaluationException("forEach arguments not closed", index + 1));
        return new Body(index, open, call.endIndex(), call.endColumn() + 1);
    }

    private Body block(SourceFile file, int index, int brace) {
        int end = BlockLocator.findBlockEnd(file.lines(), index, brace);
        if (end < 0) {
            throw new RuleEvaluationException("loop body not closed", index + 1);
        }
        return new Body(index, brace, end, Integer.MAX_VALUE);
    }

    private void checkBody(SourceFile file, MatchCollector matches, int loopIndex, Body body, String collection) {
        Pattern mutation = Pattern.compile("(?<![\\w.])(?:this\\.)?" + Pattern.quote(collection)
                + "\\s*\\.\\s*(remove|removeAt|removeAll|removeIf|add|addAll|clear|put|putAll)\\s*\\(");
        for (int i = body.startIndex(); i <= body.endIndex(); i++) {
            if (SourceText.isComment(file.line(i))) {
                continue;
            }
            String code = SourceText.code(file.line(i));
            int from = i == body.startIndex() ? Math.min(body.startColumn(), code.length()) : 0;
            int to = i == body.endIndex() ? Math.min(body.endColumn(), code.length()) : code.length();
            if (from >= to) {
                continue;
            }
            Matcher call = mutation.matcher(code.substring(from, to));
            if (!call.find()) {
                continue;
            }
            boolean exits = EXIT.matcher(code).find()
                    || (i + 1 <= body.endIndex() && EXIT.matcher(SourceText.code(file.line(i + 1))).find());
            if (!exits) {
                matches.report(i, Severity.HIGH, String.format(
                        "'%s.%s()' while iterating over '%s' (loop at line %d)",
                        collection, call.group(1), collection, loopIndex + 1));
            }
        }
    }

    private static int nextCodeLine(SourceFile file, int index) {
        for (int i = index + 1; i < file.lineCount(); i++) {
            if (!SourceText.isBlankOrComment(file.line(i)) && !SourceText.code(file.line(i)).isBlank()) {
                return i;
            }
        }
        throw new RuleEvaluationException("loop body missing", index + 1);
    }

    private static int firstNonBlank(String code, int from) {
        for (int c = from; c < code.length(); c++) {
            if (!Character.isWhitespace(code.charAt(c))) {
                return c;
            }
        }
        return -1;
    }

    /**
     * Lines and columns a loop body spans; the end column is exclusive.
     */
    private record Body(int startIndex, int startColumn, int endIndex, int endColumn) {}
}
