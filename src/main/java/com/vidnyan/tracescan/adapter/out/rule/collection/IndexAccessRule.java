package com.vidnyan.tracescan.adapter.out.rule.collection;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Detects positional access to the first or last element of a collection, or to a
 * split result, without a size check.
 */
@Component
public class IndexAccessRule extends AbstractRule {

    public static final String NAME = "unguarded-index-access";

    private static final int LOOKBACK = 5;

    private static final Pattern GET_ZERO = Pattern.compile("([\\w)\\]]+)\\s*\\.\\s*get\\s*\\(\\s*0\\s*\\)");
    private static final Pattern SUBSCRIPT_ZERO = Pattern.compile("(?<!new\\s)\\b(\\w+)\\s*\\[\\s*0\\s*\\]");
    private static final Pattern FIRST_LAST = Pattern.compile("([\\w)\\]]+)\\s*\\.\\s*(first|last)\\s*\\(\\s*\\)");
    private static final Pattern SPLIT_INDEX = Pattern.compile("\\.split\\s*\\([^)]*\\)\\s*\\[\\s*([1-9]\\d*)\\s*\\]");
    private static final Pattern ANY_SIZE_CHECK = Pattern.compile(
            "isEmpty|isNotEmpty|isNullOrEmpty|\\.size\\b|\\.length\\b|firstOrNull|lastOrNull|getOrNull|\\.count\\b");

    public IndexAccessRule() {
        super(NAME,
                "Unguarded index access",
                "Check the size first (isEmpty / size > n) or use firstOrNull() / getOrNull() "
                        + "and handle the missing element.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, GET_ZERO, (index, match) -> check(file, matches, index, match.group(1), "get(0)"));
        forEachMatch(file, matches, SUBSCRIPT_ZERO, (index, match) -> {
            if (isArrayDeclaration(file.line(index), match)) {
                return;
            }
            check(file, matches, index, match.group(1), "[0]");
        });
        if (file.isKotlin()) {
            forEachMatch(file, matches, FIRST_LAST, (index, match) ->
                    check(file, matches, index, match.group(1), match.group(2) + "()"));
        }
        forEachMatch(file, matches, SPLIT_INDEX, (index, match) -> {
            Pattern partsCheck = Pattern.compile("\\.length\\s*[><=]|\\.size\\s*[><=]|\\.size\\(\\)\\s*[><=]");
            if (LineWindow.lookback(file.lines(), index, LOOKBACK, partsCheck)) {
                return;
            }
            matches.report(index, Severity.HIGH,
                    "split(...)[" + match.group(1) + "] assumes the separator is present");
        });
    }

    private void check(SourceFile file, MatchCollector matches, int index, String receiver, String access) {
        String name = receiver.replaceAll("\\W+$", "").replaceAll("^.*\\W", "");
        if (!name.isEmpty() && !name.equals("it")) {
            String n = Pattern.quote(name);
            Pattern related = Pattern.compile("\\b" + n + "\\s*(?:\\?)?\\.\\s*(?:isEmpty|isNotEmpty|isNullOrEmpty"
                    + "|size|length|count|firstOrNull|lastOrNull|getOrNull)\\b"
                    + "|(?:isEmpty|size)\\s*\\(\\s*" + n + "\\s*\\)");
            if (LineWindow.lookback(file.lines(), index, LOOKBACK, related)) {
                return;
            }
        }
        Severity severity = LineWindow.lookback(file.lines(), index, LOOKBACK, ANY_SIZE_CHECK)
                ? Severity.MEDIUM : Severity.HIGH;
        matches.report(index, severity, access + " on '" + receiver + "' without a size check");
    }

    private boolean isArrayDeclaration(String line, MatchResult match) {
        String before = line.substring(0, match.start());
        return before.matches(".*\\bnew\\s+[\\w.<>]*\\s*$") || line.contains("arrayOf") && line.contains("[0] =");
    }
}
