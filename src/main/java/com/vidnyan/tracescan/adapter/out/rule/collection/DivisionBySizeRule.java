package com.vidnyan.tracescan.adapter.out.rule.collection;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects integer division or modulo by a collection size that may be zero.
 */
@Component
public class DivisionBySizeRule extends AbstractRule {

    public static final String NAME = "division-by-size";

    private static final Pattern DIVISION = Pattern.compile(
            "(?<![/*])[/%]=?\\s*(\\w+\\s*\\.\\s*(?:size|length|count)(?:\\s*\\(\\s*\\))?"
            + "|(?:get(?:Item)?Count)\\s*\\(\\s*\\)|itemCount)\\b");
    private static final Pattern FLOATING = Pattern.compile(
            "\\b(?:float|double|Float|Double)\\b|\\.toFloat\\(|\\.toDouble\\(|\\d\\.\\d|\\d[fF]\\b");
    private static final Pattern GUARD = Pattern.compile(
            ">\\s*0|!=\\s*0|>=\\s*1|==\\s*0|isEmpty|isNotEmpty|coerceAtLeast|Math\\.max");

    public DivisionBySizeRule() {
        super(NAME,
                "Division by collection size",
                "An empty collection makes the divisor zero (ArithmeticException for integers); "
                        + "return early when the collection is empty.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, DIVISION, (index, match) -> {
            if (FLOATING.matcher(file.line(index)).find()
                    || LineWindow.lookback(file.lines(), index, 5, GUARD)) {
                return;
            }
            matches.report(index, Severity.MEDIUM,
                    "Divides by '" + match.group(1).replaceAll("\\s", "") + "' without an empty check");
        });
    }
}
