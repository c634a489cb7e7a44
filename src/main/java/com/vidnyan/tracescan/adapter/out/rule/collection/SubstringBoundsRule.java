package com.vidnyan.tracescan.adapter.out.rule.collection;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator.Statement;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects {@code substring} calls whose bounds may fall outside the string.
 */
@Component
public class SubstringBoundsRule extends AbstractRule {

    public static final String NAME = "unsafe-substring";

    private static final int LOOKBACK = 5;

    private static final Pattern SUBSTRING = Pattern.compile("\\.substring\\s*\\(");
    private static final Pattern INDEX_OF = Pattern.compile("\\b(?:lastIndexOf|indexOf)\\s*\\(");
    private static final Pattern NUMERIC_BOUNDS = Pattern.compile("^\\(\\s*\\d+\\s*(?:,\\s*\\d+\\s*)?\\)$");
    private static final Pattern INDEX_GUARD = Pattern.compile(
            ">=\\s*0|!=\\s*-1|>\\s*-1|\\.contains\\s*\\(|<\\s*0|==\\s*-1");
    private static final Pattern LENGTH_GUARD = Pattern.compile("\\.length\\b|isEmpty|isNotEmpty|\\.size\\b|startsWith");

    public SubstringBoundsRule() {
        super(NAME,
                "Unsafe substring bounds",
                "indexOf() returns -1 when nothing is found and fixed bounds assume a minimum length; "
                        + "check both before calling substring().",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, SUBSTRING, (index, match) -> {
            String arguments = StatementAccumulator.accumulate(file.lines(), index, match.end() - 1)
                    .map(Statement::text)
                    .orElse(file.line(index).substring(match.end() - 1));
            if (INDEX_OF.matcher(arguments).find()) {
                if (!LineWindow.lookback(file.lines(), index, LOOKBACK, INDEX_GUARD)) {
                    matches.report(index, Severity.HIGH, "substring bounds come from indexOf() without a -1 check");
                }
                return;
            }
            if (NUMERIC_BOUNDS.matcher(arguments.trim()).matches()
                    && !LineWindow.lookback(file.lines(), index, LOOKBACK, LENGTH_GUARD)) {
                matches.report(index, Severity.MEDIUM,
                        "substring" + arguments.trim() + " assumes a minimum length that is never checked");
            }
        });
    }
}
