package com.vidnyan.tracescan.adapter.out.rule.nullsafety;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects the Kotlin not-null assertion operator ({@code !!}).
 * Assertions on values that come from intents, bundles or view lookups are rated higher.
 */
@Component
public class NotNullAssertionRule extends AbstractRule {

    public static final String NAME = "not-null-assertion";

    private static final Pattern ASSERTION = Pattern.compile("[\\w)\\]]\\s*!!");
    private static final Pattern RISKY_SOURCE = Pattern.compile(
            "\\b(?:intent|extras|arguments|savedInstanceState|activity|context|view|parentFragment)\\b"
            + "|get\\w*Extra\\b|getString\\b|getParcelable\\w*|getSerializable\\w*|findViewById|getSystemService"
            + "|\\.get\\s*\\(|\\]$");

    public NotNullAssertionRule() {
        super(NAME,
                "Not-null assertion",
                "Replace '!!' with a safe call (?.), an elvis fallback (?:) or an explicit "
                        + "requireNotNull(...) with a descriptive message.",
                KOTLIN_ONLY);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, ASSERTION, (index, match) -> {
            String raw = file.line(index);
            int operator = match.end() - 2;
            String expression = expressionBefore(raw, operator);
            Severity severity = RISKY_SOURCE.matcher(expression).find() ? Severity.HIGH : Severity.MEDIUM;
            matches.report(index, severity, "Not-null assertion on '" + expression + "'");
        });
    }

    /**
     * Expression text ending right before the given position, with brackets balanced.
     */
    static String expressionBefore(String line, int end) {
        int balance = 0;
        int start = end;
        while (start > 0) {
            char c = line.charAt(start - 1);
            if (c == ')' || c == ']') {
                balance++;
            } else if (c == '(' || c == '[') {
                if (balance == 0) {
                    break;
                }
                balance--;
            } else if (balance == 0 && !(Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '?'
                    || c == '"' || c == '!')) {
                break;
            }
            start--;
        }
        return line.substring(start, end).trim();
    }
}
