package com.vidnyan.tracescan.adapter.out.rule.exception;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects placeholder implementations that always throw when reached.
 */
@Component
public class TodoCallRule extends AbstractRule {

    public static final String NAME = "todo-call";

    private static final Pattern KOTLIN_TODO = Pattern.compile("(?<![\\w.])TODO\\s*\\(");
    private static final Pattern JAVA_UNSUPPORTED = Pattern.compile("\\bthrow\\s+new\\s+UnsupportedOperationException\\s*\\(");
    private static final Pattern NOT_IMPLEMENTED = Pattern.compile("(?i)not\\s+(?:yet\\s+)?implemented|\\btodo\\b");

    public TodoCallRule() {
        super(NAME,
                "Unimplemented code path",
                "Implement the branch or make it unreachable; TODO() and not-implemented "
                        + "exceptions crash as soon as the code runs.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        if (file.isKotlin()) {
            forEachMatch(file, matches, KOTLIN_TODO, (index, match) ->
                    matches.report(index, Severity.HIGH, "TODO() throws NotImplementedError when reached"));
            return;
        }
        forEachMatch(file, matches, JAVA_UNSUPPORTED, (index, match) -> {
            if (NOT_IMPLEMENTED.matcher(file.line(index)).find()) {
                matches.report(index, Severity.MEDIUM, "Placeholder throws UnsupportedOperationException");
            }
        });
    }
}
