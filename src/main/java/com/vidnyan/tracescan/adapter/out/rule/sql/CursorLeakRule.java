package com.vidnyan.tracescan.adapter.out.rule.sql;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.CodeBlock;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.source.SourceFile;
import com.vidnyan.tracescan.exception.RuleEvaluationException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects cursors obtained from a query and never closed in the same method.
 */
@Component
public class CursorLeakRule extends AbstractRule {

    public static final String NAME = "cursor-leak";

    private static final Pattern CURSOR_ASSIGNMENT = Pattern.compile(
            "\\b(?:Cursor\\s+(\\w+)|(?:val|var)\\s+(\\w+)(?:\\s*:\\s*Cursor\\??)?)\\s*=\\s*[^;]*\\b(?:rawQuery|query)\\s*\\(");
    private static final Pattern CURSOR_HINT = Pattern.compile("(?i)cursor");
    private static final Pattern TRY_WITH_RESOURCES = Pattern.compile("\\btry\\s*\\(");

    public CursorLeakRule() {
        super(NAME,
                "Cursor leak",
                "Close the cursor in a finally block, use try-with-resources, or Kotlin's use { }.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, CURSOR_ASSIGNMENT, (index, match) -> {
            String cursor = match.group(1) != null ? match.group(1) : match.group(2);
            if (TRY_WITH_RESOURCES.matcher(file.line(index)).find()
                    || (match.group(2) != null && !CURSOR_HINT.matcher(file.line(index)).find())) {
                return;
            }
            CodeBlock method = BlockLocator.findEnclosingMethod(file.lines(), index)
                    .orElseThrow(() -> new RuleEvaluationException("no enclosing method", index + 1));
            String c = Pattern.quote(cursor);
            Pattern closed = Pattern.compile("\\b" + c + "\\s*\\??\\.\\s*close\\s*\\(|\\breturn\\s+" + c + "\\s*;?\\s*$");
            Pattern use = Pattern.compile("\\b" + c + "\\s*\\??\\.\\s*use\\s*\\{|\\.use\\s*\\{");
            if (LineWindow.contains(file.lines(), index, method.end(), closed)
                    || LineWindow.lookahead(file.lines(), index, 2, use)) {
                return;
            }
            matches.report(index, Severity.LOW,
                    "Cursor '" + cursor + "' is never closed in " + method.name() + "()");
        });
    }
}
