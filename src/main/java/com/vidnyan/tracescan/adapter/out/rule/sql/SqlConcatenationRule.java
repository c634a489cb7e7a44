package com.vidnyan.tracescan.adapter.out.rule.sql;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator.Statement;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects SQL statements built by string concatenation or templates instead of
 * bound arguments.
 */
@Component
public class SqlConcatenationRule extends AbstractRule {

    public static final String NAME = "sql-string-concatenation";

    private static final Pattern SQL_CALL = Pattern.compile("\\b(rawQuery|execSQL|compileStatement|query)\\s*\\(");
    private static final Pattern DECLARATION = Pattern.compile(
            "\\b(?:fun|public|private|protected|abstract|override)\\b[^=]*\\b(?:rawQuery|execSQL|compileStatement|query)\\s*\\(");
    private static final Pattern CONCATENATION = Pattern.compile("\"\\s*\\+|\\+\\s*\"");
    private static final Pattern TEMPLATE = Pattern.compile("\"[^\"]*\\$\\{?\\w[^\"]*\"");
    private static final Pattern FORMAT = Pattern.compile("String\\.format\\s*\\(|\\.format\\s*\\(");
    private static final Pattern FIRST_ARGUMENT = Pattern.compile("^\\(\\s*(\\w+)\\s*[,)]");

    public SqlConcatenationRule() {
        super(NAME,
                "SQL string concatenation",
                "Pass values as selection arguments ('?' placeholders with bindArgs/selectionArgs) "
                        + "instead of concatenating them into the SQL text.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, SQL_CALL, (index, match) -> {
            if (DECLARATION.matcher(file.line(index)).find()) {
                return;
            }
            String call = StatementAccumulator.accumulate(file.lines(), index, match.end() - 1)
                    .map(Statement::text)
                    .orElse(file.line(index).substring(match.end() - 1));
            String how = builtBy(call);
            if (how == null) {
                how = builtBeforeCall(file, index, call);
            }
            if (how == null) {
                return;
            }
            Severity severity = call.contains("?") ? Severity.MEDIUM : Severity.HIGH;
            matches.report(index, severity, match.group(1) + "() with SQL built by " + how);
        });
    }

    private static String builtBy(String text) {
        if (CONCATENATION.matcher(text).find()) {
            return "string concatenation";
        }
        if (TEMPLATE.matcher(text).find()) {
            return "a string template";
        }
        if (FORMAT.matcher(text).find() && text.contains("%s")) {
            return "String.format";
        }
        return null;
    }

    private static String builtBeforeCall(SourceFile file, int index, String call) {
        Matcher argument = FIRST_ARGUMENT.matcher(call);
        if (!argument.find()) {
            return null;
        }
        String variable = Pattern.quote(argument.group(1));
        Pattern assembled = Pattern.compile("\\b" + variable + "\\s*(?::\\s*String\\s*)?\\+?=\\s*.*(?:\"\\s*\\+|\\+\\s*\"|\\$\\{?\\w)"
                + "|\\b" + variable + "\\s*\\.\\s*append\\s*\\(");
        return LineWindow.contains(file.lines(), index - 10, index - 1, assembled) ? "concatenation in '" + argument.group(1) + "'" : null;
    }
}
