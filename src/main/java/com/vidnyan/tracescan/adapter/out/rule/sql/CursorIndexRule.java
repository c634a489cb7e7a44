package com.vidnyan.tracescan.adapter.out.rule.sql;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects cursor reads that assume a column exists or that the cursor is positioned.
 */
@Component
public class CursorIndexRule extends AbstractRule {

    public static final String NAME = "cursor-index";

    private static final String GETTERS = "(?:getString|getInt|getLong|getDouble|getFloat|getShort|getBlob|isNull)";

    private static final Pattern GET_COLUMN_INDEX = Pattern.compile(
            "\\." + GETTERS + "\\s*\\(\\s*[\\w.]*\\s*\\.?\\s*getColumnIndex\\s*\\(");
    private static final Pattern CURSOR_GET = Pattern.compile(
            "\\b((?i:\\w*cursor\\w*)|c)\\s*\\??\\.\\s*" + GETTERS + "\\s*\\(");
    private static final Pattern POSITIONED = Pattern.compile(
            "moveToFirst|moveToNext|moveToPosition|moveToLast|moveToPrevious|\\.use\\s*\\{.*->|while\\s*\\(.*\\.moveTo");

    public CursorIndexRule() {
        super(NAME,
                "Unsafe cursor access",
                "Use getColumnIndexOrThrow() (or check for -1) and move the cursor with moveToFirst()/"
                        + "moveToNext() before reading.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, GET_COLUMN_INDEX, (index, match) ->
                matches.report(index, Severity.MEDIUM, "getColumnIndex() returns -1 for a missing column"));

        forEachMatch(file, matches, CURSOR_GET, (index, match) -> {
            if (LineWindow.lookback(file.lines(), index, 10, POSITIONED)) {
                return;
            }
            matches.report(index, Severity.HIGH,
                    "'" + match.group(1) + "' read before moveToFirst()/moveToNext()");
        });
    }
}
