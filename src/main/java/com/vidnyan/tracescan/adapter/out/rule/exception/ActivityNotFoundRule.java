package com.vidnyan.tracescan.adapter.out.rule.exception;

import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.CodeBlock;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator.Statement;
import com.vidnyan.tracescan.domain.scan.TryCoverage;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects implicit intents started without checking that some activity can handle them.
 */
@Component
public class ActivityNotFoundRule extends AbstractRule {

    public static final String NAME = "activity-not-found";

    private static final int LOOKBACK = 10;

    private static final Pattern START = Pattern.compile("\\bstartActivity(?:ForResult)?\\s*\\(");
    private static final Pattern IMPLICIT = Pattern.compile("ACTION_|setAction\\s*\\(|Uri\\.parse|\\.action\\s*=");
    private static final Pattern EXPLICIT = Pattern.compile("::class|\\.class\\b|createChooser|setClass|setComponent");
    private static final Pattern HANDLED = Pattern.compile(
            "resolveActivity|queryIntentActivities|ActivityNotFoundException");
    private static final Pattern DECLARED = Pattern.compile("ActivityNotFoundException|\\bException\\b|Throwable");

    public ActivityNotFoundRule() {
        super(NAME,
                "Unresolved implicit intent",
                "Check intent.resolveActivity(packageManager) before starting it, or catch "
                        + "ActivityNotFoundException and tell the user no app can handle the action.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, START, (index, match) -> {
            String call = StatementAccumulator.accumulate(file.lines(), index, match.start())
                    .map(Statement::text)
                    .orElse(file.line(index));
            if (EXPLICIT.matcher(call).find()) {
                return;
            }
            boolean implicit = IMPLICIT.matcher(call).find()
                    || LineWindow.lookback(file.lines(), index, LOOKBACK, IMPLICIT);
            if (!implicit) {
                return;
            }
            Optional<CodeBlock> method = BlockLocator.findEnclosingMethod(file.lines(), index);
            if (method.isPresent() && LineWindow.contains(file.lines(), method.get(), HANDLED)) {
                return;
            }
            TryCoverage coverage = TryCoverage.at(file.lines(), index, match.start(), DECLARED);
            coverage.severity().ifPresent(severity -> matches.report(index, severity,
                    "Implicit intent started without resolveActivity() or ActivityNotFoundException handling"));
        });
    }
}
