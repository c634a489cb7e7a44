package com.vidnyan.tracescan.adapter.out.rule.nullsafety;

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
 * Detects {@code savedInstanceState.x} in Java lifecycle methods where the bundle
 * is null on first creation.
 */
@Component
public class SavedStateDereferenceRule extends AbstractRule {

    public static final String NAME = "saved-state-dereference";

    private static final Pattern DEREFERENCE = Pattern.compile("\\bsavedInstanceState\\s*\\.\\s*\\w+");
    private static final Pattern GUARD = Pattern.compile(
            "savedInstanceState\\s*[!=]=\\s*null|null\\s*[!=]=\\s*savedInstanceState");

    public SavedStateDereferenceRule() {
        super(NAME,
                "Null saved-state bundle",
                "savedInstanceState is null on the first launch; wrap access in "
                        + "if (savedInstanceState != null) or restore state in onRestoreInstanceState.",
                JAVA_ONLY);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, DEREFERENCE, (index, match) -> {
            CodeBlock method = BlockLocator.findEnclosingMethod(file.lines(), index)
                    .orElseThrow(() -> new RuleEvaluationException("no enclosing method", index + 1));
            if ("onRestoreInstanceState".equals(method.name())) {
                return;
            }
            if (LineWindow.contains(file.lines(), method.start(), index, GUARD)) {
                return;
            }
            matches.report(index, Severity.HIGH,
                    "savedInstanceState dereferenced in " + method.name() + "() without a null check");
        });
    }
}
