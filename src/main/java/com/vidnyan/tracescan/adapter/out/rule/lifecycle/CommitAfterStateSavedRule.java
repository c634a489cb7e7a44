package com.vidnyan.tracescan.adapter.out.rule.lifecycle;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.ScopeTracker;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Detects fragment transactions committed where the host state may already be saved.
 */
@Component
public class CommitAfterStateSavedRule extends AbstractRule {

    public static final String NAME = "commit-after-state-saved";

    private static final Set<String> LATE_LIFECYCLE = Set.of(
            "onPause", "onStop", "onSaveInstanceState", "onDestroy", "onDestroyView", "onDetach");
    private static final Pattern COMMIT = Pattern.compile("\\.\\s*commit\\s*\\(\\s*\\)");
    private static final Pattern TRANSACTION = Pattern.compile("beginTransaction|FragmentTransaction");
    private static final Pattern GUARD = Pattern.compile(
            "isStateSaved|isFinishing|isDestroyed|isAdded|lifecycle\\.currentState");

    public CommitAfterStateSavedRule() {
        super(NAME,
                "Commit after state saved",
                "Check isStateSaved() before committing, commit from onResume/onStart, or use "
                        + "commitAllowingStateLoss() when losing the transaction is acceptable.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        ScopeTracker scopes = new ScopeTracker(file);
        for (int i = 0; i < file.lineCount(); i++) {
            scopes.advance(i);
            String raw = file.line(i);
            if (SourceText.isComment(raw) || !COMMIT.matcher(SourceText.code(raw)).find()) {
                continue;
            }
            if (!LineWindow.lookback(file.lines(), i, 8, TRANSACTION)) {
                continue;
            }
            Optional<String> method = scopes.currentMethod();
            String where;
            if (method.isPresent() && LATE_LIFECYCLE.contains(method.get())) {
                where = method.get() + "()";
            } else if (scopes.callbackWithinMethod().isPresent()) {
                where = "an asynchronous " + scopes.callbackWithinMethod().get().name() + " callback";
            } else {
                continue;
            }
            if (LineWindow.lookback(file.lines(), i, 10, GUARD)) {
                continue;
            }
            matches.report(i, Severity.HIGH, "Fragment transaction committed in " + where);
        }
    }
}
