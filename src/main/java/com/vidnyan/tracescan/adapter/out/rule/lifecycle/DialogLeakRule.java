package com.vidnyan.tracescan.adapter.out.rule.lifecycle;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.ScopeTracker;
import com.vidnyan.tracescan.domain.scan.ScopeTracker.Scope;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects dialogs shown from asynchronous callbacks without checking that the
 * window is still alive (WindowManager$BadTokenException).
 */
@Component
public class DialogLeakRule extends AbstractRule {

    public static final String NAME = "dialog-window-leak";

    private static final Pattern SHOW = Pattern.compile("\\.\\s*show\\s*\\(\\s*\\)");
    private static final Pattern NOT_A_DIALOG = Pattern.compile("\\b(?:Toast|Snackbar)\\b|makeText");
    private static final Pattern DIALOG = Pattern.compile("(?i)dialog");
    private static final Pattern GUARD = Pattern.compile(
            "isFinishing|isDestroyed|isAdded|isResumed|lifecycle\\.currentState|isShowing");

    public DialogLeakRule() {
        super(NAME,
                "Dialog window leak",
                "Check isFinishing()/isDestroyed() (or isAdded in a fragment) before showing a dialog "
                        + "from a callback, or use a lifecycle-aware DialogFragment.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        ScopeTracker scopes = new ScopeTracker(file);
        for (int i = 0; i < file.lineCount(); i++) {
            scopes.advance(i);
            String raw = file.line(i);
            if (SourceText.isComment(raw) || !SHOW.matcher(SourceText.code(raw)).find()) {
                continue;
            }
            if (NOT_A_DIALOG.matcher(raw).find() || !LineWindow.lookback(file.lines(), i, 5, DIALOG)) {
                continue;
            }
            Optional<Scope> callback = scopes.callbackWithinMethod();
            if (callback.isEmpty()) {
                continue;
            }
            if (LineWindow.contains(file.lines(), callback.get().openIndex(), i, GUARD)) {
                continue;
            }
            matches.report(i, Severity.MEDIUM,
                    "Dialog shown from " + callback.get().name() + " callback without a window state check");
        }
    }
}
