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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects fragment host access from asynchronous callbacks that may run after the
 * fragment is detached.
 */
@Component
public class DetachedFragmentRule extends AbstractRule {

    public static final String NAME = "fragment-detached-access";

    private static final Pattern HOST_ACCESS = Pattern.compile(
            "\\brequire(?:Activity|Context|View|Arguments)\\s*\\(\\s*\\)"
            + "|\\bget(?:Activity|Context)\\s*\\(\\s*\\)\\s*\\."
            + "|\\b(?:activity|context)\\s*!!");
    private static final Pattern GUARD = Pattern.compile(
            "isAdded|isDetached|isRemoving|activity\\s*==\\s*null|context\\s*==\\s*null|view\\s*==\\s*null"
            + "|getActivity\\(\\)\\s*==\\s*null|getContext\\(\\)\\s*==\\s*null|\\?:\\s*return"
            + "|viewLifecycleOwner|lifecycleScope|repeatOnLifecycle|\\.observe\\s*\\(|isResumed|lifecycle\\.currentState");

    public DetachedFragmentRule() {
        super(NAME,
                "Detached fragment access",
                "Check isAdded (or null-check activity/context) at the start of the callback, "
                        + "or scope the work to viewLifecycleOwner so it is cancelled on detach.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        if (!file.anyLineContains("Fragment")) {
            return;
        }
        ScopeTracker scopes = new ScopeTracker(file);
        for (int i = 0; i < file.lineCount(); i++) {
            scopes.advance(i);
            String raw = file.line(i);
            if (SourceText.isComment(raw)) {
                continue;
            }
            Matcher access = HOST_ACCESS.matcher(SourceText.code(raw));
            if (!access.find()) {
                continue;
            }
            Optional<Scope> callback = scopes.callbackWithinMethod();
            if (callback.isEmpty()) {
                continue;
            }
            int callbackStart = callback.get().openIndex();
            if (LineWindow.contains(file.lines(), callbackStart, i, GUARD)) {
                continue;
            }
            matches.report(i, Severity.HIGH, String.format(
                    "%s inside %s callback (line %d) can run after the fragment is detached",
                    access.group().replaceAll("\\s", ""), callback.get().name(), callbackStart + 1));
        }
    }
}
