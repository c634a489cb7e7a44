package com.vidnyan.tracescan.adapter.out.rule.threading;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.ScopeTracker;
import com.vidnyan.tracescan.domain.scan.ScopeTracker.Kind;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects blocking network calls made directly from UI-thread callbacks
 * ({@code NetworkOnMainThreadException}).
 */
@Component
public class MainThreadNetworkRule extends AbstractRule {

    public static final String NAME = "main-thread-network";

    private static final Set<String> UI_METHODS = Set.of(
            "onCreate", "onStart", "onResume", "onClick", "onViewCreated", "onCreateView", "onBindViewHolder");
    private static final Pattern BLOCKING_IO = Pattern.compile(
            "\\.\\s*openConnection\\s*\\("
            + "|\\.\\s*connect\\s*\\(\\s*\\)"
            + "|\\.\\s*getInputStream\\s*\\("
            + "|\\bnewCall\\s*\\(.*\\)\\s*\\.\\s*execute\\s*\\(\\s*\\)"
            + "|\\b\\w*[cC]all\\s*\\.\\s*execute\\s*\\(\\s*\\)"
            + "|\\bURL\\s*\\(.*\\)\\s*\\.\\s*(?:readText|readBytes|openStream)\\s*\\("
            + "|\\.\\s*openStream\\s*\\("
            + "|\\bJsoup\\s*\\.\\s*connect\\s*\\(");

    public MainThreadNetworkRule() {
        super(NAME,
                "Network on main thread",
                "Move the request off the UI thread: a coroutine on Dispatchers.IO, an executor, "
                        + "WorkManager, or an async client call (enqueue).",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        ScopeTracker scopes = new ScopeTracker(file);
        for (int i = 0; i < file.lineCount(); i++) {
            scopes.advance(i);
            String raw = file.line(i);
            if (SourceText.isComment(raw)) {
                continue;
            }
            Matcher io = BLOCKING_IO.matcher(SourceText.code(raw));
            if (!io.find()) {
                continue;
            }
            Optional<String> method = scopes.currentMethod();
            if (method.isEmpty() || !UI_METHODS.contains(method.get()) || scopes.isInside(Kind.CALLBACK)) {
                continue;
            }
            matches.report(i, Severity.HIGH, String.format(
                    "Blocking network call '%s' in %s() runs on the main thread",
                    io.group().replaceAll("\\s", ""), method.get()));
        }
    }
}
