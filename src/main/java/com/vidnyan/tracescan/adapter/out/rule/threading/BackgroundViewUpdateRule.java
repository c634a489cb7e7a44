package com.vidnyan.tracescan.adapter.out.rule.threading;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.ScopeTracker;
import com.vidnyan.tracescan.domain.scan.ScopeTracker.Kind;
import com.vidnyan.tracescan.domain.scan.ScopeTracker.Scope;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects view mutations from background threads
 * ({@code CalledFromWrongThreadException}).
 */
@Component
public class BackgroundViewUpdateRule extends AbstractRule {

    public static final String NAME = "background-view-update";

    private static final Pattern VIEW_MUTATION = Pattern.compile(
            "\\.\\s*(setText|setVisibility|setImageBitmap|setImageResource|setImageDrawable|setAdapter|setEnabled"
            + "|setBackgroundColor|notifyDataSetChanged|notifyItem\\w*|addView|removeView|removeAllViews)\\s*\\("
            + "|\\.\\s*(text|visibility|isVisible|isEnabled|adapter)\\s*=(?!=)");
    private static final Pattern MAIN_DISPATCH = Pattern.compile(
            "runOnUiThread|\\bpost(?:Delayed)?\\b|Dispatchers\\.Main|getMainLooper|mainLooper|onPostExecute"
            + "|\\bobserve\\b|MainScope|lifecycleScope\\.launch\\s*(?:\\{|\\(\\s*\\))|withContext\\s*\\(\\s*Main");
    private static final Pattern BACKGROUND = Pattern.compile(
            "\\bThread\\b|\\bthread\\b|Executor|\\bexecute\\b|\\bsubmit\\b|Dispatchers\\.(?:IO|Default)"
            + "|TimerTask|\\bschedule\\w*\\b|doInBackground|subscribeOn|GlobalScope");

    public BackgroundViewUpdateRule() {
        super(NAME,
                "View update from background thread",
                "Switch back to the main thread before touching views: runOnUiThread, View.post, "
                        + "or withContext(Dispatchers.Main).",
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
            String code = SourceText.code(raw);
            Matcher mutation = VIEW_MUTATION.matcher(code);
            if (!mutation.find() || insideMainThreadCall(code.substring(0, mutation.start()))) {
                continue;
            }
            int index = i;
            backgroundScope(scopes).ifPresent(scope -> matches.report(index, Severity.HIGH, String.format(
                    "View mutation '%s' inside background scope opened at line %d",
                    mutation.group(1) != null ? mutation.group(1) : mutation.group(2), scope.openIndex() + 1)));
        }
    }

    /**
     * Whether the code before the mutation leaves a main-thread hop open,
     * as in {@code runOnUiThread(() -> view.setText(s))}.
     */
    private static boolean insideMainThreadCall(String prefix) {
        Matcher hop = MAIN_DISPATCH.matcher(prefix);
        int start = -1;
        while (hop.find()) {
            start = hop.start();
        }
        if (start < 0) {
            return false;
        }
        String call = prefix.substring(start);
        return SourceText.count(call, '(') > SourceText.count(call, ')')
                || SourceText.count(call, '{') > SourceText.count(call, '}');
    }

    /**
     * Innermost background scope not undone by a main-thread hop, searched outward
     * to the first ordinary method.
     */
    private Optional<Scope> backgroundScope(ScopeTracker scopes) {
        for (Scope scope : scopes.scopes()) {
            String header = scope.header();
            if (MAIN_DISPATCH.matcher(header).find()
                    || (scope.kind() == Kind.METHOD && "onPostExecute".equals(scope.name()))) {
                return Optional.empty();
            }
            if (scope.kind() == Kind.METHOD && "doInBackground".equals(scope.name())) {
                return Optional.of(scope);
            }
            if ((scope.kind() == Kind.CALLBACK || scope.kind() == Kind.LAMBDA) && BACKGROUND.matcher(header).find()) {
                return Optional.of(scope);
            }
            if (scope.kind() == Kind.METHOD && !"run".equals(scope.name()) && !"call".equals(scope.name())) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
