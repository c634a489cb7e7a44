package com.vidnyan.tracescan.adapter.out.rule.nullsafety;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects intent extras and fragment arguments dereferenced without a null check.
 */
@Component
public class IntentExtraRule extends AbstractRule {

    public static final String NAME = "intent-extra-dereference";

    private static final int LOOKAHEAD = 5;

    private static final Pattern CHAINED_BUNDLE = Pattern.compile(
            "(?:\\bgetExtras\\s*\\(\\s*\\)|\\bgetArguments\\s*\\(\\s*\\)|\\bextras\\s*!!|\\barguments\\s*!!)\\s*\\.\\s*\\w+");
    private static final Pattern CHAINED_EXTRA = Pattern.compile(
            "\\bget(?:String|Serializable|Parcelable|StringArrayList|CharSequence|Bundle|IntegerArrayList"
            + "|ParcelableArrayList)Extra\\s*\\([^)]*\\)\\s*(?:!!)?\\s*\\.\\s*\\w+");
    private static final Pattern ASSIGNED_EXTRA = Pattern.compile(
            "\\b(\\w+)\\s*(?::\\s*[\\w.?<>]+\\s*)?=\\s*[^;=]*\\bget(?:String|Serializable|Parcelable|StringArrayList"
            + "|CharSequence|Bundle)Extra\\s*\\(");

    public IntentExtraRule() {
        super(NAME,
                "Missing intent extra guard",
                "Intent extras and arguments are absent when the component is started from another "
                        + "entry point or restored by the system; check for null or provide a default.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, CHAINED_BUNDLE, (index, match) ->
                matches.report(index, Severity.HIGH, "Bundle from getExtras()/getArguments() dereferenced directly"));

        forEachMatch(file, matches, CHAINED_EXTRA, (index, match) ->
                matches.report(index, Severity.HIGH, "Intent extra dereferenced in the same expression"));

        forEachMatch(file, matches, ASSIGNED_EXTRA, (index, match) -> {
            String variable = match.group(1);
            Pattern dereference = Pattern.compile("(?<![\\w.?])" + Pattern.quote(variable) + "\\.(?!\\.)\\w");
            Pattern guard = Pattern.compile("\\b" + Pattern.quote(variable) + "\\s*[!=]=\\s*null|null\\s*[!=]=\\s*"
                    + Pattern.quote(variable) + "\\b|\\b" + Pattern.quote(variable) + "\\s*\\?:"
                    + "|isEmpty\\s*\\(\\s*" + Pattern.quote(variable) + "\\s*\\)"
                    + "|" + Pattern.quote(variable) + "\\.isNullOrEmpty");
            for (int i = index + 1; i <= Math.min(file.lineCount() - 1, index + LOOKAHEAD); i++) {
                Matcher use = dereference.matcher(SourceText.code(file.line(i)));
                if (!use.find()) {
                    continue;
                }
                if (!LineWindow.contains(file.lines(), index, i, guard)) {
                    matches.report(i, Severity.MEDIUM, String.format(
                            "Extra '%s' read at line %d is dereferenced without a null check", variable, index + 1));
                }
                break;
            }
        });
    }
}
