package com.vidnyan.tracescan.adapter.out.rule.nullsafety;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects {@code ref.get()} on weak or soft references dereferenced without a null check.
 */
@Component
public class WeakReferenceGetRule extends AbstractRule {

    public static final String NAME = "weak-reference-get";

    private static final Pattern JAVA_DECLARATION = Pattern.compile("\\b(?:Weak|Soft)Reference<[^>]*>\\s+(\\w+)");
    private static final Pattern KOTLIN_DECLARATION = Pattern.compile(
            "\\b(?:val|var)\\s+(\\w+)\\s*(?::\\s*(?:Weak|Soft)Reference\\b|=\\s*(?:Weak|Soft)Reference\\b)");

    public WeakReferenceGetRule() {
        super(NAME,
                "Cleared reference dereference",
                "A weak or soft reference may be cleared at any time; read get() into a local, "
                        + "check it for null and only then use it.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        for (String name : references(file)) {
            String n = Pattern.quote(name);
            Pattern unsafeGet = Pattern.compile("\\b" + n + "\\s*\\.\\s*get\\s*\\(\\s*\\)\\s*(?:!!\\s*)?\\.(?!\\.)");
            Pattern guard = Pattern.compile("\\b" + n + "\\s*\\.\\s*get\\s*\\(\\s*\\)\\s*!=\\s*null");
            forEachMatch(file, matches, unsafeGet, (index, match) -> {
                if (LineWindow.lookback(file.lines(), index, 3, guard)) {
                    return;
                }
                matches.report(index, Severity.HIGH, "'" + name + ".get()' dereferenced without a null check");
            });
        }
    }

    private Set<String> references(SourceFile file) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : file.lines()) {
            String code = SourceText.code(line);
            Matcher java = JAVA_DECLARATION.matcher(code);
            while (java.find()) {
                names.add(java.group(1));
            }
            Matcher kotlin = KOTLIN_DECLARATION.matcher(code);
            while (kotlin.find()) {
                names.add(kotlin.group(1));
            }
        }
        return names;
    }
}
