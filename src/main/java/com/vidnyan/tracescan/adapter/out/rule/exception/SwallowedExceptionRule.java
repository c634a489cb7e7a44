package com.vidnyan.tracescan.adapter.out.rule.exception;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import com.vidnyan.tracescan.exception.RuleEvaluationException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Detects catch blocks whose body is empty or only comments.
 */
@Component
public class SwallowedExceptionRule extends AbstractRule {

    public static final String NAME = "swallowed-exception";

    private static final Pattern CATCH = Pattern.compile("\\bcatch\\s*\\(([^)]*)\\)\\s*\\{");
    private static final Pattern FATAL = Pattern.compile("\\b(?:Throwable|Error|OutOfMemoryError)\\b");
    private static final Set<String> INTENTIONAL = Set.of("ignored", "ignore", "expected", "_", "unused");

    public SwallowedExceptionRule() {
        super(NAME,
                "Swallowed exception",
                "Log the exception or rethrow it; an empty catch hides the root cause of later failures.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, CATCH, (index, match) -> {
            String declaration = match.group(1).trim();
            String variable = variableName(declaration);
            if (INTENTIONAL.contains(variable)) {
                return;
            }
            int braceColumn = match.end() - 1;
            int end = BlockLocator.findBlockEnd(file.lines(), index, braceColumn);
            if (end < 0) {
                throw new RuleEvaluationException("unterminated catch block", index + 1);
            }
            if (!isEmptyBody(file, index, braceColumn, end)) {
                return;
            }
            Severity severity = FATAL.matcher(declaration).find() ? Severity.MEDIUM : Severity.LOW;
            matches.report(index, severity, "Empty catch block for " + typeName(declaration));
        });
    }

    private boolean isEmptyBody(SourceFile file, int start, int braceColumn, int end) {
        if (start == end) {
            String code = SourceText.code(file.line(start));
            int close = code.indexOf('}', braceColumn);
            return close >= 0 && code.substring(braceColumn + 1, close).isBlank();
        }
        String first = SourceText.code(file.line(start)).substring(braceColumn + 1);
        if (!first.isBlank()) {
            return false;
        }
        for (int i = start + 1; i < end; i++) {
            if (!SourceText.isBlankOrComment(file.line(i)) && !SourceText.code(file.line(i)).isBlank()) {
                return false;
            }
        }
        String last = SourceText.code(file.line(end));
        return last.substring(0, last.indexOf('}')).isBlank();
    }

    /**
     * Variable name from {@code IOException e} (Java) or {@code e: IOException} (Kotlin).
     */
    static String variableName(String declaration) {
        int colon = declaration.indexOf(':');
        if (colon >= 0) {
            return declaration.substring(0, colon).trim();
        }
        String[] parts = declaration.split("\\s+");
        return parts[parts.length - 1];
    }

    static String typeName(String declaration) {
        int colon = declaration.indexOf(':');
        if (colon >= 0) {
            return declaration.substring(colon + 1).trim();
        }
        String[] parts = declaration.split("\\s+");
        return parts.length > 1 ? String.join(" ", Arrays.copyOf(parts, parts.length - 1))
                .replaceFirst("^final\\s+", "") : declaration;
    }
}
