package com.vidnyan.tracescan.adapter.out.rule.nullsafety;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.CodeBlock;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects dereferences of variables declared nullable without a preceding null guard.
 * Kotlin {@code val x: T?} and Java {@code @Nullable T x} declarations are tracked within the method that declares them.
 */
@Component
public class NullableDereferenceRule extends AbstractRule {

    public static final String NAME = "nullable-dereference";

    private static final int LOOKBACK = 15;

    private static final Pattern KOTLIN_NULLABLE = Pattern.compile(
            "\\b(?:val|var)\\s+(\\w+)\\s*:\\s*[\\w.]+(?:<[^>]*>)?\\?");
    private static final Pattern JAVA_NULLABLE = Pattern.compile(
            "@Nullable\\s+(?:final\\s+)?[\\w.$]+(?:<[^>]*>)?(?:\\[\\])?\\s+(\\w+)\\b");

    public NullableDereferenceRule() {
        super(NAME,
                "Null pointer dereference",
                "Guard the value with a null check (if (x != null), x?.let { }, ?: return) "
                        + "or use the safe-call operator before dereferencing it.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        Set<Integer> reported = new HashSet<>();
        for (Declaration declaration : collectDeclarations(file)) {
            String name = declaration.name();
            int declaredAt = declaration.index();
            Pattern dereference = Pattern.compile("(?<![\\w.?!])" + Pattern.quote(name) + "\\.(?!\\.)\\w");
            Pattern guard = guardPattern(name);
            Pattern anyCheck = Pattern.compile("\\b" + Pattern.quote(name) + "\\s*[!=]=\\s*null\\b|\\bnull\\s*[!=]=\\s*"
                    + Pattern.quote(name) + "\\b");

            int last = scopeEnd(file, declaredAt);
            for (int i = declaredAt + 1; i <= last; i++) {
                if (SourceText.isComment(file.line(i))) {
                    continue;
                }
                if (!dereference.matcher(SourceText.code(file.line(i))).find()) {
                    continue;
                }
                if (LineWindow.lookback(file.lines(), i, LOOKBACK, guard) || !reported.add(i)) {
                    continue;
                }
                int index = i;
                matches.guarded(() -> matches.report(index, severityFor(file, index, anyCheck),
                        String.format("'%s' is declared nullable (line %d) and dereferenced without a null check",
                                name, declaredAt + 1)));
            }
        }
    }

    private List<Declaration> collectDeclarations(SourceFile file) {
        Pattern declaration = file.isKotlin() ? KOTLIN_NULLABLE : JAVA_NULLABLE;
        List<Declaration> declarations = new ArrayList<>();
        for (int i = 0; i < file.lineCount(); i++) {
            if (SourceText.isComment(file.line(i))) {
                continue;
            }
            Matcher matcher = declaration.matcher(SourceText.code(file.line(i)));
            while (matcher.find()) {
                declarations.add(new Declaration(matcher.group(1), i));
            }
        }
        return declarations;
    }

    /**
     * Last line a declaration is visible on: the end of the method holding it,
     * or the end of the file for fields and top-level properties.
     * The line after the declaration is used so parameters on a method header resolve to that method.
     */
    private static int scopeEnd(SourceFile file, int declaredAt) {
        return BlockLocator.findEnclosingMethod(file.lines(), declaredAt + 1)
                .map(CodeBlock::end)
                .filter(end -> end > declaredAt)
                .orElse(file.lineCount() - 1);
    }

    private Severity severityFor(SourceFile file, int index, Pattern anyCheck) {
        Optional<CodeBlock> method = BlockLocator.findEnclosingMethod(file.lines(), index);
        boolean checkedSomewhere = method
                .map(m -> LineWindow.contains(file.lines(), m, anyCheck))
                .orElseGet(() -> LineWindow.contains(file.lines(), 0, file.lineCount() - 1, anyCheck));
        return checkedSomewhere ? Severity.MEDIUM : Severity.HIGH;
    }

    private record Declaration(String name, int index) {}

    private static Pattern guardPattern(String name) {
        String n = Pattern.quote(name);
        return Pattern.compile(
                "\\b" + n + "\\s*!=\\s*null\\b"
                + "|\\bnull\\s*!=\\s*" + n + "\\b"
                + "|\\b" + n + "\\s*\\?:"
                + "|\\b" + n + "\\?\\.(?:let|also|run|apply)\\b"
                + "|\\b(?:requireNotNull|checkNotNull|Objects\\.requireNonNull)\\s*\\(\\s*" + n + "\\b"
                + "|\\b" + n + "\\s*==\\s*null\\b.*\\b(?:return|throw|continue|break)\\b"
                + "|\\b" + n + "\\s+is\\s+[A-Z]");
    }
}
