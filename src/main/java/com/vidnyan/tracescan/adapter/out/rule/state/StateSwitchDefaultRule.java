package com.vidnyan.tracescan.adapter.out.rule.state;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator;
import com.vidnyan.tracescan.domain.scan.StatementAccumulator.Statement;
import com.vidnyan.tracescan.domain.source.SourceFile;
import com.vidnyan.tracescan.exception.RuleEvaluationException;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Flags switch/when statements over state-like values that either crash on an
 * unexpected state or silently ignore it.
 */
@Component
public class StateSwitchDefaultRule extends AbstractRule {

    public static final String NAME = "state-switch-default";

    private static final Pattern SWITCH = Pattern.compile("\\b(?:switch|when)\\s*\\(");
    private static final int MAX_SUBJECT_LINES = 5;
    private static final Pattern STATE_SUBJECT = Pattern.compile("(?i)state|status|mode|phase|step|stage");
    private static final Pattern JAVA_DEFAULT = Pattern.compile("^\\s*default\\s*(?::|->)");
    private static final Pattern KOTLIN_ELSE = Pattern.compile("^\\s*else\\s*->");
    private static final Pattern THROWS = Pattern.compile(
            "\\bthrow\\b|\\berror\\s*\\(|\\bTODO\\s*\\(|IllegalStateException|IllegalArgumentException");

    public StateSwitchDefaultRule() {
        super(NAME,
                "Unhandled state",
                "Handle every state explicitly and make the default branch recover (log and fall back) "
                        + "instead of throwing.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        Pattern fallback = file.isKotlin() ? KOTLIN_ELSE : JAVA_DEFAULT;
        forEachMatch(file, matches, SWITCH, (index, match) -> {
            Statement head = StatementAccumulator.accumulate(file.lines(), index, match.end() - 1, MAX_SUBJECT_LINES)
                    .orElseThrow(() -> new RuleEvaluationException("switch subject not closed", index + 1));
            String subject = head.text().substring(1, head.text().length() - 1).trim();
            if (!STATE_SUBJECT.matcher(subject).find()) {
                return;
            }
            Optional<Brace> brace = bodyBrace(file, head);
            if (brace.isEmpty()) {
                return;
            }
            int open = brace.get().index();
            int end = BlockLocator.findBlockEnd(file.lines(), open, brace.get().column());
            if (end < 0) {
                throw new RuleEvaluationException("switch body not closed", index + 1);
            }
            OptionalInt defaultBranch = LineWindow.firstMatch(file.lines(), open + 1, end, fallback);
            if (defaultBranch.isEmpty()) {
                matches.report(index, Severity.LOW, "No default branch for '" + subject + "'");
                return;
            }
            int branch = defaultBranch.getAsInt();
            int branchEnd = Math.min(end, branch + 3);
            for (int i = branch; i <= branchEnd; i++) {
                if (!SourceText.isComment(file.line(i)) && THROWS.matcher(SourceText.code(file.line(i))).find()) {
                    matches.report(branch, Severity.MEDIUM, "Default branch for '" + subject + "' throws");
                    return;
                }
            }
        });
    }

    /**
     * Brace opening the body right after the subject, on the same or the next line.
     * Empty when the subject is not followed by a body, as in {@code when(mock.getState())}.
     */
    private static Optional<Brace> bodyBrace(SourceFile file, Statement head) {
        int line = head.endIndex();
        String code = SourceText.code(file.line(line));
        int from = head.endColumn() + 1;
        if (code.substring(from).isBlank() && line + 1 < file.lineCount()) {
            line++;
            code = SourceText.code(file.line(line));
            from = 0;
        }
        String rest = code.substring(from).trim();
        return rest.startsWith("{") ? Optional.of(new Brace(line, code.indexOf('{', from))) : Optional.empty();
    }

    private record Brace(int index, int column) {}
}
