package com.vidnyan.tracescan.adapter.out.rule.lifecycle;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.CodeBlock;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import com.vidnyan.tracescan.exception.RuleEvaluationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects {@code lateinit} properties read in teardown callbacks, which run even
 * when setup bailed out before initializing them.
 */
@Component
public class LateinitTeardownRule extends AbstractRule {

    public static final String NAME = "lateinit-teardown-access";

    private static final Pattern LATEINIT = Pattern.compile("\\blateinit\\s+var\\s+(\\w+)");
    private static final Pattern TEARDOWN = Pattern.compile(
            "\\bfun\\s+(onDestroy|onDestroyView|onStop|onPause|onSaveInstanceState|onDetach)\\s*\\(");

    public LateinitTeardownRule() {
        super(NAME,
                "Uninitialized lateinit in teardown",
                "Guard teardown access with ::property.isInitialized or make the property nullable.",
                KOTLIN_ONLY);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        List<String> properties = new ArrayList<>();
        for (String line : file.lines()) {
            Matcher matcher = LATEINIT.matcher(SourceText.code(line));
            while (matcher.find()) {
                properties.add(matcher.group(1));
            }
        }
        if (properties.isEmpty()) {
            return;
        }
        forEachMatch(file, matches, TEARDOWN, (index, match) -> {
            int brace = SourceText.code(file.line(index)).indexOf('{', match.end());
            CodeBlock method = findMethodBlock(file, index, brace, match.group(1));
            for (String property : properties) {
                reportFirstAccess(file, matches, method, property);
            }
        });
    }

    private CodeBlock findMethodBlock(SourceFile file, int index, int brace, String name) {
        String code = SourceText.code(file.line(index));
        if (brace < 0 && code.indexOf('=', code.indexOf(')')) >= 0) {
            return new CodeBlock(index - 1, 0, index, code.trim(), name);
        }
        int end = BlockLocator.findBlockEnd(file.lines(), index, Math.max(brace, 0));
        if (end < 0) {
            throw new RuleEvaluationException("teardown method not closed", index + 1);
        }
        return new CodeBlock(index, Math.max(brace, 0), end, code.trim(), name);
    }

    private void reportFirstAccess(SourceFile file, MatchCollector matches, CodeBlock method, String property) {
        String p = Pattern.quote(property);
        Pattern initializedCheck = Pattern.compile("::" + p + "\\s*\\.\\s*isInitialized");
        if (LineWindow.contains(file.lines(), method, initializedCheck)) {
            return;
        }
        Pattern read = Pattern.compile("(?<![\\w.:])(?:this\\.)?" + p + "\\b(?!\\s*=[^=])");
        for (int i = method.start() + 1; i <= method.end(); i++) {
            if (SourceText.isComment(file.line(i))) {
                continue;
            }
            if (read.matcher(SourceText.code(file.line(i))).find()) {
                matches.report(i, Severity.HIGH, String.format(
                        "lateinit '%s' read in %s() without ::%s.isInitialized",
                        property, method.name(), property));
                return;
            }
        }
    }
}
