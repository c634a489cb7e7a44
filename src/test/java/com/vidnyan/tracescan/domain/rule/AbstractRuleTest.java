package com.vidnyan.tracescan.domain.rule;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.source.SourceFile;
import com.vidnyan.tracescan.exception.RuleEvaluationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class AbstractRuleTest {

    private static final Pattern BANG = Pattern.compile("boom\\(");

    /**
     * Reports every call to boom(), fails on lines containing "unresolved".
     */
    static class BoomRule extends AbstractRule {

        BoomRule() {
            super("boom", "Boom", "Do not call boom", JAVA_ONLY);
        }

        @Override
        protected void scan(SourceFile file, MatchCollector matches) {
            forEachMatch(file, matches, BANG, (index, match) -> {
                if (file.line(index).contains("unresolved")) {
                    throw new RuleEvaluationException("no boundary", index + 1);
                }
                matches.report(index, Severity.HIGH, "column " + match.start());
                matches.report(index + 100, Severity.HIGH, "out of range");
            });
        }
    }

    private final BoomRule rule = new BoomRule();

    @Test
    void analyze_ShouldSkipCommentsLiteralsAndUnsupportedFiles() {
        SourceFile file = SourceFile.of("A.java",
                "boom();",
                "// boom();",
                "log(\"boom()\");",
                "x.boom(); // trailing boom()");

        List<RuleMatch> matches = rule.analyze(file);

        assertEquals(2, matches.size());
        assertEquals(1, matches.get(0).lineNumber());
        assertEquals(4, matches.get(1).lineNumber());
        assertEquals("x.boom(); // trailing boom()", matches.get(1).matchedCode());
        assertTrue(rule.analyze(SourceFile.of("A.kt", "boom()")).isEmpty());
    }

    @Test
    void analyze_ShouldSkipOnlyTheOccurrenceThatFails() {
        SourceFile file = SourceFile.of("A.java",
                "boom(); // unresolved",
                "  boom();  ");

        List<RuleMatch> matches = rule.analyze(file);

        assertEquals(1, matches.size());
        assertEquals(2, matches.get(0).lineNumber());
        assertEquals("boom();", matches.get(0).matchedCode());
    }

    @Test
    void analyze_ShouldReportEachOccurrenceOnALine() {
        SourceFile file = SourceFile.of("A.java", "boom(); boom();");

        List<RuleMatch> matches = rule.analyze(file);

        assertEquals(2, matches.size());
        assertNotEquals(matches.get(0).detail(), matches.get(1).detail());
    }

    @Test
    void analyze_ShouldReturnNothingForEmptyFile() {
        assertTrue(rule.analyze(SourceFile.of("A.java")).isEmpty());
    }

    @Test
    void metadata_ShouldBeFixed() {
        assertEquals("boom", rule.name());
        assertEquals("Boom", rule.issueType());
        assertEquals("Do not call boom", rule.suggestion());
        assertTrue(rule.supports(SourceFile.of("B.java")));
        assertEquals("BoomRule[boom]", rule.toString());
    }
}
