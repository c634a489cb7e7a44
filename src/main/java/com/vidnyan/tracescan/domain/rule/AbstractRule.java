package com.vidnyan.tracescan.domain.rule;

import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;

import java.util.List;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for rules: fixed metadata, extension gating and
 * per-occurrence error containment.
 */
public abstract class AbstractRule implements Rule {

    protected static final Set<String> JAVA_AND_KOTLIN = Set.of(SourceFile.JAVA, SourceFile.KOTLIN);
    protected static final Set<String> JAVA_ONLY = Set.of(SourceFile.JAVA);
    protected static final Set<String> KOTLIN_ONLY = Set.of(SourceFile.KOTLIN);

    private final String name;
    private final String issueType;
    private final String suggestion;
    private final Set<String> extensions;

    protected AbstractRule(String name, String issueType, String suggestion, Set<String> extensions) {
        this.name = name;
        this.issueType = issueType;
        this.suggestion = suggestion;
        this.extensions = Set.copyOf(extensions);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String issueType() {
        return issueType;
    }

    @Override
    public String suggestion() {
        return suggestion;
    }

    @Override
    public Set<String> extensions() {
        return extensions;
    }

    @Override
    public final List<RuleMatch> analyze(SourceFile file) {
        if (!supports(file) || file.lineCount() == 0) {
            return List.of();
        }
        MatchCollector matches = new MatchCollector(name, file);
        scan(file.withLines(SourceText.maskBlockComments(file.lines())), matches);
        return matches.toList();
    }

    /**
     * Scan one file and report matches to the collector.
     * The file handed in has block comments blanked; reported code comes from the raw lines.
     */
    protected abstract void scan(SourceFile file, MatchCollector matches);

    /**
     * Run the handler for every match of the pattern on code lines.
     * Comment lines are skipped and literal contents are blanked before matching.
     */
    protected void forEachMatch(SourceFile file, MatchCollector matches, Pattern pattern, MatchHandler handler) {
        for (int i = 0; i < file.lineCount(); i++) {
            String raw = file.line(i);
            if (SourceText.isComment(raw)) {
                continue;
            }
            Matcher matcher = pattern.matcher(SourceText.code(raw));
            while (matcher.find()) {
                int index = i;
                MatchResult match = matcher.toMatchResult();
                matches.guarded(() -> handler.handle(index, match));
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }

    @FunctionalInterface
    protected interface MatchHandler {
        void handle(int index, MatchResult match);
    }
}
