package com.vidnyan.tracescan.domain.rule;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.source.SourceFile;
import com.vidnyan.tracescan.exception.RuleEvaluationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the matches of one rule over one file.
 * Lives only for the duration of a single analyze call.
 */
@Slf4j
public final class MatchCollector {

    private final String ruleName;
    private final SourceFile file;
    private final Set<RuleMatch> matches = new LinkedHashSet<>();

    MatchCollector(String ruleName, SourceFile file) {
        this.ruleName = ruleName;
        this.file = file;
    }

    /**
     * Report a match at a 0-based line index.
     */
    public void report(int index, Severity severity, String detail) {
        if (index < 0 || index >= file.lineCount()) {
            log.debug("{}: ignoring out-of-range index {} in {}", ruleName, index, file.path());
            return;
        }
        matches.add(new RuleMatch(index + 1, file.line(index).trim(), detail, severity));
    }

    /**
     * Evaluate one occurrence; an unresolved boundary skips just that occurrence.
     */
    public void guarded(Occurrence occurrence) {
        try {
            occurrence.evaluate();
        } catch (RuleEvaluationException e) {
            log.debug("{}: skipped occurrence in {}: {}", ruleName, file.path(), e.getMessage());
        }
    }

    public int size() {
        return matches.size();
    }

    List<RuleMatch> toList() {
        return new ArrayList<>(matches);
    }

    @FunctionalInterface
    public interface Occurrence {
        void evaluate();
    }
}
