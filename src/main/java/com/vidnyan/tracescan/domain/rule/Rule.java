package com.vidnyan.tracescan.domain.rule;

import com.vidnyan.tracescan.domain.source.SourceFile;

import java.util.List;
import java.util.Set;

/**
 * A heuristic detector for one class of crash-prone pattern.
 * Implementations keep no state between files.
 */
public interface Rule {

    /**
     * Unique rule identifier, used for selection and suppression.
     */
    String name();

    /**
     * Short label of the defect category. Same for every match.
     */
    String issueType();

    /**
     * Remediation text. Same for every match.
     */
    String suggestion();

    /**
     * File extensions (lower case, with dot) this rule inspects.
     */
    Set<String> extensions();

    /**
     * Check if this rule should look at the given file at all.
     */
    default boolean supports(SourceFile file) {
        return extensions().contains(file.extension());
    }

    /**
     * Analyze the file and return every match, in no particular order.
     * Unexpected content yields no matches rather than an exception.
     */
    List<RuleMatch> analyze(SourceFile file);
}
