package com.vidnyan.tracescan.domain.rule;

import com.vidnyan.tracescan.domain.finding.Severity;

/**
 * One occurrence reported by a rule, before the engine turns it into a Finding.
 */
public record RuleMatch(
    int lineNumber,
    String matchedCode,
    String detail,
    Severity severity
) {
}
