package com.vidnyan.tracescan.exception;

/**
 * A rule could not resolve a block boundary or window for one occurrence.
 * Never leaves the rule: the occurrence is skipped.
 */
public class RuleEvaluationException extends TraceScanException {

    private final int lineNumber;

    public RuleEvaluationException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
