package com.vidnyan.tracescan.domain.finding;

import java.util.Comparator;

/**
 * A detected issue at one location of one file.
 * Immutable value object.
 */
public record Finding(
    String filePath,
    int lineNumber,
    String issueType,
    String matchedCode,
    String detail,
    Severity severity,
    String suggestion,
    String ruleName,
    String context
) {

    /**
     * Report order: file, then line, then rule.
     */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::filePath)
            .thenComparingInt(Finding::lineNumber)
            .thenComparing(Finding::ruleName)
            .thenComparing(f -> f.detail() == null ? "" : f.detail());

    public boolean hasDetail() {
        return detail != null && !detail.isBlank();
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String filePath;
        private int lineNumber;
        private String issueType;
        private String matchedCode = "";
        private String detail;
        private Severity severity = Severity.MEDIUM;
        private String suggestion;
        private String ruleName;
        private String context = "";

        public Builder filePath(String path) { this.filePath = path; return this; }
        public Builder lineNumber(int line) { this.lineNumber = line; return this; }
        public Builder issueType(String type) { this.issueType = type; return this; }
        public Builder matchedCode(String code) { this.matchedCode = code; return this; }
        public Builder detail(String detail) { this.detail = detail; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder suggestion(String suggestion) { this.suggestion = suggestion; return this; }
        public Builder ruleName(String name) { this.ruleName = name; return this; }
        public Builder context(String context) { this.context = context; return this; }

        public Finding build() {
            return new Finding(filePath, lineNumber, issueType, matchedCode, detail,
                    severity, suggestion, ruleName, context);
        }
    }
}
