package com.vidnyan.tracescan.adapter.out.report;

import com.vidnyan.tracescan.application.port.out.ReportRenderer;
import com.vidnyan.tracescan.domain.finding.FileFailure;
import com.vidnyan.tracescan.domain.finding.Finding;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.domain.finding.Severity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Human-readable report grouped by file.
 */
@Component
public class TextReportRenderer implements ReportRenderer {

    public static final String FORMAT = "text";
    public static final String NO_ISSUES = "No issues found.";

    private static final String RULE = "═══════════════════════════════════════════════════════════════";
    private static final String SEPARATOR = "───────────────────────────────────────────────────────────────";

    @Override
    public String format() {
        return FORMAT;
    }

    @Override
    public String render(ScanResult result) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append(" TRACESCAN REPORT: ").append(result.root()).append('\n');
        out.append(RULE).append('\n');

        if (result.isEmpty()) {
            out.append(NO_ISSUES).append('\n');
        } else {
            for (Map.Entry<String, List<Finding>> entry : result.findingsByFile().entrySet()) {
                out.append('\n').append("File: ").append(entry.getKey()).append('\n');
                out.append(SEPARATOR).append('\n');
                entry.getValue().forEach(finding -> appendFinding(out, finding));
            }
        }

        appendSummary(out, result);
        appendFailures(out, result.failures());
        return out.toString();
    }

    private void appendFinding(StringBuilder out, Finding finding) {
        out.append(marker(finding.severity())).append(" line ").append(finding.lineNumber())
                .append(": ").append(finding.issueType())
                .append(" [").append(finding.ruleName()).append("]\n");
        out.append("  Code:       ").append(finding.matchedCode()).append('\n');
        if (finding.hasDetail()) {
            out.append("  Detail:     ").append(finding.detail()).append('\n');
        }
        out.append("  Suggestion: ").append(finding.suggestion()).append('\n');
        if (finding.context() != null && !finding.context().isEmpty()) {
            out.append("  Context:\n");
            finding.context().lines().forEach(line -> out.append("    ").append(line).append('\n'));
        }
        out.append('\n');
    }

    private void appendSummary(StringBuilder out, ScanResult result) {
        out.append(RULE).append('\n');
        out.append(" Files scanned: ").append(result.stats().filesScanned())
                .append("   Rules applied: ").append(result.stats().rulesApplied()).append('\n');
        out.append(" Findings: ").append(result.findings().size())
                .append("  (").append(marker(Severity.HIGH)).append(' ').append(result.count(Severity.HIGH))
                .append("  ").append(marker(Severity.MEDIUM)).append(' ').append(result.count(Severity.MEDIUM))
                .append("  ").append(marker(Severity.LOW)).append(' ').append(result.count(Severity.LOW))
                .append(")\n");
        out.append(RULE).append('\n');
    }

    private void appendFailures(StringBuilder out, List<FileFailure> failures) {
        if (failures.isEmpty()) {
            return;
        }
        out.append("Files not analyzed (").append(failures.size()).append("):\n");
        failures.forEach(f -> out.append("  - ").append(f.filePath()).append(": ").append(f.reason()).append('\n'));
    }

    static String marker(Severity severity) {
        return switch (severity) {
            case HIGH -> "🔴 HIGH";
            case MEDIUM -> "🟠 MEDIUM";
            case LOW -> "🟡 LOW";
        };
    }
}
