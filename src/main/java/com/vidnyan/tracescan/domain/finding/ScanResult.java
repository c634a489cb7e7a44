package com.vidnyan.tracescan.domain.finding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * All findings of one engine invocation, plus the files that could not be analyzed.
 * Contains no timing information so that equal inputs give equal results.
 */
public record ScanResult(
    String root,
    List<Finding> findings,
    List<FileFailure> failures,
    ScanStats stats
) {

    public ScanResult {
        findings = List.copyOf(findings);
        failures = List.copyOf(failures);
    }

    public static ScanResult empty(String root, int rulesApplied) {
        return new ScanResult(root, List.of(), List.of(), new ScanStats(0, 0, rulesApplied, 0));
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int count(Severity severity) {
        return (int) findings.stream()
                .filter(f -> f.severity() == severity)
                .count();
    }

    /**
     * Findings grouped by file path, files and lines in report order.
     */
    public Map<String, List<Finding>> findingsByFile() {
        return findings.stream()
                .sorted(Finding.REPORT_ORDER)
                .collect(Collectors.groupingBy(Finding::filePath, LinkedHashMap::new, Collectors.toList()));
    }

    /**
     * Scan statistics.
     */
    public record ScanStats(
        int filesScanned,
        int filesFailed,
        int rulesApplied,
        int findingCount
    ) {}
}
