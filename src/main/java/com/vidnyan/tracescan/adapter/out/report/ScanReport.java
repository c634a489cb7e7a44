package com.vidnyan.tracescan.adapter.out.report;

import com.vidnyan.tracescan.domain.finding.FileFailure;
import com.vidnyan.tracescan.domain.finding.Finding;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.domain.finding.Severity;

import java.util.List;

/**
 * Serializable view of a scan result, shared by the JSON report and the REST API.
 */
public record ScanReport(
    String root,
    Summary summary,
    List<Finding> findings,
    List<FileFailure> failures
) {

    public static ScanReport of(ScanResult result) {
        Summary summary = new Summary(
                result.stats().filesScanned(),
                result.stats().filesFailed(),
                result.stats().rulesApplied(),
                result.findings().size(),
                result.count(Severity.HIGH),
                result.count(Severity.MEDIUM),
                result.count(Severity.LOW));
        return new ScanReport(result.root(), summary, result.findings(), result.failures());
    }

    public record Summary(
        int filesScanned,
        int filesFailed,
        int rulesApplied,
        int total,
        int high,
        int medium,
        int low
    ) {}
}
