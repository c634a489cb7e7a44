package com.vidnyan.tracescan.adapter.out.report;

import com.vidnyan.tracescan.domain.finding.FileFailure;
import com.vidnyan.tracescan.domain.finding.Finding;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.domain.finding.Severity;

import java.util.List;

final class ReportFixtures {

    private ReportFixtures() {
    }

    static ScanResult sampleResult() {
        Finding high = Finding.builder()
                .filePath("app/Main.kt")
                .lineNumber(2)
                .issueType("Null pointer dereference")
                .matchedCode("x.length()")
                .detail("'x' is declared nullable (line 1) and dereferenced without a null check")
                .severity(Severity.HIGH)
                .suggestion("Guard the value")
                .ruleName("nullable-dereference")
                .context("   1 | val x: String? = null\n>> 2 | x.length()")
                .build();
        Finding low = Finding.builder()
                .filePath("app/Sync.java")
                .lineNumber(7)
                .issueType("Swallowed exception")
                .matchedCode("} catch (IOException e) {}")
                .severity(Severity.LOW)
                .suggestion("Log the exception")
                .ruleName("swallowed-exception")
                .build();
        return new ScanResult("/repo", List.of(high, low),
                List.of(new FileFailure("app/Broken.kt", "Cannot read app/Broken.kt: AccessDeniedException")),
                new ScanResult.ScanStats(3, 1, 2, 2));
    }
}
