package com.vidnyan.tracescan.application.port.in;

import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.domain.rule.Rule;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Primary use case: scan a source tree for crash-prone patterns.
 * This is the main entry point to the application.
 */
public interface ScanSourceUseCase {

    /**
     * Scan a directory tree and return all findings.
     * @param request Scan request parameters
     * @return Findings, unreadable files and statistics
     */
    ScanResult scan(ScanRequest request);

    /**
     * Describe the registered rules, sorted by name.
     */
    List<RuleDescriptor> listRules();

    /**
     * Scan request parameters.
     */
    record ScanRequest(
        Path root,
        List<String> ruleNames    // Empty = configured rule set
    ) {
        public ScanRequest {
            ruleNames = ruleNames == null ? List.of() : List.copyOf(ruleNames);
        }

        public static ScanRequest forPath(Path path) {
            return new ScanRequest(path, List.of());
        }
    }

    /**
     * Public description of one rule.
     */
    record RuleDescriptor(
        String name,
        String issueType,
        String suggestion,
        Set<String> extensions
    ) {
        public static RuleDescriptor of(Rule rule) {
            return new RuleDescriptor(rule.name(), rule.issueType(), rule.suggestion(),
                    new TreeSet<>(rule.extensions()));
        }
    }
}
