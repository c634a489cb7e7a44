package com.vidnyan.tracescan.application.service;

import com.vidnyan.tracescan.application.port.out.SourceFileRepository;
import com.vidnyan.tracescan.application.port.out.SourceFileRepository.SourceListing;
import com.vidnyan.tracescan.domain.finding.FileFailure;
import com.vidnyan.tracescan.domain.finding.Finding;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.domain.finding.ScanResult.ScanStats;
import com.vidnyan.tracescan.domain.rule.Rule;
import com.vidnyan.tracescan.domain.rule.RuleMatch;
import com.vidnyan.tracescan.domain.source.SourceFile;
import com.vidnyan.tracescan.exception.ConfigurationException;
import com.vidnyan.tracescan.exception.DirectoryNotFoundException;
import com.vidnyan.tracescan.exception.FileAccessException;
import com.vidnyan.tracescan.exception.TraceScanException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Walks a source tree and runs every active rule over every candidate file.
 *
 * <p>Each file is read once. Read failures and rule crashes are recorded as
 * {@link FileFailure}s and the scan continues; only setup errors are thrown.
 */
@Slf4j
public class ScannerEngine {

    private final List<Rule> rules;
    private final SourceFileRepository sourceFiles;
    private final ContextExtractor contextExtractor;
    private final ScanOptions options;

    public ScannerEngine(List<Rule> rules, SourceFileRepository sourceFiles,
                         ContextExtractor contextExtractor, ScanOptions options) {
        if (rules == null || rules.isEmpty()) {
            throw new ConfigurationException("At least one rule must be active");
        }
        this.rules = List.copyOf(rules);
        this.sourceFiles = sourceFiles;
        this.contextExtractor = contextExtractor;
        this.options = options;
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * Scan every candidate file under the root.
     *
     * @throws DirectoryNotFoundException if the root is missing or not a directory
     */
    public ScanResult scan(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new DirectoryNotFoundException(root);
        }
        SourceListing listing = sourceFiles.listSourceFiles(root, options.extensions(), options.excludePatterns());
        List<Path> candidates = listing.files();
        log.info("Scanning {} files under {} with {} rules", candidates.size(), root, rules.size());

        Queue<Finding> findings = new ConcurrentLinkedQueue<>();
        Queue<FileFailure> failures = new ConcurrentLinkedQueue<>(listing.failures());
        if (options.parallelism() > 1 && candidates.size() > 1) {
            scanInParallel(candidates, findings, failures);
        } else {
            candidates.forEach(file -> scanFile(file, findings, failures));
        }

        List<Finding> sortedFindings = findings.stream().sorted(Finding.REPORT_ORDER).toList();
        List<FileFailure> sortedFailures = failures.stream()
                .sorted(Comparator.comparing(FileFailure::filePath).thenComparing(FileFailure::reason))
                .toList();
        int filesFailed = (int) sortedFailures.stream().map(FileFailure::filePath).distinct().count();
        ScanStats stats = new ScanStats(candidates.size(), filesFailed, rules.size(), sortedFindings.size());

        log.info("Scan complete: {} findings, {} failures", sortedFindings.size(), sortedFailures.size());
        return new ScanResult(root.toString(), sortedFindings, sortedFailures, stats);
    }

    private void scanInParallel(List<Path> candidates, Queue<Finding> findings, Queue<FileFailure> failures) {
        ExecutorService executor = Executors.newFixedThreadPool(options.parallelism());
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (Path file : candidates) {
                tasks.add(executor.submit(() -> scanFile(file, findings, failures)));
            }
            for (Future<?> task : tasks) {
                task.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TraceScanException("Scan interrupted", e);
        } catch (ExecutionException e) {
            throw new TraceScanException("Scan worker failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private void scanFile(Path path, Queue<Finding> findings, Queue<FileFailure> failures) {
        List<String> lines;
        try {
            lines = sourceFiles.readLines(path);
        } catch (FileAccessException e) {
            log.warn("Skipping {}: {}", path, e.getMessage());
            failures.add(new FileFailure(path.toString(), e.getMessage()));
            return;
        }
        SourceFile file = SourceFile.of(path, lines);

        for (Rule rule : rules) {
            if (!rule.supports(file)) {
                continue;
            }
            List<RuleMatch> matches;
            try {
                matches = rule.analyze(file);
            } catch (RuntimeException e) {
                log.warn("Rule {} failed on {}: {}", rule.name(), path, e.toString());
                failures.add(new FileFailure(path.toString(), rule.name() + " failed: " + e));
                continue;
            }
            for (RuleMatch match : matches) {
                toFinding(file, rule, match, lines).ifPresent(findings::add);
            }
        }
    }

    private Optional<Finding> toFinding(SourceFile file, Rule rule, RuleMatch match, List<String> lines) {
        if (match.lineNumber() < 1 || match.lineNumber() > file.lineCount()) {
            log.debug("Dropping out-of-range match {} from {}", match.lineNumber(), rule.name());
            return Optional.empty();
        }
        return Optional.of(Finding.builder()
                .filePath(file.path())
                .lineNumber(match.lineNumber())
                .issueType(rule.issueType())
                .matchedCode(match.matchedCode())
                .detail(match.detail())
                .severity(match.severity())
                .suggestion(rule.suggestion())
                .ruleName(rule.name())
                .context(ContextExtractor.render(lines, match.lineNumber(), contextExtractor.radius()))
                .build());
    }
}
