package com.vidnyan.tracescan.adapter.in.cli;

import com.vidnyan.tracescan.adapter.out.report.ReportRendererRegistry;
import com.vidnyan.tracescan.application.port.in.ScanSourceUseCase;
import com.vidnyan.tracescan.application.port.in.ScanSourceUseCase.ScanRequest;
import com.vidnyan.tracescan.application.port.out.ReportRenderer;
import com.vidnyan.tracescan.config.ScanProperties;
import com.vidnyan.tracescan.domain.finding.FileFailure;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.exception.ConfigurationException;
import com.vidnyan.tracescan.exception.DirectoryNotFoundException;
import com.vidnyan.tracescan.exception.FileAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * CLI runner for standalone scans.
 * Runs a scan when tracescan.scan.path is set or a directory is passed as the first argument.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanCliRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO_ERROR = 1;
    public static final int EXIT_CONFIGURATION_ERROR = 2;

    private final ScanSourceUseCase scanSourceUseCase;
    private final ReportRendererRegistry rendererRegistry;
    private final ScanProperties properties;

    private volatile int exitCode = EXIT_OK;
    private volatile boolean scanned;

    @Override
    public void run(String... args) {
        Optional<String> sourcePath = sourcePath(args);
        if (sourcePath.isEmpty()) {
            log.info("No scan path specified. Set tracescan.scan.path or pass a directory argument.");
            return;
        }
        scanned = true;

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║          TraceScan - Crash Pattern Source Scanner             ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Scanning: {}", truncatePath(sourcePath.get(), 50));
        log.info("╚══════════════════════════════════════════════════════════════╝");

        try {
            ReportRenderer renderer = rendererRegistry.forFormat(properties.getReport().getFormat());
            ScanResult result = scanSourceUseCase.scan(ScanRequest.forPath(Path.of(sourcePath.get())));
            printSummary(result);
            writeReport(renderer.render(result));
            log.info("");
            log.info("Scan complete!");
        } catch (ConfigurationException | DirectoryNotFoundException e) {
            log.error("❌ {}", e.getMessage());
            exitCode = EXIT_CONFIGURATION_ERROR;
        } catch (FileAccessException e) {
            log.error("❌ {}", e.getMessage());
            exitCode = EXIT_IO_ERROR;
        }
    }

    /**
     * Whether this run performed a scan, so the application should exit afterwards.
     */
    public boolean hasScanned() {
        return scanned;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private Optional<String> sourcePath(String... args) {
        String configured = properties.getScan().getPath();
        if (configured != null && !configured.isBlank()) {
            return Optional.of(configured);
        }
        return Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .findFirst();
    }

    private void printSummary(ScanResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" SCAN RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files scanned: {}", result.stats().filesScanned());
        log.info(" Files failed:  {}", result.stats().filesFailed());
        log.info(" Rules applied: {}", result.stats().rulesApplied());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" FINDINGS:");
        log.info("   🔴 High:   {}", result.count(Severity.HIGH));
        log.info("   🟠 Medium: {}", result.count(Severity.MEDIUM));
        log.info("   🟡 Low:    {}", result.count(Severity.LOW));
        log.info("═══════════════════════════════════════════════════════════════");

        if (result.isEmpty()) {
            log.info("");
            log.info("✅ No crash patterns found.");
        }
        for (FileFailure failure : result.failures()) {
            log.warn(" ⚠️  Not analyzed: {} ({})", failure.filePath(), failure.reason());
        }
    }

    private void writeReport(String report) {
        String output = properties.getReport().getOutput();
        if (output == null || output.isBlank()) {
            log.info("");
            report.lines().forEach(line -> log.info("{}", line));
            return;
        }
        Path target = Path.of(output);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, report, StandardCharsets.UTF_8);
            log.info("Report written to {}", target.toAbsolutePath());
        } catch (IOException e) {
            throw new FileAccessException(target, e);
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
