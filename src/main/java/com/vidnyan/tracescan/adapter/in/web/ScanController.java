package com.vidnyan.tracescan.adapter.in.web;

import com.vidnyan.tracescan.adapter.out.report.ScanReport;
import com.vidnyan.tracescan.application.port.in.ScanSourceUseCase;
import com.vidnyan.tracescan.application.port.in.ScanSourceUseCase.RuleDescriptor;
import com.vidnyan.tracescan.application.port.in.ScanSourceUseCase.ScanRequest;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * REST API for running scans.
 */
@Slf4j
@RestController
@RequestMapping("/api/scan")
@RequiredArgsConstructor
public class ScanController {

    private final ScanSourceUseCase scanSourceUseCase;

    @PostMapping
    public ScanReport scan(@RequestBody ScanApiRequest request) {
        log.info("Received scan request");
        log.info("  Path:  {}", request.path());
        log.info("  Rules: {}", request.rules());

        if (request.path() == null || request.path().isBlank()) {
            throw new ConfigurationException("Request field 'path' is required");
        }
        ScanResult result = scanSourceUseCase.scan(new ScanRequest(Path.of(request.path()), request.rules()));
        return ScanReport.of(result);
    }

    @GetMapping("/rules")
    public List<RuleDescriptor> rules() {
        return scanSourceUseCase.listRules();
    }

    public record ScanApiRequest(
        String path,
        List<String> rules      // Empty or missing = configured rule set
    ) {}
}
