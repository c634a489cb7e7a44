package com.vidnyan.tracescan.application.service;

import com.vidnyan.tracescan.application.port.in.ScanSourceUseCase;
import com.vidnyan.tracescan.application.port.out.RuleRepository;
import com.vidnyan.tracescan.application.port.out.SourceFileRepository;
import com.vidnyan.tracescan.config.ScanProperties;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.domain.rule.Rule;
import com.vidnyan.tracescan.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Main application service that orchestrates a scan.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanApplicationService implements ScanSourceUseCase {

    private final RuleRepository ruleRepository;
    private final SourceFileRepository sourceFileRepository;
    private final ScanProperties properties;

    @Override
    public ScanResult scan(ScanRequest request) {
        log.info("Starting scan of: {}", request.root());

        List<Rule> rules = resolveRules(request.ruleNames());
        log.info("Active rules: {}", rules.stream().map(Rule::name).toList());

        ScanOptions options = options();
        ContextExtractor contextExtractor = new ContextExtractor(sourceFileRepository, options.contextRadius());
        ScannerEngine engine = new ScannerEngine(rules, sourceFileRepository, contextExtractor, options);
        return engine.scan(request.root());
    }

    @Override
    public List<RuleDescriptor> listRules() {
        return ruleRepository.findAll().stream()
                .map(RuleDescriptor::of)
                .toList();
    }

    private List<Rule> resolveRules(List<String> names) {
        if (names.isEmpty()) {
            return ruleRepository.findEnabled();
        }
        Set<String> seen = new HashSet<>();
        return names.stream()
                .filter(seen::add)
                .map(name -> ruleRepository.findByName(name)
                        .orElseThrow(() -> new ConfigurationException("Unknown rule: " + name)))
                .toList();
    }

    private ScanOptions options() {
        ScanProperties.Scan scan = properties.getScan();
        Set<String> extensions = new HashSet<>();
        for (String extension : scan.getExtensions()) {
            String normalized = extension.trim().toLowerCase(Locale.ROOT);
            extensions.add(normalized.startsWith(".") ? normalized : "." + normalized);
        }
        return new ScanOptions(extensions, scan.getExcludes(), scan.getContextRadius(), scan.getParallelism());
    }
}
