package com.vidnyan.tracescan.application.service;

import com.vidnyan.tracescan.adapter.out.filesystem.FileSystemSourceRepository;
import com.vidnyan.tracescan.adapter.out.rule.ConfiguredRuleRepository;
import com.vidnyan.tracescan.adapter.out.rule.exception.TodoCallRule;
import com.vidnyan.tracescan.adapter.out.rule.nullsafety.NullableDereferenceRule;
import com.vidnyan.tracescan.application.port.in.ScanSourceUseCase.RuleDescriptor;
import com.vidnyan.tracescan.application.port.in.ScanSourceUseCase.ScanRequest;
import com.vidnyan.tracescan.config.ScanProperties;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScanApplicationServiceTest {

    @TempDir
    Path tempDir;

    private ScanProperties properties;
    private ScanApplicationService service;

    @BeforeEach
    void setUp() throws IOException {
        properties = new ScanProperties();
        ConfiguredRuleRepository rules = new ConfiguredRuleRepository(
                List.of(new NullableDereferenceRule(), new TodoCallRule()), properties);
        service = new ScanApplicationService(rules, new FileSystemSourceRepository(), properties);

        Files.write(tempDir.resolve("Main.kt"), List.of(
                "val x: String? = null",
                "x.length()",
                "fun later() = TODO()"));
    }

    @Test
    void scan_ShouldRunConfiguredRules() {
        ScanResult result = service.scan(ScanRequest.forPath(tempDir));

        assertEquals(2, result.findings().size());
        assertEquals(2, result.stats().rulesApplied());
    }

    @Test
    void scan_ShouldRunOnlyRequestedRules() {
        ScanResult result = service.scan(new ScanRequest(tempDir,
                List.of(TodoCallRule.NAME, TodoCallRule.NAME)));

        assertEquals(1, result.findings().size());
        assertEquals(TodoCallRule.NAME, result.findings().get(0).ruleName());
        assertEquals(1, result.stats().rulesApplied());
    }

    @Test
    void scan_ShouldRejectUnknownRequestedRule() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> service.scan(new ScanRequest(tempDir, List.of("bogus"))));

        assertEquals("Unknown rule: bogus", e.getMessage());
    }

    @Test
    void scan_ShouldNormalizeConfiguredExtensions() {
        properties.getScan().setExtensions(List.of("JAVA"));

        ScanResult result = service.scan(ScanRequest.forPath(tempDir));

        assertEquals(0, result.stats().filesScanned());
    }

    @Test
    void scan_ShouldApplyContextRadius() {
        properties.getScan().setContextRadius(0);

        ScanResult result = service.scan(new ScanRequest(tempDir, List.of(NullableDereferenceRule.NAME)));

        assertEquals(">> 2 | x.length()", result.findings().get(0).context());
    }

    @Test
    void listRules_ShouldDescribeEveryRule() {
        List<RuleDescriptor> rules = service.listRules();

        assertEquals(2, rules.size());
        assertEquals(NullableDereferenceRule.NAME, rules.get(0).name());
        assertEquals(Set.of(".java", ".kt"), rules.get(0).extensions());
        assertEquals(Set.of(".kt", ".java"), rules.get(1).extensions());
    }
}
