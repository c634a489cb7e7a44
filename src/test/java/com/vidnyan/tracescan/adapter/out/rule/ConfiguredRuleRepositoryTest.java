package com.vidnyan.tracescan.adapter.out.rule;

import com.vidnyan.tracescan.adapter.out.rule.exception.SwallowedExceptionRule;
import com.vidnyan.tracescan.adapter.out.rule.exception.TodoCallRule;
import com.vidnyan.tracescan.adapter.out.rule.nullsafety.NotNullAssertionRule;
import com.vidnyan.tracescan.adapter.out.rule.nullsafety.NullableDereferenceRule;
import com.vidnyan.tracescan.config.ScanProperties;
import com.vidnyan.tracescan.domain.rule.Rule;
import com.vidnyan.tracescan.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredRuleRepositoryTest {

    private ScanProperties properties;
    private ConfiguredRuleRepository repository;

    @BeforeEach
    void setUp() {
        properties = new ScanProperties();
        repository = new ConfiguredRuleRepository(List.of(
                new TodoCallRule(), new NullableDereferenceRule(), new SwallowedExceptionRule(),
                new NotNullAssertionRule()), properties);
    }

    private static List<String> names(List<Rule> rules) {
        return rules.stream().map(Rule::name).toList();
    }

    @Test
    void findAll_ShouldSortByName() {
        assertEquals(List.of(NotNullAssertionRule.NAME, NullableDereferenceRule.NAME,
                SwallowedExceptionRule.NAME, TodoCallRule.NAME), names(repository.findAll()));
        assertTrue(repository.findByName(TodoCallRule.NAME).isPresent());
        assertTrue(repository.findByName("missing").isEmpty());
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void constructor_ShouldLogRegisteredRules(CapturedOutput output) {
        // Act
        new ConfiguredRuleRepository(List.of(new TodoCallRule(), new SwallowedExceptionRule()), properties);

        // Assert
        assertTrue(output.getOut().contains("Registered 2 rules:"));
        assertTrue(output.getOut().contains("  - " + TodoCallRule.NAME));
        assertTrue(output.getOut().contains("  - " + SwallowedExceptionRule.NAME));
    }

    @Test
    void findEnabled_ShouldReturnAllRulesByDefault() {
        assertEquals(names(repository.findAll()), names(repository.findEnabled()));
    }

    @Test
    void findEnabled_ShouldKeepConfiguredOrderAndApplyDisabled() {
        // Arrange
        properties.getRules().setEnabled(List.of(TodoCallRule.NAME, NullableDereferenceRule.NAME,
                SwallowedExceptionRule.NAME, TodoCallRule.NAME));
        properties.getRules().setDisabled(List.of(NullableDereferenceRule.NAME));

        // Act
        List<Rule> enabled = repository.findEnabled();

        // Assert
        assertEquals(List.of(TodoCallRule.NAME, SwallowedExceptionRule.NAME), names(enabled));
    }

    @Test
    void findEnabled_ShouldRejectUnknownNames() {
        properties.getRules().setDisabled(List.of("no-such-rule"));

        ConfigurationException e = assertThrows(ConfigurationException.class, repository::findEnabled);
        assertTrue(e.getMessage().startsWith("Unknown rule 'no-such-rule'"));
    }

    @Test
    void findEnabled_ShouldRejectEmptyActiveSet() {
        properties.getRules().setEnabled(List.of(TodoCallRule.NAME));
        properties.getRules().setDisabled(List.of(TodoCallRule.NAME));

        assertThrows(ConfigurationException.class, repository::findEnabled);
    }

    @Test
    void constructor_ShouldRejectDuplicateNames() {
        assertThrows(ConfigurationException.class, () -> new ConfiguredRuleRepository(
                List.of(new TodoCallRule(), new TodoCallRule()), properties));
    }
}
