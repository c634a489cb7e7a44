package com.vidnyan.tracescan.adapter.out.rule;

import com.vidnyan.tracescan.application.port.out.RuleRepository;
import com.vidnyan.tracescan.config.ScanProperties;
import com.vidnyan.tracescan.domain.rule.Rule;
import com.vidnyan.tracescan.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rule repository backed by the rule beans in the application context.
 * The active set is selected by {@code tracescan.rules.enabled} and {@code tracescan.rules.disabled}.
 */
@Slf4j
@Component
public class ConfiguredRuleRepository implements RuleRepository {

    private final Map<String, Rule> rules = new TreeMap<>();
    private final ScanProperties properties;

    public ConfiguredRuleRepository(List<Rule> registered, ScanProperties properties) {
        this.properties = properties;
        for (Rule rule : registered) {
            Rule previous = rules.put(rule.name(), rule);
            if (previous != null) {
                throw new ConfigurationException("Duplicate rule name '" + rule.name() + "': "
                        + previous.getClass().getSimpleName() + " and " + rule.getClass().getSimpleName());
            }
        }
        log.info("Registered {} rules:", rules.size());
        rules.values().forEach(rule -> log.info("  - {} ({})", rule.name(), rule.issueType()));
    }

    @Override
    public List<Rule> findAll() {
        return List.copyOf(rules.values());
    }

    @Override
    public Optional<Rule> findByName(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    @Override
    public List<Rule> findEnabled() {
        List<String> enabled = properties.getRules().getEnabled();
        Set<String> disabled = new HashSet<>(properties.getRules().getDisabled());
        requireKnown(enabled);
        requireKnown(disabled);

        List<Rule> active = new ArrayList<>();
        Collection<String> names = enabled.isEmpty() ? rules.keySet() : enabled;
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!disabled.contains(name) && seen.add(name)) {
                active.add(rules.get(name));
            }
        }
        if (active.isEmpty()) {
            throw new ConfigurationException("No rules left after applying tracescan.rules settings");
        }
        return active;
    }

    private void requireKnown(Collection<String> names) {
        for (String name : names) {
            if (!rules.containsKey(name)) {
                throw new ConfigurationException("Unknown rule '" + name + "'; known rules: " + rules.keySet());
            }
        }
    }
}
