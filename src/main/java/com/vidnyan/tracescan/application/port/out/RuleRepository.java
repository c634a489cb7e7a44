package com.vidnyan.tracescan.application.port.out;

import com.vidnyan.tracescan.domain.rule.Rule;

import java.util.List;
import java.util.Optional;

/**
 * Port for looking up the registered rules.
 */
public interface RuleRepository {

    /**
     * All registered rules, sorted by name.
     */
    List<Rule> findAll();

    /**
     * Look up a specific rule by name.
     */
    Optional<Rule> findByName(String name);

    /**
     * The configured active rule set, in application order.
     */
    List<Rule> findEnabled();
}
