package com.vidnyan.tracescan.adapter.out.rule.nullsafety;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects {@code findViewById(...).call()} chains in Java, which crash when the id is
 * missing from the inflated layout variant.
 */
@Component
public class FindViewChainRule extends AbstractRule {

    public static final String NAME = "find-view-chain";

    private static final Pattern CHAIN = Pattern.compile(
            "\\bfindViewById\\s*\\(\\s*[\\w.]+\\s*\\)\\s*\\)?\\s*\\.\\s*(\\w+)\\s*\\(");

    public FindViewChainRule() {
        super(NAME,
                "Unchecked view lookup",
                "Store the view in a local and null-check it, or switch to view binding so "
                        + "missing ids fail at compile time.",
                JAVA_ONLY);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, CHAIN, (index, match) ->
                matches.report(index, Severity.MEDIUM,
                        "findViewById(...)." + match.group(1) + "() called without checking the view exists"));
    }
}
