package com.vidnyan.tracescan.adapter.out.rule.peertube;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects chained JSON field access in PeerTube extractors. PeerTube instances
 * omit optional fields freely, so a missing object or array crashes the extractor.
 */
@Component
public class PeerTubeJsonFieldRule extends AbstractRule {

    public static final String NAME = "peertube-json-field";

    private static final Pattern CHAINED_ACCESS = Pattern.compile(
            "\\.get(?:Object|Array)\\s*\\(\\s*\"[^\"]*\"\\s*\\)\\s*\\.\\s*(get\\w*|size|isEmpty|stream)\\s*\\(");
    private static final Pattern KEY = Pattern.compile("\\.get(?:Object|Array)\\s*\\(\\s*\"([^\"]*)\"");
    private static final Pattern GUARD = Pattern.compile("\\.has\\s*\\(|\\.isNull\\s*\\(|containsKey\\s*\\(|!=\\s*null");

    public PeerTubeJsonFieldRule() {
        super(NAME,
                "Missing PeerTube JSON field",
                "Check has()/isNull() on the parent object before descending, or read the field "
                        + "with a default value.",
                JAVA_ONLY);
    }

    @Override
    public boolean supports(SourceFile file) {
        return super.supports(file) && file.pathContains("peertube");
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, CHAINED_ACCESS, (index, match) -> {
            if (LineWindow.lookback(file.lines(), index, 5, GUARD)) {
                return;
            }
            Matcher key = KEY.matcher(file.line(index));
            String field = key.find() ? key.group(1) : "?";
            matches.report(index, Severity.MEDIUM,
                    "Field '" + field + "' is read and dereferenced without checking it exists");
        });
    }
}
