package com.vidnyan.tracescan.adapter.out.rule.exception;

import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.TryCoverage;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects JSON parsing calls that throw on malformed input outside exception handling.
 */
@Component
public class JsonParseRule extends AbstractRule {

    public static final String NAME = "unguarded-json-parse";

    private static final Pattern PARSE = Pattern.compile(
            "(?<![\\w.])(?:new\\s+)?(?:JSONObject|JSONArray)\\s*\\(\\s*[^)\\s]"
            + "|\\.fromJson\\s*\\("
            + "|\\bJsonParser\\s*\\.\\s*parseString\\s*\\("
            + "|\\.decodeFromString\\s*(?:<[^>]*>)?\\s*\\(");
    private static final Pattern DECLARED = Pattern.compile(
            "JSONException|JsonSyntaxException|JsonParseException|\\bException\\b|Throwable");

    public JsonParseRule() {
        super(NAME,
                "Unguarded JSON parsing",
                "Server payloads and cached strings can be malformed; catch JSONException / "
                        + "JsonSyntaxException / SerializationException around the parse.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, PARSE, (index, match) -> {
            TryCoverage coverage = TryCoverage.at(file.lines(), index, match.start(), DECLARED);
            String call = match.group().replaceAll("\\s*(?:<[^>]*>)?\\s*\\(.*$", "")
                    .replaceAll("\\s+", " ").replaceFirst("^\\.", "").trim() + "(...)";
            coverage.severity().ifPresent(severity -> matches.report(index, severity,
                    coverage == TryCoverage.NONE
                            ? call + " parses JSON without exception handling"
                            : call + " is outside the try block of its method"));
        });
    }
}
