package com.vidnyan.tracescan.adapter.out.rule.exception;

import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.TryCoverage;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Detects string-to-number conversions that throw {@code NumberFormatException}
 * outside exception handling.
 */
@Component
public class NumberParseRule extends AbstractRule {

    public static final String NAME = "unchecked-number-parse";

    private static final Pattern JAVA_PARSE = Pattern.compile(
            "\\b(?:Integer|Long|Double|Float|Short|Byte)\\s*\\.\\s*(?:parse\\w+|valueOf)\\s*\\(\\s*(?![-\\d.)\"])");
    private static final Pattern KOTLIN_CONVERSION = Pattern.compile(
            "([\\w)\\]\"]+)\\s*\\.\\s*(toInt|toLong|toDouble|toFloat|toShort|toByte|toBigDecimal)\\s*\\(\\s*\\)");
    private static final Pattern STRING_RECEIVER = Pattern.compile(
            "(?:\\btext|\\btoString\\(\\)|\\btrim\\(\\)|\\bgetString\\w*\\([^)]*\\)|Extra\\([^)]*\\)"
            + "|\\w*(?:Str|String|Text|Input|input|text|str)|\")\\s*$");
    private static final Pattern VALIDATION = Pattern.compile(
            "isDigitsOnly|\\.matches\\s*\\(|isDigit|toIntOrNull|toLongOrNull|toDoubleOrNull|NumberUtils|tryParse");
    private static final Pattern DECLARED = Pattern.compile("NumberFormatException|\\bException\\b|Throwable");

    public NumberParseRule() {
        super(NAME,
                "Unchecked number parsing",
                "Wrap the conversion in try/catch (NumberFormatException), validate the input first, "
                        + "or use toIntOrNull()/toLongOrNull() in Kotlin.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, JAVA_PARSE, (index, match) ->
                check(file, matches, index, match, match.group().replaceAll("\\s", "")));

        if (file.isKotlin()) {
            forEachMatch(file, matches, KOTLIN_CONVERSION, (index, match) -> {
                String receiverText = file.line(index).substring(0, match.start(2));
                String receiver = receiverText.replaceAll("\\s*\\.\\s*$", "");
                if (!STRING_RECEIVER.matcher(receiver).find()) {
                    return;
                }
                check(file, matches, index, match, match.group(2) + "()");
            });
        }
    }

    private void check(SourceFile file, MatchCollector matches, int index, MatchResult match, String call) {
        if (LineWindow.lookback(file.lines(), index, 3, VALIDATION)) {
            return;
        }
        TryCoverage coverage = TryCoverage.at(file.lines(), index, match.start(), DECLARED);
        coverage.severity().ifPresent(severity -> matches.report(index, severity,
                coverage == TryCoverage.NONE
                        ? call + " can throw NumberFormatException and is not handled"
                        : call + " is outside the try block of its method"));
    }
}
