package com.vidnyan.tracescan.adapter.out.rule.exception;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Detects hard casts of values whose runtime type is decided elsewhere: bundle
 * contents, the host activity, the context, adapter items.
 */
@Component
public class UnsafeCastRule extends AbstractRule {

    public static final String NAME = "unsafe-cast";

    private static final Pattern KOTLIN_CAST = Pattern.compile("\\bas\\s+([A-Z][\\w.]*(?:<[^>]*>)?)");
    private static final Pattern JAVA_CAST = Pattern.compile(
            "\\(\\s*([A-Z][a-z]\\w*(?:\\.[A-Z]\\w*)*)\\s*\\)\\s*(?=[\\w(])");
    private static final Pattern EXTERNAL_SOURCE = Pattern.compile(
            "\\barguments\\b|getSerializable|getParcelable|\\bintent\\b|getIntent|\\bextras\\b|\\bactivity\\b"
            + "|getActivity|requireActivity\\(\\)|\\bcontext\\b|getContext|requireContext\\(\\)|parentFragment"
            + "|getParentFragment|savedInstanceState|getTag|\\.tag\\b|findViewById|getItem|\\badapter\\b"
            + "|getSystemService");

    public UnsafeCastRule() {
        super(NAME,
                "Unsafe cast",
                "Check the type first (is / instanceof) or use a safe cast (as?) and handle the null case.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        Pattern cast = file.isKotlin() ? KOTLIN_CAST : JAVA_CAST;
        forEachMatch(file, matches, cast, (index, match) -> {
            String raw = file.line(index);
            if (raw.trim().startsWith("import ")) {
                return;
            }
            String type = match.group(1).replaceAll("<.*", "");
            String simpleType = type.substring(type.lastIndexOf('.') + 1);
            if (!EXTERNAL_SOURCE.matcher(raw).find()) {
                return;
            }
            Pattern typeCheck = Pattern.compile("\\b(?:is|instanceof)\\s+(?:[\\w.]+\\.)?" + Pattern.quote(simpleType) + "\\b");
            if (LineWindow.lookback(file.lines(), index, 5, typeCheck)) {
                return;
            }
            matches.report(index, Severity.MEDIUM, "Unchecked cast to " + type);
        });
    }
}
