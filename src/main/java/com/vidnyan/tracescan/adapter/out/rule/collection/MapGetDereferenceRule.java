package com.vidnyan.tracescan.adapter.out.rule.collection;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects {@code map.get(key).call()} on Java maps, which throws when the key is absent.
 */
@Component
public class MapGetDereferenceRule extends AbstractRule {

    public static final String NAME = "map-get-dereference";

    private static final Pattern MAP_DECLARATION = Pattern.compile(
            "\\b(?:Map|HashMap|LinkedHashMap|TreeMap|ConcurrentHashMap|SortedMap|SparseArray|ArrayMap|LruCache)"
            + "\\s*(?:<[^;=]*>)?\\s+(\\w+)\\s*[;=)]");

    public MapGetDereferenceRule() {
        super(NAME,
                "Missing map key",
                "Check containsKey(), use getOrDefault(), or null-check the value before calling into it.",
                JAVA_ONLY);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        for (String map : mapVariables(file)) {
            String m = Pattern.quote(map);
            Pattern dereference = Pattern.compile("(?<![\\w])(?:this\\.)?" + m + "\\s*\\.\\s*get\\s*\\([^()]*(?:\\([^()]*\\))?[^()]*\\)\\s*\\.\\s*\\w+");
            Pattern guard = Pattern.compile("\\b" + m + "\\s*\\.\\s*containsKey|getOrDefault|!=\\s*null");
            forEachMatch(file, matches, dereference, (index, match) -> {
                if (LineWindow.lookback(file.lines(), index, 3, guard)) {
                    return;
                }
                matches.report(index, Severity.MEDIUM,
                        "Value from '" + map + ".get(...)' is dereferenced without a null check");
            });
        }
    }

    private Set<String> mapVariables(SourceFile file) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : file.lines()) {
            Matcher matcher = MAP_DECLARATION.matcher(SourceText.code(line));
            while (matcher.find()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }
}
