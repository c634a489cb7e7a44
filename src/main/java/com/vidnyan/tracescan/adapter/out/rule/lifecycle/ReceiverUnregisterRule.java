package com.vidnyan.tracescan.adapter.out.rule.lifecycle;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Detects broadcast receivers that are unregistered unsafely or never unregistered.
 */
@Component
public class ReceiverUnregisterRule extends AbstractRule {

    public static final String NAME = "receiver-unregister";

    private static final Pattern UNREGISTER = Pattern.compile("\\bunregisterReceiver\\s*\\(");
    private static final Pattern REGISTER = Pattern.compile("(?<![\\w])registerReceiver\\s*\\(");
    private static final Pattern REGISTRATION_FLAG = Pattern.compile(
            "(?i)\\bif\\s*\\(\\s*!?\\s*(?:this\\.)?\\w*(?:registered|receiver)\\w*\\b|isRegistered|!= null");

    public ReceiverUnregisterRule() {
        super(NAME,
                "Receiver registration mismatch",
                "Pair every registerReceiver with an unregisterReceiver in the opposite lifecycle "
                        + "callback and track registration with a flag.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        forEachMatch(file, matches, UNREGISTER, (index, match) -> {
            if (BlockLocator.isInsideTry(file.lines(), index, match.start())
                    || LineWindow.lookback(file.lines(), index, 5, REGISTRATION_FLAG)) {
                return;
            }
            matches.report(index, Severity.MEDIUM,
                    "unregisterReceiver() throws IllegalArgumentException if the receiver was not registered");
        });

        if (file.lines().stream().anyMatch(l -> !SourceText.isComment(l)
                && UNREGISTER.matcher(SourceText.code(l)).find())) {
            return;
        }
        OptionalInt first = LineWindow.firstMatch(file.lines(), 0, file.lineCount() - 1, REGISTER);
        first.ifPresent(index -> matches.report(index, Severity.LOW,
                "registerReceiver() without a matching unregisterReceiver() in this file"));
    }
}
