package com.vidnyan.tracescan.domain.scan;

import com.vidnyan.tracescan.domain.finding.Severity;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * How well a risky call is covered by exception handling.
 */
public enum TryCoverage {

    /** Inside a try block, or the method declares the exception. */
    ENCLOSED,

    /** Not enclosed, but the method has a try block somewhere else. */
    ELSEWHERE_IN_METHOD,

    /** No exception handling in sight. */
    NONE;

    /**
     * Classify the position. {@code declaredThrows} matches a Java {@code throws} clause
     * on the method header that makes the call safe for the caller to handle.
     */
    public static TryCoverage at(List<String> lines, int index, int column, Pattern declaredThrows) {
        if (BlockLocator.isInsideTry(lines, index, column)) {
            return ENCLOSED;
        }
        Optional<CodeBlock> method = BlockLocator.findEnclosingMethod(lines, index);
        if (method.isEmpty()) {
            return NONE;
        }
        if (declaredThrows != null && method.get().header().matches(".*\\bthrows\\b.*")
                && declaredThrows.matcher(method.get().header()).find()) {
            return ENCLOSED;
        }
        return BlockLocator.containsTry(lines, method.get()) ? ELSEWHERE_IN_METHOD : NONE;
    }

    /**
     * Severity under the shared policy: a try elsewhere in the method downgrades to MEDIUM.
     */
    public Optional<Severity> severity() {
        return switch (this) {
            case ENCLOSED -> Optional.empty();
            case ELSEWHERE_IN_METHOD -> Optional.of(Severity.MEDIUM);
            case NONE -> Optional.of(Severity.HIGH);
        };
    }
}
