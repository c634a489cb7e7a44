package com.vidnyan.tracescan.domain.scan;

import com.vidnyan.tracescan.domain.finding.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class TryCoverageTest {

    private static final List<String> LINES = List.of(
            "void a() {",
            "    try {",
            "        x();",
            "    } catch (Exception e) {}",
            "    Integer.parseInt(s);",
            "}",
            "void b() {",
            "    Integer.parseInt(s);",
            "}",
            "void c() throws NumberFormatException {",
            "    Integer.parseInt(s);",
            "}");

    @Test
    void at_ShouldClassifyPositions() {
        assertEquals(TryCoverage.ENCLOSED, TryCoverage.at(LINES, 2, 8, null));
        assertEquals(TryCoverage.ELSEWHERE_IN_METHOD, TryCoverage.at(LINES, 4, 4, null));
        assertEquals(TryCoverage.NONE, TryCoverage.at(LINES, 7, 4, null));
    }

    @Test
    void at_ShouldTreatDeclaredThrowsAsEnclosed() {
        Pattern declared = Pattern.compile("NumberFormatException");

        assertEquals(TryCoverage.ENCLOSED, TryCoverage.at(LINES, 10, 4, declared));
        assertEquals(TryCoverage.NONE, TryCoverage.at(LINES, 10, 4, Pattern.compile("IOException")));
    }

    @Test
    void severity_ShouldFollowCoverage() {
        assertEquals(Optional.empty(), TryCoverage.ENCLOSED.severity());
        assertEquals(Optional.of(Severity.MEDIUM), TryCoverage.ELSEWHERE_IN_METHOD.severity());
        assertEquals(Optional.of(Severity.HIGH), TryCoverage.NONE.severity());
    }
}
