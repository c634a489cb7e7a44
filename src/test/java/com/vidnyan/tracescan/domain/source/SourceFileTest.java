package com.vidnyan.tracescan.domain.source;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileTest {

    @Test
    void extension_ShouldBeLowerCaseWithDot() {
        assertEquals(".kt", SourceFile.of("app/src/Main.KT").extension());
        assertEquals(".java", SourceFile.of("dir.v2\\Foo.java").extension());
        assertEquals("", SourceFile.of("Makefile").extension());
        assertEquals("", SourceFile.of("some.dir/README").extension());
    }

    @Test
    void languageChecks_ShouldFollowExtension() {
        assertTrue(SourceFile.of("A.kt").isKotlin());
        assertTrue(SourceFile.of("A.java").isJava());
        assertFalse(SourceFile.of("A.kts").isKotlin());
    }

    @Test
    void lines_ShouldBeDefensivelyCopied() {
        List<String> lines = new ArrayList<>(List.of("a", "b"));
        SourceFile file = SourceFile.of(Path.of("A.java"), lines);

        lines.add("c");

        assertEquals(2, file.lineCount());
        assertThrows(UnsupportedOperationException.class, () -> file.lines().add("d"));
    }

    @Test
    void pathContains_ShouldIgnoreCaseAndSeparators() {
        SourceFile file = SourceFile.of("app\\src\\org\\PeerTube\\Api.java");

        assertTrue(file.pathContains("peertube"));
        assertTrue(file.pathContains("org/peertube"));
    }
}
