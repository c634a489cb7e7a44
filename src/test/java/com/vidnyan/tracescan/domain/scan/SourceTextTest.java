package com.vidnyan.tracescan.domain.scan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    @Test
    void code_ShouldBlankStringContentsAndDropLineComment() {
        String code = SourceText.code("String s = \"a // b\"; // comment");

        assertEquals("String s = \"      \"; ", code);
    }

    @Test
    void code_ShouldBlankCharLiteralsAndKeepColumns() {
        String line = "char c = '{'; /* x } */ int y;";

        String code = SourceText.code(line);

        assertEquals(line.length(), code.length());
        assertFalse(code.contains("{"));
        assertFalse(code.contains("}"));
        assertTrue(code.endsWith("int y;"));
    }

    @Test
    void braceDelta_ShouldIgnoreBracesInCommentsAndStrings() {
        assertEquals(1, SourceText.braceDelta("if (x) { // }"));
        assertEquals(0, SourceText.braceDelta("log(\"{\");"));
        assertEquals(0, SourceText.braceDelta(" * { javadoc"));
        assertEquals(-1, SourceText.braceDelta("}"));
    }

    @Test
    void isComment_ShouldRecognizeCommentLines() {
        assertTrue(SourceText.isComment("   // note"));
        assertTrue(SourceText.isComment(" * continued"));
        assertTrue(SourceText.isComment("/* start"));
        assertFalse(SourceText.isComment("x = 1; // trailing"));
        assertTrue(SourceText.isBlankOrComment("   "));
    }

    @Test
    void maskBlockComments_ShouldBlankCommentsSpanningLines() {
        List<String> lines = List.of(
                "int a = 1; /* start",
                "User first = users.get(0);",
                "end */ int b = 2;",
                "String s = \"/* not a comment */\"; // /* neither",
                "int c = 3;");

        List<String> masked = SourceText.maskBlockComments(lines);

        assertEquals(lines.size(), masked.size());
        for (int i = 0; i < lines.size(); i++) {
            assertEquals(lines.get(i).length(), masked.get(i).length());
        }
        assertEquals("int a = 1;", masked.get(0).trim());
        assertTrue(masked.get(1).isBlank());
        assertEquals("int b = 2;", masked.get(2).trim());
        assertEquals(lines.get(3), masked.get(3));
        assertEquals("int c = 3;", masked.get(4));
    }

    @Test
    void parenDelta_ShouldCountOpenParentheses() {
        assertEquals(1, SourceText.parenDelta("foo(a, bar(b)"));
        assertEquals(0, SourceText.parenDelta("log(\")\")"));
    }
}
