package com.vidnyan.tracescan.adapter.out.rule.sql;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.RuleMatch;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlRulesTest {

    @Test
    void sqlConcatenation_ShouldFlagInlineAndPrebuiltStatements() {
        // Arrange
        SourceFile file = SourceFile.of("UserDao.java",
                "void find(SQLiteDatabase db, String name) {",
                "    Cursor c = db.rawQuery(\"SELECT * FROM users WHERE name = '\" + name + \"'\", null);",
                "    db.execSQL(\"DELETE FROM t WHERE id = ?\", new Object[]{id});",
                "    String sql = \"UPDATE t SET n = \" + n;",
                "    db.execSQL(sql);",
                "}",
                "public Cursor query(String table) {",
                "    return null;",
                "}");

        // Act
        List<RuleMatch> matches = new SqlConcatenationRule().analyze(file);

        // Assert
        assertEquals(2, matches.size());
        assertEquals(2, matches.get(0).lineNumber());
        assertEquals(Severity.HIGH, matches.get(0).severity());
        assertEquals("rawQuery() with SQL built by string concatenation", matches.get(0).detail());
        assertEquals(5, matches.get(1).lineNumber());
        assertEquals("execSQL() with SQL built by concatenation in 'sql'", matches.get(1).detail());
    }

    @Test
    void sqlConcatenation_ShouldRateTemplateWithPlaceholdersMedium() {
        SourceFile file = SourceFile.of("UserDao.kt",
                "db.rawQuery(\"SELECT * FROM t WHERE id = ? AND n = $name\", arrayOf(id))");

        List<RuleMatch> matches = new SqlConcatenationRule().analyze(file);

        assertEquals(1, matches.size());
        assertEquals(Severity.MEDIUM, matches.get(0).severity());
        assertEquals("rawQuery() with SQL built by a string template", matches.get(0).detail());
    }

    @Test
    void cursorIndex_ShouldFlagMissingColumnAndUnpositionedRead() {
        SourceFile file = SourceFile.of("UserDao.java",
                "String n = cursor.getString(cursor.getColumnIndex(\"name\"));");
        SourceFile positioned = SourceFile.of("UserDao.java",
                "if (cursor.moveToFirst()) {",
                "    String n = cursor.getString(0);",
                "}");

        List<RuleMatch> matches = new CursorIndexRule().analyze(file);

        assertEquals(2, matches.size());
        assertEquals(Severity.MEDIUM, matches.get(0).severity());
        assertEquals(Severity.HIGH, matches.get(1).severity());
        assertEquals("'cursor' read before moveToFirst()/moveToNext()", matches.get(1).detail());
        assertTrue(new CursorIndexRule().analyze(positioned).isEmpty());
    }

    @Test
    void cursorLeak_ShouldFlagCursorNeverClosed() {
        SourceFile file = SourceFile.of("UserDao.java",
                "int count(SQLiteDatabase db) {",
                "    Cursor cursor = db.rawQuery(\"SELECT 1\", null);",
                "    return cursor.getCount();",
                "}",
                "int safe(SQLiteDatabase db) {",
                "    Cursor other = db.rawQuery(\"SELECT 1\", null);",
                "    try {",
                "        return other.getCount();",
                "    } finally {",
                "        other.close();",
                "    }",
                "}");

        List<RuleMatch> matches = new CursorLeakRule().analyze(file);

        assertEquals(1, matches.size());
        assertEquals(2, matches.get(0).lineNumber());
        assertEquals(Severity.LOW, matches.get(0).severity());
        assertEquals("Cursor 'cursor' is never closed in count()", matches.get(0).detail());
    }

    @Test
    void cursorLeak_ShouldAcceptKotlinUseAndIgnoreNonCursorQueries() {
        SourceFile file = SourceFile.of("UserDao.kt",
                "fun names(db: SQLiteDatabase): List<String> {",
                "    val cursor = db.query(\"users\", null, null, null, null, null, null)",
                "    cursor.use {",
                "        return readAll(it)",
                "    }",
                "}",
                "fun items(): List<Item> {",
                "    val items = repo.query(filter)",
                "    return items",
                "}");

        assertTrue(new CursorLeakRule().analyze(file).isEmpty());
    }
}
