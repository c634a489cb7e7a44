package com.vidnyan.tracescan.domain.scan;

import com.vidnyan.tracescan.domain.scan.ScopeTracker.Kind;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTrackerTest {

    @Test
    void advance_ShouldTrackTypeMethodAndCallbackScopes() {
        SourceFile file = SourceFile.of("MainActivity.kt",
                "class MainActivity : AppCompatActivity() {",
                "    override fun onCreate(savedInstanceState: Bundle?) {",
                "        thread {",
                "            load()",
                "        }",
                "    }",
                "}");
        ScopeTracker scopes = new ScopeTracker(file);

        for (int i = 0; i <= 3; i++) {
            scopes.advance(i);
        }

        assertEquals(3, scopes.depth());
        assertEquals(Optional.of("onCreate"), scopes.currentMethod());
        assertEquals(Optional.of("MainActivity"), scopes.currentType());
        assertTrue(scopes.isInside(Kind.CALLBACK));
        assertEquals("thread", scopes.callbackWithinMethod().map(ScopeTracker.Scope::name).orElse(null));

        scopes.advance(4);

        assertEquals(2, scopes.depth());
        assertTrue(scopes.callbackWithinMethod().isEmpty());
    }

    @Test
    void advance_ShouldClassifyControlScopes() {
        SourceFile file = SourceFile.of("A.java",
                "void f() {",
                "    for (int i = 0; i < n; i++) {",
                "        try {",
                "            g();",
                "        } catch (Exception e) {",
                "            h();",
                "        }",
                "    }",
                "}");
        ScopeTracker scopes = new ScopeTracker(file);

        for (int i = 0; i <= 3; i++) {
            scopes.advance(i);
        }
        assertTrue(scopes.isInside(Kind.TRY));
        assertTrue(scopes.isInside(Kind.LOOP));

        scopes.advance(4);
        scopes.advance(5);
        assertTrue(scopes.isInside(Kind.CATCH));
        assertFalse(scopes.isInside(Kind.TRY));
    }

    @Test
    void scopes_ShouldKeepScopeOpenedAndClosedOnSameLine() {
        SourceFile file = SourceFile.of("A.kt",
                "fun f() {",
                "    items.forEach { it.run() }",
                "}");
        ScopeTracker scopes = new ScopeTracker(file);

        scopes.advance(0);
        scopes.advance(1);

        assertEquals(1, scopes.depth());
        assertTrue(scopes.isInside(Kind.LOOP));
    }
}
