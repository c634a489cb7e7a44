package com.vidnyan.tracescan.adapter.out.rule.state;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.RuleMatch;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateRulesTest {

    @Test
    void mediaPlayer_ShouldFlagStartBeforePrepareAndUseAfterRelease() {
        // Arrange
        SourceFile file = SourceFile.of("Player.java",
                "class Player {",
                "    private MediaPlayer player;",
                "    void play(String url) {",
                "        player = new MediaPlayer();",
                "        player.setDataSource(url);",
                "        player.start();",
                "    }",
                "    void done() {",
                "        player.release();",
                "        player.start();",
                "    }",
                "}");

        // Act
        List<RuleMatch> matches = new MediaPlayerStateRule().analyze(file);

        // Assert
        assertEquals(2, matches.size());
        assertEquals(6, matches.get(0).lineNumber());
        assertEquals("player.start() called in state INITIALIZED; prepare() has not completed",
                matches.get(0).detail());
        assertEquals(10, matches.get(1).lineNumber());
        assertEquals("player.start() called after release()", matches.get(1).detail());
        assertEquals(Severity.HIGH, matches.get(1).severity());
    }

    @Test
    void mediaPlayer_ShouldFlagStartAfterPrepareAsyncWithoutListener() {
        SourceFile file = SourceFile.of("Stream.kt",
                "fun stream(url: String) {",
                "    val mp = MediaPlayer()",
                "    mp.setDataSource(url)",
                "    mp.prepareAsync()",
                "    mp.start()",
                "}",
                "fun beep() {",
                "    val tone = MediaPlayer.create(this, R.raw.beep)",
                "    tone.start()",
                "}");

        List<RuleMatch> matches = new MediaPlayerStateRule().analyze(file);

        assertEquals(1, matches.size());
        assertEquals(5, matches.get(0).lineNumber());
        assertEquals(Severity.MEDIUM, matches.get(0).severity());
    }

    @Test
    void mediaPlayer_ShouldForgetStateAcrossMethods() {
        SourceFile file = SourceFile.of("Player.java",
                "class Player {",
                "    private MediaPlayer player;",
                "    void stop() {",
                "        player.release();",
                "    }",
                "    void resume() {",
                "        player.start();",
                "    }",
                "}");

        assertTrue(new MediaPlayerStateRule().analyze(file).isEmpty());
    }

    @Test
    void stateSwitch_ShouldFlagThrowingDefault() {
        SourceFile file = SourceFile.of("Machine.java",
                "switch (state) {",
                "    case IDLE:",
                "        break;",
                "    default:",
                "        throw new IllegalStateException(\"bad\");",
                "}");

        List<RuleMatch> matches = new StateSwitchDefaultRule().analyze(file);

        assertEquals(1, matches.size());
        assertEquals(4, matches.get(0).lineNumber());
        assertEquals(Severity.MEDIUM, matches.get(0).severity());
        assertEquals("Default branch for 'state' throws", matches.get(0).detail());
    }

    @Test
    void stateSwitch_ShouldFlagMissingElseOnStateSubjectsOnly() {
        SourceFile file = SourceFile.of("Screen.kt",
                "when (status) {",
                "    Status.OK -> show()",
                "    Status.FAIL -> retry()",
                "}",
                "when (x) {",
                "    1 -> one()",
                "}");

        List<RuleMatch> matches = new StateSwitchDefaultRule().analyze(file);

        assertEquals(1, matches.size());
        assertEquals(1, matches.get(0).lineNumber());
        assertEquals(Severity.LOW, matches.get(0).severity());
        assertEquals("No default branch for 'status'", matches.get(0).detail());
    }

    @Test
    void stateSwitch_ShouldReadSubjectsContainingCalls() {
        // Arrange
        SourceFile file = SourceFile.of("Player.java",
                "switch (getState()) { case PLAYING: break; }",
                "switch (player.getStatus(true))",
                "{",
                "    case IDLE:",
                "        break;",
                "    default:",
                "        throw new IllegalStateException();",
                "}",
                "when(repository.getState()).thenReturn(State.IDLE);");

        // Act
        List<RuleMatch> matches = new StateSwitchDefaultRule().analyze(file);

        // Assert
        assertEquals(2, matches.size());
        assertEquals(1, matches.get(0).lineNumber());
        assertEquals(Severity.LOW, matches.get(0).severity());
        assertEquals("No default branch for 'getState()'", matches.get(0).detail());
        assertEquals(6, matches.get(1).lineNumber());
        assertEquals("Default branch for 'player.getStatus(true)' throws", matches.get(1).detail());
    }
}
