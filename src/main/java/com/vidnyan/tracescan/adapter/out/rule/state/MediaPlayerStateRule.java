package com.vidnyan.tracescan.adapter.out.rule.state;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.ScopeTracker;
import com.vidnyan.tracescan.domain.scan.SourceText;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks the {@code MediaPlayer} state machine per variable and flags calls that
 * are illegal in the state the player is in.
 *
 * <p>State is tracked top to bottom within each method and forgotten at method
 * boundaries, since calls from other methods may run in any order.
 */
@Component
public class MediaPlayerStateRule extends AbstractRule {

    public static final String NAME = "media-player-state";

    enum PlayerState {
        IDLE,
        INITIALIZED,
        PREPARING,
        PREPARED,
        STARTED,
        STOPPED,
        RELEASED,
        UNKNOWN
    }

    private static final Pattern JAVA_DECLARATION = Pattern.compile("\\bMediaPlayer\\s+(\\w+)\\s*[;=]");
    private static final Pattern KOTLIN_DECLARATION = Pattern.compile(
            "\\b(?:val|var)\\s+(\\w+)\\s*(?::\\s*MediaPlayer\\??|=\\s*MediaPlayer(?:\\.create)?\\s*\\()");
    private static final Pattern CALL = Pattern.compile(
            "\\b(\\w+)\\s*\\??\\.\\s*(setDataSource|prepareAsync|prepare|start|pause|stop|reset|release"
            + "|seekTo|getCurrentPosition|getDuration|isPlaying)\\s*\\(");

    public MediaPlayerStateRule() {
        super(NAME,
                "MediaPlayer state violation",
                "Follow the MediaPlayer state machine: setDataSource, prepare (or prepareAsync with an "
                        + "OnPreparedListener), then start; never touch the player after release().",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        Set<String> players = players(file);
        if (players.isEmpty()) {
            return;
        }
        boolean hasPreparedListener = file.anyLineContains("setOnPreparedListener");
        Map<String, PlayerState> states = new LinkedHashMap<>();
        ScopeTracker scopes = new ScopeTracker(file);
        Optional<String> currentMethod = Optional.empty();

        for (int i = 0; i < file.lineCount(); i++) {
            scopes.advance(i);
            Optional<String> method = scopes.currentMethod();
            if (!method.equals(currentMethod)) {
                states.clear();
                currentMethod = method;
            }
            String raw = file.line(i);
            if (SourceText.isComment(raw)) {
                continue;
            }
            String code = SourceText.code(raw);
            for (String player : players) {
                assignment(code, player).ifPresent(state -> states.put(player, state));
            }
            Matcher call = CALL.matcher(code);
            while (call.find()) {
                String player = call.group(1);
                if (!players.contains(player)) {
                    continue;
                }
                PlayerState state = states.getOrDefault(player, PlayerState.UNKNOWN);
                states.put(player, transition(matches, i, player, call.group(2), state, hasPreparedListener));
            }
        }
    }

    private PlayerState transition(MatchCollector matches, int index, String player, String method,
                                   PlayerState state, boolean hasPreparedListener) {
        if (state == PlayerState.RELEASED) {
            matches.report(index, Severity.HIGH,
                    String.format("%s.%s() called after release()", player, method));
            return PlayerState.UNKNOWN;
        }
        switch (method) {
            case "setDataSource":
                return PlayerState.INITIALIZED;
            case "prepare":
                return PlayerState.PREPARED;
            case "prepareAsync":
                return PlayerState.PREPARING;
            case "reset":
                return PlayerState.IDLE;
            case "stop":
                return PlayerState.STOPPED;
            case "release":
                return PlayerState.RELEASED;
            case "start":
                if (state == PlayerState.IDLE || state == PlayerState.INITIALIZED || state == PlayerState.STOPPED) {
                    matches.report(index, Severity.HIGH, String.format(
                            "%s.start() called in state %s; prepare() has not completed", player, state));
                } else if (state == PlayerState.PREPARING && !hasPreparedListener) {
                    matches.report(index, Severity.MEDIUM, String.format(
                            "%s.start() called right after prepareAsync() without an OnPreparedListener", player));
                }
                return PlayerState.STARTED;
            default:
                return state;
        }
    }

    private static Optional<PlayerState> assignment(String code, String player) {
        Matcher matcher = Pattern.compile("\\b" + Pattern.quote(player) + "\\s*(?::\\s*MediaPlayer\\??\\s*)?=(?!=)\\s*(.*)")
                .matcher(code);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1);
        if (value.contains("MediaPlayer.create")) {
            return Optional.of(PlayerState.PREPARED);
        }
        if (value.matches("(?:new\\s+)?MediaPlayer\\s*\\(\\s*\\).*")) {
            return Optional.of(PlayerState.IDLE);
        }
        return Optional.of(PlayerState.UNKNOWN);
    }

    private static Set<String> players(SourceFile file) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : file.lines()) {
            String code = SourceText.code(line);
            Matcher java = JAVA_DECLARATION.matcher(code);
            while (java.find()) {
                names.add(java.group(1));
            }
            Matcher kotlin = KOTLIN_DECLARATION.matcher(code);
            while (kotlin.find()) {
                names.add(kotlin.group(1));
            }
        }
        return names;
    }
}
