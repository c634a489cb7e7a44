package com.vidnyan.tracescan.domain.scan;

import com.vidnyan.tracescan.domain.source.SourceFile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-pass scope tracking for rules that walk a file once, top to bottom.
 * Call {@link #advance(int)} for each line in order, then query the state.
 */
public final class ScopeTracker {

    public enum Kind {
        TYPE,
        METHOD,
        TRY,
        CATCH,
        FINALLY,
        LOOP,
        CONTROL,
        CALLBACK,
        LAMBDA,
        OTHER
    }

    /**
     * An open scope.
     */
    public record Scope(Kind kind, String name, String header, int openIndex) {}

    private static final Pattern TYPE = Pattern.compile(
            "(?<!::)\\b(?:class|interface|object|enum)\\s+([A-Z]\\w*)");
    private static final Pattern COMPANION = Pattern.compile("\\bcompanion\\s+object\\b");
    private static final Pattern CATCH = Pattern.compile("\\bcatch\\b");
    private static final Pattern FINALLY = Pattern.compile("\\bfinally\\s*$");
    private static final Pattern LOOP = Pattern.compile(
            "^\\s*(?:\\}\\s*)?(?:for|while|do)\\b|\\.(?:forEach|forEachIndexed)\\b");
    private static final Pattern CONTROL = Pattern.compile(
            "^\\s*(?:\\}\\s*)?(?:if|else|switch|when|synchronized|case|default)\\b|\\bwhen\\s*(?:\\(.*\\))?\\s*$");
    private static final Pattern CALLBACK = Pattern.compile(
            "\\b(Thread|thread|Runnable|TimerTask|AsyncTask|Callback|Callable|post|postDelayed|runOnUiThread"
            + "|launch|async|withContext|enqueue|subscribe|observe|addOnSuccessListener|addOnCompleteListener"
            + "|addOnFailureListener|execute|submit|schedule|onResponse|onFailure|onSuccess|onError|onNext"
            + "|onComplete|doInBackground|onPostExecute)\\b");
    private static final Pattern ANONYMOUS = Pattern.compile("\\bnew\\s+[\\w.<>, ]+\\([^)]*\\)\\s*$");
    private static final Pattern ARROW_END = Pattern.compile("->\\s*$");

    private final List<String> lines;
    private final boolean kotlin;
    private final Deque<Scope> stack = new ArrayDeque<>();
    private final List<Scope> touched = new ArrayList<>();

    public ScopeTracker(SourceFile file) {
        this.lines = file.lines();
        this.kotlin = file.isKotlin();
    }

    /**
     * Process the line at the given index. Scopes opened and closed on that same
     * line remain visible until the next call.
     */
    public void advance(int index) {
        touched.clear();
        String raw = lines.get(index);
        if (SourceText.isComment(raw)) {
            return;
        }
        String code = SourceText.code(raw);
        for (int c = 0; c < code.length(); c++) {
            char ch = code.charAt(c);
            if (ch == '{') {
                String header = BlockLocator.headerBefore(lines, index, c);
                Scope scope = classify(header, index);
                stack.push(scope);
                touched.add(scope);
            } else if (ch == '}' && !stack.isEmpty()) {
                stack.pop();
            }
        }
    }

    /**
     * Scopes in effect, innermost first, including scopes touched by the last line.
     */
    public List<Scope> scopes() {
        List<Scope> result = new ArrayList<>();
        for (int i = touched.size() - 1; i >= 0; i--) {
            if (!stack.contains(touched.get(i))) {
                result.add(touched.get(i));
            }
        }
        result.addAll(stack);
        return result;
    }

    public boolean isInside(Kind kind) {
        return innermost(kind).isPresent();
    }

    public Optional<Scope> innermost(Kind kind) {
        return scopes().stream().filter(s -> s.kind() == kind).findFirst();
    }

    /**
     * Innermost callback scope that is nested within the current method.
     */
    public Optional<Scope> callbackWithinMethod() {
        for (Scope scope : scopes()) {
            if (scope.kind() == Kind.CALLBACK) {
                return Optional.of(scope);
            }
            if (scope.kind() == Kind.METHOD && !isCallbackMethod(scope.name())) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> currentMethod() {
        return innermost(Kind.METHOD).map(Scope::name);
    }

    public Optional<String> currentType() {
        return innermost(Kind.TYPE).map(Scope::name);
    }

    public int depth() {
        return stack.size();
    }

    private Scope classify(String header, int index) {
        Optional<String> method = BlockLocator.declaredMethodName(header);
        if (method.isPresent()) {
            return new Scope(Kind.METHOD, method.get(), header, index);
        }
        Matcher type = TYPE.matcher(header);
        if (type.find() && !header.contains("=")) {
            return new Scope(Kind.TYPE, type.group(1), header, index);
        }
        if (COMPANION.matcher(header).find()) {
            return new Scope(Kind.TYPE, "Companion", header, index);
        }
        if (BlockLocator.isTryHeader(header)) {
            return new Scope(Kind.TRY, null, header, index);
        }
        if (CATCH.matcher(header).find()) {
            return new Scope(Kind.CATCH, null, header, index);
        }
        if (FINALLY.matcher(header).find()) {
            return new Scope(Kind.FINALLY, null, header, index);
        }
        if (LOOP.matcher(header).find()) {
            return new Scope(Kind.LOOP, null, header, index);
        }
        if (CONTROL.matcher(header).find() || (kotlin && ARROW_END.matcher(header).find())) {
            return new Scope(Kind.CONTROL, null, header, index);
        }
        Matcher callback = CALLBACK.matcher(header);
        String callbackName = null;
        while (callback.find()) {
            callbackName = callback.group(1);
        }
        if (callbackName != null) {
            return new Scope(Kind.CALLBACK, callbackName, header, index);
        }
        if (ANONYMOUS.matcher(header).find() || ARROW_END.matcher(header).find()
                || header.endsWith(")") || header.matches(".*\\w$")) {
            return new Scope(Kind.LAMBDA, null, header, index);
        }
        return new Scope(Kind.OTHER, null, header, index);
    }

    private static boolean isCallbackMethod(String name) {
        return CALLBACK.matcher(name).matches() || "run".equals(name) || "call".equals(name)
                || "handleMessage".equals(name) || "onChanged".equals(name);
    }
}
