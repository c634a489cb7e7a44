package com.vidnyan.tracescan.application.service;

import com.vidnyan.tracescan.application.port.out.SourceFileRepository;
import com.vidnyan.tracescan.exception.FileAccessException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Renders the window of source lines around a finding.
 *
 * <pre>
 *     9 | val x: String? = null
 * >> 10 | x.length()
 *    11 | }
 * </pre>
 */
@Slf4j
public class ContextExtractor {

    public static final int DEFAULT_RADIUS = 10;

    private static final String TARGET_MARKER = ">> ";
    private static final String PLAIN_MARKER = "   ";

    private final SourceFileRepository sourceFiles;
    private final int radius;

    public ContextExtractor(SourceFileRepository sourceFiles, int radius) {
        this.sourceFiles = sourceFiles;
        this.radius = Math.max(0, radius);
    }

    public ContextExtractor(SourceFileRepository sourceFiles) {
        this(sourceFiles, DEFAULT_RADIUS);
    }

    public int radius() {
        return radius;
    }

    public String extract(Path file, int lineNumber) {
        return extract(file, lineNumber, radius);
    }

    /**
     * Re-read the file and render the context. A read failure yields a placeholder
     * instead of an exception.
     */
    public String extract(Path file, int lineNumber, int radius) {
        try {
            return render(sourceFiles.readLines(file), lineNumber, radius);
        } catch (FileAccessException e) {
            log.debug("Context unavailable for {}:{}: {}", file, lineNumber, e.getMessage());
            return "[context unavailable: " + e.getMessage() + "]";
        }
    }

    /**
     * Render lines [lineNumber - radius, lineNumber + radius], clipped to the file.
     * Line numbers are 1-based and right-aligned to the widest number shown.
     */
    public static String render(List<String> lines, int lineNumber, int radius) {
        int from = Math.max(1, lineNumber - Math.max(0, radius));
        int to = Math.min(lines.size(), lineNumber + Math.max(0, radius));
        if (from > to) {
            return "";
        }
        int width = String.valueOf(to).length();
        StringBuilder out = new StringBuilder();
        for (int n = from; n <= to; n++) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(n == lineNumber ? TARGET_MARKER : PLAIN_MARKER)
                    .append(String.format("%" + width + "d", n))
                    .append(" | ")
                    .append(lines.get(n - 1));
        }
        return out.toString();
    }
}
