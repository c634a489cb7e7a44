package com.vidnyan.tracescan.application.service;

import com.vidnyan.tracescan.domain.source.SourceFile;

import java.util.List;
import java.util.Set;

/**
 * Engine settings for one scan.
 *
 * @param extensions      file extensions to scan, lower case with dot
 * @param excludePatterns path fragments that exclude a file
 * @param contextRadius   lines of context on each side of a finding
 * @param parallelism     worker threads; 1 scans sequentially
 */
public record ScanOptions(
    Set<String> extensions,
    List<String> excludePatterns,
    int contextRadius,
    int parallelism
) {

    public ScanOptions {
        extensions = Set.copyOf(extensions);
        excludePatterns = List.copyOf(excludePatterns);
        contextRadius = Math.max(0, contextRadius);
        parallelism = Math.max(1, parallelism);
    }

    public static ScanOptions defaults() {
        return new ScanOptions(Set.of(SourceFile.JAVA, SourceFile.KOTLIN), List.of(),
                ContextExtractor.DEFAULT_RADIUS, 1);
    }

    public ScanOptions withParallelism(int threads) {
        return new ScanOptions(extensions, excludePatterns, contextRadius, threads);
    }
}
