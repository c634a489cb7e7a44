package com.vidnyan.tracescan.adapter.out.filesystem;

import com.vidnyan.tracescan.application.port.out.SourceFileRepository;
import com.vidnyan.tracescan.domain.finding.FileFailure;
import com.vidnyan.tracescan.exception.DirectoryNotFoundException;
import com.vidnyan.tracescan.exception.FileAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Scans a directory tree for source files and reads them from disk.
 */
@Slf4j
@Component
public class FileSystemSourceRepository implements SourceFileRepository {

    @Override
    public SourceListing listSourceFiles(Path root, Collection<String> extensions, Collection<String> excludePatterns) {
        if (root == null || !Files.isDirectory(root)) {
            throw new DirectoryNotFoundException(root);
        }
        List<Path> sourceFiles = new ArrayList<>();
        List<FileFailure> failures = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                    new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!hasExtension(file, extensions) || isExcluded(root, file, excludePatterns)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (attrs.isRegularFile()) {
                        sourceFiles.add(file);
                    } else if (attrs.isSymbolicLink()) {
                        log.warn("Skipping broken link {}", file);
                        failures.add(new FileFailure(file.toString(), "Cannot read " + file + ": broken symbolic link"));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    if (e instanceof FileSystemLoopException) {
                        log.debug("Not following link cycle at {}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    if (isExcluded(root, file, excludePatterns) || isExcludedDirectory(root, file, excludePatterns)) {
                        return FileVisitResult.CONTINUE;
                    }
                    FileAccessException failure = new FileAccessException(file, e);
                    log.warn("Cannot visit {}: {}", file, e.getMessage());
                    failures.add(new FileFailure(file.toString(), failure.getMessage()));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new FileAccessException(root, e);
        }
        sourceFiles.sort(Path::compareTo);
        log.debug("Found {} source files under {} ({} not visited)", sourceFiles.size(), root, failures.size());
        return new SourceListing(sourceFiles, failures);
    }

    @Override
    public List<String> readLines(Path file) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file),
                StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPLACE)
                        .onUnmappableCharacter(CodingErrorAction.REPLACE)))) {
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            return lines;
        } catch (IOException e) {
            throw new FileAccessException(file, e);
        }
    }

    private static boolean hasExtension(Path file, Collection<String> extensions) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    private static boolean isExcluded(Path root, Path file, Collection<String> excludePatterns) {
        String relative = relativePath(root, file);
        return excludePatterns.stream().anyMatch(relative::contains);
    }

    private static boolean isExcludedDirectory(Path root, Path directory, Collection<String> excludePatterns) {
        String relative = relativePath(root, directory) + "/";
        return excludePatterns.stream().anyMatch(relative::contains);
    }

    private static String relativePath(Path root, Path file) {
        return "/" + root.relativize(file).toString().replace('\\', '/');
    }
}
