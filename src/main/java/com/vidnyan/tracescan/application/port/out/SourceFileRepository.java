package com.vidnyan.tracescan.application.port.out;

import com.vidnyan.tracescan.domain.finding.FileFailure;
import com.vidnyan.tracescan.exception.DirectoryNotFoundException;
import com.vidnyan.tracescan.exception.FileAccessException;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Port for discovering and reading source files.
 * Implemented by adapters that read from the file system, archives, etc.
 */
public interface SourceFileRepository {

    /**
     * List regular files under the root whose extension is one of the given ones,
     * skipping paths that contain an exclude pattern. Sorted by path.
     * Entries that could not be visited are returned as failures.
     *
     * @throws DirectoryNotFoundException if the root is not a directory
     */
    SourceListing listSourceFiles(Path root, Collection<String> extensions, Collection<String> excludePatterns);

    /**
     * Read all lines of a file as UTF-8. Malformed bytes are replaced, not fatal.
     *
     * @throws FileAccessException if the file cannot be read
     */
    List<String> readLines(Path file);

    /**
     * Candidate files plus the directories and files the walk could not visit.
     */
    record SourceListing(
        List<Path> files,
        List<FileFailure> failures
    ) {
        public SourceListing {
            files = List.copyOf(files);
            failures = List.copyOf(failures);
        }

        public static SourceListing of(List<Path> files) {
            return new SourceListing(files, List.of());
        }
    }
}
