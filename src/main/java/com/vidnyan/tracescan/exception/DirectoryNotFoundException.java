package com.vidnyan.tracescan.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Scan root does not exist or is not a directory.
 */
@Getter
public class DirectoryNotFoundException extends TraceScanException {

    private final Path root;

    public DirectoryNotFoundException(Path root) {
        super("Scan root is not a directory: " + root);
        this.root = root;
    }
}
