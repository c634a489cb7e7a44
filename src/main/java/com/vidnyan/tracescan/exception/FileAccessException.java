package com.vidnyan.tracescan.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A source file could not be opened or read.
 */
@Getter
public class FileAccessException extends TraceScanException {

    private final Path file;

    public FileAccessException(Path file, Throwable cause) {
        super("Cannot read " + file + ": " + describe(cause), cause);
        this.file = file;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? cause.getClass().getSimpleName() + " " + message
                : cause.getClass().getSimpleName();
    }
}
