package com.vidnyan.tracescan.exception;

/**
 * Base type of all scanner errors.
 */
public class TraceScanException extends RuntimeException {

    public TraceScanException(String message) {
        super(message);
    }

    public TraceScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
