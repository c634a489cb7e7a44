package com.vidnyan.tracescan.exception;

/**
 * Invalid scanner setup: no rules, unknown rule names or report formats.
 * Raised before any file is scanned.
 */
public class ConfigurationException extends TraceScanException {

    public ConfigurationException(String message) {
        super(message);
    }
}
