package com.vidnyan.tracescan.domain.finding;

/**
 * A file that could not be read or analyzed during a scan.
 */
public record FileFailure(String filePath, String reason) {
}
