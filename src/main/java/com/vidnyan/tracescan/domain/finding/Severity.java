package com.vidnyan.tracescan.domain.finding;

/**
 * Finding severity levels.
 */
public enum Severity {
    HIGH,    // No guard at all, likely crash
    MEDIUM,  // Partially mitigated or context-dependent crash
    LOW      // Advisory, no direct crash risk
}
