package com.vidnyan.tracescan.application.port.out;

import com.vidnyan.tracescan.domain.finding.ScanResult;

/**
 * Port for turning a scan result into a report document.
 * Implementations are pure functions of the result.
 */
public interface ReportRenderer {

    /**
     * Format name used for selection, e.g. "text".
     */
    String format();

    String render(ScanResult result);
}
