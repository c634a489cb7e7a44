package com.vidnyan.tracescan.adapter.out.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.tracescan.application.port.out.ReportRenderer;
import com.vidnyan.tracescan.domain.finding.ScanResult;
import com.vidnyan.tracescan.exception.TraceScanException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON report: summary counts, findings and failures.
 */
@Component
@RequiredArgsConstructor
public class JsonReportRenderer implements ReportRenderer {

    public static final String FORMAT = "json";

    private final ObjectMapper objectMapper;

    @Override
    public String format() {
        return FORMAT;
    }

    @Override
    public String render(ScanResult result) {
        try {
            return objectMapper.writeValueAsString(ScanReport.of(result));
        } catch (JsonProcessingException e) {
            throw new TraceScanException("Cannot serialize scan result: " + e.getOriginalMessage(), e);
        }
    }
}
