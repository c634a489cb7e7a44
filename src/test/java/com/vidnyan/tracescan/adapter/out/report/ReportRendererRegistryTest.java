package com.vidnyan.tracescan.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.tracescan.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportRendererRegistryTest {

    private final ReportRendererRegistry registry = new ReportRendererRegistry(
            List.of(new TextReportRenderer(), new JsonReportRenderer(new ObjectMapper())));

    @Test
    void forFormat_ShouldIgnoreCaseAndWhitespace() {
        assertInstanceOf(JsonReportRenderer.class, registry.forFormat(" JSON "));
        assertInstanceOf(TextReportRenderer.class, registry.forFormat("text"));
    }

    @Test
    void forFormat_ShouldRejectUnknownFormat() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.forFormat("xml"));

        assertEquals("Unknown report format 'xml'; available: [json, text]", e.getMessage());
        assertThrows(ConfigurationException.class, () -> registry.forFormat(null));
    }
}
