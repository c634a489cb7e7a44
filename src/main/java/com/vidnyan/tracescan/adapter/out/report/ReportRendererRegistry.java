package com.vidnyan.tracescan.adapter.out.report;

import com.vidnyan.tracescan.application.port.out.ReportRenderer;
import com.vidnyan.tracescan.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Selects a report renderer by format name.
 */
@Component
public class ReportRendererRegistry {

    private final Map<String, ReportRenderer> renderers = new TreeMap<>();

    public ReportRendererRegistry(List<ReportRenderer> renderers) {
        renderers.forEach(r -> this.renderers.put(r.format().toLowerCase(Locale.ROOT), r));
    }

    public ReportRenderer forFormat(String format) {
        String key = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        ReportRenderer renderer = renderers.get(key);
        if (renderer == null) {
            throw new ConfigurationException("Unknown report format '" + format + "'; available: " + renderers.keySet());
        }
        return renderer;
    }
}
