package com.vidnyan.tracescan.adapter.out.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.tracescan.config.TraceScanConfiguration;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportRendererTest {

    private final ObjectMapper objectMapper = new TraceScanConfiguration().objectMapper();
    private final JsonReportRenderer renderer = new JsonReportRenderer(objectMapper);

    @Test
    void render_ShouldSerializeSummaryFindingsAndFailures() throws Exception {
        // Act
        JsonNode json = objectMapper.readTree(renderer.render(ReportFixtures.sampleResult()));

        // Assert
        assertThat(json.get("root").asText()).isEqualTo("/repo");
        assertThat(json.at("/summary/filesScanned").asInt()).isEqualTo(3);
        assertThat(json.at("/summary/high").asInt()).isEqualTo(1);
        assertThat(json.at("/summary/low").asInt()).isEqualTo(1);
        assertThat(json.get("findings")).hasSize(2);
        assertThat(json.at("/findings/0/lineNumber").asInt()).isEqualTo(2);
        assertThat(json.at("/findings/0/severity").asText()).isEqualTo("HIGH");
        assertThat(json.at("/findings/0/ruleName").asText()).isEqualTo("nullable-dereference");
        assertThat(json.at("/failures/0/filePath").asText()).isEqualTo("app/Broken.kt");
    }

    @Test
    void format_ShouldBeJson() {
        assertThat(renderer.format()).isEqualTo(JsonReportRenderer.FORMAT);
    }
}
