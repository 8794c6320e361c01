package com.sourcelint.core.report.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcelint.core.model.Location;
import com.sourcelint.core.model.Severity;
import com.sourcelint.core.model.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JsonReporter}.
 */
class JsonReporterTest {

    private final JsonReporter reporter = new JsonReporter();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void generateReport_writesOneObjectPerViolation() throws Exception {
        Violation violation = new Violation("object_literal", "Object Literal", Severity.ERROR,
            Location.atOffset("App.swift", 12, 1, 13), "Prefer object literals over image and color inits.");

        JsonNode report = objectMapper.readTree(reporter.generateReport(List.of(violation)));

        assertThat(report.isArray()).isTrue();
        assertThat(report).hasSize(1);
        JsonNode entry = report.get(0);
        assertThat(entry.get("file").asText()).isEqualTo("App.swift");
        assertThat(entry.get("line").asInt()).isEqualTo(1);
        assertThat(entry.get("character").asInt()).isEqualTo(13);
        assertThat(entry.get("rule_id").asText()).isEqualTo("object_literal");
        assertThat(entry.get("type").asText()).isEqualTo("Object Literal");
        assertThat(entry.get("severity").asText()).isEqualTo("Error");
        assertThat(entry.get("reason").asText()).isEqualTo("Prefer object literals over image and color inits.");
    }

    @Test
    void generateReport_lineLocation_writesNullCharacter() throws Exception {
        Violation violation = new Violation("line_length", "Line Length", Severity.WARNING,
            Location.atLine("App.swift", 4), "too long");

        JsonNode entry = objectMapper.readTree(reporter.generateReport(List.of(violation))).get(0);

        assertThat(entry.get("character").isNull()).isTrue();
        assertThat(entry.get("line").asInt()).isEqualTo(4);
    }

    @Test
    void generateReport_noViolations_writesEmptyArray() throws Exception {
        assertThat(objectMapper.readTree(reporter.generateReport(List.of()))).isEmpty();
    }
}
