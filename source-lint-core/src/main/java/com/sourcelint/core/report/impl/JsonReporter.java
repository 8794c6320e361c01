package com.sourcelint.core.report.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sourcelint.core.model.Location;
import com.sourcelint.core.model.Violation;
import com.sourcelint.core.report.ViolationReporter;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reports violations as a JSON array.
 *
 * <p><b>Example output:</b>
 * <pre>{@code
 * [ {
 *   "character" : null,
 *   "file" : "Sources/App.swift",
 *   "line" : 12,
 *   "reason" : "Line should be 120 characters or less: currently 134 characters",
 *   "rule_id" : "line_length",
 *   "severity" : "Warning",
 *   "type" : "Line Length"
 * } ]
 * }</pre>
 */
public class JsonReporter implements ViolationReporter {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDescription() {
        return "Reports violations as a JSON array";
    }

    @Override
    public String generateReport(List<Violation> violations) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Violation violation : violations) {
            Location location = violation.location();
            ObjectNode node = array.addObject();
            node.put("character", location.character());
            node.put("file", location.file());
            node.put("line", location.line());
            node.put("reason", violation.reason());
            node.put("rule_id", violation.ruleId());
            node.put("severity", capitalize(violation.severity().identifier()));
            node.put("type", violation.ruleName());
        }
        try {
            return objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize violations", e);
        }
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
