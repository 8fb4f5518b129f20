package com.binauditor.core.renderer.impl;

import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.ComplianceReport;
import com.binauditor.core.renderer.ReportRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.time.format.DateTimeFormatter;

/**
 * Renders a report as pretty-printed JSON with snake_case field names.
 *
 * <p>Durations are ISO-8601 ({@code PT0.042S}); the timestamp is RFC 3339 in UTC.
 * {@code metadata} and {@code sbom_path} are omitted when empty.
 */
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String render(ComplianceReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(report))
                + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize compliance report", e);
        }
    }

    /**
     * Builds the JSON tree of a report.
     *
     * @param report report
     * @return root node
     */
    public ObjectNode toTree(ComplianceReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(report.timestamp()));
        root.put("binary_path", report.binaryPath());
        root.put("binary_hash", report.binaryHash());
        root.put("format", report.format().displayName());
        root.put("total_checks", report.totalChecks());
        root.put("passed_checks", report.passedChecks());
        root.put("failed_checks", report.failedChecks());
        root.put("partial", report.partial());

        ArrayNode results = root.putArray("results");
        for (CheckResult result : report.results()) {
            ObjectNode node = results.addObject();
            node.put("check_id", result.checkId());
            node.put("description", result.description());
            node.put("status", result.status().label());
            node.put("details", result.details());
            if (!result.metadata().isEmpty()) {
                node.set("metadata", objectMapper.valueToTree(result.metadata()));
            }
            node.put("duration", result.duration().toString());
        }

        root.put("duration", report.duration().toString());
        if (report.sbomPath() != null) {
            root.put("sbom_path", report.sbomPath());
        }
        return root;
    }
}
