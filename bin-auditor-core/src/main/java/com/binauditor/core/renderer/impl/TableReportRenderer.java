package com.binauditor.core.renderer.impl;

import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.ComplianceReport;
import com.binauditor.core.renderer.ReportRenderer;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a report as an aligned, human-readable table followed by the details of every
 * failed check.
 */
public class TableReportRenderer implements ReportRenderer {

    static final int MAX_DETAILS = 50;

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
    private static final String[] HEADERS = {"CHECK ID", "STATUS", "DESCRIPTION", "DETAILS"};
    private static final String NL = System.lineSeparator();

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String render(ComplianceReport report) {
        StringBuilder out = new StringBuilder();
        out.append("BinAuditor Compliance Report").append(NL);
        out.append("============================").append(NL).append(NL);
        out.append("Binary: ").append(report.binaryPath()).append(NL);
        out.append("Format: ").append(report.format().displayName()).append(NL);
        out.append("Hash: ").append(report.binaryHash()).append(NL);
        out.append("Timestamp: ").append(TIMESTAMP.format(report.timestamp())).append(NL);
        out.append("Duration: ").append(report.duration().toMillis()).append(" ms").append(NL).append(NL);
        out.append("Summary: ").append(report.passedChecks()).append('/').append(report.totalChecks())
            .append(" checks passed");
        if (report.partial()) {
            out.append(" (partial run: some checks did not start)");
        }
        out.append(NL);
        if (report.sbomPath() != null) {
            out.append("SBOM: ").append(report.sbomPath()).append(NL);
        }
        out.append(NL);

        List<String[]> rows = new ArrayList<>();
        rows.add(HEADERS);
        rows.add(new String[] {"--------", "------", "-----------", "-------"});
        for (CheckResult result : report.results()) {
            rows.add(new String[] {
                result.checkId(),
                result.passed() ? "✓ PASS" : "✗ FAIL",
                result.description(),
                truncate(result.details())
            });
        }
        appendTable(out, rows);

        if (report.failedChecks() > 0) {
            out.append(NL).append("Failed Checks Details:").append(NL);
            out.append("======================").append(NL);
            for (CheckResult result : report.failedResults()) {
                out.append(NL).append(result.checkId()).append(": ").append(result.description()).append(NL);
                out.append("Details: ").append(result.details()).append(NL);
                if (!result.metadata().isEmpty()) {
                    out.append("Metadata:").append(NL);
                    for (Map.Entry<String, Object> entry : result.metadata().entrySet()) {
                        out.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append(NL);
                    }
                }
            }
        }
        return out.toString();
    }

    static String truncate(String details) {
        String singleLine = details.replace('\n', ' ').replace('\r', ' ');
        if (singleLine.length() > MAX_DETAILS) {
            return singleLine.substring(0, MAX_DETAILS - 3) + "...";
        }
        return singleLine;
    }

    private static void appendTable(StringBuilder out, List<String[]> rows) {
        int[] widths = new int[HEADERS.length];
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }
        for (String[] row : rows) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < row.length; i++) {
                line.append(row[i]);
                if (i < row.length - 1) {
                    line.append(" ".repeat(widths[i] - row[i].length() + 2));
                }
            }
            out.append(line.toString().stripTrailing()).append(NL);
        }
    }
}
