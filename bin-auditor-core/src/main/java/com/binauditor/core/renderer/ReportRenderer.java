package com.binauditor.core.renderer;

import com.binauditor.core.model.ComplianceReport;

/**
 * Interface for renderers that turn a compliance report into text for a terminal or a file.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.binauditor.core.renderer.ReportRenderer}
 *
 * @see ComplianceReport
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used as the value of the CLI {@code --format} option (e.g., "json", "text").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the report.
     *
     * @param report report to render
     * @return rendered text, ending with a newline
     */
    String render(ComplianceReport report);
}
