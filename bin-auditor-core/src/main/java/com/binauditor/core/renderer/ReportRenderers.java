package com.binauditor.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;

/**
 * Lookup of the report renderers available on the class path.
 */
public final class ReportRenderers {

    private ReportRenderers() {
    }

    public static List<ReportRenderer> discover() {
        List<ReportRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ReportRenderer.class, ReportRenderers.class.getClassLoader()).forEach(renderers::add);
        return renderers;
    }

    /**
     * Finds a renderer by identifier, ignoring case.
     *
     * @param id renderer identifier
     * @return renderer
     * @throws IllegalArgumentException if no renderer has that identifier
     */
    public static ReportRenderer forId(String id) {
        String wanted = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        List<ReportRenderer> renderers = discover();
        return renderers.stream()
            .filter(renderer -> renderer.getId().equals(wanted))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Invalid output format: " + id + " (supported: "
                + String.join(", ", renderers.stream().map(ReportRenderer::getId).toList()) + ")"));
    }
}
