package com.binauditor.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One SBOM entry: the audited binary or one of its declared dependencies.
 *
 * @param type application (the audited binary) or library
 * @param name component name, unique within an SBOM
 * @param version version string, or null if unknown
 * @param digests hex digests keyed by algorithm name ({@code SHA-256})
 * @param licenses declared license expressions
 * @param dependencies names of components this one depends on
 */
public record Component(
    ComponentType type,
    String name,
    String version,
    Map<String, String> digests,
    List<String> licenses,
    List<String> dependencies
) {
    /**
     * Compact constructor with validation.
     */
    public Component {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        digests = digests == null ? Map.of() : Map.copyOf(digests);
        licenses = licenses == null ? List.of() : List.copyOf(licenses);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
