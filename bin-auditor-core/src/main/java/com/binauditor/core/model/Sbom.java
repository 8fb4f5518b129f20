package com.binauditor.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A rendered software bill of materials.
 *
 * @param format document schema
 * @param schemaVersion schema version ({@code 1.5}, {@code SPDX-2.3})
 * @param components components in document order, root first
 * @param metadata generation metadata
 * @param document serialized JSON document
 */
public record Sbom(
    SbomFormat format,
    String schemaVersion,
    List<Component> components,
    SbomMetadata metadata,
    String document
) {
    /**
     * Compact constructor with validation.
     */
    public Sbom {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(schemaVersion, "schemaVersion must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(document, "document must not be null");
        components = components == null ? List.of() : List.copyOf(components);
    }
}
