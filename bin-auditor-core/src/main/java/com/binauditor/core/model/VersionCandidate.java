package com.binauditor.core.model;

import java.util.Objects;

/**
 * A version string and the metadata field it was read from.
 *
 * @param source field name, e.g. {@code package-note.version} or {@code VS_FIXEDFILEINFO.FileVersion}
 * @param value raw value
 */
public record VersionCandidate(String source, String value) {

    /**
     * Compact constructor with validation.
     */
    public VersionCandidate {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
