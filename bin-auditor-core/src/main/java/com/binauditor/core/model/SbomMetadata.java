package com.binauditor.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Generation metadata of an SBOM. The timestamp is supplied by the caller so that
 * encoding stays a pure function.
 *
 * @param timestamp generation time
 * @param toolName generating tool
 * @param toolVersion generating tool version
 */
public record SbomMetadata(Instant timestamp, String toolName, String toolVersion) {

    /**
     * Compact constructor with validation.
     */
    public SbomMetadata {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(toolVersion, "toolVersion must not be null");
    }
}
