package com.binauditor.core.model;

import java.util.Locale;

/**
 * Supported SBOM document schemas.
 */
public enum SbomFormat {
    CYCLONEDX("cyclonedx"),
    SPDX("spdx");

    private final String id;

    SbomFormat(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a format by its identifier, ignoring case.
     *
     * @param id identifier such as {@code cyclonedx}
     * @return matching format
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static SbomFormat fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (SbomFormat format : values()) {
            if (format.id.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported SBOM format: " + id + " (supported: cyclonedx, spdx)");
    }
}
