package com.binauditor.core.model;

import java.util.Objects;

/**
 * A checksum the binary declares over its own content.
 *
 * @param algorithm checksum algorithm
 * @param expected declared value, lowercase hex
 * @param region file bytes holding the declared value; excluded from the computation
 * @param coverage file bytes the checksum covers
 */
public record DeclaredChecksum(
    ChecksumAlgorithm algorithm,
    String expected,
    ByteRange region,
    ByteRange coverage
) {
    /**
     * Compact constructor with validation.
     */
    public DeclaredChecksum {
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(region, "region must not be null");
        Objects.requireNonNull(coverage, "coverage must not be null");
    }
}
