package com.binauditor.core.inspect;

import java.util.List;
import java.util.Map;

/**
 * Facts gathered in one streaming pass over the whole file.
 *
 * @param size file size in bytes
 * @param digests lowercase hex digests keyed by algorithm ({@code SHA-256}, {@code SHA-512})
 * @param licenseTags values of {@code SPDX-License-Identifier:} tags in embedded strings
 * @param algorithmIdentifiers normalized cryptographic algorithm names found in embedded strings
 */
public record ContentFacts(
    long size,
    Map<String, String> digests,
    List<String> licenseTags,
    List<String> algorithmIdentifiers
) {
    public ContentFacts {
        digests = digests == null ? Map.of() : Map.copyOf(digests);
        licenseTags = licenseTags == null ? List.of() : List.copyOf(licenseTags);
        algorithmIdentifiers = algorithmIdentifiers == null ? List.of() : List.copyOf(algorithmIdentifiers);
    }

    public String sha256() {
        return digests.get(ContentScanner.SHA_256);
    }
}
