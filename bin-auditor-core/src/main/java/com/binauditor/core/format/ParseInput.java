package com.binauditor.core.format;

import java.util.List;
import java.util.Map;

/**
 * Whole-file facts handed to a parser.
 *
 * @param digests full-file digests keyed by algorithm name
 * @param licenseTags SPDX license tags found in embedded strings
 * @param algorithmIdentifiers algorithm identifiers found in embedded strings
 */
public record ParseInput(
    Map<String, String> digests,
    List<String> licenseTags,
    List<String> algorithmIdentifiers
) {
    public ParseInput {
        digests = digests == null ? Map.of() : Map.copyOf(digests);
        licenseTags = licenseTags == null ? List.of() : List.copyOf(licenseTags);
        algorithmIdentifiers = algorithmIdentifiers == null ? List.of() : List.copyOf(algorithmIdentifiers);
    }

    public static ParseInput empty() {
        return new ParseInput(Map.of(), List.of(), List.of());
    }
}
