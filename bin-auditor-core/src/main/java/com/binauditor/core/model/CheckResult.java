package com.binauditor.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a single compliance check.
 *
 * @param checkId identifier of the check
 * @param description human description of the check
 * @param status pass or fail
 * @param details free-text explanation
 * @param metadata optional structured facts (string, number, boolean or list values) in insertion order
 * @param duration execution time
 */
public record CheckResult(
    String checkId,
    String description,
    CheckStatus status,
    String details,
    Map<String, Object> metadata,
    Duration duration
) {
    /**
     * Compact constructor with validation.
     */
    public CheckResult {
        Objects.requireNonNull(checkId, "checkId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (description == null) {
            description = "";
        }
        if (details == null) {
            details = "";
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public static CheckResult pass(String checkId, String description, String details, Map<String, Object> metadata) {
        return new CheckResult(checkId, description, CheckStatus.PASS, details, metadata, Duration.ZERO);
    }

    public static CheckResult fail(String checkId, String description, String details, Map<String, Object> metadata) {
        return new CheckResult(checkId, description, CheckStatus.FAIL, details, metadata, Duration.ZERO);
    }

    public boolean passed() {
        return status == CheckStatus.PASS;
    }

    public CheckResult withDuration(Duration elapsed) {
        return new CheckResult(checkId, description, status, details, metadata, elapsed);
    }
}
