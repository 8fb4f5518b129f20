package com.binauditor.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated outcome of a compliance run.
 *
 * <p>Invariant: {@code totalChecks == passedChecks + failedChecks == results.size()}.
 * Results are in check registration order.
 *
 * @param timestamp when the run started (UTC)
 * @param binaryPath absolute path of the audited binary
 * @param binaryHash SHA-256 of the whole file, lowercase hex
 * @param format detected container format
 * @param totalChecks number of completed checks
 * @param passedChecks number of passing checks
 * @param failedChecks number of failing checks
 * @param results completed check results in registration order
 * @param duration wall-clock duration of the run
 * @param partial true if cancellation or the deadline prevented some checks from starting
 * @param sbomPath where the SBOM generated alongside this report was written, or null
 */
public record ComplianceReport(
    Instant timestamp,
    String binaryPath,
    String binaryHash,
    BinaryFormat format,
    int totalChecks,
    int passedChecks,
    int failedChecks,
    List<CheckResult> results,
    Duration duration,
    boolean partial,
    String sbomPath
) {
    /**
     * Compact constructor with validation.
     */
    public ComplianceReport {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(binaryPath, "binaryPath must not be null");
        Objects.requireNonNull(format, "format must not be null");
        results = results == null ? List.of() : List.copyOf(results);
        if (totalChecks != results.size() || passedChecks + failedChecks != totalChecks) {
            throw new IllegalArgumentException("Inconsistent check counts: total=" + totalChecks
                + ", passed=" + passedChecks + ", failed=" + failedChecks + ", results=" + results.size());
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    /**
     * Creates a report with counts derived from the results.
     *
     * @param timestamp run start
     * @param binaryPath audited path
     * @param binaryHash content hash
     * @param format detected format
     * @param results ordered results
     * @param duration wall-clock duration
     * @param partial whether some checks never started
     * @return report
     */
    public static ComplianceReport of(Instant timestamp, String binaryPath, String binaryHash, BinaryFormat format,
                                      List<CheckResult> results, Duration duration, boolean partial) {
        int passed = (int) results.stream().filter(CheckResult::passed).count();
        return new ComplianceReport(timestamp, binaryPath, binaryHash, format, results.size(), passed,
            results.size() - passed, results, duration, partial, null);
    }

    /**
     * Overall verdict.
     *
     * @return true iff no check failed and every registered check ran
     */
    public boolean isPassing() {
        return failedChecks == 0 && !partial;
    }

    public List<CheckResult> failedResults() {
        return results.stream().filter(r -> !r.passed()).toList();
    }

    public Optional<CheckResult> result(String checkId) {
        return results.stream().filter(r -> r.checkId().equals(checkId)).findFirst();
    }

    public ComplianceReport withSbomPath(String path) {
        return new ComplianceReport(timestamp, binaryPath, binaryHash, format, totalChecks, passedChecks,
            failedChecks, results, duration, partial, path);
    }
}
