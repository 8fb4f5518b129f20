package com.binauditor.core.check;

import com.binauditor.core.model.CheckResult;

/**
 * A named rule evaluated against an inspected binary, yielding pass or fail.
 *
 * <p>Checks are discovered via Java Service Provider Interface (SPI) and constructed once.
 * Implementations must be stateless: the runner calls {@link #execute(CheckContext)} from
 * worker threads, possibly for several binaries at once.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.binauditor.core.check.ComplianceCheck}. The order of that
 * file is the order of results in every report.
 *
 * @see CheckContext
 * @see CheckRegistry
 */
public interface ComplianceCheck {

    /**
     * Returns unique identifier for this check.
     *
     * <p>Kebab-case, stable across releases (e.g., "file-signature", "hash-integrity").
     *
     * @return unique check identifier
     */
    String getId();

    /**
     * Returns a one-line human description used in reports.
     *
     * @return description
     */
    String getDescription();

    /**
     * Whether the check needs a parsed {@link com.binauditor.core.model.BinaryDescriptor}.
     *
     * <p>When the format is unknown or malformed, the runner does not call checks that
     * return {@code true} and records a failing result for them instead.
     *
     * @return true if the check depends on the container format
     */
    default boolean requiresDescriptor() {
        return true;
    }

    /**
     * Evaluates the rule.
     *
     * @param context inspected binary, configuration and trust material
     * @return the result; never null
     */
    CheckResult execute(CheckContext context);
}
