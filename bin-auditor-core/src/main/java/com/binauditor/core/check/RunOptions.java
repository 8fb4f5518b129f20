package com.binauditor.core.check;

import com.binauditor.core.config.AuditConfig;

import java.time.Duration;

/**
 * Worker pool size and deadline for a compliance run.
 *
 * @param parallelism number of worker threads, at least 1
 * @param timeout deadline measured from the start of the run; {@link Duration#ZERO} for none
 */
public record RunOptions(int parallelism, Duration timeout) {

    public RunOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        if (timeout == null) {
            timeout = Duration.ZERO;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    public static RunOptions defaults() {
        return from(AuditConfig.defaults());
    }

    public static RunOptions from(AuditConfig config) {
        return new RunOptions(config.runner().parallelism(), Duration.ofSeconds(config.runner().timeoutSeconds()));
    }

    public boolean hasDeadline() {
        return !timeout.isZero();
    }
}
