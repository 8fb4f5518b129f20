package com.binauditor.core.check;

import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.crypto.TrustMaterial;
import com.binauditor.core.inspect.InspectedBinary;
import com.binauditor.core.model.BinaryDescriptor;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only inputs shared by all checks of one run.
 *
 * @param binary inspected binary
 * @param config audit configuration
 * @param trust trusted certificates and keys
 * @param evaluationTime instant certificate validity is judged at
 */
public record CheckContext(
    InspectedBinary binary,
    AuditConfig config,
    TrustMaterial trust,
    Instant evaluationTime
) {
    public CheckContext {
        Objects.requireNonNull(binary, "binary must not be null");
        Objects.requireNonNull(evaluationTime, "evaluationTime must not be null");
        if (config == null) {
            config = AuditConfig.defaults();
        }
        if (trust == null) {
            trust = TrustMaterial.empty();
        }
    }

    /**
     * Parsed descriptor.
     *
     * @return descriptor, or null when the format could not be parsed
     */
    public BinaryDescriptor descriptor() {
        return binary.descriptor();
    }
}
