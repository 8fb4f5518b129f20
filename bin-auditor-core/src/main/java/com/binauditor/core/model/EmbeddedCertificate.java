package com.binauditor.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An X.509 certificate found inside a signature structure of the binary.
 *
 * @param encoded DER encoding
 * @param subject subject distinguished name (RFC 2253)
 * @param issuer issuer distinguished name (RFC 2253)
 * @param serialNumber serial number in hex
 * @param notBefore start of validity
 * @param notAfter end of validity
 * @param signatureAlgorithm JCA name of the algorithm the issuer signed with
 */
public record EmbeddedCertificate(
    byte[] encoded,
    String subject,
    String issuer,
    String serialNumber,
    Instant notBefore,
    Instant notAfter,
    String signatureAlgorithm
) {
    /**
     * Compact constructor with validation.
     */
    public EmbeddedCertificate {
        Objects.requireNonNull(encoded, "encoded must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(issuer, "issuer must not be null");
        Objects.requireNonNull(notBefore, "notBefore must not be null");
        Objects.requireNonNull(notAfter, "notAfter must not be null");
        encoded = encoded.clone();
    }

    @Override
    public byte[] encoded() {
        return encoded.clone();
    }

    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(notBefore) && !instant.isAfter(notAfter);
    }

    public boolean isSelfIssued() {
        return subject.equals(issuer);
    }
}
