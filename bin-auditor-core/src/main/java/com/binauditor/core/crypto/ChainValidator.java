package com.binauditor.core.crypto;

import java.security.GeneralSecurityException;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateFactory;
import java.security.cert.PKIXParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates embedded certificate chains.
 *
 * <p>With configured trust anchors the chain is checked by the JDK's PKIX validator with
 * revocation checking disabled. Without anchors the chain must be internally consistent:
 * every certificate signed by the next one, ending in a self-signed root. In both cases every
 * certificate must be within its validity window at the evaluation time.
 */
public final class ChainValidator {

    private static final int MAX_CHAIN = 10;

    /**
     * Outcome of a chain validation.
     *
     * @param valid whether the chain is acceptable
     * @param detail explanation
     * @param path certificates from the leaf upward
     */
    public record ChainResult(boolean valid, String detail, List<X509Certificate> path) {
        public ChainResult {
            path = path == null ? List.of() : List.copyOf(path);
        }
    }

    private final TrustMaterial trust;

    public ChainValidator(TrustMaterial trust) {
        this.trust = trust;
    }

    /**
     * Validates the chain starting at {@code leaf}, using the other certificates as candidates
     * for intermediates.
     */
    public ChainResult validate(X509Certificate leaf, List<X509Certificate> pool, Instant at) {
        List<X509Certificate> path = buildPath(leaf, pool);
        for (X509Certificate certificate : path) {
            try {
                certificate.checkValidity(Date.from(at));
            } catch (GeneralSecurityException e) {
                return new ChainResult(false, "Certificate '" + subject(certificate) + "' is not valid at "
                    + at + " (valid " + certificate.getNotBefore().toInstant() + " to "
                    + certificate.getNotAfter().toInstant() + ")", path);
            }
        }
        if (!trust.certificates().isEmpty()) {
            return validatePkix(path, at);
        }
        return validateInternally(path);
    }

    /**
     * Picks the end-entity certificate: the one that issued no other certificate in the set.
     */
    public static X509Certificate selectLeaf(List<X509Certificate> certificates) {
        for (X509Certificate candidate : certificates) {
            boolean issuedOther = false;
            for (X509Certificate other : certificates) {
                if (other != candidate
                    && other.getIssuerX500Principal().equals(candidate.getSubjectX500Principal())
                    && !Certificates.isSelfSigned(other)) {
                    issuedOther = true;
                    break;
                }
            }
            if (!issuedOther) {
                return candidate;
            }
        }
        return certificates.get(0);
    }

    private static List<X509Certificate> buildPath(X509Certificate leaf, List<X509Certificate> pool) {
        List<X509Certificate> path = new ArrayList<>();
        X509Certificate current = leaf;
        while (current != null && path.size() < MAX_CHAIN && !path.contains(current)) {
            path.add(current);
            if (Certificates.isSelfSigned(current)) {
                break;
            }
            current = findIssuer(current, pool);
        }
        return path;
    }

    private static X509Certificate findIssuer(X509Certificate certificate, List<X509Certificate> pool) {
        for (X509Certificate candidate : pool) {
            if (candidate.getSubjectX500Principal().equals(certificate.getIssuerX500Principal())) {
                try {
                    certificate.verify(candidate.getPublicKey());
                    return candidate;
                } catch (GeneralSecurityException e) {
                    // keep looking; several certificates may share a subject
                }
            }
        }
        return null;
    }

    private ChainResult validatePkix(List<X509Certificate> path, Instant at) {
        Set<TrustAnchor> anchors = new HashSet<>();
        for (X509Certificate anchor : trust.certificates()) {
            anchors.add(new TrustAnchor(anchor, null));
        }
        List<X509Certificate> untrusted = new ArrayList<>();
        for (X509Certificate certificate : path) {
            if (trust.certificates().contains(certificate)) {
                break;
            }
            untrusted.add(certificate);
        }
        if (untrusted.isEmpty()) {
            return new ChainResult(true, "Certificate '" + subject(path.get(0)) + "' is a configured trust anchor", path);
        }
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            CertPath certPath = factory.generateCertPath(untrusted);
            PKIXParameters parameters = new PKIXParameters(anchors);
            parameters.setRevocationEnabled(false);
            parameters.setDate(Date.from(at));
            CertPathValidator.getInstance("PKIX").validate(certPath, parameters);
            return new ChainResult(true, "Chain of " + path.size() + " certificate(s) anchored at a trusted certificate", path);
        } catch (CertPathValidatorException e) {
            return new ChainResult(false, "Chain does not validate against trusted certificates: " + e.getMessage(), path);
        } catch (GeneralSecurityException e) {
            return new ChainResult(false, "Chain validation could not run: " + e.getMessage(), path);
        }
    }

    private static ChainResult validateInternally(List<X509Certificate> path) {
        X509Certificate top = path.get(path.size() - 1);
        if (!Certificates.isSelfSigned(top)) {
            return new ChainResult(false, "Chain is incomplete: issuer of '" + subject(top) + "' is not embedded", path);
        }
        return new ChainResult(true, "Chain of " + path.size() + " certificate(s) ends at self-signed root '"
            + subject(top) + "'", path);
    }

    static String subject(X509Certificate certificate) {
        return certificate.getSubjectX500Principal().getName();
    }
}
