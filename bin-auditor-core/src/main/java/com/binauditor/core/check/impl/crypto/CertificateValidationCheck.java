package com.binauditor.core.check.impl.crypto;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.crypto.Certificates;
import com.binauditor.core.crypto.ChainValidator;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.EmbeddedCertificate;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates the certificate chains embedded in signatures.
 *
 * <p>Every end-entity certificate (one that issued no other embedded certificate) must chain
 * to a configured trust anchor, or, when none is configured, to an embedded self-signed root.
 * All certificates on the chain must be valid at the evaluation time. A binary without
 * certificates fails unless {@code crypto.requireCertificate} is false.
 */
public class CertificateValidationCheck extends AbstractCheck {

    public static final String ID = "certificate-validation";

    public CertificateValidationCheck() {
        super(ID, "Embedded certificates chain-verify and are within their validity period");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        if (descriptor.certificates().isEmpty()) {
            if (context.config().crypto().requireCertificate()) {
                return fail("No embedded certificate found");
            }
            return pass("No embedded certificate found; certificates not required by configuration");
        }

        List<X509Certificate> certificates = new ArrayList<>();
        try {
            for (EmbeddedCertificate embedded : descriptor.certificates()) {
                certificates.add(Certificates.decode(embedded));
            }
        } catch (CertificateException e) {
            return fail("Embedded certificate could not be decoded: " + e.getMessage());
        }

        ChainValidator validator = new ChainValidator(context.trust());
        List<String> subjects = new ArrayList<>();
        for (X509Certificate leaf : leaves(certificates)) {
            ChainValidator.ChainResult chain = validator.validate(leaf, certificates, context.evaluationTime());
            String subject = leaf.getSubjectX500Principal().getName();
            subjects.add(subject);
            if (!chain.valid()) {
                log.debug("Chain for {} rejected: {}", subject, chain.detail());
                return fail(chain.detail(), metadata(
                    "subject", subject,
                    "chain_length", chain.path().size(),
                    "evaluated_at", context.evaluationTime().toString()));
            }
        }

        Map<String, Object> metadata = metadata(
            "certificates", certificates.size(),
            "subjects", subjects,
            "trust_anchors", context.trust().certificates().size(),
            "evaluated_at", context.evaluationTime().toString());
        return pass(subjects.size() + " certificate chain(s) valid"
            + (context.trust().certificates().isEmpty() ? " (internal roots)" : " (trusted anchors)"), metadata);
    }

    private static List<X509Certificate> leaves(List<X509Certificate> certificates) {
        List<X509Certificate> leaves = new ArrayList<>();
        for (X509Certificate candidate : certificates) {
            boolean issuedOther = certificates.stream().anyMatch(other -> other != candidate
                && !Certificates.isSelfSigned(other)
                && other.getIssuerX500Principal().equals(candidate.getSubjectX500Principal()));
            if (!issuedOther && !leaves.contains(candidate)) {
                leaves.add(candidate);
            }
        }
        if (leaves.isEmpty()) {
            leaves.add(ChainValidator.selectLeaf(certificates));
        }
        return leaves;
    }
}
