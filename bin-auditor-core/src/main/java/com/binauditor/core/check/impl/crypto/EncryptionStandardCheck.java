package com.binauditor.core.check.impl.crypto;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.inspect.ContentScanner;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.EmbeddedCertificate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Requires every cryptographic algorithm identifier found in the binary, in embedded strings,
 * signer digests and certificate signature algorithms, to be on the approved list.
 *
 * <p>Does not need a parsed descriptor: for unparseable files the identifiers from the
 * content scan are judged alone.
 */
public class EncryptionStandardCheck extends AbstractCheck {

    public static final String ID = "encryption-standard";

    private static final Pattern WITH = Pattern.compile("(?i)with");

    public EncryptionStandardCheck() {
        super(ID, "Only approved cryptographic algorithms are used");
    }

    @Override
    public boolean requiresDescriptor() {
        return false;
    }

    @Override
    public CheckResult execute(CheckContext context) {
        Set<String> found = new LinkedHashSet<>(context.binary().content().algorithmIdentifiers());
        BinaryDescriptor descriptor = context.descriptor();
        if (descriptor != null) {
            found.addAll(descriptor.algorithmIdentifiers());
            for (EmbeddedCertificate certificate : descriptor.certificates()) {
                found.addAll(splitSignatureAlgorithm(certificate.signatureAlgorithm()));
            }
        }
        if (found.isEmpty()) {
            return pass("No cryptographic algorithm identifiers found");
        }

        AuditConfig.CryptoPolicy policy = context.config().crypto();
        Set<String> approved = normalizeAll(policy.approvedAlgorithms());
        Set<String> deprecated = normalizeAll(policy.deprecatedAlgorithms());
        List<String> deprecatedFound = new ArrayList<>();
        List<String> unknownFound = new ArrayList<>();
        for (String algorithm : found) {
            if (approved.contains(algorithm)) {
                continue;
            }
            if (deprecated.contains(algorithm)) {
                deprecatedFound.add(algorithm);
            } else {
                unknownFound.add(algorithm);
            }
        }

        List<String> algorithms = List.copyOf(found);
        if (!deprecatedFound.isEmpty() || !unknownFound.isEmpty()) {
            List<String> problems = new ArrayList<>();
            if (!deprecatedFound.isEmpty()) {
                problems.add("deprecated: " + String.join(", ", deprecatedFound));
            }
            if (!unknownFound.isEmpty()) {
                problems.add("not approved: " + String.join(", ", unknownFound));
            }
            return fail(String.join("; ", problems), metadata(
                "algorithms", algorithms,
                "deprecated", deprecatedFound.isEmpty() ? null : deprecatedFound,
                "unapproved", unknownFound.isEmpty() ? null : unknownFound));
        }
        return pass("All " + found.size() + " algorithm(s) approved: " + String.join(", ", found),
            metadata("algorithms", algorithms));
    }

    /**
     * Splits a JCA signature algorithm name ({@code SHA256withRSA}) into normalized parts.
     */
    static List<String> splitSignatureAlgorithm(String name) {
        List<String> parts = new ArrayList<>();
        if (name == null || name.isBlank()) {
            return parts;
        }
        for (String part : WITH.split(name)) {
            if (!part.isBlank()) {
                String normalized = ContentScanner.normalizeAlgorithm(part.strip());
                parts.add("EC".equals(normalized) ? "ECDSA" : normalized);
            }
        }
        return parts;
    }

    private static Set<String> normalizeAll(List<String> names) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            normalized.add(ContentScanner.normalizeAlgorithm(name.strip().toUpperCase(Locale.ROOT)));
        }
        return normalized;
    }
}
