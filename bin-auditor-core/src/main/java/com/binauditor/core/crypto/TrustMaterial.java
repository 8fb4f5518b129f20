package com.binauditor.core.crypto;

import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.List;

/**
 * Trusted certificates and bare public keys configured for signature and chain validation.
 *
 * @param certificates trusted certificates, used as PKIX trust anchors
 * @param publicKeys trusted bare public keys
 */
public record TrustMaterial(List<X509Certificate> certificates, List<PublicKey> publicKeys) {

    public TrustMaterial {
        certificates = certificates == null ? List.of() : List.copyOf(certificates);
        publicKeys = publicKeys == null ? List.of() : List.copyOf(publicKeys);
    }

    public static TrustMaterial empty() {
        return new TrustMaterial(List.of(), List.of());
    }

    public boolean isEmpty() {
        return certificates.isEmpty() && publicKeys.isEmpty();
    }

    /**
     * Checks whether the key is configured directly, either bare or as the key of a trusted
     * certificate.
     */
    public boolean trustsKey(PublicKey key) {
        byte[] encoded = key.getEncoded();
        for (PublicKey trusted : publicKeys) {
            if (Arrays.equals(trusted.getEncoded(), encoded)) {
                return true;
            }
        }
        for (X509Certificate trusted : certificates) {
            if (Arrays.equals(trusted.getPublicKey().getEncoded(), encoded)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return certificates.size() + publicKeys.size();
    }
}
