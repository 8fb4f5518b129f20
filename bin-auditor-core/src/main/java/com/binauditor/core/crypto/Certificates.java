package com.binauditor.core.crypto;

import com.binauditor.core.model.EmbeddedCertificate;

import java.io.ByteArrayInputStream;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

import javax.security.auth.x500.X500Principal;

/**
 * Conversions between JCA certificates and the descriptor's {@link EmbeddedCertificate}.
 */
public final class Certificates {

    private Certificates() {
    }

    public static EmbeddedCertificate describe(X509Certificate certificate) throws CertificateException {
        return new EmbeddedCertificate(
            certificate.getEncoded(),
            certificate.getSubjectX500Principal().getName(X500Principal.RFC2253),
            certificate.getIssuerX500Principal().getName(X500Principal.RFC2253),
            HexFormat.of().formatHex(certificate.getSerialNumber().toByteArray()).toLowerCase(Locale.ROOT),
            certificate.getNotBefore().toInstant(),
            certificate.getNotAfter().toInstant(),
            certificate.getSigAlgName()
        );
    }

    public static List<EmbeddedCertificate> describeAll(List<X509Certificate> certificates) throws CertificateException {
        List<EmbeddedCertificate> result = new ArrayList<>();
        for (X509Certificate certificate : certificates) {
            result.add(describe(certificate));
        }
        return result;
    }

    public static X509Certificate decode(EmbeddedCertificate certificate) throws CertificateException {
        return decode(certificate.encoded());
    }

    public static X509Certificate decode(byte[] der) throws CertificateException {
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
    }

    public static boolean isSelfSigned(X509Certificate certificate) {
        if (!certificate.getSubjectX500Principal().equals(certificate.getIssuerX500Principal())) {
            return false;
        }
        try {
            certificate.verify(certificate.getPublicKey());
            return true;
        } catch (GeneralSecurityException e) {
            return false;
        }
    }
}
