package com.binauditor.core.testing;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces DER {@code ContentInfo/SignedData} blobs with RSA/SHA-256 signers for fixtures.
 *
 * <p>Three shapes are supported:
 * <ul>
 *   <li>{@link #detached}: signature directly over external content</li>
 *   <li>{@link #detachedWithAttributes}: signature over signed attributes carrying the
 *       content's {@code messageDigest}</li>
 *   <li>{@link #authenticode}: {@code SpcIndirectDataContent} embedded, holding an image digest</li>
 * </ul>
 */
public final class CmsTestSigner {

    static final String SIGNED_DATA = "1.2.840.113549.1.7.2";
    static final String DATA = "1.2.840.113549.1.7.1";
    static final String CONTENT_TYPE = "1.2.840.113549.1.9.3";
    static final String MESSAGE_DIGEST = "1.2.840.113549.1.9.4";
    static final String SPC_INDIRECT_DATA = "1.3.6.1.4.1.311.2.1.4";
    static final String SPC_PE_IMAGE_DATA = "1.3.6.1.4.1.311.2.1.15";
    static final String SHA256 = "2.16.840.1.101.3.4.2.1";
    static final String SHA256_WITH_RSA = "1.2.840.113549.1.1.11";

    private final PrivateKey key;
    private final X509Certificate signer;
    private final List<X509Certificate> certificates = new ArrayList<>();

    private CmsTestSigner(PrivateKey key, X509Certificate signer) {
        this.key = key;
        this.signer = signer;
        this.certificates.add(signer);
    }

    /** Signer using the CA-issued test leaf, embedding the leaf and the CA. */
    public static CmsTestSigner trustedLeaf() {
        return new CmsTestSigner(TestKeys.leafKey(), TestKeys.leaf()).withCertificate(TestKeys.ca());
    }

    /** Signer using the self-signed rogue certificate. */
    public static CmsTestSigner rogue() {
        return new CmsTestSigner(TestKeys.rogueKey(), TestKeys.rogue());
    }

    public static CmsTestSigner of(PrivateKey key, X509Certificate signer) {
        return new CmsTestSigner(key, signer);
    }

    public CmsTestSigner withCertificate(X509Certificate certificate) {
        certificates.add(certificate);
        return this;
    }

    public byte[] detached(byte[] content) {
        byte[] encap = sequence(oid(DATA));
        return signedData(encap, signerInfo(null, sign(content)));
    }

    public byte[] detachedWithAttributes(byte[] content) {
        byte[] attributes = concat(
            sequence(oid(CONTENT_TYPE), set(oid(DATA))),
            sequence(oid(MESSAGE_DIGEST), set(octetString(sha256(content)))));
        byte[] encap = sequence(oid(DATA));
        // signed over the SET encoding, stored as [0] IMPLICIT
        return signedData(encap, signerInfo(tlv(0xA0, attributes), sign(tlv(0x31, attributes))));
    }

    /**
     * Authenticode-style blob binding {@code imageDigest} (SHA-256 of the image, excluding the
     * checksum field, the security directory entry and the certificate table).
     */
    public byte[] authenticode(byte[] imageDigest) {
        byte[] indirectContent = concat(
            sequence(oid(SPC_PE_IMAGE_DATA), sequence()),
            sequence(algorithm(SHA256), octetString(imageDigest)));
        byte[] encap = sequence(oid(SPC_INDIRECT_DATA), tlv(0xA0, tlv(0x30, indirectContent)));
        return signedData(encap, signerInfo(null, sign(indirectContent)));
    }

    private byte[] signedData(byte[] encapsulated, byte[] signerInfo) {
        byte[] certs = new byte[0];
        for (X509Certificate certificate : certificates) {
            certs = concat(certs, encoded(certificate));
        }
        byte[] signedData = sequence(
            integer(BigInteger.ONE),
            set(algorithm(SHA256)),
            encapsulated,
            tlv(0xA0, certs),
            set(signerInfo));
        return sequence(oid(SIGNED_DATA), tlv(0xA0, signedData));
    }

    private byte[] signerInfo(byte[] signedAttributes, byte[] signature) {
        byte[] issuerAndSerial = sequence(
            signer.getIssuerX500Principal().getEncoded(),
            integer(signer.getSerialNumber()));
        return sequence(
            integer(BigInteger.ONE),
            issuerAndSerial,
            algorithm(SHA256),
            signedAttributes == null ? new byte[0] : signedAttributes,
            algorithm(SHA256_WITH_RSA),
            octetString(signature));
    }

    private byte[] sign(byte[] content) {
        try {
            Signature signature = Signature.getInstance("SHA256withRSA");
            signature.initSign(key);
            signature.update(content);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    public static byte[] sha256(byte[] content) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(content);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    private static byte[] encoded(X509Certificate certificate) {
        try {
            return certificate.getEncoded();
        } catch (CertificateEncodingException e) {
            throw new IllegalStateException(e);
        }
    }

    // ==================== DER ====================

    static byte[] algorithm(String oid) {
        return sequence(oid(oid), new byte[] {0x05, 0x00});
    }

    static byte[] sequence(byte[]... parts) {
        return tlv(0x30, concat(parts));
    }

    static byte[] set(byte[]... parts) {
        return tlv(0x31, concat(parts));
    }

    static byte[] octetString(byte[] value) {
        return tlv(0x04, value);
    }

    static byte[] integer(BigInteger value) {
        return tlv(0x02, value.toByteArray());
    }

    static byte[] oid(String dotted) {
        String[] arcs = dotted.split("\\.");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeBase128(out, Long.parseLong(arcs[0]) * 40 + Long.parseLong(arcs[1]));
        for (int i = 2; i < arcs.length; i++) {
            writeBase128(out, Long.parseLong(arcs[i]));
        }
        return tlv(0x06, out.toByteArray());
    }

    private static void writeBase128(ByteArrayOutputStream out, long value) {
        int groups = 1;
        for (long v = value >>> 7; v != 0; v >>>= 7) {
            groups++;
        }
        for (int i = groups - 1; i >= 0; i--) {
            int b = (int) ((value >>> (7 * i)) & 0x7F);
            out.write(i == 0 ? b : b | 0x80);
        }
    }

    static byte[] tlv(int tag, byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(tag);
        int length = content.length;
        if (length < 0x80) {
            out.write(length);
        } else if (length < 0x100) {
            out.write(0x81);
            out.write(length);
        } else if (length < 0x10000) {
            out.write(0x82);
            out.write(length >>> 8);
            out.write(length);
        } else {
            out.write(0x83);
            out.write(length >>> 16);
            out.write(length >>> 8);
            out.write(length);
        }
        out.writeBytes(content);
        return out.toByteArray();
    }

    static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
