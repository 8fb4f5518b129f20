package com.binauditor.core.crypto;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.security.DigestOutputStream;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.Signature;
import java.security.SignatureException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Read-only view of a CMS {@code SignedData} structure (RFC 5652) as used by code-signing
 * formats: certificates, the first signer and its signature.
 *
 * <p>Both signing styles are supported: signatures directly over the content and signatures
 * over a set of signed attributes carrying the content's {@code messageDigest}.
 */
public final class CmsSignedData {

    private final List<X509Certificate> certificates;
    private final List<SignerInfo> signers;
    private final String contentType;
    private final byte[] encapsulatedContent;

    private CmsSignedData(List<X509Certificate> certificates, List<SignerInfo> signers,
                          String contentType, byte[] encapsulatedContent) {
        this.certificates = certificates;
        this.signers = signers;
        this.contentType = contentType;
        this.encapsulatedContent = encapsulatedContent;
    }

    /**
     * Signer identification and signature values of one {@code SignerInfo}.
     *
     * @param issuer DER-encoded issuer name, or null when identified by key identifier
     * @param serialNumber certificate serial number, or null
     * @param digestAlgorithm digest algorithm OID
     * @param signedAttributes DER of the signed attributes (tagged {@code [0]}), or null
     * @param signatureAlgorithm signature algorithm OID
     * @param signature signature value
     */
    public record SignerInfo(
        byte[] issuer,
        BigInteger serialNumber,
        String digestAlgorithm,
        DerElement signedAttributes,
        String signatureAlgorithm,
        byte[] signature
    ) {
    }

    /**
     * Parses a DER {@code ContentInfo} wrapping {@code SignedData}. Trailing padding after the
     * structure is ignored.
     *
     * @param der encoded structure
     * @return parsed view
     * @throws CmsException if the structure is not signed data or is malformed
     */
    public static CmsSignedData parse(byte[] der) throws CmsException {
        DerElement contentInfo = DerElement.parse(der).expect(DerElement.SEQUENCE);
        List<DerElement> info = contentInfo.children();
        if (info.size() < 2 || !Oids.PKCS7_SIGNED_DATA.equals(info.get(0).asOid())) {
            throw new CmsException("ContentInfo does not carry SignedData");
        }
        DerElement signedData = info.get(1).expect(DerElement.CONTEXT_0).firstChild().expect(DerElement.SEQUENCE);
        List<DerElement> fields = signedData.children();
        if (fields.size() < 4) {
            throw new CmsException("SignedData has " + fields.size() + " fields");
        }

        List<DerElement> encap = fields.get(2).expect(DerElement.SEQUENCE).children();
        if (encap.isEmpty()) {
            throw new CmsException("EncapsulatedContentInfo is empty");
        }
        String contentType = encap.get(0).asOid();
        byte[] content = null;
        if (encap.size() > 1) {
            DerElement inner = encap.get(1).expect(DerElement.CONTEXT_0).firstChild();
            // Authenticode embeds SpcIndirectDataContent directly; its digest covers the value octets only
            content = inner.content();
        }

        List<X509Certificate> certificates = new ArrayList<>();
        DerElement signerInfos = null;
        for (int i = 3; i < fields.size(); i++) {
            DerElement field = fields.get(i);
            if (field.tag() == DerElement.CONTEXT_0) {
                certificates.addAll(decodeCertificates(field));
            } else if (field.tag() == DerElement.SET) {
                signerInfos = field;
            }
        }
        if (signerInfos == null) {
            throw new CmsException("SignedData has no signerInfos");
        }
        List<SignerInfo> signers = new ArrayList<>();
        for (DerElement signer : signerInfos.children()) {
            signers.add(parseSigner(signer));
        }
        return new CmsSignedData(List.copyOf(certificates), List.copyOf(signers), contentType, content);
    }

    private static List<X509Certificate> decodeCertificates(DerElement set) throws CmsException {
        List<X509Certificate> result = new ArrayList<>();
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            for (DerElement cert : set.children()) {
                if (cert.tag() == DerElement.SEQUENCE) {
                    result.add((X509Certificate) factory.generateCertificate(new ByteArrayInputStream(cert.encoded())));
                }
            }
        } catch (CertificateException e) {
            throw new CmsException("Embedded certificate cannot be decoded: " + e.getMessage(), e);
        }
        return result;
    }

    private static SignerInfo parseSigner(DerElement element) throws CmsException {
        List<DerElement> fields = element.expect(DerElement.SEQUENCE).children();
        if (fields.size() < 5) {
            throw new CmsException("SignerInfo has " + fields.size() + " fields");
        }
        byte[] issuer = null;
        BigInteger serial = null;
        DerElement sid = fields.get(1);
        if (sid.tag() == DerElement.SEQUENCE) {
            List<DerElement> issuerAndSerial = sid.children();
            if (issuerAndSerial.size() < 2) {
                throw new CmsException("IssuerAndSerialNumber has " + issuerAndSerial.size() + " fields");
            }
            issuer = issuerAndSerial.get(0).encoded();
            serial = issuerAndSerial.get(1).asInteger();
        }
        String digestAlgorithm = fields.get(2).firstChild().asOid();
        int cursor = 3;
        DerElement signedAttributes = null;
        if (fields.get(cursor).tag() == DerElement.CONTEXT_0) {
            signedAttributes = fields.get(cursor++);
        }
        if (cursor + 1 >= fields.size()) {
            throw new CmsException("SignerInfo lacks signature fields");
        }
        String signatureAlgorithm = fields.get(cursor).firstChild().asOid();
        byte[] signature = fields.get(cursor + 1).expect(DerElement.OCTET_STRING).content();
        return new SignerInfo(issuer, serial, digestAlgorithm, signedAttributes, signatureAlgorithm, signature);
    }

    public List<X509Certificate> certificates() {
        return certificates;
    }

    public List<SignerInfo> signers() {
        return signers;
    }

    public String contentType() {
        return contentType;
    }

    public byte[] encapsulatedContent() {
        return encapsulatedContent == null ? null : encapsulatedContent.clone();
    }

    /**
     * Verifies the first signer over the given content.
     *
     * @param detached detached content, or null to use the encapsulated content
     * @return the signer's certificate
     * @throws CmsException if the signer cannot be found or the signature does not verify
     */
    public X509Certificate verify(SignedContent detached) throws CmsException {
        if (signers.isEmpty()) {
            throw new CmsException("SignedData has no signers");
        }
        SignerInfo signer = signers.get(0);
        X509Certificate certificate = findSignerCertificate(signer);
        SignedContent content = detached != null ? detached
            : encapsulatedContent != null ? SignedContent.of(encapsulatedContent) : null;
        if (content == null) {
            throw new CmsException("No content to verify the signature against");
        }
        try {
            Signature verifier = Signature.getInstance(
                Oids.signatureName(signer.signatureAlgorithm(), signer.digestAlgorithm()));
            verifier.initVerify(certificate.getPublicKey());
            if (signer.signedAttributes() != null) {
                byte[] digest = digest(content, Oids.digestName(signer.digestAlgorithm()));
                byte[] declared = messageDigestAttribute(signer.signedAttributes());
                if (!MessageDigest.isEqual(digest, declared)) {
                    throw new CmsException("Content digest does not match the signed messageDigest attribute");
                }
                byte[] attributes = signer.signedAttributes().encoded();
                attributes[0] = (byte) DerElement.SET;
                verifier.update(attributes);
            } else {
                content.writeTo(new SignatureOutputStream(verifier));
            }
            if (!verifier.verify(signer.signature())) {
                throw new CmsException("Signature value does not verify with the signer's public key");
            }
            return certificate;
        } catch (CmsException e) {
            throw e;
        } catch (GeneralSecurityException e) {
            throw new CmsException("Signature verification failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CmsException("Signed content could not be read: " + e.getMessage(), e);
        }
    }

    /**
     * Locates the certificate named by the signer identifier.
     */
    public X509Certificate findSignerCertificate(SignerInfo signer) throws CmsException {
        for (X509Certificate certificate : certificates) {
            if (signer.serialNumber() != null
                && signer.serialNumber().equals(certificate.getSerialNumber())
                && Arrays.equals(signer.issuer(), certificate.getIssuerX500Principal().getEncoded())) {
                return certificate;
            }
        }
        throw new CmsException("Signer certificate is not embedded in the signature");
    }

    static byte[] digest(SignedContent content, String algorithm) throws GeneralSecurityException, IOException {
        MessageDigest md = MessageDigest.getInstance(algorithm);
        try (DigestOutputStream out = new DigestOutputStream(OutputStream.nullOutputStream(), md)) {
            content.writeTo(out);
        }
        return md.digest();
    }

    private static byte[] messageDigestAttribute(DerElement signedAttributes) throws CmsException {
        for (DerElement attribute : signedAttributes.children()) {
            List<DerElement> parts = attribute.children();
            if (parts.size() == 2 && Oids.MESSAGE_DIGEST.equals(parts.get(0).asOid())) {
                return parts.get(1).firstChild().expect(DerElement.OCTET_STRING).content();
            }
        }
        throw new CmsException("Signed attributes lack messageDigest");
    }

    private static final class SignatureOutputStream extends OutputStream {
        private final Signature signature;

        SignatureOutputStream(Signature signature) {
            this.signature = signature;
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            try {
                signature.update(b, off, len);
            } catch (SignatureException e) {
                throw new IOException(e);
            }
        }
    }
}
