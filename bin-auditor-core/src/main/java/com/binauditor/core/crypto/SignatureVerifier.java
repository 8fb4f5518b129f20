package com.binauditor.core.crypto;

import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.SignatureBlob;
import com.binauditor.core.model.SignatureKind;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.List;

/**
 * Verifies an embedded signature blob and decides whether its signer is trusted.
 */
public final class SignatureVerifier {

    /**
     * Result of verifying one blob.
     *
     * @param verified signature verifies and the signer is trusted
     * @param detail explanation
     * @param signer signer subject, or null if not determined
     */
    public record Verification(boolean verified, String detail, String signer) {
    }

    private final TrustMaterial trust;

    public SignatureVerifier(TrustMaterial trust) {
        this.trust = trust;
    }

    /**
     * Verifies the blob against the file content.
     *
     * @param blob embedded signature
     * @param source file content, for signatures bound to a file range
     * @param at evaluation time for chain validity
     * @return verification outcome
     */
    public Verification verify(SignatureBlob blob, ByteSource source, Instant at) {
        X509Certificate signer;
        CmsSignedData cms;
        try {
            cms = CmsSignedData.parse(blob.cms());
            signer = cms.verify(contentFor(blob, source));
            if (blob.kind() == SignatureKind.AUTHENTICODE) {
                checkImageDigest(cms, blob, source);
            }
        } catch (CmsException e) {
            return new Verification(false, e.getMessage(), null);
        }

        String subject = ChainValidator.subject(signer);
        if (trust.trustsKey(signer.getPublicKey())) {
            return new Verification(true, "Signature by '" + subject + "' verifies with a trusted key", subject);
        }
        if (!trust.certificates().isEmpty()) {
            ChainValidator.ChainResult chain = new ChainValidator(trust).validate(signer, cms.certificates(), at);
            if (chain.valid()) {
                return new Verification(true, "Signature by '" + subject + "' verifies; " + chain.detail(), subject);
            }
        }
        return new Verification(false, "Signature verifies but signer '" + subject + "' is not trusted", subject);
    }

    private static SignedContent contentFor(SignatureBlob blob, ByteSource source) {
        if (blob.detachedContent() != null) {
            return SignedContent.of(blob.detachedContent());
        }
        if (blob.kind() == SignatureKind.AUTHENTICODE || blob.signedRange() == null) {
            return null;
        }
        return FileRegionContent.skipping(source, blob.signedRange(), blob.excludedRanges());
    }

    private static void checkImageDigest(CmsSignedData cms, SignatureBlob blob, ByteSource source) throws CmsException {
        byte[] indirect = cms.encapsulatedContent();
        if (!Oids.SPC_INDIRECT_DATA.equals(cms.contentType()) || indirect == null || blob.signedRange() == null) {
            throw new CmsException("Authenticode signature lacks SpcIndirectDataContent");
        }
        List<DerElement> fields = DerElement.parseAll(indirect);
        if (fields.size() < 2) {
            throw new CmsException("SpcIndirectDataContent lacks a message digest");
        }
        List<DerElement> digestInfo = fields.get(1).expect(DerElement.SEQUENCE).children();
        String algorithm = Oids.digestName(digestInfo.get(0).firstChild().asOid());
        byte[] declared = digestInfo.get(1).expect(DerElement.OCTET_STRING).content();
        byte[] actual;
        try {
            actual = CmsSignedData.digest(
                FileRegionContent.skipping(source, blob.signedRange(), blob.excludedRanges()), algorithm);
        } catch (GeneralSecurityException | IOException e) {
            throw new CmsException("Authenticode image digest could not be computed: " + e.getMessage(), e);
        }
        if (!MessageDigest.isEqual(declared, actual)) {
            throw new CmsException("Authenticode image digest does not match the file content");
        }
    }
}
