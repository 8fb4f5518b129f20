package com.binauditor.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An embedded code-signing structure.
 *
 * @param kind signing convention the blob was found under
 * @param cms DER-encoded PKCS#7/CMS {@code ContentInfo}
 * @param signedRange file range bound to the signature, or null when the signed content
 *                    is carried in {@code detachedContent} or inside the CMS itself
 * @param excludedRanges parts of {@code signedRange} left out of the digest (Authenticode
 *                       skips the checksum field and the certificate table)
 * @param detachedContent signed bytes that are not a plain file range (Mach-O code directory), or null
 */
public record SignatureBlob(
    SignatureKind kind,
    byte[] cms,
    ByteRange signedRange,
    List<ByteRange> excludedRanges,
    byte[] detachedContent
) {
    /**
     * Compact constructor with validation.
     */
    public SignatureBlob {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(cms, "cms must not be null");
        cms = cms.clone();
        excludedRanges = excludedRanges == null ? List.of() : List.copyOf(excludedRanges);
        detachedContent = detachedContent == null ? null : detachedContent.clone();
    }

    @Override
    public byte[] cms() {
        return cms.clone();
    }

    @Override
    public byte[] detachedContent() {
        return detachedContent == null ? null : detachedContent.clone();
    }
}
