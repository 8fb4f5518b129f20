package com.binauditor.core.format.impl;

import com.binauditor.core.crypto.Certificates;
import com.binauditor.core.crypto.CmsException;
import com.binauditor.core.crypto.CmsSignedData;
import com.binauditor.core.crypto.Oids;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.ByteRange;
import com.binauditor.core.model.EmbeddedCertificate;
import com.binauditor.core.model.SignatureBlob;
import com.binauditor.core.model.SignatureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.cert.CertificateException;
import java.util.List;

/**
 * Records a signature blob on a descriptor together with the certificates it carries.
 * A blob that is not decodable CMS is still recorded so that signature verification can
 * report it.
 */
final class EmbeddedSignatures {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedSignatures.class);

    private EmbeddedSignatures() {
    }

    static void record(BinaryDescriptor.Builder builder, SignatureKind kind, byte[] cms,
                       ByteRange signedRange, List<ByteRange> excluded, byte[] detachedContent) {
        builder.signature(new SignatureBlob(kind, cms, signedRange, excluded, detachedContent));
        try {
            CmsSignedData signedData = CmsSignedData.parse(cms);
            for (EmbeddedCertificate certificate : Certificates.describeAll(signedData.certificates())) {
                builder.certificate(certificate);
            }
            for (CmsSignedData.SignerInfo signer : signedData.signers()) {
                builder.algorithmIdentifier(Oids.digestName(signer.digestAlgorithm()));
            }
        } catch (CmsException | CertificateException e) {
            log.warn("{} blob is not a decodable CMS structure: {}", kind, e.getMessage());
        }
    }
}
