package com.binauditor.core.check.impl.crypto;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.crypto.SignatureVerifier;
import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.SignatureBlob;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Verifies every embedded PKCS#7/CMS signature over the content it covers and requires the
 * signer to be a configured trusted key or certified by a trusted certificate.
 */
public class SignatureVerificationCheck extends AbstractCheck {

    public static final String ID = "signature-verification";

    public SignatureVerificationCheck() {
        super(ID, "Embedded signatures verify against trusted keys");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        if (descriptor.signatures().isEmpty()) {
            return fail("No embedded signature found");
        }
        if (context.trust().isEmpty()) {
            return fail("No trusted keys configured (crypto.trustedKeys)",
                metadata("signatures", descriptor.signatures().size()));
        }

        SignatureVerifier verifier = new SignatureVerifier(context.trust());
        List<String> signers = new ArrayList<>();
        try (ByteSource source = context.binary().openContent()) {
            for (SignatureBlob blob : descriptor.signatures()) {
                SignatureVerifier.Verification verification = verifier.verify(blob, source, context.evaluationTime());
                if (!verification.verified()) {
                    return fail(verification.detail(), metadata(
                        "kind", blob.kind().name(),
                        "signer", verification.signer()));
                }
                signers.add(verification.signer());
            }
        } catch (IOException e) {
            return fail("Signed content could not be read: " + e.getMessage());
        }

        return pass(signers.size() + " signature(s) verified; signed by " + String.join(", ", signers),
            metadata(
                "signatures", signers.size(),
                "kinds", descriptor.signatures().stream().map(b -> b.kind().name()).distinct().toList(),
                "signers", signers));
    }
}
