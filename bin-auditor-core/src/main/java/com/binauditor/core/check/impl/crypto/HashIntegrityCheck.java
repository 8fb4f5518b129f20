package com.binauditor.core.check.impl.crypto;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.crypto.FileRegionContent;
import com.binauditor.core.format.PeImageChecksum;
import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.DeclaredChecksum;
import com.binauditor.core.util.HashUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;

/**
 * Recomputes the checksum a binary declares over itself and compares it with the declared
 * value. A binary that declares no checksum passes and reports its content hash.
 */
public class HashIntegrityCheck extends AbstractCheck {

    public static final String ID = "hash-integrity";

    public HashIntegrityCheck() {
        super(ID, "Self-declared checksum matches the content");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        String contentHash = context.binary().sha256();
        if (descriptor.checksum().isEmpty()) {
            return pass("No self-declared checksum; content SHA-256 " + contentHash,
                metadata("sha256", contentHash));
        }

        DeclaredChecksum checksum = descriptor.declaredChecksum();
        String actual;
        try (ByteSource source = context.binary().openContent()) {
            actual = switch (checksum.algorithm()) {
                case SHA_256 -> sha256(source, checksum);
                case PE_IMAGE_CHECKSUM ->
                    String.format("%08x", PeImageChecksum.compute(source, checksum.region().offset()));
            };
        } catch (IOException e) {
            return fail("Content could not be read: " + e.getMessage());
        }

        Map<String, Object> metadata = metadata(
            "algorithm", checksum.algorithm().name(),
            "expected", checksum.expected(),
            "actual", actual,
            "coverage", checksum.coverage().offset() + "-" + checksum.coverage().end(),
            "sha256", contentHash);
        if (!checksum.expected().equalsIgnoreCase(actual)) {
            return fail("Checksum mismatch: declared " + checksum.expected() + ", computed " + actual, metadata);
        }
        return pass(checksum.algorithm().name() + " checksum matches (" + actual + ")", metadata);
    }

    private static String sha256(ByteSource source, DeclaredChecksum checksum) throws IOException {
        MessageDigest digest = HashUtils.newDigest("SHA-256");
        try (OutputStream out = new DigestOutputStream(OutputStream.nullOutputStream(), digest)) {
            FileRegionContent.zeroing(source, checksum.coverage(), List.of(checksum.region())).writeTo(out);
        }
        return HashUtils.toHex(digest.digest());
    }
}
