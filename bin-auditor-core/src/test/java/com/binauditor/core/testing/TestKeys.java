package com.binauditor.core.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Instant;

/**
 * Test PKI shipped under {@code src/test/resources/pki}.
 *
 * <p>{@code leaf} is issued by {@code ca}; {@code rogue} is an unrelated self-signed
 * certificate. All are valid from {@link #NOT_BEFORE} for one hundred years.
 */
public final class TestKeys {

    public static final Instant NOT_BEFORE = Instant.parse("2026-10-17T13:06:39Z");

    /** An instant at which every test certificate is valid. */
    public static final Instant VALID_AT = NOT_BEFORE.plusSeconds(86_400);

    public static final String CA = "pki/ca.pem";
    public static final String LEAF = "pki/leaf.pem";
    public static final String LEAF_KEY = "pki/leaf-key.pk8";
    public static final String ROGUE = "pki/rogue.pem";
    public static final String ROGUE_KEY = "pki/rogue-key.pk8";

    private TestKeys() {
    }

    public static X509Certificate ca() {
        return certificate(CA);
    }

    public static X509Certificate leaf() {
        return certificate(LEAF);
    }

    public static X509Certificate rogue() {
        return certificate(ROGUE);
    }

    public static PrivateKey leafKey() {
        return privateKey(LEAF_KEY);
    }

    public static PrivateKey rogueKey() {
        return privateKey(ROGUE_KEY);
    }

    /**
     * Copies a PKI resource into a directory, for code that loads trust material from files.
     */
    public static Path copyTo(Path directory, String resource) throws IOException {
        Path target = directory.resolve(resource.substring(resource.lastIndexOf('/') + 1));
        Files.write(target, bytes(resource));
        return target;
    }

    static X509Certificate certificate(String resource) {
        try (InputStream in = open(resource)) {
            return (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot decode " + resource, e);
        }
    }

    static PrivateKey privateKey(String resource) {
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(bytes(resource)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot decode " + resource, e);
        }
    }

    static byte[] bytes(String resource) {
        try (InputStream in = open(resource)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static InputStream open(String resource) throws IOException {
        InputStream in = TestKeys.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IOException("Missing test resource " + resource);
        }
        return in;
    }
}
