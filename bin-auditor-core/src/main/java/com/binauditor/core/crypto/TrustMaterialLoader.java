package com.binauditor.core.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.security.spec.X509EncodedKeySpec;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads trusted certificates and public keys from PEM files ({@code CERTIFICATE} and
 * {@code PUBLIC KEY} blocks). A file without PEM armor is read as a DER certificate.
 */
public final class TrustMaterialLoader {

    private static final Logger log = LoggerFactory.getLogger(TrustMaterialLoader.class);

    private static final Pattern PEM_BLOCK = Pattern.compile(
        "-----BEGIN ([A-Z0-9 ]+)-----([A-Za-z0-9+/=\\s]*)-----END \\1-----");

    private static final List<String> KEY_ALGORITHMS = List.of("RSA", "EC", "Ed25519");

    private TrustMaterialLoader() {
    }

    /**
     * Loads all files.
     *
     * @param files PEM or DER files
     * @return combined trust material
     * @throws IOException if a file cannot be read
     * @throws GeneralSecurityException if a block cannot be decoded
     */
    public static TrustMaterial load(List<Path> files) throws IOException, GeneralSecurityException {
        List<X509Certificate> certificates = new ArrayList<>();
        List<PublicKey> keys = new ArrayList<>();
        for (Path file : files) {
            byte[] raw = Files.readAllBytes(file);
            String text = new String(raw, StandardCharsets.US_ASCII);
            Matcher matcher = PEM_BLOCK.matcher(text);
            boolean armored = false;
            while (matcher.find()) {
                armored = true;
                byte[] der = Base64.getMimeDecoder().decode(matcher.group(2));
                switch (matcher.group(1)) {
                    case "CERTIFICATE" -> certificates.add(Certificates.decode(der));
                    case "PUBLIC KEY" -> keys.add(decodePublicKey(der, file));
                    default -> log.warn("Ignoring PEM block '{}' in {}", matcher.group(1), file);
                }
            }
            if (!armored) {
                certificates.add(Certificates.decode(raw));
            }
        }
        log.debug("Loaded {} trusted certificates and {} public keys from {} files",
            certificates.size(), keys.size(), files.size());
        return new TrustMaterial(certificates, keys);
    }

    private static PublicKey decodePublicKey(byte[] der, Path file) throws GeneralSecurityException {
        X509EncodedKeySpec spec = new X509EncodedKeySpec(der);
        GeneralSecurityException last = null;
        for (String algorithm : KEY_ALGORITHMS) {
            try {
                return KeyFactory.getInstance(algorithm).generatePublic(spec);
            } catch (GeneralSecurityException e) {
                last = e;
            }
        }
        throw new GeneralSecurityException("Unsupported public key in " + file, last);
    }
}
