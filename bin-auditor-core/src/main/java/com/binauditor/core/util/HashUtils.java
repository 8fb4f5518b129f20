package com.binauditor.core.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Digest helpers.
 */
public final class HashUtils {

    private HashUtils() {
        // Utility class
    }

    /**
     * Creates a digest for an algorithm every JDK must provide.
     *
     * @param algorithm JCA name such as {@code SHA-256}
     * @return fresh digest
     * @throws IllegalStateException if the JDK lacks the algorithm
     */
    public static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available in this JVM", e);
        }
    }

    public static String toHex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    public static String sha256(byte[] data) {
        return toHex(newDigest("SHA-256").digest(data));
    }
}
