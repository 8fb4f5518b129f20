package com.binauditor.core.inspect;

import com.binauditor.core.io.ByteSource;
import com.binauditor.core.util.HashUtils;

import java.io.IOException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Streams a file once, computing whole-file digests and collecting facts from embedded
 * printable strings.
 *
 * <p>Strings follow the GNU {@code strings} rule: runs of at least four printable ASCII
 * characters (tab included).
 */
public final class ContentScanner {

    public static final String SHA_256 = "SHA-256";
    public static final String SHA_512 = "SHA-512";

    static final int MIN_STRING_LENGTH = 4;
    static final int MAX_STRING_LENGTH = 4096;
    static final int MAX_LICENSE_TAGS = 64;

    private static final String LICENSE_TAG = "SPDX-License-Identifier:";

    private static final Pattern ALGORITHM = Pattern.compile(
        "(?<![A-Za-z0-9])(SHA3-(?:224|256|384|512)|SHA-?(?:1|224|256|384|512)|MD[45]|3DES|DES|RC4|AES"
            + "|ChaCha20|CHACHA20|RSA|ECDSA|Ed25519|ED25519|Blowfish|BLOWFISH)(?![A-Za-z0-9])");

    private static final int CHUNK = 64 * 1024;

    private ContentScanner() {
    }

    /**
     * Scans the content.
     *
     * @param source content
     * @return collected facts
     * @throws IOException on read failure
     */
    public static ContentFacts scan(ByteSource source) throws IOException {
        MessageDigest sha256 = HashUtils.newDigest(SHA_256);
        MessageDigest sha512 = HashUtils.newDigest(SHA_512);
        StringCollector strings = new StringCollector();

        byte[] buffer = new byte[CHUNK];
        long position = 0;
        long size = source.size();
        while (position < size) {
            int n = source.read(position, buffer, 0, (int) Math.min(CHUNK, size - position));
            if (n <= 0) {
                break;
            }
            sha256.update(buffer, 0, n);
            sha512.update(buffer, 0, n);
            strings.accept(buffer, n);
            position += n;
        }
        strings.finish();

        Map<String, String> digests = new LinkedHashMap<>();
        digests.put(SHA_256, HashUtils.toHex(sha256.digest()));
        digests.put(SHA_512, HashUtils.toHex(sha512.digest()));
        return new ContentFacts(position, digests, strings.licenses, new ArrayList<>(strings.algorithms));
    }

    /**
     * Normalizes an algorithm spelling ({@code SHA256}, {@code sha-256}) to its canonical name.
     *
     * @param raw identifier as found
     * @return canonical name such as {@code SHA-256} or {@code 3DES}
     */
    public static String normalizeAlgorithm(String raw) {
        String upper = raw.toUpperCase(Locale.ROOT);
        if (upper.startsWith("SHA3-")) {
            return upper;
        }
        if (upper.startsWith("SHA")) {
            String bits = upper.substring(3).replace("-", "");
            return "SHA-" + bits;
        }
        return upper;
    }

    /**
     * Extracts algorithm identifiers from arbitrary text.
     */
    public static List<String> findAlgorithms(String text) {
        List<String> found = new ArrayList<>();
        Matcher matcher = ALGORITHM.matcher(text);
        while (matcher.find()) {
            String normalized = normalizeAlgorithm(matcher.group(1));
            if (!found.contains(normalized)) {
                found.add(normalized);
            }
        }
        return found;
    }

    private static final class StringCollector {
        private final StringBuilder current = new StringBuilder();
        private final List<String> licenses = new ArrayList<>();
        private final Set<String> algorithms = new LinkedHashSet<>();

        void accept(byte[] data, int length) {
            for (int i = 0; i < length; i++) {
                byte b = data[i];
                if ((b >= 0x20 && b <= 0x7E) || b == '\t') {
                    if (current.length() < MAX_STRING_LENGTH) {
                        current.append((char) b);
                    }
                } else {
                    finish();
                }
            }
        }

        void finish() {
            if (current.length() >= MIN_STRING_LENGTH) {
                inspect(current.toString());
            }
            current.setLength(0);
        }

        private void inspect(String value) {
            int tag = value.indexOf(LICENSE_TAG);
            if (tag >= 0 && licenses.size() < MAX_LICENSE_TAGS) {
                String expression = value.substring(tag + LICENSE_TAG.length()).strip();
                if (!expression.isEmpty() && !licenses.contains(expression)) {
                    licenses.add(expression);
                }
            }
            algorithms.addAll(findAlgorithms(value));
        }
    }
}
