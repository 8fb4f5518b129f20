package com.binauditor.core.util;

import java.util.regex.Pattern;

/**
 * Case-insensitive glob matching for library names ({@code libssl.so.*}, {@code msvcr*.dll}).
 *
 * <p>Supports {@code *}, {@code ?} and bracket classes. Unlike path globs, {@code *} also
 * matches {@code /}.
 */
public final class Globs {

    private Globs() {
        // Utility class
    }

    public static boolean matches(String glob, String name) {
        return compile(glob).matcher(name).matches();
    }

    /**
     * Compiles a glob into an anchored, case-insensitive pattern.
     *
     * @param glob glob expression
     * @return compiled pattern
     */
    public static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        boolean inClass = false;
        for (char c : glob.toCharArray()) {
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '\\') {
                    regex.append("\\\\");
                } else {
                    regex.append(c);
                }
                continue;
            }
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    inClass = true;
                    regex.append('[');
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        if (inClass) {
            throw new IllegalArgumentException("Unterminated character class in glob: " + glob);
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
