package com.binauditor.core.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient semantic version as found in binary metadata.
 *
 * <p>Accepts {@code MAJOR.MINOR}, {@code MAJOR.MINOR.PATCH} and four-part Windows versions
 * ({@code 1.2.3.4}), optionally prefixed with {@code v} and followed by pre-release and build
 * suffixes. A missing patch is read as zero.
 *
 * @param major major version
 * @param minor minor version
 * @param patch patch version
 * @param build fourth component, or -1
 * @param preRelease pre-release suffix, or null
 * @param buildMetadata build metadata, or null
 */
public record SemanticVersion(int major, int minor, int patch, int build, String preRelease, String buildMetadata) {

    private static final Pattern VERSION = Pattern.compile(
        "^[vV]?(\\d{1,9})\\.(\\d{1,9})(?:\\.(\\d{1,9}))?(?:\\.(\\d{1,9}))?"
            + "(?:-([0-9A-Za-z.-]+))?(?:\\+([0-9A-Za-z.-]+))?$");

    public static Optional<SemanticVersion> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher m = VERSION.matcher(value.strip());
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new SemanticVersion(
            Integer.parseInt(m.group(1)),
            Integer.parseInt(m.group(2)),
            m.group(3) == null ? 0 : Integer.parseInt(m.group(3)),
            m.group(4) == null ? -1 : Integer.parseInt(m.group(4)),
            m.group(5),
            m.group(6)));
    }

    /**
     * Major, minor and patch, the part that must agree across metadata fields.
     */
    public String core() {
        return major + "." + minor + "." + patch;
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(core());
        if (build >= 0) {
            text.append('.').append(build);
        }
        if (preRelease != null) {
            text.append('-').append(preRelease);
        }
        if (buildMetadata != null) {
            text.append('+').append(buildMetadata);
        }
        return text.toString();
    }
}
