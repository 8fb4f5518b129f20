package com.binauditor.core.inspect;

import com.binauditor.core.io.ByteSource;
import com.binauditor.core.io.FileByteSource;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.BinaryFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A binary after detection and parsing, shared read-only by all checks of a run.
 *
 * @param path absolute file path
 * @param format detected format; {@link BinaryFormat#UNKNOWN} when nothing matched
 * @param descriptor parsed descriptor, or null when detection or parsing failed
 * @param formatError why no descriptor is available, or null
 * @param content whole-file facts
 */
public record InspectedBinary(
    Path path,
    BinaryFormat format,
    BinaryDescriptor descriptor,
    String formatError,
    ContentFacts content
) {
    /** Detail reported by checks that need a descriptor when none is available. */
    public static final String UNSUPPORTED_FORMAT = "unsupported or malformed binary format";

    public InspectedBinary {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public boolean hasDescriptor() {
        return descriptor != null;
    }

    public String sha256() {
        return content.sha256();
    }

    /**
     * Opens the file for checks that re-read content ranges. Callers close the source.
     */
    public ByteSource openContent() throws IOException {
        return FileByteSource.open(path);
    }
}
