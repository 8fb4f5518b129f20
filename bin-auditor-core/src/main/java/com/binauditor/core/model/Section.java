package com.binauditor.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * One entry of a binary's section or segment table.
 *
 * @param name section name ({@code .text}, {@code __TEXT,__text}) or segment label ({@code PT_LOAD[0]})
 * @param kind whether this is a section or a segment
 * @param fileOffset offset of the first file byte
 * @param fileSize number of bytes occupied in the file
 * @param virtualAddress load address
 * @param virtualSize size in memory
 * @param flags permissions and content markers
 */
public record Section(
    String name,
    SectionKind kind,
    long fileOffset,
    long fileSize,
    long virtualAddress,
    long virtualSize,
    Set<SectionFlag> flags
) {
    /**
     * Compact constructor with validation.
     */
    public Section {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        flags = flags == null ? Set.of() : Set.copyOf(flags);
    }

    public boolean hasFlag(SectionFlag flag) {
        return flags.contains(flag);
    }

    /**
     * Returns true if this entry occupies bytes in the file.
     *
     * @return true for entries with file content
     */
    public boolean occupiesFile() {
        return fileSize > 0 && !flags.contains(SectionFlag.NO_FILE_DATA);
    }

    /**
     * Exclusive end offset of the file range.
     *
     * @return {@code fileOffset + fileSize}, saturating on overflow
     */
    public long fileEnd() {
        long end = fileOffset + fileSize;
        return end < fileOffset ? Long.MAX_VALUE : end;
    }
}
