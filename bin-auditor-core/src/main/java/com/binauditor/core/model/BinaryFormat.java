package com.binauditor.core.model;

/**
 * Closed set of executable container formats recognized by the format detector.
 */
public enum BinaryFormat {
    /** Executable and Linkable Format (Linux, BSD). */
    ELF("ELF"),
    /** Portable Executable (Windows). */
    PE("PE"),
    /** Mach object file (macOS, iOS). */
    MACHO("Mach-O"),
    /** Readable content without a recognized signature. */
    UNKNOWN("unknown");

    private final String displayName;

    BinaryFormat(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
