package com.binauditor.core.model;

/**
 * Format-neutral memory permissions and content markers of a section or segment.
 */
public enum SectionFlag {
    READ,
    WRITE,
    EXECUTE,
    CODE,
    /** Occupies memory but no file bytes (ELF {@code SHT_NOBITS}, PE uninitialized data, Mach-O zerofill). */
    NO_FILE_DATA
}
