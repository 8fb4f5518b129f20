package com.binauditor.core.model;

/**
 * Distinguishes linker-view sections from loader-view segments.
 */
public enum SectionKind {
    SECTION,
    SEGMENT
}
