package com.binauditor.core.model;

/**
 * Platform hardening markers recognized across formats.
 */
public enum HardeningFlag {
    /** Position-independent executable / ASLR-compatible image. */
    PIE,
    /** Compiler stack protection (canaries, {@code /GS} security cookie). */
    STACK_PROTECTION,
    /** Non-executable stack / DEP. */
    NX_STACK,
    /** Read-only relocations after start-up. */
    RELRO,
    /** 64-bit high-entropy ASLR. */
    HIGH_ENTROPY_ASLR
}
