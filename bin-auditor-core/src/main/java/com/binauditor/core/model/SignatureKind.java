package com.binauditor.core.model;

/**
 * Native code-signing conventions understood by the parsers.
 */
public enum SignatureKind {
    /** PKCS#7 detached signature appended to an ELF file behind a {@code module_signature} trailer. */
    ELF_APPENDED_SIGNATURE,
    /** Authenticode {@code WIN_CERTIFICATE} entry of a PE security directory. */
    AUTHENTICODE,
    /** CMS blob of a Mach-O {@code LC_CODE_SIGNATURE} super-blob, signing the code directory. */
    MACHO_CODE_SIGNATURE
}
