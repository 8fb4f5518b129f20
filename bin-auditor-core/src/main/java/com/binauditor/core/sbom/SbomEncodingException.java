package com.binauditor.core.sbom;

/**
 * Raised when components cannot be represented in, or read back from, an SBOM document.
 * Fatal to SBOM generation only; a compliance run is never affected.
 */
public class SbomEncodingException extends Exception {

    public SbomEncodingException(String message) {
        super(message);
    }

    public SbomEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
