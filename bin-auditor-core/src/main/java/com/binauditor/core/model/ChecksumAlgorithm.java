package com.binauditor.core.model;

public enum ChecksumAlgorithm {
    /** SHA-256 over the covered range with the checksum bytes read as zeros. */
    SHA_256,
    /** Windows image checksum ({@code IMAGE_OPTIONAL_HEADER.CheckSum}). */
    PE_IMAGE_CHECKSUM
}
