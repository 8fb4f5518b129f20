package com.binauditor.core.model;

/**
 * Half-open range of file offsets.
 *
 * @param offset first byte
 * @param length number of bytes
 */
public record ByteRange(long offset, long length) {

    /**
     * Compact constructor with validation.
     */
    public ByteRange {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("offset and length must not be negative");
        }
    }

    public long end() {
        return offset + length;
    }

    public boolean contains(long position) {
        return position >= offset && position < end();
    }
}
