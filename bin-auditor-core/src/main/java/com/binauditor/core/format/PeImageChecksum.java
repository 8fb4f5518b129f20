package com.binauditor.core.format;

import com.binauditor.core.io.ByteSource;

import java.io.IOException;

/**
 * The PE optional-header {@code CheckSum} algorithm: a 16-bit one's-complement style sum of
 * all little-endian words with the checksum field read as zero, plus the file length.
 */
public final class PeImageChecksum {

    private static final int CHUNK = 64 * 1024;

    private PeImageChecksum() {
    }

    /**
     * Computes the image checksum.
     *
     * @param source whole file
     * @param checksumOffset file offset of the 4-byte {@code CheckSum} field
     * @return checksum as an unsigned 32-bit value
     * @throws IOException on read failure
     */
    public static long compute(ByteSource source, long checksumOffset) throws IOException {
        long size = source.size();
        long sum = 0;
        long position = 0;
        while (position < size) {
            byte[] chunk = source.readAvailable(position, (int) Math.min(CHUNK, size - position));
            if (chunk.length == 0) {
                throw new IOException("Unexpected end of content at offset " + position);
            }
            for (int i = 0; i < chunk.length; i += 2) {
                long offset = position + i;
                if (offset >= checksumOffset && offset < checksumOffset + 4) {
                    continue;
                }
                int low = chunk[i] & 0xFF;
                int high = i + 1 < chunk.length ? chunk[i + 1] & 0xFF : 0;
                sum += low | (high << 8);
                sum = (sum & 0xFFFF) + (sum >>> 16);
            }
            position += chunk.length;
        }
        sum = (sum & 0xFFFF) + (sum >>> 16);
        return (sum + size) & 0xFFFFFFFFL;
    }
}
