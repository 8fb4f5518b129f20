package com.binauditor.core.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * Random-access, read-only view of binary content.
 *
 * <p>Implementations must support concurrent positional reads; parsers and the content
 * scanner never share a cursor.
 */
public interface ByteSource extends Closeable {

    /**
     * Total number of bytes available.
     *
     * @return size in bytes
     * @throws IOException if the size cannot be determined
     */
    long size() throws IOException;

    /**
     * Reads up to {@code length} bytes starting at {@code position}.
     *
     * @param position absolute offset
     * @param target destination buffer
     * @param offset offset into {@code target}
     * @param length maximum number of bytes to read
     * @return number of bytes read, or -1 at end of content
     * @throws IOException on read failure
     */
    int read(long position, byte[] target, int offset, int length) throws IOException;

    /**
     * Reads exactly {@code length} bytes or fewer if the content ends first.
     *
     * @param position absolute offset
     * @param length number of bytes wanted
     * @return the bytes read, possibly shorter than requested
     * @throws IOException on read failure
     */
    default byte[] readAvailable(long position, int length) throws IOException {
        byte[] buffer = new byte[length];
        int filled = 0;
        while (filled < length) {
            int n = read(position + filled, buffer, filled, length - filled);
            if (n <= 0) {
                break;
            }
            filled += n;
        }
        if (filled == length) {
            return buffer;
        }
        byte[] shorter = new byte[filled];
        System.arraycopy(buffer, 0, shorter, 0, filled);
        return shorter;
    }

    @Override
    default void close() throws IOException {
    }
}
