package com.binauditor.core.format;

import com.binauditor.core.format.BinaryFormatException.Reason;
import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.Endianness;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Bounds-checked, endian-aware field reader over a {@link ByteSource}.
 *
 * <p>Every read is validated against the content size before touching the source, so a
 * header field that points past the end surfaces as {@link Reason#UNEXPECTED_EOF} instead of
 * a short read.
 */
public final class BinaryReader {

    /** Upper bound on a single materialized region. */
    public static final int MAX_REGION = 64 * 1024 * 1024;

    private final ByteSource source;
    private final long size;
    private Endianness endianness;

    public BinaryReader(ByteSource source, Endianness endianness) throws IOException {
        this.source = source;
        this.size = source.size();
        this.endianness = endianness;
    }

    /**
     * Creates a reader, rethrowing a failure to size the source unchecked.
     */
    public static BinaryReader over(ByteSource source, Endianness endianness) {
        try {
            return new BinaryReader(source, endianness);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public long size() {
        return size;
    }

    public Endianness endianness() {
        return endianness;
    }

    public void setEndianness(Endianness endianness) {
        this.endianness = endianness;
    }

    public boolean isInBounds(long offset, long length) {
        return offset >= 0 && length >= 0 && offset <= size && length <= size - offset;
    }

    public void requireRange(long offset, long length, String what) throws BinaryFormatException {
        if (!isInBounds(offset, length)) {
            throw new BinaryFormatException(Reason.UNEXPECTED_EOF,
                what + " at offset " + offset + " (length " + length + ") exceeds file size " + size);
        }
    }

    public byte[] bytes(long offset, long length, String what) throws BinaryFormatException {
        requireRange(offset, length, what);
        if (length > MAX_REGION) {
            throw new BinaryFormatException(Reason.UNSUPPORTED_VARIANT,
                what + " of " + length + " bytes exceeds the supported region size");
        }
        byte[] data;
        try {
            data = source.readAvailable(offset, (int) length);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (data.length != length) {
            throw new BinaryFormatException(Reason.UNEXPECTED_EOF, what + " ended early at offset " + offset);
        }
        return data;
    }

    public int u8(long offset) throws BinaryFormatException {
        return bytes(offset, 1, "byte")[0] & 0xFF;
    }

    public int u16(long offset) throws BinaryFormatException {
        return (int) decode(bytes(offset, 2, "u16"), 0, 2, endianness);
    }

    public long u32(long offset) throws BinaryFormatException {
        return decode(bytes(offset, 4, "u32"), 0, 4, endianness);
    }

    public long u64(long offset) throws BinaryFormatException {
        return decode(bytes(offset, 8, "u64"), 0, 8, endianness);
    }

    /**
     * Reads a 32- or 64-bit word depending on {@code wide}.
     */
    public long word(long offset, boolean wide) throws BinaryFormatException {
        return wide ? u64(offset) : u32(offset);
    }

    /**
     * Reads a NUL-terminated ASCII string of at most {@code maxLength} bytes. A string running
     * to the end of the content or to the limit is returned as read.
     */
    public String cString(long offset, int maxLength) throws BinaryFormatException {
        requireRange(offset, 0, "string");
        int length = (int) Math.min(maxLength, size - offset);
        byte[] data = bytes(offset, length, "string");
        int end = 0;
        while (end < data.length && data[end] != 0) {
            end++;
        }
        return new String(data, 0, end, StandardCharsets.UTF_8);
    }

    /**
     * Size in bytes of a table of {@code count} entries, rejecting negative or overflowing products.
     */
    public static long tableSize(long entrySize, long count, String what) throws BinaryFormatException {
        if (entrySize < 0 || count < 0) {
            throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                what + " has a negative entry size or count");
        }
        try {
            return Math.multiplyExact(entrySize, count);
        } catch (ArithmeticException e) {
            throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                what + " size overflows (" + count + " entries of " + entrySize + " bytes)");
        }
    }

    /**
     * Decodes an unsigned integer from a byte array.
     *
     * @param data buffer
     * @param offset start index
     * @param width 1, 2, 4 or 8
     * @param order byte order
     * @return decoded value
     */
    public static long decode(byte[] data, int offset, int width, Endianness order) {
        long value = 0;
        for (int i = 0; i < width; i++) {
            int index = order == Endianness.LITTLE ? offset + width - 1 - i : offset + i;
            value = (value << 8) | (data[index] & 0xFFL);
        }
        return value;
    }

    /**
     * Bounds-checked variant of {@link #decode} for fields inside already-read tables.
     */
    public static long field(byte[] data, int offset, int width, Endianness order) throws BinaryFormatException {
        if (offset < 0 || width < 0 || (long) offset + width > data.length) {
            throw new BinaryFormatException(Reason.UNEXPECTED_EOF,
                "field at " + offset + " exceeds table of " + data.length + " bytes");
        }
        return decode(data, offset, width, order);
    }

    /**
     * Reads a NUL-terminated string from an in-memory table.
     */
    public static String cString(byte[] table, long offset) {
        if (offset < 0 || offset >= table.length) {
            return "";
        }
        int start = (int) offset;
        int end = start;
        while (end < table.length && table[end] != 0) {
            end++;
        }
        return new String(table, start, end - start, StandardCharsets.UTF_8);
    }
}
