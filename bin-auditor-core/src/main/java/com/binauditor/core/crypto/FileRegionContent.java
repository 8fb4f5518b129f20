package com.binauditor.core.crypto;

import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.ByteRange;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Comparator;
import java.util.List;

/**
 * Streams a file range with some sub-ranges either skipped or replaced by zeros.
 */
public final class FileRegionContent implements SignedContent {

    private static final int CHUNK = 64 * 1024;

    private final ByteSource source;
    private final ByteRange range;
    private final List<ByteRange> excluded;
    private final boolean zeroFill;

    private FileRegionContent(ByteSource source, ByteRange range, List<ByteRange> excluded, boolean zeroFill) {
        this.source = source;
        this.range = range;
        this.excluded = excluded.stream().sorted(Comparator.comparingLong(ByteRange::offset)).toList();
        this.zeroFill = zeroFill;
    }

    /** Region with excluded ranges left out of the stream. */
    public static FileRegionContent skipping(ByteSource source, ByteRange range, List<ByteRange> excluded) {
        return new FileRegionContent(source, range, excluded, false);
    }

    /** Region with excluded ranges read as zeros. */
    public static FileRegionContent zeroing(ByteSource source, ByteRange range, List<ByteRange> excluded) {
        return new FileRegionContent(source, range, excluded, true);
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        long position = range.offset();
        long end = range.end();
        for (ByteRange skip : excluded) {
            long skipStart = Math.max(skip.offset(), position);
            long skipEnd = Math.min(skip.end(), end);
            if (skipEnd <= skipStart) {
                continue;
            }
            copy(position, skipStart, out);
            if (zeroFill) {
                writeZeros(skipEnd - skipStart, out);
            }
            position = skipEnd;
        }
        copy(position, end, out);
    }

    private void copy(long from, long to, OutputStream out) throws IOException {
        byte[] buffer = new byte[CHUNK];
        long position = from;
        while (position < to) {
            int wanted = (int) Math.min(CHUNK, to - position);
            int n = source.read(position, buffer, 0, wanted);
            if (n <= 0) {
                throw new IOException("Unexpected end of content at offset " + position);
            }
            out.write(buffer, 0, n);
            position += n;
        }
    }

    private static void writeZeros(long count, OutputStream out) throws IOException {
        byte[] zeros = new byte[(int) Math.min(CHUNK, count)];
        long remaining = count;
        while (remaining > 0) {
            int n = (int) Math.min(zeros.length, remaining);
            out.write(zeros, 0, n);
            remaining -= n;
        }
    }
}
