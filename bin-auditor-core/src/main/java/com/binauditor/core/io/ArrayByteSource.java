package com.binauditor.core.io;

import java.util.Objects;

/**
 * In-memory {@link ByteSource}.
 */
public final class ArrayByteSource implements ByteSource {

    private final byte[] data;

    public ArrayByteSource(byte[] data) {
        this.data = Objects.requireNonNull(data, "data must not be null").clone();
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    public int read(long position, byte[] target, int offset, int length) {
        if (position >= data.length) {
            return -1;
        }
        int n = (int) Math.min(length, data.length - position);
        System.arraycopy(data, (int) position, target, offset, n);
        return n;
    }
}
