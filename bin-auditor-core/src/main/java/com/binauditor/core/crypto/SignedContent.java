package com.binauditor.core.crypto;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Streams the bytes a signature covers.
 */
@FunctionalInterface
public interface SignedContent {

    void writeTo(OutputStream out) throws IOException;

    static SignedContent of(byte[] bytes) {
        return out -> out.write(bytes);
    }
}
