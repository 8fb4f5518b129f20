package com.binauditor.core.format;

import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.BinaryFormat;

/**
 * Parses one container format into a {@link BinaryDescriptor}.
 *
 * <p>Parsers read header tables only; whole-file facts (digests, embedded strings) are
 * computed by the content scanner and passed in through {@link ParseInput}.
 */
public interface BinaryParser {

    /**
     * Format handled by this parser.
     *
     * @return container format
     */
    BinaryFormat format();

    /**
     * Parses the content.
     *
     * @param source content, already detected as {@link #format()}
     * @param input whole-file facts to merge into the descriptor
     * @return descriptor
     * @throws BinaryFormatException if a header or table is malformed
     */
    BinaryDescriptor parse(ByteSource source, ParseInput input) throws BinaryFormatException;
}
