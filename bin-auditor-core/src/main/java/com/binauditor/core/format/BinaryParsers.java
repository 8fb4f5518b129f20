package com.binauditor.core.format;

import com.binauditor.core.format.BinaryFormatException.Reason;
import com.binauditor.core.format.impl.ElfParser;
import com.binauditor.core.format.impl.MachOParser;
import com.binauditor.core.format.impl.PeParser;
import com.binauditor.core.model.BinaryFormat;

/**
 * Selects the parser for a detected format.
 */
public final class BinaryParsers {

    private BinaryParsers() {
    }

    /**
     * Returns the parser for the format.
     *
     * @param format detected format
     * @return parser
     * @throws BinaryFormatException if the format has no parser
     */
    public static BinaryParser forFormat(BinaryFormat format) throws BinaryFormatException {
        return switch (format) {
            case ELF -> new ElfParser();
            case PE -> new PeParser();
            case MACHO -> new MachOParser();
            case UNKNOWN -> throw new BinaryFormatException(Reason.UNSUPPORTED_VARIANT,
                "No parser for unrecognized binary format");
        };
    }
}
