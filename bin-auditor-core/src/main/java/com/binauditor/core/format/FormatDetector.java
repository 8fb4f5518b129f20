package com.binauditor.core.format;

import com.binauditor.core.format.BinaryFormatException.Reason;
import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.BinaryFormat;
import com.binauditor.core.model.Endianness;

import java.io.IOException;

/**
 * Identifies the container format from leading magic numbers.
 *
 * <p>Detection is a pure function of the content. A PE image needs both the {@code MZ} stub
 * and the {@code PE\0\0} signature at {@code e_lfanew}; a bare DOS executable is
 * {@link BinaryFormat#UNKNOWN}. The {@code CAFEBABE} magic is shared between Mach-O universal
 * binaries and Java class files, so it is only accepted when the following word is a
 * plausible architecture count.
 */
public final class FormatDetector {

    static final long ELF_MAGIC = 0x7F454C46L;
    static final long MACHO_MAGIC_32 = 0xFEEDFACEL;
    static final long MACHO_MAGIC_64 = 0xFEEDFACFL;
    static final long MACHO_CIGAM_32 = 0xCEFAEDFEL;
    static final long MACHO_CIGAM_64 = 0xCFFAEDFEL;
    static final long FAT_MAGIC = 0xCAFEBABEL;
    static final long PE_SIGNATURE = 0x00004550L;
    static final int MAX_FAT_ARCHS = 20;

    private FormatDetector() {
    }

    /**
     * Detects the container format.
     *
     * @param source content to inspect
     * @return detected format, {@link BinaryFormat#UNKNOWN} if no magic matches
     * @throws BinaryFormatException with {@link Reason#TRUNCATED} if fewer than 4 bytes exist
     * @throws IOException on read failure
     */
    public static BinaryFormat detect(ByteSource source) throws BinaryFormatException, IOException {
        long size = source.size();
        if (size < 4) {
            throw new BinaryFormatException(Reason.TRUNCATED,
                "File has " + size + " bytes, too short for any supported magic number");
        }
        byte[] head = source.readAvailable(0, (int) Math.min(size, 64));
        long magic = BinaryReader.decode(head, 0, 4, Endianness.BIG);

        if (magic == ELF_MAGIC) {
            return BinaryFormat.ELF;
        }
        if (magic == MACHO_MAGIC_32 || magic == MACHO_MAGIC_64 || magic == MACHO_CIGAM_32 || magic == MACHO_CIGAM_64) {
            return BinaryFormat.MACHO;
        }
        if (magic == FAT_MAGIC) {
            return isPlausibleFatHeader(head) ? BinaryFormat.MACHO : BinaryFormat.UNKNOWN;
        }
        if (head[0] == 'M' && head[1] == 'Z') {
            return hasPeSignature(source, head, size) ? BinaryFormat.PE : BinaryFormat.UNKNOWN;
        }
        return BinaryFormat.UNKNOWN;
    }

    private static boolean isPlausibleFatHeader(byte[] head) {
        if (head.length < 8) {
            return false;
        }
        long count = BinaryReader.decode(head, 4, 4, Endianness.BIG);
        return count > 0 && count < MAX_FAT_ARCHS;
    }

    private static boolean hasPeSignature(ByteSource source, byte[] head, long size) throws IOException {
        if (head.length < 0x40) {
            return false;
        }
        long lfanew = BinaryReader.decode(head, 0x3C, 4, Endianness.LITTLE);
        if (lfanew + 4 > size) {
            return false;
        }
        byte[] signature = source.readAvailable(lfanew, 4);
        return signature.length == 4 && BinaryReader.decode(signature, 0, 4, Endianness.LITTLE) == PE_SIGNATURE;
    }
}
