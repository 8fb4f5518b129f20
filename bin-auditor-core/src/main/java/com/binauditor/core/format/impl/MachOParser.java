package com.binauditor.core.format.impl;

import com.binauditor.core.format.BinaryFormatException;
import com.binauditor.core.format.BinaryFormatException.Reason;
import com.binauditor.core.format.BinaryParser;
import com.binauditor.core.format.BinaryReader;
import com.binauditor.core.format.ParseInput;
import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.BinaryFormat;
import com.binauditor.core.model.BinaryKind;
import com.binauditor.core.model.ByteRange;
import com.binauditor.core.model.ChecksumAlgorithm;
import com.binauditor.core.model.DeclaredChecksum;
import com.binauditor.core.model.Endianness;
import com.binauditor.core.model.HardeningFlag;
import com.binauditor.core.model.ImportedLibrary;
import com.binauditor.core.model.Section;
import com.binauditor.core.model.SectionFlag;
import com.binauditor.core.model.SectionKind;
import com.binauditor.core.model.SignatureKind;
import com.binauditor.core.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Mach-O images, thin or universal. Universal binaries are described by their
 * first architecture slice; every offset in the descriptor is absolute within the file.
 *
 * <p>Reads segments and sections, dylib load commands, {@code LC_MAIN},
 * {@code LC_SOURCE_VERSION}, the embedded {@code __info_plist}, a {@code __checksum}
 * section and the CMS blob of the {@code LC_CODE_SIGNATURE} super-blob.
 */
public class MachOParser implements BinaryParser {

    private static final Logger log = LoggerFactory.getLogger(MachOParser.class);

    static final long MH_MAGIC = 0xFEEDFACEL;
    static final long MH_MAGIC_64 = 0xFEEDFACFL;
    static final long FAT_MAGIC = 0xCAFEBABEL;

    static final int MH_OBJECT = 1;
    static final int MH_EXECUTE = 2;
    static final int MH_DYLIB = 6;
    static final int MH_BUNDLE = 8;

    static final long MH_ALLOW_STACK_EXECUTION = 0x20000L;
    static final long MH_PIE = 0x200000L;

    static final long LC_SEGMENT = 0x1;
    static final long LC_SYMTAB = 0x2;
    static final long LC_LOAD_DYLIB = 0xC;
    static final long LC_ID_DYLIB = 0xD;
    static final long LC_SEGMENT_64 = 0x19;
    static final long LC_CODE_SIGNATURE = 0x1D;
    static final long LC_LAZY_LOAD_DYLIB = 0x20;
    static final long LC_SOURCE_VERSION = 0x2A;
    static final long LC_LOAD_WEAK_DYLIB = 0x80000018L;
    static final long LC_REEXPORT_DYLIB = 0x8000001FL;
    static final long LC_MAIN = 0x80000028L;

    static final int VM_PROT_READ = 0x1;
    static final int VM_PROT_WRITE = 0x2;
    static final int VM_PROT_EXECUTE = 0x4;

    static final long S_ZEROFILL = 0x1;
    static final long S_ATTR_PURE_INSTRUCTIONS = 0x80000000L;
    static final long S_ATTR_SOME_INSTRUCTIONS = 0x400L;

    static final long CSMAGIC_EMBEDDED_SIGNATURE = 0xFADE0CC0L;
    static final long CSMAGIC_CODEDIRECTORY = 0xFADE0C02L;
    static final long CSMAGIC_BLOBWRAPPER = 0xFADE0B01L;
    static final long CSSLOT_CODEDIRECTORY = 0;
    static final long CSSLOT_SIGNATURESLOT = 0x10000;

    static final String CHECKSUM_SECTION = "__checksum";
    static final String INFO_PLIST_SECTION = "__info_plist";

    private static final int MAX_LOAD_COMMANDS = 4096;
    private static final int MAX_BLOB_INDEX = 64;
    private static final int MAX_PLIST_BYTES = 256 * 1024;
    private static final int MAX_FAT_ARCHS = 20;

    private static final Map<Long, String> CPU_TYPES = Map.of(
        7L, "i386",
        0x01000007L, "x86_64",
        12L, "arm",
        0x0100000CL, "arm64",
        18L, "ppc",
        0x01000012L, "ppc64"
    );

    @Override
    public BinaryFormat format() {
        return BinaryFormat.MACHO;
    }

    @Override
    public BinaryDescriptor parse(ByteSource source, ParseInput input) throws BinaryFormatException {
        BinaryReader reader = BinaryReader.over(source, Endianness.BIG);
        long base = 0;
        long sliceEnd = reader.size();
        if (reader.u32(0) == FAT_MAGIC) {
            long count = reader.u32(4);
            if (count == 0 || count >= MAX_FAT_ARCHS) {
                throw new BinaryFormatException(Reason.MALFORMED_HEADER, "Universal binary declares " + count + " slices");
            }
            base = reader.u32(8 + 8);
            long size = reader.u32(8 + 12);
            reader.requireRange(base, size, "first universal slice");
            sliceEnd = base + size;
        }

        long magic = reader.u32(base);
        Endianness endianness;
        boolean wide;
        if (magic == MH_MAGIC || magic == MH_MAGIC_64) {
            endianness = Endianness.BIG;
            wide = magic == MH_MAGIC_64;
        } else {
            reader.setEndianness(Endianness.LITTLE);
            long swapped = reader.u32(base);
            if (swapped != MH_MAGIC && swapped != MH_MAGIC_64) {
                throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                    "No Mach-O magic at offset " + base);
            }
            endianness = Endianness.LITTLE;
            wide = swapped == MH_MAGIC_64;
        }
        reader.setEndianness(endianness);
        int headerSize = wide ? 32 : 28;
        reader.requireRange(base, headerSize, "Mach-O header");

        long cpuType = reader.u32(base + 4);
        int fileType = (int) reader.u32(base + 12);
        long commandCount = reader.u32(base + 16);
        long commandsSize = reader.u32(base + 20);
        long flags = reader.u32(base + 24);
        if (commandCount > MAX_LOAD_COMMANDS) {
            throw new BinaryFormatException(Reason.MALFORMED_HEADER, "ncmds " + commandCount + " is implausible");
        }
        reader.requireRange(base + headerSize, commandsSize, "load commands");

        BinaryDescriptor.Builder builder = BinaryDescriptor.builder(BinaryFormat.MACHO)
            .bitness(wide ? 64 : 32)
            .endianness(endianness)
            .fileSize(reader.size())
            .contentDigests(input.digests())
            .architecture(CPU_TYPES.getOrDefault(cpuType, "unknown"))
            .property("machine", "0x" + Long.toHexString(cpuType))
            .kind(kindOf(fileType));
        if (base > 0) {
            builder.property("universal.slice.offset", Long.toString(base));
        }
        if ((flags & MH_PIE) != 0) {
            builder.flag(HardeningFlag.PIE);
        }
        if ((flags & MH_ALLOW_STACK_EXECUTION) == 0) {
            builder.flag(HardeningFlag.NX_STACK);
        }

        long cursor = base + headerSize;
        long commandsEnd = cursor + commandsSize;
        long textVmAddr = -1;
        long mainOffset = -1;
        long codeSignatureOffset = -1;
        long codeSignatureSize = 0;
        ByteRange checksumRange = null;
        boolean checksumMisplaced = false;
        for (long i = 0; i < commandCount; i++) {
            if (cursor + 8 > commandsEnd) {
                throw new BinaryFormatException(Reason.UNEXPECTED_EOF, "Load command " + i + " exceeds sizeofcmds");
            }
            long command = reader.u32(cursor);
            long size = reader.u32(cursor + 4);
            if (size < 8 || size % 4 != 0 || cursor + size > commandsEnd) {
                throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                    "Load command " + i + " has invalid size " + size);
            }

            if (command == LC_SEGMENT || command == LC_SEGMENT_64) {
                boolean wideSegment = command == LC_SEGMENT_64;
                String segmentName = reader.cString(cursor + 8, 16);
                long vmAddr = reader.word(cursor + 24, wideSegment);
                long vmSize = reader.word(cursor + (wideSegment ? 32 : 28), wideSegment);
                long fileOffset = reader.word(cursor + (wideSegment ? 40 : 32), wideSegment);
                long fileSize = reader.word(cursor + (wideSegment ? 48 : 36), wideSegment);
                int initProt = (int) reader.u32(cursor + (wideSegment ? 60 : 44));
                long sectionCount = reader.u32(cursor + (wideSegment ? 64 : 48));
                if ("__TEXT".equals(segmentName)) {
                    textVmAddr = vmAddr;
                }
                builder.section(new Section(segmentName, SectionKind.SEGMENT, base + fileOffset, fileSize, vmAddr,
                    vmSize, protectionFlags(initProt)));

                int headerLength = wideSegment ? 72 : 56;
                int sectionLength = wideSegment ? 80 : 68;
                if (headerLength + sectionCount * sectionLength > size) {
                    throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                        "Segment " + segmentName + " declares more sections than its command holds");
                }
                for (long s = 0; s < sectionCount; s++) {
                    long header = cursor + headerLength + s * sectionLength;
                    String sectionName = reader.cString(header, 16);
                    long address = reader.word(header + 32, wideSegment);
                    long sectionSize = reader.word(header + (wideSegment ? 40 : 36), wideSegment);
                    long offset = reader.u32(header + (wideSegment ? 48 : 40));
                    long sectionFlags = reader.u32(header + (wideSegment ? 64 : 56));
                    Set<SectionFlag> sectionFlagSet = sectionFlags(sectionFlags, initProt);
                    boolean zeroFill = sectionFlagSet.contains(SectionFlag.NO_FILE_DATA);
                    long absolute = base + offset;
                    builder.section(new Section(sectionName, SectionKind.SECTION, absolute,
                        zeroFill ? 0 : sectionSize, address, sectionSize, sectionFlagSet));
                    if (CHECKSUM_SECTION.equals(sectionName) && !zeroFill) {
                        if (sectionSize == 32 && reader.isInBounds(absolute, 32)) {
                            checksumRange = new ByteRange(absolute, 32);
                        } else {
                            checksumMisplaced = true;
                        }
                    } else if (INFO_PLIST_SECTION.equals(sectionName) && !zeroFill
                        && sectionSize <= MAX_PLIST_BYTES && reader.isInBounds(absolute, sectionSize)) {
                        applyInfoPlist(new String(reader.bytes(absolute, sectionSize, "Info.plist"),
                            StandardCharsets.UTF_8), builder);
                    }
                }
            } else if (command == LC_LOAD_DYLIB || command == LC_LOAD_WEAK_DYLIB
                || command == LC_REEXPORT_DYLIB || command == LC_LAZY_LOAD_DYLIB) {
                String name = reader.cString(cursor + reader.u32(cursor + 8), (int) Math.min(size, 1024));
                long compatibility = reader.u32(cursor + 20);
                builder.importedLibrary(new ImportedLibrary(name,
                    compatibility == 0 ? null : packedVersion(compatibility), List.of()));
            } else if (command == LC_ID_DYLIB) {
                String name = reader.cString(cursor + reader.u32(cursor + 8), (int) Math.min(size, 1024));
                builder.property("install.name", name);
                builder.versionCandidate("LC_ID_DYLIB", packedVersion(reader.u32(cursor + 16)));
            } else if (command == LC_MAIN) {
                mainOffset = reader.u64(cursor + 8);
            } else if (command == LC_SOURCE_VERSION) {
                long packed = reader.u64(cursor + 8);
                builder.versionCandidate("LC_SOURCE_VERSION",
                    (packed >>> 40) + "." + ((packed >>> 30) & 0x3FF) + "." + ((packed >>> 20) & 0x3FF));
            } else if (command == LC_SYMTAB) {
                long stringsOffset = base + reader.u32(cursor + 16);
                long stringsSize = reader.u32(cursor + 20);
                if (reader.isInBounds(stringsOffset, stringsSize) && stringsSize <= BinaryReader.MAX_REGION) {
                    String table = new String(reader.bytes(stringsOffset, stringsSize, "symbol strings"),
                        StandardCharsets.ISO_8859_1);
                    if (table.contains("___stack_chk_guard") || table.contains("___stack_chk_fail")) {
                        builder.flag(HardeningFlag.STACK_PROTECTION);
                    }
                }
            } else if (command == LC_CODE_SIGNATURE) {
                codeSignatureOffset = base + reader.u32(cursor + 8);
                codeSignatureSize = reader.u32(cursor + 12);
            }
            cursor += size;
        }

        if (mainOffset >= 0) {
            builder.entryPoint(textVmAddr >= 0 ? textVmAddr + mainOffset : mainOffset);
        }
        long coverageEnd = sliceEnd;
        if (codeSignatureOffset >= 0) {
            if (reader.isInBounds(codeSignatureOffset, codeSignatureSize)) {
                readCodeSignature(reader, codeSignatureOffset, codeSignatureSize, builder);
                coverageEnd = codeSignatureOffset;
            } else {
                builder.anomaly("Code signature lies outside the file");
            }
        }
        if (checksumMisplaced) {
            builder.anomaly("Checksum section has unexpected size or position");
        } else if (checksumRange != null) {
            builder.declaredChecksum(new DeclaredChecksum(ChecksumAlgorithm.SHA_256,
                HashUtils.toHex(reader.bytes(checksumRange.offset(), 32, "checksum")),
                checksumRange, new ByteRange(base, coverageEnd - base)));
        }

        input.licenseTags().forEach(builder::license);
        input.algorithmIdentifiers().forEach(builder::algorithmIdentifier);

        log.debug("Mach-O {} image: {} load commands", wide ? "64-bit" : "32-bit", commandCount);
        return builder.build();
    }

    /**
     * Reads the embedded signature super-blob. Its index and blob headers are big-endian
     * regardless of the image byte order.
     */
    private static void readCodeSignature(BinaryReader reader, long offset, long size, BinaryDescriptor.Builder builder)
        throws BinaryFormatException {
        byte[] blob = reader.bytes(offset, size, "code signature");
        if (blob.length < 12 || BinaryReader.decode(blob, 0, 4, Endianness.BIG) != CSMAGIC_EMBEDDED_SIGNATURE) {
            builder.anomaly("Code signature does not start with an embedded-signature super-blob");
            return;
        }
        long count = BinaryReader.decode(blob, 8, 4, Endianness.BIG);
        if (count > MAX_BLOB_INDEX) {
            builder.anomaly("Code signature index declares " + count + " blobs");
            return;
        }
        int directoryOffset = -1;
        int directoryLength = 0;
        byte[] cms = null;
        for (int i = 0; i < count; i++) {
            int entry = 12 + i * 8;
            long type = BinaryReader.field(blob, entry, 4, Endianness.BIG);
            long blobStart = BinaryReader.field(blob, entry + 4, 4, Endianness.BIG);
            if (blobStart + 8 > blob.length) {
                builder.anomaly("Code signature blob " + i + " starts outside the super-blob");
                return;
            }
            int blobOffset = (int) blobStart;
            long blobMagic = BinaryReader.field(blob, blobOffset, 4, Endianness.BIG);
            long declaredLength = BinaryReader.field(blob, blobOffset + 4, 4, Endianness.BIG);
            if (declaredLength < 8 || blobStart + declaredLength > blob.length) {
                builder.anomaly("Code signature blob " + i + " overruns the super-blob");
                return;
            }
            int blobLength = (int) declaredLength;
            if (type == CSSLOT_CODEDIRECTORY && blobMagic == CSMAGIC_CODEDIRECTORY) {
                directoryOffset = blobOffset;
                directoryLength = blobLength;
            } else if (type == CSSLOT_SIGNATURESLOT && blobMagic == CSMAGIC_BLOBWRAPPER && blobLength > 8) {
                cms = Arrays.copyOfRange(blob, blobOffset + 8, blobOffset + blobLength);
            }
        }
        if (cms == null) {
            // ad-hoc signature: code directory without a CMS signer
            return;
        }
        if (directoryOffset < 0) {
            builder.anomaly("Code signature carries a CMS blob but no code directory");
            return;
        }
        byte[] directory = Arrays.copyOfRange(blob, directoryOffset, directoryOffset + directoryLength);
        EmbeddedSignatures.record(builder, SignatureKind.MACHO_CODE_SIGNATURE, cms,
            new ByteRange(offset + directoryOffset, directoryLength), List.of(), directory);
    }

    private static final Pattern PLIST_ENTRY = Pattern.compile(
        "<key>\\s*(CFBundleShortVersionString|CFBundleVersion|CFBundleIdentifier|CFBundleName)\\s*</key>\\s*"
            + "<string>\\s*([^<]*?)\\s*</string>");

    static void applyInfoPlist(String plist, BinaryDescriptor.Builder builder) {
        Matcher matcher = PLIST_ENTRY.matcher(plist);
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = matcher.group(2);
            switch (key) {
                case "CFBundleShortVersionString", "CFBundleVersion" -> builder.versionCandidate(key, value);
                case "CFBundleName" -> builder.property("package.name", value);
                default -> builder.property("bundle.identifier", value);
            }
        }
    }

    static String packedVersion(long packed) {
        return (packed >>> 16) + "." + ((packed >>> 8) & 0xFF) + "." + (packed & 0xFF);
    }

    private static BinaryKind kindOf(int fileType) {
        return switch (fileType) {
            case MH_OBJECT -> BinaryKind.OBJECT;
            case MH_EXECUTE -> BinaryKind.EXECUTABLE;
            case MH_DYLIB, MH_BUNDLE -> BinaryKind.SHARED_LIBRARY;
            default -> BinaryKind.OTHER;
        };
    }

    private static Set<SectionFlag> protectionFlags(int protection) {
        Set<SectionFlag> flags = EnumSet.noneOf(SectionFlag.class);
        if ((protection & VM_PROT_READ) != 0) {
            flags.add(SectionFlag.READ);
        }
        if ((protection & VM_PROT_WRITE) != 0) {
            flags.add(SectionFlag.WRITE);
        }
        if ((protection & VM_PROT_EXECUTE) != 0) {
            flags.add(SectionFlag.EXECUTE);
        }
        return flags;
    }

    private static Set<SectionFlag> sectionFlags(long flags, int segmentProtection) {
        Set<SectionFlag> result = protectionFlags(segmentProtection);
        result.remove(SectionFlag.EXECUTE);
        if ((flags & (S_ATTR_PURE_INSTRUCTIONS | S_ATTR_SOME_INSTRUCTIONS)) != 0) {
            result.add(SectionFlag.EXECUTE);
            result.add(SectionFlag.CODE);
        }
        if ((flags & 0xFF) == S_ZEROFILL) {
            result.add(SectionFlag.NO_FILE_DATA);
        }
        return result;
    }
}
