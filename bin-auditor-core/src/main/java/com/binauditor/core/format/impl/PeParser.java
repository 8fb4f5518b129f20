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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for PE/COFF images (PE32 and PE32+).
 *
 * <p>Reads the COFF and optional headers, the section table, the import directory, the
 * security directory (Authenticode {@code WIN_CERTIFICATE} entries), the load configuration
 * security cookie and the version resource.
 */
public class PeParser implements BinaryParser {

    private static final Logger log = LoggerFactory.getLogger(PeParser.class);

    static final int PE32_MAGIC = 0x10B;
    static final int PE32_PLUS_MAGIC = 0x20B;

    static final int IMAGE_FILE_EXECUTABLE_IMAGE = 0x0002;
    static final int IMAGE_FILE_DLL = 0x2000;

    static final int DLL_HIGH_ENTROPY_VA = 0x0020;
    static final int DLL_DYNAMIC_BASE = 0x0040;
    static final int DLL_NX_COMPAT = 0x0100;

    static final long SCN_CNT_CODE = 0x00000020L;
    static final long SCN_CNT_UNINITIALIZED_DATA = 0x00000080L;
    static final long SCN_MEM_EXECUTE = 0x20000000L;
    static final long SCN_MEM_READ = 0x40000000L;
    static final long SCN_MEM_WRITE = 0x80000000L;

    static final int DIR_IMPORT = 1;
    static final int DIR_RESOURCE = 2;
    static final int DIR_SECURITY = 4;
    static final int DIR_LOAD_CONFIG = 10;

    static final int WIN_CERT_TYPE_PKCS_SIGNED_DATA = 0x0002;
    static final int RT_VERSION = 16;
    static final byte[] FIXED_FILE_INFO_SIGNATURE = {(byte) 0xBD, 0x04, (byte) 0xEF, (byte) 0xFE};

    private static final int SECTION_HEADER_SIZE = 40;
    private static final int MAX_SECTIONS = 96;
    private static final int MAX_IMPORTS = 4096;
    private static final int MAX_CERTIFICATES = 16;
    private static final int MAX_RESOURCE_ENTRIES = 256;

    private static final Map<Integer, String> MACHINES = Map.of(
        0x014C, "i386",
        0x8664, "x86_64",
        0xAA64, "aarch64",
        0x01C0, "arm",
        0x01C4, "arm"
    );

    private record PeSection(String name, long virtualSize, long virtualAddress, long rawSize, long rawPointer,
                             long characteristics) {
    }

    @Override
    public BinaryFormat format() {
        return BinaryFormat.PE;
    }

    @Override
    public BinaryDescriptor parse(ByteSource source, ParseInput input) throws BinaryFormatException {
        BinaryReader reader = BinaryReader.over(source, Endianness.LITTLE);
        reader.requireRange(0, 0x40, "DOS header");
        long peOffset = reader.u32(0x3C);
        if (reader.u32(peOffset) != 0x00004550L) {
            throw new BinaryFormatException(Reason.MALFORMED_HEADER, "PE signature missing at offset " + peOffset);
        }
        long coff = peOffset + 4;
        reader.requireRange(coff, 20, "COFF header");
        int machine = reader.u16(coff);
        int sectionCount = reader.u16(coff + 2);
        int optionalSize = reader.u16(coff + 16);
        int characteristics = reader.u16(coff + 18);

        long optional = coff + 20;
        int magic = reader.u16(optional);
        boolean plus = switch (magic) {
            case PE32_MAGIC -> false;
            case PE32_PLUS_MAGIC -> true;
            default -> throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                "Unknown optional header magic 0x" + Integer.toHexString(magic));
        };
        int minimumOptional = plus ? 112 : 96;
        if (optionalSize < minimumOptional) {
            throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                "SizeOfOptionalHeader " + optionalSize + " is smaller than " + minimumOptional);
        }
        reader.requireRange(optional, optionalSize, "optional header");

        BinaryDescriptor.Builder builder = BinaryDescriptor.builder(BinaryFormat.PE)
            .bitness(plus ? 64 : 32)
            .endianness(Endianness.LITTLE)
            .fileSize(reader.size())
            .contentDigests(input.digests())
            .architecture(MACHINES.getOrDefault(machine, "unknown"))
            .property("machine", "0x" + Integer.toHexString(machine))
            .entryPoint(reader.u32(optional + 16));

        if ((characteristics & IMAGE_FILE_DLL) != 0) {
            builder.kind(BinaryKind.SHARED_LIBRARY);
        } else if ((characteristics & IMAGE_FILE_EXECUTABLE_IMAGE) != 0) {
            builder.kind(BinaryKind.EXECUTABLE);
        } else {
            builder.kind(BinaryKind.OBJECT);
        }

        long checksumOffset = optional + 64;
        long checksum = reader.u32(checksumOffset);
        int dllCharacteristics = reader.u16(optional + 70);
        if ((dllCharacteristics & DLL_DYNAMIC_BASE) != 0) {
            builder.flag(HardeningFlag.PIE);
        }
        if ((dllCharacteristics & DLL_NX_COMPAT) != 0) {
            builder.flag(HardeningFlag.NX_STACK);
        }
        if ((dllCharacteristics & DLL_HIGH_ENTROPY_VA) != 0) {
            builder.flag(HardeningFlag.HIGH_ENTROPY_ASLR);
        }

        long directoryCountOffset = optional + (plus ? 108 : 92);
        long directories = optional + (plus ? 112 : 96);
        long directoryCount = Math.min(reader.u32(directoryCountOffset), (optionalSize - (directories - optional)) / 8);

        if (sectionCount > MAX_SECTIONS) {
            builder.anomaly("Section count " + sectionCount + " exceeds the PE loader limit of " + MAX_SECTIONS);
        }
        long sectionTable = optional + optionalSize;
        byte[] table = reader.bytes(sectionTable, (long) sectionCount * SECTION_HEADER_SIZE, "section table");
        List<PeSection> sections = new ArrayList<>();
        for (int i = 0; i < sectionCount; i++) {
            int base = i * SECTION_HEADER_SIZE;
            PeSection section = new PeSection(
                BinaryReader.cString(Arrays.copyOfRange(table, base, base + 8), 0),
                BinaryReader.decode(table, base + 8, 4, Endianness.LITTLE),
                BinaryReader.decode(table, base + 12, 4, Endianness.LITTLE),
                BinaryReader.decode(table, base + 16, 4, Endianness.LITTLE),
                BinaryReader.decode(table, base + 20, 4, Endianness.LITTLE),
                BinaryReader.decode(table, base + 36, 4, Endianness.LITTLE));
            sections.add(section);
            builder.section(new Section(section.name(), SectionKind.SECTION, section.rawPointer(), section.rawSize(),
                section.virtualAddress(), section.virtualSize(), sectionFlags(section)));
        }

        if (directoryCount > DIR_IMPORT) {
            readImports(reader, sections, directories, builder);
        }
        if (directoryCount > DIR_LOAD_CONFIG) {
            readLoadConfig(reader, sections, directories, plus, builder);
        }
        if (directoryCount > DIR_RESOURCE) {
            try {
                readVersionResource(reader, sections, directories, builder);
            } catch (BinaryFormatException e) {
                builder.anomaly("Resource directory is damaged: " + e.getMessage());
            }
        }
        if (directoryCount > DIR_SECURITY) {
            readSecurityDirectory(reader, directories, checksumOffset, builder);
        }
        if (checksum != 0) {
            builder.declaredChecksum(new DeclaredChecksum(ChecksumAlgorithm.PE_IMAGE_CHECKSUM,
                String.format("%08x", checksum), new ByteRange(checksumOffset, 4), new ByteRange(0, reader.size())));
        }

        input.licenseTags().forEach(builder::license);
        input.algorithmIdentifiers().forEach(builder::algorithmIdentifier);

        log.debug("PE{} image: {} sections, machine 0x{}", plus ? "32+" : "32", sectionCount,
            Integer.toHexString(machine));
        return builder.build();
    }

    private static void readImports(BinaryReader reader, List<PeSection> sections, long directories,
                                    BinaryDescriptor.Builder builder) throws BinaryFormatException {
        long rva = reader.u32(directories + DIR_IMPORT * 8L);
        if (rva == 0) {
            return;
        }
        long offset = rvaToOffset(sections, rva);
        if (offset < 0) {
            builder.anomaly("Import directory RVA 0x" + Long.toHexString(rva) + " is not mapped by any section");
            return;
        }
        for (int i = 0; i < MAX_IMPORTS; i++) {
            long descriptor = offset + i * 20L;
            byte[] entry = reader.bytes(descriptor, 20, "import descriptor");
            long nameRva = BinaryReader.decode(entry, 12, 4, Endianness.LITTLE);
            if (nameRva == 0 && BinaryReader.decode(entry, 16, 4, Endianness.LITTLE) == 0) {
                return;
            }
            long nameOffset = rvaToOffset(sections, nameRva);
            if (nameOffset < 0) {
                builder.anomaly("Import name RVA 0x" + Long.toHexString(nameRva) + " is not mapped by any section");
                continue;
            }
            builder.importedLibrary(new ImportedLibrary(reader.cString(nameOffset, 256), null, List.of()));
        }
    }

    private static void readLoadConfig(BinaryReader reader, List<PeSection> sections, long directories, boolean plus,
                                       BinaryDescriptor.Builder builder) throws BinaryFormatException {
        long rva = reader.u32(directories + DIR_LOAD_CONFIG * 8L);
        if (rva == 0) {
            return;
        }
        long offset = rvaToOffset(sections, rva);
        if (offset < 0) {
            return;
        }
        long structSize = reader.u32(offset);
        int cookieField = plus ? 0x58 : 0x3C;
        int cookieWidth = plus ? 8 : 4;
        if (structSize >= cookieField + cookieWidth) {
            long cookie = reader.word(offset + cookieField, plus);
            if (cookie != 0) {
                builder.flag(HardeningFlag.STACK_PROTECTION);
            }
        }
    }

    private static void readSecurityDirectory(BinaryReader reader, long directories, long checksumOffset,
                                              BinaryDescriptor.Builder builder) throws BinaryFormatException {
        long entryOffset = directories + DIR_SECURITY * 8L;
        long tableOffset = reader.u32(entryOffset);
        long tableSize = reader.u32(entryOffset + 4);
        if (tableOffset == 0 || tableSize == 0) {
            return;
        }
        if (!reader.isInBounds(tableOffset, tableSize)) {
            builder.anomaly("Certificate table lies outside the file");
            return;
        }
        List<ByteRange> excluded = List.of(
            new ByteRange(checksumOffset, 4),
            new ByteRange(entryOffset, 8),
            new ByteRange(tableOffset, tableSize));
        ByteRange signed = new ByteRange(0, reader.size());

        long cursor = tableOffset;
        long end = tableOffset + tableSize;
        for (int i = 0; i < MAX_CERTIFICATES && cursor + 8 <= end; i++) {
            long length = reader.u32(cursor);
            int type = reader.u16(cursor + 6);
            if (length < 8 || cursor + length > end) {
                builder.anomaly("WIN_CERTIFICATE entry at offset " + cursor + " has invalid length " + length);
                return;
            }
            if (type == WIN_CERT_TYPE_PKCS_SIGNED_DATA) {
                byte[] cms = reader.bytes(cursor + 8, length - 8, "Authenticode signature");
                EmbeddedSignatures.record(builder, SignatureKind.AUTHENTICODE, cms, signed, excluded, null);
            }
            cursor += (length + 7) & ~7L;
        }
    }

    private static void readVersionResource(BinaryReader reader, List<PeSection> sections, long directories,
                                            BinaryDescriptor.Builder builder) throws BinaryFormatException {
        long rva = reader.u32(directories + DIR_RESOURCE * 8L);
        long size = reader.u32(directories + DIR_RESOURCE * 8L + 4);
        if (rva == 0 || size == 0) {
            return;
        }
        long root = rvaToOffset(sections, rva);
        if (root < 0) {
            return;
        }
        long typeDirectory = findEntry(reader, root, root, RT_VERSION);
        if (typeDirectory < 0) {
            return;
        }
        long nameDirectory = firstEntry(reader, root, typeDirectory);
        long languageEntry = nameDirectory < 0 ? -1 : firstEntry(reader, root, nameDirectory);
        if (languageEntry < 0) {
            return;
        }
        long dataRva = reader.u32(languageEntry);
        long dataSize = reader.u32(languageEntry + 4);
        long dataOffset = rvaToOffset(sections, dataRva);
        if (dataOffset < 0 || !reader.isInBounds(dataOffset, dataSize)) {
            builder.anomaly("Version resource lies outside the file");
            return;
        }
        applyVersionInfo(reader.bytes(dataOffset, dataSize, "version resource"), builder);
    }

    /**
     * Returns the absolute offset of the subdirectory or data entry for {@code id}, or -1.
     */
    private static long findEntry(BinaryReader reader, long root, long directory, int id) throws BinaryFormatException {
        int named = reader.u16(directory + 12);
        int ids = reader.u16(directory + 14);
        int total = Math.min(named + ids, MAX_RESOURCE_ENTRIES);
        for (int i = 0; i < total; i++) {
            long entry = directory + 16 + i * 8L;
            long name = reader.u32(entry);
            if ((name & 0x80000000L) == 0 && name == id) {
                return root + (reader.u32(entry + 4) & 0x7FFFFFFFL);
            }
        }
        return -1;
    }

    private static long firstEntry(BinaryReader reader, long root, long directory) throws BinaryFormatException {
        int total = reader.u16(directory + 12) + reader.u16(directory + 14);
        if (total == 0) {
            return -1;
        }
        return root + (reader.u32(directory + 16 + 4) & 0x7FFFFFFFL);
    }

    static void applyVersionInfo(byte[] versionInfo, BinaryDescriptor.Builder builder) {
        int fixed = indexOf(versionInfo, FIXED_FILE_INFO_SIGNATURE, 0);
        if (fixed >= 0 && fixed + 24 <= versionInfo.length) {
            builder.versionCandidate("FixedFileVersion", fourPart(versionInfo, fixed + 8));
            builder.versionCandidate("FixedProductVersion", fourPart(versionInfo, fixed + 16));
        }
        String fileVersion = stringValue(versionInfo, "FileVersion");
        String productVersion = stringValue(versionInfo, "ProductVersion");
        builder.versionCandidate("FileVersion", normalizeVersion(fileVersion));
        builder.versionCandidate("ProductVersion", normalizeVersion(productVersion));
        builder.property("package.name", stringValue(versionInfo, "ProductName"));
    }

    private static String fourPart(byte[] data, int offset) {
        long ms = BinaryReader.decode(data, offset, 4, Endianness.LITTLE);
        long ls = BinaryReader.decode(data, offset + 4, 4, Endianness.LITTLE);
        return (ms >>> 16) + "." + (ms & 0xFFFF) + "." + (ls >>> 16) + "." + (ls & 0xFFFF);
    }

    private static String normalizeVersion(String value) {
        return value == null ? null : value.replaceAll("\\s*,\\s*", ".").strip();
    }

    /**
     * Reads the value of a {@code String} structure in a {@code StringFileInfo} block. Values
     * are UTF-16LE and start at the next 32-bit boundary after the NUL-terminated key.
     */
    private static String stringValue(byte[] data, String key) {
        byte[] pattern = (key + "\0").getBytes(StandardCharsets.UTF_16LE);
        int position = indexOf(data, pattern, 0);
        while (position >= 0 && position % 2 != 0) {
            position = indexOf(data, pattern, position + 1);
        }
        if (position < 0) {
            return null;
        }
        int cursor = position + pattern.length;
        cursor = (cursor + 3) & ~3;
        StringBuilder value = new StringBuilder();
        while (cursor + 1 < data.length) {
            char c = (char) ((data[cursor] & 0xFF) | ((data[cursor + 1] & 0xFF) << 8));
            if (c == 0) {
                break;
            }
            value.append(c);
            cursor += 2;
        }
        return value.length() == 0 ? null : value.toString();
    }

    private static int indexOf(byte[] data, byte[] pattern, int from) {
        outer:
        for (int i = Math.max(from, 0); i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static long rvaToOffset(List<PeSection> sections, long rva) {
        for (PeSection section : sections) {
            long span = Math.max(section.virtualSize(), section.rawSize());
            if (rva >= section.virtualAddress() && rva < section.virtualAddress() + span) {
                long delta = rva - section.virtualAddress();
                return delta < section.rawSize() ? section.rawPointer() + delta : -1;
            }
        }
        return -1;
    }

    private static Set<SectionFlag> sectionFlags(PeSection section) {
        Set<SectionFlag> flags = EnumSet.noneOf(SectionFlag.class);
        long c = section.characteristics();
        if ((c & SCN_MEM_READ) != 0) {
            flags.add(SectionFlag.READ);
        }
        if ((c & SCN_MEM_WRITE) != 0) {
            flags.add(SectionFlag.WRITE);
        }
        if ((c & SCN_MEM_EXECUTE) != 0) {
            flags.add(SectionFlag.EXECUTE);
        }
        if ((c & SCN_CNT_CODE) != 0) {
            flags.add(SectionFlag.CODE);
        }
        if ((c & SCN_CNT_UNINITIALIZED_DATA) != 0 && section.rawSize() == 0) {
            flags.add(SectionFlag.NO_FILE_DATA);
        }
        return flags;
    }
}
