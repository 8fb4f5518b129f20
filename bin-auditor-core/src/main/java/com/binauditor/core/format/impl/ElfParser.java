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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for ELF objects, executables and shared libraries (32/64-bit, either byte order).
 *
 * <p>Besides the header tables it reads:
 * <ul>
 *   <li>dynamic section: {@code DT_NEEDED}, {@code DT_SONAME}, {@code DT_FLAGS_1}</li>
 *   <li>{@code .gnu.version_r}: symbol versions required from each dependency</li>
 *   <li>{@code .note.package}: FDO package metadata note (JSON name, version, license)</li>
 *   <li>{@code .checksum}: 32-byte SHA-256 over the file up to any appended signature,
 *       with the checksum bytes read as zeros</li>
 *   <li>appended PKCS#7 signature behind a {@code module_signature} trailer</li>
 * </ul>
 */
public class ElfParser implements BinaryParser {

    private static final Logger log = LoggerFactory.getLogger(ElfParser.class);

    static final int ET_REL = 1;
    static final int ET_EXEC = 2;
    static final int ET_DYN = 3;
    static final int ET_CORE = 4;

    static final long PT_LOAD = 1;
    static final long PT_DYNAMIC = 2;
    static final long PT_INTERP = 3;
    static final long PT_NOTE = 4;
    static final long PT_GNU_STACK = 0x6474e551L;
    static final long PT_GNU_RELRO = 0x6474e552L;

    static final int PF_X = 0x1;
    static final int PF_W = 0x2;
    static final int PF_R = 0x4;

    static final long SHT_STRTAB = 3;
    static final long SHT_DYNAMIC = 6;
    static final long SHT_NOTE = 7;
    static final long SHT_NOBITS = 8;
    static final long SHT_GNU_VERNEED = 0x6ffffffeL;

    static final long SHF_WRITE = 0x1;
    static final long SHF_ALLOC = 0x2;
    static final long SHF_EXECINSTR = 0x4;

    static final long DT_NULL = 0;
    static final long DT_NEEDED = 1;
    static final long DT_STRTAB = 5;
    static final long DT_STRSZ = 10;
    static final long DT_SONAME = 14;
    static final long DT_FLAGS_1 = 0x6ffffffbL;
    static final long DF_1_PIE = 0x08000000L;

    static final String CHECKSUM_SECTION = ".checksum";
    static final int CHECKSUM_LENGTH = 32;

    static final String PACKAGE_NOTE_OWNER = "FDO";
    static final long PACKAGE_NOTE_TYPE = 0xcafe1a7eL;

    static final byte[] MODULE_SIGNATURE_MAGIC = "~Module signature appended~\n".getBytes(StandardCharsets.US_ASCII);
    static final int MODULE_SIGNATURE_INFO_SIZE = 12;
    static final int PKEY_ID_PKCS7 = 2;

    private static final int MAX_VERNEED_ENTRIES = 4096;
    private static final long MAX_SECTIONS = 1 << 20;
    private static final int MAX_NOTE_BYTES = 64 * 1024;
    private static final Pattern SONAME_VERSION = Pattern.compile("\\.so\\.(\\d+\\.\\d+\\.\\d+)$");
    private static final List<String> STACK_PROTECTOR_SYMBOLS = List.of("__stack_chk_fail", "__stack_chk_guard");

    private static final Map<Integer, String> MACHINES = Map.of(
        3, "i386",
        8, "mips",
        0x14, "ppc",
        0x15, "ppc64",
        0x16, "s390x",
        0x28, "arm",
        0x3E, "x86_64",
        0xB7, "aarch64",
        0xF3, "riscv"
    );

    private final ObjectMapper objectMapper = new ObjectMapper();

    private record Segment(long type, int flags, long offset, long vaddr, long fileSize, long memSize) {
    }

    private record RawSection(int index, String name, long type, long flags, long addr, long offset, long size,
                              long link, long info) {
    }

    @Override
    public BinaryFormat format() {
        return BinaryFormat.ELF;
    }

    @Override
    public BinaryDescriptor parse(ByteSource source, ParseInput input) throws BinaryFormatException {
        BinaryReader reader = BinaryReader.over(source, Endianness.LITTLE);
        byte[] ident = reader.bytes(0, 16, "ELF identification");
        boolean wide = switch (ident[4]) {
            case 1 -> false;
            case 2 -> true;
            default -> throw new BinaryFormatException(Reason.MALFORMED_HEADER, "Invalid ELF class " + ident[4]);
        };
        Endianness endianness = switch (ident[5]) {
            case 1 -> Endianness.LITTLE;
            case 2 -> Endianness.BIG;
            default -> throw new BinaryFormatException(Reason.MALFORMED_HEADER, "Invalid ELF data encoding " + ident[5]);
        };
        reader.setEndianness(endianness);
        int headerSize = wide ? 64 : 52;
        reader.requireRange(0, headerSize, "ELF header");

        BinaryDescriptor.Builder builder = BinaryDescriptor.builder(BinaryFormat.ELF)
            .bitness(wide ? 64 : 32)
            .endianness(endianness)
            .fileSize(reader.size())
            .contentDigests(input.digests());
        if (ident[6] != 1) {
            builder.anomaly("ELF identification version is " + ident[6] + ", expected 1");
        }

        int type = reader.u16(16);
        int machine = reader.u16(18);
        if (reader.u32(20) != 1) {
            builder.anomaly("e_version is " + reader.u32(20) + ", expected 1");
        }
        builder.architecture(MACHINES.getOrDefault(machine, "unknown"))
            .property("machine", "0x" + Integer.toHexString(machine))
            .entryPoint(reader.word(24, wide));

        long phoff = reader.word(wide ? 32 : 28, wide);
        long shoff = reader.word(wide ? 40 : 32, wide);
        int ehsize = reader.u16(wide ? 52 : 40);
        if (ehsize != headerSize) {
            builder.anomaly("e_ehsize is " + ehsize + ", expected " + headerSize);
        }
        int phentsize = reader.u16(wide ? 54 : 42);
        int phnum = reader.u16(wide ? 56 : 44);
        int shentsize = reader.u16(wide ? 58 : 46);
        int shnum = reader.u16(wide ? 60 : 48);
        int shstrndx = reader.u16(wide ? 62 : 50);

        List<Segment> segments = readSegments(reader, wide, phoff, phentsize, phnum);
        List<RawSection> sections = readSections(reader, wide, shoff, shentsize, shnum, shstrndx, builder);

        for (Segment segment : segments) {
            builder.section(new Section(segmentName(segment.type()), SectionKind.SEGMENT, segment.offset(),
                segment.fileSize(), segment.vaddr(), segment.memSize(), segmentFlags(segment.flags())));
        }
        for (RawSection section : sections) {
            builder.section(new Section(section.name(), SectionKind.SECTION, section.offset(),
                section.type() == SHT_NOBITS ? 0 : section.size(), section.addr(), section.size(),
                sectionFlags(section)));
        }

        DynamicInfo dynamic = readDynamic(reader, wide, segments, sections);
        boolean hasInterp = segments.stream().anyMatch(s -> s.type() == PT_INTERP);
        builder.kind(kindOf(type, hasInterp, dynamic.flags1(), builder));
        if (type == ET_DYN && (hasInterp || (dynamic.flags1() & DF_1_PIE) != 0)) {
            builder.flag(HardeningFlag.PIE);
        }
        segments.stream().filter(s -> s.type() == PT_GNU_STACK).findFirst()
            .filter(s -> (s.flags() & PF_X) == 0)
            .ifPresent(s -> builder.flag(HardeningFlag.NX_STACK));
        if (segments.stream().anyMatch(s -> s.type() == PT_GNU_RELRO)) {
            builder.flag(HardeningFlag.RELRO);
        }

        Map<String, List<String>> versionNeeds = readVersionNeeds(reader, sections);
        for (String needed : dynamic.needed()) {
            builder.importedLibrary(new ImportedLibrary(needed, sonameVersion(needed),
                versionNeeds.getOrDefault(needed, List.of())));
        }
        if (dynamic.soname() != null) {
            builder.property("soname", dynamic.soname());
            Matcher m = SONAME_VERSION.matcher(dynamic.soname());
            if (m.find()) {
                builder.versionCandidate("soname", m.group(1));
            }
        }

        if (hasStackProtector(reader, sections, dynamic)) {
            builder.flag(HardeningFlag.STACK_PROTECTION);
        }

        readPackageNotes(reader, segments, sections, builder);
        input.licenseTags().forEach(builder::license);
        input.algorithmIdentifiers().forEach(builder::algorithmIdentifier);

        long signatureStart = readAppendedSignature(reader, headerSize, builder);
        readChecksum(reader, sections, signatureStart, builder);

        log.debug("ELF{} {} binary: {} segments, {} sections, {} needed libraries",
            wide ? 64 : 32, endianness, segments.size(), sections.size(), dynamic.needed().size());
        return builder.build();
    }

    private static List<Segment> readSegments(BinaryReader reader, boolean wide, long phoff, int entrySize, int count)
        throws BinaryFormatException {
        List<Segment> segments = new ArrayList<>();
        if (count == 0) {
            return segments;
        }
        int minimum = wide ? 56 : 32;
        if (entrySize < minimum) {
            throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                "e_phentsize " + entrySize + " is smaller than " + minimum);
        }
        byte[] table = reader.bytes(phoff, BinaryReader.tableSize(entrySize, count, "program header table"),
            "program header table");
        Endianness order = reader.endianness();
        for (int i = 0; i < count; i++) {
            int base = i * entrySize;
            if (wide) {
                segments.add(new Segment(
                    BinaryReader.decode(table, base, 4, order),
                    (int) BinaryReader.decode(table, base + 4, 4, order),
                    BinaryReader.decode(table, base + 8, 8, order),
                    BinaryReader.decode(table, base + 16, 8, order),
                    BinaryReader.decode(table, base + 32, 8, order),
                    BinaryReader.decode(table, base + 40, 8, order)));
            } else {
                segments.add(new Segment(
                    BinaryReader.decode(table, base, 4, order),
                    (int) BinaryReader.decode(table, base + 24, 4, order),
                    BinaryReader.decode(table, base + 4, 4, order),
                    BinaryReader.decode(table, base + 8, 4, order),
                    BinaryReader.decode(table, base + 16, 4, order),
                    BinaryReader.decode(table, base + 20, 4, order)));
            }
        }
        return segments;
    }

    private static List<RawSection> readSections(BinaryReader reader, boolean wide, long shoff, int entrySize,
                                                 int declaredCount, int shstrndx, BinaryDescriptor.Builder builder)
        throws BinaryFormatException {
        List<RawSection> sections = new ArrayList<>();
        if (shoff == 0) {
            return sections;
        }
        int minimum = wide ? 64 : 40;
        if (entrySize < minimum) {
            throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                "e_shentsize " + entrySize + " is smaller than " + minimum);
        }
        long count = declaredCount;
        long nameIndex = shstrndx;
        if (declaredCount == 0 || shstrndx == 0xFFFF) {
            // extended numbering keeps the real values in section 0
            byte[] first = reader.bytes(shoff, entrySize, "section header 0");
            if (declaredCount == 0) {
                count = BinaryReader.decode(first, wide ? 32 : 20, wide ? 8 : 4, reader.endianness());
            }
            if (shstrndx == 0xFFFF) {
                nameIndex = BinaryReader.decode(first, wide ? 40 : 24, 4, reader.endianness());
            }
        }
        if (count < 0 || count > MAX_SECTIONS) {
            throw new BinaryFormatException(Reason.MALFORMED_HEADER,
                "Section count " + Long.toUnsignedString(count) + " exceeds " + MAX_SECTIONS);
        }
        byte[] table = reader.bytes(shoff, BinaryReader.tableSize(entrySize, count, "section header table"),
            "section header table");
        Endianness order = reader.endianness();
        List<long[]> raw = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int base = i * entrySize;
            if (wide) {
                raw.add(new long[] {
                    BinaryReader.decode(table, base, 4, order),
                    BinaryReader.decode(table, base + 4, 4, order),
                    BinaryReader.decode(table, base + 8, 8, order),
                    BinaryReader.decode(table, base + 16, 8, order),
                    BinaryReader.decode(table, base + 24, 8, order),
                    BinaryReader.decode(table, base + 32, 8, order),
                    BinaryReader.decode(table, base + 40, 4, order),
                    BinaryReader.decode(table, base + 44, 4, order)});
            } else {
                raw.add(new long[] {
                    BinaryReader.decode(table, base, 4, order),
                    BinaryReader.decode(table, base + 4, 4, order),
                    BinaryReader.decode(table, base + 8, 4, order),
                    BinaryReader.decode(table, base + 12, 4, order),
                    BinaryReader.decode(table, base + 16, 4, order),
                    BinaryReader.decode(table, base + 20, 4, order),
                    BinaryReader.decode(table, base + 24, 4, order),
                    BinaryReader.decode(table, base + 28, 4, order)});
            }
        }

        byte[] names = new byte[0];
        if (nameIndex > 0 && nameIndex < raw.size()) {
            long[] strtab = raw.get((int) nameIndex);
            if (reader.isInBounds(strtab[4], strtab[5])) {
                names = reader.bytes(strtab[4], strtab[5], "section name table");
            } else {
                builder.anomaly("Section name table lies outside the file");
            }
        } else if (nameIndex != 0) {
            builder.anomaly("e_shstrndx " + nameIndex + " is out of range");
        }

        for (int i = 1; i < raw.size(); i++) {
            long[] s = raw.get(i);
            if (s[1] == 0) {
                continue;
            }
            sections.add(new RawSection(i, BinaryReader.cString(names, s[0]), s[1], s[2], s[3], s[4], s[5],
                s[6], s[7]));
        }
        return sections;
    }

    private record DynamicInfo(List<String> needed, String soname, long flags1, byte[] strings) {
    }

    private static DynamicInfo readDynamic(BinaryReader reader, boolean wide, List<Segment> segments,
                                           List<RawSection> sections) throws BinaryFormatException {
        byte[] entries = null;
        byte[] strings = null;
        RawSection dynamicSection = sections.stream().filter(s -> s.type() == SHT_DYNAMIC).findFirst().orElse(null);
        if (dynamicSection != null && reader.isInBounds(dynamicSection.offset(), dynamicSection.size())) {
            entries = reader.bytes(dynamicSection.offset(), dynamicSection.size(), "dynamic section");
            RawSection strtab = byIndex(sections, dynamicSection.link());
            if (strtab != null && reader.isInBounds(strtab.offset(), strtab.size())) {
                strings = reader.bytes(strtab.offset(), strtab.size(), "dynamic string table");
            }
        } else {
            Segment dynamicSegment = segments.stream().filter(s -> s.type() == PT_DYNAMIC).findFirst().orElse(null);
            if (dynamicSegment != null && reader.isInBounds(dynamicSegment.offset(), dynamicSegment.fileSize())) {
                entries = reader.bytes(dynamicSegment.offset(), dynamicSegment.fileSize(), "dynamic segment");
            }
        }
        if (entries == null) {
            return new DynamicInfo(List.of(), null, 0, new byte[0]);
        }

        int entrySize = wide ? 16 : 8;
        int wordSize = wide ? 8 : 4;
        List<Long> neededOffsets = new ArrayList<>();
        long soname = -1;
        long flags1 = 0;
        long strtabAddress = -1;
        long strtabSize = 0;
        for (int base = 0; base + entrySize <= entries.length; base += entrySize) {
            long tag = BinaryReader.decode(entries, base, wordSize, reader.endianness());
            long value = BinaryReader.decode(entries, base + wordSize, wordSize, reader.endianness());
            if (tag == DT_NULL) {
                break;
            } else if (tag == DT_NEEDED) {
                neededOffsets.add(value);
            } else if (tag == DT_SONAME) {
                soname = value;
            } else if (tag == DT_FLAGS_1) {
                flags1 = value;
            } else if (tag == DT_STRTAB) {
                strtabAddress = value;
            } else if (tag == DT_STRSZ) {
                strtabSize = value;
            }
        }
        if (strings == null && strtabAddress >= 0) {
            long offset = toFileOffset(segments, strtabAddress);
            if (offset >= 0 && reader.isInBounds(offset, strtabSize)) {
                strings = reader.bytes(offset, strtabSize, "dynamic string table");
            }
        }
        if (strings == null) {
            strings = new byte[0];
        }
        List<String> needed = new ArrayList<>();
        for (long offset : neededOffsets) {
            String name = BinaryReader.cString(strings, offset);
            if (!name.isEmpty()) {
                needed.add(name);
            }
        }
        String sonameValue = soname >= 0 ? BinaryReader.cString(strings, soname) : null;
        return new DynamicInfo(needed, sonameValue == null || sonameValue.isEmpty() ? null : sonameValue,
            flags1, strings);
    }

    private static long toFileOffset(List<Segment> segments, long address) {
        for (Segment segment : segments) {
            if (segment.type() == PT_LOAD && address >= segment.vaddr()
                && address < segment.vaddr() + segment.fileSize()) {
                return segment.offset() + (address - segment.vaddr());
            }
        }
        return -1;
    }

    private static Map<String, List<String>> readVersionNeeds(BinaryReader reader, List<RawSection> sections)
        throws BinaryFormatException {
        Map<String, List<String>> needs = new LinkedHashMap<>();
        RawSection verneed = sections.stream().filter(s -> s.type() == SHT_GNU_VERNEED).findFirst().orElse(null);
        if (verneed == null || !reader.isInBounds(verneed.offset(), verneed.size())) {
            return needs;
        }
        RawSection strtab = byIndex(sections, verneed.link());
        if (strtab == null || !reader.isInBounds(strtab.offset(), strtab.size())) {
            return needs;
        }
        byte[] data = reader.bytes(verneed.offset(), verneed.size(), "version needs");
        byte[] strings = reader.bytes(strtab.offset(), strtab.size(), "version string table");
        Endianness order = reader.endianness();

        long entry = 0;
        int visited = 0;
        for (long i = 0; i < verneed.info() && visited < MAX_VERNEED_ENTRIES; i++) {
            if (entry < 0 || entry + 16 > data.length) {
                break;
            }
            int base = (int) entry;
            int auxCount = (int) BinaryReader.field(data, base + 2, 2, order);
            String file = BinaryReader.cString(strings, BinaryReader.field(data, base + 4, 4, order));
            long aux = entry + BinaryReader.field(data, base + 8, 4, order);
            List<String> versions = needs.computeIfAbsent(file, k -> new ArrayList<>());
            for (int j = 0; j < auxCount && visited < MAX_VERNEED_ENTRIES; j++, visited++) {
                if (aux < 0 || aux + 16 > data.length) {
                    break;
                }
                int auxBase = (int) aux;
                versions.add(BinaryReader.cString(strings, BinaryReader.field(data, auxBase + 8, 4, order)));
                long next = BinaryReader.field(data, auxBase + 12, 4, order);
                if (next == 0) {
                    break;
                }
                aux += next;
            }
            long next = BinaryReader.field(data, base + 12, 4, order);
            if (next == 0) {
                break;
            }
            entry += next;
        }
        return needs;
    }

    private static boolean hasStackProtector(BinaryReader reader, List<RawSection> sections, DynamicInfo dynamic)
        throws BinaryFormatException {
        if (containsSymbol(dynamic.strings())) {
            return true;
        }
        for (RawSection section : sections) {
            if (section.type() == SHT_STRTAB && reader.isInBounds(section.offset(), section.size())
                && section.size() <= BinaryReader.MAX_REGION
                && containsSymbol(reader.bytes(section.offset(), section.size(), "string table"))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsSymbol(byte[] strings) {
        String table = new String(strings, StandardCharsets.ISO_8859_1);
        return STACK_PROTECTOR_SYMBOLS.stream().anyMatch(table::contains);
    }

    private void readPackageNotes(BinaryReader reader, List<Segment> segments, List<RawSection> sections,
                                  BinaryDescriptor.Builder builder) throws BinaryFormatException {
        List<long[]> regions = new ArrayList<>();
        for (RawSection section : sections) {
            if (section.type() == SHT_NOTE) {
                regions.add(new long[] {section.offset(), section.size()});
            }
        }
        if (sections.isEmpty()) {
            for (Segment segment : segments) {
                if (segment.type() == PT_NOTE) {
                    regions.add(new long[] {segment.offset(), segment.fileSize()});
                }
            }
        }
        for (long[] region : regions) {
            if (!reader.isInBounds(region[0], region[1]) || region[1] > MAX_NOTE_BYTES) {
                continue;
            }
            byte[] notes = reader.bytes(region[0], region[1], "note");
            int cursor = 0;
            while (cursor + 12 <= notes.length) {
                long nameSize = BinaryReader.decode(notes, cursor, 4, reader.endianness());
                long descSize = BinaryReader.decode(notes, cursor + 4, 4, reader.endianness());
                long noteType = BinaryReader.decode(notes, cursor + 8, 4, reader.endianness());
                long nameStart = cursor + 12L;
                long descStart = nameStart + align4(nameSize);
                long end = descStart + align4(descSize);
                if (descStart + descSize > notes.length) {
                    builder.anomaly("Note entry overruns its section");
                    break;
                }
                String owner = BinaryReader.cString(notes, (int) nameStart);
                if (PACKAGE_NOTE_OWNER.equals(owner) && noteType == PACKAGE_NOTE_TYPE) {
                    applyPackageMetadata(new String(notes, (int) descStart, (int) descSize, StandardCharsets.UTF_8),
                        builder);
                }
                cursor = (int) end;
            }
        }
    }

    private void applyPackageMetadata(String json, BinaryDescriptor.Builder builder) {
        try {
            JsonNode node = objectMapper.readTree(json.replace("\0", "").strip());
            builder.property("package.name", text(node, "name"))
                .property("package.type", text(node, "type"))
                .license(text(node, "license"))
                .versionCandidate("package-note", text(node, "version"));
        } catch (JsonProcessingException e) {
            builder.anomaly("Package metadata note is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static long readAppendedSignature(BinaryReader reader, int headerSize, BinaryDescriptor.Builder builder)
        throws BinaryFormatException {
        long size = reader.size();
        int trailer = MODULE_SIGNATURE_MAGIC.length + MODULE_SIGNATURE_INFO_SIZE;
        if (size < headerSize + trailer) {
            return size;
        }
        byte[] magic = reader.bytes(size - MODULE_SIGNATURE_MAGIC.length, MODULE_SIGNATURE_MAGIC.length, "signature magic");
        if (!Arrays.equals(magic, MODULE_SIGNATURE_MAGIC)) {
            return size;
        }
        byte[] info = reader.bytes(size - trailer, MODULE_SIGNATURE_INFO_SIZE, "module signature info");
        int idType = info[2] & 0xFF;
        long signatureLength = BinaryReader.decode(info, 8, 4, Endianness.BIG);
        long start = size - trailer - signatureLength;
        if (signatureLength == 0 || start < headerSize) {
            builder.anomaly("Appended signature length " + signatureLength + " does not fit the file");
            return size;
        }
        if (idType != PKEY_ID_PKCS7) {
            builder.anomaly("Appended signature uses unsupported id type " + idType);
            return start;
        }
        byte[] cms = reader.bytes(start, signatureLength, "appended signature");
        EmbeddedSignatures.record(builder, SignatureKind.ELF_APPENDED_SIGNATURE, cms, new ByteRange(0, start),
            List.of(), null);
        return start;
    }

    private static void readChecksum(BinaryReader reader, List<RawSection> sections, long coverageEnd,
                                     BinaryDescriptor.Builder builder) throws BinaryFormatException {
        for (RawSection section : sections) {
            if (!CHECKSUM_SECTION.equals(section.name())) {
                continue;
            }
            if (section.size() != CHECKSUM_LENGTH || !reader.isInBounds(section.offset(), section.size())) {
                builder.anomaly("Checksum section has unexpected size or position");
                return;
            }
            byte[] value = reader.bytes(section.offset(), CHECKSUM_LENGTH, "checksum");
            builder.declaredChecksum(new DeclaredChecksum(ChecksumAlgorithm.SHA_256, HashUtils.toHex(value),
                new ByteRange(section.offset(), CHECKSUM_LENGTH), new ByteRange(0, coverageEnd)));
            return;
        }
    }

    private static BinaryKind kindOf(int type, boolean hasInterp, long flags1, BinaryDescriptor.Builder builder) {
        return switch (type) {
            case ET_REL -> BinaryKind.OBJECT;
            case ET_EXEC -> BinaryKind.EXECUTABLE;
            case ET_DYN -> hasInterp || (flags1 & DF_1_PIE) != 0 ? BinaryKind.EXECUTABLE : BinaryKind.SHARED_LIBRARY;
            case ET_CORE -> BinaryKind.OTHER;
            default -> {
                builder.anomaly("Unknown ELF type 0x" + Integer.toHexString(type));
                yield BinaryKind.OTHER;
            }
        };
    }

    private static String sonameVersion(String library) {
        int index = library.indexOf(".so.");
        return index >= 0 ? library.substring(index + 4) : null;
    }

    private static RawSection byIndex(List<RawSection> sections, long index) {
        for (RawSection section : sections) {
            if (section.index() == index) {
                return section;
            }
        }
        return null;
    }

    private static long align4(long value) {
        return (value + 3) & ~3L;
    }

    private static String segmentName(long type) {
        if (type == PT_LOAD) {
            return "LOAD";
        } else if (type == PT_DYNAMIC) {
            return "DYNAMIC";
        } else if (type == PT_INTERP) {
            return "INTERP";
        } else if (type == PT_NOTE) {
            return "NOTE";
        } else if (type == PT_GNU_STACK) {
            return "GNU_STACK";
        } else if (type == PT_GNU_RELRO) {
            return "GNU_RELRO";
        }
        return "PT_0x" + Long.toHexString(type);
    }

    private static Set<SectionFlag> segmentFlags(int flags) {
        Set<SectionFlag> result = EnumSet.noneOf(SectionFlag.class);
        if ((flags & PF_R) != 0) {
            result.add(SectionFlag.READ);
        }
        if ((flags & PF_W) != 0) {
            result.add(SectionFlag.WRITE);
        }
        if ((flags & PF_X) != 0) {
            result.add(SectionFlag.EXECUTE);
        }
        return result;
    }

    private static Set<SectionFlag> sectionFlags(RawSection section) {
        Set<SectionFlag> result = EnumSet.noneOf(SectionFlag.class);
        if ((section.flags() & SHF_ALLOC) != 0) {
            result.add(SectionFlag.READ);
        }
        if ((section.flags() & SHF_WRITE) != 0) {
            result.add(SectionFlag.WRITE);
        }
        if ((section.flags() & SHF_EXECINSTR) != 0) {
            result.add(SectionFlag.EXECUTE);
            result.add(SectionFlag.CODE);
        }
        if (section.type() == SHT_NOBITS) {
            result.add(SectionFlag.NO_FILE_DATA);
        }
        return result;
    }
}
