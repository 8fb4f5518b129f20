package com.binauditor.core.check.impl.structure;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.format.BinaryFormatException;
import com.binauditor.core.format.FormatDetector;
import com.binauditor.core.io.ByteSource;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.BinaryFormat;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.Endianness;
import com.binauditor.core.util.FileUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Confirms that the magic number and header identity fields agree with the parsed format,
 * that a conventional file extension does not claim a different format and that the parser
 * recorded no header anomalies.
 */
public class FileSignatureCheck extends AbstractCheck {

    public static final String ID = "file-signature";

    private static final Map<BinaryFormat, Set<String>> EXTENSIONS = Map.of(
        BinaryFormat.ELF, Set.of("so", "ko", "elf", "axf", "prx", "mod"),
        BinaryFormat.PE, Set.of("exe", "dll", "sys", "efi", "ocx", "scr", "cpl", "drv", "mui"),
        BinaryFormat.MACHO, Set.of("dylib", "bundle", "kext", "macho"));

    public FileSignatureCheck() {
        super(ID, "File signature matches the declared binary format");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        List<String> problems = new ArrayList<>();

        try (ByteSource source = context.binary().openContent()) {
            BinaryFormat detected = FormatDetector.detect(source);
            if (detected != descriptor.format()) {
                problems.add("magic number identifies " + detected.displayName() + ", not "
                    + descriptor.format().displayName());
            } else if (descriptor.format() == BinaryFormat.ELF) {
                checkElfIdent(source, descriptor, problems);
            }
        } catch (BinaryFormatException | IOException e) {
            problems.add("header could not be re-read: " + e.getMessage());
        }

        String extension = FileUtils.getExtension(context.binary().path());
        for (Map.Entry<BinaryFormat, Set<String>> entry : EXTENSIONS.entrySet()) {
            if (entry.getKey() != descriptor.format() && entry.getValue().contains(extension)) {
                problems.add("extension '." + extension + "' suggests " + entry.getKey().displayName());
            }
        }
        problems.addAll(descriptor.headerAnomalies());

        Map<String, Object> metadata = metadata(
            "format", descriptor.format().displayName(),
            "extension", extension.isEmpty() ? null : extension);
        if (!problems.isEmpty()) {
            metadata.put("problems", List.copyOf(problems));
            return fail("Header inconsistencies: " + String.join("; ", problems), metadata);
        }
        return pass("Valid " + descriptor.format().displayName() + " signature (" + descriptor.bitness() + "-bit, "
            + descriptor.endianness().name().toLowerCase(Locale.ROOT) + "-endian)", metadata);
    }

    private static void checkElfIdent(ByteSource source, BinaryDescriptor descriptor, List<String> problems)
            throws IOException {
        byte[] ident = source.readAvailable(0, 6);
        if (ident.length < 6) {
            problems.add("ELF identification bytes truncated");
            return;
        }
        int bitness = ident[4] == 1 ? 32 : ident[4] == 2 ? 64 : 0;
        Endianness order = ident[5] == 2 ? Endianness.BIG : Endianness.LITTLE;
        if (bitness != descriptor.bitness()) {
            problems.add("EI_CLASS says " + bitness + "-bit, parsed as " + descriptor.bitness() + "-bit");
        }
        if (order != descriptor.endianness()) {
            problems.add("EI_DATA byte order differs from parsed byte order");
        }
    }
}
