package com.binauditor.core.check.impl.structure;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.BinaryKind;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.Section;
import com.binauditor.core.model.SectionFlag;
import com.binauditor.core.model.SectionKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Requires a known architecture, an entry point for executables and at least one
 * executable code section.
 */
public class BinaryMetadataCheck extends AbstractCheck {

    public static final String ID = "binary-metadata";

    public BinaryMetadataCheck() {
        super(ID, "Binary metadata is complete");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        List<String> problems = new ArrayList<>();

        if ("unknown".equals(descriptor.architecture())) {
            problems.add("unknown architecture" + machineSuffix(descriptor));
        }
        if (descriptor.kind() == BinaryKind.EXECUTABLE && descriptor.entryPoint() == 0) {
            problems.add("executable has no entry point");
        }
        long sectionCount = descriptor.sections().stream().filter(s -> s.kind() == SectionKind.SECTION).count();
        if (descriptor.sections().isEmpty()) {
            problems.add("no sections or segments");
        }
        List<String> codeSections = descriptor.sections().stream()
            .filter(s -> s.hasFlag(SectionFlag.EXECUTE) || s.hasFlag(SectionFlag.CODE))
            .map(Section::name)
            .distinct()
            .toList();
        if (codeSections.isEmpty()) {
            problems.add("no executable code section");
        }

        Map<String, Object> metadata = metadata(
            "architecture", descriptor.architecture(),
            "bitness", descriptor.bitness(),
            "kind", descriptor.kind().name(),
            "entry_point", String.format("0x%x", descriptor.entryPoint()),
            "sections", sectionCount,
            "segments", descriptor.sections().size() - sectionCount,
            "code_sections", codeSections);
        if (!problems.isEmpty()) {
            return fail(String.join("; ", problems), metadata);
        }
        return pass(descriptor.architecture() + " " + descriptor.kind().name().toLowerCase(Locale.ROOT).replace('_', ' ')
            + " with " + codeSections.size() + " code section(s)", metadata);
    }

    private static String machineSuffix(BinaryDescriptor descriptor) {
        String machine = descriptor.property("machine");
        return machine == null ? "" : " (machine " + machine + ")";
    }
}
