package com.binauditor.core.check.impl.structure;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.Section;
import com.binauditor.core.model.SectionKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Verifies that every section and segment lies within the file and that sections do not
 * overlap each other. Segments may legitimately contain sections and other segments, so
 * only their bounds are checked.
 */
public class StructuralValidationCheck extends AbstractCheck {

    public static final String ID = "structural-validation";

    private static final int MAX_REPORTED = 10;

    public StructuralValidationCheck() {
        super(ID, "Sections lie within the file and do not overlap");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        long fileSize = descriptor.fileSize();
        List<String> problems = new ArrayList<>();

        for (Section section : descriptor.sections()) {
            if (section.occupiesFile() && section.fileEnd() > fileSize) {
                problems.add(String.format("%s [0x%x, 0x%x) extends past end of file (0x%x)",
                    section.name(), section.fileOffset(), section.fileEnd(), fileSize));
            }
        }

        List<Section> placed = descriptor.sections().stream()
            .filter(s -> s.kind() == SectionKind.SECTION && s.occupiesFile())
            .sorted(Comparator.comparingLong(Section::fileOffset).thenComparingLong(Section::fileEnd))
            .toList();
        Section furthest = null;
        for (Section section : placed) {
            if (furthest != null && section.fileOffset() < furthest.fileEnd()) {
                problems.add(String.format("%s [0x%x, 0x%x) overlaps %s [0x%x, 0x%x)",
                    section.name(), section.fileOffset(), section.fileEnd(),
                    furthest.name(), furthest.fileOffset(), furthest.fileEnd()));
            }
            if (furthest == null || section.fileEnd() > furthest.fileEnd()) {
                furthest = section;
            }
        }

        Map<String, Object> metadata = metadata(
            "file_size", fileSize,
            "entries", descriptor.sections().size());
        if (!problems.isEmpty()) {
            metadata.put("problems", List.copyOf(problems.size() > MAX_REPORTED ? problems.subList(0, MAX_REPORTED) : problems));
            return fail(problems.size() + " structural problem(s): " + problems.get(0), metadata);
        }
        return pass(descriptor.sections().size() + " sections and segments within " + fileSize + " bytes", metadata);
    }
}
