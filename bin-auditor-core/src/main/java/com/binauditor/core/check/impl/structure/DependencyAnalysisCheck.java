package com.binauditor.core.check.impl.structure;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.BinaryFormat;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.ImportedLibrary;
import com.binauditor.core.util.Globs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks declared dynamic dependencies against the denylist and, for formats that record
 * versions (ELF and Mach-O), requires every dependency to carry a version pin.
 */
public class DependencyAnalysisCheck extends AbstractCheck {

    public static final String ID = "dependency-analysis";

    public DependencyAnalysisCheck() {
        super(ID, "Dependencies are allowed and version-pinned");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        AuditConfig.DependencyPolicy policy = context.config().dependencies();
        List<Pattern> denied = policy.denylist().stream().map(Globs::compile).toList();
        boolean pinsRequired = policy.requireVersionPins() && descriptor.format() != BinaryFormat.PE;

        List<String> deniedFound = new ArrayList<>();
        List<String> unpinned = new ArrayList<>();
        for (ImportedLibrary library : descriptor.imports()) {
            String baseName = baseName(library.name());
            if (denied.stream().anyMatch(p -> p.matcher(library.name()).matches() || p.matcher(baseName).matches())) {
                deniedFound.add(library.name());
            }
            if (pinsRequired && !library.hasVersionPin()) {
                unpinned.add(library.name());
            }
        }

        Map<String, Object> metadata = metadata(
            "dependencies", descriptor.imports().stream().map(ImportedLibrary::name).toList(),
            "denied", deniedFound.isEmpty() ? null : deniedFound,
            "unpinned", unpinned.isEmpty() ? null : unpinned);
        if (!deniedFound.isEmpty() || !unpinned.isEmpty()) {
            List<String> problems = new ArrayList<>();
            if (!deniedFound.isEmpty()) {
                problems.add("denylisted: " + String.join(", ", deniedFound));
            }
            if (!unpinned.isEmpty()) {
                problems.add("no version pin: " + String.join(", ", unpinned));
            }
            return fail(String.join("; ", problems), metadata);
        }
        return pass(descriptor.imports().size() + " dependencies, none denylisted"
            + (pinsRequired ? ", all version-pinned" : ""), metadata);
    }

    private static String baseName(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash >= 0 ? name.substring(slash + 1) : name;
    }
}
