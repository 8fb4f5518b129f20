package com.binauditor.core.check.impl.security;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.VersionCandidate;
import com.binauditor.core.util.SemanticVersion;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Requires at least one semantic version in the binary's metadata and agreement on
 * major.minor.patch between all fields that parse as one.
 */
public class VersionInformationCheck extends AbstractCheck {

    public static final String ID = "version-information";

    public VersionInformationCheck() {
        super(ID, "Version information is present and consistent");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        if (descriptor.versionCandidates().isEmpty()) {
            return fail("No version information found");
        }

        Map<String, Object> candidates = new LinkedHashMap<>();
        Set<String> cores = new LinkedHashSet<>();
        SemanticVersion first = null;
        for (VersionCandidate candidate : descriptor.versionCandidates()) {
            candidates.put(candidate.source(), candidate.value());
            Optional<SemanticVersion> parsed = SemanticVersion.parse(candidate.value());
            if (parsed.isPresent()) {
                cores.add(parsed.get().core());
                if (first == null) {
                    first = parsed.get();
                }
            } else {
                log.debug("Version candidate {}='{}' is not a semantic version", candidate.source(), candidate.value());
            }
        }

        if (first == null) {
            return fail("No semantic version among " + candidates.size() + " version field(s)",
                metadata("candidates", candidates));
        }
        if (cores.size() > 1) {
            return fail("Inconsistent versions: " + String.join(" vs ", cores),
                metadata("candidates", candidates, "versions", cores.stream().toList()));
        }
        return pass("Version " + first, metadata("version", first.toString(), "candidates", candidates));
    }
}
