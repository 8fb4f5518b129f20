package com.binauditor.core.check.impl.security;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.HardeningFlag;

import java.util.List;

/**
 * Requires the hardening flags named by {@code security.requiredFlags}.
 */
public class SecurityFlagsCheck extends AbstractCheck {

    public static final String ID = "security-flags";

    public SecurityFlagsCheck() {
        super(ID, "Required security hardening flags are present");
    }

    @Override
    public CheckResult execute(CheckContext context) {
        BinaryDescriptor descriptor = context.descriptor();
        List<HardeningFlag> required = context.config().security().requiredFlags();
        List<String> present = descriptor.hardeningFlags().stream().sorted().map(Enum::name).toList();
        List<String> missing = required.stream()
            .filter(flag -> !descriptor.hasFlag(flag))
            .map(Enum::name)
            .toList();

        if (!missing.isEmpty()) {
            return fail("Missing hardening flags: " + String.join(", ", missing), metadata(
                "required", required.stream().map(Enum::name).toList(),
                "present", present,
                "missing", missing));
        }
        return pass("All required flags present: " + required.stream().map(Enum::name).toList(),
            metadata("present", present));
    }
}
