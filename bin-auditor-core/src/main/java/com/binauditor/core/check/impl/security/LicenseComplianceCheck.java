package com.binauditor.core.check.impl.security;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.base.AbstractCheck;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.util.SpdxExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Requires at least one declared license, every declaration to be a valid SPDX expression
 * over recognized identifiers, and none of those identifiers to be denylisted.
 *
 * <p>Works on unparseable files too, using the {@code SPDX-License-Identifier} tags found
 * by the content scan.
 */
public class LicenseComplianceCheck extends AbstractCheck {

    public static final String ID = "license-compliance";

    public LicenseComplianceCheck() {
        super(ID, "Declared licenses are valid SPDX and not denylisted");
    }

    @Override
    public boolean requiresDescriptor() {
        return false;
    }

    @Override
    public CheckResult execute(CheckContext context) {
        List<String> licenses = context.descriptor() != null
            ? context.descriptor().licenses()
            : context.binary().content().licenseTags();
        if (licenses.isEmpty()) {
            return fail("No declared license found");
        }

        Set<String> denied = context.config().licenses().denylist().stream()
            .map(id -> id.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        List<String> invalid = new ArrayList<>();
        List<String> deniedFound = new ArrayList<>();
        List<String> identifiers = new ArrayList<>();
        for (String license : licenses) {
            SpdxExpression expression;
            try {
                expression = SpdxExpression.parse(license);
            } catch (IllegalArgumentException e) {
                invalid.add(e.getMessage());
                continue;
            }
            for (String id : expression.licenseIds()) {
                if (!identifiers.contains(id)) {
                    identifiers.add(id);
                }
                if (denied.contains(id.toLowerCase(Locale.ROOT)) && !deniedFound.contains(id)) {
                    deniedFound.add(id);
                }
            }
        }

        if (!invalid.isEmpty() || !deniedFound.isEmpty()) {
            List<String> problems = new ArrayList<>(invalid);
            if (!deniedFound.isEmpty()) {
                problems.add("denylisted: " + String.join(", ", deniedFound));
            }
            return fail(String.join("; ", problems), metadata(
                "licenses", licenses,
                "invalid", invalid.isEmpty() ? null : invalid,
                "denied", deniedFound.isEmpty() ? null : deniedFound));
        }
        return pass("Licensed under " + String.join(", ", licenses),
            metadata("licenses", licenses, "identifiers", identifiers));
    }
}
