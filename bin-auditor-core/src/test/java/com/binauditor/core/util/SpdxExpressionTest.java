package com.binauditor.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpdxExpression}.
 */
class SpdxExpressionTest {

    @Test
    void parse_singleIdentifier_returnsIt() {
        SpdxExpression expression = SpdxExpression.parse(" Apache-2.0 ");

        assertThat(expression.licenseIds()).containsExactly("Apache-2.0");
        assertThat(expression).hasToString("Apache-2.0");
    }

    @Test
    void parse_compoundExpression_collectsIdentifiersInOrder() {
        SpdxExpression expression = SpdxExpression.parse(
            "(MIT OR Apache-2.0) AND GPL-2.0-only WITH Classpath-exception-2.0");

        assertThat(expression.licenseIds()).containsExactly("MIT", "Apache-2.0", "GPL-2.0-only");
    }

    @Test
    void parse_orLaterSuffix_stripsPlus() {
        assertThat(SpdxExpression.parse("LGPL-2.1+").licenseIds()).containsExactly("LGPL-2.1");
    }

    @Test
    void parse_operatorsAreCaseInsensitive() {
        assertThat(SpdxExpression.parse("mit or bsd-3-clause").licenseIds()).containsExactly("mit", "bsd-3-clause");
    }

    @Test
    void parse_licenseRef_isAccepted() {
        assertThat(SpdxExpression.parse("LicenseRef-Acme AND DocumentRef-ext:LicenseRef-Other").licenseIds())
            .containsExactly("LicenseRef-Acme", "DocumentRef-ext:LicenseRef-Other");
    }

    @ParameterizedTest
    @ValueSource(strings = {"MIT AND", "(MIT OR Apache-2.0", "AND MIT", "MIT Apache-2.0", "MIT )", "   "})
    void parse_malformedExpression_throws(String value) {
        assertThatThrownBy(() -> SpdxExpression.parse(value)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_unknownIdentifier_throws() {
        assertThatThrownBy(() -> SpdxExpression.parse("MIT OR Frobnicate-1.0"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unrecognized SPDX license identifier 'Frobnicate-1.0'");
    }

    @Test
    void parse_unknownException_throws() {
        assertThatThrownBy(() -> SpdxExpression.parse("GPL-2.0-only WITH Nope-exception"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown license exception 'Nope-exception'");
    }

    @Test
    void parse_nestingAtLimit_isAccepted() {
        String nested = "(".repeat(SpdxExpression.MAX_DEPTH) + "MIT" + ")".repeat(SpdxExpression.MAX_DEPTH);

        assertThat(SpdxExpression.parse(nested).licenseIds()).containsExactly("MIT");
    }

    @Test
    void parse_nestingBeyondLimit_throwsWithoutExhaustingStack() {
        assertThatThrownBy(() -> SpdxExpression.parse("(".repeat(4000) + "MIT"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("License expression nests deeper than 64 levels");
    }

    @Test
    void isKnownLicense_ignoresCase() {
        assertThat(SpdxExpression.isKnownLicense("agpl-3.0-only")).isTrue();
        assertThat(SpdxExpression.isKnownLicense("MIT OR Apache-2.0")).isFalse();
    }
}
