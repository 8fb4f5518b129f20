package com.binauditor.core.check.impl.crypto;

import com.binauditor.core.check.CheckContext;
import com.binauditor.core.check.CheckTestBase;
import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.crypto.TrustMaterial;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.testing.CmsTestSigner;
import com.binauditor.core.testing.ElfFixtureBuilder;
import com.binauditor.core.testing.PeFixtureBuilder;
import com.binauditor.core.testing.TestKeys;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link CertificateValidationCheck}.
 */
class CertificateValidationCheckTest extends CheckTestBase {

    private final CertificateValidationCheck check = new CertificateValidationCheck();

    @Test
    void execute_withChainToTrustedRoot_passes() throws Exception {
        CheckResult result = run(check, "demo-app", ElfFixtureBuilder.compliant().build());

        assertThat(result.passed()).isTrue();
        assertThat(result.details()).isEqualTo("1 certificate chain(s) valid (trusted anchors)");
        assertThat(result.metadata())
            .containsEntry("certificates", 2)
            .containsEntry("trust_anchors", 1)
            .containsEntry("evaluated_at", TestKeys.VALID_AT.toString());
    }

    @Test
    void execute_withoutTrustAnchors_acceptsEmbeddedSelfSignedRoot() throws Exception {
        CheckContext context = context("demo-app", ElfFixtureBuilder.compliant().build(), AuditConfig.defaults(),
            TrustMaterial.empty());

        CheckResult result = check.execute(context);

        assertThat(result.passed()).isTrue();
        assertThat(result.details()).endsWith("(internal roots)");
    }

    @Test
    void execute_withoutTrustAnchorsAndIncompleteChain_fails() throws Exception {
        // Given: only the leaf is embedded, its issuer is missing
        byte[] image = ElfFixtureBuilder.executable()
            .signedBy(CmsTestSigner.of(TestKeys.leafKey(), TestKeys.leaf()))
            .build();

        // When
        CheckResult result = check.execute(context("demo-app", image, AuditConfig.defaults(), TrustMaterial.empty()));

        // Then
        assertThat(result.passed()).isFalse();
        assertThat(result.details()).startsWith("Chain is incomplete");
    }

    @Test
    void execute_withSignerOutsideTrustedRoot_fails() throws Exception {
        CheckResult result = run(check, "demo-app", ElfFixtureBuilder.executable().signedBy(CmsTestSigner.rogue()).build());

        assertThat(result.passed()).isFalse();
        assertThat(result.details()).startsWith("Chain does not validate against trusted certificates");
        assertThat(result.metadata().get("subject")).asString().contains("Untrusted Signer");
    }

    @Test
    void execute_beforeValidityPeriod_fails() throws Exception {
        // Given
        CheckContext context = new CheckContext(inspect("demo-app", ElfFixtureBuilder.compliant().build()),
            AuditConfig.defaults(), trustedRoot(), TestKeys.NOT_BEFORE.minusSeconds(86_400));

        // When
        CheckResult result = check.execute(context);

        // Then
        assertThat(result.passed()).isFalse();
        assertThat(result.details()).contains("is not valid at");
    }

    @Test
    void execute_withoutCertificates_failsWhenRequired() throws Exception {
        CheckResult result = run(check, "demo-app", ElfFixtureBuilder.executable().build());

        assertThat(result.passed()).isFalse();
        assertThat(result.details()).isEqualTo("No embedded certificate found");
    }

    @Test
    void execute_withoutCertificates_passesWhenNotRequired() throws Exception {
        AuditConfig config = AuditConfig.defaults()
            .withCrypto(new AuditConfig.CryptoPolicy(null, null, null, false));

        CheckResult result = check.execute(context("demo-app", ElfFixtureBuilder.executable().build(), config));

        assertThat(result.passed()).isTrue();
    }

    @Test
    void execute_withAuthenticodeChain_passes() throws Exception {
        CheckResult result = run(check, "demo.exe",
            PeFixtureBuilder.executable().signedBy(CmsTestSigner.trustedLeaf()).build());

        assertThat(result.passed()).isTrue();
    }
}
