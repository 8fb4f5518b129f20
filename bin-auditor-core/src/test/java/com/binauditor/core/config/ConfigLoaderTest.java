package com.binauditor.core.config;

import com.binauditor.core.crypto.TrustMaterial;
import com.binauditor.core.model.HardeningFlag;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.testing.TestKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            runner:
              parallelism: 2
              timeoutSeconds: 30

            dependencies:
              denylist:
                - "libssl.so.1.*"
                - "msvcr*.dll"
              requireVersionPins: false

            crypto:
              trustedKeys:
                - keys/ca.pem
              approvedAlgorithms: [SHA-256, AES]
              requireCertificate: false

            security:
              requiredFlags: [pie, nx-stack, RELRO]

            licenses:
              denylist: [AGPL-3.0-only]

            sbom:
              format: spdx
              output: out/sbom.spdx.json
            """);

        AuditConfig config = ConfigLoader.load(configFile);

        assertThat(config.runner().parallelism()).isEqualTo(2);
        assertThat(config.runner().timeoutSeconds()).isEqualTo(30L);
        assertThat(config.dependencies().denylist()).containsExactly("libssl.so.1.*", "msvcr*.dll");
        assertThat(config.dependencies().requireVersionPins()).isFalse();
        assertThat(config.crypto().trustedKeys()).containsExactly("keys/ca.pem");
        assertThat(config.crypto().approvedAlgorithms()).containsExactly("SHA-256", "AES");
        assertThat(config.crypto().deprecatedAlgorithms()).isEqualTo(AuditConfig.DEFAULT_DEPRECATED_ALGORITHMS);
        assertThat(config.crypto().requireCertificate()).isFalse();
        assertThat(config.security().requiredFlags())
            .containsExactly(HardeningFlag.PIE, HardeningFlag.NX_STACK, HardeningFlag.RELRO);
        assertThat(config.licenses().denylist()).containsExactly("AGPL-3.0-only");
        assertThat(config.sbom().format()).isEqualTo(SbomFormat.SPDX);
        assertThat(config.sbom().output()).isEqualTo("out/sbom.spdx.json");
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            licenses:
              denylist: [GPL-3.0-only]
            unknownSection:
              ignored: true
            """);

        AuditConfig config = ConfigLoader.load(configFile);

        assertThat(config.licenses().denylist()).containsExactly("GPL-3.0-only");
        assertThat(config.runner().parallelism()).isPositive();
        assertThat(config.dependencies().requireVersionPins()).isTrue();
        assertThat(config.crypto().requireCertificate()).isTrue();
        assertThat(config.security().requiredFlags())
            .containsExactly(HardeningFlag.PIE, HardeningFlag.STACK_PROTECTION, HardeningFlag.NX_STACK);
        assertThat(config.sbom().format()).isEqualTo(SbomFormat.CYCLONEDX);
        assertThat(config.sbom().output()).isEqualTo("sbom.json");
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AuditConfig.defaults());
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        AuditConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(AuditConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            security:
              requiredFlags: [pie, [broken
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AuditConfig.defaults());
    }

    @Test
    void loadStrict_missingFile_throws() {
        Path missing = tempDir.resolve("missing.yaml");

        assertThatThrownBy(() -> ConfigLoader.loadStrict(missing))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Configuration file not found");
    }

    @Test
    void loadStrict_unknownHardeningFlag_throws() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            security:
              requiredFlags: [pie, cfi]
            """);

        assertThatThrownBy(() -> ConfigLoader.loadStrict(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid configuration file");
    }

    @Test
    void loadStrict_unknownSbomFormat_throws() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            sbom:
              format: swid
            """);

        assertThatThrownBy(() -> ConfigLoader.loadStrict(configFile))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void loadStrict_zeroParallelism_failsValidation() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            runner:
              parallelism: 0
            """);

        assertThatThrownBy(() -> ConfigLoader.loadStrict(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("runner.parallelism must be at least 1");
    }

    @Test
    void validate_emptyApprovedAlgorithms_throws() {
        AuditConfig config = AuditConfig.defaults()
            .withCrypto(new AuditConfig.CryptoPolicy(null, List.of(), null, null));

        assertThatThrownBy(() -> ConfigLoader.validate(config))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("crypto.approvedAlgorithms must not be empty");
    }

    @Test
    void loadTrustMaterial_resolvesRelativePaths() throws IOException {
        // Given
        Path keys = Files.createDirectories(tempDir.resolve("keys"));
        TestKeys.copyTo(keys, TestKeys.CA);
        AuditConfig config = AuditConfig.defaults()
            .withCrypto(AuditConfig.CryptoPolicy.defaults().withTrustedKeys(List.of("keys/ca.pem")));

        // When
        TrustMaterial trust = ConfigLoader.loadTrustMaterial(config, tempDir);

        // Then
        assertThat(trust.certificates()).containsExactly(TestKeys.ca());
    }

    @Test
    void loadTrustMaterial_withoutKeys_returnsEmpty() {
        assertThat(ConfigLoader.loadTrustMaterial(AuditConfig.defaults(), tempDir).isEmpty()).isTrue();
    }

    @Test
    void loadTrustMaterial_missingFile_throws() {
        AuditConfig config = AuditConfig.defaults()
            .withCrypto(AuditConfig.CryptoPolicy.defaults().withTrustedKeys(List.of("nope.pem")));

        assertThatThrownBy(() -> ConfigLoader.loadTrustMaterial(config, tempDir))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Failed to load trusted keys");
    }
}
