package com.binauditor.core;

import com.binauditor.core.check.CheckRegistry;
import com.binauditor.core.check.CheckRunner;
import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.crypto.TrustMaterial;
import com.binauditor.core.inspect.BinaryInputException;
import com.binauditor.core.inspect.BinaryInspector;
import com.binauditor.core.inspect.InspectedBinary;
import com.binauditor.core.model.BinaryFormat;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.ComplianceReport;
import com.binauditor.core.model.Component;
import com.binauditor.core.model.Sbom;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.model.SbomMetadata;
import com.binauditor.core.sbom.ComponentExtractor;
import com.binauditor.core.sbom.SbomEncoder;
import com.binauditor.core.sbom.SbomEncoders;
import com.binauditor.core.testing.CmsTestSigner;
import com.binauditor.core.testing.ElfFixtureBuilder;
import com.binauditor.core.testing.MachOFixtureBuilder;
import com.binauditor.core.testing.TestKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the full check set over fixture binaries, from file to report and SBOM.
 */
class AuditEndToEndTest {

    @TempDir
    Path tempDir;

    private final CheckRunner runner = new CheckRunner(CheckRegistry.withDefaultChecks(), AuditConfig.defaults(),
        new TrustMaterial(List.of(TestKeys.ca()), List.of()), Clock.fixed(TestKeys.VALID_AT, ZoneOffset.UTC));

    @Test
    void runAll_withCompliantElf_passesEveryCheck() throws Exception {
        // Given
        Path binary = Files.write(tempDir.resolve("demo-app"), ElfFixtureBuilder.compliant().build());

        // When
        ComplianceReport report = runner.runAll(binary);

        // Then
        assertThat(report.failedResults()).extracting(CheckResult::details).isEmpty();
        assertThat(report.isPassing()).isTrue();
        assertThat(report.totalChecks()).isEqualTo(11);
        assertThat(report.format()).isEqualTo(BinaryFormat.ELF);
        assertThat(report.timestamp()).isEqualTo(TestKeys.VALID_AT);
        assertThat(report.binaryPath()).isEqualTo(binary.toAbsolutePath().normalize().toString());
    }

    @Test
    void runAll_withUnhardenedElf_failsOnlySecurityFlags() throws Exception {
        Path binary = Files.write(tempDir.resolve("demo-app"),
            ElfFixtureBuilder.compliant().withoutHardening().build());

        ComplianceReport report = runner.runAll(binary);

        assertThat(report.isPassing()).isFalse();
        assertThat(report.failedResults()).extracting(CheckResult::checkId).containsExactly("security-flags");
        assertThat(report.passedChecks()).isEqualTo(10);
    }

    @Test
    void runAll_withTamperedText_failsIntegrityChecks() throws Exception {
        // Given
        ElfFixtureBuilder builder = ElfFixtureBuilder.compliant();
        byte[] image = builder.build();
        image[builder.textOffset()] ^= (byte) 0xFF;
        Path binary = Files.write(tempDir.resolve("demo-app"), image);

        // When
        ComplianceReport report = runner.runAll(binary);

        // Then
        assertThat(report.failedResults()).extracting(CheckResult::checkId)
            .containsExactly("signature-verification", "hash-integrity");
    }

    @Test
    void runAll_withEmptyFile_degradesDescriptorChecks() throws Exception {
        // Given
        Path binary = Files.write(tempDir.resolve("empty.bin"), new byte[0]);

        // When
        ComplianceReport report = runner.runAll(binary);

        // Then
        assertThat(report.format()).isEqualTo(BinaryFormat.UNKNOWN);
        assertThat(report.totalChecks()).isEqualTo(11);
        assertThat(report.results())
            .filteredOn(result -> result.details().contains(InspectedBinary.UNSUPPORTED_FORMAT))
            .hasSize(9);
        assertThat(report.result("license-compliance").orElseThrow().details()).isEqualTo("No declared license found");
        assertThat(report.isPassing()).isFalse();
    }

    @Test
    void runAll_withOverflowingElfSectionTable_reportsEveryCheck() throws Exception {
        // Given
        byte[] image = ElfFixtureBuilder.compliant().build();
        ByteBuffer buffer = ByteBuffer.wrap(image).order(ByteOrder.LITTLE_ENDIAN);
        int shoff = (int) buffer.getLong(40);
        buffer.putShort(60, (short) 0);
        buffer.putLong(shoff + 32, 1L << 58);
        Path binary = Files.write(tempDir.resolve("demo-app"), image);

        // When
        ComplianceReport report = runner.runAll(binary);

        // Then
        assertThat(report.format()).isEqualTo(BinaryFormat.ELF);
        assertThat(report.totalChecks()).isEqualTo(11);
        assertThat(report.partial()).isFalse();
        assertThat(report.results())
            .filteredOn(result -> result.details().contains(InspectedBinary.UNSUPPORTED_FORMAT))
            .hasSize(9);
        assertThat(report.isPassing()).isFalse();
    }

    @Test
    void runAll_withMachOSignatureOffsetNearIntLimit_reportsEveryCheck() throws Exception {
        // Given
        byte[] image = MachOFixtureBuilder.executable().signedBy(CmsTestSigner.trustedLeaf()).build();
        int superBlob = -1;
        for (int i = 0; i + 4 <= image.length && superBlob < 0; i++) {
            if ((image[i] & 0xFF) == 0xFA && (image[i + 1] & 0xFF) == 0xDE
                && image[i + 2] == 0x0C && (image[i + 3] & 0xFF) == 0xC0) {
                superBlob = i;
            }
        }
        ByteBuffer.wrap(image).order(ByteOrder.BIG_ENDIAN).putInt(superBlob + 16, 0x7FFFFFFD);
        Path binary = Files.write(tempDir.resolve("demo-app"), image);

        // When
        ComplianceReport report = runner.runAll(binary);

        // Then
        assertThat(report.format()).isEqualTo(BinaryFormat.MACHO);
        assertThat(report.totalChecks()).isEqualTo(11);
        assertThat(report.partial()).isFalse();
        assertThat(report.result("signature-verification").orElseThrow().passed()).isFalse();
    }

    @Test
    void runAll_withMissingFile_throws() {
        Path missing = tempDir.resolve("missing");

        assertThatThrownBy(() -> runner.runAll(missing)).isInstanceOf(BinaryInputException.class);
    }

    @Test
    void sbom_forCompliantElf_listsRootAndImports() throws Exception {
        // Given
        Path binary = Files.write(tempDir.resolve("demo-app"), ElfFixtureBuilder.compliant().build());
        InspectedBinary inspected = new BinaryInspector().inspect(binary);

        // When
        List<Component> components = new ComponentExtractor().extract(inspected);
        SbomEncoder encoder = SbomEncoders.forFormat(SbomFormat.SPDX);
        Sbom sbom = encoder.encode(components, new SbomMetadata(TestKeys.VALID_AT, "bin-auditor", "test"));

        // Then
        assertThat(encoder.readComponents(sbom.document())).isEqualTo(components);
        assertThat(components).extracting(Component::name).containsExactly("demo-app", "libc.so.6");
        assertThat(components.get(0).licenses()).containsExactly("Apache-2.0");
    }
}
