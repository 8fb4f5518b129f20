package com.binauditor.core.format.impl;

import com.binauditor.core.format.BinaryFormatException;
import com.binauditor.core.format.ParseInput;
import com.binauditor.core.io.ArrayByteSource;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.BinaryFormat;
import com.binauditor.core.model.BinaryKind;
import com.binauditor.core.model.ByteRange;
import com.binauditor.core.model.ChecksumAlgorithm;
import com.binauditor.core.model.HardeningFlag;
import com.binauditor.core.model.ImportedLibrary;
import com.binauditor.core.model.Section;
import com.binauditor.core.model.SignatureKind;
import com.binauditor.core.model.VersionCandidate;
import com.binauditor.core.testing.CmsTestSigner;
import com.binauditor.core.testing.PeFixtureBuilder;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link PeParser}.
 */
class PeParserTest {

    private final PeParser parser = new PeParser();

    @Test
    void parse_withHardenedExecutable_readsHeaderAndFlags() throws Exception {
        // Given
        byte[] image = PeFixtureBuilder.executable().build();

        // When
        BinaryDescriptor descriptor = parse(image);

        // Then
        assertThat(descriptor.format()).isEqualTo(BinaryFormat.PE);
        assertThat(descriptor.architecture()).isEqualTo("x86_64");
        assertThat(descriptor.bitness()).isEqualTo(64);
        assertThat(descriptor.kind()).isEqualTo(BinaryKind.EXECUTABLE);
        assertThat(descriptor.entryPoint()).isEqualTo(0x1000);
        assertThat(descriptor.hardeningFlags()).containsExactlyInAnyOrder(
            HardeningFlag.PIE, HardeningFlag.NX_STACK, HardeningFlag.HIGH_ENTROPY_ASLR, HardeningFlag.STACK_PROTECTION);
        assertThat(descriptor.sections()).extracting(Section::name).containsExactly(".text", ".rdata");
    }

    @Test
    void parse_withoutHardening_reportsNoFlags() throws Exception {
        BinaryDescriptor descriptor = parse(PeFixtureBuilder.executable().withoutHardening().build());

        assertThat(descriptor.hardeningFlags()).isEmpty();
    }

    @Test
    void parse_withPe32Library_readsKindAndBitness() throws Exception {
        BinaryDescriptor descriptor = parse(PeFixtureBuilder.library().pe32().build());

        assertThat(descriptor.bitness()).isEqualTo(32);
        assertThat(descriptor.architecture()).isEqualTo("i386");
        assertThat(descriptor.kind()).isEqualTo(BinaryKind.SHARED_LIBRARY);
        assertThat(descriptor.hasFlag(HardeningFlag.STACK_PROTECTION)).isTrue();
    }

    @Test
    void parse_withImports_listsLibrariesWithoutPins() throws Exception {
        BinaryDescriptor descriptor = parse(PeFixtureBuilder.executable().imports("KERNEL32.dll", "ADVAPI32.dll").build());

        assertThat(descriptor.imports()).extracting(ImportedLibrary::name, ImportedLibrary::versionHint)
            .containsExactly(tuple("KERNEL32.dll", null), tuple("ADVAPI32.dll", null));
    }

    @Test
    void parse_withVersionResource_readsFixedAndStringVersions() throws Exception {
        BinaryDescriptor descriptor = parse(PeFixtureBuilder.executable().version("3.1.0").build());

        assertThat(descriptor.versionCandidates()).extracting(VersionCandidate::source, VersionCandidate::value)
            .contains(
                tuple("FixedFileVersion", "3.1.0.0"),
                tuple("FixedProductVersion", "3.1.0.0"),
                tuple("FileVersion", "3.1.0"),
                tuple("ProductVersion", "3.1.0"));
        assertThat(descriptor.property("package.name")).isEqualTo("DemoTool");
    }

    @Test
    void parse_withCommaSeparatedStringVersion_normalizesDots() throws Exception {
        BinaryDescriptor descriptor = parse(PeFixtureBuilder.executable()
            .version("3.1.0")
            .versionString("FileVersion", "3, 1, 0, 0")
            .build());

        assertThat(descriptor.versionCandidates()).contains(new VersionCandidate("FileVersion", "3.1.0.0"));
    }

    @Test
    void parse_withChecksum_declaresImageChecksumOverWholeFile() throws Exception {
        PeFixtureBuilder builder = PeFixtureBuilder.executable();
        byte[] image = builder.build();

        BinaryDescriptor descriptor = parse(image);

        assertThat(descriptor.checksum()).hasValueSatisfying(checksum -> {
            assertThat(checksum.algorithm()).isEqualTo(ChecksumAlgorithm.PE_IMAGE_CHECKSUM);
            assertThat(checksum.region()).isEqualTo(new ByteRange(builder.checksumOffset(), 4));
            assertThat(checksum.coverage()).isEqualTo(new ByteRange(0, image.length));
            assertThat(checksum.expected())
                .isEqualTo(String.format("%08x", PeFixtureBuilder.imageChecksum(image, builder.checksumOffset())));
        });
    }

    @Test
    void parse_withZeroChecksum_declaresNone() throws Exception {
        BinaryDescriptor descriptor = parse(PeFixtureBuilder.executable().withoutChecksum().build());

        assertThat(descriptor.checksum()).isEmpty();
    }

    @Test
    void parse_withAuthenticode_excludesChecksumDirectoryAndTable() throws Exception {
        // Given
        PeFixtureBuilder builder = PeFixtureBuilder.executable().signedBy(CmsTestSigner.trustedLeaf());
        byte[] image = builder.build();

        // When
        BinaryDescriptor descriptor = parse(image);

        // Then
        assertThat(descriptor.signatures()).singleElement().satisfies(blob -> {
            assertThat(blob.kind()).isEqualTo(SignatureKind.AUTHENTICODE);
            assertThat(blob.signedRange()).isEqualTo(new ByteRange(0, image.length));
            assertThat(blob.excludedRanges()).hasSize(3);
            assertThat(blob.excludedRanges().get(0)).isEqualTo(new ByteRange(builder.checksumOffset(), 4));
        });
        assertThat(descriptor.certificates()).hasSize(2);
    }

    @Test
    void parse_withUnknownMachine_reportsUnknownArchitecture() throws Exception {
        BinaryDescriptor descriptor = parse(PeFixtureBuilder.executable().machine(0x1234).build());

        assertThat(descriptor.architecture()).isEqualTo("unknown");
        assertThat(descriptor.property("machine")).isEqualTo("0x1234");
    }

    @Test
    void parse_withCorruptPeSignature_throwsMalformedHeader() {
        byte[] image = PeFixtureBuilder.executable().build();
        image[0x80] = 'X';

        assertThatThrownBy(() -> parse(image))
            .isInstanceOf(BinaryFormatException.class)
            .hasMessageContaining("PE signature missing");
    }

    @Test
    void parse_withResourceEntryPointingPastEndOfFile_recordsAnomaly() throws Exception {
        // Given
        byte[] image = PeFixtureBuilder.executable().version("3.1.0").build();
        long root = parse(image).sections().stream()
            .filter(s -> s.name().equals(".rsrc"))
            .findFirst().orElseThrow().fileOffset();
        ByteBuffer.wrap(image).order(ByteOrder.LITTLE_ENDIAN).putInt((int) root + 20, 0x7FFFFFF0);

        // When
        BinaryDescriptor descriptor = parse(image);

        // Then
        assertThat(descriptor.versionCandidates()).extracting(VersionCandidate::source)
            .doesNotContain("FixedFileVersion", "FileVersion");
        assertThat(descriptor.headerAnomalies()).anyMatch(a -> a.startsWith("Resource directory is damaged"));
    }

    @Test
    void parse_withCertificateTableNearIntLimit_recordsAnomaly() throws Exception {
        // Given
        byte[] image = PeFixtureBuilder.executable().signedBy(CmsTestSigner.trustedLeaf()).build();
        int securityEntry = 0x80 + 24 + 112 + 4 * 8;
        ByteBuffer.wrap(image).order(ByteOrder.LITTLE_ENDIAN).putInt(securityEntry, 0x7FFFFFF8);

        // When
        BinaryDescriptor descriptor = parse(image);

        // Then
        assertThat(descriptor.signatures()).isEmpty();
        assertThat(descriptor.headerAnomalies()).contains("Certificate table lies outside the file");
    }

    private BinaryDescriptor parse(byte[] image) throws Exception {
        return parser.parse(new ArrayByteSource(image), ParseInput.empty());
    }
}
