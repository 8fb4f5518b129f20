package com.binauditor.core.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized structural and cryptographic summary of a parsed binary container.
 *
 * <p>Built once per run by the parser matching the detected {@link BinaryFormat} and shared
 * read-only by every check and by the component extractor. All collections are immutable
 * copies, so concurrent readers need no synchronization.
 *
 * @param format container format
 * @param architecture machine name ({@code x86_64}, {@code aarch64}, {@code i386}), or {@code unknown}
 * @param bitness 32 or 64
 * @param endianness byte order of header fields
 * @param kind executable, shared library, object or other
 * @param entryPoint entry point address, 0 if none
 * @param sections ordered section and segment table
 * @param imports declared dynamic dependencies in table order
 * @param certificates certificates carried by embedded signatures
 * @param signatures embedded code-signing blobs
 * @param declaredChecksum self-declared checksum, or null
 * @param hardeningFlags hardening markers present in the binary
 * @param licenses declared license strings
 * @param versionCandidates version strings from redundant metadata fields
 * @param algorithmIdentifiers cryptographic algorithm identifiers found in content
 * @param headerAnomalies inconsistencies noticed while parsing that did not prevent it
 * @param properties additional descriptive facts ({@code package.name}, {@code machine})
 * @param contentDigests full-file digests keyed by algorithm name ({@code SHA-256})
 * @param fileSize file size in bytes
 */
public record BinaryDescriptor(
    BinaryFormat format,
    String architecture,
    int bitness,
    Endianness endianness,
    BinaryKind kind,
    long entryPoint,
    List<Section> sections,
    List<ImportedLibrary> imports,
    List<EmbeddedCertificate> certificates,
    List<SignatureBlob> signatures,
    DeclaredChecksum declaredChecksum,
    Set<HardeningFlag> hardeningFlags,
    List<String> licenses,
    List<VersionCandidate> versionCandidates,
    List<String> algorithmIdentifiers,
    List<String> headerAnomalies,
    Map<String, String> properties,
    Map<String, String> contentDigests,
    long fileSize
) {
    /**
     * Compact constructor with validation.
     */
    public BinaryDescriptor {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(endianness, "endianness must not be null");
        if (architecture == null || architecture.isBlank()) {
            architecture = "unknown";
        }
        sections = copy(sections);
        imports = copy(imports);
        certificates = copy(certificates);
        signatures = copy(signatures);
        hardeningFlags = hardeningFlags == null || hardeningFlags.isEmpty()
            ? Set.of()
            : Set.copyOf(hardeningFlags);
        licenses = copy(licenses);
        versionCandidates = copy(versionCandidates);
        algorithmIdentifiers = copy(algorithmIdentifiers);
        headerAnomalies = copy(headerAnomalies);
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        contentDigests = contentDigests == null ? Map.of() : Map.copyOf(contentDigests);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public Optional<DeclaredChecksum> checksum() {
        return Optional.ofNullable(declaredChecksum);
    }

    public boolean hasFlag(HardeningFlag flag) {
        return hardeningFlags.contains(flag);
    }

    public String property(String key) {
        return properties.get(key);
    }

    /**
     * Creates a builder for the given format.
     *
     * @param format container format
     * @return new builder
     */
    public static Builder builder(BinaryFormat format) {
        return new Builder(format);
    }

    /**
     * Mutable accumulator used by parsers while walking header tables.
     */
    public static final class Builder {
        private final BinaryFormat format;
        private String architecture = "unknown";
        private int bitness;
        private Endianness endianness = Endianness.LITTLE;
        private BinaryKind kind = BinaryKind.OTHER;
        private long entryPoint;
        private final List<Section> sections = new ArrayList<>();
        private final List<ImportedLibrary> imports = new ArrayList<>();
        private final List<EmbeddedCertificate> certificates = new ArrayList<>();
        private final List<SignatureBlob> signatures = new ArrayList<>();
        private DeclaredChecksum declaredChecksum;
        private final Set<HardeningFlag> hardeningFlags = EnumSet.noneOf(HardeningFlag.class);
        private final List<String> licenses = new ArrayList<>();
        private final List<VersionCandidate> versionCandidates = new ArrayList<>();
        private final List<String> algorithmIdentifiers = new ArrayList<>();
        private final List<String> headerAnomalies = new ArrayList<>();
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final Map<String, String> contentDigests = new LinkedHashMap<>();
        private long fileSize;

        private Builder(BinaryFormat format) {
            this.format = Objects.requireNonNull(format, "format must not be null");
        }

        public Builder architecture(String architecture) {
            this.architecture = architecture;
            return this;
        }

        public Builder bitness(int bitness) {
            this.bitness = bitness;
            return this;
        }

        public Builder endianness(Endianness endianness) {
            this.endianness = endianness;
            return this;
        }

        public Builder kind(BinaryKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder entryPoint(long entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder section(Section section) {
            sections.add(section);
            return this;
        }

        public Builder importedLibrary(ImportedLibrary library) {
            imports.add(library);
            return this;
        }

        public Builder certificate(EmbeddedCertificate certificate) {
            certificates.add(certificate);
            return this;
        }

        public Builder signature(SignatureBlob signature) {
            signatures.add(signature);
            return this;
        }

        public Builder declaredChecksum(DeclaredChecksum checksum) {
            this.declaredChecksum = checksum;
            return this;
        }

        public Builder flag(HardeningFlag flag) {
            hardeningFlags.add(flag);
            return this;
        }

        public Builder license(String license) {
            if (license != null && !license.isBlank() && !licenses.contains(license.strip())) {
                licenses.add(license.strip());
            }
            return this;
        }

        public Builder versionCandidate(String source, String value) {
            if (value != null && !value.isBlank()) {
                versionCandidates.add(new VersionCandidate(source, value.strip()));
            }
            return this;
        }

        public Builder algorithmIdentifier(String identifier) {
            if (!algorithmIdentifiers.contains(identifier)) {
                algorithmIdentifiers.add(identifier);
            }
            return this;
        }

        public Builder anomaly(String anomaly) {
            headerAnomalies.add(anomaly);
            return this;
        }

        public Builder property(String key, String value) {
            if (value != null) {
                properties.put(key, value);
            }
            return this;
        }

        public Builder contentDigests(Map<String, String> digests) {
            contentDigests.putAll(digests);
            return this;
        }

        public Builder fileSize(long fileSize) {
            this.fileSize = fileSize;
            return this;
        }

        public BinaryDescriptor build() {
            return new BinaryDescriptor(
                format,
                architecture,
                bitness,
                endianness,
                kind,
                entryPoint,
                sections,
                imports,
                certificates,
                signatures,
                declaredChecksum,
                hardeningFlags,
                licenses,
                versionCandidates,
                algorithmIdentifiers,
                headerAnomalies,
                properties,
                contentDigests,
                fileSize
            );
        }
    }
}
