package com.binauditor.core.sbom.impl;

import com.binauditor.core.model.Component;
import com.binauditor.core.model.ComponentType;
import com.binauditor.core.model.Sbom;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.sbom.CyclicDependencyException;
import com.binauditor.core.sbom.SbomEncodingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.binauditor.core.sbom.impl.SbomFixtures.METADATA;
import static com.binauditor.core.sbom.impl.SbomFixtures.SHA256;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CycloneDxEncoder}.
 */
class CycloneDxEncoderTest {

    private final CycloneDxEncoder encoder = new CycloneDxEncoder();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void encode_writesRootAsMetadataComponent() throws Exception {
        // When
        Sbom sbom = encoder.encode(SbomFixtures.components(), METADATA);
        JsonNode bom = mapper.readTree(sbom.document());

        // Then
        assertThat(sbom.format()).isEqualTo(SbomFormat.CYCLONEDX);
        assertThat(sbom.schemaVersion()).isEqualTo("1.5");
        assertThat(bom.path("bomFormat").asText()).isEqualTo("CycloneDX");
        assertThat(bom.path("specVersion").asText()).isEqualTo("1.5");
        assertThat(bom.path("serialNumber").asText()).startsWith("urn:uuid:");
        assertThat(bom.path("metadata").path("timestamp").asText()).isEqualTo("2026-10-17T12:00:00Z");
        assertThat(bom.path("metadata").path("tools").path("components").get(0).path("name").asText())
            .isEqualTo("bin-auditor");

        JsonNode root = bom.path("metadata").path("component");
        assertThat(root.path("type").asText()).isEqualTo("application");
        assertThat(root.path("name").asText()).isEqualTo("demo-app");
        assertThat(root.path("hashes").get(0).path("alg").asText()).isEqualTo("SHA-256");
        assertThat(root.path("hashes").get(0).path("content").asText()).isEqualTo(SHA256);
        assertThat(root.path("licenses").get(0).path("license").path("id").asText()).isEqualTo("Apache-2.0");
        assertThat(bom.path("components")).hasSize(2);
    }

    @Test
    void encode_writesDependencyGraph() throws Exception {
        JsonNode bom = mapper.readTree(encoder.encode(SbomFixtures.components(), METADATA).document());

        JsonNode dependencies = bom.path("dependencies");
        assertThat(dependencies).hasSize(3);
        assertThat(dependencies.get(0).path("ref").asText()).isEqualTo("demo-app");
        assertThat(dependencies.get(0).path("dependsOn")).extracting(JsonNode::asText)
            .containsExactly("libc.so.6", "libssl.so.3");
        assertThat(dependencies.get(2).path("dependsOn")).extracting(JsonNode::asText).containsExactly("libc.so.6");
    }

    @Test
    void encode_withLicenseExpression_writesExpression() throws Exception {
        List<Component> components = List.of(new Component(ComponentType.APPLICATION, "demo", null, Map.of(),
            List.of("MIT OR Apache-2.0"), List.of()));

        JsonNode bom = mapper.readTree(encoder.encode(components, METADATA).document());

        assertThat(bom.path("metadata").path("component").path("licenses").get(0).path("expression").asText())
            .isEqualTo("MIT OR Apache-2.0");
    }

    @Test
    void encode_withIdentifierAndExpression_writesSingleCombinedExpression() throws Exception {
        // Given
        List<Component> components = List.of(new Component(ComponentType.APPLICATION, "demo", null, Map.of(),
            List.of("MIT", "Apache-2.0 OR GPL-2.0-only"), List.of()));

        // When
        JsonNode licenses = mapper.readTree(encoder.encode(components, METADATA).document())
            .path("metadata").path("component").path("licenses");

        // Then
        assertThat(licenses).hasSize(1);
        assertThat(licenses.get(0).has("license")).isFalse();
        assertThat(licenses.get(0).path("expression").asText()).isEqualTo("MIT AND (Apache-2.0 OR GPL-2.0-only)");
    }

    @Test
    void encode_withOnlyIdentifiers_writesLicenseObjects() throws Exception {
        List<Component> components = List.of(new Component(ComponentType.APPLICATION, "demo", null, Map.of(),
            List.of("MIT", "BSD-3-Clause"), List.of()));

        JsonNode licenses = mapper.readTree(encoder.encode(components, METADATA).document())
            .path("metadata").path("component").path("licenses");

        assertThat(licenses).extracting(node -> node.path("license").path("id").asText())
            .containsExactly("MIT", "BSD-3-Clause");
        assertThat(licenses).noneMatch(node -> node.has("expression"));
    }

    @Test
    void encode_isDeterministic() throws Exception {
        String first = encoder.encode(SbomFixtures.components(), METADATA).document();
        String second = encoder.encode(SbomFixtures.components(), METADATA).document();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void readComponents_returnsEncodedComponents() throws Exception {
        // Given
        List<Component> components = SbomFixtures.components();
        String document = encoder.encode(components, METADATA).document();

        // When
        List<Component> read = encoder.readComponents(document);

        // Then
        assertThat(read).isEqualTo(components);
    }

    @Test
    void encode_withCycle_throws() {
        List<Component> components = List.of(
            new Component(ComponentType.APPLICATION, "app", null, Map.of(), List.of(), List.of("lib")),
            new Component(ComponentType.LIBRARY, "lib", null, Map.of(), List.of(), List.of("app")));

        assertThatThrownBy(() -> encoder.encode(components, METADATA))
            .isInstanceOf(CyclicDependencyException.class);
    }

    @Test
    void encode_withNonHexDigest_throws() {
        List<Component> components = List.of(new Component(ComponentType.APPLICATION, "app", null,
            Map.of("SHA-256", "not-hex"), List.of(), List.of()));

        assertThatThrownBy(() -> encoder.encode(components, METADATA))
            .isInstanceOf(SbomEncodingException.class)
            .hasMessageContaining("is not hexadecimal");
    }

    @Test
    void readComponents_withSpdxDocument_throws() throws Exception {
        String spdx = new SpdxEncoder().encode(SbomFixtures.components(), METADATA).document();

        assertThatThrownBy(() -> encoder.readComponents(spdx))
            .isInstanceOf(SbomEncodingException.class)
            .hasMessageContaining("Not a CycloneDX document");
    }
}
