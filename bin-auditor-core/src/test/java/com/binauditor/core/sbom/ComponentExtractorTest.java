package com.binauditor.core.sbom;

import com.binauditor.core.inspect.BinaryInspector;
import com.binauditor.core.inspect.InspectedBinary;
import com.binauditor.core.model.Component;
import com.binauditor.core.model.ComponentType;
import com.binauditor.core.testing.ElfFixtureBuilder;
import com.binauditor.core.testing.PeFixtureBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ComponentExtractor}.
 */
class ComponentExtractorTest {

    @TempDir
    Path tempDir;

    private final ComponentExtractor extractor = new ComponentExtractor();

    @Test
    void extract_withElfImports_buildsRootAndLibraries() throws Exception {
        // Given
        InspectedBinary binary = inspect("demo-app", ElfFixtureBuilder.executable()
            .packageNote("demo-app", "2.4.1", "MIT")
            .needed("libc.so.6")
            .needed("libssl.so.3")
            .build());

        // When
        List<Component> components = extractor.extract(binary);

        // Then
        assertThat(components).extracting(Component::name).containsExactly("demo-app", "libc.so.6", "libssl.so.3");
        Component root = components.get(0);
        assertThat(root.type()).isEqualTo(ComponentType.APPLICATION);
        assertThat(root.version()).isEqualTo("2.4.1");
        assertThat(root.licenses()).containsExactly("MIT");
        assertThat(root.digests()).containsEntry("SHA-256", binary.sha256());
        assertThat(root.dependencies()).containsExactly("libc.so.6", "libssl.so.3");
        assertThat(components.get(2).type()).isEqualTo(ComponentType.LIBRARY);
        assertThat(components.get(2).version()).isEqualTo("3");
        assertThat(components.get(2).dependencies()).isEmpty();
    }

    @Test
    void extract_withoutPackageName_usesFileName() throws Exception {
        InspectedBinary binary = inspect("tool.exe", PeFixtureBuilder.executable()
            .imports("KERNEL32.dll", "KERNEL32.dll", "USER32.dll")
            .build());

        List<Component> components = extractor.extract(binary);

        assertThat(components).extracting(Component::name).containsExactly("tool.exe", "KERNEL32.dll", "USER32.dll");
        assertThat(components.get(0).version()).isNull();
    }

    @Test
    void extract_withUnparseableFile_returnsRootOnly() throws Exception {
        InspectedBinary binary = inspect("notes.txt", "SPDX-License-Identifier: MIT\n".getBytes());

        List<Component> components = extractor.extract(binary);

        assertThat(components).hasSize(1);
        assertThat(components.get(0).name()).isEqualTo("notes.txt");
        assertThat(components.get(0).licenses()).containsExactly("MIT");
    }

    @Test
    void validate_withCycle_throwsWithCyclePath() {
        // Given
        List<Component> components = List.of(
            component("app", "a"),
            component("a", "b"),
            component("b", "a"));

        // When / Then
        assertThatThrownBy(() -> ComponentExtractor.validate(components))
            .isInstanceOf(CyclicDependencyException.class)
            .hasMessage("Cyclic dependency: a -> b -> a")
            .satisfies(e -> assertThat(((CyclicDependencyException) e).getCycle()).containsExactly("a", "b", "a"));
    }

    @Test
    void validate_withUnknownDependency_throws() {
        List<Component> components = List.of(component("app", "missing"));

        assertThatThrownBy(() -> ComponentExtractor.validate(components))
            .isInstanceOf(SbomEncodingException.class)
            .hasMessageContaining("depends on unknown component missing");
    }

    @Test
    void validate_withDuplicateName_throws() {
        List<Component> components = List.of(component("app"), component("app"));

        assertThatThrownBy(() -> ComponentExtractor.validate(components))
            .isInstanceOf(SbomEncodingException.class)
            .hasMessage("Duplicate component name: app");
    }

    private InspectedBinary inspect(String name, byte[] content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, content);
        return new BinaryInspector().inspect(file);
    }

    private static Component component(String name, String... dependencies) {
        return new Component(ComponentType.LIBRARY, name, null, Map.of(), List.of(), List.of(dependencies));
    }
}
