package com.binauditor.core.sbom;

import com.binauditor.core.inspect.InspectedBinary;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.Component;
import com.binauditor.core.model.ComponentType;
import com.binauditor.core.model.ImportedLibrary;
import com.binauditor.core.model.VersionCandidate;
import com.binauditor.core.util.SemanticVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the SBOM component list of an inspected binary: the binary itself as the root
 * application component, followed by one library component per declared import.
 *
 * <p>The root reuses the digests and licenses gathered during inspection; nothing is
 * re-read from disk. Dependency edges are validated before they are returned.
 */
public class ComponentExtractor {

    private static final Logger log = LoggerFactory.getLogger(ComponentExtractor.class);

    private static final int VISITING = 1;
    private static final int DONE = 2;

    /**
     * Extracts components.
     *
     * @param binary inspected binary
     * @return components, root first
     * @throws SbomEncodingException if the dependency graph is invalid
     */
    public List<Component> extract(InspectedBinary binary) throws SbomEncodingException {
        BinaryDescriptor descriptor = binary.descriptor();
        String rootName = rootName(binary);

        Map<String, Component> libraries = new LinkedHashMap<>();
        if (descriptor != null) {
            for (ImportedLibrary library : descriptor.imports()) {
                if (library.name().equals(rootName) || libraries.containsKey(library.name())) {
                    continue;
                }
                libraries.put(library.name(), new Component(ComponentType.LIBRARY, library.name(),
                    blankToNull(library.versionHint()), Map.of(), List.of(), List.of()));
            }
        }

        List<String> licenses = descriptor != null ? descriptor.licenses() : binary.content().licenseTags();
        Component root = new Component(ComponentType.APPLICATION, rootName, rootVersion(descriptor),
            binary.content().digests(), licenses, new ArrayList<>(libraries.keySet()));

        List<Component> components = new ArrayList<>();
        components.add(root);
        components.addAll(libraries.values());
        validate(components);
        log.debug("Extracted {} components from {}", components.size(), binary.path());
        return components;
    }

    /**
     * Checks that component names are unique, that every dependency names a component of the
     * list and that the dependency graph is acyclic.
     *
     * @param components components to check
     * @throws SbomEncodingException on duplicate or unknown names
     * @throws CyclicDependencyException if a cycle exists
     */
    public static void validate(List<Component> components) throws SbomEncodingException {
        Map<String, Component> byName = new LinkedHashMap<>();
        for (Component component : components) {
            if (component.name().isBlank()) {
                throw new SbomEncodingException("Component name must not be blank");
            }
            if (byName.put(component.name(), component) != null) {
                throw new SbomEncodingException("Duplicate component name: " + component.name());
            }
        }
        for (Component component : components) {
            for (String dependency : component.dependencies()) {
                if (!byName.containsKey(dependency)) {
                    throw new SbomEncodingException("Component " + component.name()
                        + " depends on unknown component " + dependency);
                }
            }
        }

        Map<String, Integer> state = new HashMap<>();
        for (String name : byName.keySet()) {
            if (!state.containsKey(name)) {
                visit(name, byName, state, new ArrayList<>());
            }
        }
    }

    private static void visit(String name, Map<String, Component> byName, Map<String, Integer> state,
                              List<String> path) throws CyclicDependencyException {
        state.put(name, VISITING);
        path.add(name);
        for (String dependency : byName.get(name).dependencies()) {
            Integer seen = state.get(dependency);
            if (seen == null) {
                visit(dependency, byName, state, path);
            } else if (seen == VISITING) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                throw new CyclicDependencyException(cycle);
            }
        }
        path.remove(path.size() - 1);
        state.put(name, DONE);
    }

    private static String rootName(InspectedBinary binary) {
        BinaryDescriptor descriptor = binary.descriptor();
        if (descriptor != null) {
            String packageName = descriptor.property("package.name");
            if (packageName != null && !packageName.isBlank()) {
                return packageName.strip();
            }
        }
        return binary.path().getFileName().toString();
    }

    private static String rootVersion(BinaryDescriptor descriptor) {
        if (descriptor == null) {
            return null;
        }
        Set<String> raw = new LinkedHashSet<>();
        for (VersionCandidate candidate : descriptor.versionCandidates()) {
            if (SemanticVersion.parse(candidate.value()).isPresent()) {
                return candidate.value().strip();
            }
            raw.add(candidate.value());
        }
        return raw.isEmpty() ? null : raw.iterator().next();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
