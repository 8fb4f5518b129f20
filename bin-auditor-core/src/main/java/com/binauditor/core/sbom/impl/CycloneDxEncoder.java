package com.binauditor.core.sbom.impl;

import com.binauditor.core.model.Component;
import com.binauditor.core.model.ComponentType;
import com.binauditor.core.model.Sbom;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.model.SbomMetadata;
import com.binauditor.core.sbom.SbomEncodingException;
import com.binauditor.core.sbom.base.AbstractJsonSbomEncoder;
import com.binauditor.core.util.SpdxExpression;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes CycloneDX 1.5 JSON.
 *
 * <p>The root component goes to {@code metadata.component}, libraries to {@code components},
 * and edges to {@code dependencies}. Component names double as {@code bom-ref} values.
 */
public class CycloneDxEncoder extends AbstractJsonSbomEncoder {

    public static final String SPEC_VERSION = "1.5";

    @Override
    public String getId() {
        return SbomFormat.CYCLONEDX.id();
    }

    @Override
    public String getDisplayName() {
        return "CycloneDX";
    }

    @Override
    public String getSchemaVersion() {
        return SPEC_VERSION;
    }

    @Override
    public SbomFormat getFormat() {
        return SbomFormat.CYCLONEDX;
    }

    @Override
    public Sbom encode(List<Component> components, SbomMetadata metadata) throws SbomEncodingException {
        validate(components);
        Component root = components.get(0);

        ObjectNode bom = objectMapper.createObjectNode();
        bom.put("bomFormat", "CycloneDX");
        bom.put("specVersion", SPEC_VERSION);
        bom.put("serialNumber", "urn:uuid:" + documentId(root, metadata));
        bom.put("version", 1);

        ObjectNode meta = bom.putObject("metadata");
        meta.put("timestamp", timestamp(metadata));
        ObjectNode tool = meta.putObject("tools").putArray("components").addObject();
        tool.put("type", "application");
        tool.put("name", metadata.toolName());
        tool.put("version", metadata.toolVersion());
        meta.set("component", component(root));

        ArrayNode list = bom.putArray("components");
        for (Component component : components.subList(1, components.size())) {
            list.add(component(component));
        }

        ArrayNode dependencies = bom.putArray("dependencies");
        for (Component component : components) {
            ObjectNode entry = dependencies.addObject();
            entry.put("ref", component.name());
            ArrayNode dependsOn = entry.putArray("dependsOn");
            component.dependencies().forEach(dependsOn::add);
        }

        String document = write(bom);
        log.debug("Encoded {} components as CycloneDX {}", components.size(), SPEC_VERSION);
        return new Sbom(SbomFormat.CYCLONEDX, SPEC_VERSION, components, metadata, document);
    }

    private ObjectNode component(Component component) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", component.type() == ComponentType.APPLICATION ? "application" : "library");
        node.put("bom-ref", component.name());
        node.put("name", component.name());
        if (component.version() != null) {
            node.put("version", component.version());
        }
        if (!component.digests().isEmpty()) {
            ArrayNode hashes = node.putArray("hashes");
            sortedDigests(component).forEach((alg, value) -> {
                ObjectNode hash = hashes.addObject();
                hash.put("alg", alg);
                hash.put("content", value.toLowerCase(Locale.ROOT));
            });
        }
        if (!component.licenses().isEmpty()) {
            // licenseChoice is either license objects or a single expression, never both
            ArrayNode licenses = node.putArray("licenses");
            if (component.licenses().stream().allMatch(SpdxExpression::isKnownLicense)) {
                component.licenses().forEach(license -> licenses.addObject().putObject("license").put("id", license));
            } else {
                licenses.addObject().put("expression", conjunction(component.licenses()));
            }
        }
        return node;
    }

    @Override
    public List<Component> readComponents(String document) throws SbomEncodingException {
        JsonNode bom = read(document);
        if (!"CycloneDX".equals(text(bom, "bomFormat"))) {
            throw new SbomEncodingException("Not a CycloneDX document: bomFormat is " + text(bom, "bomFormat"));
        }

        Map<String, List<String>> edges = new HashMap<>();
        for (JsonNode entry : bom.path("dependencies")) {
            List<String> dependsOn = new ArrayList<>();
            entry.path("dependsOn").forEach(ref -> dependsOn.add(ref.asText()));
            edges.put(requireText(entry, "ref", "dependency entry"), dependsOn);
        }

        Map<String, Component> components = new LinkedHashMap<>();
        JsonNode root = bom.path("metadata").path("component");
        if (root.isObject()) {
            addComponent(root, edges, components);
        }
        for (JsonNode node : bom.path("components")) {
            addComponent(node, edges, components);
        }
        return List.copyOf(components.values());
    }

    private static void addComponent(JsonNode node, Map<String, List<String>> edges, Map<String, Component> into)
            throws SbomEncodingException {
        String name = requireText(node, "name", "component");
        String ref = text(node, "bom-ref");
        ComponentType type = "application".equals(text(node, "type")) ? ComponentType.APPLICATION : ComponentType.LIBRARY;

        Map<String, String> digests = new LinkedHashMap<>();
        for (JsonNode hash : node.path("hashes")) {
            digests.put(requireText(hash, "alg", "hash of " + name), requireText(hash, "content", "hash of " + name));
        }
        List<String> licenses = new ArrayList<>();
        for (JsonNode license : node.path("licenses")) {
            String expression = text(license, "expression");
            String id = text(license.path("license"), "id");
            String licenseName = text(license.path("license"), "name");
            if (expression != null) {
                licenses.add(expression);
            } else if (id != null) {
                licenses.add(id);
            } else if (licenseName != null) {
                licenses.add(licenseName);
            }
        }
        List<String> dependencies = edges.getOrDefault(ref != null ? ref : name, List.of());
        into.put(name, new Component(type, name, text(node, "version"), digests, licenses, dependencies));
    }
}
