package com.binauditor.core.sbom.impl;

import com.binauditor.core.model.Component;
import com.binauditor.core.model.ComponentType;
import com.binauditor.core.model.Sbom;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.model.SbomMetadata;
import com.binauditor.core.sbom.SbomEncodingException;
import com.binauditor.core.sbom.base.AbstractJsonSbomEncoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes SPDX 2.3 JSON.
 *
 * <p>Every component becomes a package; the document {@code DESCRIBES} the root and each
 * dependency is a {@code DEPENDS_ON} relationship. Multiple declared licenses are joined
 * with {@code AND}.
 */
public class SpdxEncoder extends AbstractJsonSbomEncoder {

    public static final String SPDX_VERSION = "SPDX-2.3";

    private static final String DOCUMENT_ID = "SPDXRef-DOCUMENT";
    private static final String NO_ASSERTION = "NOASSERTION";
    private static final String NAMESPACE_BASE = "https://spdx.org/spdxdocs/";

    @Override
    public String getId() {
        return SbomFormat.SPDX.id();
    }

    @Override
    public String getDisplayName() {
        return "SPDX";
    }

    @Override
    public String getSchemaVersion() {
        return SPDX_VERSION;
    }

    @Override
    public SbomFormat getFormat() {
        return SbomFormat.SPDX;
    }

    @Override
    public Sbom encode(List<Component> components, SbomMetadata metadata) throws SbomEncodingException {
        validate(components);
        Component root = components.get(0);
        Map<String, String> ids = packageIds(components);

        ObjectNode document = objectMapper.createObjectNode();
        document.put("spdxVersion", SPDX_VERSION);
        document.put("dataLicense", "CC0-1.0");
        document.put("SPDXID", DOCUMENT_ID);
        document.put("name", root.name());
        document.put("documentNamespace", NAMESPACE_BASE + sanitize(root.name()) + "-" + documentId(root, metadata));

        ObjectNode creation = document.putObject("creationInfo");
        creation.put("created", timestamp(metadata));
        creation.putArray("creators").add("Tool: " + metadata.toolName() + "-" + metadata.toolVersion());
        document.putArray("documentDescribes").add(ids.get(root.name()));

        ArrayNode packages = document.putArray("packages");
        for (Component component : components) {
            packages.add(packageNode(component, ids.get(component.name())));
        }

        ArrayNode relationships = document.putArray("relationships");
        relationship(relationships, DOCUMENT_ID, "DESCRIBES", ids.get(root.name()));
        for (Component component : components) {
            for (String dependency : component.dependencies()) {
                relationship(relationships, ids.get(component.name()), "DEPENDS_ON", ids.get(dependency));
            }
        }

        String json = write(document);
        log.debug("Encoded {} components as {}", components.size(), SPDX_VERSION);
        return new Sbom(SbomFormat.SPDX, SPDX_VERSION, components, metadata, json);
    }

    private ObjectNode packageNode(Component component, String id) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("SPDXID", id);
        node.put("name", component.name());
        if (component.version() != null) {
            node.put("versionInfo", component.version());
        }
        node.put("downloadLocation", NO_ASSERTION);
        node.put("filesAnalyzed", false);
        if (!component.digests().isEmpty()) {
            ArrayNode checksums = node.putArray("checksums");
            sortedDigests(component).forEach((alg, value) -> {
                ObjectNode checksum = checksums.addObject();
                checksum.put("algorithm", alg.replace("-", ""));
                checksum.put("checksumValue", value.toLowerCase(Locale.ROOT));
            });
        }
        node.put("licenseConcluded", NO_ASSERTION);
        node.put("licenseDeclared", declaredLicense(component.licenses()));
        node.put("copyrightText", NO_ASSERTION);
        node.put("primaryPackagePurpose", component.type() == ComponentType.APPLICATION ? "APPLICATION" : "LIBRARY");
        return node;
    }

    private static void relationship(ArrayNode relationships, String from, String type, String to) {
        ObjectNode node = relationships.addObject();
        node.put("spdxElementId", from);
        node.put("relationshipType", type);
        node.put("relatedSpdxElement", to);
    }

    private static String declaredLicense(List<String> licenses) {
        if (licenses.isEmpty()) {
            return NO_ASSERTION;
        }
        return conjunction(licenses);
    }

    private static Map<String, String> packageIds(List<Component> components) {
        Map<String, String> ids = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (Component component : components) {
            String base = "SPDXRef-Package-" + sanitize(component.name());
            String id = base;
            for (int n = 2; !used.add(id); n++) {
                id = base + "-" + n;
            }
            ids.put(component.name(), id);
        }
        return ids;
    }

    private static String sanitize(String name) {
        String sanitized = name.replaceAll("[^A-Za-z0-9.\\-]", "-");
        return sanitized.isEmpty() ? "unnamed" : sanitized;
    }

    @Override
    public List<Component> readComponents(String document) throws SbomEncodingException {
        JsonNode root = read(document);
        String version = text(root, "spdxVersion");
        if (version == null || !version.startsWith("SPDX-2.")) {
            throw new SbomEncodingException("Not an SPDX 2.x document: spdxVersion is " + version);
        }

        Map<String, String> names = new HashMap<>();
        for (JsonNode node : root.path("packages")) {
            names.put(requireText(node, "SPDXID", "package"), requireText(node, "name", "package"));
        }
        Map<String, List<String>> edges = new HashMap<>();
        String described = null;
        for (JsonNode relationship : root.path("relationships")) {
            String type = text(relationship, "relationshipType");
            String from = text(relationship, "spdxElementId");
            String to = text(relationship, "relatedSpdxElement");
            if ("DEPENDS_ON".equals(type) && names.containsKey(to)) {
                edges.computeIfAbsent(from, key -> new ArrayList<>()).add(names.get(to));
            } else if ("DESCRIBES".equals(type) && DOCUMENT_ID.equals(from)) {
                described = to;
            }
        }

        List<Component> components = new ArrayList<>();
        for (JsonNode node : root.path("packages")) {
            String id = text(node, "SPDXID");
            Map<String, String> digests = new LinkedHashMap<>();
            for (JsonNode checksum : node.path("checksums")) {
                digests.put(digestName(requireText(checksum, "algorithm", "checksum")),
                    requireText(checksum, "checksumValue", "checksum"));
            }
            String license = text(node, "licenseDeclared");
            List<String> licenses = license == null || NO_ASSERTION.equals(license) || "NONE".equals(license)
                ? List.of()
                : List.of(license);
            boolean application = "APPLICATION".equals(text(node, "primaryPackagePurpose")) || id.equals(described);
            Component component = new Component(application ? ComponentType.APPLICATION : ComponentType.LIBRARY,
                names.get(id), text(node, "versionInfo"), digests, licenses, edges.getOrDefault(id, List.of()));
            if (id.equals(described)) {
                components.add(0, component);
            } else {
                components.add(component);
            }
        }
        return components;
    }

    private static String digestName(String spdxAlgorithm) {
        String upper = spdxAlgorithm.toUpperCase(Locale.ROOT);
        return upper.startsWith("SHA") && !upper.contains("-") ? "SHA-" + upper.substring(3) : upper;
    }
}
