package com.binauditor.core.sbom.base;

import com.binauditor.core.model.Component;
import com.binauditor.core.model.SbomMetadata;
import com.binauditor.core.sbom.ComponentExtractor;
import com.binauditor.core.sbom.SbomEncoder;
import com.binauditor.core.sbom.SbomEncodingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Abstract base class for encoders that write JSON SBOM documents with Jackson.
 *
 * <p>Provides:
 * <ul>
 *   <li>A shared {@link ObjectMapper} for building and reading JSON trees</li>
 *   <li>Pretty-printed, deterministic serialization ({@link #write(ObjectNode)})</li>
 *   <li>Component validation common to all schemas ({@link #validate(List)})</li>
 *   <li>Helpers for timestamps, stable identifiers and node navigation</li>
 * </ul>
 *
 * @see SbomEncoder
 */
public abstract class AbstractJsonSbomEncoder implements SbomEncoder {

    /** Digest algorithms both schemas can express. */
    protected static final Set<String> SUPPORTED_DIGESTS = Set.of("SHA-1", "SHA-256", "SHA-384", "SHA-512");

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");

    /**
     * Logger instance for this encoder.
     */
    protected final Logger log;

    /**
     * JSON mapper used for tree construction and parsing.
     * Thread-safe and reusable.
     */
    protected final ObjectMapper objectMapper;

    protected AbstractJsonSbomEncoder() {
        this.log = LoggerFactory.getLogger(getClass());
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Serializes a document tree.
     *
     * @param document root node
     * @return pretty-printed JSON
     * @throws SbomEncodingException if serialization fails
     */
    protected String write(ObjectNode document) throws SbomEncodingException {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new SbomEncodingException("Failed to serialize " + getDisplayName() + " document", e);
        }
    }

    /**
     * Parses a document.
     *
     * @param document JSON text
     * @return root object
     * @throws SbomEncodingException if the text is not a JSON object
     */
    protected JsonNode read(String document) throws SbomEncodingException {
        try {
            JsonNode root = objectMapper.readTree(document);
            if (root == null || !root.isObject()) {
                throw new SbomEncodingException(getDisplayName() + " document must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new SbomEncodingException("Invalid " + getDisplayName() + " document: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Checks components against rules shared by all schemas: a root first, unique non-blank
     * names, supported hex digests and a valid dependency graph.
     *
     * @param components components to encode
     * @throws SbomEncodingException on the first violation
     */
    protected void validate(List<Component> components) throws SbomEncodingException {
        if (components.isEmpty()) {
            throw new SbomEncodingException("An SBOM needs at least the root component");
        }
        for (Component component : components) {
            for (Map.Entry<String, String> digest : component.digests().entrySet()) {
                if (!SUPPORTED_DIGESTS.contains(digest.getKey())) {
                    throw new SbomEncodingException("Unsupported digest algorithm " + digest.getKey()
                        + " on component " + component.name());
                }
                if (!HEX.matcher(digest.getValue()).matches()) {
                    throw new SbomEncodingException("Digest " + digest.getKey() + " of component "
                        + component.name() + " is not hexadecimal");
                }
            }
        }
        ComponentExtractor.validate(components);
    }

    /**
     * Digests in algorithm order so that output does not depend on map iteration order.
     */
    protected static Map<String, String> sortedDigests(Component component) {
        return new TreeMap<>(component.digests());
    }

    /**
     * Joins declared licenses into one expression with {@code AND}, parenthesizing compound
     * entries: {@code MIT AND (Apache-2.0 OR GPL-2.0-only)}.
     */
    protected static String conjunction(List<String> licenses) {
        if (licenses.size() == 1) {
            return licenses.get(0);
        }
        List<String> grouped = new ArrayList<>();
        for (String license : licenses) {
            grouped.add(license.contains(" ") ? "(" + license + ")" : license);
        }
        return String.join(" AND ", grouped);
    }

    protected static String timestamp(SbomMetadata metadata) {
        return DateTimeFormatter.ISO_INSTANT.format(metadata.timestamp().truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Name-based UUID derived from the root component and the generation time.
     */
    protected static UUID documentId(Component root, SbomMetadata metadata) {
        String seed = root.name() + '\n' + root.version() + '\n' + sortedDigests(root) + '\n' + timestamp(metadata);
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    protected static String requireText(JsonNode node, String field, String context) throws SbomEncodingException {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new SbomEncodingException(context + " lacks required field '" + field + "'");
        }
        return value;
    }
}
