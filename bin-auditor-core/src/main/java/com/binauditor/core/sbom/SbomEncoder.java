package com.binauditor.core.sbom;

import com.binauditor.core.model.Component;
import com.binauditor.core.model.Sbom;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.model.SbomMetadata;

import java.util.List;

/**
 * Interface for SBOM encoders that serialize extracted components into a document schema.
 *
 * <p>Encoders are discovered via Java Service Provider Interface (SPI). They are pure: the
 * same components and metadata always produce the same bytes, and the generation time comes
 * from {@link SbomMetadata}, never from a clock.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.binauditor.core.sbom.SbomEncoder}
 *
 * @see ComponentExtractor
 * @see SbomEncoders
 */
public interface SbomEncoder {

    /**
     * Returns unique identifier for this encoder ("cyclonedx", "spdx").
     *
     * @return unique encoder identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this encoder.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the schema version written ("1.5", "SPDX-2.3").
     *
     * @return schema version
     */
    String getSchemaVersion();

    SbomFormat getFormat();

    /**
     * Encodes the components.
     *
     * @param components components, root first, as produced by {@link ComponentExtractor}
     * @param metadata generation metadata
     * @return SBOM with its serialized document
     * @throws SbomEncodingException if a component violates the schema
     */
    Sbom encode(List<Component> components, SbomMetadata metadata) throws SbomEncodingException;

    /**
     * Reads components back from a document written by this encoder.
     *
     * @param document serialized document
     * @return components, root first
     * @throws SbomEncodingException if the document is not valid for this schema
     */
    List<Component> readComponents(String document) throws SbomEncodingException;
}
