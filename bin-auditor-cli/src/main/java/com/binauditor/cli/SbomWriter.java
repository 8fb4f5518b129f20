package com.binauditor.cli;

import com.binauditor.BinAuditorCLI;
import com.binauditor.core.inspect.InspectedBinary;
import com.binauditor.core.model.Sbom;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.model.SbomMetadata;
import com.binauditor.core.sbom.ComponentExtractor;
import com.binauditor.core.sbom.SbomEncoders;
import com.binauditor.core.sbom.SbomEncodingException;
import com.binauditor.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Extracts, encodes and writes an SBOM for an inspected binary.
 */
final class SbomWriter {

    private static final Logger log = LoggerFactory.getLogger(SbomWriter.class);

    private SbomWriter() {
    }

    /**
     * Generates the SBOM and writes it.
     *
     * @param binary inspected binary
     * @param format document format
     * @param output target file
     * @param timestamp generation time recorded in the document
     * @return absolute path of the written document
     * @throws SbomEncodingException if the components cannot be encoded
     * @throws IOException if the file cannot be written
     */
    static Path write(InspectedBinary binary, SbomFormat format, Path output, Instant timestamp)
            throws SbomEncodingException, IOException {
        log.info("Generating {} SBOM for {}", format.id(), binary.path());
        Sbom sbom = SbomEncoders.forFormat(format).encode(
            new ComponentExtractor().extract(binary),
            new SbomMetadata(timestamp, BinAuditorCLI.TOOL_NAME, BinAuditorCLI.VERSION));
        Path target = output.toAbsolutePath();
        FileUtils.writeString(target, sbom.document());
        log.info("SBOM written to {} ({} components)", target, sbom.components().size());
        return target;
    }
}
