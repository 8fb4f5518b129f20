package com.binauditor.core.sbom;

import com.binauditor.core.model.SbomFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Lookup of the SBOM encoders available on the class path.
 */
public final class SbomEncoders {

    private static final Logger log = LoggerFactory.getLogger(SbomEncoders.class);

    private SbomEncoders() {
    }

    /**
     * Discovers encoders via {@link ServiceLoader}.
     *
     * @return encoders in service-file order
     */
    public static List<SbomEncoder> discover() {
        List<SbomEncoder> encoders = new ArrayList<>();
        ServiceLoader.load(SbomEncoder.class, SbomEncoders.class.getClassLoader()).forEach(encoders::add);
        log.debug("Discovered {} SBOM encoders", encoders.size());
        return encoders;
    }

    /**
     * Finds the encoder for a format.
     *
     * @param format document format
     * @return encoder
     * @throws IllegalArgumentException if no encoder supports the format
     */
    public static SbomEncoder forFormat(SbomFormat format) {
        return discover().stream()
            .filter(encoder -> encoder.getFormat() == format)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No SBOM encoder for format " + format.id()));
    }
}
