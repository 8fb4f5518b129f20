package com.binauditor.core.inspect;

import com.binauditor.core.format.BinaryFormatException;
import com.binauditor.core.format.BinaryParser;
import com.binauditor.core.format.BinaryParsers;
import com.binauditor.core.format.FormatDetector;
import com.binauditor.core.format.ParseInput;
import com.binauditor.core.io.ByteSource;
import com.binauditor.core.io.FileByteSource;
import com.binauditor.core.model.BinaryDescriptor;
import com.binauditor.core.model.BinaryFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a binary once: streams it for digests and strings, detects its format and parses
 * the descriptor.
 *
 * <p>Format problems never abort inspection. They are recorded on the result so that
 * every check can report its own failure; only an unreadable path is an error.
 */
public class BinaryInspector {

    private static final Logger log = LoggerFactory.getLogger(BinaryInspector.class);

    private final Map<BinaryFormat, BinaryParser> parsers = new EnumMap<>(BinaryFormat.class);

    public BinaryInspector() {
        this(List.of());
    }

    /**
     * Creates an inspector that prefers the given parsers over the registered ones.
     */
    BinaryInspector(List<BinaryParser> parsers) {
        parsers.forEach(parser -> this.parsers.put(parser.format(), parser));
    }

    /**
     * Inspects the file.
     *
     * @param file path to the binary
     * @return inspection result
     * @throws BinaryInputException if the path cannot be read as a regular file
     */
    public InspectedBinary inspect(Path file) throws BinaryInputException {
        Path path = file.toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new BinaryInputException(BinaryInputException.Reason.NOT_FOUND, path, "File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new BinaryInputException(BinaryInputException.Reason.NOT_A_REGULAR_FILE, path,
                "Not a regular file: " + path);
        }

        try (ByteSource source = FileByteSource.open(path)) {
            ContentFacts facts = ContentScanner.scan(source);
            log.debug("Scanned {} ({} bytes, sha256 {})", path, facts.size(), facts.sha256());
            return inspect(path, source, facts);
        } catch (AccessDeniedException e) {
            throw new BinaryInputException(BinaryInputException.Reason.PERMISSION_DENIED, path,
                "Permission denied: " + path, e);
        } catch (NoSuchFileException e) {
            throw new BinaryInputException(BinaryInputException.Reason.NOT_FOUND, path, "File not found: " + path, e);
        } catch (UncheckedIOException e) {
            throw new BinaryInputException(BinaryInputException.Reason.READ_FAILED, path,
                "Failed to read " + path + ": " + e.getCause().getMessage(), e.getCause());
        } catch (IOException e) {
            throw new BinaryInputException(BinaryInputException.Reason.READ_FAILED, path,
                "Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private InspectedBinary inspect(Path path, ByteSource source, ContentFacts facts) throws IOException {
        BinaryFormat format;
        try {
            format = FormatDetector.detect(source);
        } catch (BinaryFormatException e) {
            log.warn("Format detection failed for {}: {}", path, e.getMessage());
            return new InspectedBinary(path, BinaryFormat.UNKNOWN, null, e.getMessage(), facts);
        }
        if (format == BinaryFormat.UNKNOWN) {
            log.warn("No supported binary format recognized in {}", path);
            return new InspectedBinary(path, format, null, "No ELF, PE or Mach-O magic number found", facts);
        }

        ParseInput input = new ParseInput(facts.digests(), facts.licenseTags(), facts.algorithmIdentifiers());
        try {
            BinaryDescriptor descriptor = parserFor(format).parse(source, input);
            log.debug("Parsed {} {} binary with {} sections and {} imports", format.displayName(),
                descriptor.architecture(), descriptor.sections().size(), descriptor.imports().size());
            return new InspectedBinary(path, format, descriptor, null, facts);
        } catch (BinaryFormatException e) {
            return degraded(path, format, e, facts);
        } catch (UncheckedIOException e) {
            throw e;
        } catch (RuntimeException e) {
            return degraded(path, format, new BinaryFormatException(BinaryFormatException.Reason.MALFORMED_HEADER,
                "Parser rejected inconsistent structure (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")",
                e), facts);
        }
    }

    private BinaryParser parserFor(BinaryFormat format) throws BinaryFormatException {
        BinaryParser parser = parsers.get(format);
        return parser != null ? parser : BinaryParsers.forFormat(format);
    }

    private static InspectedBinary degraded(Path path, BinaryFormat format, BinaryFormatException e,
                                            ContentFacts facts) {
        log.warn("Failed to parse {} as {} ({}): {}", path, format.displayName(), e.getReason(), e.getMessage());
        return new InspectedBinary(path, format, null, e.getReason() + ": " + e.getMessage(), facts);
    }
}
