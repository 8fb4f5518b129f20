package com.binauditor.cli;

import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.config.ConfigurationException;
import com.binauditor.core.inspect.BinaryInputException;
import com.binauditor.core.inspect.BinaryInspector;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.sbom.SbomEncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * Command to generate an SBOM without running compliance checks.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * binauditor sbom ./my-binary
 * binauditor sbom ./my-binary --format spdx -o ./sbom.spdx.json
 * }</pre>
 */
@Command(
    name = "sbom",
    description = "Generate a software bill of materials for a binary",
    mixinStandardHelpOptions = true
)
public class SbomCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SbomCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ConfigOptions configOptions = new ConfigOptions();

    @Parameters(index = "0", description = "Binary to describe")
    Path binaryPath;

    @Option(names = {"--format"}, description = "SBOM format: cyclonedx, spdx (default: from configuration)")
    String format;

    @Option(names = {"-o", "--output"}, description = "Output file (default: from configuration)")
    Path output;

    Clock clock = Clock.systemUTC();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AuditConfig config;
        SbomFormat sbomFormat;
        try {
            config = configOptions.loadConfig();
            sbomFormat = format != null ? SbomFormat.fromId(format) : config.sbom().format();
        } catch (ConfigurationException | IllegalArgumentException e) {
            err.println("✗ " + e.getMessage());
            return ExitCodes.INVALID_INPUT;
        }

        try {
            Path written = SbomWriter.write(new BinaryInspector().inspect(binaryPath), sbomFormat,
                output != null ? output : Path.of(config.sbom().output()), clock.instant());
            out.println("✓ SBOM generated: " + written);
            return ExitCodes.OK;
        } catch (BinaryInputException e) {
            log.error("Cannot read {}: {}", binaryPath, e.getMessage());
            err.println("✗ " + e.getMessage());
            return ExitCodes.INVALID_INPUT;
        } catch (SbomEncodingException e) {
            log.error("SBOM encoding failed", e);
            err.println("✗ SBOM generation failed: " + e.getMessage());
            return ExitCodes.CHECKS_FAILED;
        } catch (IOException e) {
            log.error("Failed to write SBOM", e);
            err.println("✗ Failed to write SBOM: " + e.getMessage());
            return ExitCodes.CHECKS_FAILED;
        }
    }
}
