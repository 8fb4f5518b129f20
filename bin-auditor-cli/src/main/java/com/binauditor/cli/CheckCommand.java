package com.binauditor.cli;

import com.binauditor.core.check.CheckRegistry;
import com.binauditor.core.check.CheckRunner;
import com.binauditor.core.check.RunOptions;
import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.config.ConfigurationException;
import com.binauditor.core.crypto.TrustMaterial;
import com.binauditor.core.inspect.BinaryInputException;
import com.binauditor.core.inspect.BinaryInspector;
import com.binauditor.core.inspect.InspectedBinary;
import com.binauditor.core.model.ComplianceReport;
import com.binauditor.core.model.SbomFormat;
import com.binauditor.core.renderer.ReportRenderer;
import com.binauditor.core.renderer.ReportRenderers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Callable;

/**
 * Command to run all compliance checks against a binary.
 *
 * <p>Inspects the binary once, then runs the checks and, with {@code --sbom}, SBOM
 * generation concurrently over the shared inspection. SBOM failures are reported as warnings
 * and never change the exit code.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * binauditor check ./my-binary
 * binauditor check ./my-binary --format json
 * binauditor check ./my-binary --sbom --sbom-format cyclonedx --sbom-output ./sbom.json
 * }</pre>
 */
@Command(
    name = "check",
    description = "Run compliance checks against a binary",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ConfigOptions configOptions = new ConfigOptions();

    @Parameters(index = "0", description = "Binary to audit")
    Path binaryPath;

    @Option(names = {"-f", "--format"}, description = "Output format: text, json (default: ${DEFAULT-VALUE})",
        defaultValue = "text")
    String outputFormat;

    @Option(names = {"--sbom"}, description = "Generate an SBOM alongside the report")
    boolean generateSbom;

    @Option(names = {"--sbom-format"}, description = "SBOM format: cyclonedx, spdx (default: from configuration)")
    String sbomFormat;

    @Option(names = {"--sbom-output"}, description = "SBOM output file (default: from configuration)")
    Path sbomOutput;

    @Option(names = {"--parallelism"}, description = "Number of worker threads (default: from configuration)")
    Integer parallelism;

    @Option(names = {"--timeout"}, description = "Run deadline in seconds, 0 for none (default: from configuration)")
    Long timeoutSeconds;

    Clock clock = Clock.systemUTC();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ReportRenderer renderer;
        AuditConfig config;
        TrustMaterial trust;
        SbomFormat format;
        RunOptions options;
        try {
            renderer = ReportRenderers.forId(outputFormat);
            config = configOptions.loadConfig();
            trust = configOptions.loadTrust(config);
            format = sbomFormat != null ? SbomFormat.fromId(sbomFormat) : config.sbom().format();
            options = new RunOptions(
                parallelism != null ? parallelism : config.runner().parallelism(),
                Duration.ofSeconds(timeoutSeconds != null ? timeoutSeconds : config.runner().timeoutSeconds()));
        } catch (ConfigurationException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("✗ " + e.getMessage());
            return ExitCodes.INVALID_INPUT;
        }

        InspectedBinary binary;
        try {
            binary = new BinaryInspector().inspect(binaryPath);
        } catch (BinaryInputException e) {
            log.error("Cannot audit {}: {}", binaryPath, e.getMessage());
            err.println("✗ " + e.getMessage());
            return ExitCodes.INVALID_INPUT;
        }

        CheckRegistry registry = CheckRegistry.withDefaultChecks();
        log.debug("Registered {} compliance checks", registry.count());
        if (!"json".equals(renderer.getId())) {
            out.println("Running " + registry.count() + " compliance checks"
                + (generateSbom ? " and generating SBOM" : "") + "...");
            out.flush();
        }

        Path sbomTarget = sbomOutput != null ? sbomOutput : Path.of(config.sbom().output());
        CompletableFuture<Path> sbom = generateSbom
            ? CompletableFuture.supplyAsync(() -> writeSbom(binary, format, sbomTarget))
            : CompletableFuture.completedFuture(null);

        CheckRunner runner = new CheckRunner(registry, config, trust, clock, options, new BinaryInspector());
        ComplianceReport report = runner.runAll(binary);

        Path written = sbom.join();
        if (written != null) {
            report = report.withSbomPath(written.toString());
        } else if (generateSbom) {
            err.println("⚠ WARNING: SBOM generation failed; see log for details");
        }

        out.print(renderer.render(report));
        out.flush();

        if (!report.isPassing()) {
            log.warn("Compliance check failed: {}/{} checks passed", report.passedChecks(), report.totalChecks());
            return ExitCodes.CHECKS_FAILED;
        }
        log.info("All compliance checks passed: {}/{}", report.passedChecks(), report.totalChecks());
        return ExitCodes.OK;
    }

    private Path writeSbom(InspectedBinary binary, SbomFormat format, Path target) {
        try {
            return SbomWriter.write(binary, format, target, clock.instant());
        } catch (Exception e) {
            log.warn("SBOM generation failed: {}", e.getMessage(), e);
            return null;
        }
    }
}
