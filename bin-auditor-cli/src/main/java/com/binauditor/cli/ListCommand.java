package com.binauditor.cli;

import com.binauditor.core.check.CheckRegistry;
import com.binauditor.core.check.ComplianceCheck;
import com.binauditor.core.renderer.ReportRenderer;
import com.binauditor.core.renderer.ReportRenderers;
import com.binauditor.core.sbom.SbomEncoder;
import com.binauditor.core.sbom.SbomEncoders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available checks, SBOM encoders or report formats.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * binauditor list checks
 * binauditor list encoders
 * binauditor list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available checks, SBOM encoders or report formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: checks, encoders or formats")
    String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "checks", "check" -> listChecks(out);
            case "encoders", "encoder" -> listEncoders(out);
            case "formats", "format" -> listFormats(out);
            default -> {
                log.error("Unknown type: {}. Use: checks, encoders or formats", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: checks, encoders or formats");
                yield ExitCodes.INVALID_INPUT;
            }
        };
    }

    private int listChecks(PrintWriter out) {
        out.println("Available Checks:");
        out.println();
        int index = 1;
        for (ComplianceCheck check : CheckRegistry.withDefaultChecks().checks()) {
            out.printf("  %2d. %s%n", index++, check.getId());
            out.printf("      %s%n", check.getDescription());
        }
        return ExitCodes.OK;
    }

    private int listEncoders(PrintWriter out) {
        out.println("Available SBOM Encoders:");
        out.println();
        for (SbomEncoder encoder : SbomEncoders.discover()) {
            out.printf("  • %s (ID: %s)%n", encoder.getDisplayName(), encoder.getId());
            out.printf("    Schema Version: %s%n", encoder.getSchemaVersion());
            out.println();
        }
        return ExitCodes.OK;
    }

    private int listFormats(PrintWriter out) {
        out.println("Available Report Formats:");
        out.println();
        for (ReportRenderer renderer : ReportRenderers.discover()) {
            out.printf("  • %s%n", renderer.getId());
        }
        return ExitCodes.OK;
    }
}
