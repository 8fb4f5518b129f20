package com.binauditor;

import com.binauditor.cli.CheckCommand;
import com.binauditor.cli.ListCommand;
import com.binauditor.cli.SbomCommand;
import com.binauditor.cli.ValidateCommand;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for BinAuditor.
 *
 * <p>BinAuditor audits compiled ELF, PE and Mach-O binaries against eleven compliance checks
 * and generates CycloneDX or SPDX software bills of materials.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code check} - Run compliance checks, optionally with SBOM generation</li>
 *   <li>{@code sbom} - Generate an SBOM only</li>
 *   <li>{@code list} - List available checks or SBOM encoders</li>
 *   <li>{@code validate} - Validate a configuration file and its trusted keys</li>
 * </ul>
 *
 * <p><b>Exit codes:</b> 0 when all checks pass, 1 when any check fails, 2 for invalid input
 * or configuration.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * binauditor check ./my-binary
 * binauditor check ./my-binary --format json
 * binauditor check ./my-binary --sbom --sbom-format spdx --sbom-output ./sbom.json
 * binauditor list checks
 * }</pre>
 */
@Command(
    name = "binauditor",
    mixinStandardHelpOptions = true,
    version = "BinAuditor " + BinAuditorCLI.VERSION,
    description = "Compliance auditing and SBOM generation for compiled binaries",
    subcommands = {
        CheckCommand.class,
        SbomCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class BinAuditorCLI implements Runnable {

    public static final String VERSION = "1.0.0-SNAPSHOT";
    public static final String TOOL_NAME = "binauditor";

    private static final Logger log = LoggerFactory.getLogger(BinAuditorCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("BinAuditor - Binary Compliance Auditor");
        System.out.println("Version: " + VERSION);
        System.out.println();
        System.out.println("Use 'binauditor --help' to see available commands");
        System.out.println("Use 'binauditor <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        BinAuditorCLI cli = new BinAuditorCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
