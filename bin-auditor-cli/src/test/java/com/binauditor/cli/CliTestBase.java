package com.binauditor.cli;

import com.binauditor.BinAuditorCLI;
import com.binauditor.core.testing.TestKeys;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;

/**
 * Base class for CLI tests.
 *
 * <p>Runs the real command line with captured output streams and a clock fixed inside the
 * validity of the test certificates.
 */
public abstract class CliTestBase {

    @TempDir
    protected Path tempDir;

    protected final StringWriter out = new StringWriter();
    protected final StringWriter err = new StringWriter();

    /**
     * Executes the command line.
     *
     * @param args arguments
     * @return exit code
     */
    protected int execute(String... args) {
        CommandLine commandLine = BinAuditorCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));

        Clock clock = Clock.fixed(TestKeys.VALID_AT, ZoneOffset.UTC);
        ((CheckCommand) commandLine.getSubcommands().get("check").getCommand()).clock = clock;
        ((SbomCommand) commandLine.getSubcommands().get("sbom").getCommand()).clock = clock;
        return commandLine.execute(args);
    }

    protected Path writeBinary(String name, byte[] content) throws IOException {
        return Files.write(tempDir.resolve(name), content);
    }

    protected Path trustedCa() throws IOException {
        return TestKeys.copyTo(tempDir, TestKeys.CA);
    }
}
