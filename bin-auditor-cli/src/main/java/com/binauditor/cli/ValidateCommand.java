package com.binauditor.cli;

import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.config.ConfigLoader;
import com.binauditor.core.config.ConfigurationException;
import com.binauditor.core.crypto.TrustMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file and the trusted keys it names.
 */
@Command(
    name = "validate",
    description = "Validate configuration file and trusted keys",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        log.info("Validating configuration: {}", configFile);
        try {
            AuditConfig config = ConfigLoader.loadStrict(configFile);
            TrustMaterial trust = ConfigLoader.loadTrustMaterial(config, configFile.toAbsolutePath().getParent());
            out.println("✓ Configuration is valid: " + configFile);
            out.println("  Parallelism: " + config.runner().parallelism());
            out.println("  Trusted keys: " + trust.size());
            out.println("  Required flags: " + config.security().requiredFlags());
            out.println("  SBOM format: " + config.sbom().format().id());
            return ExitCodes.OK;
        } catch (ConfigurationException e) {
            log.error("Configuration is invalid: {}", e.getMessage());
            spec.commandLine().getErr().println("✗ " + e.getMessage());
            return ExitCodes.INVALID_INPUT;
        }
    }
}
