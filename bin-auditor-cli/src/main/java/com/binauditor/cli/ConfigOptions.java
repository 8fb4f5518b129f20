package com.binauditor.cli;

import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.config.ConfigLoader;
import com.binauditor.core.crypto.TrustMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration options shared by commands that audit a binary.
 *
 * <p>An explicitly named configuration file must exist and be valid; the default
 * {@code binauditor.yaml} in the working directory is optional.
 */
public class ConfigOptions {

    private static final Logger log = LoggerFactory.getLogger(ConfigOptions.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: binauditor.yaml if present)"
    )
    Path configPath;

    @Option(
        names = {"--trusted-key"},
        description = "PEM or DER certificate or public key to trust (repeatable)"
    )
    List<Path> trustedKeys = new ArrayList<>();

    /**
     * Loads the configuration.
     *
     * @return configuration
     * @throws com.binauditor.core.config.ConfigurationException if an explicit file is invalid
     */
    AuditConfig loadConfig() {
        AuditConfig config;
        if (configPath != null) {
            log.debug("Loading configuration from: {}", configPath.toAbsolutePath());
            config = ConfigLoader.loadStrict(configPath);
        } else {
            config = ConfigLoader.load(Path.of(ConfigLoader.DEFAULT_FILE_NAME));
        }
        if (!trustedKeys.isEmpty()) {
            List<String> keys = new ArrayList<>(config.crypto().trustedKeys());
            trustedKeys.forEach(key -> keys.add(key.toAbsolutePath().toString()));
            config = config.withCrypto(config.crypto().withTrustedKeys(keys));
        }
        return config;
    }

    /**
     * Loads the trusted keys named by the configuration, resolving relative paths against the
     * configuration file's directory.
     *
     * @param config loaded configuration
     * @return trust material
     * @throws com.binauditor.core.config.ConfigurationException if a key cannot be loaded
     */
    TrustMaterial loadTrust(AuditConfig config) {
        Path base = configPath != null ? configPath.toAbsolutePath().getParent() : Path.of("").toAbsolutePath();
        return ConfigLoader.loadTrustMaterial(config, base);
    }
}
