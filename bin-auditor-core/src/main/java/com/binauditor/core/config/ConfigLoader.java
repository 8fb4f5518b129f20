package com.binauditor.core.config;

import com.binauditor.core.crypto.TrustMaterial;
import com.binauditor.core.crypto.TrustMaterialLoader;
import com.binauditor.core.model.HardeningFlag;
import com.binauditor.core.model.SbomFormat;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Utility for loading BinAuditor configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code binauditor.yaml} into {@link AuditConfig} records.
 * {@link #load(Path)} is lenient: a missing or invalid file yields {@link AuditConfig#defaults()}.
 * {@link #loadStrict(Path)} is used when the user names a file explicitly and fails instead.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AuditConfig config = ConfigLoader.load(Path.of("binauditor.yaml"));
 * TrustMaterial trust = ConfigLoader.loadTrustMaterial(config, Path.of("."));
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "binauditor.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .registerModule(new SimpleModule("binauditor-enums")
            .addDeserializer(SbomFormat.class, new SbomFormatDeserializer())
            .addDeserializer(HardeningFlag.class, new HardeningFlagDeserializer()));

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link AuditConfig#defaults()}.
     *
     * @param configPath path to {@code binauditor.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AuditConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        try {
            return read(configPath);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AuditConfig.defaults();
        }
    }

    /**
     * Loads configuration from a YAML file that must exist and be valid.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static AuditConfig loadStrict(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Configuration file not found: " + configPath);
        }
        try {
            AuditConfig config = read(configPath);
            validate(config);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the trusted certificates and keys named by the configuration.
     *
     * @param config configuration
     * @param baseDirectory directory relative key paths are resolved against
     * @return trust material, empty when no keys are configured
     * @throws ConfigurationException if a key file cannot be read or decoded
     */
    public static TrustMaterial loadTrustMaterial(AuditConfig config, Path baseDirectory) {
        List<Path> files = new ArrayList<>();
        for (String key : config.crypto().trustedKeys()) {
            Path path = Path.of(key);
            files.add(path.isAbsolute() || baseDirectory == null ? path : baseDirectory.resolve(path));
        }
        if (files.isEmpty()) {
            return TrustMaterial.empty();
        }
        try {
            TrustMaterial trust = TrustMaterialLoader.load(files);
            log.debug("Loaded {} trusted keys", trust.size());
            return trust;
        } catch (IOException | GeneralSecurityException e) {
            throw new ConfigurationException("Failed to load trusted keys: " + e.getMessage(), e);
        }
    }

    /**
     * Checks value ranges Jackson cannot express.
     *
     * @param config configuration to check
     * @throws ConfigurationException on the first invalid value
     */
    public static void validate(AuditConfig config) {
        if (config.runner().parallelism() < 1) {
            throw new ConfigurationException("runner.parallelism must be at least 1");
        }
        if (config.runner().timeoutSeconds() < 0) {
            throw new ConfigurationException("runner.timeoutSeconds must not be negative");
        }
        if (config.crypto().approvedAlgorithms().isEmpty()) {
            throw new ConfigurationException("crypto.approvedAlgorithms must not be empty");
        }
    }

    private static AuditConfig read(Path configPath) throws IOException {
        log.debug("Loading configuration from: {}", configPath);
        AuditConfig config = YAML_MAPPER.readValue(configPath.toFile(), AuditConfig.class);
        if (config == null) {
            config = AuditConfig.defaults();
        }
        log.info("Loaded configuration from: {}", configPath);
        return config;
    }

    private static final class SbomFormatDeserializer extends JsonDeserializer<SbomFormat> {
        @Override
        public SbomFormat deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            try {
                return SbomFormat.fromId(parser.getValueAsString());
            } catch (IllegalArgumentException e) {
                return (SbomFormat) context.handleWeirdStringValue(SbomFormat.class, parser.getValueAsString(),
                    e.getMessage());
            }
        }
    }

    private static final class HardeningFlagDeserializer extends JsonDeserializer<HardeningFlag> {
        @Override
        public HardeningFlag deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String value = parser.getValueAsString();
            try {
                return HardeningFlag.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException | NullPointerException e) {
                return (HardeningFlag) context.handleWeirdStringValue(HardeningFlag.class, value,
                    "unknown hardening flag");
            }
        }
    }
}
