package com.binauditor.core.config;

import com.binauditor.core.model.HardeningFlag;
import com.binauditor.core.model.SbomFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for BinAuditor runs.
 *
 * <p>Loaded from {@code binauditor.yaml}. Every section is optional; missing sections and
 * fields take the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * runner:
 *   parallelism: 4
 *   timeoutSeconds: 60
 *
 * dependencies:
 *   denylist: ["libssl.so.1.0*", "msvcr71.dll"]
 *   requireVersionPins: true
 *
 * crypto:
 *   trustedKeys: ["keys/release-ca.pem"]
 *   approvedAlgorithms: [SHA-256, SHA-384, SHA-512, AES, RSA, ECDSA]
 *
 * security:
 *   requiredFlags: [PIE, STACK_PROTECTION, NX_STACK]
 *
 * licenses:
 *   denylist: [AGPL-3.0-only]
 *
 * sbom:
 *   format: cyclonedx
 *   output: sbom.json
 * }</pre>
 *
 * @param runner worker pool and deadline
 * @param dependencies dependency rules
 * @param crypto trust material and algorithm policy
 * @param security hardening policy
 * @param licenses license policy
 * @param sbom SBOM defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
    @JsonProperty("runner") RunnerConfig runner,
    @JsonProperty("dependencies") DependencyPolicy dependencies,
    @JsonProperty("crypto") CryptoPolicy crypto,
    @JsonProperty("security") SecurityPolicy security,
    @JsonProperty("licenses") LicensePolicy licenses,
    @JsonProperty("sbom") SbomConfig sbom
) {
    public static final List<String> DEFAULT_APPROVED_ALGORITHMS = List.of(
        "SHA-256", "SHA-384", "SHA-512", "SHA3-256", "SHA3-384", "SHA3-512",
        "AES", "CHACHA20", "RSA", "ECDSA", "ED25519");

    public static final List<String> DEFAULT_DEPRECATED_ALGORITHMS = List.of(
        "MD4", "MD5", "SHA-1", "DES", "3DES", "RC4", "BLOWFISH");

    /**
     * Compact constructor filling absent sections with defaults.
     */
    public AuditConfig {
        runner = runner == null ? RunnerConfig.defaults() : runner;
        dependencies = dependencies == null ? DependencyPolicy.defaults() : dependencies;
        crypto = crypto == null ? CryptoPolicy.defaults() : crypto;
        security = security == null ? SecurityPolicy.defaults() : security;
        licenses = licenses == null ? LicensePolicy.defaults() : licenses;
        sbom = sbom == null ? SbomConfig.defaults() : sbom;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AuditConfig defaults() {
        return new AuditConfig(null, null, null, null, null, null);
    }

    public AuditConfig withRunner(RunnerConfig replacement) {
        return new AuditConfig(replacement, dependencies, crypto, security, licenses, sbom);
    }

    public AuditConfig withCrypto(CryptoPolicy replacement) {
        return new AuditConfig(runner, dependencies, replacement, security, licenses, sbom);
    }

    /**
     * Worker pool settings.
     *
     * @param parallelism number of worker threads, at least 1
     * @param timeoutSeconds run deadline in seconds, 0 for none
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RunnerConfig(
        @JsonProperty("parallelism") Integer parallelism,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds
    ) {
        public RunnerConfig {
            if (parallelism == null) {
                parallelism = Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 8));
            }
            if (timeoutSeconds == null) {
                timeoutSeconds = 0L;
            }
        }

        public static RunnerConfig defaults() {
            return new RunnerConfig(null, null);
        }
    }

    /**
     * Dependency rules.
     *
     * @param denylist case-insensitive globs of forbidden library names
     * @param requireVersionPins whether ELF and Mach-O imports must carry a version
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DependencyPolicy(
        @JsonProperty("denylist") List<String> denylist,
        @JsonProperty("requireVersionPins") Boolean requireVersionPins
    ) {
        public DependencyPolicy {
            denylist = denylist == null ? List.of() : List.copyOf(denylist);
            if (requireVersionPins == null) {
                requireVersionPins = Boolean.TRUE;
            }
        }

        public static DependencyPolicy defaults() {
            return new DependencyPolicy(null, null);
        }
    }

    /**
     * Trust material and algorithm policy.
     *
     * @param trustedKeys PEM or DER files with trusted certificates or public keys
     * @param approvedAlgorithms algorithm identifiers allowed in content and certificates
     * @param deprecatedAlgorithms identifiers reported as deprecated when found
     * @param requireCertificate whether a binary without embedded certificates fails certificate validation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CryptoPolicy(
        @JsonProperty("trustedKeys") List<String> trustedKeys,
        @JsonProperty("approvedAlgorithms") List<String> approvedAlgorithms,
        @JsonProperty("deprecatedAlgorithms") List<String> deprecatedAlgorithms,
        @JsonProperty("requireCertificate") Boolean requireCertificate
    ) {
        public CryptoPolicy {
            trustedKeys = trustedKeys == null ? List.of() : List.copyOf(trustedKeys);
            approvedAlgorithms = approvedAlgorithms == null ? DEFAULT_APPROVED_ALGORITHMS : List.copyOf(approvedAlgorithms);
            deprecatedAlgorithms = deprecatedAlgorithms == null
                ? DEFAULT_DEPRECATED_ALGORITHMS
                : List.copyOf(deprecatedAlgorithms);
            if (requireCertificate == null) {
                requireCertificate = Boolean.TRUE;
            }
        }

        public static CryptoPolicy defaults() {
            return new CryptoPolicy(null, null, null, null);
        }

        public CryptoPolicy withTrustedKeys(List<String> keys) {
            return new CryptoPolicy(keys, approvedAlgorithms, deprecatedAlgorithms, requireCertificate);
        }
    }

    /**
     * Hardening policy.
     *
     * @param requiredFlags flags every binary must carry
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SecurityPolicy(
        @JsonProperty("requiredFlags") List<HardeningFlag> requiredFlags
    ) {
        public SecurityPolicy {
            requiredFlags = requiredFlags == null
                ? List.of(HardeningFlag.PIE, HardeningFlag.STACK_PROTECTION, HardeningFlag.NX_STACK)
                : List.copyOf(requiredFlags);
        }

        public static SecurityPolicy defaults() {
            return new SecurityPolicy(null);
        }
    }

    /**
     * License policy.
     *
     * @param denylist SPDX identifiers that must not appear in any declared license
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LicensePolicy(
        @JsonProperty("denylist") List<String> denylist
    ) {
        public LicensePolicy {
            denylist = denylist == null ? List.of() : List.copyOf(denylist);
        }

        public static LicensePolicy defaults() {
            return new LicensePolicy(null);
        }
    }

    /**
     * SBOM defaults.
     *
     * @param format default document format
     * @param output default output path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SbomConfig(
        @JsonProperty("format") SbomFormat format,
        @JsonProperty("output") String output
    ) {
        public SbomConfig {
            if (format == null) {
                format = SbomFormat.CYCLONEDX;
            }
            if (output == null || output.isBlank()) {
                output = "sbom.json";
            }
        }

        public static SbomConfig defaults() {
            return new SbomConfig(null, null);
        }
    }
}
