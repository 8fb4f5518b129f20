package com.binauditor.core.check;

import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.crypto.TrustMaterial;
import com.binauditor.core.inspect.BinaryInputException;
import com.binauditor.core.inspect.BinaryInspector;
import com.binauditor.core.inspect.InspectedBinary;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.testing.TestKeys;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Base class for compliance check tests.
 *
 * <p>Provides common test infrastructure including:
 * <ul>
 *   <li>Temporary directory for fixture binaries</li>
 *   <li>Inspection of a written fixture into a {@link CheckContext}</li>
 *   <li>Trust material holding the test root CA and an evaluation time inside its validity</li>
 * </ul>
 */
public abstract class CheckTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Trust anchored at the test root CA.
     */
    protected static TrustMaterial trustedRoot() {
        return new TrustMaterial(List.of(TestKeys.ca()), List.of());
    }

    /**
     * Writes the bytes to {@code tempDir/name}.
     *
     * @param name file name
     * @param content file content
     * @return the created file path
     * @throws IOException if the file cannot be written
     */
    protected Path writeBinary(String name, byte[] content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content);
        return file;
    }

    protected InspectedBinary inspect(String name, byte[] content) throws IOException, BinaryInputException {
        return new BinaryInspector().inspect(writeBinary(name, content));
    }

    protected CheckContext context(String name, byte[] content) throws IOException, BinaryInputException {
        return context(name, content, AuditConfig.defaults(), trustedRoot());
    }

    protected CheckContext context(String name, byte[] content, AuditConfig config)
        throws IOException, BinaryInputException {
        return context(name, content, config, trustedRoot());
    }

    protected CheckContext context(String name, byte[] content, AuditConfig config, TrustMaterial trust)
        throws IOException, BinaryInputException {
        return new CheckContext(inspect(name, content), config, trust, TestKeys.VALID_AT);
    }

    /**
     * Runs the check on a fixture with default configuration and the test root as trust.
     */
    protected CheckResult run(ComplianceCheck check, String name, byte[] content)
        throws IOException, BinaryInputException {
        return check.execute(context(name, content));
    }
}
