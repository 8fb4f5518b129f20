package com.binauditor.core.check.base;

import com.binauditor.core.check.ComplianceCheck;
import com.binauditor.core.model.CheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Abstract base class for compliance check implementations providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per check class)</li>
 *   <li>Identifier and description storage</li>
 *   <li>Result creation helpers ({@link #pass(String, Map)}, {@link #fail(String, Map)})</li>
 *   <li>Ordered metadata construction ({@link #metadata(Object...)})</li>
 * </ul>
 *
 * <p>Subclasses must stay stateless: one instance serves every run.
 *
 * @see ComplianceCheck
 */
public abstract class AbstractCheck implements ComplianceCheck {

    /**
     * Logger instance for this check.
     * Automatically initialized with the concrete check class name.
     */
    protected final Logger log;

    private final String id;
    private final String description;

    protected AbstractCheck(String id, String description) {
        this.log = LoggerFactory.getLogger(getClass());
        this.id = id;
        this.description = description;
    }

    @Override
    public final String getId() {
        return id;
    }

    @Override
    public final String getDescription() {
        return description;
    }

    protected CheckResult pass(String details, Map<String, Object> metadata) {
        return CheckResult.pass(id, description, details, metadata);
    }

    protected CheckResult pass(String details) {
        return pass(details, Map.of());
    }

    protected CheckResult fail(String details, Map<String, Object> metadata) {
        return CheckResult.fail(id, description, details, metadata);
    }

    protected CheckResult fail(String details) {
        return fail(details, Map.of());
    }

    /**
     * Builds an ordered metadata map from alternating keys and values. Null values are skipped.
     *
     * @param keysAndValues {@code key1, value1, key2, value2, ...}
     * @return mutable ordered map
     */
    protected static Map<String, Object> metadata(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("metadata needs key/value pairs");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                metadata.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
            }
        }
        return metadata;
    }
}
