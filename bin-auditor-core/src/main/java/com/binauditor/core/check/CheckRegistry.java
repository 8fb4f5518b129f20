package com.binauditor.core.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Ordered set of compliance checks owned by one run.
 *
 * <p>Not a singleton: callers construct a registry per invocation so that concurrent runs
 * cannot see each other's registrations. Registration order is the order of results.
 */
public class CheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(CheckRegistry.class);

    private final Map<String, ComplianceCheck> checks = new LinkedHashMap<>();

    /**
     * Creates a registry holding every check found via {@link ServiceLoader}.
     *
     * @return registry with the built-in checks in service-file order
     */
    public static CheckRegistry withDefaultChecks() {
        return withChecksFrom(CheckRegistry.class.getClassLoader());
    }

    /**
     * Creates a registry holding every check visible to the class loader.
     *
     * @param classLoader loader to discover checks with
     * @return populated registry
     * @throws DuplicateCheckIdException if two providers share an identifier
     */
    public static CheckRegistry withChecksFrom(ClassLoader classLoader) {
        log.debug("Discovering compliance checks via ServiceLoader");
        CheckRegistry registry = new CheckRegistry();
        ServiceLoader.load(ComplianceCheck.class, classLoader).forEach(registry::register);
        log.debug("Discovered {} compliance checks", registry.count());
        if (log.isTraceEnabled()) {
            registry.checks().forEach(c -> log.trace("  - {} ({})", c.getId(), c.getDescription()));
        }
        return registry;
    }

    /**
     * Adds a check after all previously registered ones.
     *
     * @param check check to add
     * @throws DuplicateCheckIdException if the identifier is already registered
     */
    public synchronized void register(ComplianceCheck check) {
        Objects.requireNonNull(check, "check must not be null");
        String id = check.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Check " + check.getClass().getName() + " has no identifier");
        }
        if (checks.containsKey(id)) {
            throw new DuplicateCheckIdException(id);
        }
        checks.put(id, check);
    }

    public synchronized int count() {
        return checks.size();
    }

    /**
     * Snapshot of the registered checks in registration order.
     *
     * @return immutable list
     */
    public synchronized List<ComplianceCheck> checks() {
        return Collections.unmodifiableList(new ArrayList<>(checks.values()));
    }

    public synchronized Optional<ComplianceCheck> find(String id) {
        return Optional.ofNullable(checks.get(id));
    }
}
