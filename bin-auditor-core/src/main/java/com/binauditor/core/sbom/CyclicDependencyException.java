package com.binauditor.core.sbom;

import java.util.List;

/**
 * Raised when the component dependency graph contains a cycle.
 */
public class CyclicDependencyException extends SbomEncodingException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Component names along the cycle; the first name is repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
