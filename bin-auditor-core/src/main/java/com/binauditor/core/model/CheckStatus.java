package com.binauditor.core.model;

/**
 * Outcome of a compliance check. There is deliberately no third value: data that is
 * unavailable for evaluation is reported as {@link #FAIL}.
 */
public enum CheckStatus {
    PASS("pass"),
    FAIL("fail");

    private final String label;

    CheckStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
