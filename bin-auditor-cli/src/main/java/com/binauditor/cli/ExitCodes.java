package com.binauditor.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    /** All checks passed. */
    public static final int OK = 0;
    /** At least one check failed or the run was cut short. */
    public static final int CHECKS_FAILED = 1;
    /** The binary, options or configuration were invalid. */
    public static final int INVALID_INPUT = 2;

    private ExitCodes() {
    }
}
