package com.binauditor.core.check;

/**
 * Wraps an unexpected failure inside a check. The runner converts it to a failing result.
 */
public class CheckExecutionException extends RuntimeException {

    private final String checkId;

    public CheckExecutionException(String checkId, Throwable cause) {
        super("Check " + checkId + " failed unexpectedly: " + describe(cause), cause);
        this.checkId = checkId;
    }

    public String getCheckId() {
        return checkId;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
