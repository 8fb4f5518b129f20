package com.binauditor.core.check;

/**
 * Raised when a check is registered under an identifier that is already taken.
 */
public class DuplicateCheckIdException extends IllegalArgumentException {

    private final String checkId;

    public DuplicateCheckIdException(String checkId) {
        super("Check already registered: " + checkId);
        this.checkId = checkId;
    }

    public String getCheckId() {
        return checkId;
    }
}
