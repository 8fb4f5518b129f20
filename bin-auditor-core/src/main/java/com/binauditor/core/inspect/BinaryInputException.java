package com.binauditor.core.inspect;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The audited path cannot be read as a file. Distinct from format errors, which still yield
 * a (degraded) report.
 */
public class BinaryInputException extends IOException {

    /**
     * Why the input was rejected.
     */
    public enum Reason {
        NOT_FOUND,
        PERMISSION_DENIED,
        NOT_A_REGULAR_FILE,
        READ_FAILED
    }

    private final Reason reason;
    private final Path path;

    public BinaryInputException(Reason reason, Path path, String message) {
        super(message);
        this.reason = reason;
        this.path = path;
    }

    public BinaryInputException(Reason reason, Path path, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.path = path;
    }

    public Reason getReason() {
        return reason;
    }

    public Path getPath() {
        return path;
    }
}
