package com.binauditor.core.format;

/**
 * Signals that binary content could not be interpreted as a supported container.
 */
public class BinaryFormatException extends Exception {

    /**
     * Category of the format error.
     */
    public enum Reason {
        /** Fewer bytes than any magic number needs. */
        TRUNCATED,
        /** A fixed header field holds an impossible value. */
        MALFORMED_HEADER,
        /** A table or field points past the end of the content. */
        UNEXPECTED_EOF,
        /** A recognized container using a layout this tool does not handle. */
        UNSUPPORTED_VARIANT
    }

    private final Reason reason;

    public BinaryFormatException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BinaryFormatException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
