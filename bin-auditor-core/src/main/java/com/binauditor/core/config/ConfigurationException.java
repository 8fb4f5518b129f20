package com.binauditor.core.config;

/**
 * Raised when an explicitly requested configuration or its trust material is invalid.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
