package com.roll.exception;

/**
 * Exception thrown when configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends RollException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
