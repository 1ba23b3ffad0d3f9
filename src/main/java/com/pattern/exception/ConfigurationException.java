package com.pattern.exception;

/**
 * Exception thrown when engine configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends PatternEngineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
