package com.pattern.exception;

/**
 * Base exception for the pattern engine.
 */
public class PatternEngineException extends RuntimeException {

    public PatternEngineException(String message) {
        super(message);
    }

    public PatternEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
