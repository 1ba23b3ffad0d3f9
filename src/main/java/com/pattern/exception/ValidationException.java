package com.pattern.exception;

/**
 * Exception thrown when a pattern is rejected before it is persisted:
 * a required field is blank or the script fails the static scan.
 */
public class ValidationException extends PatternEngineException {

    public ValidationException(String message) {
        super(message);
    }
}
