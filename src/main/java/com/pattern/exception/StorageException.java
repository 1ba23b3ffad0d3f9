package com.pattern.exception;

/**
 * Exception thrown when the pattern store cannot read or write its backing database.
 * Records committed before the failure are unaffected.
 */
public class StorageException extends PatternEngineException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
