package com.pattern.sandbox;

/**
 * Thrown from the interpreter's instruction observer when a script outlives its
 * deadline. Being an {@link Error}, script {@code try/catch} cannot intercept it.
 */
public class ScriptTimeoutError extends Error {

    public ScriptTimeoutError(long timeoutMs) {
        super("Script exceeded its " + timeoutMs + "ms budget", null, false, false);
    }
}
