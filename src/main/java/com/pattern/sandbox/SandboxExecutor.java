package com.pattern.sandbox;

/**
 * Runs one untrusted predicate script against a guarded context.
 * Implementations never throw from {@link #run} or {@link #evaluate}: every
 * failure is reported as a non-match.
 */
public interface SandboxExecutor extends AutoCloseable {

    /**
     * Run a script and report how it ended.
     *
     * @param label          Name used in diagnostics
     * @param scriptSource   Body of the predicate; {@code context} and {@code chart} are bound
     * @param guardedContext Value produced by {@link com.pattern.guard.GuardProxy#wrap(Object)}
     * @return Diagnostic result, never null
     */
    ScriptResult run(String label, String scriptSource, Object guardedContext);

    /**
     * Run a script and report whether it returned exactly {@code true}.
     */
    default boolean evaluate(String scriptSource, Object guardedContext) {
        return run("script", scriptSource, guardedContext).matched();
    }

    /**
     * Release worker threads.
     */
    @Override
    void close();
}
