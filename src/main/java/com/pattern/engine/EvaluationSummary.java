package com.pattern.engine;

/**
 * Counters for one coordinator run. Logged, never returned to callers.
 *
 * @param total         Patterns evaluated
 * @param matched       Patterns that returned true
 * @param rejected      Patterns refused by the static scan
 * @param timedOut      Patterns aborted for exceeding the budget
 * @param failed        Patterns that threw or failed to compile
 * @param elapsedMillis Wall-clock time for the whole run
 */
public record EvaluationSummary(
        int total,
        int matched,
        int rejected,
        int timedOut,
        int failed,
        long elapsedMillis
) {
}
