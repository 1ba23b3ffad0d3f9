package com.pattern.sandbox;

import com.pattern.core.EvaluationOutcome;

/**
 * Diagnostic result of one sandboxed run.
 *
 * @param outcome       Normalized match outcome
 * @param termination   How the run ended
 * @param elapsedMillis Wall-clock time spent, including validation and compilation
 */
public record ScriptResult(
        EvaluationOutcome outcome,
        Termination termination,
        long elapsedMillis
) {
    public boolean matched() {
        return outcome.isMatched();
    }

    static ScriptResult completed(boolean matched, long elapsedMillis) {
        return new ScriptResult(EvaluationOutcome.of(matched), Termination.COMPLETED, elapsedMillis);
    }

    static ScriptResult notMatched(Termination termination, long elapsedMillis) {
        return new ScriptResult(EvaluationOutcome.NOT_MATCHED, termination, elapsedMillis);
    }
}
