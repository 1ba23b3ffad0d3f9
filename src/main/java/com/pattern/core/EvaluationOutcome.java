package com.pattern.core;

/**
 * Outcome of running one pattern script against one chart context.
 * Every failure mode normalizes to {@link #NOT_MATCHED}.
 */
public enum EvaluationOutcome {
    MATCHED,
    NOT_MATCHED;

    public boolean isMatched() {
        return this == MATCHED;
    }

    public static EvaluationOutcome of(boolean matched) {
        return matched ? MATCHED : NOT_MATCHED;
    }
}
