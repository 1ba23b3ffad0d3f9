package com.pattern.engine;

import com.pattern.core.PatternMatch;

import java.util.List;

/**
 * Evaluates every stored pattern against one chart context.
 */
public interface PatternEvaluationCoordinator {

    /**
     * Run all stored patterns, in store order, against a freshly computed chart.
     * Failing patterns count as non-matches and never abort the run.
     *
     * @param chartContext Chart produced by the external engine; read, never modified
     * @return Matched patterns in store order, empty when nothing matches
     * @throws com.pattern.exception.StorageException if the patterns cannot be read
     */
    List<PatternMatch> evaluateAll(Object chartContext);
}
