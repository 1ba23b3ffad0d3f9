package com.pattern.engine;

import com.pattern.core.Pattern;
import com.pattern.core.PatternMatch;
import com.pattern.guard.GuardProxy;
import com.pattern.sandbox.SandboxExecutor;
import com.pattern.sandbox.ScriptResult;
import com.pattern.sandbox.Termination;
import com.pattern.store.PatternStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Serial coordinator: one guarded view per run, one pattern at a time in store order.
 */
public class DefaultPatternEvaluationCoordinator implements PatternEvaluationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultPatternEvaluationCoordinator.class);

    private final PatternStore store;
    private final SandboxExecutor executor;

    public DefaultPatternEvaluationCoordinator(PatternStore store, SandboxExecutor executor) {
        this.store = store;
        this.executor = executor;
    }

    @Override
    public List<PatternMatch> evaluateAll(Object chartContext) {
        if (chartContext == null) {
            throw new IllegalArgumentException("Chart context cannot be null");
        }
        long start = System.nanoTime();
        List<Pattern> patterns = store.list();

        // One proxy per run: the cache dies with it and never pins the chart
        GuardProxy guard = new GuardProxy();
        Object view = guard.wrap(chartContext);

        List<PatternMatch> matches = new ArrayList<>();
        int rejected = 0;
        int timedOut = 0;
        int failed = 0;

        for (Pattern pattern : patterns) {
            Termination termination = Termination.FAILED;
            try {
                ScriptResult result = executor.run(label(pattern), pattern.script(), view);
                termination = result.termination();
                if (result.matched()) {
                    matches.add(pattern.toMatch());
                }
                log.debug("Pattern {} ({}) -> {} in {}ms",
                        pattern.id(), pattern.name(), result.outcome(), result.elapsedMillis());
            } catch (RuntimeException e) {
                log.warn("Pattern {} ({}) failed in the executor, treated as no match",
                        pattern.id(), pattern.name(), e);
            }
            switch (termination) {
                case REJECTED -> rejected++;
                case TIMED_OUT -> timedOut++;
                case FAILED -> failed++;
                case COMPLETED -> {
                }
            }
        }

        EvaluationSummary summary = new EvaluationSummary(patterns.size(), matches.size(), rejected, timedOut,
                failed, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        log.info("Pattern evaluation finished: {}", summary);
        return matches;
    }

    private static String label(Pattern pattern) {
        return "pattern-" + pattern.id();
    }
}
