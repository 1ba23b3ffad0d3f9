package com.pattern.sandbox;

import com.pattern.config.SandboxConfig;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;

/**
 * Rhino context factory for sandboxed evaluation.
 * <p>
 * Contexts run interpreted so the instruction observer can enforce a wall-clock
 * deadline and the interpreter stack depth is bounded. A deny-all class shutter
 * keeps every Java class out of reach, and host-object wrapping never happens
 * because scripts only ever see guarded views.
 */
class SandboxContextFactory extends ContextFactory {

    private final SandboxConfig config;

    SandboxContextFactory(SandboxConfig config) {
        this.config = config;
    }

    /**
     * Context that carries the deadline of the script it is running.
     */
    static final class SandboxContext extends Context {

        private boolean armed;
        private long deadlineNanos;
        private long budgetMs;

        SandboxContext(ContextFactory factory) {
            super(factory);
        }

        void startBudget(long budgetMs) {
            this.budgetMs = budgetMs;
            this.deadlineNanos = System.nanoTime() + budgetMs * 1_000_000L;
            this.armed = true;
        }

        void clearBudget() {
            this.armed = false;
        }

        boolean isExpired() {
            return armed && System.nanoTime() - deadlineNanos > 0;
        }
    }

    @Override
    protected Context makeContext() {
        SandboxContext cx = new SandboxContext(this);
        cx.setLanguageVersion(Context.VERSION_ES6);
        cx.setOptimizationLevel(-1);
        cx.setMaximumInterpreterStackDepth(config.maxStackDepth());
        cx.setInstructionObserverThreshold(config.instructionObserverThreshold());
        cx.setClassShutter(fullClassName -> false);
        cx.getWrapFactory().setJavaPrimitiveWrap(false);
        return cx;
    }

    @Override
    protected boolean hasFeature(Context cx, int featureIndex) {
        if (featureIndex == Context.FEATURE_ENHANCED_JAVA_ACCESS) {
            return false;
        }
        return super.hasFeature(cx, featureIndex);
    }

    @Override
    protected void observeInstructionCount(Context cx, int instructionCount) {
        SandboxContext sandboxContext = (SandboxContext) cx;
        if (sandboxContext.isExpired()) {
            throw new ScriptTimeoutError(sandboxContext.budgetMs);
        }
    }
}
