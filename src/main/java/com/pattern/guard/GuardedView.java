package com.pattern.guard;

/**
 * Read-only view over one host value, produced by {@link GuardProxy#wrap(Object)}.
 * Values read through a view are wrapped by the same proxy, so the guarantee is
 * transitive through the whole reachable graph.
 */
public abstract class GuardedView extends ReadOnlyScriptable {

    protected final GuardProxy guard;
    private final Object target;

    protected GuardedView(GuardProxy guard, Object target) {
        this.guard = guard;
        this.target = target;
    }

    /**
     * The real host value. Never handed to script code.
     */
    final Object target() {
        return target;
    }
}
