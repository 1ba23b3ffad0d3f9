package com.pattern.guard;

import org.mozilla.javascript.Scriptable;

import java.util.Set;

/**
 * Base for every object the engine hands to sandboxed scripts.
 * <p>
 * Reads go through {@link #lookup(String)} and {@link #lookup(int)}, except the
 * meta-properties in {@link #DENIED_PROPERTIES}, which always read as absent.
 * Writes, deletes and prototype or scope reassignment are ignored without error.
 * There is no prototype chain, so nothing reachable from a view leads back to
 * built-in constructors.
 */
public abstract class ReadOnlyScriptable implements Scriptable {

    /**
     * Properties that expose a value's constructing function or its prototype chain.
     */
    public static final Set<String> DENIED_PROPERTIES = Set.of("constructor", "prototype", "__proto__");

    /**
     * Resolve a named property, or {@link Scriptable#NOT_FOUND}.
     */
    protected abstract Object lookup(String name);

    /**
     * Resolve an indexed property, or {@link Scriptable#NOT_FOUND}.
     */
    protected Object lookup(int index) {
        return NOT_FOUND;
    }

    /**
     * Enumerable property ids.
     */
    protected Object[] ids() {
        return new Object[0];
    }

    @Override
    public final Object get(String name, Scriptable start) {
        if (DENIED_PROPERTIES.contains(name)) {
            return NOT_FOUND;
        }
        return lookup(name);
    }

    @Override
    public final Object get(int index, Scriptable start) {
        return lookup(index);
    }

    @Override
    public final boolean has(String name, Scriptable start) {
        return get(name, start) != NOT_FOUND;
    }

    @Override
    public final boolean has(int index, Scriptable start) {
        return get(index, start) != NOT_FOUND;
    }

    @Override
    public final void put(String name, Scriptable start, Object value) {
        // read-only
    }

    @Override
    public final void put(int index, Scriptable start, Object value) {
        // read-only
    }

    @Override
    public final void delete(String name) {
        // read-only
    }

    @Override
    public final void delete(int index) {
        // read-only
    }

    @Override
    public final Scriptable getPrototype() {
        return null;
    }

    @Override
    public final void setPrototype(Scriptable prototype) {
        // read-only
    }

    @Override
    public final Scriptable getParentScope() {
        return null;
    }

    @Override
    public final void setParentScope(Scriptable parent) {
        // read-only
    }

    @Override
    public final Object[] getIds() {
        return ids();
    }

    @Override
    public Object getDefaultValue(Class<?> hint) {
        if (hint == Boolean.class) {
            return Boolean.TRUE;
        }
        if (hint == Number.class) {
            return Double.NaN;
        }
        return "[object " + getClassName() + "]";
    }

    @Override
    public boolean hasInstance(Scriptable instance) {
        return false;
    }
}
