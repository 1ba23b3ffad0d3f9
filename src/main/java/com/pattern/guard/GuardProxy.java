package com.pattern.guard;

import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive read-only, reflection-blocking wrapper for values exposed to scripts.
 * <p>
 * Wrapping is idempotent and identity-preserving: the same host reference always
 * maps to the same {@link GuardedView} for the lifetime of this proxy, however it
 * was reached. Children are wrapped lazily when read, so cyclic graphs cost one
 * view per distinct object.
 * <p>
 * A proxy is meant to live for one evaluation run. Dropping it releases every
 * view and, with them, the host graph.
 */
public final class GuardProxy {

    private static final Logger log = LoggerFactory.getLogger(GuardProxy.class);

    private final Map<Object, GuardedView> views = new IdentityHashMap<>();

    /**
     * Wrap a host value for script access.
     * Primitives pass through in their script form. Objects become guarded views.
     * Types that must never reach scripts become {@code undefined}.
     *
     * @param value Host value, may be null
     * @return Script-safe value
     */
    public synchronized Object wrap(Object value) {
        if (value == null || value == Undefined.instance || value instanceof ReadOnlyScriptable) {
            return value;
        }
        Object primitive = HostValues.toScriptPrimitive(value);
        if (primitive != HostValues.NO_CONVERSION) {
            return primitive;
        }
        if (value instanceof Optional<?> optional) {
            return wrap(optional.orElse(null));
        }

        GuardedView existing = views.get(value);
        if (existing != null) {
            return existing;
        }

        GuardedView view = createView(value);
        if (view == null) {
            log.debug("Refusing to expose host value of type {}", value.getClass().getName());
            return Undefined.instance;
        }
        views.put(value, view);
        return view;
    }

    private GuardedView createView(Object value) {
        if (value instanceof Map<?, ?> map) {
            return new GuardedMap(this, map);
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return new GuardedList(this, value);
        }
        if (HostValues.isExposable(value.getClass())) {
            return new GuardedObject(this, value);
        }
        return null;
    }

    /**
     * Number of distinct host objects wrapped so far.
     */
    public synchronized int size() {
        return views.size();
    }
}
