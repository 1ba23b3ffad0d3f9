package com.pattern.guard;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * View over a {@link Map}: each key, by its string form, is a property.
 */
final class GuardedMap extends GuardedView {

    GuardedMap(GuardProxy guard, Map<?, ?> target) {
        super(guard, target);
    }

    private Map<?, ?> map() {
        return (Map<?, ?>) target();
    }

    @Override
    protected Object lookup(String name) {
        Map<?, ?> map = map();
        // Sorted maps may reject foreign key types, so they are only scanned
        if (!(map instanceof SortedMap)) {
            Object value = map.get(name);
            if (value != null || map.containsKey(name)) {
                return guard.wrap(value);
            }
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (name.equals(keyName(entry.getKey()))) {
                return guard.wrap(entry.getValue());
            }
        }
        return NOT_FOUND;
    }

    @Override
    protected Object lookup(int index) {
        return lookup(String.valueOf(index));
    }

    @Override
    protected Object[] ids() {
        List<Object> ids = new ArrayList<>();
        for (Object key : map().keySet()) {
            String name = keyName(key);
            if (!DENIED_PROPERTIES.contains(name)) {
                ids.add(name);
            }
        }
        return ids.toArray();
    }

    @Override
    public String getClassName() {
        return "Object";
    }

    private static String keyName(Object key) {
        if (key instanceof Enum<?> e) {
            return e.name();
        }
        return String.valueOf(key);
    }
}
