package com.pattern.guard;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * View over an arbitrary host object: its properties are record components and
 * bean getters, its callables are the remaining public value-returning methods.
 */
final class GuardedObject extends GuardedView {

    private final HostMembers members;
    private final Map<String, GuardedMethod> methodViews = new ConcurrentHashMap<>();

    GuardedObject(GuardProxy guard, Object target) {
        super(guard, target);
        this.members = HostMembers.of(target.getClass());
    }

    @Override
    protected Object lookup(String name) {
        Method getter = members.property(name);
        if (getter != null) {
            return guard.wrap(HostMembers.invoke(getter, target(), new Object[0]));
        }
        List<Method> overloads = members.methods(name);
        if (overloads.isEmpty()) {
            return NOT_FOUND;
        }
        return methodViews.computeIfAbsent(name, n -> new GuardedMethod(guard, target(), n, overloads));
    }

    @Override
    protected Object[] ids() {
        return members.propertyNames().toArray();
    }

    @Override
    public String getClassName() {
        return "Object";
    }
}
