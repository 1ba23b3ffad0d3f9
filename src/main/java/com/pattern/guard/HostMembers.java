package com.pattern.guard;

import org.mozilla.javascript.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The read-only member surface of a host class, as seen by scripts.
 * <p>
 * Record components and bean getters become properties. Other public,
 * non-static, value-returning methods become callables. Setters,
 * {@code void} methods and {@link Object}'s own methods are never exposed.
 * Tables are computed once per class.
 */
final class HostMembers {

    private static final Logger log = LoggerFactory.getLogger(HostMembers.class);

    private static final Set<String> EXCLUDED_METHODS = Set.of(
            "getClass", "hashCode", "equals", "toString", "clone", "finalize",
            "notify", "notifyAll", "wait"
    );

    private static final Comparator<Method> METHOD_ORDER = Comparator
            .comparing(Method::getName)
            .thenComparingInt(Method::getParameterCount)
            .thenComparing(m -> Arrays.toString(m.getParameterTypes()));

    private static final ClassValue<HostMembers> CACHE = new ClassValue<>() {
        @Override
        protected HostMembers computeValue(Class<?> type) {
            return new HostMembers(type);
        }
    };

    private final Map<String, Method> properties = new LinkedHashMap<>();
    private final Map<String, List<Method>> methods = new LinkedHashMap<>();

    private HostMembers(Class<?> type) {
        Set<String> components = recordComponents(type);
        Method[] candidates = type.getMethods();
        Arrays.sort(candidates, METHOD_ORDER);

        for (Method method : candidates) {
            if (!isExposed(method)) {
                continue;
            }
            Method accessible = accessible(type, method);
            if (accessible == null) {
                log.debug("Skipping inaccessible member {}.{}", type.getName(), method.getName());
                continue;
            }
            methods.computeIfAbsent(method.getName(), k -> new ArrayList<>()).add(accessible);
            if (method.getParameterCount() == 0) {
                String property = propertyName(method, components);
                if (property != null) {
                    properties.putIfAbsent(property, accessible);
                }
            }
        }
        log.debug("Host members for {}: properties={}, methods={}",
                type.getName(), properties.keySet(), methods.keySet());
    }

    static HostMembers of(Class<?> type) {
        return CACHE.get(type);
    }

    /**
     * Getter backing a property, or null.
     */
    Method property(String name) {
        return properties.get(name);
    }

    /**
     * Overloads exposed under a name, possibly empty.
     */
    List<Method> methods(String name) {
        return methods.getOrDefault(name, List.of());
    }

    Set<String> propertyNames() {
        return properties.keySet();
    }

    /**
     * Invoke a host method, translating host failures into script errors.
     * The host exception itself never reaches the script.
     */
    static Object invoke(Method method, Object receiver, Object[] args) {
        try {
            return method.invoke(receiver, args);
        } catch (InvocationTargetException e) {
            log.debug("Host call {} failed", method.getName(), e.getCause());
            throw Context.reportRuntimeError("Host call '" + method.getName() + "' failed");
        } catch (IllegalAccessException | IllegalArgumentException e) {
            log.debug("Host member {} is not invocable", method.getName(), e);
            throw Context.reportRuntimeError("Host member '" + method.getName() + "' is not accessible");
        }
    }

    private static boolean isExposed(Method method) {
        if (Modifier.isStatic(method.getModifiers())) {
            return false;
        }
        if (method.getDeclaringClass() == Object.class || method.isBridge() || method.isSynthetic()) {
            return false;
        }
        if (method.getReturnType() == void.class) {
            return false;
        }
        String name = method.getName();
        if (EXCLUDED_METHODS.contains(name) || ReadOnlyScriptable.DENIED_PROPERTIES.contains(name)) {
            return false;
        }
        return !isSetter(name);
    }

    private static boolean isSetter(String name) {
        return name.length() > 3 && name.startsWith("set") && Character.isUpperCase(name.charAt(3));
    }

    private static Set<String> recordComponents(Class<?> type) {
        if (!type.isRecord()) {
            return Set.of();
        }
        Set<String> names = new HashSet<>();
        for (RecordComponent component : type.getRecordComponents()) {
            names.add(component.getName());
        }
        return names;
    }

    private static String propertyName(Method method, Set<String> components) {
        String name = method.getName();
        if (components.contains(name)) {
            return name;
        }
        if (name.length() > 3 && name.startsWith("get") && Character.isUpperCase(name.charAt(3))) {
            return decapitalize(name.substring(3));
        }
        if (name.length() > 2 && name.startsWith("is") && Character.isUpperCase(name.charAt(2))
                && (method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class)) {
            return decapitalize(name.substring(2));
        }
        return null;
    }

    private static String decapitalize(String name) {
        if (name.length() > 1 && Character.isUpperCase(name.charAt(1))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * A variant of the method that reflection may invoke: the method itself when
     * its class is public, else the same signature on a public supertype, else the
     * method made accessible. Null when none works.
     */
    private static Method accessible(Class<?> type, Method method) {
        if (Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            return method;
        }
        Deque<Class<?>> pending = new ArrayDeque<>();
        pending.add(type);
        Set<Class<?>> seen = new HashSet<>();
        while (!pending.isEmpty()) {
            Class<?> current = pending.poll();
            if (!seen.add(current)) {
                continue;
            }
            if (Modifier.isPublic(current.getModifiers())) {
                try {
                    return current.getMethod(method.getName(), method.getParameterTypes());
                } catch (NoSuchMethodException e) {
                    log.trace("{} does not declare {}", current.getName(), method.getName());
                }
            }
            if (current.getSuperclass() != null) {
                pending.add(current.getSuperclass());
            }
            pending.addAll(Arrays.asList(current.getInterfaces()));
        }
        return method.trySetAccessible() ? method : null;
    }
}
