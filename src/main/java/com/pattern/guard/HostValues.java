package com.pattern.guard;

import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.Undefined;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Member;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import java.util.List;
import java.util.UUID;

/**
 * Conversions between host values and script values, and the rules for which
 * host types may be exposed to scripts at all.
 */
final class HostValues {

    /**
     * Marker for a value that has no primitive script form or no host conversion.
     */
    static final Object NO_CONVERSION = new Object();

    private static final List<Class<?>> DENIED_TYPES = List.of(
            Class.class,
            ClassLoader.class,
            Module.class,
            Thread.class,
            ThreadGroup.class,
            Runtime.class,
            Process.class,
            ProcessBuilder.class,
            AccessibleObject.class,
            Member.class,
            MethodHandle.class,
            MethodHandles.Lookup.class,
            Scriptable.class
    );

    private static final List<String> DENIED_PACKAGES = List.of(
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.sun.",
            "org.mozilla.javascript.",
            "org.springframework.",
            "com.pattern.guard.",
            "com.pattern.sandbox.",
            "com.pattern.store.",
            "com.pattern.engine.",
            "com.pattern.adapter."
    );

    private HostValues() {
    }

    /**
     * Primitive script form of a host value, or {@link #NO_CONVERSION} for objects.
     */
    static Object toScriptPrimitive(Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof TemporalAccessor || value instanceof TemporalAmount || value instanceof UUID) {
            return value.toString();
        }
        return NO_CONVERSION;
    }

    /**
     * Whether objects of this type may be wrapped as a {@link GuardedObject}.
     * Reflection, class-loading and process types are never exposable, nor is
     * anything else from the JDK or the engine's own internals.
     */
    static boolean isExposable(Class<?> type) {
        for (Class<?> denied : DENIED_TYPES) {
            if (denied.isAssignableFrom(type)) {
                return false;
            }
        }
        String name = type.getName();
        for (String prefix : DENIED_PACKAGES) {
            if (name.startsWith(prefix)) {
                return false;
            }
        }
        Module module = type.getModule();
        if (module.isNamed()) {
            String moduleName = module.getName();
            return !moduleName.startsWith("java.") && !moduleName.startsWith("jdk.");
        }
        return true;
    }

    /**
     * Convert script arguments for a host method, or return null when any
     * argument cannot be converted to its parameter type.
     */
    static Object[] toJavaArguments(Object[] args, Class<?>[] parameterTypes) {
        if (args.length != parameterTypes.length) {
            return null;
        }
        Object[] converted = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            Object value = toJava(args[i], parameterTypes[i]);
            if (value == NO_CONVERSION) {
                return null;
            }
            converted[i] = value;
        }
        return converted;
    }

    /**
     * Convert one script value to a host parameter type.
     * Guarded views hand over their real referent. Objects created by the
     * script itself are never passed to host code.
     */
    static Object toJava(Object arg, Class<?> type) {
        if (arg instanceof GuardedView view) {
            Object target = view.target();
            return type.isInstance(target) ? target : NO_CONVERSION;
        }
        if (arg == null || arg == Undefined.instance) {
            return type.isPrimitive() ? NO_CONVERSION : null;
        }
        if (arg instanceof Scriptable) {
            return NO_CONVERSION;
        }
        if (arg instanceof CharSequence cs) {
            return stringToJava(cs.toString(), type);
        }
        if (arg instanceof Number n) {
            return numberToJava(n, type);
        }
        if (arg instanceof Boolean b) {
            return (type == boolean.class || type == Boolean.class || type == Object.class) ? b : NO_CONVERSION;
        }
        return NO_CONVERSION;
    }

    private static Object stringToJava(String s, Class<?> type) {
        if (type == String.class || type == Object.class || type == CharSequence.class) {
            return s;
        }
        if ((type == char.class || type == Character.class) && s.length() == 1) {
            return s.charAt(0);
        }
        if (type.isEnum()) {
            for (Object constant : type.getEnumConstants()) {
                if (((Enum<?>) constant).name().equals(s)) {
                    return constant;
                }
            }
        }
        return NO_CONVERSION;
    }

    private static Object numberToJava(Number n, Class<?> type) {
        double d = n.doubleValue();
        if (type == double.class || type == Double.class || type == Number.class || type == Object.class) {
            return d;
        }
        if (type == float.class || type == Float.class) {
            return (float) d;
        }
        if (d != Math.rint(d) || Double.isInfinite(d)) {
            return NO_CONVERSION;
        }
        if ((type == int.class || type == Integer.class) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
            return (int) d;
        }
        if ((type == long.class || type == Long.class) && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
            return (long) d;
        }
        if ((type == short.class || type == Short.class) && d >= Short.MIN_VALUE && d <= Short.MAX_VALUE) {
            return (short) d;
        }
        if ((type == byte.class || type == Byte.class) && d >= Byte.MIN_VALUE && d <= Byte.MAX_VALUE) {
            return (byte) d;
        }
        return NO_CONVERSION;
    }
}
