package com.pattern.guard;

import org.mozilla.javascript.Callable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ScriptRuntime;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * View over a {@link List}, any other {@link Collection}, or a Java array.
 * <p>
 * Exposes integer indices, {@code length} and a fixed set of read-only helpers
 * shaped like their JavaScript array counterparts. Elements handed to callbacks
 * are wrapped. {@code filter} and {@code map} return new script-owned arrays.
 * Collections other than lists are snapshotted when the view is created.
 */
final class GuardedList extends GuardedView {

    static final Set<String> HELPERS = Set.of(
            "includes", "indexOf", "join", "some", "every", "find", "filter", "map", "forEach");

    private final Object elements;
    private final Map<String, GuardedFunction> helpers = new ConcurrentHashMap<>();

    GuardedList(GuardProxy guard, Object target) {
        super(guard, target);
        if (target instanceof List<?> || target.getClass().isArray()) {
            this.elements = target;
        } else {
            this.elements = ((Collection<?>) target).toArray();
        }
    }

    int size() {
        if (elements instanceof List<?> list) {
            return list.size();
        }
        return Array.getLength(elements);
    }

    private Object element(int index) {
        Object raw = elements instanceof List<?> list ? list.get(index) : Array.get(elements, index);
        return guard.wrap(raw);
    }

    @Override
    protected Object lookup(String name) {
        if ("length".equals(name)) {
            return (double) size();
        }
        if (!HELPERS.contains(name)) {
            return NOT_FOUND;
        }
        return helpers.computeIfAbsent(name, this::createHelper);
    }

    @Override
    protected Object lookup(int index) {
        if (index < 0 || index >= size()) {
            return NOT_FOUND;
        }
        return element(index);
    }

    @Override
    protected Object[] ids() {
        Object[] ids = new Object[size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = i;
        }
        return ids;
    }

    @Override
    public String getClassName() {
        return "Array";
    }

    private GuardedFunction createHelper(String name) {
        return switch (name) {
            case "includes" -> GuardedFunction.of(name, (cx, scope, args) -> indexOf(arg(args, 0)) >= 0);
            case "indexOf" -> GuardedFunction.of(name, (cx, scope, args) -> (double) indexOf(arg(args, 0)));
            case "join" -> GuardedFunction.of(name, (cx, scope, args) -> join(arg(args, 0)));
            case "some" -> GuardedFunction.of(name, (cx, scope, args) -> {
                Callable fn = callback(name, args);
                for (int i = 0; i < size(); i++) {
                    if (test(cx, scope, fn, i)) {
                        return true;
                    }
                }
                return false;
            });
            case "every" -> GuardedFunction.of(name, (cx, scope, args) -> {
                Callable fn = callback(name, args);
                for (int i = 0; i < size(); i++) {
                    if (!test(cx, scope, fn, i)) {
                        return false;
                    }
                }
                return true;
            });
            case "find" -> GuardedFunction.of(name, (cx, scope, args) -> {
                Callable fn = callback(name, args);
                for (int i = 0; i < size(); i++) {
                    if (test(cx, scope, fn, i)) {
                        return element(i);
                    }
                }
                return Undefined.instance;
            });
            case "filter" -> GuardedFunction.of(name, (cx, scope, args) -> {
                Callable fn = callback(name, args);
                List<Object> kept = new ArrayList<>();
                for (int i = 0; i < size(); i++) {
                    if (test(cx, scope, fn, i)) {
                        kept.add(element(i));
                    }
                }
                return cx.newArray(scope, kept.toArray());
            });
            case "map" -> GuardedFunction.of(name, (cx, scope, args) -> {
                Callable fn = callback(name, args);
                Object[] mapped = new Object[size()];
                for (int i = 0; i < mapped.length; i++) {
                    mapped[i] = apply(cx, scope, fn, i);
                }
                return cx.newArray(scope, mapped);
            });
            case "forEach" -> GuardedFunction.of(name, (cx, scope, args) -> {
                Callable fn = callback(name, args);
                for (int i = 0; i < size(); i++) {
                    apply(cx, scope, fn, i);
                }
                return Undefined.instance;
            });
            default -> throw new IllegalArgumentException("Unknown list helper: " + name);
        };
    }

    private int indexOf(Object needle) {
        for (int i = 0; i < size(); i++) {
            if (ScriptRuntime.shallowEq(element(i), needle)) {
                return i;
            }
        }
        return -1;
    }

    private String join(Object separator) {
        String sep = separator == Undefined.instance ? "," : ScriptRuntime.toString(separator);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < size(); i++) {
            if (i > 0) {
                sb.append(sep);
            }
            Object value = element(i);
            if (value != null && value != Undefined.instance) {
                sb.append(ScriptRuntime.toString(value));
            }
        }
        return sb.toString();
    }

    private boolean test(Context cx, Scriptable scope, Callable fn, int index) {
        return ScriptRuntime.toBoolean(apply(cx, scope, fn, index));
    }

    private Object apply(Context cx, Scriptable scope, Callable fn, int index) {
        Scriptable thisObj = ScriptableObject.getTopLevelScope(scope);
        return fn.call(cx, scope, thisObj, new Object[]{element(index), (double) index, this});
    }

    private static Callable callback(String helper, Object[] args) {
        Object fn = arg(args, 0);
        if (!(fn instanceof Callable callable)) {
            throw Context.reportRuntimeError(helper + " requires a function argument");
        }
        return callable;
    }

    private static Object arg(Object[] args, int index) {
        return index < args.length ? args[index] : Undefined.instance;
    }
}
