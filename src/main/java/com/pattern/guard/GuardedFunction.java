package com.pattern.guard;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.Scriptable;

/**
 * Read-only callable exposed to scripts. Cannot be used as a constructor and
 * ignores the script-supplied {@code this}.
 */
public abstract class GuardedFunction extends ReadOnlyScriptable implements Function {

    private final String name;

    protected GuardedFunction(String name) {
        this.name = name;
    }

    /**
     * Run the function body.
     *
     * @param cx    Current interpreter context
     * @param scope Caller scope
     * @param args  Script arguments
     * @return Script-visible result
     */
    protected abstract Object invoke(Context cx, Scriptable scope, Object[] args);

    public String name() {
        return name;
    }

    @Override
    public final Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
        return invoke(cx, scope, args);
    }

    @Override
    public final Scriptable construct(Context cx, Scriptable scope, Object[] args) {
        throw Context.reportRuntimeError(name + " is not a constructor");
    }

    @Override
    protected Object lookup(String property) {
        if ("name".equals(property)) {
            return name;
        }
        return NOT_FOUND;
    }

    @Override
    public String getClassName() {
        return "Function";
    }

    @Override
    public Object getDefaultValue(Class<?> hint) {
        if (hint == null || hint == String.class) {
            return "function " + name + "() { [native code] }";
        }
        return super.getDefaultValue(hint);
    }

    /**
     * Create a function from a lambda body.
     */
    public static GuardedFunction of(String name, Body body) {
        return new GuardedFunction(name) {
            @Override
            protected Object invoke(Context cx, Scriptable scope, Object[] args) {
                return body.apply(cx, scope, args);
            }
        };
    }

    /**
     * Body of a lambda-backed function.
     */
    @FunctionalInterface
    public interface Body {
        Object apply(Context cx, Scriptable scope, Object[] args);
    }
}
