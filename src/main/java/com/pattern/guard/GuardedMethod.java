package com.pattern.guard;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;

import java.lang.reflect.Method;
import java.util.List;

/**
 * A host method group bound to its real receiver.
 * The first overload whose parameters accept the converted arguments is called,
 * and its return value is wrapped before the script sees it.
 */
final class GuardedMethod extends GuardedFunction {

    private final GuardProxy guard;
    private final Object receiver;
    private final List<Method> overloads;

    GuardedMethod(GuardProxy guard, Object receiver, String name, List<Method> overloads) {
        super(name);
        this.guard = guard;
        this.receiver = receiver;
        this.overloads = List.copyOf(overloads);
    }

    @Override
    protected Object invoke(Context cx, Scriptable scope, Object[] args) {
        for (Method method : overloads) {
            Object[] converted = HostValues.toJavaArguments(args, method.getParameterTypes());
            if (converted != null) {
                return guard.wrap(HostMembers.invoke(method, receiver, converted));
            }
        }
        throw Context.reportRuntimeError(
                "No overload of '" + name() + "' accepts " + args.length + " argument(s)");
    }
}
