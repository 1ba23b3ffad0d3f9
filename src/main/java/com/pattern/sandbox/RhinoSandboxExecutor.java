package com.pattern.sandbox;

import com.pattern.config.SandboxConfig;
import com.pattern.guard.GuardProxy;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SandboxExecutor} backed by the Rhino JavaScript interpreter.
 * <p>
 * Each script is compiled as the body of {@code function pattern(context, chart, console)}
 * in a fresh scope layered over a sealed, LiveConnect-free global object, so
 * globals a script defines never leak into the next one. {@code eval} and
 * {@code Function} are removed from the global object before it is sealed.
 * <p>
 * Runs happen on daemon worker threads. The interpreter aborts a script once its
 * budget is spent, and the caller stops waiting after the budget plus the
 * compile grace even if the worker is stuck outside interpreted code.
 */
public class RhinoSandboxExecutor implements SandboxExecutor {

    private static final Logger log = LoggerFactory.getLogger(RhinoSandboxExecutor.class);

    private static final String FUNCTION_HEADER = "function pattern(context, chart, console) {\n";
    private static final String FUNCTION_FOOTER = "\n}";
    private static final List<String> REMOVED_GLOBALS = List.of("eval", "Function");

    private final SandboxConfig config;
    private final ScriptValidator validator;
    private final SandboxContextFactory contextFactory;
    private final ScriptableObject sharedScope;
    private final ExecutorService workers;
    private final AtomicInteger workerIds = new AtomicInteger(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RhinoSandboxExecutor(SandboxConfig config) {
        this(config, new ScriptValidator(config));
    }

    public RhinoSandboxExecutor(SandboxConfig config, ScriptValidator validator) {
        this.config = config;
        this.validator = validator;
        this.contextFactory = new SandboxContextFactory(config);
        this.sharedScope = initSharedScope();

        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("pattern-sandbox-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        // First compilation loads most of the interpreter; keep that out of real budgets
        ScriptResult warmUp = run("warm-up", "return [1].length === 1;", null);
        log.debug("Sandbox warm-up finished: {}", warmUp);

        log.info("RhinoSandboxExecutor initialized: timeout {}ms, max script length {}, {} denied identifiers",
                config.timeoutMs(), config.maxScriptLength(), config.denyList().size());
    }

    private ScriptableObject initSharedScope() {
        Context cx = contextFactory.enterContext();
        try {
            ScriptableObject scope = cx.initSafeStandardObjects(null, true);
            for (String name : REMOVED_GLOBALS) {
                scope.delete(name);
                if (scope.has(name, scope)) {
                    scope.put(name, scope, Undefined.instance);
                }
            }
            // initSafeStandardObjects seals each built-in but not the global object holding them
            scope.sealObject();
            return scope;
        } finally {
            Context.exit();
        }
    }

    @Override
    public ScriptResult run(String label, String scriptSource, Object guardedContext) {
        long start = System.nanoTime();

        Optional<String> violation = validator.findViolation(scriptSource);
        if (violation.isPresent()) {
            log.debug("[{}] script rejected: {}", label, violation.get());
            return ScriptResult.notMatched(Termination.REJECTED, elapsedMillis(start));
        }
        if (closed.get()) {
            log.warn("[{}] sandbox is closed, script not run", label);
            return ScriptResult.notMatched(Termination.FAILED, elapsedMillis(start));
        }

        Object bound = guard(guardedContext);
        Future<ScriptResult> future;
        try {
            future = workers.submit(() -> execute(label, scriptSource, bound, start));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] sandbox worker unavailable", label, e);
            return ScriptResult.notMatched(Termination.FAILED, elapsedMillis(start));
        }

        try {
            return future.get(config.callerWaitMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] script did not finish within {}ms and was abandoned", label, config.callerWaitMs());
            return ScriptResult.notMatched(Termination.TIMED_OUT, elapsedMillis(start));
        } catch (ExecutionException e) {
            log.warn("[{}] script run failed outside the interpreter", label, e.getCause());
            return ScriptResult.notMatched(Termination.FAILED, elapsedMillis(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.debug("[{}] interrupted while waiting for script", label);
            return ScriptResult.notMatched(Termination.FAILED, elapsedMillis(start));
        }
    }

    private ScriptResult execute(String label, String source, Object boundContext, long start) {
        SandboxContextFactory.SandboxContext cx =
                (SandboxContextFactory.SandboxContext) contextFactory.enterContext();
        try {
            Scriptable scope = cx.newObject(sharedScope);
            scope.setPrototype(sharedScope);
            scope.setParentScope(null);

            Function predicate = cx.compileFunction(scope, FUNCTION_HEADER + source + FUNCTION_FOOTER, label, 0, null);
            ScriptConsole console = new ScriptConsole(label, config.maxConsoleLines());

            cx.startBudget(config.timeoutMs());
            Object result = predicate.call(cx, scope, scope, new Object[]{boundContext, boundContext, console});

            // Strict policy: only a real boolean true matches
            boolean matched = result instanceof Boolean b && b;
            return ScriptResult.completed(matched, elapsedMillis(start));
        } catch (ScriptTimeoutError e) {
            log.warn("[{}] {}", label, e.getMessage());
            return ScriptResult.notMatched(Termination.TIMED_OUT, elapsedMillis(start));
        } catch (RhinoException e) {
            log.debug("[{}] script failed: {}", label, e.details());
            return ScriptResult.notMatched(Termination.FAILED, elapsedMillis(start));
        } catch (IllegalArgumentException e) {
            log.debug("[{}] script is not a single function body: {}", label, e.getMessage());
            return ScriptResult.notMatched(Termination.FAILED, elapsedMillis(start));
        } finally {
            cx.clearBudget();
            Context.exit();
        }
    }

    /**
     * Values already safe for scripts pass through; anything else gets a
     * throwaway proxy so raw host objects never reach the interpreter.
     */
    private static Object guard(Object context) {
        if (context == null || context instanceof Scriptable || context instanceof String
                || context instanceof Boolean || context instanceof Double) {
            return context;
        }
        return new GuardProxy().wrap(context);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Shutting down sandbox workers");
            workers.shutdownNow();
        }
    }
}
