package com.pattern.sandbox;

import com.pattern.guard.GuardedFunction;
import com.pattern.guard.ReadOnlyScriptable;
import org.mozilla.javascript.ScriptRuntime;
import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Neutered {@code console} for scripts. Output goes to the engine log at DEBUG,
 * capped per evaluation, and has no other effect.
 */
final class ScriptConsole extends ReadOnlyScriptable {

    private static final Logger log = LoggerFactory.getLogger(ScriptConsole.class);

    private static final List<String> LEVELS = List.of("log", "info", "warn", "error", "debug");
    private static final int MAX_MESSAGE_LENGTH = 500;

    private final String label;
    private final int maxLines;
    private final Map<String, GuardedFunction> functions = new LinkedHashMap<>();
    private int lines;

    ScriptConsole(String label, int maxLines) {
        this.label = label;
        this.maxLines = maxLines;
        for (String level : LEVELS) {
            functions.put(level, GuardedFunction.of(level, (cx, scope, args) -> {
                print(level, args);
                return Undefined.instance;
            }));
        }
    }

    private void print(String level, Object[] args) {
        lines++;
        if (lines > maxLines) {
            if (lines == maxLines + 1) {
                log.debug("[{}] console output truncated after {} lines", label, maxLines);
            }
            return;
        }
        StringJoiner message = new StringJoiner(" ");
        for (Object arg : args) {
            message.add(ScriptRuntime.toString(arg));
        }
        String text = message.toString();
        if (text.length() > MAX_MESSAGE_LENGTH) {
            text = text.substring(0, MAX_MESSAGE_LENGTH) + "...";
        }
        log.debug("[{}] console.{}: {}", label, level, text);
    }

    @Override
    protected Object lookup(String name) {
        GuardedFunction function = functions.get(name);
        return function != null ? function : NOT_FOUND;
    }

    @Override
    protected Object[] ids() {
        return functions.keySet().toArray();
    }

    @Override
    public String getClassName() {
        return "Console";
    }
}
