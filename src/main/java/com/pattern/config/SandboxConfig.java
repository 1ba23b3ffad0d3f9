package com.pattern.config;

import java.util.List;

/**
 * Limits applied to every sandboxed script evaluation.
 *
 * @param timeoutMs                    Wall-clock budget for running one script
 * @param compileGraceMs               Extra time the caller waits for compilation and thread hand-off
 * @param instructionObserverThreshold Interpreter instructions between deadline checks
 * @param maxStackDepth                Maximum interpreter call depth
 * @param maxScriptLength              Maximum script length in characters
 * @param maxConsoleLines              Console shim lines logged per evaluation
 * @param denyList                     Identifiers a script may not contain
 */
public record SandboxConfig(
        long timeoutMs,
        long compileGraceMs,
        int instructionObserverThreshold,
        int maxStackDepth,
        int maxScriptLength,
        int maxConsoleLines,
        List<String> denyList
) {
    public static final List<String> DEFAULT_DENY_LIST = List.of(
            "process",
            "require",
            "eval",
            "Function",
            "constructor",
            "__proto__",
            "prototype",
            "import",
            "global",
            "globalThis",
            "Packages",
            "java",
            "javax",
            "JavaImporter",
            "JavaAdapter",
            "importPackage",
            "importClass"
    );

    public SandboxConfig {
        denyList = denyList == null ? DEFAULT_DENY_LIST : List.copyOf(denyList);
    }

    public static SandboxConfig defaults() {
        return new SandboxConfig(100, 250, 10_000, 256, 1000, 20, DEFAULT_DENY_LIST);
    }

    /**
     * Copy of this configuration with a different timeout.
     */
    public SandboxConfig withTimeoutMs(long timeoutMs) {
        return new SandboxConfig(timeoutMs, compileGraceMs, instructionObserverThreshold,
                maxStackDepth, maxScriptLength, maxConsoleLines, denyList);
    }

    /**
     * Caller-side wait bound: script budget plus compile grace.
     */
    public long callerWaitMs() {
        return timeoutMs + compileGraceMs;
    }
}
