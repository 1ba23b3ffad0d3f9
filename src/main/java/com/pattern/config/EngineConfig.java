package com.pattern.config;

/**
 * Root configuration for the pattern engine.
 *
 * @param name    Engine name identifier (used in logs)
 * @param sandbox Script sandbox limits and deny-list
 * @param store   Pattern store settings
 */
public record EngineConfig(
        String name,
        SandboxConfig sandbox,
        StoreConfig store
) {
    /**
     * Configuration with every default applied.
     */
    public static EngineConfig defaults() {
        return new EngineConfig("pattern-engine", SandboxConfig.defaults(), StoreConfig.defaults());
    }
}
