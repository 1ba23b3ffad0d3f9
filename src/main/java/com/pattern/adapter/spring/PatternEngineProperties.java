package com.pattern.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the pattern engine.
 */
@ConfigurationProperties(prefix = "pattern-engine")
public class PatternEngineProperties {

    /**
     * Whether the pattern engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the engine YAML configuration.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:pattern-engine.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
