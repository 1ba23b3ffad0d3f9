package com.pattern.adapter.spring;

import com.pattern.config.ConfigLoader;
import com.pattern.config.EngineConfig;
import com.pattern.engine.DefaultPatternEvaluationCoordinator;
import com.pattern.engine.PatternEvaluationCoordinator;
import com.pattern.sandbox.RhinoSandboxExecutor;
import com.pattern.sandbox.SandboxExecutor;
import com.pattern.sandbox.ScriptValidator;
import com.pattern.store.JdbcPatternStore;
import com.pattern.store.PatternStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the pattern engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "pattern-engine", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PatternEngineProperties.class)
public class PatternEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PatternEngineAutoConfiguration.class);

    private RhinoSandboxExecutor sandboxExecutor;

    @Bean
    @ConditionalOnMissingBean
    public EngineConfig engineConfig(PatternEngineProperties properties) {
        log.info("Loading pattern engine configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScriptValidator scriptValidator(EngineConfig config) {
        return new ScriptValidator(config.sandbox());
    }

    @Bean
    @ConditionalOnMissingBean
    public PatternStore patternStore(EngineConfig config, ScriptValidator validator) {
        log.info("Opening pattern store at: {}", config.store().databasePath());
        return JdbcPatternStore.open(config.store(), validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public SandboxExecutor sandboxExecutor(EngineConfig config, ScriptValidator validator) {
        log.info("Creating sandbox executor for: {}", config.name());
        this.sandboxExecutor = new RhinoSandboxExecutor(config.sandbox(), validator);
        return this.sandboxExecutor;
    }

    @Bean
    @ConditionalOnMissingBean
    public PatternEvaluationCoordinator patternEvaluationCoordinator(PatternStore store, SandboxExecutor executor) {
        return new DefaultPatternEvaluationCoordinator(store, executor);
    }

    @PreDestroy
    public void shutdown() {
        if (sandboxExecutor != null) {
            sandboxExecutor.close();
        }
    }
}
