package com.pattern.config;

import com.pattern.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    // =====================================================================
    // Loading
    // =====================================================================

    @Test
    @DisplayName("Classpath config is loaded with its overrides")
    void loadsClasspathConfig() {
        EngineConfig config = ConfigLoader.load("classpath:pattern-engine-test.yaml");

        assertEquals("test-engine", config.name());
        assertEquals(1000, config.sandbox().timeoutMs());
        assertEquals(500, config.sandbox().compileGraceMs());
        assertEquals(2000, config.sandbox().maxScriptLength());
        assertEquals(5, config.sandbox().maxConsoleLines());
        assertEquals(SandboxConfig.DEFAULT_DENY_LIST, config.sandbox().denyList());
        assertEquals("target/test-data/patterns.db", config.store().databasePath());
        assertEquals(2000, config.store().busyTimeoutMs());
    }

    @Test
    @DisplayName("Bundled default config matches the built-in defaults")
    void bundledConfigMatchesDefaults() {
        EngineConfig config = ConfigLoader.load("classpath:pattern-engine.yaml");
        SandboxConfig defaults = SandboxConfig.defaults();

        assertEquals(defaults.timeoutMs(), config.sandbox().timeoutMs());
        assertEquals(defaults.maxScriptLength(), config.sandbox().maxScriptLength());
        assertEquals(defaults.denyList(), config.sandbox().denyList());
    }

    @Test
    @DisplayName("Missing file is a configuration error")
    void missingFileFails() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/no/such/dir/engine.yaml"));
    }

    // =====================================================================
    // Parsing
    // =====================================================================

    @Test
    @DisplayName("Missing sections fall back to defaults")
    void missingSectionsUseDefaults() {
        EngineConfig config = ConfigLoader.parseYaml(yaml("name: bare\n"));

        assertEquals("bare", config.name());
        assertEquals(SandboxConfig.defaults(), config.sandbox());
        assertEquals(StoreConfig.defaults(), config.store());
    }

    @Test
    @DisplayName("Document without limits equals the built-in engine defaults")
    void emptySectionsEqualEngineDefaults() {
        EngineConfig config = ConfigLoader.parseYaml(yaml("""
                pattern-engine:
                  name: pattern-engine
                  sandbox: {}
                  store: {}
                """));

        assertEquals(EngineConfig.defaults(), config);
    }

    @Test
    @DisplayName("Custom deny-list replaces the default one")
    void customDenyList() {
        EngineConfig config = ConfigLoader.parseYaml(yaml("""
                pattern-engine:
                  sandbox:
                    deny-list: [process, fetch]
                """));

        assertEquals(List.of("process", "fetch"), config.sandbox().denyList());
    }

    @Test
    @DisplayName("Empty document is rejected")
    void emptyDocumentRejected() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("")));
    }

    @Test
    @DisplayName("Non-positive timeout is rejected")
    void nonPositiveTimeoutRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("""
                sandbox:
                  timeout-ms: 0
                """)));
        assertTrue(e.getMessage().contains("timeout-ms"));
    }

    @Test
    @DisplayName("Negative compile grace is rejected")
    void negativeGraceRejected() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("""
                sandbox:
                  compile-grace-ms: -1
                """)));
    }

    @Test
    @DisplayName("Empty or blank deny-list entries are rejected")
    void badDenyListRejected() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("""
                sandbox:
                  deny-list: []
                """)));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("""
                sandbox:
                  deny-list: [process, " "]
                """)));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("""
                sandbox:
                  deny-list: process
                """)));
    }

    @Test
    @DisplayName("Negative console line cap is rejected, zero disables console output")
    void consoleLinesValidated() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("""
                sandbox:
                  max-console-lines: -1
                """)));
        assertTrue(e.getMessage().contains("max-console-lines"));

        EngineConfig silent = ConfigLoader.parseYaml(yaml("""
                sandbox:
                  max-console-lines: 0
                """));
        assertEquals(0, silent.sandbox().maxConsoleLines());
    }

    @Test
    @DisplayName("Non-numeric limits are rejected")
    void nonNumericRejected() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("""
                store:
                  busy-timeout-ms: soon
                """)));
    }

    @Test
    @DisplayName("Caller wait covers the budget plus the compile grace")
    void callerWait() {
        SandboxConfig config = SandboxConfig.defaults().withTimeoutMs(400);
        assertEquals(400 + config.compileGraceMs(), config.callerWaitMs());
    }
}
