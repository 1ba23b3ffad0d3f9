package com.pattern.config;

import com.pattern.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads pattern engine configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static EngineConfig load(String path) {
        log.info("Loading pattern engine configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static EngineConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The engine section may sit at the root or under 'pattern-engine'
        Map<String, Object> engineConfig = root.containsKey("pattern-engine")
                ? (Map<String, Object>) root.get("pattern-engine")
                : root;

        String name = getString(engineConfig, "name", "pattern-engine");
        SandboxConfig sandbox = parseSandboxConfig((Map<String, Object>) engineConfig.get("sandbox"));
        StoreConfig store = parseStoreConfig((Map<String, Object>) engineConfig.get("store"));

        EngineConfig config = new EngineConfig(name, sandbox, store);

        log.info("Loaded pattern engine configuration: {} (timeout {}ms, {} denied identifiers, database {})",
                name, sandbox.timeoutMs(), sandbox.denyList().size(), store.databasePath());

        return config;
    }

    @SuppressWarnings("unchecked")
    private static SandboxConfig parseSandboxConfig(Map<String, Object> map) {
        SandboxConfig defaults = SandboxConfig.defaults();
        if (map == null) {
            return defaults;
        }

        long timeoutMs = getLong(map, "timeout-ms", defaults.timeoutMs());
        long compileGraceMs = getLong(map, "compile-grace-ms", defaults.compileGraceMs());
        int observerThreshold = getInt(map, "instruction-observer-threshold",
                defaults.instructionObserverThreshold());
        int maxStackDepth = getInt(map, "max-stack-depth", defaults.maxStackDepth());
        int maxScriptLength = getInt(map, "max-script-length", defaults.maxScriptLength());
        int maxConsoleLines = getInt(map, "max-console-lines", defaults.maxConsoleLines());

        requirePositive("sandbox.timeout-ms", timeoutMs);
        requirePositive("sandbox.instruction-observer-threshold", observerThreshold);
        requirePositive("sandbox.max-stack-depth", maxStackDepth);
        requirePositive("sandbox.max-script-length", maxScriptLength);
        requireNonNegative("sandbox.compile-grace-ms", compileGraceMs);
        requireNonNegative("sandbox.max-console-lines", maxConsoleLines);

        List<String> denyList = defaults.denyList();
        Object denyObj = map.get("deny-list");
        if (denyObj != null) {
            if (!(denyObj instanceof List<?> rawList)) {
                throw new ConfigurationException("sandbox.deny-list must be a list of identifiers");
            }
            denyList = new ArrayList<>();
            for (Object entry : rawList) {
                if (entry == null || entry.toString().isBlank()) {
                    throw new ConfigurationException("sandbox.deny-list contains a blank entry");
                }
                denyList.add(entry.toString().trim());
            }
            if (denyList.isEmpty()) {
                throw new ConfigurationException("sandbox.deny-list must not be empty");
            }
        }

        log.debug("Parsed sandbox config: timeoutMs={}, maxScriptLength={}, denyList={}",
                timeoutMs, maxScriptLength, denyList);

        return new SandboxConfig(timeoutMs, compileGraceMs, observerThreshold, maxStackDepth,
                maxScriptLength, maxConsoleLines, denyList);
    }

    private static StoreConfig parseStoreConfig(Map<String, Object> map) {
        StoreConfig defaults = StoreConfig.defaults();
        if (map == null) {
            return defaults;
        }
        String databasePath = getString(map, "database-path", defaults.databasePath());
        int busyTimeoutMs = getInt(map, "busy-timeout-ms", defaults.busyTimeoutMs());
        if (databasePath.isBlank()) {
            throw new ConfigurationException("store.database-path must not be blank");
        }
        requirePositive("store.busy-timeout-ms", busyTimeoutMs);
        return new StoreConfig(databasePath, busyTimeoutMs);
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, was " + value);
        }
    }

    private static void requireNonNegative(String key, long value) {
        if (value < 0) {
            throw new ConfigurationException(key + " must not be negative, was " + value);
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for '" + key + "': " + value, e);
        }
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for '" + key + "': " + value, e);
        }
    }
}
