package com.pattern;

import com.pattern.config.ConfigLoader;
import com.pattern.config.EngineConfig;
import com.pattern.config.StoreConfig;
import com.pattern.core.ChartContextFactory;
import com.pattern.core.Pattern;
import com.pattern.core.PatternMatch;
import com.pattern.engine.DefaultPatternEvaluationCoordinator;
import com.pattern.engine.PatternEvaluationCoordinator;
import com.pattern.exception.ValidationException;
import com.pattern.sandbox.RhinoSandboxExecutor;
import com.pattern.sandbox.ScriptValidator;
import com.pattern.store.JdbcPatternStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the pattern engine: YAML config, SQLite store, Rhino
 * sandbox and coordinator wired the way the auto-configuration wires them.
 * Tests cover:
 * - Constant and context-dependent patterns
 * - Deny-listed scripts at create time and in legacy data
 * - Concurrent creates
 * - The bundled sample chart
 */
class PatternEngineTest {

    @TempDir
    Path tempDir;

    private StoreConfig storeConfig;
    private JdbcPatternStore store;
    private RhinoSandboxExecutor executor;
    private PatternEvaluationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        EngineConfig config = ConfigLoader.load("classpath:pattern-engine-test.yaml");
        ScriptValidator validator = new ScriptValidator(config.sandbox());
        storeConfig = StoreConfig.at(tempDir.resolve("engine.db").toString());
        store = JdbcPatternStore.open(storeConfig, validator);
        executor = new RhinoSandboxExecutor(config.sandbox(), validator);
        coordinator = new DefaultPatternEvaluationCoordinator(store, executor);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private static Map<String, Object> gender(String gender) {
        return ChartContextFactory.fromJson("{\"gender\": \"" + gender + "\"}");
    }

    // =====================================================================
    // Constant patterns
    // =====================================================================

    @Test
    @DisplayName("return true matches every chart")
    void alwaysTrue() {
        String id = store.create("Always", "return true;", null, null);

        assertEquals(List.of(new PatternMatch("Always", null, id)), coordinator.evaluateAll(gender("male")));
        assertEquals(1, coordinator.evaluateAll(gender("female")).size());
        assertEquals(1, coordinator.evaluateAll(Map.of()).size());
    }

    @Test
    @DisplayName("return false matches no chart")
    void alwaysFalse() {
        store.create("Never", "return false;", null, null);

        assertTrue(coordinator.evaluateAll(gender("male")).isEmpty());
        assertTrue(coordinator.evaluateAll(gender("female")).isEmpty());
    }

    // =====================================================================
    // Context-dependent patterns
    // =====================================================================

    @Test
    @DisplayName("Gender pattern follows the chart")
    void genderPattern() {
        store.create("Male", "return context.gender === 'male';", null, null);

        assertEquals(1, coordinator.evaluateAll(gender("male")).size());
        assertTrue(coordinator.evaluateAll(gender("female")).isEmpty());
    }

    @Test
    @DisplayName("Patterns over the bundled sample chart")
    void sampleChart() throws Exception {
        store.create("Ziwei in life", """
                var life = context.palaces.find(function (p) { return p.name === '命宫'; });
                return life !== undefined && life.stars.includes('紫微');""", null, null);
        store.create("Crowded palace",
                "return context.palaces.some(function (p) { return p.stars.length >= 3; });", null, null);
        store.create("Water bureau", "return context.fiveElements === '水二局';", null, null);
        store.create("Born before 1980", "return context.birth.year < 1980;", null, null);
        store.create("Empty palaces", """
                return context.palaces.filter(function (p) { return p.stars.length === 0; }).length === 2;""",
                null, null);

        Map<String, Object> chart;
        try (InputStream in = getClass().getResourceAsStream("/sample-chart.json")) {
            chart = ChartContextFactory.fromJson(in);
        }

        List<String> names = coordinator.evaluateAll(chart).stream().map(PatternMatch::name).toList();
        assertEquals(List.of("Ziwei in life", "Crowded palace", "Water bureau", "Empty palaces"), names);
    }

    // =====================================================================
    // Deny-listed scripts
    // =====================================================================

    @Test
    @DisplayName("process.exit is refused at create time")
    void processExitRefused() {
        assertThrows(ValidationException.class, () -> store.create("Exit", "process.exit(1);", null, null));
        assertTrue(store.list().isEmpty());
    }

    @Test
    @DisplayName("process.exit in legacy data never matches and never runs")
    void processExitLegacy() {
        new JdbcTemplate(JdbcPatternStore.dataSource(storeConfig))
                .update("INSERT INTO patterns (name, script) VALUES (?, ?)", "Exit", "process.exit(1);");

        assertTrue(coordinator.evaluateAll(gender("male")).isEmpty());
        // Still here: the JVM was not asked to exit
        assertEquals(1, store.list().size());
    }

    // =====================================================================
    // Concurrent creates
    // =====================================================================

    @Test
    @DisplayName("Two concurrent creates get distinct ids and are both listed")
    void concurrentCreates() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<String> first = pool.submit(() -> {
                start.await();
                return store.create("First", "return true;", null, null);
            });
            Future<String> second = pool.submit(() -> {
                start.await();
                return store.create("Second", "return false;", null, null);
            });
            start.countDown();

            String firstId = first.get(10, TimeUnit.SECONDS);
            String secondId = second.get(10, TimeUnit.SECONDS);
            assertNotEquals(firstId, secondId);

            List<String> listed = store.list().stream().map(Pattern::id).toList();
            assertEquals(2, listed.size());
            assertTrue(listed.containsAll(List.of(firstId, secondId)));
        } finally {
            pool.shutdownNow();
        }
    }
}
